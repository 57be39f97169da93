package com.trendradar.io;

import com.trendradar.model.PlatformBatch;
import com.trendradar.model.RawItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the fetch collaborator's per-platform lists:
 * <pre>
 * {"fetched_at":"2026-10-18T08:00:00Z",
 *  "platforms":[{"id":"weibo","items":[{"title":"...","url":"...","rank":1,"fetched_at":"..."}]}]}
 * </pre>
 * A platform whose {@code items} is not an array counts as failed and is left out.
 * Items without a title or with a rank below 1 are skipped.
 */
public final class FetchResultReader {
    private static final Logger LOG = LogManager.getLogger(FetchResultReader.class);

    private final Instant fallbackFetchedAt;

    public FetchResultReader(Instant fallbackFetchedAt) {
        this.fallbackFetchedAt = fallbackFetchedAt == null ? Instant.now() : fallbackFetchedAt;
    }

    public List<PlatformBatch> read(Path file) throws IOException {
        String txt = Files.readString(file, StandardCharsets.UTF_8);
        try {
            return parse(new JSONObject(txt));
        } catch (JSONException e) {
            throw new IOException("fetch result " + file + " is not valid JSON: " + e.getMessage(), e);
        }
    }

    public List<PlatformBatch> parse(JSONObject root) {
        Instant documentFetchedAt = parseInstant(root.optString("fetched_at", ""), fallbackFetchedAt);
        JSONArray platforms = root.optJSONArray("platforms");
        if (platforms == null) {
            LOG.warn("fetch result has no platforms array, treating as empty");
            return List.of();
        }

        List<PlatformBatch> out = new ArrayList<>();
        int skipped = 0;
        for (int p = 0; p < platforms.length(); p++) {
            JSONObject platform = platforms.optJSONObject(p);
            String platformId = platform == null ? "" : platform.optString("id", "").trim();
            JSONArray items = platform == null ? null : platform.optJSONArray("items");
            if (platformId.isEmpty() || items == null) {
                LOG.warn("platform entry #{} unusable (id='{}'), omitted from this run", p, platformId);
                continue;
            }
            Instant platformFetchedAt = parseInstant(platform.optString("fetched_at", ""), documentFetchedAt);

            List<RawItem> rawItems = new ArrayList<>(items.length());
            for (int i = 0; i < items.length(); i++) {
                JSONObject item = items.optJSONObject(i);
                if (item == null || !item.has("title") || item.isNull("title")) {
                    skipped++;
                    continue;
                }
                int rank = item.optInt("rank", i + 1);
                if (rank < 1) {
                    skipped++;
                    continue;
                }
                rawItems.add(new RawItem(
                        platformId,
                        item.optString("title", ""),
                        item.optString("url", ""),
                        rank,
                        parseInstant(item.optString("fetched_at", ""), platformFetchedAt)
                ));
            }
            out.add(new PlatformBatch(platformId, rawItems));
        }
        if (skipped > 0) {
            LOG.warn("skipped {} malformed fetch items", skipped);
        }
        LOG.info("fetch result platforms={}", out.size());
        return out;
    }

    private Instant parseInstant(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debug("unparseable fetched_at '{}', using fallback", raw);
            return fallback;
        }
    }
}
