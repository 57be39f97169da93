package com.trendradar.io;

import com.trendradar.core.RunTelemetry;
import com.trendradar.model.NormalizedItem;
import com.trendradar.model.RankedItem;
import com.trendradar.model.TopicCluster;
import com.trendradar.runner.AggregationOutcome;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class RankedOutputWriterTest {

    private final RankedOutputWriter writer = new RankedOutputWriter();

    @Test
    void toJson_shouldRenderRowsWithRoundedScores() {
        AggregationOutcome outcome = outcome();

        JSONObject json = writer.toJson(outcome, LocalDate.of(2026, 10, 18));

        assertEquals("2026-10-18", json.getString("run_date"));
        assertEquals(2, json.getInt("items_raw"));
        assertFalse(json.getBoolean("persisted"));
        JSONArray items = json.getJSONArray("items");
        assertEquals(1, items.length());
        JSONObject row = items.getJSONObject(0);
        assertEquals(1, row.getInt("rank"));
        assertEquals("华为发布会", row.getString("title"));
        assertEquals(0.5297, row.getDouble("final_score"), 1e-9);
        assertEquals("weibo", row.getJSONArray("platforms").getString(0));
        assertEquals("2026-10-18T01:00:00Z", row.getString("first_seen_at"));
        assertEquals(2, row.getJSONArray("members").length());
        assertEquals(3, row.getJSONArray("members").getJSONObject(1).getInt("rank"));

        JSONArray steps = json.getJSONArray("steps");
        assertEquals(2, steps.length());
        assertEquals("DEDUP", steps.getJSONObject(0).getString("name"));
        assertEquals(2, steps.getJSONObject(0).getLong("in"));
        assertFalse(steps.getJSONObject(0).has("note"));
        assertEquals("persist failed", steps.getJSONObject(1).getString("note"));
    }

    @Test
    void write_shouldCreateParentDirectories(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("out").resolve("ranked.json");

        writer.write(outcome(), LocalDate.of(2026, 10, 18), file);

        JSONObject json = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
        assertEquals(1, json.getJSONArray("items").length());
    }

    private static AggregationOutcome outcome() {
        Instant at = Instant.parse("2026-10-18T01:00:00Z");
        TopicCluster cluster = new TopicCluster(1, "华为发布会", "华为发布会", List.of(
                new NormalizedItem("weibo", "华为发布会", "华为发布会", 1, "https://weibo.example/1", at),
                new NormalizedItem("zhihu", "华为发布会", "华为发布会", 3, "", at)
        ), at);
        RankedItem item = RankedItem.builder()
                .cluster(cluster)
                .rankScore(0.74)
                .frequencyScore(2.0 / 7.0)
                .keywordScore(0.0)
                .finalScore(0.6 * 0.74 + 0.3 * 2.0 / 7.0)
                .rankPosition(1)
                .build();
        return AggregationOutcome.builder()
                .rankedItems(List.of(item))
                .platforms(2)
                .itemsRaw(2)
                .clusterCount(1)
                .historyAvailable(true)
                .persisted(false)
                .persistError("disk full")
                .steps(List.of(
                        new RunTelemetry.StepRecord("DEDUP", 3, 2, 1, 0, ""),
                        new RunTelemetry.StepRecord("WINDOW_PERSIST", 1, 1, 0, 1, "persist failed")))
                .build();
    }
}
