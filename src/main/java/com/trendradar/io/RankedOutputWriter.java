package com.trendradar.io;

import com.trendradar.core.RunTelemetry;
import com.trendradar.model.NormalizedItem;
import com.trendradar.model.RankedItem;
import com.trendradar.runner.AggregationOutcome;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Ranked rows as JSON for the report and notification collaborators.
 */
public final class RankedOutputWriter {

    public JSONObject toJson(AggregationOutcome outcome, LocalDate runDate) {
        JSONArray rows = new JSONArray();
        for (RankedItem item : outcome.rankedItems) {
            rows.put(toJson(item));
        }
        JSONObject root = new JSONObject();
        root.put("run_date", runDate == null ? "" : runDate.toString());
        root.put("platforms", outcome.platforms);
        root.put("items_raw", outcome.itemsRaw);
        root.put("items_skipped", outcome.itemsSkipped);
        root.put("clusters", outcome.clusterCount);
        root.put("history_available", outcome.historyAvailable);
        root.put("persisted", outcome.persisted);
        root.put("items", rows);

        JSONArray steps = new JSONArray();
        for (RunTelemetry.StepRecord step : outcome.steps) {
            JSONObject s = new JSONObject();
            s.put("name", step.name());
            s.put("elapsed_ms", step.elapsedMs());
            s.put("in", step.itemsIn());
            s.put("out", step.itemsOut());
            s.put("errors", step.errorCount());
            if (!step.optionalNote().isEmpty()) {
                s.put("note", step.optionalNote());
            }
            steps.put(s);
        }
        root.put("steps", steps);
        return root;
    }

    public void write(AggregationOutcome outcome, LocalDate runDate, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(outcome, runDate).toString(2), StandardCharsets.UTF_8);
    }

    JSONObject toJson(RankedItem item) {
        JSONObject row = new JSONObject();
        row.put("rank", item.rankPosition);
        row.put("title", item.cluster.canonicalTitle);
        row.put("key", item.cluster.representativeKey);
        row.put("final_score", round4(item.finalScore));
        row.put("rank_score", round4(item.rankScore));
        row.put("frequency_score", round4(item.frequencyScore));
        row.put("keyword_score", round4(item.keywordScore));
        row.put("platforms", new JSONArray(item.cluster.platformsSeen));
        row.put("first_seen_at", item.cluster.firstSeenAt == null ? "" : item.cluster.firstSeenAt.toString());

        JSONArray members = new JSONArray();
        for (NormalizedItem member : item.cluster.members) {
            JSONObject m = new JSONObject();
            m.put("platform", member.platformId);
            m.put("title", member.canonicalTitle);
            m.put("rank", member.rankPosition);
            m.put("url", member.url);
            members.put(m);
        }
        row.put("members", members);
        return row;
    }

    private double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
