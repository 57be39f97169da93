package com.trendradar.runner;

import com.trendradar.core.RunTelemetry;
import com.trendradar.model.RankedItem;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one aggregation run. {@code rankedItems} is valid even when {@code persisted} is false.
 */
@Value
public class AggregationOutcome {
    public final List<RankedItem> rankedItems;
    public final int platforms;
    public final int itemsRaw;
    public final int itemsSkipped;
    public final int clusterCount;
    public final boolean historyAvailable;
    public final boolean persisted;
    public final String persistError;
    public final String telemetrySummary;
    public final List<RunTelemetry.StepRecord> steps;

    @Builder(toBuilder = true)
    public AggregationOutcome(
            List<RankedItem> rankedItems,
            int platforms,
            int itemsRaw,
            int itemsSkipped,
            int clusterCount,
            boolean historyAvailable,
            boolean persisted,
            String persistError,
            String telemetrySummary,
            List<RunTelemetry.StepRecord> steps
    ) {
        this.rankedItems = rankedItems == null ? List.of() : List.copyOf(rankedItems);
        this.platforms = Math.max(0, platforms);
        this.itemsRaw = Math.max(0, itemsRaw);
        this.itemsSkipped = Math.max(0, itemsSkipped);
        this.clusterCount = Math.max(0, clusterCount);
        this.historyAvailable = historyAvailable;
        this.persisted = persisted;
        this.persistError = persistError == null ? "" : persistError;
        this.telemetrySummary = telemetrySummary == null ? "" : telemetrySummary;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
