package com.trendradar.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Final output row handed to report and notification collaborators.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class RankedItem {
    public final TopicCluster cluster;
    public final double rankScore;
    public final double frequencyScore;
    public final double keywordScore;
    public final double finalScore;
    public final int rankPosition;
}
