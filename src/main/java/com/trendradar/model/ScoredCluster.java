package com.trendradar.model;

import java.util.Objects;

/**
 * A cluster paired with its score, the input row of the ranker.
 */
public final class ScoredCluster {
    public final TopicCluster cluster;
    public final ScoreBreakdown score;

    public ScoredCluster(TopicCluster cluster, ScoreBreakdown score) {
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.score = Objects.requireNonNull(score, "score");
    }
}
