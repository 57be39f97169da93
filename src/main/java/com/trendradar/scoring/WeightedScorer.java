package com.trendradar.scoring;

import com.trendradar.config.WeightConfig;
import com.trendradar.model.NormalizedItem;
import com.trendradar.model.ScoreBreakdown;
import com.trendradar.model.TopicCluster;
import com.trendradar.model.WindowEntry;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Composite score of a cluster:
 * {@code rank_weight * rank + frequency_weight * frequency + keyword_weight * keyword}.
 * Deterministic; no clock access. Weights are used as given.
 */
public final class WeightedScorer {

    public ScoreBreakdown score(TopicCluster cluster, Optional<WindowEntry> windowEntry, WeightConfig config) {
        if (config.maxRankConsidered < 1) {
            throw new IllegalArgumentException("max rank considered must be >= 1, got " + config.maxRankConsidered);
        }
        if (config.windowDays < 1) {
            throw new IllegalArgumentException("window days must be >= 1, got " + config.windowDays);
        }
        double rank = rankScore(cluster, config);
        double frequency = frequencyScore(windowEntry, config.windowDays);
        double keyword = keywordScore(cluster.canonicalTitle, config.keywords);
        double finalScore = config.rankWeight * rank
                + config.frequencyWeight * frequency
                + config.keywordWeight * keyword;
        return new ScoreBreakdown(rank, frequency, keyword, finalScore);
    }

    /**
     * Mean over members of the platform-weighted position score; positions past the cutoff score 0.
     */
    double rankScore(TopicCluster cluster, WeightConfig config) {
        double sum = 0.0;
        int maxRank = config.maxRankConsidered;
        for (NormalizedItem member : cluster.members) {
            double position = Math.max(0, maxRank - member.rankPosition + 1) / (double) maxRank;
            sum += position * config.platformWeight(member.platformId);
        }
        return sum / cluster.members.size();
    }

    double frequencyScore(Optional<WindowEntry> windowEntry, int windowDays) {
        if (windowEntry.isEmpty()) {
            return 0.0;
        }
        return clamp(windowEntry.get().frequencyCount() / (double) windowDays, 0.0, 1.0);
    }

    /**
     * Each configured keyword contributes once when it occurs anywhere in the title, case-insensitively.
     */
    double keywordScore(String canonicalTitle, Map<String, Double> keywords) {
        if (canonicalTitle == null || canonicalTitle.isEmpty() || keywords.isEmpty()) {
            return 0.0;
        }
        String title = canonicalTitle.toLowerCase(Locale.ROOT);
        double score = 0.0;
        for (Map.Entry<String, Double> e : keywords.entrySet()) {
            String keyword = e.getKey() == null ? "" : e.getKey().toLowerCase(Locale.ROOT);
            if (!keyword.isEmpty() && title.contains(keyword)) {
                score += e.getValue();
            }
        }
        return score;
    }

    private double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
