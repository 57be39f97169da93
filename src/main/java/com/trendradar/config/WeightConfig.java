package com.trendradar.config;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable scoring and ranking parameters. Validated once by {@link WeightConfigValidator}
 * before the engine sees it; the engine does not re-check ranges.
 */
@Value
public class WeightConfig {
    public final double rankWeight;
    public final double frequencyWeight;
    public final double keywordWeight;
    public final Map<String, Double> platformWeights;
    public final Map<String, Integer> platformPriorities;
    public final Map<String, Double> keywords;
    public final int windowDays;
    public final int topN;
    public final int maxRankConsidered;
    public final double similarityThreshold;

    @Builder(toBuilder = true)
    public WeightConfig(
            double rankWeight,
            double frequencyWeight,
            double keywordWeight,
            Map<String, Double> platformWeights,
            Map<String, Integer> platformPriorities,
            Map<String, Double> keywords,
            int windowDays,
            int topN,
            int maxRankConsidered,
            double similarityThreshold
    ) {
        this.rankWeight = rankWeight;
        this.frequencyWeight = frequencyWeight;
        this.keywordWeight = keywordWeight;
        this.platformWeights = copy(platformWeights);
        this.platformPriorities = copy(platformPriorities);
        this.keywords = copy(keywords);
        this.windowDays = windowDays;
        this.topN = topN;
        this.maxRankConsidered = maxRankConsidered;
        this.similarityThreshold = similarityThreshold;
    }

    public static WeightConfig fromConfig(Config config) {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : config.getWeightMap("platform.priorities").entrySet()) {
            priorities.put(e.getKey(), (int) Math.round(e.getValue()));
        }
        return WeightConfig.builder()
                .rankWeight(config.getDouble("weight.rank"))
                .frequencyWeight(config.getDouble("weight.frequency"))
                .keywordWeight(config.getDouble("weight.keyword"))
                .platformWeights(config.getWeightMap("platform.weights"))
                .platformPriorities(priorities)
                .keywords(config.getWeightMap("keywords"))
                .windowDays(config.getInt("window.days"))
                .topN(config.getInt("rank.top_n"))
                .maxRankConsidered(config.getInt("rank.max_considered"))
                .similarityThreshold(config.getDouble("dedup.similarity_threshold"))
                .build();
    }

    /**
     * Unlisted platforms weigh 1.0.
     */
    public double platformWeight(String platformId) {
        Double weight = platformWeights.get(platformId);
        return weight == null ? 1.0 : weight;
    }

    /**
     * Unlisted platforms have priority 0.
     */
    public int platformPriority(String platformId) {
        Integer priority = platformPriorities.get(platformId);
        return priority == null ? 0 : priority;
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
