package com.trendradar.config;

import com.trendradar.exception.ValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 模块说明：WeightConfigValidator（class）。
 * 主要职责：在配置进入评分引擎之前一次性校验权重、窗口与平台声明，
 * 收集全部问题后统一抛出 ValidationException。
 */
public final class WeightConfigValidator {
    private static final double SUM_TOLERANCE = 0.01;

    public void validate(WeightConfig config) {
        List<String> problems = new ArrayList<>();
        checkUnitWeight(problems, "weight.rank", config.rankWeight);
        checkUnitWeight(problems, "weight.frequency", config.frequencyWeight);
        checkUnitWeight(problems, "weight.keyword", config.keywordWeight);

        double total = config.rankWeight + config.frequencyWeight + config.keywordWeight;
        if (Math.abs(total - 1.0) > SUM_TOLERANCE) {
            problems.add(String.format(Locale.US, "weights should sum to 1.0, got %.2f", total));
        }

        checkNonNegative(problems, "platform.weights", config.platformWeights);
        checkNonNegative(problems, "keywords", config.keywords);
        for (String keyword : config.keywords.keySet()) {
            if (keyword == null || keyword.isBlank()) {
                problems.add("keywords must not contain a blank keyword");
            }
        }

        if (config.windowDays < 1) {
            problems.add("window.days must be >= 1, got " + config.windowDays);
        }
        if (config.maxRankConsidered < 1) {
            problems.add("rank.max_considered must be >= 1, got " + config.maxRankConsidered);
        }
        if (!(config.similarityThreshold > 0.0 && config.similarityThreshold <= 1.0)) {
            problems.add("dedup.similarity_threshold must be in (0, 1], got " + config.similarityThreshold);
        }

        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
    }

    /**
     * Declared platform ids must be present, non-blank and unique.
     */
    public void validatePlatforms(List<String> platformIds) {
        List<String> problems = new ArrayList<>();
        if (platformIds == null || platformIds.isEmpty()) {
            problems.add("at least one platform must be configured");
        } else {
            Set<String> seen = new HashSet<>();
            for (String id : platformIds) {
                if (id == null || id.isBlank()) {
                    problems.add("platform id must not be blank");
                } else if (!seen.add(id.trim())) {
                    problems.add("duplicate platform id: " + id.trim());
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
    }

    private void checkUnitWeight(List<String> problems, String name, double weight) {
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            problems.add(name + " should be within [0, 1], got " + weight);
        }
    }

    private void checkNonNegative(List<String> problems, String name, Map<String, Double> weights) {
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            Double value = e.getValue();
            if (value == null || value.isNaN() || value < 0.0) {
                problems.add(name + "[" + e.getKey() + "] must be >= 0, got " + value);
            }
        }
    }
}
