package com.trendradar.config;

import com.trendradar.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeightConfigTest {

    private final WeightConfigValidator validator = new WeightConfigValidator();

    @Test
    void fromConfig_shouldReadTypedFields() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "platform.weights", "weibo:1.0,zhihu:0.5",
                "platform.priorities", "zhihu:2,weibo:1",
                "keywords", "AI:0.5",
                "window.days", "5",
                "rank.top_n", "10"
        ));

        WeightConfig weights = WeightConfig.fromConfig(config);

        assertEquals(0.6, weights.rankWeight, 1e-9);
        assertEquals(0.5, weights.platformWeight("zhihu"), 1e-9);
        assertEquals(1.0, weights.platformWeight("douyin"), 1e-9);
        assertEquals(2, weights.platformPriority("zhihu"));
        assertEquals(0, weights.platformPriority("douyin"));
        assertEquals(Map.of("AI", 0.5), weights.keywords);
        assertEquals(5, weights.windowDays);
        assertEquals(10, weights.topN);
        assertEquals(50, weights.maxRankConsidered);
        assertEquals(0.6, weights.similarityThreshold, 1e-9);
        assertDoesNotThrow(() -> validator.validate(weights));
    }

    @Test
    void maps_shouldBeImmutable() {
        WeightConfig weights = WeightConfig.builder().keywords(Map.of("AI", 0.5)).build();
        assertThrows(UnsupportedOperationException.class, () -> weights.keywords.put("x", 1.0));
        assertTrue(weights.platformWeights.isEmpty());
    }

    @Test
    void validate_shouldCollectAllProblems() {
        WeightConfig bad = WeightConfig.builder()
                .rankWeight(1.2)
                .frequencyWeight(0.3)
                .keywordWeight(-0.1)
                .keywords(Map.of(" ", 0.5))
                .platformWeights(Map.of("weibo", -1.0))
                .windowDays(0)
                .maxRankConsidered(0)
                .similarityThreshold(0.0)
                .build();

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(bad));
        assertEquals(8, e.problems().size());
    }

    @Test
    void validate_shouldRejectWeightsNotSummingToOne() {
        WeightConfig bad = valid().toBuilder().rankWeight(0.3).build();
        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(bad));
        assertEquals(1, e.problems().size());
        assertTrue(e.problems().get(0).contains("sum"));

        assertDoesNotThrow(() -> validator.validate(valid().toBuilder().rankWeight(0.605).build()));
    }

    @Test
    void validatePlatforms_shouldRejectEmptyBlankAndDuplicateIds() {
        assertThrows(ValidationException.class, () -> validator.validatePlatforms(List.of()));
        assertThrows(ValidationException.class, () -> validator.validatePlatforms(Arrays.asList("weibo", " ")));
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validatePlatforms(List.of("weibo", "zhihu", "weibo")));
        assertEquals(List.of("duplicate platform id: weibo"), e.problems());
        assertDoesNotThrow(() -> validator.validatePlatforms(List.of("weibo", "zhihu")));
    }

    private static WeightConfig valid() {
        return WeightConfig.builder()
                .rankWeight(0.6)
                .frequencyWeight(0.3)
                .keywordWeight(0.1)
                .windowDays(7)
                .topN(20)
                .maxRankConsidered(50)
                .similarityThreshold(0.6)
                .build();
    }
}
