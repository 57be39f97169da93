package com.trendradar.runner;

import com.trendradar.cluster.TopicDeduplicator;
import com.trendradar.config.WeightConfig;
import com.trendradar.core.RunTelemetry;
import com.trendradar.exception.WindowStoreException;
import com.trendradar.model.NormalizedItem;
import com.trendradar.model.PlatformBatch;
import com.trendradar.model.RankedItem;
import com.trendradar.model.RawItem;
import com.trendradar.model.ScoreBreakdown;
import com.trendradar.model.ScoredCluster;
import com.trendradar.model.TopicCluster;
import com.trendradar.model.WindowEntry;
import com.trendradar.normalize.TitleNormalizer;
import com.trendradar.rank.TrendRanker;
import com.trendradar.scoring.WeightedScorer;
import com.trendradar.window.WindowStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：TrendAggregator（class）。
 * 主要职责：单轮聚合的主流程，顺序执行
 * 标题归一化 → 跨平台去重 → 读取窗口 → 合并首次出现时间 → 记录今日 → 加权评分 → 排名 → 持久化窗口。
 * 使用建议：窗口存储由调用方显式传入并拥有；同一份存储同一时间只允许一个运行。
 */
public final class TrendAggregator {
    private static final Logger LOG = LogManager.getLogger(TrendAggregator.class);

    private final WeightConfig config;
    private final TitleNormalizer normalizer;
    private final TopicDeduplicator deduplicator;
    private final WeightedScorer scorer;
    private final TrendRanker ranker;
    private final ZoneId zone;

    public TrendAggregator(WeightConfig config, TitleNormalizer normalizer, ZoneId zone) {
        this(config, normalizer, new TopicDeduplicator(config), new WeightedScorer(), new TrendRanker(), zone);
    }

    TrendAggregator(
            WeightConfig config,
            TitleNormalizer normalizer,
            TopicDeduplicator deduplicator,
            WeightedScorer scorer,
            TrendRanker ranker,
            ZoneId zone
    ) {
        this.config = config;
        this.normalizer = normalizer;
        this.deduplicator = deduplicator;
        this.scorer = scorer;
        this.ranker = ranker;
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public AggregationOutcome aggregate(List<PlatformBatch> batches, LocalDate today, WindowStore store) {
        Instant startedAt = Instant.now();
        RunTelemetry telemetry = new RunTelemetry(today, startedAt);

        telemetry.startStep(RunTelemetry.STEP_NORMALIZE);
        int platforms = 0;
        int raw = 0;
        int skipped = 0;
        List<NormalizedItem> items = new ArrayList<>();
        for (PlatformBatch batch : batches == null ? List.<PlatformBatch>of() : batches) {
            if (batch == null) {
                continue;
            }
            platforms++;
            for (RawItem item : batch.items) {
                raw++;
                RawItem usable = usableItem(item, batch.platformId, startedAt);
                if (usable == null) {
                    skipped++;
                    LOG.debug("skipping malformed item platform={} item={}", batch.platformId, item);
                    continue;
                }
                items.add(normalizer.normalize(usable));
            }
        }
        telemetry.setInputStats(platforms, raw, skipped);
        telemetry.endStep(RunTelemetry.STEP_NORMALIZE, raw, items.size(), 0,
                skipped > 0 ? "skipped=" + skipped : "");
        if (skipped > 0) {
            LOG.warn("skipped {} malformed items of {}", skipped, raw);
        }

        telemetry.startStep(RunTelemetry.STEP_DEDUP);
        List<TopicCluster> clusters = deduplicator.group(items);
        telemetry.endStep(RunTelemetry.STEP_DEDUP, items.size(), clusters.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_WINDOW_LOAD);
        // scoring reads this snapshot, so today's record only affects later runs
        Map<String, WindowEntry> prior = store.load(today, config.windowDays);
        boolean history = store.historyAvailable();
        if (history) {
            clusters = applyRecordedFirstSeen(clusters, prior);
        }
        telemetry.endStep(RunTelemetry.STEP_WINDOW_LOAD, 0, 0, history ? 0 : 1,
                history ? "" : "history unavailable");

        telemetry.startStep(RunTelemetry.STEP_WINDOW_RECORD);
        store.record(clusters, today);
        telemetry.endStep(RunTelemetry.STEP_WINDOW_RECORD, clusters.size(), clusters.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_SCORE);
        List<ScoredCluster> scored = new ArrayList<>(clusters.size());
        for (TopicCluster cluster : clusters) {
            Optional<WindowEntry> entry = history ? clusterEntry(cluster, prior) : Optional.empty();
            ScoreBreakdown score = scorer.score(cluster, entry, config);
            scored.add(new ScoredCluster(cluster, score));
        }
        telemetry.endStep(RunTelemetry.STEP_SCORE, clusters.size(), scored.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_RANK);
        List<RankedItem> ranked = ranker.rank(scored, config.topN);
        telemetry.endStep(RunTelemetry.STEP_RANK, scored.size(), ranked.size(), 0);

        telemetry.startStep(RunTelemetry.STEP_WINDOW_PERSIST);
        boolean persisted = false;
        String persistError = "";
        try {
            store.persist();
            persisted = true;
            telemetry.endStep(RunTelemetry.STEP_WINDOW_PERSIST, 1, 1, 0);
        } catch (WindowStoreException e) {
            persistError = e.getMessage();
            LOG.warn("window state not saved, next run will miss today's observations: {}", e.getMessage());
            telemetry.endStep(RunTelemetry.STEP_WINDOW_PERSIST, 1, 0, 1, "persist failed");
        }

        telemetry.setOutputStats(clusters.size(), ranked.size());
        telemetry.finish();
        LOG.info("aggregation finished date={} items={} clusters={} ranked={} elapsed_ms={}",
                today, items.size(), clusters.size(), ranked.size(), telemetry.totalElapsedMs());
        LOG.debug("run summary\n{}", telemetry.getSummary());

        return AggregationOutcome.builder()
                .rankedItems(ranked)
                .platforms(platforms)
                .itemsRaw(raw)
                .itemsSkipped(skipped)
                .clusterCount(clusters.size())
                .historyAvailable(history)
                .persisted(persisted)
                .persistError(persistError)
                .telemetrySummary(telemetry.getSummary())
                .steps(telemetry.stepRecords())
                .build();
    }

    /**
     * Returns the item with its platform and timestamp filled in, or null when it cannot be used:
     * missing title, no platform id, or a rank below 1.
     */
    private RawItem usableItem(RawItem item, String batchPlatformId, Instant runInstant) {
        if (item == null || item.title == null || item.rankPosition < 1) {
            return null;
        }
        String platformId = firstNonBlank(item.platformId, batchPlatformId);
        if (platformId.isEmpty()) {
            return null;
        }
        if (platformId.equals(item.platformId) && item.fetchedAt != null) {
            return item;
        }
        return new RawItem(
                platformId,
                item.title,
                item.url,
                item.rankPosition,
                item.fetchedAt == null ? runInstant : item.fetchedAt
        );
    }

    /**
     * A key already in the window keeps the start of its earliest recorded day as first-seen time.
     */
    private List<TopicCluster> applyRecordedFirstSeen(List<TopicCluster> clusters, Map<String, WindowEntry> prior) {
        List<TopicCluster> out = new ArrayList<>(clusters.size());
        for (TopicCluster cluster : clusters) {
            LocalDate earliest = null;
            for (String key : cluster.memberKeys()) {
                Optional<LocalDate> first = Optional.ofNullable(prior.get(key)).flatMap(WindowEntry::firstSeen);
                if (first.isPresent() && (earliest == null || first.get().isBefore(earliest))) {
                    earliest = first.get();
                }
            }
            if (earliest == null) {
                out.add(cluster);
                continue;
            }
            Instant recorded = earliest.atStartOfDay(zone).toInstant();
            if (cluster.firstSeenAt == null || recorded.isBefore(cluster.firstSeenAt)) {
                out.add(cluster.withFirstSeenAt(recorded));
            } else {
                out.add(cluster);
            }
        }
        return out;
    }

    /**
     * Union of the days recorded before this run for every member key, keyed by the cluster's representative key.
     */
    private Optional<WindowEntry> clusterEntry(TopicCluster cluster, Map<String, WindowEntry> prior) {
        List<WindowEntry> found = new ArrayList<>();
        for (String key : cluster.memberKeys()) {
            WindowEntry entry = prior.get(key);
            if (entry != null) {
                found.add(entry);
            }
        }
        if (found.isEmpty()) {
            return Optional.empty();
        }
        if (found.size() == 1) {
            return Optional.of(found.get(0));
        }
        return Optional.of(WindowEntry.merge(cluster.representativeKey, found));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return "";
    }
}
