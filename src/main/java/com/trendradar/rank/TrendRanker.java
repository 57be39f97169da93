package com.trendradar.rank;

import com.trendradar.model.RankedItem;
import com.trendradar.model.ScoredCluster;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 模块说明：TrendRanker（class）。
 * 主要职责：按最终得分降序排列，并用确定性的次序打破平局，保证重复运行输出一致。
 * 平局规则：更早的 firstSeenAt 优先 → 标题字典序较小者优先 → 代表 key → clusterId。
 */
public final class TrendRanker {

    static final Comparator<ScoredCluster> ORDER = Comparator
            .comparingDouble((ScoredCluster row) -> row.score.finalScore).reversed()
            .thenComparing(row -> row.cluster.firstSeenAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(row -> row.cluster.canonicalTitle)
            .thenComparing(row -> row.cluster.representativeKey)
            .thenComparingInt(row -> row.cluster.clusterId);

    /**
     * @param topN keep the first {@code topN} rows; zero or negative keeps all
     */
    public List<RankedItem> rank(List<ScoredCluster> scored, int topN) {
        if (scored == null || scored.isEmpty()) {
            return List.of();
        }
        List<ScoredCluster> sorted = new ArrayList<>(scored);
        sorted.sort(ORDER);

        int limit = topN <= 0 ? sorted.size() : Math.min(topN, sorted.size());
        List<RankedItem> out = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            ScoredCluster row = sorted.get(i);
            out.add(RankedItem.builder()
                    .cluster(row.cluster)
                    .rankScore(row.score.rankScore)
                    .frequencyScore(row.score.frequencyScore)
                    .keywordScore(row.score.keywordScore)
                    .finalScore(row.score.finalScore)
                    .rankPosition(i + 1)
                    .build());
        }
        return out;
    }
}
