package com.trendradar.cluster;

import com.trendradar.config.WeightConfig;
import com.trendradar.model.NormalizedItem;
import com.trendradar.model.TopicCluster;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * 模块说明：TopicDeduplicator（class）。
 * 主要职责：把同一轮运行中、来自不同平台但指向同一话题的条目合并为 TopicCluster。
 * 处理流程：
 * 1. 同平台同 key 的重复条目只保留排名最靠前的一条；
 * 2. 按 normalization key 精确分桶，每个桶占用一个槽位；
 * 3. 共享至少一个 token 的桶两两计算 Jaccard 相似度，达到阈值即在并查集中合并（可传递）；
 * 4. 每个集合生成一个簇，按平台优先级 → 标题长度 → 字典序选出代表标题。
 */
public final class TopicDeduplicator {
    private static final Logger LOG = LogManager.getLogger(TopicDeduplicator.class);

    private final double similarityThreshold;
    private final ToIntFunction<String> platformPriority;

    public TopicDeduplicator(double similarityThreshold, ToIntFunction<String> platformPriority) {
        if (!(similarityThreshold > 0.0 && similarityThreshold <= 1.0)) {
            throw new IllegalArgumentException("similarity threshold must be in (0, 1], got " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
        this.platformPriority = platformPriority == null ? id -> 0 : platformPriority;
    }

    public TopicDeduplicator(WeightConfig config) {
        this(config.similarityThreshold, config::platformPriority);
    }

    public List<TopicCluster> group(List<NormalizedItem> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<Bucket> slots = buildBuckets(dropSamePlatformDuplicates(items));

        UnionFind sets = new UnionFind(slots.size());
        int merges = mergeSimilar(slots, sets);

        Map<Integer, List<Bucket>> groups = new LinkedHashMap<>();
        for (int i = 0; i < slots.size(); i++) {
            groups.computeIfAbsent(sets.find(i), ignored -> new ArrayList<>()).add(slots.get(i));
        }

        List<TopicCluster> clusters = new ArrayList<>(groups.size());
        int nextId = 1;
        for (List<Bucket> group : groups.values()) {
            clusters.add(toCluster(nextId++, group));
        }
        LOG.debug("dedup items={} keys={} similarity_merges={} clusters={}",
                items.size(), slots.size(), merges, clusters.size());
        return clusters;
    }

    private List<NormalizedItem> dropSamePlatformDuplicates(List<NormalizedItem> items) {
        Map<String, NormalizedItem> kept = new LinkedHashMap<>();
        for (NormalizedItem item : items) {
            if (item == null) {
                continue;
            }
            String slot = item.platformId + '\u0000' + item.normalizationKey;
            NormalizedItem existing = kept.get(slot);
            if (existing == null) {
                kept.put(slot, item);
            } else if (item.rankPosition < existing.rankPosition) {
                kept.put(slot, item);
                LOG.debug("duplicate on platform={} key='{}': keeping rank {} over {}",
                        item.platformId, item.normalizationKey, item.rankPosition, existing.rankPosition);
            } else {
                LOG.debug("duplicate on platform={} key='{}': dropping rank {}",
                        item.platformId, item.normalizationKey, item.rankPosition);
            }
        }
        return new ArrayList<>(kept.values());
    }

    private List<Bucket> buildBuckets(List<NormalizedItem> items) {
        Map<String, Bucket> byKey = new LinkedHashMap<>();
        for (NormalizedItem item : items) {
            byKey.computeIfAbsent(item.normalizationKey, Bucket::new).items.add(item);
        }
        return new ArrayList<>(byKey.values());
    }

    /**
     * Only slots that share a token can reach a positive threshold, so candidates come from a token index.
     */
    private int mergeSimilar(List<Bucket> slots, UnionFind sets) {
        Map<String, List<Integer>> slotsByToken = new LinkedHashMap<>();
        for (int i = 0; i < slots.size(); i++) {
            for (String token : slots.get(i).tokens) {
                slotsByToken.computeIfAbsent(token, ignored -> new ArrayList<>()).add(i);
            }
        }

        int merges = 0;
        for (int i = 0; i < slots.size(); i++) {
            Set<Integer> candidates = new LinkedHashSet<>();
            for (String token : slots.get(i).tokens) {
                for (int j : slotsByToken.get(token)) {
                    if (j > i) {
                        candidates.add(j);
                    }
                }
            }
            for (int j : candidates) {
                if (sets.connected(i, j)) {
                    continue;
                }
                double similarity = TokenSimilarity.jaccard(slots.get(i).tokens, slots.get(j).tokens);
                if (similarity >= similarityThreshold && sets.union(i, j)) {
                    merges++;
                }
            }
        }
        return merges;
    }

    private TopicCluster toCluster(int clusterId, List<Bucket> group) {
        List<NormalizedItem> members = new ArrayList<>();
        for (Bucket bucket : group) {
            members.addAll(bucket.items);
        }

        NormalizedItem representative = members.stream()
                .min(representativeOrder())
                .orElseThrow();

        Instant firstSeen = null;
        for (NormalizedItem member : members) {
            if (member.fetchedAt != null && (firstSeen == null || member.fetchedAt.isBefore(firstSeen))) {
                firstSeen = member.fetchedAt;
            }
        }
        return new TopicCluster(
                clusterId,
                representative.canonicalTitle,
                representative.normalizationKey,
                members,
                firstSeen
        );
    }

    private Comparator<NormalizedItem> representativeOrder() {
        Comparator<NormalizedItem> byPriority = Comparator.comparingInt(
                (NormalizedItem item) -> platformPriority.applyAsInt(item.platformId)).reversed();
        Comparator<NormalizedItem> byLength = Comparator.comparingInt(
                (NormalizedItem item) -> item.canonicalTitle.codePointCount(0, item.canonicalTitle.length())).reversed();
        return byPriority
                .thenComparing(byLength)
                .thenComparing(item -> item.canonicalTitle);
    }

    private static final class Bucket {
        private final String key;
        private final Set<String> tokens;
        private final List<NormalizedItem> items = new ArrayList<>();

        private Bucket(String key) {
            this.key = key;
            this.tokens = TokenSimilarity.tokens(key);
        }

        @Override
        public String toString() {
            return key;
        }
    }
}
