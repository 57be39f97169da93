package com.trendradar.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 模块说明：TopicCluster（class）。
 * 主要职责：同一轮运行中被判定为同一话题的条目集合，是排名的基本单位。
 * platformsSeen 由成员推导，不单独设置。
 */
public final class TopicCluster {
    public final int clusterId;
    public final String canonicalTitle;
    public final String representativeKey;
    public final List<NormalizedItem> members;
    public final Set<String> platformsSeen;
    public final Instant firstSeenAt;

    public TopicCluster(
            int clusterId,
            String canonicalTitle,
            String representativeKey,
            List<NormalizedItem> members,
            Instant firstSeenAt
    ) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("cluster " + clusterId + " must have at least one member");
        }
        this.clusterId = clusterId;
        this.canonicalTitle = canonicalTitle == null ? "" : canonicalTitle;
        this.representativeKey = representativeKey == null ? "" : representativeKey;
        this.members = List.copyOf(members);
        Set<String> platforms = new LinkedHashSet<>();
        for (NormalizedItem member : this.members) {
            platforms.add(member.platformId);
        }
        this.platformsSeen = Collections.unmodifiableSet(platforms);
        this.firstSeenAt = firstSeenAt;
    }

    public TopicCluster withFirstSeenAt(Instant earlier) {
        return new TopicCluster(clusterId, canonicalTitle, representativeKey, members, earlier);
    }

    /**
     * Distinct normalization keys among members, in member order.
     */
    public Set<String> memberKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (NormalizedItem member : members) {
            keys.add(member.normalizationKey);
        }
        return keys;
    }

    @Override
    public String toString() {
        return "TopicCluster{id=" + clusterId
                + ", title=" + canonicalTitle
                + ", members=" + members.size()
                + ", platforms=" + platformsSeen + "}";
    }
}
