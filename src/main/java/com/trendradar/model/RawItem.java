package com.trendradar.model;

import java.time.Instant;

/**
 * One entry as a single platform reported it, at a single rank.
 */
public final class RawItem {
    public final String platformId;
    public final String title;
    public final String url;
    public final int rankPosition;
    public final Instant fetchedAt;

    public RawItem(String platformId, String title, String url, int rankPosition, Instant fetchedAt) {
        this.platformId = platformId;
        this.title = title;
        this.url = url;
        this.rankPosition = rankPosition;
        this.fetchedAt = fetchedAt;
    }

    @Override
    public String toString() {
        return "RawItem{" + platformId + "#" + rankPosition + " " + title + "}";
    }
}
