package com.trendradar.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class NormalizedItem {
    public final String platformId;
    public final String canonicalTitle;
    public final String normalizationKey;
    public final int rankPosition;
    public final String url;
    public final Instant fetchedAt;
}
