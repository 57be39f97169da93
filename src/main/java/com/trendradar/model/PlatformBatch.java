package com.trendradar.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The complete list one platform returned for a run. Platforms that failed to fetch have no batch.
 */
@Value
public class PlatformBatch {
    public final String platformId;
    public final List<RawItem> items;

    public PlatformBatch(String platformId, List<RawItem> items) {
        this.platformId = platformId;
        this.items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }
}
