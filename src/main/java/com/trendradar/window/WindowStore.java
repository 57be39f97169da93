package com.trendradar.window;

import com.trendradar.model.TopicCluster;
import com.trendradar.model.WindowEntry;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-key record of the calendar dates a topic was seen, pruned to a trailing window.
 * Lifecycle per run: {@link #load}, {@link #record}, {@link #persist}. Not safe for concurrent runs
 * against the same backing state; the last writer wins.
 */
public interface WindowStore {

    /**
     * Reads committed state and prunes it relative to {@code today}. A read failure is not thrown:
     * the store starts empty and {@link #historyAvailable()} turns false.
     */
    Map<String, WindowEntry> load(LocalDate today, int windowDays);

    /**
     * Adds {@code today} to the entry of every distinct member key. Re-recording the same date is a no-op.
     */
    void record(List<TopicCluster> todayClusters, LocalDate today);

    Optional<WindowEntry> entry(String normalizationKey);

    int frequencyCount(String normalizationKey);

    boolean historyAvailable();

    /**
     * Atomically replaces the committed state with the in-memory one.
     *
     * @throws com.trendradar.exception.WindowStoreException when the state cannot be written
     */
    void persist();
}
