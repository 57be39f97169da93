package com.trendradar.window;

import com.trendradar.exception.WindowStoreException;
import com.trendradar.model.TopicCluster;
import com.trendradar.model.WindowEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory window bookkeeping shared by the concrete stores; subclasses only read and write the committed blob.
 */
public abstract class AbstractWindowStore implements WindowStore {
    private static final Logger LOG = LogManager.getLogger(AbstractWindowStore.class);

    private final Map<String, WindowEntry> entries = new LinkedHashMap<>();
    private LocalDate today;
    private int windowDays;
    private boolean loaded;
    private boolean historyAvailable;

    protected abstract Map<String, List<LocalDate>> readState() throws IOException;

    protected abstract void writeState(Map<String, WindowEntry> state, LocalDate today, int windowDays) throws IOException;

    /**
     * Called once when committed state exists but could not be read.
     */
    protected void onReadFailure(Exception cause) {
    }

    @Override
    public Map<String, WindowEntry> load(LocalDate today, int windowDays) {
        if (today == null) {
            throw new IllegalArgumentException("today must not be null");
        }
        if (windowDays < 1) {
            throw new IllegalArgumentException("window days must be >= 1, got " + windowDays);
        }
        this.today = today;
        this.windowDays = windowDays;
        this.entries.clear();
        this.loaded = true;

        Map<String, List<LocalDate>> raw;
        try {
            raw = readState();
            historyAvailable = true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("window state unreadable, continuing without history: {}", e.getMessage());
            historyAvailable = false;
            onReadFailure(e);
            return Map.of();
        }

        int dropped = 0;
        for (Map.Entry<String, List<LocalDate>> e : raw.entrySet()) {
            WindowEntry entry = prune(new WindowEntry(e.getKey(), e.getValue()));
            if (entry.isEmpty()) {
                dropped++;
            } else {
                entries.put(entry.normalizationKey, entry);
            }
        }
        LOG.info("window loaded keys={} dropped_stale={} window_days={} today={}",
                entries.size(), dropped, windowDays, today);
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public void record(List<TopicCluster> todayClusters, LocalDate today) {
        if (!loaded) {
            throw new IllegalStateException("load must be called before record");
        }
        if (today != null && !today.equals(this.today)) {
            this.today = today;
            entries.replaceAll((key, entry) -> prune(entry));
            entries.values().removeIf(WindowEntry::isEmpty);
        }
        if (todayClusters == null) {
            return;
        }
        int touched = 0;
        for (TopicCluster cluster : todayClusters) {
            for (String key : cluster.memberKeys()) {
                WindowEntry current = entries.get(key);
                WindowEntry next = current == null
                        ? new WindowEntry(key, List.of(this.today))
                        : current.withDay(this.today);
                if (next != current) {
                    entries.put(key, next);
                    touched++;
                }
            }
        }
        LOG.debug("window recorded date={} new_observations={} keys={}", this.today, touched, entries.size());
    }

    @Override
    public Optional<WindowEntry> entry(String normalizationKey) {
        return Optional.ofNullable(entries.get(normalizationKey));
    }

    @Override
    public int frequencyCount(String normalizationKey) {
        WindowEntry entry = entries.get(normalizationKey);
        return entry == null ? 0 : entry.frequencyCount();
    }

    @Override
    public boolean historyAvailable() {
        return historyAvailable;
    }

    @Override
    public void persist() {
        if (!loaded) {
            throw new IllegalStateException("load must be called before persist");
        }
        try {
            writeState(Collections.unmodifiableMap(new LinkedHashMap<>(entries)), today, windowDays);
        } catch (IOException | RuntimeException e) {
            throw new WindowStoreException("failed to persist window state: " + e.getMessage(), e);
        }
    }

    /**
     * Keeps dates in {@code [today - windowDays, today]}; only dates older than the window start are dropped.
     */
    private WindowEntry prune(WindowEntry entry) {
        LocalDate from = today.minusDays(windowDays);
        return entry.retainBetween(from, today);
    }
}
