package com.trendradar.window;

import com.trendradar.model.WindowEntry;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Window store whose committed state lives in memory. Used for isolated runs and tests.
 */
public class InMemoryWindowStore extends AbstractWindowStore {
    private Map<String, List<LocalDate>> committed;

    public InMemoryWindowStore() {
        this(Map.of());
    }

    public InMemoryWindowStore(Map<String, List<LocalDate>> committed) {
        this.committed = copy(committed);
    }

    public synchronized Map<String, List<LocalDate>> committed() {
        return copy(committed);
    }

    @Override
    protected synchronized Map<String, List<LocalDate>> readState() {
        return copy(committed);
    }

    @Override
    protected synchronized void writeState(Map<String, WindowEntry> state, LocalDate today, int windowDays) {
        Map<String, List<LocalDate>> next = new LinkedHashMap<>();
        for (WindowEntry entry : state.values()) {
            next.put(entry.normalizationKey, entry.daysSeen);
        }
        this.committed = next;
    }

    private static Map<String, List<LocalDate>> copy(Map<String, List<LocalDate>> source) {
        Map<String, List<LocalDate>> out = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, List<LocalDate>> e : source.entrySet()) {
                out.put(e.getKey(), e.getValue() == null ? List.of() : new ArrayList<>(e.getValue()));
            }
        }
        return out;
    }
}
