package com.trendradar.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Calendar dates on which a normalization key was observed.
 * {@code daysSeen} is ascending and free of duplicates.
 */
public final class WindowEntry {
    public final String normalizationKey;
    public final List<LocalDate> daysSeen;

    public WindowEntry(String normalizationKey, Collection<LocalDate> daysSeen) {
        this.normalizationKey = normalizationKey == null ? "" : normalizationKey;
        TreeSet<LocalDate> sorted = new TreeSet<>();
        if (daysSeen != null) {
            for (LocalDate day : daysSeen) {
                if (day != null) {
                    sorted.add(day);
                }
            }
        }
        this.daysSeen = List.copyOf(sorted);
    }

    public int frequencyCount() {
        return daysSeen.size();
    }

    public boolean isEmpty() {
        return daysSeen.isEmpty();
    }

    public Optional<LocalDate> firstSeen() {
        return daysSeen.isEmpty() ? Optional.empty() : Optional.of(daysSeen.get(0));
    }

    public WindowEntry withDay(LocalDate day) {
        if (day == null || daysSeen.contains(day)) {
            return this;
        }
        List<LocalDate> next = new ArrayList<>(daysSeen);
        next.add(day);
        return new WindowEntry(normalizationKey, next);
    }

    /**
     * Keeps only dates inside {@code [from, to]}.
     */
    public WindowEntry retainBetween(LocalDate from, LocalDate to) {
        List<LocalDate> kept = new ArrayList<>();
        for (LocalDate day : daysSeen) {
            if (!day.isBefore(from) && !day.isAfter(to)) {
                kept.add(day);
            }
        }
        if (kept.size() == daysSeen.size()) {
            return this;
        }
        return new WindowEntry(normalizationKey, kept);
    }

    /**
     * Union of the dates of several entries, reported under {@code key}.
     */
    public static WindowEntry merge(String key, Collection<WindowEntry> entries) {
        List<LocalDate> days = new ArrayList<>();
        if (entries != null) {
            for (WindowEntry entry : entries) {
                if (entry != null) {
                    days.addAll(entry.daysSeen);
                }
            }
        }
        return new WindowEntry(key, days);
    }

    @Override
    public String toString() {
        return "WindowEntry{" + normalizationKey + "=" + daysSeen + "}";
    }
}
