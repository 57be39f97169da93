package com.trendradar.window;

import com.trendradar.exception.WindowStoreException;
import com.trendradar.model.NormalizedItem;
import com.trendradar.model.TopicCluster;
import com.trendradar.model.WindowEntry;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileWindowStoreTest {
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 18);

    @TempDir
    Path tempDir;

    @Test
    void load_shouldStartEmptyWhenFileMissing() {
        JsonFileWindowStore store = new JsonFileWindowStore(tempDir.resolve("state.json"));
        Map<String, WindowEntry> loaded = store.load(TODAY, 7);

        assertTrue(loaded.isEmpty());
        assertTrue(store.historyAvailable());
    }

    @Test
    void persist_shouldRoundTripAndPruneStaleDates() throws IOException {
        Path file = tempDir.resolve("state.json");
        writeState(file, "{\"version\":1,\"entries\":{"
                + "\"old topic\":[\"2026-10-08\"],"
                + "\"edge topic\":[\"2026-10-11\",\"2026-10-10\"],"
                + "\"future topic\":[\"2026-10-19\",\"2026-10-17\"]}}");

        JsonFileWindowStore store = new JsonFileWindowStore(file);
        Map<String, WindowEntry> loaded = store.load(TODAY, 7);

        assertFalse(loaded.containsKey("old topic"));
        assertEquals(List.of(LocalDate.of(2026, 10, 11)), loaded.get("edge topic").daysSeen);
        assertEquals(List.of(LocalDate.of(2026, 10, 17)), loaded.get("future topic").daysSeen);

        store.record(List.of(cluster("edge topic")), TODAY);
        store.persist();

        JSONObject saved = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
        JSONObject entries = saved.getJSONObject("entries");
        assertEquals(1, saved.getInt("version"));
        assertEquals("2026-10-18", saved.getString("today"));
        assertEquals(7, saved.getInt("window_days"));
        assertFalse(entries.has("old topic"));
        assertEquals(2, entries.getJSONArray("edge topic").length());
        assertEquals("2026-10-11", entries.getJSONArray("edge topic").getString(0));
        assertEquals("2026-10-18", entries.getJSONArray("edge topic").getString(1));

        JsonFileWindowStore reopened = new JsonFileWindowStore(file);
        reopened.load(TODAY, 7);
        assertEquals(2, reopened.frequencyCount("edge topic"));
    }

    @Test
    void record_shouldNotDoubleCountSameDateRerun() {
        Path file = tempDir.resolve("state.json");
        for (int run = 0; run < 3; run++) {
            JsonFileWindowStore store = new JsonFileWindowStore(file);
            store.load(TODAY, 7);
            store.record(List.of(cluster("repeat topic")), TODAY);
            store.persist();
            assertEquals(1, store.frequencyCount("repeat topic"));
        }
    }

    @Test
    void persist_shouldLeaveNoTempFiles() throws IOException {
        Path file = tempDir.resolve("nested").resolve("state.json");
        JsonFileWindowStore store = new JsonFileWindowStore(file);
        store.load(TODAY, 7);
        store.record(List.of(cluster("a"), cluster("b")), TODAY);
        store.persist();

        assertTrue(Files.isRegularFile(file));
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void load_shouldBackUpUnreadableState() throws IOException {
        Path file = tempDir.resolve("state.json");
        writeState(file, "{not json");

        JsonFileWindowStore store = new JsonFileWindowStore(file);
        Map<String, WindowEntry> loaded = store.load(TODAY, 7);

        assertTrue(loaded.isEmpty());
        assertFalse(store.historyAvailable());
        assertTrue(Files.isRegularFile(store.corruptBackupPath()));
        assertEquals("{not json", Files.readString(store.corruptBackupPath(), StandardCharsets.UTF_8));
    }

    @Test
    void load_shouldTreatMissingEntriesAsUnreadable() throws IOException {
        Path file = tempDir.resolve("state.json");
        writeState(file, "{\"version\":1}");

        JsonFileWindowStore store = new JsonFileWindowStore(file);
        store.load(TODAY, 7);

        assertFalse(store.historyAvailable());
    }

    @Test
    void load_shouldIgnoreUnparseableDates() throws IOException {
        Path file = tempDir.resolve("state.json");
        writeState(file, "{\"entries\":{\"k\":[\"yesterday\",\"2026-10-17\"]}}");

        JsonFileWindowStore store = new JsonFileWindowStore(file);
        store.load(TODAY, 7);

        assertTrue(store.historyAvailable());
        assertEquals(1, store.frequencyCount("k"));
    }

    @Test
    void persist_shouldFailWhenTargetCannotBeReplaced() throws IOException {
        Path target = tempDir.resolve("state.json");
        Files.createDirectories(target);
        Files.writeString(target.resolve("occupied"), "x", StandardCharsets.UTF_8);

        JsonFileWindowStore store = new JsonFileWindowStore(target);
        store.load(TODAY, 7);
        store.record(List.of(cluster("a")), TODAY);

        assertThrows(WindowStoreException.class, store::persist);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(target), files.toList());
        }
    }

    private static void writeState(Path file, String json) throws IOException {
        Files.writeString(file, json, StandardCharsets.UTF_8);
    }

    private static TopicCluster cluster(String key) {
        NormalizedItem item = new NormalizedItem("weibo", key, key, 1, "", Instant.parse("2026-10-18T01:00:00Z"));
        return new TopicCluster(1, key, key, List.of(item), item.fetchedAt);
    }
}
