package com.trendradar.io;

import com.trendradar.model.PlatformBatch;
import com.trendradar.model.RawItem;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FetchResultReaderTest {
    private static final Instant FALLBACK = Instant.parse("2026-10-18T00:00:00Z");

    private final FetchResultReader reader = new FetchResultReader(FALLBACK);

    @Test
    void parse_shouldReadPlatformsAndResolveTimestamps() {
        JSONObject root = new JSONObject("{"
                + "\"fetched_at\":\"2026-10-18T08:00:00+08:00\","
                + "\"platforms\":["
                + "{\"id\":\"weibo\",\"fetched_at\":\"2026-10-18T01:30:00Z\",\"items\":["
                + "{\"title\":\"话题一\",\"url\":\"https://weibo.example/1\",\"rank\":1},"
                + "{\"title\":\"话题二\",\"rank\":2,\"fetched_at\":\"2026-10-18T01:45:00Z\"}]},"
                + "{\"id\":\"zhihu\",\"items\":[{\"title\":\"问题\"},{\"title\":\"问题二\"}]}"
                + "]}");

        List<PlatformBatch> batches = reader.parse(root);

        assertEquals(2, batches.size());
        PlatformBatch weibo = batches.get(0);
        assertEquals("weibo", weibo.platformId);
        assertEquals(Instant.parse("2026-10-18T01:30:00Z"), weibo.items.get(0).fetchedAt);
        assertEquals("https://weibo.example/1", weibo.items.get(0).url);
        assertEquals(Instant.parse("2026-10-18T01:45:00Z"), weibo.items.get(1).fetchedAt);

        PlatformBatch zhihu = batches.get(1);
        RawItem second = zhihu.items.get(1);
        assertEquals(2, second.rankPosition);
        assertEquals(Instant.parse("2026-10-18T00:00:00Z"), second.fetchedAt);
        assertEquals("", second.url);
    }

    @Test
    void parse_shouldOmitFailedPlatformsAndSkipBadItems() {
        JSONObject root = new JSONObject("{\"platforms\":["
                + "{\"id\":\"douyin\",\"error\":\"timeout\"},"
                + "{\"items\":[{\"title\":\"no id\"}]},"
                + "{\"id\":\"baidu\",\"items\":[{\"rank\":1},{\"title\":\"bad rank\",\"rank\":0},"
                + "{\"title\":\"kept\",\"rank\":3,\"fetched_at\":\"not a time\"}]}"
                + "]}");

        List<PlatformBatch> batches = reader.parse(root);

        assertEquals(1, batches.size());
        assertEquals("baidu", batches.get(0).platformId);
        assertEquals(1, batches.get(0).items.size());
        assertEquals("kept", batches.get(0).items.get(0).title);
        assertEquals(FALLBACK, batches.get(0).items.get(0).fetchedAt);
    }

    @Test
    void parse_shouldTreatMissingPlatformsAsEmpty() {
        assertTrue(reader.parse(new JSONObject("{}")).isEmpty());
    }

    @Test
    void read_shouldWrapInvalidJson(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("fetch.json");
        Files.writeString(file, "[broken", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> reader.read(file));
    }
}
