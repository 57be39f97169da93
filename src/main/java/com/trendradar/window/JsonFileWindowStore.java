package com.trendradar.window;

import com.trendradar.model.WindowEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：JsonFileWindowStore（class）。
 * 主要职责：以单个 JSON 文件保存窗口状态，格式：
 * <pre>
 * {"version":1,"today":"2026-10-18","window_days":7,
 *  "entries":{"key":["2026-10-12","2026-10-18"]}}
 * </pre>
 * 写入先落到同目录临时文件，成功后再原子替换目标文件；读取失败时把原文件另存为 .corrupt。
 */
public class JsonFileWindowStore extends AbstractWindowStore {
    private static final Logger LOG = LogManager.getLogger(JsonFileWindowStore.class);
    static final int FORMAT_VERSION = 1;

    private final Path path;

    public JsonFileWindowStore(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("state path must not be null");
        }
        this.path = path.toAbsolutePath().normalize();
    }

    @Override
    protected Map<String, List<LocalDate>> readState() throws IOException {
        Map<String, List<LocalDate>> out = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            LOG.info("window state {} not found, starting empty", path);
            return out;
        }
        String txt = Files.readString(path, StandardCharsets.UTF_8);
        JSONObject root = new JSONObject(txt);
        JSONObject entries = root.optJSONObject("entries");
        if (entries == null) {
            throw new IOException("window state " + path + " has no 'entries' object");
        }
        int badDates = 0;
        for (String key : entries.keySet()) {
            JSONArray days = entries.optJSONArray(key);
            if (days == null) {
                badDates++;
                continue;
            }
            List<LocalDate> parsed = new ArrayList<>(days.length());
            for (int i = 0; i < days.length(); i++) {
                try {
                    parsed.add(LocalDate.parse(days.optString(i, "")));
                } catch (DateTimeParseException e) {
                    badDates++;
                }
            }
            out.put(key, parsed);
        }
        if (badDates > 0) {
            LOG.warn("window state {} had {} unparseable date values, ignored", path, badDates);
        }
        return out;
    }

    @Override
    protected void writeState(Map<String, WindowEntry> state, LocalDate today, int windowDays) throws IOException {
        JSONObject entries = new JSONObject();
        for (WindowEntry entry : state.values()) {
            JSONArray days = new JSONArray();
            for (LocalDate day : entry.daysSeen) {
                days.put(day.toString());
            }
            entries.put(entry.normalizationKey, days);
        }
        JSONObject root = new JSONObject();
        root.put("version", FORMAT_VERSION);
        root.put("today", today == null ? "" : today.toString());
        root.put("window_days", windowDays);
        root.put("entries", entries);

        Path dir = path.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, path.getFileName().toString() + ".", ".tmp");
        boolean moved = false;
        try {
            Files.writeString(tmp, root.toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
            LOG.info("window state persisted keys={} path={}", state.size(), path);
        } finally {
            if (!moved) {
                Files.deleteIfExists(tmp);
            }
        }
    }

    @Override
    protected void onReadFailure(Exception cause) {
        Path backup = corruptBackupPath();
        try {
            if (Files.isRegularFile(path)) {
                Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
                LOG.warn("unreadable window state copied to {}", backup);
            }
        } catch (IOException e) {
            LOG.warn("failed to back up unreadable window state {}: {}", path, e.getMessage());
        }
    }

    Path corruptBackupPath() {
        return path.resolveSibling(path.getFileName().toString() + ".corrupt");
    }
}
