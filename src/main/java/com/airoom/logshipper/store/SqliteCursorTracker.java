package com.airoom.logshipper.store;

import com.airoom.logshipper.util.JsonlFiles;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.airoom.logshipper.store.EventSchema.FILE_STATE;

/** conversation_file_state 테이블에 저장되는 커서 */
public class SqliteCursorTracker implements CursorTracker {

    private static final Logger log = LoggerFactory.getLogger(SqliteCursorTracker.class);

    static final String LEGACY_FILE = "state.json";

    private static final String UPSERT = "INSERT INTO " + FILE_STATE + " (file_name, last_line, updated_at)"
            + " VALUES (?, ?, CURRENT_TIMESTAMP)"
            + " ON CONFLICT(file_name) DO UPDATE SET"
            + " last_line = MAX(last_line, excluded.last_line), updated_at = CURRENT_TIMESTAMP";

    private final SqliteDatabase db;

    public SqliteCursorTracker(SqliteDatabase db) throws SQLException {
        this.db = db;
        db.withConnection(c -> {
            try (Statement st = c.createStatement()) {
                st.execute(EventSchema.createFileState());
            }
            return null;
        });
        importLegacySnapshot();
    }

    @Override
    public int getLastLine(String fileName) throws SQLException {
        return db.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT last_line FROM " + FILE_STATE + " WHERE file_name = ?")) {
                ps.setString(1, fileName);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public void setLastLine(String fileName, int lastLine) throws SQLException {
        setAll(Map.of(fileName, lastLine));
    }

    @Override
    public int fastForwardAll(Path root, String filter) throws SQLException, IOException {
        log.info("[Cursor] skipping backlog under {}", root);
        Map<String, Integer> updates = new LinkedHashMap<>();
        for (Path f : JsonlFiles.listAll(root)) {
            String name = JsonlFiles.relativeName(root, f);
            if (!JsonlFiles.matchesFilter(name, filter)) continue;
            try {
                int lines = JsonlFiles.countLines(f);
                if (lines > 0) {
                    updates.put(name, lines);
                    log.debug("[Cursor] skipped {} lines in {}", lines, name);
                }
            } catch (IOException e) {
                log.warn("[Cursor] cannot count lines of {}: {}", f, e.getMessage());
            }
        }
        setAll(updates);
        log.info("[Cursor] fast-forwarded {} files", updates.size());
        return updates.size();
    }

    @Override
    public int trackedFileCount() throws SQLException {
        return db.withConnection(c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + FILE_STATE)) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private void setAll(Map<String, Integer> cursors) throws SQLException {
        if (cursors.isEmpty()) return;
        db.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement(UPSERT)) {
                for (Map.Entry<String, Integer> e : cursors.entrySet()) {
                    ps.setString(1, e.getKey());
                    ps.setInt(2, e.getValue());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
    }

    /**
     * 예전 버전이 남긴 state.json ({"경로": 줄번호}) 을 한 번만 가져온다.
     * 커서 테이블이 비어 있을 때만 읽는다. 읽었든 아니든 state.json.bak 으로 이름을 바꿔 다음 시작 때는 보지 않는다.
     */
    private void importLegacySnapshot() throws SQLException {
        Path parent = db.file().toAbsolutePath().getParent();
        if (parent == null) return;
        Path legacy = parent.resolve(LEGACY_FILE);
        if (!Files.isRegularFile(legacy)) return;
        if (trackedFileCount() > 0) {
            log.info("[Cursor] cursors already present, legacy {} archived without import", legacy);
            archive(legacy);
            return;
        }

        Map<String, Integer> cursors = new LinkedHashMap<>();
        try {
            JsonElement root = JsonParser.parseString(Files.readString(legacy, StandardCharsets.UTF_8));
            if (root.isJsonObject()) {
                JsonObject obj = root.getAsJsonObject();
                for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
                    JsonElement v = e.getValue();
                    if (v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber()) {
                        cursors.put(e.getKey(), v.getAsInt());
                    }
                }
            }
        } catch (IOException | JsonParseException | NumberFormatException e) {
            log.warn("[Cursor] legacy {} unreadable, ignored: {}", legacy, e.getMessage());
            return;
        }

        setAll(cursors);
        archive(legacy);
        log.info("[Cursor] imported {} cursors from legacy {}", cursors.size(), legacy);
    }

    private static void archive(Path legacy) {
        try {
            Files.move(legacy, legacy.resolveSibling(LEGACY_FILE + ".bak"), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("[Cursor] could not archive {}: {}", legacy, e.getMessage());
        }
    }
}
