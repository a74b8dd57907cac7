package com.airoom.logshipper.store;

import com.airoom.logshipper.event.DerivedColumn;

import java.util.ArrayList;
import java.util.List;

/** conversation_events 와 부속 객체(인덱스, FTS, 트리거, 커서 테이블)의 DDL */
public final class EventSchema {

    public static final String EVENTS = "conversation_events";
    public static final String FILE_STATE = "conversation_file_state";
    public static final String FTS = "messages_fts";

    public static final List<String> FTS_TRIGGERS = List.of(FTS + "_insert", FTS + "_delete", FTS + "_update");

    /** 파생 컬럼이 아닌, 재구성 시 복사 대상 컬럼 */
    public static final List<String> BASE_COLUMNS = List.of(
            "id", "file_name", "line_number", "event_data", "user_name", "inserted_at",
            "git_remote_url", "git_commit_hash", "synced_at");

    /** 인덱스 대상 컬럼 */
    static final List<String> INDEXED_COLUMNS = List.of(
            "file_name", "user_name", "inserted_at", "event_type", "event_message",
            "event_git_branch", "event_session_id", "event_uuid", "event_timestamp",
            "event_model", "git_remote_url", "git_commit_hash", "synced_at");

    private EventSchema() {}

    public static String createEventsTable(String tableName) {
        StringBuilder sb = new StringBuilder();
        sb.append("CREATE TABLE IF NOT EXISTS ").append(tableName).append(" (\n")
          .append("    id INTEGER PRIMARY KEY AUTOINCREMENT,\n")
          .append("    file_name TEXT NOT NULL,\n")
          .append("    line_number INTEGER NOT NULL,\n")
          .append("    event_data TEXT NOT NULL,\n")
          .append("    user_name TEXT,\n")
          .append("    inserted_at DATETIME DEFAULT CURRENT_TIMESTAMP,\n")
          .append("    git_remote_url TEXT,\n")
          .append("    git_commit_hash TEXT,\n")
          .append("    synced_at DATETIME DEFAULT NULL,\n");
        for (DerivedColumn c : DerivedColumn.values()) {
            sb.append("    ").append(c.definition("event_data")).append(",\n");
        }
        sb.append("    UNIQUE(file_name, line_number)\n)");
        return sb.toString();
    }

    public static List<String> createIndexes() {
        List<String> out = new ArrayList<>();
        for (String col : INDEXED_COLUMNS) {
            out.add("CREATE INDEX IF NOT EXISTS idx_" + col + " ON " + EVENTS + "(" + col + ")");
        }
        return out;
    }

    public static String createFts() {
        return "CREATE VIRTUAL TABLE IF NOT EXISTS " + FTS + " USING fts5(\n"
                + "    event_message,\n"
                + "    event_type,\n"
                + "    event_session_id,\n"
                + "    content=" + EVENTS + ",\n"
                + "    content_rowid=id\n)";
    }

    /**
     * external content FTS5 이므로 삭제는 'delete' 명령으로 한다.
     * 갱신 트리거는 event_data 변경에만 반응 (synced_at 갱신은 색인과 무관).
     */
    public static List<String> createFtsTriggers() {
        String cols = "event_message, event_type, event_session_id";
        return List.of(
                "CREATE TRIGGER IF NOT EXISTS " + FTS + "_insert AFTER INSERT ON " + EVENTS + "\n"
                        + "WHEN new.event_message IS NOT NULL\nBEGIN\n"
                        + "    INSERT INTO " + FTS + "(rowid, " + cols + ")\n"
                        + "    VALUES (new.id, new.event_message, new.event_type, new.event_session_id);\nEND",
                "CREATE TRIGGER IF NOT EXISTS " + FTS + "_delete AFTER DELETE ON " + EVENTS + "\n"
                        + "WHEN old.event_message IS NOT NULL\nBEGIN\n"
                        + "    INSERT INTO " + FTS + "(" + FTS + ", rowid, " + cols + ")\n"
                        + "    VALUES ('delete', old.id, old.event_message, old.event_type, old.event_session_id);\nEND",
                "CREATE TRIGGER IF NOT EXISTS " + FTS + "_update AFTER UPDATE OF event_data ON " + EVENTS + "\n"
                        + "BEGIN\n"
                        + "    INSERT INTO " + FTS + "(" + FTS + ", rowid, " + cols + ")\n"
                        + "    SELECT 'delete', old.id, old.event_message, old.event_type, old.event_session_id\n"
                        + "    WHERE old.event_message IS NOT NULL;\n"
                        + "    INSERT INTO " + FTS + "(rowid, " + cols + ")\n"
                        + "    SELECT new.id, new.event_message, new.event_type, new.event_session_id\n"
                        + "    WHERE new.event_message IS NOT NULL;\nEND");
    }

    /** 색인 전체를 비우고 메시지가 있는 행만 다시 넣는다 */
    public static List<String> repopulateFts() {
        return List.of(
                "INSERT INTO " + FTS + "(" + FTS + ") VALUES ('delete-all')",
                "INSERT INTO " + FTS + "(rowid, event_message, event_type, event_session_id)\n"
                        + "SELECT id, event_message, event_type, event_session_id FROM " + EVENTS + "\n"
                        + "WHERE event_message IS NOT NULL");
    }

    public static String createFileState() {
        return "CREATE TABLE IF NOT EXISTS " + FILE_STATE + " (\n"
                + "    file_name TEXT PRIMARY KEY,\n"
                + "    last_line INTEGER NOT NULL DEFAULT 0,\n"
                + "    updated_at DATETIME DEFAULT CURRENT_TIMESTAMP\n)";
    }
}
