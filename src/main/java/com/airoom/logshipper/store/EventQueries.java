package com.airoom.logshipper.store;

import com.airoom.logshipper.event.EventStatistics;
import com.airoom.logshipper.event.StoredEvent;

import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static com.airoom.logshipper.store.EventSchema.EVENTS;
import static com.airoom.logshipper.store.EventSchema.FTS;

/**
 * 외부 도구(조회, 뷰어)가 쓰는 읽기 전용 질의.
 * 수집 중인 프로세스와 동시에 열어도 WAL 덕분에 서로 막지 않는다.
 */
public class EventQueries implements AutoCloseable {

    private final SqliteDatabase db;

    EventQueries(SqliteDatabase db) {
        this.db = db;
    }

    public static EventQueries openReadOnly(Path dbFile) throws SQLException {
        return new EventQueries(SqliteDatabase.openReadOnly(dbFile));
    }

    /** FTS5 MATCH 구문 그대로 ("error AND timeout", "event_type:user" ...), 관련도 순 */
    public List<StoredEvent> search(String query, int limit) throws SQLException {
        String sql = "SELECT " + prefixed("e") + " FROM " + FTS + " f"
                + " JOIN " + EVENTS + " e ON e.id = f.rowid"
                + " WHERE " + FTS + " MATCH ? ORDER BY f.rank LIMIT ?";
        return db.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, query);
                ps.setInt(2, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    return SqliteEventStore.readRows(rs);
                }
            }
        });
    }

    public List<StoredEvent> sessionEvents(String sessionId) throws SQLException {
        return db.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + SqliteEventStore.ROW_COLUMNS
                    + " FROM " + EVENTS + " WHERE event_session_id = ? ORDER BY event_timestamp, id")) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    return SqliteEventStore.readRows(rs);
                }
            }
        });
    }

    public EventStatistics statistics() throws SQLException {
        return db.withConnection(c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(*), COUNT(DISTINCT event_session_id),"
                         + " COUNT(DISTINCT file_name), COUNT(*) - COUNT(synced_at),"
                         + " MIN(event_timestamp), MAX(event_timestamp) FROM " + EVENTS)) {
                rs.next();
                return new EventStatistics(rs.getLong(1), rs.getLong(2), rs.getLong(3), rs.getLong(4),
                        rs.getString(5), rs.getString(6));
            }
        });
    }

    @Override
    public void close() throws SQLException {
        db.close();
    }

    private static String prefixed(String alias) {
        StringBuilder sb = new StringBuilder();
        for (String col : SqliteEventStore.ROW_COLUMNS.split(",\\s*")) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(alias).append('.').append(col);
        }
        return sb.toString();
    }
}
