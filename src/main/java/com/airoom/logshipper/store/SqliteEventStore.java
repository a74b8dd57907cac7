package com.airoom.logshipper.store;

import com.airoom.logshipper.event.NewEvent;
import com.airoom.logshipper.event.StoredEvent;
import com.airoom.logshipper.event.SyncStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.airoom.logshipper.store.EventSchema.EVENTS;

/** SQLite 기반 이벤트 저장소. 로컬 사본은 항상 원본 그대로 저장한다 */
public class SqliteEventStore implements EventStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteEventStore.class);

    private static final String INSERT = "INSERT OR IGNORE INTO " + EVENTS
            + " (file_name, line_number, event_data, user_name, git_remote_url, git_commit_hash)"
            + " SELECT ?1, ?2, ?3, ?4, ?5, ?6 WHERE json_valid(?3)";

    static final String ROW_COLUMNS = "id, file_name, line_number, event_data, user_name, inserted_at, "
            + "git_remote_url, git_commit_hash, synced_at, event_type, event_message, event_session_id, event_timestamp";

    private final SqliteDatabase db;
    private final String userName;

    SqliteEventStore(SqliteDatabase db, String userName) {
        this.db = db;
        this.userName = userName;
    }

    /**
     * 파일을 열고(없으면 생성) 스키마를 최신으로 맞춘다.
     * 마이그레이션이 끝나야 반환되므로 수집은 그 뒤에 시작된다.
     */
    public static SqliteEventStore open(Path dbFile, String userName) throws SQLException {
        SqliteDatabase db = SqliteDatabase.open(dbFile);
        try {
            SchemaMigrator.migrate(db);
        } catch (SQLException e) {
            db.close();
            throw e;
        }
        SchemaDocExporter.exportQuietly(db);
        log.info("[Store] local store ready → {}", dbFile);
        return new SqliteEventStore(db, userName);
    }

    public SqliteDatabase database() { return db; }

    @Override
    public int insertBatch(List<NewEvent> events) throws SQLException {
        if (events.isEmpty()) return 0;
        return db.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement(INSERT)) {
                for (NewEvent e : events) {
                    ps.setString(1, e.fileName());
                    ps.setInt(2, e.lineNumber());
                    ps.setString(3, e.eventData());
                    ps.setString(4, userName);
                    setNullable(ps, 5, e.gitRemoteUrl());
                    setNullable(ps, 6, e.gitCommitHash());
                    ps.addBatch();
                }
                int inserted = 0;
                for (int n : ps.executeBatch()) {
                    if (n > 0) inserted += n;
                }
                return inserted;
            }
        });
    }

    @Override
    public Set<Integer> invalidLines(List<NewEvent> events) throws SQLException {
        Set<Integer> invalid = new LinkedHashSet<>();
        if (events.isEmpty()) return invalid;
        return db.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT json_valid(?)")) {
                for (NewEvent e : events) {
                    ps.setString(1, e.eventData());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next() || rs.getInt(1) != 1) invalid.add(e.lineNumber());
                    }
                }
            }
            return invalid;
        });
    }

    @Override
    public List<StoredEvent> getUnsynced(int limit) throws SQLException {
        return db.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + ROW_COLUMNS + " FROM " + EVENTS
                    + " WHERE synced_at IS NULL ORDER BY id DESC LIMIT ?")) {
                ps.setInt(1, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    return readRows(rs);
                }
            }
        });
    }

    @Override
    public void markSynced(long eventId) throws SQLException {
        db.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE " + EVENTS
                    + " SET synced_at = CURRENT_TIMESTAMP WHERE id = ? AND synced_at IS NULL")) {
                ps.setLong(1, eventId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public SyncStats syncStats() throws SQLException {
        return db.withConnection(c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(*), COUNT(synced_at) FROM " + EVENTS)) {
                if (!rs.next()) return SyncStats.EMPTY;
                long total = rs.getLong(1);
                long synced = rs.getLong(2);
                return new SyncStats(total, synced, total - synced);
            }
        });
    }

    @Override
    public void close() throws SQLException {
        db.close();
    }

    static List<StoredEvent> readRows(ResultSet rs) throws SQLException {
        List<StoredEvent> out = new ArrayList<>();
        while (rs.next()) {
            out.add(new StoredEvent(
                    rs.getLong("id"),
                    rs.getString("file_name"),
                    rs.getInt("line_number"),
                    rs.getString("event_data"),
                    rs.getString("user_name"),
                    rs.getString("inserted_at"),
                    rs.getString("git_remote_url"),
                    rs.getString("git_commit_hash"),
                    rs.getString("synced_at"),
                    rs.getString("event_type"),
                    rs.getString("event_message"),
                    rs.getString("event_session_id"),
                    rs.getString("event_timestamp")));
        }
        return out;
    }

    private static void setNullable(PreparedStatement ps, int idx, String v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.VARCHAR);
        else ps.setString(idx, v);
    }
}
