package com.airoom.logshipper.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaMigratorTest {

    @TempDir
    Path dir;

    private SqliteDatabase db;

    @BeforeEach
    void setUp() throws Exception {
        db = SqliteDatabase.open(dir.resolve("legacy.db"));
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    @Test
    void freshDatabaseGetsFullSchemaAndSecondRunIsNoop() throws Exception {
        List<String> first = SchemaMigrator.migrate(db);
        List<String> second = SchemaMigrator.migrate(db);

        assertThat(first).contains(SchemaMigrator.STEP_CREATE, SchemaMigrator.STEP_CREATE_FTS);
        assertThat(second).isEmpty();
        assertThat(columns()).contains("synced_at", "event_message", "event_output_tokens");
    }

    @Test
    void addsSyncTrackingColumnInPlace() throws Exception {
        SchemaMigrator.migrate(db);
        exec("INSERT INTO conversation_events (file_name, line_number, event_data) VALUES ('a.jsonl', 1, '{\"type\":\"user\"}')");
        // synced_at 이 없던 시절의 테이블 흉내: 컬럼만 빠진 스키마로 재생성
        exec("CREATE TABLE old_copy AS SELECT id, file_name, line_number, event_data FROM conversation_events");
        exec("DROP TABLE conversation_events");
        exec(EventSchema.createEventsTable("conversation_events")
                .replace("    synced_at DATETIME DEFAULT NULL,\n", ""));
        exec("INSERT INTO conversation_events (id, file_name, line_number, event_data) SELECT * FROM old_copy");
        assertThat(columns()).doesNotContain("synced_at");

        List<String> steps = SchemaMigrator.migrate(db);

        assertThat(steps).contains(SchemaMigrator.STEP_ADD_SYNCED_AT).doesNotContain(SchemaMigrator.STEP_REBUILD);
        assertThat(columns()).contains("synced_at");
        assertThat(query("SELECT COUNT(*) FROM conversation_events WHERE synced_at IS NULL")).isEqualTo("1");
    }

    @Test
    void rebuildsTableWhenDerivedColumnsMissingAndKeepsViews() throws Exception {
        exec("CREATE TABLE conversation_events (\n"
                + " id INTEGER PRIMARY KEY AUTOINCREMENT,\n"
                + " file_name TEXT NOT NULL,\n"
                + " line_number INTEGER NOT NULL,\n"
                + " event_data TEXT NOT NULL,\n"
                + " user_name TEXT,\n"
                + " inserted_at DATETIME DEFAULT CURRENT_TIMESTAMP,\n"
                + " event_type TEXT GENERATED ALWAYS AS (json_extract(event_data, '$.type')) STORED,\n"
                + " UNIQUE(file_name, line_number))");
        exec("CREATE VIEW user_events AS SELECT id, file_name FROM conversation_events WHERE event_type = 'user'");
        exec("INSERT INTO conversation_events (file_name, line_number, event_data, user_name) VALUES "
                + "('a.jsonl', 1, '{\"type\":\"user\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"legacy words\"}]}}', 'old'),"
                + "('a.jsonl', 2, '{\"type\":\"assistant\",\"message\":{\"model\":\"m1\"}}', 'old')");

        List<String> steps = SchemaMigrator.migrate(db);

        assertThat(steps).contains(SchemaMigrator.STEP_REBUILD, SchemaMigrator.STEP_POPULATE_FTS);
        assertThat(columns()).contains("event_model", "event_message", "synced_at", "git_remote_url");
        assertThat(query("SELECT COUNT(*) FROM conversation_events")).isEqualTo("2");
        assertThat(query("SELECT user_name FROM conversation_events WHERE line_number = 1")).isEqualTo("old");
        assertThat(query("SELECT event_model FROM conversation_events WHERE line_number = 2")).isEqualTo("m1");
        assertThat(query("SELECT COUNT(*) FROM user_events")).isEqualTo("1");
        assertThat(query("SELECT COUNT(*) FROM messages_fts WHERE messages_fts MATCH 'legacy'")).isEqualTo("1");
        assertThat(query("SELECT COUNT(*) FROM sqlite_master WHERE name = 'conversation_events_new'")).isEqualTo("0");

        // AUTOINCREMENT 가 이어져야 한다
        exec("INSERT INTO conversation_events (file_name, line_number, event_data) VALUES ('a.jsonl', 3, '{}')");
        assertThat(query("SELECT MAX(id) FROM conversation_events")).isEqualTo("3");
    }

    @Test
    void repopulatesMissingSearchIndex() throws Exception {
        SchemaMigrator.migrate(db);
        exec("INSERT INTO conversation_events (file_name, line_number, event_data) VALUES "
                + "('a.jsonl', 1, '{\"type\":\"user\",\"message\":{\"content\":\"findable text\"}}')");
        for (String t : EventSchema.FTS_TRIGGERS) exec("DROP TRIGGER " + t);
        exec("DROP TABLE messages_fts");

        List<String> steps = SchemaMigrator.migrate(db);

        assertThat(steps).containsExactly(SchemaMigrator.STEP_CREATE_FTS, SchemaMigrator.STEP_POPULATE_FTS);
        assertThat(query("SELECT COUNT(*) FROM messages_fts WHERE messages_fts MATCH 'findable'")).isEqualTo("1");
    }

    @Test
    void emptySearchIndexIsRefilled() throws Exception {
        SchemaMigrator.migrate(db);
        exec("INSERT INTO conversation_events (file_name, line_number, event_data) VALUES "
                + "('a.jsonl', 1, '{\"type\":\"user\",\"content\":\"orphaned\"}')");
        exec("INSERT INTO messages_fts(messages_fts) VALUES ('delete-all')");

        assertThat(SchemaMigrator.migrate(db)).containsExactly(SchemaMigrator.STEP_POPULATE_FTS);
        assertThat(query("SELECT COUNT(*) FROM messages_fts WHERE messages_fts MATCH 'orphaned'")).isEqualTo("1");
    }

    private List<String> columns() throws SQLException {
        return db.withConnection(c -> List.copyOf(SchemaMigrator.columns(c, "conversation_events")));
    }

    private void exec(String sql) throws SQLException {
        db.withConnection(c -> {
            try (Statement st = c.createStatement()) {
                st.execute(sql);
            }
            return null;
        });
    }

    private String query(String sql) throws SQLException {
        return db.withConnection(c -> {
            try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
                return rs.next() ? rs.getString(1) : null;
            }
        });
    }
}
