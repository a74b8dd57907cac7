package com.airoom.logshipper.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static com.airoom.logshipper.store.EventSchema.EVENTS;
import static com.airoom.logshipper.store.EventSchema.FILE_STATE;
import static com.airoom.logshipper.store.EventSchema.FTS;

/** DB 파일 옆에 SCHEMA.md 를 남긴다 (조회 도구 사용자가 참고) */
public final class SchemaDocExporter {

    private static final Logger log = LoggerFactory.getLogger(SchemaDocExporter.class);

    public static final String FILE_NAME = "SCHEMA.md";

    private SchemaDocExporter() {}

    /** 실패해도 수집에는 영향 없음 - WARN 만 남긴다 */
    static void exportQuietly(SqliteDatabase db) {
        try {
            export(db);
        } catch (IOException | SQLException e) {
            log.warn("[Store] could not write {}: {}", FILE_NAME, e.getMessage());
        }
    }

    public static Path export(SqliteDatabase db) throws IOException, SQLException {
        Path target = db.file().toAbsolutePath().resolveSibling(FILE_NAME);
        String doc = db.withConnection(SchemaDocExporter::render);
        Files.writeString(target, doc, StandardCharsets.UTF_8);
        log.debug("[Store] schema documentation → {}", target);
        return target;
    }

    static String render(Connection c) throws SQLException {
        StringBuilder md = new StringBuilder();
        md.append("# Database Schema\n\n")
          .append("Generated automatically on startup. Open the database read-only when querying it ")
          .append("while the shipper is running.\n\n");

        md.append("## ").append(EVENTS).append("\n\n")
          .append("| Column | Type | Kind |\n|---|---|---|\n");
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_xinfo(" + EVENTS + ")")) {
            while (rs.next()) {
                int hidden = rs.getInt("hidden");
                String kind = (hidden == 2 || hidden == 3) ? "generated from event_data" : "stored";
                md.append("| ").append(rs.getString("name")).append(" | ")
                  .append(rs.getString("type")).append(" | ").append(kind).append(" |\n");
            }
        }
        md.append("\nUnique key: `(file_name, line_number)`. `synced_at` is NULL until the remote ")
          .append("collector acknowledged the event.\n\n");

        md.append("## ").append(FILE_STATE).append("\n\n")
          .append("One row per source file: `file_name` (relative path), `last_line`, `updated_at`.\n\n");

        md.append("## Indexes\n\n");
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT name, tbl_name FROM sqlite_master "
                     + "WHERE type = 'index' AND name LIKE 'idx_%' ORDER BY name")) {
            while (rs.next()) {
                md.append("- `").append(rs.getString(1)).append("` on ").append(rs.getString(2)).append('\n');
            }
        }

        md.append("\n## Full-text search\n\n")
          .append("`").append(FTS).append("` (FTS5) indexes `event_message`, `event_type` and ")
          .append("`event_session_id`; rowid equals `").append(EVENTS).append(".id`.\n\n")
          .append("```sql\nSELECT e.* FROM ").append(FTS).append(" f JOIN ").append(EVENTS)
          .append(" e ON e.id = f.rowid\nWHERE ").append(FTS).append(" MATCH 'timeout AND retry'\n")
          .append("ORDER BY f.rank LIMIT 20;\n```\n");
        return md.toString();
    }
}
