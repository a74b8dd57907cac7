package com.airoom.logshipper.store;

import com.airoom.logshipper.event.DerivedColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.airoom.logshipper.store.EventSchema.EVENTS;
import static com.airoom.logshipper.store.EventSchema.FTS;

/**
 * 시작 시 현재 스키마 모양을 읽어 부족한 부분만 채운다. 버전 번호는 두지 않는다.
 *
 * 단계 (각각 다시 실행해도 안전):
 *  1) 테이블 없음 → 새로 생성
 *  2) 파생 컬럼 누락 → 새 스키마의 그림자 테이블로 재구성 (생성 컬럼은 ALTER 로 못 붙인다)
 *  3) synced_at 누락 → ALTER TABLE ADD COLUMN
 *  4) 인덱스/FTS/트리거/커서 테이블 보장
 *  5) FTS 가 새로 생겼거나 비었거나 재구성 직후면 다시 채움
 */
public final class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    static final String SHADOW = EVENTS + "_new";

    public static final String STEP_CREATE = "create-table";
    public static final String STEP_REBUILD = "rebuild-derived-columns";
    public static final String STEP_ADD_SYNCED_AT = "add-synced-at";
    public static final String STEP_CREATE_FTS = "create-fts";
    public static final String STEP_POPULATE_FTS = "populate-fts";

    private SchemaMigrator() {}

    /** @return 실제로 적용된 단계 이름들 (이미 최신이면 빈 리스트) */
    public static List<String> migrate(SqliteDatabase db) throws SQLException {
        List<String> applied = db.inTransaction(SchemaMigrator::migrate);
        if (applied.isEmpty()) log.debug("[Store] schema up to date");
        else log.info("[Store] schema migrated: {}", applied);
        return applied;
    }

    static List<String> migrate(Connection c) throws SQLException {
        List<String> applied = new ArrayList<>();

        boolean rebuilt = false;
        Set<String> cols = columns(c, EVENTS);
        if (cols.isEmpty()) {
            exec(c, EventSchema.createEventsTable(EVENTS));
            applied.add(STEP_CREATE);
        } else {
            if (missingDerived(cols)) {
                rebuild(c, cols);
                applied.add(STEP_REBUILD);
                rebuilt = true;
            } else if (!cols.contains("synced_at")) {
                exec(c, "ALTER TABLE " + EVENTS + " ADD COLUMN synced_at DATETIME DEFAULT NULL");
                applied.add(STEP_ADD_SYNCED_AT);
            }
        }

        for (String sql : EventSchema.createIndexes()) exec(c, sql);

        boolean ftsExisted = objectExists(c, "table", FTS);
        exec(c, EventSchema.createFts());
        if (!ftsExisted) applied.add(STEP_CREATE_FTS);
        // 예전 형식의 트리거가 남아 있을 수 있어 항상 새로 만든다
        for (String name : EventSchema.FTS_TRIGGERS) exec(c, "DROP TRIGGER IF EXISTS " + name);
        for (String sql : EventSchema.createFtsTriggers()) exec(c, sql);

        exec(c, EventSchema.createFileState());

        if (!ftsExisted || rebuilt || ftsOutOfDate(c)) {
            for (String sql : EventSchema.repopulateFts()) exec(c, sql);
            applied.add(STEP_POPULATE_FTS);
        }
        return applied;
    }

    private static boolean missingDerived(Set<String> cols) {
        for (DerivedColumn d : DerivedColumn.values()) {
            if (!cols.contains(d.column())) return true;
        }
        return false;
    }

    /** 그림자 테이블 재구성. 원본 컬럼만 옮기고 파생 컬럼은 엔진이 다시 계산한다 */
    private static void rebuild(Connection c, Set<String> oldCols) throws SQLException {
        log.info("[Store] derived columns missing, rebuilding {}", EVENTS);

        Map<String, String> views = dependentViews(c);
        for (String name : views.keySet()) exec(c, "DROP VIEW IF EXISTS \"" + name + "\"");

        // 이전에 중단된 재구성의 잔여물
        exec(c, "DROP TABLE IF EXISTS " + SHADOW);
        exec(c, EventSchema.createEventsTable(SHADOW));

        List<String> copy = new ArrayList<>();
        for (String col : EventSchema.BASE_COLUMNS) {
            if (oldCols.contains(col)) copy.add(col);
        }
        String list = String.join(", ", copy);
        exec(c, "INSERT INTO " + SHADOW + " (" + list + ") SELECT " + list + " FROM " + EVENTS);

        exec(c, "DROP TABLE " + EVENTS);
        exec(c, "ALTER TABLE " + SHADOW + " RENAME TO " + EVENTS);

        for (Map.Entry<String, String> v : views.entrySet()) {
            exec(c, v.getValue());
            log.info("[Store] recreated view {}", v.getKey());
        }
    }

    /** conversation_events 를 참조하는 뷰 (이름 → CREATE 문) */
    private static Map<String, String> dependentViews(Connection c) throws SQLException {
        Map<String, String> out = new LinkedHashMap<>();
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT name, sql FROM sqlite_master "
                     + "WHERE type = 'view' AND sql LIKE '%" + EVENTS + "%' ORDER BY name")) {
            while (rs.next()) out.put(rs.getString(1), rs.getString(2));
        }
        return out;
    }

    /** 메시지가 있는 행이 있는데 색인이 비어 있으면 true */
    private static boolean ftsOutOfDate(Connection c) throws SQLException {
        long indexed = count(c, "SELECT COUNT(*) FROM " + FTS + "_docsize");
        if (indexed > 0) return false;
        return count(c, "SELECT COUNT(*) FROM " + EVENTS + " WHERE event_message IS NOT NULL") > 0;
    }

    /** table_xinfo 는 생성 컬럼까지 보여준다 */
    static Set<String> columns(Connection c, String table) throws SQLException {
        Set<String> out = new LinkedHashSet<>();
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_xinfo(" + table + ")")) {
            while (rs.next()) out.add(rs.getString("name"));
        }
        return out;
    }

    private static boolean objectExists(Connection c, String type, String name) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1 FROM sqlite_master WHERE type = '" + type
                     + "' AND name = '" + name + "'")) {
            return rs.next();
        }
    }

    private static long count(Connection c, String sql) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private static void exec(Connection c, String sql) throws SQLException {
        try (Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }
}
