package com.airoom.logshipper.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite 파일 하나에 대한 단일 연결.
 *
 * 수집 스레드와 동기화 스레드가 같은 연결을 쓰므로 모든 접근은 이 객체의 락 아래에서 한다.
 * WAL 저널이라 다른 프로세스(조회 도구, 뷰어)는 읽기 전용 연결로 동시에 읽을 수 있다.
 */
public final class SqliteDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteDatabase.class);

    static final int BUSY_TIMEOUT_MS = 30_000;

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private final Path file;
    private final Connection conn;

    private SqliteDatabase(Path file, Connection conn) {
        this.file = file;
        this.conn = conn;
    }

    /** 읽기/쓰기 연결. 상위 디렉터리가 없으면 만든다 */
    public static SqliteDatabase open(Path file) throws SQLException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SQLException("Cannot create database directory for " + file, e);
        }

        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setJournalMode(SQLiteConfig.JournalMode.WAL);
        cfg.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        cfg.setBusyTimeout(BUSY_TIMEOUT_MS);
        Connection c = cfg.createConnection("jdbc:sqlite:" + file.toAbsolutePath());
        try (Statement st = c.createStatement()) {
            // 드라이버 설정이 적용 안 된 경우 대비
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        } catch (SQLException e) {
            c.close();
            throw e;
        }
        log.debug("[Store] opened {} (WAL)", file);
        return new SqliteDatabase(file, c);
    }

    /** 외부 도구용 읽기 전용 연결 */
    public static SqliteDatabase openReadOnly(Path file) throws SQLException {
        if (!Files.exists(file)) throw new SQLException("Database does not exist: " + file);
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setReadOnly(true);
        cfg.setBusyTimeout(BUSY_TIMEOUT_MS);
        return new SqliteDatabase(file, cfg.createConnection("jdbc:sqlite:" + file.toAbsolutePath()));
    }

    public Path file() { return file; }

    public synchronized <T> T withConnection(SqlWork<T> work) throws SQLException {
        return work.run(conn);
    }

    /** 트랜잭션 하나로 실행. 예외 시 롤백 후 다시 던진다 */
    public synchronized <T> T inTransaction(SqlWork<T> work) throws SQLException {
        conn.setAutoCommit(false);
        try {
            T result = work.run(conn);
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            try {
                conn.rollback();
            } catch (SQLException re) {
                e.addSuppressed(re);
            }
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    @Override
    public synchronized void close() throws SQLException {
        if (!conn.isClosed()) conn.close();
    }
}
