package com.airoom.logshipper;

import com.airoom.logshipper.config.ConfigException;
import com.airoom.logshipper.config.ShipperConfig;
import com.airoom.logshipper.event.SyncStats;
import com.airoom.logshipper.git.GitCommandResolver;
import com.airoom.logshipper.monitor.ConversationWatcher;
import com.airoom.logshipper.monitor.IngestionPipeline;
import com.airoom.logshipper.network.Backoff;
import com.airoom.logshipper.network.CollectorClient;
import com.airoom.logshipper.network.DirectForwardQueue;
import com.airoom.logshipper.network.PendingEventSource;
import com.airoom.logshipper.network.StorePendingSource;
import com.airoom.logshipper.network.SyncWorker;
import com.airoom.logshipper.redact.EventRedactor;
import com.airoom.logshipper.redact.PatternSecretClassifier;
import com.airoom.logshipper.server.ShipperStatus;
import com.airoom.logshipper.server.StatusServer;
import com.airoom.logshipper.store.CursorTracker;
import com.airoom.logshipper.store.InMemoryCursorTracker;
import com.airoom.logshipper.store.SqliteCursorTracker;
import com.airoom.logshipper.store.SqliteDatabase;
import com.airoom.logshipper.store.SqliteEventStore;
import com.airoom.logshipper.util.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.OptionalLong;
import java.util.Properties;

public class LogShipperMain {

    private static final Logger log = LoggerFactory.getLogger(LogShipperMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    /** 감시 루프가 끝날 때까지 블록. 종료 코드 반환 */
    static int run(String[] args) {
        boolean skipBacklogArg = Arrays.asList(args).contains("--skip-backlog");

        ShipperConfig config;
        try {
            config = ShipperConfig.load();
        } catch (ConfigException e) {
            log.error("[LogShipper] {}: {}", e.getMessage(), e.getCause() == null ? "" : e.getCause().getMessage());
            return EXIT_FAILURE;
        }
        String version = version();
        log.info("[LogShipper] starting v{} {}", version, config);

        /* 0) 단일 실행 보장 */
        ProcessSupervisor supervisor = new ProcessSupervisor(config.getHomeDir());
        try {
            if (!supervisor.tryAcquire()) {
                OptionalLong pid = supervisor.runningPid();
                log.info("[LogShipper] already running{}. Exit.", pid.isPresent() ? " (pid " + pid.getAsLong() + ")" : "");
                return EXIT_OK;
            }
        } catch (IOException e) {
            log.error("[LogShipper] cannot acquire instance lock: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        Path root = config.getConversationDir();
        if (!Files.isDirectory(root)) {
            log.error("[LogShipper] conversation directory not found: {}", root);
            supervisor.close();
            return EXIT_FAILURE;
        }

        /* 1) 로컬 저장소 (실패해도 원격 경로가 살아 있으면 계속) */
        SqliteEventStore store = null;
        SqliteDatabase cursorDb = null;
        CursorTracker cursors = null;
        if (config.isSqliteEnabled()) {
            try {
                store = SqliteEventStore.open(config.getDatabasePath(), config.getUserName());
                cursors = new SqliteCursorTracker(store.database());
            } catch (SQLException e) {
                log.error("[Store] local recording disabled: {}", e.getMessage());
                if (store != null) closeQuietly(store);
                store = null;
            }
        }
        if (cursors == null) {
            try {
                cursorDb = SqliteDatabase.open(config.getDatabasePath());
                cursors = new SqliteCursorTracker(cursorDb);
            } catch (SQLException e) {
                log.warn("[Cursor] database unusable, cursors kept in memory only: {}", e.getMessage());
                if (cursorDb != null) closeQuietly(cursorDb);
                cursorDb = null;
                cursors = new InMemoryCursorTracker();
            }
        }

        /* 2) 원격 수집 서버 */
        CollectorClient client = null;
        if (config.isRemoteConfigured()) {
            CollectorClient c = new CollectorClient(config.getApiUrl(), config.getApiKey(),
                    config.getConnectTimeoutMs(), config.getReadTimeoutMs(), "AIRoomLogShipper/" + version);
            if (c.probe()) client = c;
            else log.warn("[Sync] remote sync disabled for this run, local recording continues");
        } else if (config.isApiEnabled()) {
            log.warn("[Sync] api enabled but url or api key missing, remote sync disabled");
        }

        if (store == null && client == null) {
            log.error("[LogShipper] neither local store nor remote collector is usable. Exit.");
            shutdown(null, null, null, null, cursorDb, supervisor);
            return EXIT_FAILURE;
        }

        /* 3) 동기화 워커 */
        EventRedactor redactor = new EventRedactor(new PatternSecretClassifier());
        DirectForwardQueue direct = (store == null) ? new DirectForwardQueue() : null;
        SyncWorker worker = null;
        PendingEventSource source = null;
        if (client != null) {
            source = (store != null) ? new StorePendingSource(store) : direct;
            worker = new SyncWorker(source, client, redactor,
                    config.getSyncBatchSize(), config.getSyncIdleInterval(), config.getSyncThrottle(),
                    new Backoff(config.getInitialBackoff(), config.getMaxBackoff()), config.getStopTimeout());
            worker.start();
        }

        /* 4) 수집 파이프라인 + 감시 */
        IngestionPipeline pipeline = new IngestionPipeline(root, config.getDebugFilterProject(), cursors,
                store, direct, redactor, new GitCommandResolver());
        ConversationWatcher watcher;
        try {
            watcher = new ConversationWatcher(pipeline);
        } catch (IOException e) {
            log.error("[Watcher] cannot start file watcher: {}", e.getMessage());
            shutdown(null, worker, null, store, cursorDb, supervisor);
            return EXIT_FAILURE;
        }

        if (skipBacklogArg || config.isSkipBacklog()) {
            try {
                cursors.fastForwardAll(root, config.getDebugFilterProject());
            } catch (IOException | SQLException e) {
                log.error("[Cursor] skip-backlog failed, falling back to full scan: {}", e.getMessage());
                watcher.sweep();
            }
        } else {
            watcher.sweep();
        }

        /* 5) 상태 서버 (선택) */
        StatusServer status = null;
        if (config.isStatusEnabled()) {
            String startedAt = Instant.now().toString();
            boolean local = store != null;
            CursorTracker c = cursors;
            PendingEventSource s = source != null ? source : (store != null ? new StorePendingSource(store) : direct);
            SyncWorker w = worker;
            try {
                status = new StatusServer(config.getStatusPort(),
                        () -> snapshot(version, startedAt, local, c, s, w),
                        w == null ? null : w::flushNow);
                status.start();
            } catch (IOException e) {
                log.warn("[Status] status server not started: {}", e.getMessage());
            }
        }

        final SyncWorker fw = worker;
        final StatusServer fs = status;
        final SqliteEventStore fst = store;
        final SqliteDatabase fdb = cursorDb;
        Runtime.getRuntime().addShutdownHook(new Thread(
                () -> shutdown(watcher, fw, fs, fst, fdb, supervisor), "shipper-shutdown"));

        log.info("[LogShipper] running (local={}, remote={})", store != null, client != null);
        watcher.run();
        return EXIT_OK;
    }

    static ShipperStatus snapshot(String version, String startedAt, boolean local, CursorTracker cursors,
                                  PendingEventSource source, SyncWorker worker) {
        int tracked;
        SyncStats stats;
        try {
            tracked = cursors.trackedFileCount();
            stats = source.stats();
        } catch (SQLException e) {
            throw new IllegalStateException("store unavailable: " + e.getMessage(), e);
        }
        return ShipperStatus.of(version, startedAt, local, worker != null, tracked, stats,
                worker == null ? "disabled" : worker.state().name().toLowerCase(),
                worker == null ? 0 : worker.currentBackoff().toMillis());
    }

    private static synchronized void shutdown(ConversationWatcher watcher, SyncWorker worker, StatusServer status,
                                              SqliteEventStore store, SqliteDatabase cursorDb,
                                              ProcessSupervisor supervisor) {
        if (watcher != null) {
            try {
                watcher.close();
            } catch (IOException e) {
                log.debug("[Watcher] close failed: {}", e.getMessage());
            }
        }
        if (worker != null) worker.stop();
        if (status != null) status.close();
        if (store != null) closeQuietly(store);
        if (cursorDb != null) closeQuietly(cursorDb);
        supervisor.close();
    }

    private static void closeQuietly(AutoCloseable c) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("[LogShipper] close failed: {}", e.getMessage());
        }
    }

    static String version() {
        Properties p = new Properties();
        try (InputStream is = LogShipperMain.class.getClassLoader().getResourceAsStream("shipper.properties")) {
            if (is != null) p.load(is);
        } catch (IOException e) {
            log.debug("[LogShipper] shipper.properties unreadable: {}", e.getMessage());
        }
        return p.getProperty("shipper.version", "1.0.0");
    }
}
