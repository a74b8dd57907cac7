package com.airoom.logshipper.monitor;

import com.airoom.logshipper.util.JsonlFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * 감시 루트 아래 *.jsonl 의 생성/수정 알림을 받아 파이프라인에 넘긴다.
 *
 * - 하위 디렉터리까지 재귀 등록 (새로 생긴 프로젝트 디렉터리도 등록)
 * - 접근할 수 없는 디렉터리는 건너뜀
 * - 시작 시 sweep() 한 번으로 꺼져 있던 동안의 변경을 따라잡는다
 * - 알림 누락(OVERFLOW) 시 전체 sweep
 * - 직접 전송 큐가 가득 차 멈춘 파일은 10초마다 다시 시도
 * 처리는 이 스레드에서 한 파일씩 순서대로 한다.
 */
public class ConversationWatcher implements Runnable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConversationWatcher.class);

    private static final long RESUME_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(10);

    private final WatchService ws = FileSystems.getDefault().newWatchService();
    private final IngestionPipeline pipeline;
    private final Path root;
    private volatile boolean closed;

    public ConversationWatcher(IngestionPipeline pipeline) throws IOException {
        this.pipeline = pipeline;
        this.root = pipeline.root();
        registerRecursiveSafe(root);
        log.info("[Watcher] ready → {}", root);
    }

    /** 루트 아래 모든 .jsonl 을 한 번씩 처리. @return 처리한 파일 수 */
    public int sweep() {
        List<Path> files;
        try {
            files = JsonlFiles.listAll(root);
        } catch (IOException e) {
            log.error("[Watcher] sweep failed: {}", e.getMessage());
            return 0;
        }
        log.info("[Watcher] scanning {} existing file(s)", files.size());
        for (Path f : files) {
            if (closed) break;
            pipeline.processSafely(f);
        }
        return files.size();
    }

    /* 메인 루프 - close() 로 WatchService 를 닫으면 끝난다 */
    @Override public void run() {
        try {
            long lastResume = System.nanoTime();
            while (!closed) {
                WatchKey key = ws.poll(10, TimeUnit.SECONDS);
                if (key != null) {
                    handle(key);
                    key.reset();
                }
                if (pipeline.hasBacklog() && System.nanoTime() - lastResume >= RESUME_INTERVAL_NANOS) {
                    pipeline.resumeBacklogged();
                    lastResume = System.nanoTime();
                }
            }
        } catch (ClosedWatchServiceException e) {
            log.debug("[Watcher] watch service closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Watcher] stopped");
    }

    void handle(WatchKey key) {
        Path base = (Path) key.watchable();
        for (WatchEvent<?> ev : key.pollEvents()) {
            if (ev.kind() == OVERFLOW) {
                log.warn("[Watcher] event overflow, rescanning");
                sweep();
                continue;
            }
            Path p = base.resolve((Path) ev.context());
            if (ev.kind() == ENTRY_CREATE && Files.isDirectory(p)) {
                // 새 디렉터리: 등록 전에 생긴 파일은 sweep 으로 따라잡음
                registerRecursiveSafe(p);
                sweepDirectory(p);
                continue;
            }
            if (JsonlFiles.isJsonl(p)) pipeline.processSafely(p);
        }
    }

    private void sweepDirectory(Path dir) {
        try {
            for (Path f : JsonlFiles.listAll(dir)) pipeline.processSafely(f);
        } catch (IOException e) {
            log.warn("[Watcher] cannot scan new directory {}: {}", dir, e.getMessage());
        }
    }

    @Override
    public void close() throws IOException {
        closed = true;
        ws.close();
    }

    /** 접근 가능한 디렉터리만 재귀 등록, 실패 폴더는 건너뜀 */
    private void registerRecursiveSafe(Path start) {
        if (!Files.isDirectory(start)) return;
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    try {
                        dir.register(ws, ENTRY_CREATE, ENTRY_MODIFY);
                    } catch (IOException | SecurityException ex) {
                        log.debug("[Watcher] SKIP (not accessible): {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
            });
        } catch (IOException e) {
            log.warn("[Watcher] cannot register {}: {}", start, e.getMessage());
        }
    }
}
