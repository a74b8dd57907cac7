package com.airoom.logshipper.network;

import com.airoom.logshipper.event.RemoteEvent;
import com.airoom.logshipper.redact.EventRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 미동기화 이벤트를 원격으로 보내는 백그라운드 워커 (지수 백오프).
 *
 * 한 주기:
 *  - 최대 batchSize 개를 가져온다. 없으면 idle 간격 뒤 다시.
 *  - 하나씩 마스킹 → 전송 → 확인 표시 → throttle 만큼 쉼.
 *  - 실패하면 배치를 바로 멈추고 백오프 뒤에 주기 전체를 다시.
 * 로컬 원본은 읽기만 한다.
 */
public class SyncWorker {

    private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);

    public enum State { IDLE, SENDING, BACKOFF, STOPPED }

    private final PendingEventSource source;
    private final CollectorClient client;
    private final EventRedactor redactor;
    private final int batchSize;
    private final Duration idleInterval;
    private final Duration throttle;
    private final Backoff backoff;
    private final Duration stopTimeout;

    private final ScheduledExecutorService ses;
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private ScheduledFuture<?> future;
    private volatile State state = State.IDLE;
    private volatile long deliveredTotal;

    public SyncWorker(PendingEventSource source, CollectorClient client, EventRedactor redactor,
                      int batchSize, Duration idleInterval, Duration throttle,
                      Backoff backoff, Duration stopTimeout) {
        this.source = source;
        this.client = client;
        this.redactor = redactor;
        this.batchSize = batchSize;
        this.idleInterval = idleInterval;
        this.throttle = throttle;
        this.backoff = backoff;
        this.stopTimeout = stopTimeout;
        this.ses = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        log.info("[Sync] worker started (batch={}, throttle={}ms)", batchSize, throttle.toMillis());
        scheduleNext(Duration.ZERO);
    }

    /** 대기 중인 주기를 취소하고 바로 한 번 돈다 */
    public void flushNow() {
        if (!stopping.get()) scheduleNext(Duration.ZERO);
    }

    /**
     * 멈춤 신호를 보내고 최대 stopTimeout 동안 기다린다.
     * @return 제한 시간 안에 끝났으면 true
     */
    public boolean stop() {
        if (!stopping.compareAndSet(false, true)) return ses.isTerminated();
        stopSignal.countDown();
        synchronized (this) {
            if (future != null) future.cancel(false);
        }
        ses.shutdown();
        boolean done;
        try {
            done = ses.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            done = false;
        }
        if (!done) {
            log.warn("[Sync] worker did not stop within {}s, abandoning", stopTimeout.toSeconds());
            ses.shutdownNow();
        }
        state = State.STOPPED;
        log.info("[Sync] worker stopped (delivered {} this run)", deliveredTotal);
        return done;
    }

    public State state() { return state; }
    public Duration currentBackoff() { return backoff.current(); }
    public long deliveredTotal() { return deliveredTotal; }

    private synchronized void scheduleNext(Duration delay) {
        if (stopping.get()) return;
        if (future != null) future.cancel(false);
        try {
            future = ses.schedule(this::cycle, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[Sync] executor already shut down");
        }
    }

    private void cycle() {
        if (stopping.get()) return;
        Duration next;
        try {
            next = runCycle();
        } catch (RuntimeException e) {
            log.error("[Sync] unexpected error in sync cycle", e);
            next = backoff.onFailure();
            state = State.BACKOFF;
        }
        scheduleNext(next);
    }

    /** 한 주기 실행 후 다음 주기까지의 대기 시간을 돌려준다 */
    Duration runCycle() {
        List<PendingEvent> batch;
        try {
            batch = source.fetch(batchSize);
        } catch (SQLException e) {
            log.error("[Sync] cannot read pending events: {}", e.getMessage());
            state = State.BACKOFF;
            return backoff.onFailure();
        }

        if (batch.isEmpty()) {
            state = State.IDLE;
            return idleInterval;
        }

        state = State.SENDING;
        int sent = 0;
        boolean failed = false;
        for (PendingEvent e : batch) {
            if (stopping.get()) break;

            RemoteEvent remote = new RemoteEvent(e.fileName(), e.lineNumber(), redactor.redact(e.eventData()),
                    e.gitRemoteUrl(), e.gitCommitHash());
            DeliveryResult result = client.submit(remote);
            if (result != DeliveryResult.DELIVERED) {
                failed = true;
                break;
            }

            try {
                source.acknowledge(e);
            } catch (SQLException ex) {
                log.error("[Sync] delivered event {} but could not mark it synced: {}", e.id(), ex.getMessage());
                failed = true;
                break;
            }
            sent++;
            deliveredTotal++;
            backoff.reset();

            if (pause(throttle)) break;
        }

        if (sent > 0) log.info("[Sync] synced {} of {} events", sent, batch.size());
        if (failed) {
            Duration delay = backoff.onFailure();
            state = State.BACKOFF;
            log.warn("[Sync] remote delivery failed, retrying in {}s", delay.toMillis() / 1000.0);
            return delay;
        }
        // 남은 이벤트가 있을 수 있으니 바로 다음 배치
        return Duration.ZERO;
    }

    /** @return 멈춤 신호를 받았으면 true */
    private boolean pause(Duration d) {
        if (d.isZero()) return stopping.get();
        try {
            return stopSignal.await(d.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
