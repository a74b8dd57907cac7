package com.airoom.logshipper.network;

import com.airoom.logshipper.event.SyncStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 로컬 저장소를 쓸 수 없을 때의 메모리 대기열.
 * 수집 쪽은 넣기만 하고(네트워크 없음) 같은 동기화 워커가 비운다.
 * 가득 차면 새 항목을 받지 않는다. 수집 쪽은 받아들여진 줄까지만 커서를 옮기고
 * 나머지는 큐가 비워진 뒤 다시 읽는다.
 */
public class DirectForwardQueue implements PendingEventSource {

    private static final Logger log = LoggerFactory.getLogger(DirectForwardQueue.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Deque<PendingEvent> queue = new ArrayDeque<>();
    private long nextId = 1;
    private long delivered;
    private long refused;

    public DirectForwardQueue() { this(DEFAULT_CAPACITY); }
    public DirectForwardQueue(int capacity) { this.capacity = capacity; }

    /**
     * id 는 큐가 새로 매긴다.
     * @return 들어간 항목, 큐가 가득 찼으면 null
     */
    public synchronized PendingEvent enqueue(PendingEvent event) {
        if (queue.size() >= capacity) {
            refused++;
            log.debug("[Direct] queue full ({}), refused {}:{}", capacity, event.fileName(), event.lineNumber());
            return null;
        }
        PendingEvent e = new PendingEvent(nextId++, event.fileName(), event.lineNumber(), event.eventData(),
                event.gitRemoteUrl(), event.gitCommitHash());
        queue.addLast(e);
        return e;
    }

    @Override
    public synchronized List<PendingEvent> fetch(int limit) {
        List<PendingEvent> out = new ArrayList<>(Math.min(limit, queue.size()));
        Iterator<PendingEvent> it = queue.iterator();
        while (it.hasNext() && out.size() < limit) out.add(it.next());
        return out;
    }

    @Override
    public synchronized void acknowledge(PendingEvent event) {
        if (queue.removeIf(e -> e.id() == event.id())) delivered++;
    }

    @Override
    public synchronized SyncStats stats() {
        return new SyncStats(delivered + queue.size(), delivered, queue.size());
    }

    public synchronized int size() { return queue.size(); }
    public synchronized long refused() { return refused; }
}
