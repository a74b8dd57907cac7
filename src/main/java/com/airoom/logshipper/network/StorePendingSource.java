package com.airoom.logshipper.network;

import com.airoom.logshipper.event.EventPayloads;
import com.airoom.logshipper.event.StoredEvent;
import com.airoom.logshipper.event.SyncStats;
import com.airoom.logshipper.store.EventStore;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** 로컬 저장소의 미동기화 행 (최신 것부터) */
public class StorePendingSource implements PendingEventSource {

    private static final Logger log = LoggerFactory.getLogger(StorePendingSource.class);

    private final EventStore store;

    public StorePendingSource(EventStore store) {
        this.store = store;
    }

    @Override
    public List<PendingEvent> fetch(int limit) throws SQLException {
        List<PendingEvent> out = new ArrayList<>();
        for (StoredEvent e : store.getUnsynced(limit)) {
            JsonObject data;
            try {
                data = EventPayloads.parseObject(e.eventData());
            } catch (JsonParseException ex) {
                // 저장 전에 파싱을 통과한 줄만 들어오므로 정상적으로는 오지 않는 경로
                log.warn("[Sync] stored event {} is not a JSON object, left unsynced: {}", e.id(), ex.getMessage());
                continue;
            }
            out.add(new PendingEvent(e.id(), e.fileName(), e.lineNumber(), data, e.gitRemoteUrl(), e.gitCommitHash()));
        }
        return out;
    }

    @Override
    public void acknowledge(PendingEvent event) throws SQLException {
        store.markSynced(event.id());
    }

    @Override
    public SyncStats stats() throws SQLException {
        return store.syncStats();
    }
}
