package com.airoom.logshipper.network;

import com.airoom.logshipper.event.SyncStats;

import java.sql.SQLException;
import java.util.List;

/** 동기화 워커가 읽어 가는 대기열 */
public interface PendingEventSource {

    List<PendingEvent> fetch(int limit) throws SQLException;

    /** 원격 수신 확인 후 호출 */
    void acknowledge(PendingEvent event) throws SQLException;

    SyncStats stats() throws SQLException;
}
