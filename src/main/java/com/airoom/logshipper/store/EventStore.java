package com.airoom.logshipper.store;

import com.airoom.logshipper.event.NewEvent;
import com.airoom.logshipper.event.StoredEvent;
import com.airoom.logshipper.event.SyncStats;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;

public interface EventStore {

    /**
     * 한 번의 트랜잭션으로 기록. (file_name, line_number) 가 이미 있으면 조용히 건너뛴다.
     * @return 실제로 들어간 행 수
     */
    int insertBatch(List<NewEvent> events) throws SQLException;

    /**
     * 저장소의 JSON 파서가 받아들이지 않는 줄 번호들 (제어 문자가 그대로 들어간 문자열, 너무 깊은 중첩 등).
     * insertBatch 는 이런 행을 넣지 않고 건너뛴다.
     */
    Set<Integer> invalidLines(List<NewEvent> events) throws SQLException;

    /** synced_at 이 NULL 인 이벤트, 최신 것부터 최대 limit 개 */
    List<StoredEvent> getUnsynced(int limit) throws SQLException;

    /** null → 현재 시각. 이미 동기화된 행이면 아무 일도 하지 않는다 */
    void markSynced(long eventId) throws SQLException;

    SyncStats syncStats() throws SQLException;
}
