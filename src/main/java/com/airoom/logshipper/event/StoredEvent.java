package com.airoom.logshipper.event;

/** conversation_events 한 행 (파생 컬럼 일부 포함) */
public record StoredEvent(
        long id,
        String fileName,
        int lineNumber,
        String eventData,
        String userName,
        String insertedAt,
        String gitRemoteUrl,
        String gitCommitHash,
        String syncedAt,
        String eventType,
        String eventMessage,
        String sessionId,
        String eventTimestamp
) {
    public boolean isSynced() { return syncedAt != null; }
}
