package com.airoom.logshipper.event;

public record SyncStats(long total, long synced, long pending) {
    public static final SyncStats EMPTY = new SyncStats(0, 0, 0);
}
