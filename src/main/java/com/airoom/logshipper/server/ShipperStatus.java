package com.airoom.logshipper.server;

import com.airoom.logshipper.event.SyncStats;

/** GET /status 응답 본문 */
public record ShipperStatus(
        String version,
        String startedAt,
        boolean localStore,
        boolean remoteSync,
        int trackedFiles,
        long total,
        long synced,
        long pending,
        String worker,
        long backoffMillis
) {
    public static ShipperStatus of(String version, String startedAt, boolean localStore, boolean remoteSync,
                                   int trackedFiles, SyncStats stats, String worker, long backoffMillis) {
        return new ShipperStatus(version, startedAt, localStore, remoteSync, trackedFiles,
                stats.total(), stats.synced(), stats.pending(), worker, backoffMillis);
    }
}
