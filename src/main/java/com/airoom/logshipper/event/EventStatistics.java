package com.airoom.logshipper.event;

/** 조회 도구용 요약 */
public record EventStatistics(
        long totalEvents,
        long sessions,
        long files,
        long unsynced,
        String firstTimestamp,
        String lastTimestamp
) {}
