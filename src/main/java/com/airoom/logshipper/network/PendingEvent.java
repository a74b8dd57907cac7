package com.airoom.logshipper.network;

import com.google.gson.JsonObject;

/** 전송 대기 중인 이벤트. id 는 출처(저장소 행 id 또는 큐 순번) 안에서만 의미가 있다 */
public record PendingEvent(
        long id,
        String fileName,
        int lineNumber,
        JsonObject eventData,
        String gitRemoteUrl,
        String gitCommitHash
) {}
