package com.airoom.logshipper.event;

/**
 * 저장소에 넣을 한 줄 분량의 이벤트.
 * eventData 는 원본 줄 그대로(trim만) 보관 - 로컬 사본은 절대 마스킹하지 않는다.
 */
public record NewEvent(
        String fileName,       // 감시 루트 기준 상대 경로
        int lineNumber,        // 1부터
        String eventData,      // 원본 JSON 텍스트
        String gitRemoteUrl,   // 없으면 null
        String gitCommitHash   // 없으면 null
) {}
