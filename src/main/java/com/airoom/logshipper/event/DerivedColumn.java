package com.airoom.logshipper.event;

import com.google.gson.JsonObject;

/**
 * event_data 에서 쓰기 시점에 계산되는 컬럼들 (SQLite GENERATED ... STORED).
 * DDL 생성과 자바 쪽 평가가 같은 정의를 쓴다.
 */
public enum DerivedColumn {

    EVENT_TYPE("event_type", "TEXT", "type"),
    EVENT_MESSAGE("event_message", "TEXT", null),
    EVENT_GIT_BRANCH("event_git_branch", "TEXT", "gitBranch"),
    EVENT_SESSION_ID("event_session_id", "TEXT", "sessionId"),
    EVENT_UUID("event_uuid", "TEXT", "uuid"),
    EVENT_TIMESTAMP("event_timestamp", "TEXT", "timestamp"),
    EVENT_MODEL("event_model", "TEXT", "message.model"),
    EVENT_INPUT_TOKENS("event_input_tokens", "INTEGER", "message.usage.input_tokens"),
    EVENT_CACHE_CREATION_INPUT_TOKENS("event_cache_creation_input_tokens", "INTEGER",
            "message.usage.cache_creation_input_tokens"),
    EVENT_CACHE_READ_INPUT_TOKENS("event_cache_read_input_tokens", "INTEGER",
            "message.usage.cache_read_input_tokens"),
    EVENT_OUTPUT_TOKENS("event_output_tokens", "INTEGER", "message.usage.output_tokens");

    private final String column;
    private final String sqlType;
    private final String path;   // null 이면 MessageTextRule 사용

    DerivedColumn(String column, String sqlType, String path) {
        this.column = column;
        this.sqlType = sqlType;
        this.path = path;
    }

    public String column() { return column; }

    /** 컬럼 정의 한 줄: "event_type TEXT GENERATED ALWAYS AS (...) STORED" */
    public String definition(String source) {
        return column + " " + sqlType + " GENERATED ALWAYS AS (" + expression(source) + ") STORED";
    }

    public String expression(String source) {
        if (path == null) return MessageTextRule.coalesceSql(source);
        return "json_extract(" + source + ", '$." + path + "')";
    }

    /** 자바에서 같은 값을 계산 (로그 요약, 검증용) */
    public String evaluate(JsonObject payload) {
        if (path == null) return MessageTextRule.messageText(payload);
        return EventPayloads.string(payload, path);
    }
}
