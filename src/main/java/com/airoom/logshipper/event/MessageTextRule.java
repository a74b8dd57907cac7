package com.airoom.logshipper.event;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * 페이로드에서 "사람이 읽는 메시지 본문"을 뽑는 규칙들. 선언 순서 = 우선순위.
 *
 * 같은 규칙을 두 가지로 표현한다.
 *  - extract(): Gson JsonObject 위에서 바로 평가
 *  - sql(): SQLite 생성 컬럼(event_message) 정의에 들어갈 식
 * 두 결과는 항상 같아야 한다 (MessageTextRuleTest 에서 대조).
 */
public enum MessageTextRule {

    /** {"message":{"content":[{"text":"..."}, ...]}} - 앞 5개 블록을 빈 줄로 이어 붙임 */
    CONTENT_BLOCKS {
        @Override
        public String extract(JsonObject payload) {
            JsonElement content = EventPayloads.path(payload, "message.content");
            if (content == null || !content.isJsonArray()) return null;
            JsonArray blocks = content.getAsJsonArray();

            String first = blockText(blocks, 0);
            if (first == null) return null;

            StringBuilder sb = new StringBuilder(first);
            for (int i = 1; i < MAX_BLOCKS; i++) {
                String t = blockText(blocks, i);
                if (t != null) sb.append(BLOCK_SEPARATOR).append(t);
            }
            return sb.toString();
        }

        @Override
        public String sql(String column) {
            StringBuilder sb = new StringBuilder(blockSql(column, 0));
            for (int i = 1; i < MAX_BLOCKS; i++) {
                sb.append(" ||\n    IIF(").append(blockSql(column, i)).append(" IS NOT NULL,")
                  .append(" char(10) || char(10) || ").append(blockSql(column, i)).append(", '')");
            }
            return sb.toString();
        }
    },

    /** {"message":{"content":"plain text"}} */
    PLAIN_STRING {
        @Override
        public String extract(JsonObject payload) {
            JsonElement content = EventPayloads.path(payload, "message.content");
            if (content == null || !content.isJsonPrimitive() || !content.getAsJsonPrimitive().isString()) {
                return null;
            }
            return content.getAsString();
        }

        @Override
        public String sql(String column) {
            return "IIF(json_type(" + column + ", '$.message.content') = 'text', json_extract("
                    + column + ", '$.message.content'), NULL)";
        }
    },

    /** 최상위 content 필드 (마지막 fallback) */
    TOP_LEVEL_CONTENT {
        @Override
        public String extract(JsonObject payload) {
            return EventPayloads.scalarText(payload.get("content"));
        }

        @Override
        public String sql(String column) {
            return "json_extract(" + column + ", '$.content')";
        }
    };

    static final int MAX_BLOCKS = 5;
    static final String BLOCK_SEPARATOR = "\n\n";

    public abstract String extract(JsonObject payload);

    public abstract String sql(String column);

    /** 첫 번째로 값이 나온 규칙의 결과, 없으면 null */
    public static String messageText(JsonObject payload) {
        for (MessageTextRule rule : values()) {
            String text = rule.extract(payload);
            if (text != null) return text;
        }
        return null;
    }

    /** 규칙 전체를 COALESCE 로 묶은 SQL 식 */
    public static String coalesceSql(String column) {
        List<String> parts = new ArrayList<>();
        for (MessageTextRule rule : values()) parts.add(rule.sql(column));
        return "COALESCE(\n    " + String.join(",\n    ", parts) + "\n)";
    }

    private static String blockText(JsonArray blocks, int index) {
        if (index >= blocks.size()) return null;
        JsonElement block = blocks.get(index);
        if (block == null || !block.isJsonObject()) return null;
        return EventPayloads.scalarText(block.getAsJsonObject().get("text"));
    }

    private static String blockSql(String column, int index) {
        return "json_extract(" + column + ", '$.message.content[" + index + "].text')";
    }
}
