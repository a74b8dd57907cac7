package com.airoom.logshipper.event;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;

/**
 * 한 줄 = JSON 객체 하나.
 * JsonParser.parseString 은 lenient 모드라 "abc" 같은 줄도 통과시키므로
 * strict JsonReader + JsonElement 어댑터로 직접 읽는다.
 */
public final class EventPayloads {

    private static final TypeAdapter<JsonElement> ELEMENT = new Gson().getAdapter(JsonElement.class);

    private EventPayloads() {}

    /**
     * @throws JsonParseException 객체가 아니거나 문법 오류, 뒤에 잔여 토큰이 있을 때
     */
    public static JsonObject parseObject(String line) {
        try (JsonReader reader = new JsonReader(new StringReader(line))) {
            reader.setLenient(false);
            JsonElement el = ELEMENT.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonParseException("trailing content after JSON value");
            }
            if (el == null || !el.isJsonObject()) {
                throw new JsonParseException("line is not a JSON object");
            }
            return el.getAsJsonObject();
        } catch (IOException | IllegalStateException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

    /** 점 경로 탐색 ("message.usage.input_tokens"), 없으면 null */
    public static JsonElement path(JsonObject root, String dotted) {
        JsonElement cur = root;
        for (String part : dotted.split("\\.")) {
            if (cur == null || !cur.isJsonObject()) return null;
            cur = cur.getAsJsonObject().get(part);
        }
        return (cur == null || cur.isJsonNull()) ? null : cur;
    }

    /**
     * SQLite json_extract 와 같은 방식으로 값을 텍스트화.
     * 문자열/숫자는 그대로, boolean 은 1/0, 객체/배열은 압축 JSON.
     */
    public static String scalarText(JsonElement el) {
        if (el == null || el.isJsonNull()) return null;
        if (el.isJsonPrimitive()) {
            if (el.getAsJsonPrimitive().isBoolean()) return el.getAsBoolean() ? "1" : "0";
            return el.getAsString();
        }
        return el.toString();
    }

    public static String string(JsonObject root, String dotted) {
        return scalarText(path(root, dotted));
    }
}
