package com.airoom.logshipper.redact;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * 원격 전송용 사본을 만든다. 입력 객체는 건드리지 않는다.
 * 대상: type 이 user/assistant/message 인 이벤트의 message.content 중 type=text 블록의 text.
 */
public class EventRedactor {

    private static final Logger log = LoggerFactory.getLogger(EventRedactor.class);

    private static final Set<String> MESSAGE_TYPES = Set.of("user", "assistant", "message");

    private final SecretClassifier classifier;

    public EventRedactor(SecretClassifier classifier) {
        this.classifier = classifier;
    }

    public JsonObject redact(JsonObject event) {
        JsonObject copy = event.deepCopy();

        JsonElement type = copy.get("type");
        if (type == null || !type.isJsonPrimitive() || !MESSAGE_TYPES.contains(type.getAsString())) return copy;

        JsonElement message = copy.get("message");
        if (message == null || !message.isJsonObject()) return copy;
        JsonElement content = message.getAsJsonObject().get("content");
        if (content == null || !content.isJsonArray()) return copy;

        JsonArray blocks = content.getAsJsonArray();
        for (int i = 0; i < blocks.size(); i++) {
            JsonElement b = blocks.get(i);
            if (!b.isJsonObject()) continue;
            JsonObject block = b.getAsJsonObject();
            if (!isTextBlock(block)) continue;

            JsonElement textEl = block.get("text");
            if (textEl == null || !textEl.isJsonPrimitive() || !textEl.getAsJsonPrimitive().isString()) continue;
            String text = textEl.getAsString();
            if (text.isEmpty()) continue;

            String result = classifier.classify(text);
            if (result != null && !result.equals(text)) {
                block.addProperty("text", result);
                log.warn("[Redact] secret detected and redacted in message block {}", i);
            }
        }
        return copy;
    }

    private static boolean isTextBlock(JsonObject block) {
        JsonElement t = block.get("type");
        return t != null && t.isJsonPrimitive() && "text".equals(t.getAsString());
    }
}
