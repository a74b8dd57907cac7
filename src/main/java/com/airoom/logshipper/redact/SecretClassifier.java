package com.airoom.logshipper.redact;

/** 텍스트에 비밀값이 있으면 고정 문구로 바꾼 결과, 없으면 원문을 그대로 돌려준다 */
@FunctionalInterface
public interface SecretClassifier {

    String SENTINEL = "<SECRET REDACTED>";

    String classify(String text);
}
