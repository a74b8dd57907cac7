package com.airoom.logshipper.redact;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 알려진 토큰 형식 정규식으로 비밀값을 찾는다. 줄 단위로 검사.
 * 엔트로피 기반 탐지는 대화 텍스트에서 오탐이 많아 쓰지 않는다.
 */
public class PatternSecretClassifier implements SecretClassifier {

    private static final Map<String, Pattern> DETECTORS = new LinkedHashMap<>();
    static {
        DETECTORS.put("aws-access-key", Pattern.compile("\\b(?:AKIA|ASIA|ABIA|ACCA)[0-9A-Z]{16}\\b"));
        DETECTORS.put("aws-secret-key", Pattern.compile(
                "(?i)aws.{0,20}?(?:secret|key).{0,20}?['\"=:\\s][0-9a-zA-Z/+]{40}\\b"));
        DETECTORS.put("github-token", Pattern.compile("\\b(?:ghp|gho|ghu|ghs|ghr)_[A-Za-z0-9]{36,}\\b"));
        DETECTORS.put("github-fine-grained", Pattern.compile("\\bgithub_pat_[A-Za-z0-9_]{60,}\\b"));
        DETECTORS.put("private-key", Pattern.compile("-----BEGIN (?:[A-Z]+ )?PRIVATE KEY( BLOCK)?-----"));
        DETECTORS.put("jwt", Pattern.compile("\\beyJ[A-Za-z0-9_-]{8,}\\.eyJ[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}"));
        DETECTORS.put("slack-token", Pattern.compile("\\bxox[abposr]-[0-9A-Za-z-]{10,}"));
        DETECTORS.put("slack-webhook", Pattern.compile(
                "https://hooks\\.slack\\.com/services/T[A-Za-z0-9_]+/B[A-Za-z0-9_]+/[A-Za-z0-9_]+"));
        DETECTORS.put("stripe-key", Pattern.compile("\\b(?:sk|rk)_live_[0-9a-zA-Z]{24,}\\b"));
        DETECTORS.put("openai-key", Pattern.compile("\\bsk-(?:proj-)?[A-Za-z0-9_-]{20,}T3BlbkFJ[A-Za-z0-9_-]{20,}\\b"));
        DETECTORS.put("anthropic-key", Pattern.compile("\\bsk-ant-[A-Za-z0-9_-]{32,}"));
        DETECTORS.put("npm-token", Pattern.compile("//.+/:_authToken=\\s*[A-Za-z0-9_-]+"));
        DETECTORS.put("sendgrid-key", Pattern.compile("\\bSG\\.[A-Za-z0-9_-]{22}\\.[A-Za-z0-9_-]{43}\\b"));
        DETECTORS.put("twilio-key", Pattern.compile("\\bSK[0-9a-fA-F]{32}\\b"));
        DETECTORS.put("basic-auth-url", Pattern.compile("://[^{}\\s/:@]+:[^{}\\s/:@]+@[^\\s/]+"));
        DETECTORS.put("password-assignment", Pattern.compile(
                "(?i)\\b(?:password|passwd|pwd|secret|api_?key|access_?token)\\b\\s*[:=]\\s*['\"][^'\"\\s]{6,}['\"]"));
    }

    private final String sentinel;

    public PatternSecretClassifier() { this(SENTINEL); }
    public PatternSecretClassifier(String sentinel) { this.sentinel = sentinel; }

    @Override
    public String classify(String text) {
        if (text == null || text.isEmpty()) return text;
        return detect(text).isEmpty() ? text : sentinel;
    }

    /** 발견된 탐지기 이름들 (로그용 - 값 자체는 돌려주지 않는다) */
    public List<String> detect(String text) {
        List<String> found = new ArrayList<>();
        if (text == null) return found;
        for (String line : text.split("\n")) {
            for (Map.Entry<String, Pattern> d : DETECTORS.entrySet()) {
                if (!found.contains(d.getKey()) && d.getValue().matcher(line).find()) {
                    found.add(d.getKey());
                }
            }
        }
        return found;
    }
}
