package com.airoom.logshipper.network;

import java.time.Duration;

/**
 * 지수 백오프. 연속 실패 K 번 뒤의 대기 시간 = min(initial * 2^K, cap).
 * 성공하면 initial 로 돌아간다.
 */
public class Backoff {

    private final Duration initial;
    private final Duration cap;
    private int failures;
    private Duration current;

    public Backoff(Duration initial, Duration cap) {
        if (initial.isNegative() || initial.isZero()) throw new IllegalArgumentException("initial must be > 0");
        if (cap.compareTo(initial) < 0) throw new IllegalArgumentException("cap must be >= initial");
        this.initial = initial;
        this.cap = cap;
        this.current = initial;
    }

    public synchronized Duration onFailure() {
        failures++;
        current = delayAfter(failures);
        return current;
    }

    public synchronized void reset() {
        failures = 0;
        current = initial;
    }

    public synchronized Duration current() { return current; }
    public synchronized int failures() { return failures; }

    Duration delayAfter(int k) {
        // 2^62 이상은 어차피 cap
        if (k >= 62) return cap;
        long factor = 1L << k;
        long millis = initial.toMillis();
        if (millis > cap.toMillis() / factor) return cap;
        return Duration.ofMillis(millis * factor);
    }
}
