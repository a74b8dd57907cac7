package com.airoom.logshipper.network;

/** 원격 전송 결과 */
public enum DeliveryResult {
    /** 2xx */
    DELIVERED,
    /** 401/403 등 영구 거부 - 사람이 설정을 고치기 전까지 계속 실패한다 */
    REJECTED,
    /** 네트워크 오류, 타임아웃, 5xx, 408, 429 */
    FAILED;

    public static DeliveryResult fromStatus(int code) {
        if (code >= 200 && code < 300) return DELIVERED;
        if (code == 408 || code == 429) return FAILED;
        if (code >= 400 && code < 500) return REJECTED;
        return FAILED;
    }
}
