package com.airoom.logshipper.network;

import com.airoom.logshipper.event.RemoteEvent;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/**
 * 원격 수집 서버 클라이언트.
 *  - GET  {base}/health   : 연결 확인 (실패 시 {url}/api.php 로 한 번 더)
 *  - POST {base}/events   : 이벤트 1건 전송
 * 인증은 X-API-Key 헤더.
 */
public class CollectorClient {

    private static final Logger log = LoggerFactory.getLogger(CollectorClient.class);

    private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    static final String PHP_ENTRY = "/api.php";

    private final String url;
    private final String apiKey;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final String userAgent;

    private volatile String base;

    public CollectorClient(String url, String apiKey, int connectTimeoutMs, int readTimeoutMs, String userAgent) {
        this.url = stripTrailingSlash(url);
        this.apiKey = apiKey;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.userAgent = userAgent;
        this.base = this.url;
    }

    /** 현재 사용하는 엔드포인트 기준 주소 (probe 결과에 따라 /api.php 가 붙을 수 있음) */
    public String endpointBase() { return base; }

    /** @return 연결되면 true. 성공한 주소를 이후 전송 기준으로 고정한다 */
    public boolean probe() {
        String firstError = health(url);
        if (firstError == null) {
            base = url;
            log.info("[Collector] connected → {}", base);
            return true;
        }
        if (!url.contains(PHP_ENTRY)) {
            String alt = url + PHP_ENTRY;
            if (health(alt) == null) {
                base = alt;
                log.info("[Collector] connected → {}", base);
                return true;
            }
        }
        log.warn("[Collector] could not connect to {}: {}", url, firstError);
        return false;
    }

    /** null 이면 성공, 아니면 실패 사유 */
    private String health(String target) {
        HttpURLConnection conn = null;
        try {
            conn = open(target + "/health", "GET");
            int code = conn.getResponseCode();
            drain(conn);
            return (code >= 200 && code < 300) ? null : "HTTP " + code;
        } catch (IOException e) {
            return e.getClass().getSimpleName() + ": " + e.getMessage();
        } finally {
            if (conn != null) conn.disconnect();
        }
    }

    public DeliveryResult submit(RemoteEvent event) {
        String endpoint = base + "/events";
        HttpURLConnection conn = null;
        try {
            conn = open(endpoint, "POST");
            conn.setDoOutput(true);
            byte[] body = GSON.toJson(event).getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = conn.getOutputStream()) {
                os.write(body);
                os.flush();
            }

            int code = conn.getResponseCode();
            drain(conn);
            DeliveryResult result = DeliveryResult.fromStatus(code);
            switch (result) {
                case DELIVERED:
                    log.debug("[Collector] delivered {}:{} ({})", event.fileName(), event.lineNumber(), code);
                    break;
                case REJECTED:
                    log.warn("[Collector] rejected {}:{} with HTTP {} → check api key / url",
                            event.fileName(), event.lineNumber(), code);
                    break;
                default:
                    log.warn("[Collector] send failed {}:{} with HTTP {}", event.fileName(), event.lineNumber(), code);
            }
            return result;
        } catch (IOException e) {
            log.warn("[Collector] send error → {} / reason={}: {}",
                    endpoint, e.getClass().getSimpleName(), e.getMessage());
            return DeliveryResult.FAILED;
        } finally {
            if (conn != null) conn.disconnect();
        }
    }

    private HttpURLConnection open(String target, String method) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) new URL(target).openConnection();
        conn.setConnectTimeout(connectTimeoutMs);
        conn.setReadTimeout(readTimeoutMs);
        conn.setRequestMethod(method);
        conn.setRequestProperty("X-API-Key", apiKey);
        conn.setRequestProperty("Content-Type", "application/json; charset=UTF-8");
        conn.setRequestProperty("Accept", "application/json");
        conn.setRequestProperty("User-Agent", userAgent);
        return conn;
    }

    /** keep-alive 재사용을 위해 응답 본문을 비운다 */
    private static void drain(HttpURLConnection conn) {
        try (InputStream in = conn.getResponseCode() >= 400 ? conn.getErrorStream() : conn.getInputStream()) {
            if (in != null) in.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            log.trace("[Collector] response body not drained: {}", e.getMessage());
        }
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
