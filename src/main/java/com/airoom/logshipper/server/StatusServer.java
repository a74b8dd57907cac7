package com.airoom.logshipper.server;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * 로컬 상태 서버 (loopback 전용).
 *  - GET  /status : 수집/동기화 현황 JSON
 *  - POST /flush  : 동기화 워커를 즉시 깨움
 */
public class StatusServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);
    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final HttpServer server;
    private final Supplier<ShipperStatus> status;
    private final Runnable flushCallback;

    /** port 0 이면 임의 포트 */
    public StatusServer(int port, Supplier<ShipperStatus> status, Runnable flushCallback) throws IOException {
        this.status = status;
        this.flushCallback = flushCallback;
        this.server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
        server.createContext("/status", this::handleStatus);
        server.createContext("/flush", this::handleFlush);
        server.setExecutor(null);
    }

    public void start() {
        server.start();
        log.info("[Status] listening on http://127.0.0.1:{}", port());
    }

    public int port() { return server.getAddress().getPort(); }

    private void handleStatus(HttpExchange ex) throws IOException {
        if (!"GET".equals(ex.getRequestMethod())) {
            send(ex, 405, "{\"error\":\"method not allowed\"}");
            return;
        }
        try {
            send(ex, 200, GSON.toJson(status.get()));
        } catch (RuntimeException e) {
            log.error("[Status] status snapshot failed", e);
            send(ex, 500, "{\"error\":\"status unavailable\"}");
        }
    }

    private void handleFlush(HttpExchange ex) throws IOException {
        if (!"POST".equals(ex.getRequestMethod())) {
            send(ex, 405, "{\"error\":\"method not allowed\"}");
            return;
        }
        if (flushCallback == null) {
            send(ex, 503, "{\"flushed\":false,\"reason\":\"remote sync disabled\"}");
            return;
        }
        flushCallback.run();
        send(ex, 202, "{\"flushed\":true}");
    }

    private static void send(HttpExchange ex, int code, String json) throws IOException {
        byte[] b = json.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        try {
            ex.sendResponseHeaders(code, b.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(b); }
        } finally {
            ex.close();
        }
    }

    @Override
    public void close() {
        server.stop(0);
        log.info("[Status] stopped");
    }
}
