package com.airoom.logshipper.server;

import com.airoom.logshipper.event.SyncStats;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class StatusServerTest {

    private StatusServer server;

    @AfterEach
    void tearDown() {
        if (server != null) server.close();
    }

    private StatusServer start(Runnable flush) throws IOException {
        server = new StatusServer(0, () -> ShipperStatus.of("1.0.0", "2025-01-01T00:00:00Z", true, true, 4,
                new SyncStats(10, 7, 3), "IDLE", 2000), flush);
        server.start();
        return server;
    }

    private HttpURLConnection request(String method, String path) throws IOException {
        HttpURLConnection con = (HttpURLConnection) new URL("http://127.0.0.1:" + server.port() + path).openConnection();
        con.setRequestMethod(method);
        con.setConnectTimeout(2000);
        con.setReadTimeout(2000);
        if ("POST".equals(method)) {
            con.setDoOutput(true);
            con.getOutputStream().close();
        }
        return con;
    }

    private static String body(HttpURLConnection con) throws IOException {
        InputStream in = con.getResponseCode() < 400 ? con.getInputStream() : con.getErrorStream();
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void statusReportsCounters() throws Exception {
        start(() -> {});

        HttpURLConnection con = request("GET", "/status");

        assertThat(con.getResponseCode()).isEqualTo(200);
        JsonObject json = JsonParser.parseString(body(con)).getAsJsonObject();
        assertThat(json.get("total").getAsLong()).isEqualTo(10);
        assertThat(json.get("synced").getAsLong()).isEqualTo(7);
        assertThat(json.get("pending").getAsLong()).isEqualTo(3);
        assertThat(json.get("trackedFiles").getAsInt()).isEqualTo(4);
        assertThat(json.get("worker").getAsString()).isEqualTo("IDLE");
    }

    @Test
    void flushWakesWorker() throws Exception {
        AtomicInteger flushed = new AtomicInteger();
        start(flushed::incrementAndGet);

        HttpURLConnection con = request("POST", "/flush");

        assertThat(con.getResponseCode()).isEqualTo(202);
        assertThat(body(con)).contains("\"flushed\":true");
        assertThat(flushed).hasValue(1);
    }

    @Test
    void flushWithoutRemoteSyncIsUnavailable() throws Exception {
        start(null);

        assertThat(request("POST", "/flush").getResponseCode()).isEqualTo(503);
    }

    @Test
    void wrongMethodsAreRejected() throws Exception {
        start(() -> {});

        assertThat(request("GET", "/flush").getResponseCode()).isEqualTo(405);
        assertThat(request("POST", "/status").getResponseCode()).isEqualTo(405);
    }
}
