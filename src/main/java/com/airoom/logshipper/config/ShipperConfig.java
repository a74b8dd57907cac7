package com.airoom.logshipper.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 실행 설정.
 *
 * 우선순위: JVM prop(-Dshipper.xxx) → ENV(SHIPPER_XXX) → config.json → 기본값
 *  - config.json 이 없으면 기본값으로 한 번 만들어 둔다 (원격 동기화는 꺼진 상태)
 *  - 숫자 값이 깨져 있으면 WARN 남기고 기본값 사용
 */
public final class ShipperConfig {

    private static final Logger log = LoggerFactory.getLogger(ShipperConfig.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /** 설정 키 → config.json 내부 경로 */
    private static final Map<String, String> FILE_PATHS = new LinkedHashMap<>();
    static {
        FILE_PATHS.put("api.enabled", "api.enabled");
        FILE_PATHS.put("api.url", "api.url");
        FILE_PATHS.put("api.key", "api.api_key");
        FILE_PATHS.put("sqlite.enabled", "sqlite.enabled");
        FILE_PATHS.put("sqlite.path", "sqlite.database_path");
        FILE_PATHS.put("sqlite.user", "sqlite.user_name");
        FILE_PATHS.put("monitor.dir", "monitor.conversation_dir");
        FILE_PATHS.put("monitor.filter", "monitor.debug_filter_project");
        FILE_PATHS.put("sync.batchSize", "sync.batch_size");
        FILE_PATHS.put("sync.idleSeconds", "sync.idle_seconds");
        FILE_PATHS.put("sync.throttleMillis", "sync.throttle_millis");
        FILE_PATHS.put("sync.initialBackoffMillis", "sync.initial_backoff_millis");
        FILE_PATHS.put("sync.maxBackoffSeconds", "sync.max_backoff_seconds");
        FILE_PATHS.put("sync.stopTimeoutSeconds", "sync.stop_timeout_seconds");
        FILE_PATHS.put("net.connectTimeoutMs", "net.connect_timeout_ms");
        FILE_PATHS.put("net.readTimeoutMs", "net.read_timeout_ms");
        FILE_PATHS.put("status.enabled", "status.enabled");
        FILE_PATHS.put("status.port", "status.port");
        FILE_PATHS.put("skipBacklog", "monitor.skip_backlog");
    }

    private final Path homeDir;
    private final boolean apiEnabled;
    private final String apiUrl;
    private final String apiKey;
    private final boolean sqliteEnabled;
    private final Path databasePath;
    private final String userName;
    private final Path conversationDir;
    private final String debugFilterProject;
    private final int syncBatchSize;
    private final Duration syncIdleInterval;
    private final Duration syncThrottle;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Duration stopTimeout;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final boolean statusEnabled;
    private final int statusPort;
    private final boolean skipBacklog;

    private ShipperConfig(Resolver r, Path homeDir) {
        this.homeDir = homeDir;
        this.apiEnabled = r.bool("api.enabled", false);
        this.apiUrl = stripTrailingSlash(r.string("api.url", ""));
        this.apiKey = r.string("api.key", "");
        this.sqliteEnabled = r.bool("sqlite.enabled", true);
        this.databasePath = expand(r.string("sqlite.path", homeDir.resolve("shipper.db").toString()));
        this.userName = r.string("sqlite.user", System.getProperty("user.name", "unknown"));
        this.conversationDir = expand(r.string("monitor.dir", "~/.claude/projects"));
        String filter = r.string("monitor.filter", "");
        this.debugFilterProject = filter.isBlank() ? null : filter;
        this.syncBatchSize = Math.max(1, r.integer("sync.batchSize", 50));
        this.syncIdleInterval = Duration.ofSeconds(r.integer("sync.idleSeconds", 60));
        this.syncThrottle = Duration.ofMillis(r.integer("sync.throttleMillis", 100));
        this.initialBackoff = Duration.ofMillis(r.integer("sync.initialBackoffMillis", 2000));
        this.maxBackoff = Duration.ofSeconds(r.integer("sync.maxBackoffSeconds", 300));
        this.stopTimeout = Duration.ofSeconds(r.integer("sync.stopTimeoutSeconds", 5));
        this.connectTimeoutMs = r.integer("net.connectTimeoutMs", 5000);
        this.readTimeoutMs = r.integer("net.readTimeoutMs", 30000);
        this.statusEnabled = r.bool("status.enabled", false);
        this.statusPort = r.integer("status.port", 47800);
        this.skipBacklog = r.bool("skipBacklog", false);
    }

    /** 실제 JVM prop/ENV 기준으로 로딩 */
    public static ShipperConfig load() {
        return load(System::getProperty, System::getenv);
    }

    public static ShipperConfig load(UnaryOperator<String> props, UnaryOperator<String> env) {
        String home = firstNonBlank(props.apply("shipper.home"), env.apply("SHIPPER_HOME"));
        Path homeDir = expand(home != null ? home : "~/.logshipper");

        String cfg = firstNonBlank(props.apply("shipper.config"), env.apply("SHIPPER_CONFIG"));
        Path configFile = (cfg != null) ? expand(cfg) : homeDir.resolve("config.json");

        JsonObject file = readOrCreate(configFile);
        return new ShipperConfig(new Resolver(props, env, file), homeDir);
    }

    private static JsonObject readOrCreate(Path configFile) {
        if (Files.exists(configFile)) {
            try {
                JsonElement root = JsonParser.parseString(Files.readString(configFile, StandardCharsets.UTF_8));
                return root.isJsonObject() ? root.getAsJsonObject() : new JsonObject();
            } catch (IOException | JsonParseException e) {
                throw new ConfigException("Cannot read config file " + configFile, e);
            }
        }

        JsonObject defaults = defaultFileContent();
        try {
            Files.createDirectories(configFile.toAbsolutePath().getParent());
            Files.writeString(configFile, GSON.toJson(defaults), StandardCharsets.UTF_8);
            log.info("[Config] default configuration created → {}", configFile);
        } catch (IOException e) {
            // 파일을 못 만들어도 기본값으로는 돌 수 있다
            log.warn("[Config] could not create default config at {}: {}", configFile, e.getMessage());
        }
        return defaults;
    }

    private static JsonObject defaultFileContent() {
        JsonObject api = new JsonObject();
        api.addProperty("enabled", false);
        api.addProperty("url", "");
        api.addProperty("api_key", "");

        JsonObject sqlite = new JsonObject();
        sqlite.addProperty("enabled", true);
        sqlite.addProperty("database_path", "~/.logshipper/shipper.db");
        sqlite.addProperty("user_name", System.getProperty("user.name", "unknown"));

        JsonObject monitor = new JsonObject();
        monitor.addProperty("conversation_dir", "~/.claude/projects");

        JsonObject root = new JsonObject();
        root.add("api", api);
        root.add("sqlite", sqlite);
        root.add("monitor", monitor);
        return root;
    }

    // ── 값 해석기
    private static final class Resolver {
        private final UnaryOperator<String> props;
        private final UnaryOperator<String> env;
        private final JsonObject file;

        Resolver(UnaryOperator<String> props, UnaryOperator<String> env, JsonObject file) {
            this.props = props;
            this.env = env;
            this.file = file;
        }

        String raw(String key) {
            String p = props.apply("shipper." + key);
            if (p != null && !p.isBlank()) return p.trim();
            String e = env.apply(envName(key));
            if (e != null && !e.isBlank()) return e.trim();
            JsonElement f = lookup(file, FILE_PATHS.getOrDefault(key, key));
            if (f != null && !f.isJsonNull() && f.isJsonPrimitive()) return f.getAsString().trim();
            return null;
        }

        String string(String key, String def) {
            String v = raw(key);
            return (v == null) ? def : v;
        }

        boolean bool(String key, boolean def) {
            String v = raw(key);
            if (v == null) return def;
            return v.equalsIgnoreCase("true") || v.equals("1");
        }

        int integer(String key, int def) {
            String v = raw(key);
            if (v == null) return def;
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                log.warn("[Config] invalid number for {}='{}', using {}", key, v, def);
                return def;
            }
        }
    }

    /** "sync.batchSize" → "SHIPPER_SYNC_BATCH_SIZE" */
    static String envName(String key) {
        String snake = key.replaceAll("([a-z0-9])([A-Z])", "$1_$2").replace('.', '_');
        return "SHIPPER_" + snake.toUpperCase(Locale.ROOT);
    }

    private static JsonElement lookup(JsonObject root, String dotted) {
        JsonElement cur = root;
        for (String part : dotted.split("\\.")) {
            if (cur == null || !cur.isJsonObject()) return null;
            cur = cur.getAsJsonObject().get(part);
        }
        return cur;
    }

    static Path expand(String path) {
        if (path.equals("~")) return Paths.get(System.getProperty("user.home"));
        if (path.startsWith("~/")) return Paths.get(System.getProperty("user.home"), path.substring(2));
        return Paths.get(path);
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a.trim();
        if (b != null && !b.isBlank()) return b.trim();
        return null;
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    public Path getHomeDir() { return homeDir; }
    public boolean isApiEnabled() { return apiEnabled; }
    public String getApiUrl() { return apiUrl; }
    public String getApiKey() { return apiKey; }
    public boolean isSqliteEnabled() { return sqliteEnabled; }
    public Path getDatabasePath() { return databasePath; }
    public String getUserName() { return userName; }
    public Path getConversationDir() { return conversationDir; }
    public String getDebugFilterProject() { return debugFilterProject; }
    public int getSyncBatchSize() { return syncBatchSize; }
    public Duration getSyncIdleInterval() { return syncIdleInterval; }
    public Duration getSyncThrottle() { return syncThrottle; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public Duration getStopTimeout() { return stopTimeout; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public int getReadTimeoutMs() { return readTimeoutMs; }
    public boolean isStatusEnabled() { return statusEnabled; }
    public int getStatusPort() { return statusPort; }
    public boolean isSkipBacklog() { return skipBacklog; }

    /** 원격 동기화에 필요한 값이 다 있는지 */
    public boolean isRemoteConfigured() {
        return apiEnabled && !apiUrl.isBlank() && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ShipperConfig{dir=" + conversationDir
                + ", db=" + (sqliteEnabled ? databasePath : "disabled")
                + ", api=" + (apiEnabled ? apiUrl : "disabled")
                + ", apiKey=" + (apiKey.isBlank() ? "NOT SET" : "***SET***")
                + ", filter=" + debugFilterProject + "}";
    }
}
