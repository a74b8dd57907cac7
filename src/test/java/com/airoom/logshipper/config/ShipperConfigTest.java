package com.airoom.logshipper.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShipperConfigTest {

    @TempDir
    Path home;

    private final Map<String, String> props = new HashMap<>();
    private final Map<String, String> env = new HashMap<>();

    private ShipperConfig load() {
        props.putIfAbsent("shipper.home", home.toString());
        return ShipperConfig.load(props::get, env::get);
    }

    private void writeConfig(String json) throws Exception {
        Files.writeString(home.resolve("config.json"), json, StandardCharsets.UTF_8);
    }

    @Test
    void createsDefaultFileWhenMissing() {
        ShipperConfig cfg = load();

        assertThat(home.resolve("config.json")).exists();
        assertThat(cfg.isApiEnabled()).isFalse();
        assertThat(cfg.isSqliteEnabled()).isTrue();
        assertThat(cfg.getSyncBatchSize()).isEqualTo(50);
        assertThat(cfg.getSyncThrottle()).isEqualTo(Duration.ofMillis(100));
        assertThat(cfg.getMaxBackoff()).isEqualTo(Duration.ofMinutes(5));
        assertThat(cfg.getDebugFilterProject()).isNull();
        assertThat(cfg.isRemoteConfigured()).isFalse();
    }

    @Test
    void propertyBeatsEnvironmentBeatsFile() throws Exception {
        writeConfig("{\"api\":{\"enabled\":true,\"url\":\"http://file/\",\"api_key\":\"file-key\"},"
                + "\"sync\":{\"batch_size\":7}}");
        env.put("SHIPPER_API_URL", "http://env");
        env.put("SHIPPER_SYNC_BATCH_SIZE", "9");
        props.put("shipper.sync.batchSize", "11");

        ShipperConfig cfg = load();

        assertThat(cfg.getApiUrl()).isEqualTo("http://env");
        assertThat(cfg.getApiKey()).isEqualTo("file-key");
        assertThat(cfg.getSyncBatchSize()).isEqualTo(11);
        assertThat(cfg.isRemoteConfigured()).isTrue();
    }

    @Test
    void fileValuesAreUsedWithTrailingSlashStripped() throws Exception {
        writeConfig("{\"api\":{\"url\":\"http://collector.local/\"},"
                + "\"monitor\":{\"conversation_dir\":\"/data/logs\",\"debug_filter_project\":\"-proj-a\"}}");

        ShipperConfig cfg = load();

        assertThat(cfg.getApiUrl()).isEqualTo("http://collector.local");
        assertThat(cfg.getConversationDir()).isEqualTo(Path.of("/data/logs"));
        assertThat(cfg.getDebugFilterProject()).isEqualTo("-proj-a");
    }

    @Test
    void malformedNumberFallsBackToDefault() {
        props.put("shipper.sync.idleSeconds", "soon");

        assertThat(load().getSyncIdleInterval()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void unreadableConfigFileIsAConfigException() throws Exception {
        writeConfig("{ not json");

        assertThatThrownBy(this::load).isInstanceOf(ConfigException.class);
    }

    @Test
    void toStringMasksApiKey() {
        props.put("shipper.api.key", "super-secret-key");

        assertThat(load().toString()).contains("***SET***").doesNotContain("super-secret-key");
    }

    @Test
    void envNameIsUpperSnake() {
        assertThat(ShipperConfig.envName("sync.initialBackoffMillis")).isEqualTo("SHIPPER_SYNC_INITIAL_BACKOFF_MILLIS");
        assertThat(ShipperConfig.envName("api.key")).isEqualTo("SHIPPER_API_KEY");
    }
}
