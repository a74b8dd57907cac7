package com.airoom.logshipper.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonlFilesTest {

    @TempDir
    Path dir;

    @Test
    void splitsOnNewlineAndStripsCarriageReturn() throws Exception {
        Path f = dir.resolve("a.jsonl");
        Files.writeString(f, "one\r\n\ntwo\nthree", StandardCharsets.UTF_8);

        JsonlFiles.Snapshot snap = JsonlFiles.read(f);

        assertThat(snap.lines()).containsExactly("one", "", "two", "three");
        assertThat(snap.lastTerminated()).isFalse();
    }

    @Test
    void terminatedFileHasNoPhantomLastLine() throws Exception {
        Path f = dir.resolve("a.jsonl");
        Files.writeString(f, "one\ntwo\n", StandardCharsets.UTF_8);

        assertThat(JsonlFiles.read(f).lines()).containsExactly("one", "two");
        assertThat(JsonlFiles.read(f).lastTerminated()).isTrue();
        assertThat(JsonlFiles.countLines(f)).isEqualTo(2);
    }

    @Test
    void undecodableLineIsNullAndNeighboursKeepTheirBytes() throws Exception {
        Path f = dir.resolve("a.jsonl");
        byte[] bad = {'{', '"', 'x', '"', ':', '"', (byte) 0xC3, (byte) 0x28, '"', '}'};
        byte[] good = "{\"x\":\"héllo\"}".getBytes(StandardCharsets.UTF_8);
        try (var out = Files.newOutputStream(f)) {
            out.write(good);
            out.write('\n');
            out.write(bad);
            out.write('\n');
            out.write(good);
            out.write('\n');
        }

        JsonlFiles.Snapshot snap = JsonlFiles.read(f);

        assertThat(snap.lines()).hasSize(3);
        assertThat(snap.lines().get(0)).isEqualTo("{\"x\":\"héllo\"}");
        assertThat(snap.lines().get(1)).isNull();
        assertThat(snap.lines().get(2)).isEqualTo("{\"x\":\"héllo\"}");
    }

    @Test
    void relativeNameUsesForwardSlashes() {
        assertThat(JsonlFiles.relativeName(dir, dir.resolve("proj").resolve("s.jsonl"))).isEqualTo("proj/s.jsonl");
        assertThat(JsonlFiles.isJsonl(dir.resolve("x.JSONL"))).isTrue();
        assertThat(JsonlFiles.isJsonl(dir.resolve("x.json"))).isFalse();
    }

    @Test
    void listsJsonlRecursively() throws Exception {
        Files.createDirectories(dir.resolve("p/q"));
        Files.writeString(dir.resolve("p/q/a.jsonl"), "{}\n", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("p/b.jsonl"), "{}\n", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("p/c.txt"), "{}\n", StandardCharsets.UTF_8);

        assertThat(JsonlFiles.listAll(dir)).hasSize(2).allMatch(JsonlFiles::isJsonl);
    }
}
