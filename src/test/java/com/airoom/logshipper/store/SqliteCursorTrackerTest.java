package com.airoom.logshipper.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteCursorTrackerTest {

    @TempDir
    Path dir;

    @Test
    void unseenFileStartsAtZeroAndCursorNeverMovesBack() throws Exception {
        try (SqliteDatabase db = SqliteDatabase.open(dir.resolve("c.db"))) {
            SqliteCursorTracker cursors = new SqliteCursorTracker(db);

            assertThat(cursors.getLastLine("p/a.jsonl")).isZero();
            cursors.setLastLine("p/a.jsonl", 5);
            cursors.setLastLine("p/a.jsonl", 5);
            cursors.setLastLine("p/a.jsonl", 3);

            assertThat(cursors.getLastLine("p/a.jsonl")).isEqualTo(5);
            assertThat(cursors.trackedFileCount()).isEqualTo(1);
        }
    }

    @Test
    void survivesReopen() throws Exception {
        try (SqliteDatabase db = SqliteDatabase.open(dir.resolve("c.db"))) {
            new SqliteCursorTracker(db).setLastLine("a.jsonl", 42);
        }
        try (SqliteDatabase db = SqliteDatabase.open(dir.resolve("c.db"))) {
            assertThat(new SqliteCursorTracker(db).getLastLine("a.jsonl")).isEqualTo(42);
        }
    }

    @Test
    void importsLegacySnapshotOnceAndArchivesIt() throws Exception {
        Path legacy = dir.resolve("state.json");
        Files.writeString(legacy, "{\"proj/a.jsonl\": 12, \"proj/b.jsonl\": 3, \"bogus\": \"x\"}", StandardCharsets.UTF_8);

        try (SqliteDatabase db = SqliteDatabase.open(dir.resolve("c.db"))) {
            SqliteCursorTracker cursors = new SqliteCursorTracker(db);

            assertThat(cursors.getLastLine("proj/a.jsonl")).isEqualTo(12);
            assertThat(cursors.getLastLine("proj/b.jsonl")).isEqualTo(3);
            assertThat(cursors.trackedFileCount()).isEqualTo(2);
        }
        assertThat(legacy).doesNotExist();
        assertThat(dir.resolve("state.json.bak")).exists();
    }

    @Test
    void legacySnapshotArchivedWithoutImportWhenCursorsAlreadyExist() throws Exception {
        try (SqliteDatabase db = SqliteDatabase.open(dir.resolve("c.db"))) {
            new SqliteCursorTracker(db).setLastLine("a.jsonl", 1);
        }
        Files.writeString(dir.resolve("state.json"), "{\"a.jsonl\": 99}", StandardCharsets.UTF_8);

        try (SqliteDatabase db = SqliteDatabase.open(dir.resolve("c.db"))) {
            assertThat(new SqliteCursorTracker(db).getLastLine("a.jsonl")).isEqualTo(1);
        }
        assertThat(dir.resolve("state.json")).doesNotExist();
        assertThat(dir.resolve("state.json.bak")).exists();

        // 다음 시작 때는 더 이상 보지 않는다
        try (SqliteDatabase db = SqliteDatabase.open(dir.resolve("c.db"))) {
            assertThat(new SqliteCursorTracker(db).getLastLine("a.jsonl")).isEqualTo(1);
        }
    }

    @Test
    void fastForwardSetsCursorsToLineCountsWithinFilter() throws Exception {
        Path root = Files.createDirectories(dir.resolve("projects"));
        Files.createDirectories(root.resolve("-proj-a"));
        Files.createDirectories(root.resolve("-proj-b"));
        Files.writeString(root.resolve("-proj-a/s1.jsonl"), "{}\n{}\n{}\n", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("-proj-a/s2.jsonl"), "{}\n{}", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("-proj-a/empty.jsonl"), "", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("-proj-b/s3.jsonl"), "{}\n", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("-proj-a/notes.txt"), "x\n", StandardCharsets.UTF_8);

        try (SqliteDatabase db = SqliteDatabase.open(dir.resolve("c.db"))) {
            SqliteCursorTracker cursors = new SqliteCursorTracker(db);

            int moved = cursors.fastForwardAll(root, "-proj-a");

            assertThat(moved).isEqualTo(2);
            assertThat(cursors.getLastLine("-proj-a/s1.jsonl")).isEqualTo(3);
            assertThat(cursors.getLastLine("-proj-a/s2.jsonl")).isEqualTo(2);
            assertThat(cursors.getLastLine("-proj-b/s3.jsonl")).isZero();
        }
    }

    @Test
    void inMemoryTrackerHasSameContract() throws Exception {
        InMemoryCursorTracker cursors = new InMemoryCursorTracker();
        cursors.setLastLine("a.jsonl", 4);
        cursors.setLastLine("a.jsonl", 2);

        assertThat(cursors.getLastLine("a.jsonl")).isEqualTo(4);
        assertThat(cursors.getLastLine("b.jsonl")).isZero();
        assertThat(cursors.trackedFileCount()).isEqualTo(1);
    }
}
