package com.airoom.logshipper.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessSupervisorTest {

    @TempDir
    Path dir;

    @Test
    void secondInstanceCannotAcquire() throws Exception {
        try (ProcessSupervisor first = new ProcessSupervisor(dir);
             ProcessSupervisor second = new ProcessSupervisor(dir)) {
            assertThat(first.tryAcquire()).isTrue();
            assertThat(second.tryAcquire()).isFalse();
        }
    }

    @Test
    void pidFileNamesCurrentProcessAndIsRemovedOnClose() throws Exception {
        ProcessSupervisor sup = new ProcessSupervisor(dir);
        assertThat(sup.tryAcquire()).isTrue();

        assertThat(Files.readString(dir.resolve(ProcessSupervisor.PID_FILE)).trim())
                .isEqualTo(Long.toString(ProcessHandle.current().pid()));
        assertThat(new ProcessSupervisor(dir).runningPid()).hasValue(ProcessHandle.current().pid());

        sup.close();

        assertThat(dir.resolve(ProcessSupervisor.PID_FILE)).doesNotExist();
        try (ProcessSupervisor again = new ProcessSupervisor(dir)) {
            assertThat(again.tryAcquire()).isTrue();
        }
    }

    @Test
    void stalePidFileIsCleanedUp() throws Exception {
        Path pid = dir.resolve(ProcessSupervisor.PID_FILE);
        Files.writeString(pid, "2000000000");

        assertThat(new ProcessSupervisor(dir).runningPid()).isEmpty();
        assertThat(pid).doesNotExist();
    }

    @Test
    void garbagePidFileIsCleanedUp() throws Exception {
        Path pid = dir.resolve(ProcessSupervisor.PID_FILE);
        Files.writeString(pid, "not-a-pid");

        assertThat(new ProcessSupervisor(dir).runningPid()).isEmpty();
        assertThat(pid).doesNotExist();
    }
}
