package com.airoom.logshipper.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.SystemInfo;
import oshi.software.os.OperatingSystem;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;

/*
 단일 실행 보장 + PID 파일.
  - shipper.lock : FileChannel#tryLock 으로 OS 수준 배타 잠금. 프로세스가 죽으면 OS 가 풀어준다.
  - shipper.pid  : 실행 중인 PID 기록. 다른 도구가 "지금 돌고 있나?" 를 확인할 때 사용.
    PID 가 살아있는지는 OSHI 로 확인하고, 죽은 PID 면 파일을 지운다.
*/
public final class ProcessSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    static final String LOCK_FILE = "shipper.lock";
    static final String PID_FILE = "shipper.pid";

    private final Path lockFile;
    private final Path pidFile;
    private FileChannel channel;
    private FileLock lock;

    public ProcessSupervisor(Path dataDir) {
        this.lockFile = dataDir.resolve(LOCK_FILE);
        this.pidFile = dataDir.resolve(PID_FILE);
    }

    /** @return 잠금을 얻었으면 true, 이미 다른 인스턴스가 실행 중이면 false */
    public synchronized boolean tryAcquire() throws IOException {
        if (lock != null) return true;
        Files.createDirectories(lockFile.toAbsolutePath().getParent());
        channel = FileChannel.open(lockFile, CREATE, WRITE);
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // 같은 JVM 안에서 이미 잡고 있음
            lock = null;
        }
        if (lock == null) {
            channel.close();
            channel = null;
            return false;
        }
        Files.writeString(pidFile, Long.toString(ProcessHandle.current().pid()), StandardCharsets.UTF_8);
        log.debug("[Supervisor] lock acquired, pid file → {}", pidFile);
        return true;
    }

    /** PID 파일에 기록된, 아직 살아있는 프로세스 */
    public OptionalLong runningPid() {
        if (!Files.isRegularFile(pidFile)) return OptionalLong.empty();
        long pid;
        try {
            pid = Long.parseLong(Files.readString(pidFile, StandardCharsets.UTF_8).trim());
        } catch (IOException | NumberFormatException e) {
            log.warn("[Supervisor] unreadable pid file {}, removing", pidFile);
            deleteQuietly(pidFile);
            return OptionalLong.empty();
        }
        if (isAlive(pid)) return OptionalLong.of(pid);

        log.info("[Supervisor] stale pid file (pid {} not running), removing", pid);
        deleteQuietly(pidFile);
        return OptionalLong.empty();
    }

    static boolean isAlive(long pid) {
        if (pid <= 0 || pid > Integer.MAX_VALUE) return false;
        OperatingSystem os = new SystemInfo().getOperatingSystem();
        return os.getProcess((int) pid) != null;
    }

    @Override
    public synchronized void close() {
        if (lock == null) return;
        deleteQuietly(pidFile);
        try {
            lock.release();
            channel.close();
        } catch (IOException e) {
            log.debug("[Supervisor] lock release failed: {}", e.getMessage());
        }
        lock = null;
        channel = null;
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("[Supervisor] cannot delete {}: {}", p, e.getMessage());
        }
    }
}
