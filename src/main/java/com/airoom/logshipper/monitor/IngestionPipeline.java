package com.airoom.logshipper.monitor;

import com.airoom.logshipper.event.DerivedColumn;
import com.airoom.logshipper.event.EventPayloads;
import com.airoom.logshipper.event.NewEvent;
import com.airoom.logshipper.git.GitContext;
import com.airoom.logshipper.git.GitContextResolver;
import com.airoom.logshipper.network.DirectForwardQueue;
import com.airoom.logshipper.network.PendingEvent;
import com.airoom.logshipper.redact.EventRedactor;
import com.airoom.logshipper.store.CursorTracker;
import com.airoom.logshipper.store.EventStore;
import com.airoom.logshipper.util.JsonlFiles;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 변경된 .jsonl 파일에서 커서 이후의 새 줄만 읽어 저장한다.
 *
 * 순서:
 *  1) 감시 루트 기준 이름 → 디버그 필터
 *  2) 커서 이후 줄만 잘라냄 (없으면 바로 종료)
 *  3) 줄마다 JSON 파싱. 깨진 줄은 WARN 후 건너뛰되 커서는 넘긴다
 *  4) git 정보는 패스당 한 번
 *  5) 배치 저장 → 커서 이동 (저장이 끝난 뒤에만)
 * 네트워크 I/O 는 하지 않는다. 저장소가 없을 때는 마스킹한 사본을 직접 전송 큐에 넣는다.
 * 큐가 가득 차면 들어간 줄까지만 커서를 옮기고, 그 파일은 resumeBacklogged() 에서 다시 처리한다.
 */
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final Path root;
    private final String filter;
    private final CursorTracker cursors;
    private final EventStore store;            // null 이면 로컬 기록 꺼짐
    private final DirectForwardQueue direct;   // null 이면 직접 전송 없음
    private final EventRedactor redactor;
    private final GitContextResolver git;
    private final Set<Path> backlogged = ConcurrentHashMap.newKeySet();

    public IngestionPipeline(Path root, String filter, CursorTracker cursors, EventStore store,
                             DirectForwardQueue direct, EventRedactor redactor, GitContextResolver git) {
        if (store == null && direct == null) throw new IllegalArgumentException("no sink configured");
        this.root = root;
        this.filter = filter;
        this.cursors = cursors;
        this.store = store;
        this.direct = direct;
        this.redactor = redactor;
        this.git = git;
    }

    public Path root() { return root; }

    /** 직접 전송 큐가 가득 차 중간에 멈춘 파일들을 다시 처리. @return 다시 본 파일 수 */
    public int resumeBacklogged() {
        if (backlogged.isEmpty()) return 0;
        List<Path> files = new ArrayList<>(backlogged);
        for (Path f : files) processSafely(f);
        return files.size();
    }

    public boolean hasBacklog() { return !backlogged.isEmpty(); }

    /** 감시 스레드용. 예외는 로그로만 남기고 커서는 그대로 둔다 */
    public PassResult processSafely(Path file) {
        try {
            return process(file);
        } catch (IOException | SQLException | RuntimeException e) {
            log.error("[Ingest] error processing {}: {}", file, e.toString());
            String name = JsonlFiles.relativeName(root, file);
            int cursor;
            try {
                cursor = cursors.getLastLine(name);
            } catch (SQLException ce) {
                log.debug("[Ingest] cursor unreadable for {}: {}", name, ce.getMessage());
                cursor = 0;
            }
            return PassResult.failed(name, cursor);
        }
    }

    public PassResult process(Path file) throws IOException, SQLException {
        String name = JsonlFiles.relativeName(root, file);
        if (!JsonlFiles.isJsonl(file) || !Files.isRegularFile(file)) return PassResult.skipped(name);
        if (!JsonlFiles.matchesFilter(name, filter)) return PassResult.skipped(name);
        backlogged.remove(file);

        int last = cursors.getLastLine(name);
        JsonlFiles.Snapshot snap = JsonlFiles.read(file);
        List<String> lines = snap.lines();

        if (lines.size() <= last) {
            // 빈 파일도 추적 대상으로 남긴다
            if (last == 0 && lines.isEmpty()) cursors.setLastLine(name, 0);
            return PassResult.unchanged(name, last, false);
        }

        int end = lines.size();
        boolean deferred = false;
        if (!snap.lastTerminated() && !parses(lines.get(end - 1))) {
            // 아직 쓰는 중인 마지막 줄 - 다음 알림 때 다시 본다
            end--;
            deferred = true;
            if (end <= last) return PassResult.unchanged(name, last, true);
        }

        log.debug("[Ingest] {} new line(s) in {}", end - last, name);

        List<Parsed> parsed = new ArrayList<>();
        int blank = 0;
        int malformed = 0;
        for (int i = last; i < end; i++) {
            int lineNumber = i + 1;
            String line = lines.get(i);
            if (line == null) {
                malformed++;
                log.warn("[Ingest] invalid UTF-8 at {}:{}, skipped", name, lineNumber);
                continue;
            }
            String raw = line.trim();
            if (raw.isEmpty()) {
                blank++;
                continue;
            }
            try {
                parsed.add(new Parsed(lineNumber, raw, EventPayloads.parseObject(raw)));
            } catch (JsonParseException e) {
                malformed++;
                log.warn("[Ingest] invalid JSON at {}:{}, skipped: {}", name, lineNumber, e.getMessage());
            }
        }

        GitContext ctx = parsed.isEmpty() ? GitContext.NONE : resolveGit(file, parsed.get(0).payload());

        int stored = 0;
        if (!parsed.isEmpty()) {
            if (store != null) {
                List<NewEvent> batch = new ArrayList<>(parsed.size());
                for (Parsed p : parsed) {
                    batch.add(new NewEvent(name, p.lineNumber(), p.raw(), ctx.remoteUrl(), ctx.commitHash()));
                }
                Set<Integer> invalid = store.invalidLines(batch);
                if (!invalid.isEmpty()) {
                    for (int n : invalid) {
                        log.warn("[Ingest] JSON rejected by store at {}:{}, skipped", name, n);
                    }
                    malformed += invalid.size();
                    batch.removeIf(e -> invalid.contains(e.lineNumber()));
                }
                stored = store.insertBatch(batch);
            } else {
                for (Parsed p : parsed) {
                    PendingEvent queued = direct.enqueue(new PendingEvent(0, name, p.lineNumber(),
                            redactor.redact(p.payload()), ctx.remoteUrl(), ctx.commitHash()));
                    if (queued == null) {
                        // 받아들여진 줄까지만 진행
                        end = p.lineNumber() - 1;
                        backlogged.add(file);
                        log.warn("[Ingest] direct queue full, {} paused at line {}", name, end);
                        break;
                    }
                    stored++;
                }
            }
        }

        // 저장이 끝난 뒤에만 커서 이동 (깨진 줄 포함, 최대 처리 줄까지)
        cursors.setLastLine(name, end);

        if (stored > 0 || malformed > 0) {
            log.info("[Ingest] {}: {} stored{}, {} malformed, cursor {} → {}{}", name, stored,
                    store == null ? " (direct)" : "", malformed, last, end, summary(parsed));
        }
        return new PassResult(name, last, end, parsed.size(), malformed, blank, stored, deferred, false);
    }

    private GitContext resolveGit(Path file, JsonObject first) {
        Path dir = file.toAbsolutePath().getParent();
        String cwd = EventPayloads.string(first, "cwd");
        if (cwd != null && !cwd.isBlank()) {
            try {
                dir = Paths.get(cwd);
            } catch (InvalidPathException e) {
                log.debug("[Ingest] unusable cwd '{}': {}", cwd, e.getMessage());
            }
        }
        try {
            GitContext ctx = git.resolve(dir);
            return ctx == null ? GitContext.NONE : ctx;
        } catch (RuntimeException e) {
            log.debug("[Ingest] git lookup failed for {}: {}", dir, e.getMessage());
            return GitContext.NONE;
        }
    }

    private static boolean parses(String line) {
        if (line == null) return false;
        String raw = line.trim();
        if (raw.isEmpty()) return false;
        try {
            EventPayloads.parseObject(raw);
            return true;
        } catch (JsonParseException e) {
            return false;
        }
    }

    /** " [session abc, types user/assistant]" 형태의 짧은 요약 */
    private static String summary(List<Parsed> parsed) {
        if (parsed.isEmpty() || !log.isInfoEnabled()) return "";
        Parsed first = parsed.get(0);
        String session = DerivedColumn.EVENT_SESSION_ID.evaluate(first.payload());
        List<String> types = new ArrayList<>();
        for (Parsed p : parsed) {
            String t = DerivedColumn.EVENT_TYPE.evaluate(p.payload());
            if (t != null && !types.contains(t)) types.add(t);
        }
        return " [session " + session + ", types " + String.join("/", types) + "]";
    }

    private record Parsed(int lineNumber, String raw, JsonObject payload) {}
}
