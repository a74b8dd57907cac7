package com.airoom.logshipper.git;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * `git -C dir remote get-url origin` / `git -C dir rev-parse HEAD` 로 조회.
 * 명령마다 1초 제한, 같은 디렉터리는 30초 동안 캐시.
 */
public class GitCommandResolver implements GitContextResolver {

    private static final Logger log = LoggerFactory.getLogger(GitCommandResolver.class);

    static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(1);

    /** 종료 코드 0 이면 표준출력, 아니면 null */
    @FunctionalInterface
    interface CommandRunner {
        String run(Path dir, List<String> args) throws IOException, InterruptedException;
    }

    private final CommandRunner runner;
    private final Cache<String, GitContext> cache = Caffeine.newBuilder()
            .expireAfterWrite(30, TimeUnit.SECONDS)
            .maximumSize(1_000)
            .build();

    public GitCommandResolver() { this(GitCommandResolver::runGit); }

    GitCommandResolver(CommandRunner runner) { this.runner = runner; }

    @Override
    public GitContext resolve(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) return GitContext.NONE;
        String key = directory.toAbsolutePath().normalize().toString();
        return cache.get(key, k -> lookup(directory));
    }

    private GitContext lookup(Path dir) {
        String remote = query(dir, List.of("remote", "get-url", "origin"));
        String commit = query(dir, List.of("rev-parse", "HEAD"));
        GitContext ctx = new GitContext(remote, commit);
        log.debug("[Git] {} → remote={}, commit={}", dir, remote, commit);
        return ctx.isPresent() ? ctx : GitContext.NONE;
    }

    private String query(Path dir, List<String> args) {
        try {
            String out = runner.run(dir, args);
            if (out == null) return null;
            String trimmed = out.trim();
            return trimmed.isEmpty() ? null : trimmed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (IOException e) {
            log.debug("[Git] git {} failed in {}: {}", args, dir, e.getMessage());
            return null;
        }
    }

    private static String runGit(Path dir, List<String> args) throws IOException, InterruptedException {
        List<String> cmd = new ArrayList<>();
        cmd.add("git");
        cmd.add("-C");
        cmd.add(dir.toString());
        cmd.addAll(args);

        Process p = new ProcessBuilder(cmd).redirectError(ProcessBuilder.Redirect.DISCARD).start();
        p.getOutputStream().close();
        if (!p.waitFor(COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
            p.destroyForcibly();
            throw new IOException("git timed out after " + COMMAND_TIMEOUT.toMillis() + "ms");
        }
        if (p.exitValue() != 0) return null;
        return readAll(p.getInputStream());
    }

    private static String readAll(InputStream in) throws IOException {
        try (in) {
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            in.transferTo(buf);
            return buf.toString(StandardCharsets.UTF_8);
        }
    }
}
