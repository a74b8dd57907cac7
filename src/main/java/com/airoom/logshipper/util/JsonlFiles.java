package com.airoom.logshipper.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/** *.jsonl 파일 관련 공통 처리 (상대 경로 이름, 줄 읽기, 디렉터리 순회) */
public final class JsonlFiles {

    public static final String EXTENSION = ".jsonl";

    private JsonlFiles() {}

    /**
     * 파일 내용 스냅샷.
     * lines 는 '\n' 기준으로 나눈 줄 (끝의 '\r' 제거), lastTerminated 는 마지막 줄이 '\n' 으로 끝났는지.
     * UTF-8 로 읽을 수 없는 줄은 null 로 남긴다 (대체 문자로 바꾸지 않음).
     */
    public record Snapshot(List<String> lines, boolean lastTerminated) {
        public int lineCount() { return lines.size(); }
    }

    public static boolean isJsonl(Path p) {
        Path name = p.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }

    /** 감시 루트 기준 상대 경로, 구분자는 항상 '/' */
    public static String relativeName(Path root, Path file) {
        Path abs = file.toAbsolutePath().normalize();
        Path base = root.toAbsolutePath().normalize();
        if (!abs.startsWith(base)) return String.valueOf(abs.getFileName());
        return base.relativize(abs).toString().replace('\\', '/');
    }

    public static boolean matchesFilter(String relativeName, String filter) {
        return filter == null || relativeName.startsWith(filter);
    }

    public static Snapshot read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        if (bytes.length == 0) return new Snapshot(Collections.emptyList(), true);

        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                lines.add(decodeLine(bytes, start, i));
                start = i + 1;
            }
        }
        boolean terminated = start == bytes.length;
        if (!terminated) lines.add(decodeLine(bytes, start, bytes.length));
        return new Snapshot(lines, terminated);
    }

    /** 줄 수 (마지막 줄에 개행이 없어도 한 줄로 센다) */
    public static int countLines(Path file) throws IOException {
        return read(file).lineCount();
    }

    /** root 아래의 모든 *.jsonl (읽을 수 없는 디렉터리는 건너뜀) */
    public static List<Path> listAll(Path root) throws IOException {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(root)) return out;
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isJsonl(file)) out.add(file);
                return FileVisitResult.CONTINUE;
            }

            @Override public FileVisitResult visitFileFailed(Path file, IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(out);
        return out;
    }

    /** [from, to) 구간을 엄격한 UTF-8 로 디코딩, 실패하면 null */
    private static String decodeLine(byte[] bytes, int from, int to) {
        if (to > from && bytes[to - 1] == '\r') to--;
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, from, to - from)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
