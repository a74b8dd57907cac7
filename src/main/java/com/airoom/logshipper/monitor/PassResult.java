package com.airoom.logshipper.monitor;

/**
 * 파일 한 번 처리한 결과.
 * cursorAfter 는 이번 패스가 끝난 뒤 커서 (실패 시 cursorBefore 그대로).
 */
public record PassResult(
        String fileName,
        int cursorBefore,
        int cursorAfter,
        int parsed,
        int malformed,
        int blank,
        int stored,
        boolean deferredPartialLine,
        boolean failed
) {
    static PassResult skipped(String fileName) {
        return new PassResult(fileName, 0, 0, 0, 0, 0, 0, false, false);
    }

    static PassResult unchanged(String fileName, int cursor, boolean deferred) {
        return new PassResult(fileName, cursor, cursor, 0, 0, 0, 0, deferred, false);
    }

    static PassResult failed(String fileName, int cursor) {
        return new PassResult(fileName, cursor, cursor, 0, 0, 0, 0, false, true);
    }

    public int linesConsumed() { return cursorAfter - cursorBefore; }
}
