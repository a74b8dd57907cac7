package com.airoom.logshipper.store;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;

/**
 * 파일별 마지막 처리 줄 번호.
 * 값은 줄어들지 않는다 - 더 작은 값으로 set 해도 기존 값이 유지된다.
 */
public interface CursorTracker {

    /** 처음 보는 파일이면 0 */
    int getLastLine(String fileName) throws SQLException;

    void setLastLine(String fileName, int lastLine) throws SQLException;

    /**
     * root 아래 필터에 맞는 모든 *.jsonl 의 커서를 현재 줄 수로 옮긴다 (내용은 수집하지 않음).
     * @return 옮긴 파일 수
     */
    int fastForwardAll(Path root, String filter) throws SQLException, IOException;

    int trackedFileCount() throws SQLException;
}
