package com.airoom.logshipper.store;

import com.airoom.logshipper.util.JsonlFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** DB 파일 자체를 열 수 없을 때 쓰는 휘발성 커서 (재시작하면 처음부터) */
public class InMemoryCursorTracker implements CursorTracker {

    private final Map<String, Integer> cursors = new ConcurrentHashMap<>();

    @Override
    public int getLastLine(String fileName) {
        return cursors.getOrDefault(fileName, 0);
    }

    @Override
    public void setLastLine(String fileName, int lastLine) {
        cursors.merge(fileName, lastLine, Math::max);
    }

    @Override
    public int fastForwardAll(Path root, String filter) throws IOException {
        int count = 0;
        for (Path f : JsonlFiles.listAll(root)) {
            String name = JsonlFiles.relativeName(root, f);
            if (!JsonlFiles.matchesFilter(name, filter)) continue;
            int lines = JsonlFiles.countLines(f);
            if (lines > 0) {
                setLastLine(name, lines);
                count++;
            }
        }
        return count;
    }

    @Override
    public int trackedFileCount() {
        return cursors.size();
    }
}
