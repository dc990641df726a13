package com.purchasingpower.codegraph.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File size and modification time, remembered for the lifetime
 * of one scan session. Create one per scan and drop it afterwards.
 */
public class FileStatsCache {

    private final Map<Path, FileStats> stats = new ConcurrentHashMap<>();

    public FileStats stats(Path file) throws IOException {
        FileStats cached = stats.get(file);
        if (cached != null) {
            return cached;
        }
        FileStats fresh = new FileStats(
            Files.size(file),
            Files.getLastModifiedTime(file).toInstant());
        FileStats previous = stats.putIfAbsent(file, fresh);
        return previous != null ? previous : fresh;
    }

    public void clear() {
        stats.clear();
    }

    public record FileStats(long sizeBytes, Instant lastModified) {
    }
}
