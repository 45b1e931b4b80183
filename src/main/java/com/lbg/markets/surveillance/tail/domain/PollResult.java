package com.lbg.markets.surveillance.tail.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Summary of one poll cycle.
 */
public record PollResult(
        long cycle,
        List<FileResult> files,
        int openFiles,
        boolean cancelled
) {
    public PollResult {
        files = files != null ? List.copyOf(files) : List.of();
    }

    public long count(FileResult.Status status) {
        return files.stream().filter(f -> f.status() == status).count();
    }

    public int entries() {
        return files.stream().mapToInt(FileResult::entries).sum();
    }

    public Optional<FileResult> file(Path path) {
        return files.stream().filter(f -> f.path().equals(path)).findFirst();
    }
}
