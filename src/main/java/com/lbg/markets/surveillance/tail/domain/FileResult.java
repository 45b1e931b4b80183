package com.lbg.markets.surveillance.tail.domain;

import java.nio.file.Path;

/**
 * What happened to a single file during one poll cycle.
 */
public record FileResult(
        Path path,
        Status status,
        int entries,
        long offset,
        String errorMessage
) {
    public enum Status {
        /** First seen; a fresh reader was built. */
        NEW,
        /** Matched a tracked reader and continued from its offset. */
        CONTINUED,
        /** Tracked but no longer discovered; drained and closed. */
        LOST,
        /** Over the open file budget; retried next cycle. */
        DEFERRED,
        FAILED
    }

    public static FileResult deferred(Path path) {
        return new FileResult(path, Status.DEFERRED, 0, -1, null);
    }

    public static FileResult failed(Path path, String error) {
        return new FileResult(path, Status.FAILED, 0, -1, error);
    }

    public FileResult withProgress(int entries, long offset) {
        return new FileResult(path, status, entries, offset, errorMessage);
    }

    public FileResult withError(String error) {
        return new FileResult(path, Status.FAILED, entries, offset, error);
    }
}
