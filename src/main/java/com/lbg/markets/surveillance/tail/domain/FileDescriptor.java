package com.lbg.markets.surveillance.tail.domain;

import java.nio.file.Path;

/**
 * Describes a file matched by discovery, before it is opened.
 */
public record FileDescriptor(
        Path path,
        long sizeBytes,
        long mtimeEpochMs
) {
    public FileDescriptor {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }
}
