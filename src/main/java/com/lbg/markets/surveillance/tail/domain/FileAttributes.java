package com.lbg.markets.surveillance.tail.domain;

import java.nio.file.Path;

/**
 * File-system metadata resolved once when a reader is attached to a file.
 * {@code fileKey} is the platform key (device and inode on POSIX) or null.
 */
public record FileAttributes(
        String name,
        String path,
        String nameResolved,
        String pathResolved,
        String fileKey
) {
    /**
     * Attributes derived from the path alone, used when resolution fails.
     */
    public static FileAttributes unresolved(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString() : path.toString();
        return new FileAttributes(name, path.toString(), name, path.toString(), null);
    }
}
