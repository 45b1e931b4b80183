package com.lbg.markets.surveillance.tail.util;

import com.lbg.markets.surveillance.tail.domain.FileAttributes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Utility for resolving the file-system attributes of a tailed file.
 * The resolved path follows symlinks; the file key identifies the underlying inode where
 * the platform exposes one.
 */
public final class FileAttributesResolver {

    private FileAttributesResolver() {
        // Utility class
    }

    public static FileAttributes resolve(Path path) throws AttributeResolutionException {
        try {
            Path absolute = path.toAbsolutePath();
            Path resolved = absolute.toRealPath();
            BasicFileAttributes attrs = Files.readAttributes(resolved, BasicFileAttributes.class);
            Object fileKey = attrs.fileKey();

            return new FileAttributes(
                    fileName(absolute),
                    absolute.toString(),
                    fileName(resolved),
                    resolved.toString(),
                    fileKey != null ? fileKey.toString() : null
            );
        } catch (IOException | SecurityException e) {
            throw new AttributeResolutionException("Failed to resolve attributes: " + path, e);
        }
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }
}
