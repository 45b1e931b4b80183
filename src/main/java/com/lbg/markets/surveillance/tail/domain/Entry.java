package com.lbg.markets.surveillance.tail.domain;

import java.util.Map;

/**
 * A single decoded record read from a file.
 * {@code offset} is the byte position just past the record.
 */
public record Entry(
        String body,
        Map<String, String> attributes,
        long offset
) {
    public static final String FILE_NAME = "log.file.name";
    public static final String FILE_PATH = "log.file.path";
    public static final String FILE_NAME_RESOLVED = "log.file.name_resolved";
    public static final String FILE_PATH_RESOLVED = "log.file.path_resolved";

    public Entry {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }
}
