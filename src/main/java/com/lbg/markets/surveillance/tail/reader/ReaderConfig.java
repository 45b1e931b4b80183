package com.lbg.markets.surveillance.tail.reader;

import com.lbg.markets.surveillance.tail.domain.ConfigurationException;
import com.lbg.markets.surveillance.tail.domain.Fingerprint;

/**
 * Per-reader settings shared by every reader a factory builds.
 */
public record ReaderConfig(
        int fingerprintSize,
        int maxLogSize,
        boolean includeFileName,
        boolean includeFilePath,
        boolean includeFileNameResolved,
        boolean includeFilePathResolved
) {
    public static final int DEFAULT_MAX_LOG_SIZE = 1024 * 1024;

    public ReaderConfig {
        if (fingerprintSize < Fingerprint.MIN_SIZE) {
            throw new ConfigurationException("fingerprintSize must be at least " + Fingerprint.MIN_SIZE);
        }
        if (maxLogSize <= 0) {
            throw new ConfigurationException("maxLogSize must be positive");
        }
    }

    public static ReaderConfig defaults() {
        return new ReaderConfig(Fingerprint.DEFAULT_SIZE, DEFAULT_MAX_LOG_SIZE, true, false, false, false);
    }

    public ReaderConfig withFingerprintSize(int size) {
        return new ReaderConfig(size, maxLogSize, includeFileName, includeFilePath,
                includeFileNameResolved, includeFilePathResolved);
    }

    public ReaderConfig withMaxLogSize(int size) {
        return new ReaderConfig(fingerprintSize, size, includeFileName, includeFilePath,
                includeFileNameResolved, includeFilePathResolved);
    }
}
