package com.lbg.markets.surveillance.tail.domain;

/**
 * Persisted progress for one tracked file.
 */
public record Checkpoint(
        byte[] fingerprint,
        long offset,
        FileAttributes attributes
) {
    public Checkpoint {
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative");
        }
    }
}
