package com.lbg.markets.surveillance.tail.domain;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Identity of a file derived from the first bytes of its content.
 * <p>
 * A file that is only appended to keeps its prefix, so a fingerprint taken later
 * {@link #startsWith(Fingerprint) starts with} one taken earlier. A file replaced at the
 * same path (rotation, truncate and rewrite) does not.
 */
public final class Fingerprint {

    public static final int DEFAULT_SIZE = 1000;
    public static final int MIN_SIZE = 16;

    private final byte[] firstBytes;

    private Fingerprint(byte[] firstBytes) {
        this.firstBytes = firstBytes;
    }

    /**
     * Read up to {@code maxSize} bytes from the start of the file.
     * Uses positional reads, so the channel's own position is left untouched.
     */
    public static Fingerprint compute(FileChannel channel, int maxSize) throws IOException {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        ByteBuffer buffer = ByteBuffer.allocate(maxSize);
        long position = 0;
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, position);
            if (n < 0) {
                break;
            }
            position += n;
        }
        return new Fingerprint(Arrays.copyOf(buffer.array(), buffer.position()));
    }

    public static Fingerprint of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        return new Fingerprint(bytes.clone());
    }

    public Fingerprint copy() {
        return new Fingerprint(firstBytes.clone());
    }

    /**
     * True if {@code prefix}'s bytes are a prefix of this fingerprint's bytes.
     */
    public boolean startsWith(Fingerprint prefix) {
        if (prefix.firstBytes.length > firstBytes.length) {
            return false;
        }
        return Arrays.equals(firstBytes, 0, prefix.firstBytes.length,
                prefix.firstBytes, 0, prefix.firstBytes.length);
    }

    public int length() {
        return firstBytes.length;
    }

    public boolean isEmpty() {
        return firstBytes.length == 0;
    }

    public byte[] bytes() {
        return firstBytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Fingerprint other && Arrays.equals(firstBytes, other.firstBytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(firstBytes);
    }

    @Override
    public String toString() {
        int shown = Math.min(firstBytes.length, 8);
        return "Fingerprint[" + firstBytes.length + "b:" + HexFormat.of().formatHex(firstBytes, 0, shown) + "]";
    }
}
