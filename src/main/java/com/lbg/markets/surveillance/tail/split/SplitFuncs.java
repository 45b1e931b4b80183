package com.lbg.markets.surveillance.tail.split;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.function.LongSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in split strategies.
 */
public final class SplitFuncs {

    private SplitFuncs() {
        // Utility class
    }

    /**
     * One record per line. The newline (and a preceding carriage return) is not part of the
     * record. Both are encoded with {@code charset}, so multi-byte encodings split correctly.
     */
    public static SplitFunc newline(Charset charset) {
        byte[] newline = "\n".getBytes(charset);
        byte[] carriageReturn = "\r".getBytes(charset);

        return (data, length, atEof) -> {
            int at = indexOf(data, length, newline);
            if (at >= 0) {
                int tokenLength = endsWith(data, at, carriageReturn) ? at - carriageReturn.length : at;
                return Split.of(at + newline.length, tokenLength);
            }
            if (atEof && length > 0) {
                int tokenLength = endsWith(data, length, carriageReturn) ? length - carriageReturn.length : length;
                return Split.of(length, tokenLength);
            }
            return Split.NONE;
        };
    }

    /**
     * Records begin where {@code pattern} matches. Bytes before the first match form a record
     * of their own.
     */
    public static SplitFunc lineStart(Pattern pattern) {
        return (data, length, atEof) -> {
            if (length == 0) {
                return Split.NONE;
            }
            Matcher matcher = pattern.matcher(latin1(data, length));
            if (!matcher.find()) {
                return atEof ? trimmed(data, 0, length, length) : Split.NONE;
            }
            int first = matcher.start();
            if (first > 0) {
                return trimmed(data, 0, first, first);
            }

            int searchFrom = matcher.end() > first ? matcher.end() : first + 1;
            if (searchFrom < length && matcher.find(searchFrom)) {
                int next = matcher.start();
                return trimmed(data, 0, next, next);
            }
            return atEof ? trimmed(data, 0, length, length) : Split.NONE;
        };
    }

    /**
     * Records end where {@code pattern} matches; the match is part of the record.
     */
    public static SplitFunc lineEnd(Pattern pattern) {
        return (data, length, atEof) -> {
            if (length == 0) {
                return Split.NONE;
            }
            Matcher matcher = pattern.matcher(latin1(data, length));
            while (matcher.find()) {
                if (matcher.end() > 0) {
                    return trimmed(data, 0, matcher.end(), matcher.end());
                }
            }
            return atEof ? trimmed(data, 0, length, length) : Split.NONE;
        };
    }

    /**
     * Emits a trailing partial record once the buffered data has stopped changing for
     * {@code period}. A record that ends in a delimiter is never delayed.
     */
    public static SplitFunc flushing(SplitFunc delegate, Duration period) {
        return flushing(delegate, period, System::nanoTime);
    }

    static SplitFunc flushing(SplitFunc delegate, Duration period, LongSupplier nanoClock) {
        long periodNanos = period.toNanos();
        return new SplitFunc() {
            private int lastLength = -1;
            private long lastChange = nanoClock.getAsLong();

            @Override
            public Split split(byte[] data, int length, boolean atEof) {
                Split split = delegate.split(data, length, atEof);
                long now = nanoClock.getAsLong();
                if (split.found()) {
                    lastLength = -1;
                    lastChange = now;
                    return split;
                }
                if (length != lastLength) {
                    lastLength = length;
                    lastChange = now;
                    return split;
                }
                if (length > 0 && now - lastChange >= periodNanos) {
                    lastLength = -1;
                    lastChange = now;
                    return delegate.split(data, length, true);
                }
                return split;
            }
        };
    }

    // Regex runs over a one-char-per-byte view so match positions are byte positions.
    private static String latin1(byte[] data, int length) {
        return new String(data, 0, length, StandardCharsets.ISO_8859_1);
    }

    private static Split trimmed(byte[] data, int start, int end, int advance) {
        int from = start;
        int to = end;
        while (from < to && isLineBreak(data[from])) {
            from++;
        }
        while (to > from && isLineBreak(data[to - 1])) {
            to--;
        }
        return new Split(advance, from, to - from);
    }

    private static boolean isLineBreak(byte b) {
        return b == '\n' || b == '\r';
    }

    // Steps by the delimiter width so a UTF-16 newline is only found on a code unit boundary.
    private static int indexOf(byte[] data, int length, byte[] target) {
        outer:
        for (int i = 0; i <= length - target.length; i += target.length) {
            for (int j = 0; j < target.length; j++) {
                if (data[i + j] != target[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static boolean endsWith(byte[] data, int end, byte[] suffix) {
        return end >= suffix.length
                && Arrays.equals(data, end - suffix.length, end, suffix, 0, suffix.length);
    }
}
