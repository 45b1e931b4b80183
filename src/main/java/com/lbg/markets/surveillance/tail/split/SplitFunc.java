package com.lbg.markets.surveillance.tail.split;

/**
 * Finds the next record boundary in a buffer of raw bytes.
 * <p>
 * {@code data[0, length)} holds unconsumed bytes starting at the reader's offset. When
 * {@code atEof} is true there is no more data coming for now, and whatever remains should be
 * returned as a final record. Implementations may keep state between calls but are only ever
 * driven by one reader at a time.
 */
@FunctionalInterface
public interface SplitFunc {

    Split split(byte[] data, int length, boolean atEof);
}
