package com.lbg.markets.surveillance.tail.split;

/**
 * Result of a {@link SplitFunc} call. The record occupies
 * {@code data[tokenOffset, tokenOffset + tokenLength)} and the reader moves {@code advance}
 * bytes forward past it.
 */
public record Split(
        int advance,
        int tokenOffset,
        int tokenLength
) {
    public static final Split NONE = new Split(0, 0, 0);

    public Split {
        if (advance < 0 || tokenOffset < 0 || tokenLength < 0) {
            throw new IllegalArgumentException("split values cannot be negative");
        }
        if (tokenOffset + tokenLength > advance) {
            throw new IllegalArgumentException("token extends past advance");
        }
    }

    public static Split of(int advance, int tokenLength) {
        return new Split(advance, 0, tokenLength);
    }

    public boolean found() {
        return advance > 0;
    }
}
