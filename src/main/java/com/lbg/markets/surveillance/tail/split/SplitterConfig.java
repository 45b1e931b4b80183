package com.lbg.markets.surveillance.tail.split;

import com.lbg.markets.surveillance.tail.domain.ConfigurationException;

import java.nio.charset.Charset;
import java.time.Duration;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * How raw bytes are cut into records. With neither pattern set, records are lines.
 */
public record SplitterConfig(
        String lineStartPattern,
        String lineEndPattern,
        Duration forceFlushPeriod
) {
    public static final Duration DEFAULT_FORCE_FLUSH_PERIOD = Duration.ofMillis(500);

    public SplitterConfig {
        lineStartPattern = blankToNull(lineStartPattern);
        lineEndPattern = blankToNull(lineEndPattern);
        forceFlushPeriod = forceFlushPeriod != null ? forceFlushPeriod : DEFAULT_FORCE_FLUSH_PERIOD;
        if (forceFlushPeriod.isNegative()) {
            throw new ConfigurationException("forceFlushPeriod cannot be negative");
        }
    }

    public static SplitterConfig newline() {
        return new SplitterConfig(null, null, DEFAULT_FORCE_FLUSH_PERIOD);
    }

    /**
     * Resolve this configuration into a split function. Every call returns a new instance,
     * since the flushing wrapper keeps per-reader state.
     */
    public SplitFunc build(Charset charset) {
        if (lineStartPattern != null && lineEndPattern != null) {
            throw new ConfigurationException("only one of lineStartPattern and lineEndPattern can be set");
        }

        SplitFunc base;
        if (lineStartPattern != null) {
            base = SplitFuncs.lineStart(compile(lineStartPattern));
        } else if (lineEndPattern != null) {
            base = SplitFuncs.lineEnd(compile(lineEndPattern));
        } else {
            base = SplitFuncs.newline(charset);
        }

        return forceFlushPeriod.isZero() ? base : SplitFuncs.flushing(base, forceFlushPeriod);
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex, Pattern.MULTILINE);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid multiline pattern: " + regex, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
