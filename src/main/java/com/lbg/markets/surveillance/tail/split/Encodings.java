package com.lbg.markets.surveillance.tail.split;

import com.lbg.markets.surveillance.tail.domain.ConfigurationException;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves configured encoding names to charsets.
 */
public final class Encodings {

    public static final String DEFAULT = "utf-8";

    private static final Map<String, Charset> NAMED = Map.of(
            "nop", StandardCharsets.ISO_8859_1,
            "utf-8", StandardCharsets.UTF_8,
            "utf8", StandardCharsets.UTF_8,
            "utf-16le", StandardCharsets.UTF_16LE,
            "utf-16be", StandardCharsets.UTF_16BE,
            "ascii", StandardCharsets.US_ASCII,
            "us-ascii", StandardCharsets.US_ASCII,
            "latin1", StandardCharsets.ISO_8859_1
    );

    private Encodings() {
        // Utility class
    }

    public static Charset resolve(String name) {
        String key = name == null || name.isBlank() ? DEFAULT : name.trim().toLowerCase(Locale.ROOT);
        Charset named = NAMED.get(key);
        if (named != null) {
            return named;
        }
        // Byte-order-mark variants cannot be split on a fixed newline sequence.
        if (key.equals("utf-16") || key.equals("utf-32")) {
            throw new ConfigurationException("Encoding " + name + " needs an explicit byte order (le/be)");
        }
        try {
            return Charset.forName(key);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigurationException("Unsupported encoding: " + name, e);
        }
    }

    public static Decoder decoder(Charset charset) {
        return new Decoder(charset);
    }
}
