package com.lbg.markets.surveillance.tail.orchestration;

import com.lbg.markets.surveillance.tail.domain.ConfigurationException;
import com.lbg.markets.surveillance.tail.reader.ReaderConfig;
import com.lbg.markets.surveillance.tail.reader.ReaderFactory;
import com.lbg.markets.surveillance.tail.split.Encodings;
import com.lbg.markets.surveillance.tail.split.SplitterConfig;

import java.util.List;
import java.util.Locale;

/**
 * Configuration of one tailing input - which files to follow and how to read them.
 */
public record InputConfig(
        List<String> include,
        List<String> exclude,
        StartAt startAt,
        int maxConcurrentFiles,
        int workers,
        int knownFilesGenerations,
        String encoding,
        ReaderConfig reader,
        SplitterConfig splitter
) {
    public static final int DEFAULT_MAX_CONCURRENT_FILES = 1024;
    public static final int DEFAULT_WORKERS = 4;
    public static final int DEFAULT_KNOWN_FILES_GENERATIONS = 3;

    public InputConfig {
        if (include == null || include.isEmpty()) {
            throw new ConfigurationException("At least one include pattern is required");
        }
        if (maxConcurrentFiles < 1) {
            throw new ConfigurationException("maxConcurrentFiles must be at least 1");
        }
        if (workers < 1) {
            throw new ConfigurationException("workers must be at least 1");
        }
        if (knownFilesGenerations < 0) {
            throw new ConfigurationException("knownFilesGenerations cannot be negative");
        }
        include = List.copyOf(include);
        exclude = exclude != null ? List.copyOf(exclude) : List.of();
        startAt = startAt != null ? startAt : StartAt.END;
        encoding = encoding != null && !encoding.isBlank() ? encoding : Encodings.DEFAULT;
        reader = reader != null ? reader : ReaderConfig.defaults();
        splitter = splitter != null ? splitter : SplitterConfig.newline();
    }

    public static InputConfig defaults(List<String> include) {
        return new InputConfig(include, List.of(), StartAt.END, DEFAULT_MAX_CONCURRENT_FILES,
                DEFAULT_WORKERS, DEFAULT_KNOWN_FILES_GENERATIONS, Encodings.DEFAULT, null, null);
    }

    public InputConfig withStartAt(StartAt startAt) {
        return new InputConfig(include, exclude, startAt, maxConcurrentFiles, workers,
                knownFilesGenerations, encoding, reader, splitter);
    }

    public InputConfig withMaxConcurrentFiles(int maxConcurrentFiles) {
        return new InputConfig(include, exclude, startAt, maxConcurrentFiles, workers,
                knownFilesGenerations, encoding, reader, splitter);
    }

    public InputConfig withEncoding(String encoding) {
        return new InputConfig(include, exclude, startAt, maxConcurrentFiles, workers,
                knownFilesGenerations, encoding, reader, splitter);
    }

    public InputConfig withReader(ReaderConfig reader) {
        return new InputConfig(include, exclude, startAt, maxConcurrentFiles, workers,
                knownFilesGenerations, encoding, reader, splitter);
    }

    public InputConfig withSplitter(SplitterConfig splitter) {
        return new InputConfig(include, exclude, startAt, maxConcurrentFiles, workers,
                knownFilesGenerations, encoding, reader, splitter);
    }

    /**
     * @throws ConfigurationException if the encoding or splitter cannot be built
     */
    public ReaderFactory readerFactory() {
        return new ReaderFactory(reader, splitter, encoding, startAt == StartAt.BEGINNING);
    }

    public enum StartAt {
        BEGINNING,
        END;

        public static StartAt parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ConfigurationException("start-at must be 'beginning' or 'end', got: " + value, e);
            }
        }
    }
}
