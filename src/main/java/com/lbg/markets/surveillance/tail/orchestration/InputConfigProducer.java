package com.lbg.markets.surveillance.tail.orchestration;

import com.lbg.markets.surveillance.tail.reader.ReaderConfig;
import com.lbg.markets.surveillance.tail.split.SplitterConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Builds the {@link InputConfig} from {@code tail.*} configuration properties.
 */
@ApplicationScoped
public class InputConfigProducer {

    @ConfigProperty(name = "tail.include")
    List<String> include;

    @ConfigProperty(name = "tail.exclude")
    Optional<List<String>> exclude;

    @ConfigProperty(name = "tail.start-at", defaultValue = "end")
    String startAt;

    @ConfigProperty(name = "tail.fingerprint-size", defaultValue = "1000")
    int fingerprintSize;

    @ConfigProperty(name = "tail.max-log-size", defaultValue = "1048576")
    int maxLogSize;

    @ConfigProperty(name = "tail.max-concurrent-files", defaultValue = "1024")
    int maxConcurrentFiles;

    @ConfigProperty(name = "tail.workers", defaultValue = "4")
    int workers;

    @ConfigProperty(name = "tail.known-files-generations", defaultValue = "3")
    int knownFilesGenerations;

    @ConfigProperty(name = "tail.encoding", defaultValue = "utf-8")
    String encoding;

    @ConfigProperty(name = "tail.multiline.line-start-pattern")
    Optional<String> lineStartPattern;

    @ConfigProperty(name = "tail.multiline.line-end-pattern")
    Optional<String> lineEndPattern;

    @ConfigProperty(name = "tail.force-flush-period", defaultValue = "500ms")
    Duration forceFlushPeriod;

    @ConfigProperty(name = "tail.include-file-name", defaultValue = "true")
    boolean includeFileName;

    @ConfigProperty(name = "tail.include-file-path", defaultValue = "false")
    boolean includeFilePath;

    @ConfigProperty(name = "tail.include-file-name-resolved", defaultValue = "false")
    boolean includeFileNameResolved;

    @ConfigProperty(name = "tail.include-file-path-resolved", defaultValue = "false")
    boolean includeFilePathResolved;

    @Produces
    @Singleton
    InputConfig inputConfig() {
        return new InputConfig(
                include,
                exclude.orElse(List.of()),
                InputConfig.StartAt.parse(startAt),
                maxConcurrentFiles,
                workers,
                knownFilesGenerations,
                encoding,
                new ReaderConfig(fingerprintSize, maxLogSize, includeFileName, includeFilePath,
                        includeFileNameResolved, includeFilePathResolved),
                new SplitterConfig(lineStartPattern.orElse(null), lineEndPattern.orElse(null), forceFlushPeriod)
        );
    }
}
