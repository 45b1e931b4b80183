package com.lbg.markets.surveillance.tail.sink;

import com.lbg.markets.surveillance.tail.domain.Entry;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Simple local filesystem sink for development.
 * Appends each record body as a line to a file in the configured directory.
 */
@ApplicationScoped
@IfBuildProfile(anyOf = {"dev", "test"})
public class LocalFsSink implements Sink {

    static final String OUTPUT_FILE = "entries.log";

    private final Path basePath;

    public LocalFsSink(@ConfigProperty(name = "sink.local.path", defaultValue = "/tmp/tail-sink") String path) {
        this.basePath = Paths.get(path);
    }

    @Override
    public synchronized void emit(Entry entry) {
        try {
            Files.createDirectories(basePath);
            Files.write(output(), List.of(entry.body()), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write entry to " + output(), e);
        }
    }

    public Path output() {
        return basePath.resolve(OUTPUT_FILE);
    }
}
