package com.lbg.markets.surveillance.tail.source;

import com.lbg.markets.surveillance.tail.orchestration.InputConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Finds regular files on the local filesystem by glob.
 * Include patterns are absolute or relative to the working directory; {@code **} crosses
 * directories. Exclude patterns starting with {@code **} match anywhere.
 */
@ApplicationScoped
public class GlobFileFinder implements FileFinder {

    private static final Logger LOG = Logger.getLogger(GlobFileFinder.class);
    private static final String GLOB_CHARS = "*?[{";

    private final List<String> includePatterns;
    private final List<PathMatcher> excludeMatchers;

    @Inject
    public GlobFileFinder(InputConfig config) {
        this(config.include(), config.exclude());
    }

    public GlobFileFinder(List<String> includePatterns, List<String> excludePatterns) {
        if (includePatterns == null || includePatterns.isEmpty()) {
            throw new IllegalArgumentException("At least one include pattern is required");
        }
        this.includePatterns = includePatterns.stream().map(GlobFileFinder::absolute).toList();
        this.excludeMatchers = (excludePatterns != null ? excludePatterns : List.<String>of()).stream()
                .map(p -> p.startsWith("**") ? p : absolute(p))
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p))
                .toList();
    }

    @Override
    public List<Path> find() throws IOException {
        Set<Path> matches = new TreeSet<>();

        for (String include : includePatterns) {
            Path base = baseDirectory(include);
            if (!Files.isDirectory(base)) {
                LOG.debugf("Base directory does not exist for pattern %s: %s", include, base);
                continue;
            }

            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + include);
            int depth = include.contains("**")
                    ? Integer.MAX_VALUE
                    : Path.of(include).getNameCount() - base.getNameCount();

            try (Stream<Path> walk = Files.walk(base, Math.max(depth, 1))) {
                walk.filter(Files::isRegularFile)
                        .filter(matcher::matches)
                        .filter(p -> !isExcluded(p))
                        .forEach(matches::add);
            } catch (UncheckedIOException e) {
                LOG.warnf(e.getCause(), "Failed to walk %s for pattern %s", base, include);
            }
        }

        return new ArrayList<>(matches);
    }

    private boolean isExcluded(Path path) {
        for (PathMatcher exclude : excludeMatchers) {
            if (exclude.matches(path)) {
                return true;
            }
        }
        return false;
    }

    // Longest leading directory with no glob characters.
    static Path baseDirectory(String pattern) {
        int glob = -1;
        for (int i = 0; i < pattern.length(); i++) {
            if (GLOB_CHARS.indexOf(pattern.charAt(i)) >= 0) {
                glob = i;
                break;
            }
        }

        String prefix = glob < 0 ? pattern : pattern.substring(0, glob);
        int lastSep = prefix.lastIndexOf('/');
        if (lastSep <= 0) {
            return Path.of("/");
        }
        return Path.of(prefix.substring(0, lastSep));
    }

    private static String absolute(String pattern) {
        if (pattern.startsWith("/")) {
            return pattern;
        }
        return Path.of("").toAbsolutePath() + "/" + pattern;
    }
}
