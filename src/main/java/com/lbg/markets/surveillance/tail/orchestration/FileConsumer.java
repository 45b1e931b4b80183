package com.lbg.markets.surveillance.tail.orchestration;

import com.lbg.markets.surveillance.tail.domain.Checkpoint;
import com.lbg.markets.surveillance.tail.domain.FileDescriptor;
import com.lbg.markets.surveillance.tail.domain.FileResult;
import com.lbg.markets.surveillance.tail.domain.FileResult.Status;
import com.lbg.markets.surveillance.tail.domain.Fingerprint;
import com.lbg.markets.surveillance.tail.domain.PollResult;
import com.lbg.markets.surveillance.tail.reader.Reader;
import com.lbg.markets.surveillance.tail.reader.ReaderFactory;
import com.lbg.markets.surveillance.tail.sink.Sink;
import com.lbg.markets.surveillance.tail.source.FileFinder;
import com.lbg.markets.surveillance.tail.tracker.CheckpointStore;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs poll cycles over one input: discover, fingerprint, reconcile, read, then checkpoint.
 * <p>
 * Reconciliation matches each discovered file against the readers tracked so far, by content
 * prefix rather than by path, so renamed and rotated files keep their progress while replaced
 * or truncated files start over. Reads are spread over a worker pool; everything else happens
 * on the polling thread, which owns all tracked state.
 * <p>
 * The last cycle's readers are drained and their handles released before any new file is
 * opened, so no more than {@code maxConcurrentFiles} handles are open at any point.
 */
public class FileConsumer implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(FileConsumer.class);

    private final InputConfig config;
    private final FileFinder finder;
    private final Sink sink;
    private final CheckpointStore store;
    private final ExecutorService workers;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    // Honours start-at; used for files already present on the first discovery.
    private final ReaderFactory startupFactory;
    // Reads from byte 0; used for files that appear later.
    private final ReaderFactory newFileFactory;
    // Readers from the last cycle; their handles are still open.
    private List<Reader> previousPoll = new ArrayList<>();
    // Detached readers for files not seen recently, oldest first.
    private final List<KnownFile> knownFiles = new ArrayList<>();
    // Paths over the open file budget, with the cycle they were first deferred in.
    private Map<Path, Long> deferredSince = Map.of();
    // Files from the first discovery that have not had a reader yet.
    private Set<Path> startupFiles;
    private long cycle;
    private boolean closed;

    /**
     * @throws com.lbg.markets.surveillance.tail.domain.ConfigurationException if the encoding
     *         or splitter configuration is invalid
     */
    public FileConsumer(InputConfig config, FileFinder finder, Sink sink, CheckpointStore store) {
        this.config = config;
        this.finder = finder;
        this.sink = sink;
        this.store = store;
        this.startupFactory = config.readerFactory();
        this.newFileFactory = startupFactory.withFromBeginning(true);
        this.workers = newWorkerPool(config.workers());
    }

    /**
     * Restore progress from the checkpoint store. A store that cannot be read is logged and
     * tailing starts without history.
     */
    public synchronized void start() {
        List<Checkpoint> checkpoints;
        try {
            checkpoints = store.load();
        } catch (IOException e) {
            LOG.errorf(e, "Failed to load checkpoints, starting without history");
            checkpoints = List.of();
        }

        for (Checkpoint checkpoint : checkpoints) {
            knownFiles.add(new KnownFile(startupFactory.restore(checkpoint)));
        }
        LOG.infof("File consumer started for %s with %d known files", config.include(), knownFiles.size());
    }

    /**
     * Run one full cycle. Per-file failures are reported in the result and never abort the
     * cycle for other files.
     */
    public synchronized PollResult poll() {
        if (closed) {
            throw new IllegalStateException("File consumer is closed");
        }
        long current = ++cycle;
        cancelled.set(false);
        ageKnownFiles();

        List<FileResult> results = new ArrayList<>();
        List<FileDescriptor> candidates;
        try {
            candidates = discover(results);
        } catch (IOException e) {
            LOG.warnf(e, "Failed to find files for %s, skipping cycle %d", config.include(), current);
            return new PollResult(current, results, openFiles(), false);
        }

        trackStartupFiles(candidates);

        List<FileDescriptor> selected = applyBudget(candidates, results);
        Map<Reader, FileResult> drained = drainPrevious();
        List<Opened> opened = dedupe(open(selected, results));

        List<Work> work = reconcile(opened, drained, results);
        results.addAll(retireUnmatched(drained));
        results.addAll(readAll(work));
        previousPoll = new ArrayList<>(work.stream().map(Work::reader).toList());

        checkpoint();

        PollResult result = new PollResult(current, results, openFiles(), cancelled.get());
        LOG.debugf("Cycle %d: %d files, %d entries, %d open, %d deferred",
                current, results.size(), result.entries(), result.openFiles(), result.count(Status.DEFERRED));
        return result;
    }

    /**
     * Ask in-flight reads to stop at the next record boundary. Offsets only ever cover
     * delivered records, so the next cycle resumes cleanly.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public synchronized int openFiles() {
        int open = 0;
        for (Reader reader : previousPoll) {
            if (!reader.isDetached()) {
                open++;
            }
        }
        return open;
    }

    public synchronized List<Checkpoint> checkpoints() {
        List<Checkpoint> checkpoints = new ArrayList<>();
        for (Reader reader : previousPoll) {
            checkpoints.add(reader.toCheckpoint());
        }
        for (KnownFile known : knownFiles) {
            checkpoints.add(known.reader.toCheckpoint());
        }
        return checkpoints;
    }

    @Override
    public void close() {
        cancel();
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            for (Reader reader : previousPoll) {
                reader.close();
            }
            workers.shutdown();
        }
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Reader workers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void ageKnownFiles() {
        for (KnownFile known : knownFiles) {
            known.age++;
        }
        knownFiles.removeIf(known -> known.age > config.knownFilesGenerations());
    }

    private List<FileDescriptor> discover(List<FileResult> results) throws IOException {
        List<FileDescriptor> descriptors = new ArrayList<>();
        for (Path path : finder.find()) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
                descriptors.add(new FileDescriptor(path, attrs.size(), attrs.lastModifiedTime().toMillis()));
            } catch (IOException e) {
                LOG.warnf("path=%s: failed to stat file: %s", path, e.getMessage());
                results.add(FileResult.failed(path, e.getMessage()));
            }
        }
        return descriptors;
    }

    // A file present at startup keeps the start-at policy until it first gets a reader, even
    // when the open file budget defers it to a later cycle.
    private void trackStartupFiles(List<FileDescriptor> candidates) {
        Set<Path> discovered = new HashSet<>();
        for (FileDescriptor candidate : candidates) {
            discovered.add(candidate.path());
        }
        if (startupFiles == null) {
            startupFiles = discovered;
        } else {
            startupFiles.retainAll(discovered);
        }
    }

    // Longest-deferred files first so none starve, then most recently modified.
    private List<FileDescriptor> applyBudget(List<FileDescriptor> candidates, List<FileResult> results) {
        Map<Path, Long> wasDeferred = deferredSince;
        List<FileDescriptor> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator
                .comparing((FileDescriptor d) -> wasDeferred.getOrDefault(d.path(), Long.MAX_VALUE))
                .thenComparing(FileDescriptor::mtimeEpochMs, Comparator.reverseOrder())
                .thenComparing(FileDescriptor::path));

        int limit = Math.min(ordered.size(), config.maxConcurrentFiles());
        Map<Path, Long> nowDeferred = new HashMap<>();
        for (FileDescriptor skipped : ordered.subList(limit, ordered.size())) {
            nowDeferred.put(skipped.path(), wasDeferred.getOrDefault(skipped.path(), cycle));
            results.add(FileResult.deferred(skipped.path()));
        }
        if (!nowDeferred.isEmpty()) {
            LOG.debugf("Deferring %d files over the limit of %d open files", nowDeferred.size(), config.maxConcurrentFiles());
        }
        deferredSince = nowDeferred;
        return new ArrayList<>(ordered.subList(0, limit));
    }

    private List<Opened> open(List<FileDescriptor> selected, List<FileResult> results) {
        List<Opened> opened = new ArrayList<>();
        for (FileDescriptor descriptor : selected) {
            Path path = descriptor.path();
            FileChannel channel;
            try {
                channel = FileChannel.open(path, StandardOpenOption.READ);
            } catch (IOException e) {
                LOG.warnf("path=%s: failed to open file: %s", path, e.getMessage());
                results.add(FileResult.failed(path, e.getMessage()));
                continue;
            }
            try {
                Fingerprint fingerprint = startupFactory.newFingerprint(channel);
                opened.add(new Opened(path, channel, fingerprint, channel.size()));
            } catch (IOException e) {
                LOG.warnf("path=%s: failed to fingerprint file: %s", path, e.getMessage());
                results.add(FileResult.failed(path, e.getMessage()));
                closeChannel(path, channel);
            }
        }
        return opened;
    }

    // Two paths whose fingerprints are prefix-compatible are the same file at different
    // sizes (copies, hard links, a copy in progress). Keep the longer one.
    private List<Opened> dedupe(List<Opened> opened) {
        List<Opened> accepted = new ArrayList<>();
        for (Opened candidate : opened) {
            int duplicate = -1;
            if (!candidate.fingerprint().isEmpty()) {
                for (int i = 0; i < accepted.size(); i++) {
                    Fingerprint other = accepted.get(i).fingerprint();
                    if (!other.isEmpty() && (candidate.fingerprint().startsWith(other) || other.startsWith(candidate.fingerprint()))) {
                        duplicate = i;
                        break;
                    }
                }
            }
            if (duplicate < 0) {
                accepted.add(candidate);
                continue;
            }

            Opened kept = accepted.get(duplicate);
            if (candidate.fingerprint().length() > kept.fingerprint().length()) {
                accepted.set(duplicate, candidate);
                LOG.debugf("path=%s: duplicate of %s, skipping", kept.path(), candidate.path());
                closeChannel(kept.path(), kept.channel());
            } else {
                LOG.debugf("path=%s: duplicate of %s, skipping", candidate.path(), kept.path());
                closeChannel(candidate.path(), candidate.channel());
            }
        }
        return accepted;
    }

    // Read what the last cycle's readers can still see, then release their handles. They stay
    // tracked, detached, until reconciliation continues or retires them.
    private Map<Reader, FileResult> drainPrevious() {
        List<Work> draining = new ArrayList<>();
        for (Reader reader : previousPoll) {
            draining.add(new Work(reader, new FileResult(reader.path(), Status.LOST, 0, reader.offset(), null)));
        }
        List<FileResult> drainedResults = readAll(draining);

        Map<Reader, FileResult> drained = new IdentityHashMap<>();
        for (int i = 0; i < draining.size(); i++) {
            Reader reader = draining.get(i).reader();
            reader.close();
            drained.put(reader, drainedResults.get(i));
        }
        return drained;
    }

    private List<Work> reconcile(List<Opened> opened, Map<Reader, FileResult> drained, List<FileResult> results) {
        List<Work> work = new ArrayList<>();
        for (Opened candidate : opened) {
            boolean startupFile = startupFiles.remove(candidate.path());
            Reader match = takeMatch(candidate);
            FileResult drainedResult = match != null ? drained.get(match) : null;
            try {
                if (match != null) {
                    Reader reader = newFileFactory.copy(match, candidate.channel(), candidate.path());
                    match.close();
                    work.add(new Work(reader, continued(candidate.path(), reader, drainedResult)));
                } else {
                    ReaderFactory factory = startupFile ? startupFactory : newFileFactory;
                    Reader reader = factory.newReader(candidate.channel(), candidate.path(), candidate.fingerprint().copy());
                    LOG.infof("path=%s: started watching file, offset=%d", candidate.path(), reader.offset());
                    work.add(new Work(reader, new FileResult(candidate.path(), Status.NEW, 0, reader.offset(), null)));
                }
            } catch (IOException e) {
                LOG.warnf("path=%s: failed to create reader: %s", candidate.path(), e.getMessage());
                int entries = drainedResult != null ? drainedResult.entries() : 0;
                results.add(FileResult.failed(candidate.path(), e.getMessage()).withProgress(entries, -1));
                closeChannel(candidate.path(), candidate.channel());
                if (match != null) {
                    match.close();
                    knownFiles.add(new KnownFile(match));
                }
            }
        }
        return work;
    }

    // Entries drained from the old handle this cycle count towards the continued file.
    private static FileResult continued(Path path, Reader reader, FileResult drainedResult) {
        if (drainedResult == null) {
            return new FileResult(path, Status.CONTINUED, 0, reader.offset(), null);
        }
        FileResult result = new FileResult(path, Status.CONTINUED, drainedResult.entries(), reader.offset(), null);
        return drainedResult.errorMessage() != null ? result.withError(drainedResult.errorMessage()) : result;
    }

    // Known files (oldest first) and the last cycle's readers are ranked together; on an
    // otherwise equal match the last cycle's reader wins.
    private Reader takeMatch(Opened candidate) {
        List<Reader> tracked = new ArrayList<>();
        for (KnownFile known : knownFiles) {
            tracked.add(known.reader());
        }
        tracked.addAll(previousPoll);

        int index = bestMatch(tracked, candidate);
        if (index < 0) {
            return null;
        }
        if (index < knownFiles.size()) {
            return knownFiles.remove(index).reader();
        }
        return previousPoll.remove(index - knownFiles.size());
    }

    static int bestMatch(List<Reader> tracked, Opened candidate) {
        int best = -1;
        boolean bestExact = false;
        for (int i = tracked.size() - 1; i >= 0; i--) {
            Reader reader = tracked.get(i);
            if (!matches(reader, candidate)) {
                continue;
            }
            boolean exact = reader.fingerprint().equals(candidate.fingerprint());
            if (best < 0 || (exact && !bestExact)) {
                best = i;
                bestExact = exact;
            }
        }
        return best;
    }

    static boolean matches(Reader tracked, Opened candidate) {
        Fingerprint fingerprint = tracked.fingerprint();
        if (fingerprint == null) {
            return false;
        }
        // A file smaller than what was already read from it cannot be the same file.
        if (tracked.offset() > candidate.size()) {
            return false;
        }
        // An empty fingerprint is a prefix of everything; only the same path is evidence.
        if (fingerprint.isEmpty()) {
            return tracked.path() != null && samePath(tracked.path(), candidate.path());
        }
        return candidate.fingerprint().startsWith(fingerprint);
    }

    private List<FileResult> retireUnmatched(Map<Reader, FileResult> drained) {
        List<FileResult> lost = new ArrayList<>();
        for (Reader reader : previousPoll) {
            LOG.infof("path=%s: file no longer matched, closed at offset %d", reader.path(), reader.offset());
            knownFiles.add(new KnownFile(reader));
            lost.add(drained.get(reader));
        }
        previousPoll = new ArrayList<>();
        return lost;
    }

    private List<FileResult> readAll(List<Work> work) {
        List<Future<FileResult>> futures = new ArrayList<>();
        for (Work w : work) {
            futures.add(workers.submit(() -> readOne(w)));
        }

        List<FileResult> results = new ArrayList<>();
        boolean interrupted = false;
        for (Future<FileResult> future : futures) {
            while (true) {
                try {
                    results.add(future.get());
                    break;
                } catch (InterruptedException e) {
                    // Keep waiting: a reader must not outlive the cycle that owns it.
                    interrupted = true;
                    cancel();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Unexpected reader failure", e.getCause());
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    private FileResult readOne(Work work) {
        Reader reader = work.reader();
        FileResult result = work.result();
        if (reader.isDetached()) {
            return result;
        }
        AtomicInteger delivered = new AtomicInteger();
        Sink counting = entry -> {
            sink.emit(entry);
            delivered.incrementAndGet();
        };
        try {
            reader.readToEnd(counting, cancelled::get);
            return result.withProgress(result.entries() + delivered.get(), reader.offset());
        } catch (IOException e) {
            LOG.warnf("path=%s: read failed at offset %d, will retry: %s", reader.path(), reader.offset(), e.getMessage());
            return result.withProgress(result.entries() + delivered.get(), reader.offset()).withError(e.getMessage());
        } catch (RuntimeException e) {
            LOG.warnf(e, "path=%s: sink rejected entry at offset %d, will retry", reader.path(), reader.offset());
            return result.withProgress(result.entries() + delivered.get(), reader.offset()).withError(e.getMessage());
        }
    }

    private void checkpoint() {
        List<Checkpoint> checkpoints = checkpoints();
        try {
            store.save(checkpoints);
        } catch (IOException e) {
            LOG.warnf(e, "Failed to save %d checkpoints, will retry next cycle", checkpoints.size());
        }
    }

    private static boolean samePath(Path a, Path b) {
        return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }

    private static void closeChannel(Path path, FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warnf(e, "path=%s: failed to close file", path);
        }
    }

    private static ExecutorService newWorkerPool(int size) {
        AtomicInteger index = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("tail-reader-" + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(size, factory);
    }

    record Opened(Path path, FileChannel channel, Fingerprint fingerprint, long size) {
    }

    private record Work(Reader reader, FileResult result) {
    }

    private static final class KnownFile {
        private final Reader reader;
        private int age;

        KnownFile(Reader reader) {
            this.reader = reader;
        }

        Reader reader() {
            return reader;
        }
    }
}
