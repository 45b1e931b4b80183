package com.lbg.markets.surveillance.tail.orchestration;

import com.lbg.markets.surveillance.tail.domain.Checkpoint;
import com.lbg.markets.surveillance.tail.domain.FileAttributes;
import com.lbg.markets.surveillance.tail.domain.FileResult;
import com.lbg.markets.surveillance.tail.domain.FileResult.Status;
import com.lbg.markets.surveillance.tail.domain.Fingerprint;
import com.lbg.markets.surveillance.tail.domain.PollResult;
import com.lbg.markets.surveillance.tail.orchestration.InputConfig.StartAt;
import com.lbg.markets.surveillance.tail.reader.Reader;
import com.lbg.markets.surveillance.tail.reader.ReaderConfig;
import com.lbg.markets.surveillance.tail.sink.Sink;
import com.lbg.markets.surveillance.tail.source.GlobFileFinder;
import com.lbg.markets.surveillance.tail.split.SplitterConfig;
import com.lbg.markets.surveillance.tail.tracker.CheckpointStore;
import com.lbg.markets.surveillance.tail.tracker.InMemoryCheckpointStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileConsumerTest {

    @TempDir
    Path dir;

    private final List<String> emitted = new CopyOnWriteArrayList<>();
    private final List<FileConsumer> consumers = new ArrayList<>();
    private CheckpointStore store;

    @BeforeEach
    void setup() {
        store = new InMemoryCheckpointStore();
    }

    @AfterEach
    void cleanup() {
        consumers.forEach(FileConsumer::close);
    }

    private InputConfig config() {
        return InputConfig.defaults(List.of(dir + "/*.log*"))
                .withStartAt(StartAt.BEGINNING)
                .withSplitter(new SplitterConfig(null, null, Duration.ZERO));
    }

    private FileConsumer consumer(InputConfig config) {
        return consumer(config, entry -> emitted.add(entry.body()));
    }

    private FileConsumer consumer(InputConfig config, Sink sink) {
        FileConsumer consumer = new FileConsumer(config, new GlobFileFinder(config.include(), config.exclude()), sink, store);
        consumers.add(consumer);
        consumer.start();
        return consumer;
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static void append(Path file, String content) throws IOException {
        Files.writeString(file, content, StandardOpenOption.APPEND);
    }

    private static FileResult result(PollResult poll, Path path, Status status) {
        return poll.files().stream()
                .filter(f -> f.path().equals(path) && f.status() == status)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No " + status + " result for " + path + " in " + poll.files()));
    }

    private Reader tracked(String content, long offset, Path path) {
        Checkpoint checkpoint = new Checkpoint(content.getBytes(StandardCharsets.UTF_8), offset, FileAttributes.unresolved(path));
        return config().readerFactory().restore(checkpoint);
    }

    private static FileConsumer.Opened candidate(Path path, String content) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return new FileConsumer.Opened(path, null, Fingerprint.of(bytes), bytes.length);
    }

    // Descriptors held by this process that point below root.
    private static long openHandlesUnder(Path root) {
        try (Stream<Path> fds = Files.list(Path.of("/proc/self/fd"))) {
            return fds.filter(fd -> pointsUnder(fd, root)).count();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static boolean pointsUnder(Path fd, Path root) {
        try {
            return Files.readSymbolicLink(fd).startsWith(root);
        } catch (IOException e) {
            // Closed between listing and reading the link
            return false;
        }
    }

    @Test
    void shouldReadNewFilesAndOnlyAppendedDataAfterwards() throws IOException {
        Path a = write("a.log", "a1\na2\n");
        Path b = write("b.log", "b1\n");
        FileConsumer consumer = consumer(config());

        PollResult first = consumer.poll();

        assertEquals(2, first.count(Status.NEW));
        assertEquals(3, first.entries());
        assertEquals(2, first.openFiles());
        assertTrue(emitted.containsAll(List.of("a1", "a2", "b1")));

        append(a, "a3\n");
        PollResult second = consumer.poll();

        assertEquals(Status.CONTINUED, second.file(a).orElseThrow().status());
        assertEquals(1, second.file(a).orElseThrow().entries());
        assertEquals(0, second.file(b).orElseThrow().entries());
        assertEquals(4, emitted.size(), "nothing is emitted twice");
    }

    @Test
    void shouldFollowRotatedFileAndReadReplacementFromStart() throws IOException {
        Path log = write("app.log", "one\ntwo\n");
        FileConsumer consumer = consumer(config());
        consumer.poll();

        // Late write, then rotate
        append(log, "three\n");
        Path rotated = dir.resolve("app.log.1");
        Files.move(log, rotated);
        write("app.log", "fresh\n");

        PollResult poll = consumer.poll();

        FileResult continued = result(poll, rotated, Status.CONTINUED);
        assertEquals(1, continued.entries());
        assertEquals(14, continued.offset());

        FileResult replacement = result(poll, log, Status.NEW);
        assertEquals(1, replacement.entries());
        assertEquals(6, replacement.offset());

        assertEquals(List.of("one", "two"), emitted.subList(0, 2));
        assertTrue(emitted.containsAll(List.of("three", "fresh")));
        assertEquals(4, emitted.size());
    }

    @Test
    void shouldTreatEmptyReplacementAsNewFile() throws IOException {
        Path log = write("app.log", "AAAA\n");
        FileConsumer consumer = consumer(config().withStartAt(StartAt.END));
        consumer.poll();

        Path rotated = dir.resolve("app.log.1");
        Files.move(log, rotated);
        write("app.log", "");
        PollResult poll = consumer.poll();

        FileResult continued = result(poll, rotated, Status.CONTINUED);
        assertEquals(5, continued.offset());
        FileResult replacement = result(poll, log, Status.NEW);
        assertEquals(0, replacement.offset());
        assertEquals(2, poll.openFiles());
        assertTrue(emitted.isEmpty());
    }

    @Test
    void shouldStartOverWhenFileIsRewrittenInPlace() throws IOException {
        Path log = write("app.log", "first version\n");
        FileConsumer consumer = consumer(config());
        consumer.poll();

        write("app.log", "second\n");
        PollResult poll = consumer.poll();

        FileResult restarted = result(poll, log, Status.NEW);
        assertEquals(1, restarted.entries());
        assertEquals(List.of("first version", "second"), emitted);
    }

    @Test
    void shouldStartOverWhenTruncatedBelowOffsetWithSamePrefix() throws IOException {
        InputConfig config = config().withReader(ReaderConfig.defaults().withFingerprintSize(16));
        Path log = write("app.log", "0123456789abcdefXYZ\n");
        FileConsumer consumer = consumer(config);
        consumer.poll();

        write("app.log", "0123456789abcdef\n");
        PollResult poll = consumer.poll();

        FileResult restarted = result(poll, log, Status.NEW);
        assertEquals(1, restarted.entries());
        assertEquals(17, restarted.offset());
        assertEquals("0123456789abcdef", emitted.get(emitted.size() - 1));
    }

    @Test
    void shouldLimitOpenFilesAndRotateDeferredFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Path file = write("f" + i + ".log", "file-" + i + "\n");
            Files.setLastModifiedTime(file, FileTime.fromMillis(1_000_000L + i * 1000L));
            files.add(file);
        }
        FileConsumer consumer = consumer(config().withMaxConcurrentFiles(2));

        PollResult first = consumer.poll();

        assertEquals(2, first.openFiles());
        assertEquals(3, first.count(Status.DEFERRED));
        assertEquals(Status.NEW, first.file(files.get(4)).orElseThrow().status());
        assertEquals(Status.NEW, first.file(files.get(3)).orElseThrow().status());
        for (int i = 0; i < 3; i++) {
            assertEquals(Status.DEFERRED, first.file(files.get(i)).orElseThrow().status());
        }

        PollResult second = consumer.poll();

        assertEquals(2, second.openFiles());
        result(second, files.get(2), Status.NEW);
        result(second, files.get(1), Status.NEW);
        result(second, files.get(0), Status.DEFERRED);

        PollResult third = consumer.poll();

        result(third, files.get(0), Status.NEW);
        assertEquals(List.of("file-0", "file-1", "file-2", "file-3", "file-4"),
                emitted.stream().sorted().toList());
    }

    @Test
    void shouldNeverHoldMoreHandlesThanTheLimit() throws IOException {
        assumeTrue(Files.isDirectory(Path.of("/proc/self/fd")), "needs /proc/self/fd");
        Path root = dir.toRealPath();
        Path a = write("a.log", "a1\n");
        Path b = write("b.log", "b1\n");
        Files.setLastModifiedTime(a, FileTime.fromMillis(2_000_000L));
        Files.setLastModifiedTime(b, FileTime.fromMillis(1_000_000L));
        AtomicLong peak = new AtomicLong();
        FileConsumer consumer = consumer(config().withMaxConcurrentFiles(1), entry -> {
            emitted.add(entry.body());
            peak.accumulateAndGet(openHandlesUnder(root), Math::max);
        });

        consumer.poll();
        // Drained from a's old handle while b takes its slot
        append(a, "a2\n");
        PollResult second = consumer.poll();
        consumer.poll();

        result(second, b, Status.NEW);
        result(second, a, Status.LOST);
        assertEquals(List.of("a1", "a2", "b1"), emitted);
        assertEquals(1, peak.get());
    }

    @Test
    void shouldApplyStartAtToStartupFileDeferredByLimit() throws IOException {
        Path a = write("a.log", "old-a\n");
        Path b = write("b.log", "old-b\n");
        Files.setLastModifiedTime(a, FileTime.fromMillis(2_000_000L));
        Files.setLastModifiedTime(b, FileTime.fromMillis(1_000_000L));
        FileConsumer consumer = consumer(config().withStartAt(StartAt.END).withMaxConcurrentFiles(1));

        PollResult first = consumer.poll();
        PollResult second = consumer.poll();
        consumer.poll();

        assertEquals(Status.DEFERRED, first.file(b).orElseThrow().status());
        assertEquals(6, result(second, b, Status.NEW).offset());
        assertTrue(emitted.isEmpty(), "content present at startup is skipped: " + emitted);

        append(b, "new-b\n");
        consumer.poll();
        assertEquals(List.of("new-b"), emitted);
    }

    @Test
    void shouldPreferExactKnownFileOverPrefixOfLastCycle() throws IOException {
        Path a = write("a.log", "AA\nBB\n");
        FileConsumer consumer = consumer(config());
        consumer.poll();

        // a drops out of the include pattern; b starts with the same first line
        Path hidden = dir.resolve("a.txt");
        Files.move(a, hidden);
        write("b.log", "AA\n");
        consumer.poll();

        Files.move(hidden, a);
        PollResult poll = consumer.poll();

        FileResult continued = result(poll, a, Status.CONTINUED);
        assertEquals(6, continued.offset());
        assertEquals(0, continued.entries());
        assertEquals(List.of("AA", "BB", "AA"), emitted);
    }

    @Test
    void shouldPreferExactFingerprintOverPrefixInEitherOrder() {
        Path path = dir.resolve("app.log");
        Reader prefix = tracked("AA\n", 3, path);
        Reader exact = tracked("AA\nBB\n", 6, path);
        FileConsumer.Opened candidate = candidate(path, "AA\nBB\n");

        assertEquals(1, FileConsumer.bestMatch(List.of(prefix, exact), candidate));
        assertEquals(0, FileConsumer.bestMatch(List.of(exact, prefix), candidate));
    }

    @Test
    void shouldPreferNewestAmongEqualMatches() {
        Reader older = tracked("AA\n", 3, dir.resolve("a.log"));
        Reader newer = tracked("AA\n", 2, dir.resolve("b.log"));

        assertEquals(1, FileConsumer.bestMatch(List.of(older, newer), candidate(dir.resolve("c.log"), "AA\nBB\n")));
    }

    @Test
    void shouldNotMatchReaderThatReadPastCandidateSize() {
        Path path = dir.resolve("app.log");
        FileConsumer.Opened candidate = candidate(path, "AA\nB\n");
        Reader exactButPast = tracked("AA\nB\n", 9, path);
        Reader prefix = tracked("AA\n", 3, path);

        assertFalse(FileConsumer.matches(exactButPast, candidate));
        assertTrue(FileConsumer.matches(tracked("AA\n", 5, path), candidate), "offset equal to size still matches");
        assertEquals(0, FileConsumer.bestMatch(List.of(prefix, exactButPast), candidate));
        assertEquals(-1, FileConsumer.bestMatch(List.of(exactButPast), candidate));
    }

    @Test
    void shouldMatchEmptyFingerprintOnlyOnSamePath() {
        Reader empty = tracked("", 0, dir.resolve("app.log"));

        assertTrue(FileConsumer.matches(empty, candidate(dir.resolve("app.log"), "x\n")));
        assertFalse(FileConsumer.matches(empty, candidate(dir.resolve("other.log"), "x\n")));
    }

    @Test
    void shouldReadIdenticalFilesOnce() throws IOException {
        write("a.log", "same content\n");
        write("b.log", "same content\n");
        FileConsumer consumer = consumer(config());

        PollResult first = consumer.poll();
        PollResult second = consumer.poll();

        assertEquals(1, first.count(Status.NEW));
        assertEquals(1, first.openFiles());
        assertEquals(0, second.entries());
        assertEquals(List.of("same content"), emitted);
    }

    @Test
    void shouldResumeFromCheckpointsAfterRestart() throws IOException {
        Path log = write("app.log", "a\nb\n");
        FileConsumer before = consumer(config());
        before.poll();
        before.close();

        append(log, "c\n");
        FileConsumer after = consumer(config().withStartAt(StartAt.END));
        PollResult poll = after.poll();

        FileResult resumed = poll.file(log).orElseThrow();
        assertEquals(Status.CONTINUED, resumed.status());
        assertEquals(1, resumed.entries());
        assertEquals(List.of("a", "b", "c"), emitted);
    }

    @Test
    void shouldSkipExistingContentWhenStartingAtEnd() throws IOException {
        Path existing = write("old.log", "history\n");
        FileConsumer consumer = consumer(config().withStartAt(StartAt.END));

        PollResult first = consumer.poll();
        assertEquals(0, first.entries());
        assertEquals(8, first.file(existing).orElseThrow().offset());

        // Files created later are read from the beginning
        Path created = write("new.log", "created later\n");
        append(existing, "appended\n");
        PollResult second = consumer.poll();

        assertEquals(Status.NEW, second.file(created).orElseThrow().status());
        assertEquals(1, second.file(created).orElseThrow().entries());
        assertEquals(1, second.file(existing).orElseThrow().entries());
        assertEquals(List.of("appended", "created later"), emitted.stream().sorted().toList());
    }

    @Test
    void shouldDrainFileThatDisappears() throws IOException {
        Path log = write("app.log", "a\n");
        FileConsumer consumer = consumer(config());
        consumer.poll();

        append(log, "b\n");
        Files.delete(log);
        PollResult poll = consumer.poll();

        FileResult lost = poll.file(log).orElseThrow();
        assertEquals(Status.LOST, lost.status());
        assertEquals(1, lost.entries());
        assertEquals(0, poll.openFiles());
        assertEquals(List.of("a", "b"), emitted);
        assertEquals(1, consumer.checkpoints().size(), "lost file is still remembered");
    }

    @Test
    void shouldForgetKnownFilesAfterConfiguredGenerations() throws IOException {
        InputConfig base = config();
        InputConfig config = new InputConfig(base.include(), base.exclude(), base.startAt(),
                base.maxConcurrentFiles(), base.workers(), 1, base.encoding(), base.reader(), base.splitter());
        Path log = write("app.log", "remember me\n");
        FileConsumer consumer = consumer(config);
        consumer.poll();

        // Move out of the include pattern
        Path hidden = dir.resolve("app.txt");
        Files.move(log, hidden);
        consumer.poll();
        consumer.poll();
        assertEquals(1, consumer.checkpoints().size());

        consumer.poll();
        assertEquals(0, consumer.checkpoints().size());

        // Reappearing after eviction it is a new file again
        Files.move(hidden, log);
        PollResult poll = consumer.poll();
        assertEquals(Status.NEW, poll.file(log).orElseThrow().status());
        assertEquals(List.of("remember me", "remember me"), emitted);
    }

    @Test
    void shouldMatchKnownFileWhenItReappears() throws IOException {
        Path log = write("app.log", "remember me\n");
        FileConsumer consumer = consumer(config());
        consumer.poll();

        Path hidden = dir.resolve("app.txt");
        Files.move(log, hidden);
        consumer.poll();

        append(hidden, "more\n");
        Files.move(hidden, log);
        PollResult poll = consumer.poll();

        assertEquals(Status.CONTINUED, poll.file(log).orElseThrow().status());
        assertEquals(List.of("remember me", "more"), emitted);
    }

    @Test
    void shouldContinueEmptyFileOnceContentArrives() throws IOException {
        Path log = write("app.log", "");
        FileConsumer consumer = consumer(config());

        PollResult first = consumer.poll();
        assertEquals(Status.NEW, first.file(log).orElseThrow().status());

        append(log, "hello\n");
        PollResult second = consumer.poll();

        assertEquals(Status.CONTINUED, second.file(log).orElseThrow().status());
        assertEquals(List.of("hello"), emitted);
    }

    @Test
    void shouldStopReadingWhenCancelledAndResumeNextCycle() throws IOException {
        write("app.log", "a\nb\nc\n");
        List<FileConsumer> holder = new ArrayList<>();
        FileConsumer consumer = consumer(config(), entry -> {
            emitted.add(entry.body());
            holder.get(0).cancel();
        });
        holder.add(consumer);

        PollResult first = consumer.poll();

        assertTrue(first.cancelled());
        assertEquals(1, first.entries());

        consumer.poll();
        consumer.poll();
        assertEquals(List.of("a", "b", "c"), emitted);
    }

    @Test
    void shouldRetryRecordRejectedBySink() throws IOException {
        Path log = write("app.log", "a\nb\n");
        List<Boolean> failNext = new CopyOnWriteArrayList<>(List.of(true));
        FileConsumer consumer = consumer(config(), entry -> {
            if (entry.body().equals("b") && failNext.remove(Boolean.TRUE)) {
                throw new IllegalStateException("downstream unavailable");
            }
            emitted.add(entry.body());
        });

        PollResult first = consumer.poll();
        assertEquals(Status.FAILED, first.file(log).orElseThrow().status());
        assertEquals(2, first.file(log).orElseThrow().offset());
        assertEquals(1, first.file(log).orElseThrow().entries(), "delivered records are still counted");

        PollResult second = consumer.poll();
        assertEquals(Status.CONTINUED, second.file(log).orElseThrow().status());
        assertEquals(List.of("a", "b"), emitted);
    }

    @Test
    void shouldSkipCycleWhenDiscoveryFails() throws IOException {
        FileConsumer consumer = new FileConsumer(config(), () -> {
            throw new IOException("disk gone");
        }, entry -> emitted.add(entry.body()), store);
        consumers.add(consumer);

        PollResult poll = consumer.poll();

        assertEquals(1, poll.cycle());
        assertTrue(poll.files().isEmpty());
    }

    @Test
    void shouldSaveCheckpointsEveryCycle() throws IOException {
        write("app.log", "a\n");
        FileConsumer consumer = consumer(config());
        consumer.poll();

        List<Checkpoint> saved = store.load();

        assertEquals(1, saved.size());
        assertEquals(2, saved.get(0).offset());
    }

    @Test
    void shouldRefusePollAfterClose() {
        FileConsumer consumer = consumer(config());
        consumer.close();

        assertThrows(IllegalStateException.class, consumer::poll);
    }
}
