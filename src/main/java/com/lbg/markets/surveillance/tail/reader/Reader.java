package com.lbg.markets.surveillance.tail.reader;

import com.lbg.markets.surveillance.tail.domain.Checkpoint;
import com.lbg.markets.surveillance.tail.domain.Entry;
import com.lbg.markets.surveillance.tail.domain.FileAttributes;
import com.lbg.markets.surveillance.tail.domain.Fingerprint;
import com.lbg.markets.surveillance.tail.sink.Sink;
import com.lbg.markets.surveillance.tail.split.DecodeException;
import com.lbg.markets.surveillance.tail.split.Decoder;
import com.lbg.markets.surveillance.tail.split.Split;
import com.lbg.markets.surveillance.tail.split.SplitFunc;
import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Reads records from one file, starting at a tracked byte offset.
 * <p>
 * A reader either owns an open channel or is detached, holding only identity and progress
 * (restored checkpoints, files no longer open). Detached readers must not be read. A reader
 * is driven by one thread at a time.
 */
public final class Reader implements Closeable {

    private static final Logger LOG = Logger.getLogger(Reader.class);

    private static final int INITIAL_BUFFER_SIZE = 16 * 1024;

    private final ReaderConfig config;
    private final SplitFunc splitFunc;
    private final Decoder decoder;

    private FileChannel file;
    private Path path;
    private FileAttributes attributes;
    private Map<String, String> entryAttributes;
    private Fingerprint fingerprint;
    private long offset;

    // Unconsumed bytes starting at offset.
    private byte[] buffer;
    private int buffered;

    Reader(ReaderConfig config, SplitFunc splitFunc, Decoder decoder, FileChannel file, Path path,
           FileAttributes attributes, Fingerprint fingerprint, long offset) {
        this.config = config;
        this.splitFunc = splitFunc;
        this.decoder = decoder;
        this.file = file;
        this.path = path;
        this.fingerprint = fingerprint;
        this.offset = offset;
        this.buffer = new byte[Math.min(INITIAL_BUFFER_SIZE, config.maxLogSize())];
        setAttributes(attributes);
    }

    /**
     * Pull the next complete record, or empty when none is buffered up to the current end of
     * file. The offset moves past the record before returning. A later call resumes where
     * this one stopped.
     *
     * @throws DecodeException the record's bytes could not be decoded; the offset has already
     *                         moved past them
     * @throws IOException     the file could not be read; the offset is unchanged
     */
    public Optional<Entry> next() throws IOException, DecodeException {
        requireAttached();
        while (true) {
            if (buffered > 0) {
                Split split = splitFunc.split(buffer, buffered, false);
                if (!split.found() && buffered >= config.maxLogSize()) {
                    split = Split.of(config.maxLogSize(), config.maxLogSize());
                }
                if (split.found()) {
                    return Optional.of(consume(split));
                }
            }
            if (!fill()) {
                return Optional.empty();
            }
        }
    }

    /**
     * Read every complete record up to the current end of file and hand each one to
     * {@code sink}. Undecodable records are logged and skipped. Stops early, between
     * records, once {@code cancelled} reports true.
     *
     * @return number of records delivered
     */
    public int readToEnd(Sink sink, BooleanSupplier cancelled) throws IOException {
        int emitted = 0;
        while (!cancelled.getAsBoolean()) {
            long start = offset;
            Optional<Entry> entry;
            try {
                entry = next();
            } catch (DecodeException e) {
                LOG.warnf("path=%s offset=%d: skipping undecodable record: %s", path, start, e.getMessage());
                continue;
            }
            if (entry.isEmpty()) {
                break;
            }
            try {
                sink.emit(entry.get());
            } catch (RuntimeException e) {
                rewind(start);
                throw e;
            }
            emitted++;
        }
        growFingerprint();
        return emitted;
    }

    /**
     * Move the offset to the current end of file without reading records.
     */
    public void offsetToEnd() throws IOException {
        requireAttached();
        offset = file.size();
        buffered = 0;
    }

    public Checkpoint toCheckpoint() {
        return new Checkpoint(fingerprint != null ? fingerprint.bytes() : new byte[0], offset, attributes);
    }

    public Fingerprint fingerprint() {
        return fingerprint;
    }

    public long offset() {
        return offset;
    }

    public Path path() {
        return path;
    }

    public FileAttributes attributes() {
        return attributes;
    }

    public boolean isDetached() {
        return file == null;
    }

    /**
     * Close the file handle. The reader keeps its identity and offset and becomes detached.
     */
    @Override
    public void close() {
        if (file == null) {
            return;
        }
        FileChannel closing = file;
        file = null;
        buffered = 0;
        try {
            closing.close();
        } catch (IOException e) {
            LOG.warnf(e, "path=%s: failed to close file", path);
        }
    }

    SplitFunc splitFunc() {
        return splitFunc;
    }

    void restore(Checkpoint checkpoint) {
        this.fingerprint = Fingerprint.of(checkpoint.fingerprint());
        this.offset = checkpoint.offset();
        FileAttributes restored = checkpoint.attributes();
        this.path = restored != null && restored.path() != null ? Path.of(restored.path()) : null;
        setAttributes(restored);
    }

    private Entry consume(Split split) throws DecodeException {
        long recordEnd = offset + split.advance();
        String body = null;
        DecodeException failure = null;
        try {
            body = decoder.decode(buffer, split.tokenOffset(), split.tokenLength());
        } catch (DecodeException e) {
            failure = e;
        }

        System.arraycopy(buffer, split.advance(), buffer, 0, buffered - split.advance());
        buffered -= split.advance();
        offset = recordEnd;

        if (failure != null) {
            throw failure;
        }
        return new Entry(body, entryAttributes, recordEnd);
    }

    private boolean fill() throws IOException {
        if (buffered == buffer.length) {
            int grown = (int) Math.min((long) buffer.length * 2, config.maxLogSize());
            byte[] larger = new byte[grown];
            System.arraycopy(buffer, 0, larger, 0, buffered);
            buffer = larger;
        }
        int n = file.read(ByteBuffer.wrap(buffer, buffered, buffer.length - buffered), offset + buffered);
        if (n <= 0) {
            return false;
        }
        buffered += n;
        return true;
    }

    private void rewind(long position) {
        offset = position;
        buffered = 0;
    }

    // Until the fingerprint is full size, refresh it so it keeps describing the whole prefix.
    private void growFingerprint() throws IOException {
        if (file == null || (fingerprint != null && fingerprint.length() >= config.fingerprintSize())) {
            return;
        }
        Fingerprint current = Fingerprint.compute(file, config.fingerprintSize());
        if (fingerprint == null || (current.length() > fingerprint.length() && current.startsWith(fingerprint))) {
            fingerprint = current;
        }
    }

    private void setAttributes(FileAttributes attributes) {
        this.attributes = attributes;
        Map<String, String> values = new HashMap<>();
        if (attributes != null) {
            putIf(values, config.includeFileName(), Entry.FILE_NAME, attributes.name());
            putIf(values, config.includeFilePath(), Entry.FILE_PATH, attributes.path());
            putIf(values, config.includeFileNameResolved(), Entry.FILE_NAME_RESOLVED, attributes.nameResolved());
            putIf(values, config.includeFilePathResolved(), Entry.FILE_PATH_RESOLVED, attributes.pathResolved());
        }
        this.entryAttributes = Map.copyOf(values);
    }

    private static void putIf(Map<String, String> values, boolean include, String key, String value) {
        if (include && value != null) {
            values.put(key, value);
        }
    }

    private void requireAttached() {
        if (file == null) {
            throw new IllegalStateException("Reader for " + path + " has no open file");
        }
    }
}
