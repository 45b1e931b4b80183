package com.lbg.markets.surveillance.tail.reader;

import com.lbg.markets.surveillance.tail.domain.Checkpoint;
import com.lbg.markets.surveillance.tail.domain.FileAttributes;
import com.lbg.markets.surveillance.tail.domain.Fingerprint;
import com.lbg.markets.surveillance.tail.split.Encodings;
import com.lbg.markets.surveillance.tail.split.SplitFunc;
import com.lbg.markets.surveillance.tail.split.SplitterConfig;
import com.lbg.markets.surveillance.tail.util.AttributeResolutionException;
import com.lbg.markets.surveillance.tail.util.FileAttributesResolver;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.file.Path;

/**
 * Builds readers from shared configuration. Immutable and safe to use from any thread; each
 * construction gets its own builder.
 */
public final class ReaderFactory {

    private static final Logger LOG = Logger.getLogger(ReaderFactory.class);

    private final ReaderConfig readerConfig;
    private final SplitterConfig splitterConfig;
    private final Charset encoding;
    private final boolean fromBeginning;

    /**
     * @throws com.lbg.markets.surveillance.tail.domain.ConfigurationException if the encoding
     *         or splitter configuration is invalid
     */
    public ReaderFactory(ReaderConfig readerConfig, SplitterConfig splitterConfig, String encoding,
                         boolean fromBeginning) {
        this(readerConfig, splitterConfig, Encodings.resolve(encoding), fromBeginning);
        // Fail at construction rather than on the first file.
        splitterConfig.build(this.encoding);
    }

    private ReaderFactory(ReaderConfig readerConfig, SplitterConfig splitterConfig, Charset encoding,
                          boolean fromBeginning) {
        this.readerConfig = readerConfig;
        this.splitterConfig = splitterConfig;
        this.encoding = encoding;
        this.fromBeginning = fromBeginning;
    }

    public ReaderFactory withFromBeginning(boolean fromBeginning) {
        return fromBeginning == this.fromBeginning
                ? this
                : new ReaderFactory(readerConfig, splitterConfig, encoding, fromBeginning);
    }

    public boolean fromBeginning() {
        return fromBeginning;
    }

    public ReaderConfig readerConfig() {
        return readerConfig;
    }

    /**
     * A reader for a file seen for the first time. Starts at offset 0, or at the end of the
     * file when this factory does not read from the beginning.
     *
     * @throws IOException seeking to the end failed; no reader is produced and the caller
     *                     still owns {@code file}
     */
    public Reader newReader(FileChannel file, Path path, Fingerprint fingerprint) throws IOException {
        return new Builder()
                .withFile(file, path)
                .withFingerprint(fingerprint)
                .seekToEnd(!fromBeginning)
                .build();
    }

    /**
     * A reader that continues {@code old} on a newly opened handle: same progress, a copy of
     * its fingerprint and the same split function.
     */
    public Reader copy(Reader old, FileChannel file, Path path) throws IOException {
        return new Builder()
                .withFile(file, path)
                .withFingerprint(old.fingerprint() != null ? old.fingerprint().copy() : null)
                .withOffset(old.offset())
                .withSplitFunc(old.splitFunc())
                .build();
    }

    /**
     * A detached reader that only holds resolved configuration. Never read from it.
     */
    public Reader unsafeReader() {
        try {
            return new Builder().build();
        } catch (IOException e) {
            // Unreachable without a file.
            throw new IllegalStateException(e);
        }
    }

    /**
     * A detached reader carrying persisted progress, ready to be matched and copied.
     */
    public Reader restore(Checkpoint checkpoint) {
        Reader reader = unsafeReader();
        reader.restore(checkpoint);
        return reader;
    }

    public Fingerprint newFingerprint(FileChannel file) throws IOException {
        return Fingerprint.compute(file, readerConfig.fingerprintSize());
    }

    /**
     * Single-use accumulator of construction parameters.
     */
    private final class Builder {
        private FileChannel file;
        private Path path;
        private Fingerprint fingerprint;
        private long offset;
        private SplitFunc splitFunc;
        private boolean seekToEnd;
        private boolean built;

        Builder withFile(FileChannel file, Path path) {
            this.file = file;
            this.path = path;
            return this;
        }

        Builder withFingerprint(Fingerprint fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        Builder withOffset(long offset) {
            this.offset = offset;
            return this;
        }

        Builder withSplitFunc(SplitFunc splitFunc) {
            this.splitFunc = splitFunc;
            return this;
        }

        Builder seekToEnd(boolean seekToEnd) {
            this.seekToEnd = seekToEnd;
            return this;
        }

        Reader build() throws IOException {
            if (built) {
                throw new IllegalStateException("Builder already used");
            }
            built = true;

            SplitFunc split = splitFunc != null ? splitFunc : splitterConfig.build(encoding);

            if (file == null) {
                return new Reader(readerConfig, split, Encodings.decoder(encoding), null, null, null, null, 0);
            }

            FileAttributes attributes;
            try {
                attributes = FileAttributesResolver.resolve(path);
            } catch (AttributeResolutionException e) {
                LOG.errorf(e, "path=%s: resolve attributes", path);
                attributes = FileAttributes.unresolved(path);
            }

            Fingerprint fp = fingerprint != null ? fingerprint : newFingerprint(file);
            Reader reader = new Reader(readerConfig, split, Encodings.decoder(encoding), file, path,
                    attributes, fp, offset);
            if (seekToEnd) {
                reader.offsetToEnd();
            }
            return reader;
        }
    }
}
