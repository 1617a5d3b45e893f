// file: src/main/java/io/logstats/storage/SegmentStore.java
package io.logstats.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPOutputStream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.*;

/**
 * Size-bounded, rotating set of log segments. Owns the active file handle.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - restores a segment left at the staging name by a crash mid-rotation,
 *      - opens (or creates) segment 0 for append,
 *      - counts the bytes already in it toward the size limit.
 * <p>
 *  - append():
 *      - writes the whole line (a line is never split across segments),
 *      - calls force(true) when durable,
 *      - tracks bytes written to the active segment.
 *      A failing force(true) is reported as {@link SegmentSyncException}: the bytes
 *      already reached the file and only their durability is in doubt.
 * <p>
 *  - rotateIfNeeded(), called before every append:
 *      - when tracked bytes >= sizeLimit, stages segment 0 as "index 1 + .tmp"
 *        (gzipped when compression is on, renamed otherwise),
 *      - only then shifts sealed segments up by one index
 *        (highest first, dropping any that would reach numFiles),
 *      - moves the staged copy into index 1,
 *      - opens a fresh segment 0 and notifies the rotation listener.
 * <p>
 * Failures surface as UncheckedIOException. After a failed rotation the store
 * reopens whatever segment 0 is on disk so later calls can retry. Staging fails
 * before any sealed segment moves, so retries never drop sealed data.
 * Not thread safe: the owning writer serializes access.
 */
public final class SegmentStore implements AutoCloseable {
    private static final Logger log = Logger.getLogger(SegmentStore.class.getName());

    private final SegmentFiles files;
    private final long sizeLimit;
    private final int numFiles;
    private final boolean compress;
    private final StatLogMetrics metrics;
    private final Runnable onRotate;

    private FileChannel ch;
    private Sync sync = c -> c.force(true);
    private long writtenInSegment;
    private boolean durable;

    public SegmentStore(SegmentFiles files, long sizeLimit, int numFiles, boolean compress,
                        StatLogMetrics metrics, Runnable onRotate) {
        if (sizeLimit <= 0) throw new IllegalArgumentException("sizeLimit must be > 0");
        if (numFiles < 1 || numFiles > SegmentFiles.MAX_NUM_FILES) {
            throw new IllegalArgumentException(
                    "numFiles must be within [1, " + SegmentFiles.MAX_NUM_FILES + "], got " + numFiles);
        }
        this.files = Objects.requireNonNull(files, "files");
        this.sizeLimit = sizeLimit;
        this.numFiles = numFiles;
        this.compress = compress;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.onRotate = Objects.requireNonNull(onRotate, "onRotate");
        try {
            Files.createDirectories(files.dir());
            recoverStaged();
            openActive();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open stat log " + files.active(), e);
        }
    }

    public void setDurable(boolean durable) { this.durable = durable; }

    public boolean isDurable() { return durable; }

    /** Bytes in the active segment, including what was there when it was opened. */
    public long activeSize() { return writtenInSegment; }

    public SegmentFiles files() { return files; }

    public void append(byte[] line) {
        try {
            if (ch == null) {
                openActive();
            }
            ByteBuffer buf = ByteBuffer.wrap(line);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Append to " + files.active() + " failed", e);
        }
        writtenInSegment += line.length;
        if (durable) {
            try {
                sync.force(ch);
            } catch (IOException e) {
                throw new SegmentSyncException("fsync of " + files.active() + " failed", e);
            }
            metrics.recordSync();
        }
    }

    /** Replace how the active channel is flushed to disk. */
    void syncWith(Sync sync) {
        this.sync = Objects.requireNonNull(sync, "sync");
    }

    public void rotateIfNeeded() {
        if (writtenInSegment < sizeLimit) return;
        try {
            rotate();
        } catch (IOException e) {
            log.log(Level.WARNING, "Rotation of " + files.active() + " failed", e);
            try {
                openActive();
            } catch (IOException reopen) {
                e.addSuppressed(reopen);
            }
            throw new UncheckedIOException("Rotation of " + files.active() + " failed", e);
        }
    }

    @Override
    public void close() throws IOException {
        closeActive();
    }

    /** Flushes the active channel when durable. */
    @FunctionalInterface
    interface Sync {
        void force(FileChannel ch) throws IOException;
    }

    // ---------- internals ----------

    private void rotate() throws IOException {
        closeActive();
        Path staged = stageActive();
        try {
            shiftSealed();
        } catch (IOException e) {
            unstage(staged, e);
            throw e;
        }
        publish(staged);
        metrics.recordRotation();
        onRotate.run();
        openActive();
        log.info(() -> "Rotated stat log " + files.active() + " (numFiles=" + numFiles + ", compress=" + compress + ")");
    }

    /**
     * Copy segment 0 to the staging name of index 1, gzipped when compression is on.
     * Runs before the rename cascade, so a failure here leaves every sealed segment untouched.
     *
     * @return the staged file, or null when there is nothing to keep
     */
    private Path stageActive() throws IOException {
        Path active = files.active();
        if (!Files.exists(active) || numFiles == 1) {
            return null;
        }
        Path staged = stagingPath(compress);
        if (compress) {
            gzip(active, staged);
        } else {
            Files.move(active, staged);
        }
        return staged;
    }

    /** Undo {@link #stageActive()} after the cascade failed. */
    private void unstage(Path staged, IOException cause) {
        if (staged == null) {
            return;
        }
        try {
            if (compress) {
                Files.deleteIfExists(staged);
            } else {
                Files.move(staged, files.active());
            }
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    /** Move every sealed segment from index i to i+1, highest index first. */
    private void shiftSealed() throws IOException {
        for (SegmentFiles.Segment seg : files.listSealedDescending()) {
            int next = seg.index() + 1;
            if (next >= numFiles) {
                Files.deleteIfExists(seg.path());
                metrics.recordDropped();
                log.fine(() -> "Dropped segment " + seg.path());
                continue;
            }
            Path target = files.path(next, seg.compressed());
            Files.move(seg.path(), target);
            log.fine(() -> "Renamed " + seg.path() + " -> " + target);
        }
    }

    /** Move the staged copy into index 1, or discard segment 0 when only one segment is kept. */
    private void publish(Path staged) throws IOException {
        Path active = files.active();
        if (staged == null) {
            if (Files.deleteIfExists(active)) {
                metrics.recordDropped();
            }
            return;
        }
        Path target = files.path(1, compress);
        Files.move(staged, target, ATOMIC_MOVE);
        if (compress) {
            Files.delete(active);
            metrics.recordCompressed();
            log.fine(() -> "Compressed " + active + " -> " + target);
        } else {
            log.fine(() -> "Renamed " + active + " -> " + target);
        }
    }

    private Path stagingPath(boolean compressed) {
        Path target = files.path(1, compressed);
        return target.resolveSibling(target.getFileName() + ".tmp");
    }

    /**
     * A crash between staging and publishing leaves "index 1 + .tmp" behind.
     * A plain staged copy holds the only copy of the old active segment, so it goes back
     * to index 0 when that is missing or empty. A gzipped one is always a redundant copy.
     */
    private void recoverStaged() throws IOException {
        Path gz = stagingPath(true);
        if (Files.isRegularFile(gz)) {
            Files.delete(gz);
        }
        Path plain = stagingPath(false);
        if (!Files.isRegularFile(plain)) {
            return;
        }
        Path active = files.active();
        if (Files.exists(active) && Files.size(active) > 0) {
            log.warning(() -> "Leaving stale staged segment " + plain + " in place, " + active + " is not empty");
            return;
        }
        Files.move(plain, active, REPLACE_EXISTING);
        log.warning(() -> "Restored staged segment " + plain + " -> " + active);
    }

    /** Gzip {@code source} into {@code target}, removing a partial target on failure. */
    private static void gzip(Path source, Path target) throws IOException {
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = new GZIPOutputStream(Files.newOutputStream(target, CREATE, TRUNCATE_EXISTING, WRITE))) {
            in.transferTo(out);
        } catch (IOException e) {
            try {
                if (Files.isRegularFile(target)) {
                    Files.delete(target);
                }
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private void openActive() throws IOException {
        Path active = files.active();
        ch = FileChannel.open(active, CREATE, WRITE, APPEND);
        writtenInSegment = ch.size();
        log.fine(() -> "Opened stat log segment " + active + " at size " + writtenInSegment);
    }

    private void closeActive() throws IOException {
        FileChannel c = ch;
        ch = null;
        if (c != null) {
            c.close();
        }
    }
}
