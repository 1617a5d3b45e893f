// file: src/main/java/io/logstats/storage/StatLineSink.java
package io.logstats.storage;

import io.logstats.core.Snapshot;
import io.logstats.core.SnapshotCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Encode + append path shared by both writers.
 * <p>
 * Owns one SegmentStore and one LineCodec. Callers hold their own lock around
 * rotateIfNeeded() + append() so the pair is atomic.
 */
final class StatLineSink implements AutoCloseable {
    private static final Logger log = Logger.getLogger(StatLineSink.class.getName());

    private final SegmentStore store;
    private final LineCodec codec;
    private final StatLogMetrics metrics;

    StatLineSink(StatLogConfig cfg, StatLogMetrics metrics, Runnable onRotate) {
        this.metrics = metrics;
        this.codec = new LineCodec(cfg.formatter(), cfg.clock());
        this.store = new SegmentStore(cfg.segmentFiles(), cfg.sizeLimit(), cfg.numFiles(), cfg.compress(), metrics, onRotate);
        this.store.setDurable(cfg.durable());
    }

    void rotateIfNeeded() {
        try {
            store.rotateIfNeeded();
        } catch (UncheckedIOException e) {
            metrics.recordFailedWrite();
            throw e;
        }
    }

    void append(String statType, Snapshot payload) {
        byte[] line = codec.encode(statType, SnapshotCodec.encode(payload));
        try {
            store.append(line);
        } catch (SegmentSyncException e) {
            metrics.recordWrite(line.length);
            metrics.recordFailedWrite();
            throw e;
        } catch (UncheckedIOException e) {
            metrics.recordFailedWrite();
            throw e;
        }
        metrics.recordWrite(line.length);
    }

    void setDurable(boolean durable) {
        store.setDurable(durable);
    }

    SegmentStore store() { return store; }

    @Override
    public void close() {
        try {
            store.close();
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to close " + store.files().active(), e);
            throw new UncheckedIOException(e);
        }
    }
}
