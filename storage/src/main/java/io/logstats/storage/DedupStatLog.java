// file: src/main/java/io/logstats/storage/DedupStatLog.java
package io.logstats.storage;

import io.logstats.core.DedupEngine;
import io.logstats.core.Snapshot;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stat log that deduplicates consecutive snapshots of the same type.
 * <p>
 * Per write, under one lock:
 *  1) rotate if the active segment is full (rotation clears all baselines),
 *  2) compute the delta against the baseline of this type,
 *  3) encode and append it (fsync when durable),
 *  4) record the full snapshot as the new baseline.
 * <p>
 * Step 4 only runs after the append succeeded, so a failed write leaves the
 * baseline where it was and a retry writes the same delta. When only the fsync
 * failed ({@link SegmentSyncException}) the line is in the file, so the baseline
 * is still committed before the failure is rethrown.
 * <p>
 * This saves a lot of space, at the cost that individual lines can no longer be
 * consumed as-is: use the reconstruction pipeline to expand them again.
 */
public final class DedupStatLog implements StatLog {

    private final ReentrantLock lock = new ReentrantLock();
    private final DedupEngine engine = new DedupEngine();
    private final StatLogMetrics metrics;
    private final StatLineSink sink;

    public DedupStatLog(StatLogConfig cfg) {
        this(cfg, new StatLogMetrics());
    }

    public DedupStatLog(StatLogConfig cfg, StatLogMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.sink = new StatLineSink(cfg, metrics, engine::reset);
    }

    @Override
    public void write(String statType, Snapshot stats) {
        Objects.requireNonNull(statType, "statType");
        Objects.requireNonNull(stats, "stats");
        lock.lock();
        try {
            sink.rotateIfNeeded();
            Snapshot delta = engine.delta(statType, stats);
            try {
                sink.append(statType, delta);
            } catch (SegmentSyncException e) {
                engine.commit(statType, stats);
                throw e;
            }
            engine.commit(statType, stats);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void writeDedupe(String statType, Snapshot stats) {
        write(statType, stats);
    }

    @Override
    public void setDurable(boolean durable) {
        lock.lock();
        try {
            sink.setDurable(durable);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public StatLogMetrics metrics() { return metrics; }

    SegmentStore store() { return sink.store(); }

    @Override
    public void close() {
        lock.lock();
        try {
            sink.close();
        } finally {
            lock.unlock();
        }
    }
}
