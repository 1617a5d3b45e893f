// file: src/main/java/io/logstats/storage/PlainStatLog.java
package io.logstats.storage;

import io.logstats.core.Snapshot;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stat log that always writes full snapshots. Supports regular log rotation.
 */
public final class PlainStatLog implements StatLog {

    private final ReentrantLock lock = new ReentrantLock();
    private final StatLogMetrics metrics;
    private final StatLineSink sink;

    public PlainStatLog(StatLogConfig cfg) {
        this(cfg, new StatLogMetrics());
    }

    public PlainStatLog(StatLogConfig cfg, StatLogMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.sink = new StatLineSink(cfg, metrics, () -> { });
    }

    @Override
    public void write(String statType, Snapshot stats) {
        Objects.requireNonNull(statType, "statType");
        Objects.requireNonNull(stats, "stats");
        lock.lock();
        try {
            // Rotate only once the active segment is at or above the limit, so a
            // single line may push a segment past sizeLimit.
            sink.rotateIfNeeded();
            sink.append(statType, stats);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void writeDedupe(String statType, Snapshot stats) {
        throw new UnsupportedOperationException("writeDedupe is not supported by " + getClass().getSimpleName());
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
