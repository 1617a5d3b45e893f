// file: src/main/java/io/logstats/storage/StatLogMetrics.java
package io.logstats.storage;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for one stat log writer.
 *
 * JVM-local and thread-safe via AtomicLong; nothing is exported. Callers that want
 * to observe a writer pass their own instance in, otherwise the writer creates one.
 */
public final class StatLogMetrics {

    private final AtomicLong linesWritten       = new AtomicLong();
    private final AtomicLong bytesWritten       = new AtomicLong();
    private final AtomicLong failedWrites       = new AtomicLong();
    private final AtomicLong syncs              = new AtomicLong();
    private final AtomicLong rotations          = new AtomicLong();
    private final AtomicLong segmentsCompressed = new AtomicLong();
    private final AtomicLong segmentsDropped    = new AtomicLong();

    void recordWrite(int bytes) {
        linesWritten.incrementAndGet();
        bytesWritten.addAndGet(bytes);
    }

    void recordFailedWrite() { failedWrites.incrementAndGet(); }

    void recordSync() { syncs.incrementAndGet(); }

    void recordRotation() { rotations.incrementAndGet(); }

    void recordCompressed() { segmentsCompressed.incrementAndGet(); }

    void recordDropped() { segmentsDropped.incrementAndGet(); }

    public long linesWritten()       { return linesWritten.get(); }
    public long bytesWritten()       { return bytesWritten.get(); }
    public long failedWrites()       { return failedWrites.get(); }
    public long syncs()              { return syncs.get(); }
    public long rotations()          { return rotations.get(); }
    public long segmentsCompressed() { return segmentsCompressed.get(); }
    public long segmentsDropped()    { return segmentsDropped.get(); }

    @Override
    public String toString() {
        return "StatLogMetrics{" +
                "linesWritten=" + linesWritten.get() +
                ", bytesWritten=" + bytesWritten.get() +
                ", failedWrites=" + failedWrites.get() +
                ", syncs=" + syncs.get() +
                ", rotations=" + rotations.get() +
                ", segmentsCompressed=" + segmentsCompressed.get() +
                ", segmentsDropped=" + segmentsDropped.get() +
                '}';
    }
}
