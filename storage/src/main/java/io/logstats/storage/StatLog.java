// file: src/main/java/io/logstats/storage/StatLog.java
package io.logstats.storage;

import io.logstats.core.Snapshot;

import java.util.Map;

/**
 * Writer of stat snapshots into a rotating set of log segments.
 * <p>
 * Contract:
 *  - write() appends one line "timestamp type json" to the active segment,
 *    rotating first when the active segment has reached its size limit.
 *  - A failed write (UncheckedIOException) did not persist the line; callers may retry.
 *  - Calls are serialized; one instance owns its files exclusively. Two writers,
 *    in one process or several, must not target the same file name.
 */
public interface StatLog extends AutoCloseable {

    /**
     * Write a snapshot under {@code statType}. Stat types must not contain spaces.
     */
    void write(String statType, Snapshot stats);

    /** Convenience overload converting a plain map via {@link Snapshot#of(Map)}. */
    default void write(String statType, Map<String, ?> stats) {
        write(statType, Snapshot.of(stats));
    }

    /**
     * Write only the keys that changed since the previous write of the same type.
     *
     * @throws UnsupportedOperationException if this writer does not deduplicate
     */
    void writeDedupe(String statType, Snapshot stats);

    /** When set, every write is followed by an fsync of the active segment. */
    void setDurable(boolean durable);

    StatLogMetrics metrics();

    @Override
    void close();
}
