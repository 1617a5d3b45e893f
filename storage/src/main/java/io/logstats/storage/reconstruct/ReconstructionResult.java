// file: src/main/java/io/logstats/storage/reconstruct/ReconstructionResult.java
package io.logstats.storage.reconstruct;

/**
 * Counters of one reconstruction run.
 *
 * @param linesRead          lines the reader emitted
 * @param linesWritten       lines appended to the output
 * @param linesFilled        stat lines merged with the previous snapshot of their type
 * @param linesPassedThrough lines copied unchanged because they were not stat lines or malformed
 */
public record ReconstructionResult(
        long linesRead,
        long linesWritten,
        long linesFilled,
        long linesPassedThrough
) {}
