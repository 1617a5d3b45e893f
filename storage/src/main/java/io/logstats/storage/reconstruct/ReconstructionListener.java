// file: src/main/java/io/logstats/storage/reconstruct/ReconstructionListener.java
package io.logstats.storage.reconstruct;

/**
 * Progress sink for a reconstruction run.
 * Called from the pipeline's worker threads; implementations must be thread safe.
 */
public interface ReconstructionListener {

    /** Called every {@link ReconstructionPipeline#FLUSH_EVERY_LINES} written lines, after a flush. */
    void onProgress(long linesWritten);

    /** A line looked like a stat line but could not be reconstructed; it is passed through. */
    void onMalformedLine(byte[] line, String reason);

    void onFinished(ReconstructionResult result);

    /** Default sink writing to java.util.logging. */
    static ReconstructionListener logging() {
        return new LoggingReconstructionListener();
    }
}
