// file: src/main/java/io/logstats/storage/SegmentSyncException.java
package io.logstats.storage;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * A line was appended but flushing it to disk failed.
 * The line is in the file; writers treat it as written.
 */
public class SegmentSyncException extends UncheckedIOException {
    public SegmentSyncException(String message, IOException cause) {
        super(message, cause);
    }
}
