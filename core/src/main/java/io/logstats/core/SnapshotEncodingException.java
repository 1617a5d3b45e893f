// file: src/main/java/io/logstats/core/SnapshotEncodingException.java
package io.logstats.core;

/**
 * A snapshot could not be turned into JSON, or JSON could not be turned into a snapshot.
 */
public class SnapshotEncodingException extends RuntimeException {

    public SnapshotEncodingException(String message) {
        super(message);
    }

    public SnapshotEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
