// file: src/main/java/io/logstats/storage/LineFormatException.java
package io.logstats.storage;

/**
 * A line that starts like a stat line but whose type or payload cannot be located.
 * Reconstruction passes such lines through unchanged.
 */
public class LineFormatException extends RuntimeException {

    public LineFormatException(String message) {
        super(message);
    }
}
