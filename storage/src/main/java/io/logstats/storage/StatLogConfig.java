// file: src/main/java/io/logstats/storage/StatLogConfig.java
package io.logstats.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logstats.storage.dto.JsonStatLogConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Configuration of one stat log writer.
 *
 * Fields:
 *  - fileName:        log file name; ".log" is appended when missing.
 *  - sizeLimit:       soft size limit of the active segment in bytes (rotation trigger).
 *  - numFiles:        number of segments kept, active one included (1..99).
 *  - timestampFormat: DateTimeFormatter pattern for the line prefix.
 *  - durable:         fsync after every append.
 *  - compress:        gzip sealed segments.
 *  - dedupe:          write only keys that changed since the last write of the same type.
 *  - clock:           time source for line timestamps.
 */
public record StatLogConfig(
        String fileName,
        long sizeLimit,
        int numFiles,
        String timestampFormat,
        boolean durable,
        boolean compress,
        boolean dedupe,
        Clock clock
) {
    public static final long DEFAULT_SIZE_LIMIT = 10L * 1024 * 1024;
    public static final int DEFAULT_NUM_FILES = 10;

    public StatLogConfig {
        if (fileName == null || fileName.isBlank()) throw new IllegalArgumentException("fileName must not be blank");
        if (sizeLimit <= 0) throw new IllegalArgumentException("sizeLimit must be > 0");
        if (numFiles > SegmentFiles.MAX_NUM_FILES) {
            throw new IllegalArgumentException("More than " + SegmentFiles.MAX_NUM_FILES + " files not supported, got " + numFiles);
        }
        if (numFiles < 1) throw new IllegalArgumentException("Unsupported file count " + numFiles);
        Objects.requireNonNull(timestampFormat, "timestampFormat");
        Objects.requireNonNull(clock, "clock");
        try {
            DateTimeFormatter.ofPattern(timestampFormat);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid timestamp format: " + timestampFormat, e);
        }
        // Fails fast on names that cannot be a log file.
        SegmentFiles.forLogFile(fileName);
    }

    public static Builder builder(String fileName) {
        return new Builder(fileName);
    }

    public SegmentFiles segmentFiles() {
        return SegmentFiles.forLogFile(fileName);
    }

    public DateTimeFormatter formatter() {
        return DateTimeFormatter.ofPattern(timestampFormat);
    }

    /**
     * Load a writer configuration from JSON. Missing fields fall back to the builder defaults.
     *
     * Example:
     *   {"fileName": "/var/log/app/stats.log", "sizeLimit": 1048576, "numFiles": 5,
     *    "timestampFormat": "yyyy-MM-dd'T'HH:mm:ss.SSSXXX", "durable": false,
     *    "compress": true, "dedupe": true}
     */
    public static StatLogConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        JsonStatLogConfig cfg;
        try {
            cfg = mapper.readValue(path.toFile(), JsonStatLogConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load StatLogConfig from " + path, e);
        }
        if (cfg.fileName == null) {
            throw new IllegalArgumentException("fileName is required in " + path);
        }
        Builder b = builder(cfg.fileName);
        if (cfg.sizeLimit != null) b.sizeLimit(cfg.sizeLimit);
        if (cfg.numFiles != null) b.numFiles(cfg.numFiles);
        if (cfg.timestampFormat != null) b.timestampFormat(cfg.timestampFormat);
        if (cfg.durable != null) b.durable(cfg.durable);
        if (cfg.compress != null) b.compress(cfg.compress);
        if (cfg.dedupe != null) b.dedupe(cfg.dedupe);
        return b.build();
    }

    public static final class Builder {
        private final String fileName;
        private long sizeLimit = DEFAULT_SIZE_LIMIT;
        private int numFiles = DEFAULT_NUM_FILES;
        private String timestampFormat = LineCodec.DEFAULT_TIMESTAMP_FORMAT;
        private boolean durable = false;
        private boolean compress = true;
        private boolean dedupe = false;
        private Clock clock = Clock.systemDefaultZone();

        private Builder(String fileName) {
            this.fileName = fileName;
        }

        public Builder sizeLimit(long sizeLimit) { this.sizeLimit = sizeLimit; return this; }

        public Builder numFiles(int numFiles) { this.numFiles = numFiles; return this; }

        public Builder timestampFormat(String timestampFormat) { this.timestampFormat = timestampFormat; return this; }

        public Builder durable(boolean durable) { this.durable = durable; return this; }

        public Builder compress(boolean compress) { this.compress = compress; return this; }

        public Builder dedupe(boolean dedupe) { this.dedupe = dedupe; return this; }

        public Builder clock(Clock clock) { this.clock = clock; return this; }

        public StatLogConfig build() {
            return new StatLogConfig(fileName, sizeLimit, numFiles, timestampFormat, durable, compress, dedupe, clock);
        }
    }
}
