package io.logstats.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StatLogConfigTest {

    @TempDir Path dir;

    @Test
    void builder_defaults() {
        var cfg = StatLogConfig.builder(dir.resolve("stats.log").toString()).build();

        assertEquals(StatLogConfig.DEFAULT_SIZE_LIMIT, cfg.sizeLimit());
        assertEquals(10, cfg.numFiles());
        assertEquals(LineCodec.DEFAULT_TIMESTAMP_FORMAT, cfg.timestampFormat());
        assertTrue(cfg.compress());
        assertFalse(cfg.dedupe());
        assertFalse(cfg.durable());
    }

    @Test
    void file_count_must_be_within_bounds() {
        var b = StatLogConfig.builder(dir.resolve("stats.log").toString());

        assertThrows(IllegalArgumentException.class, () -> b.numFiles(0).build());
        assertThrows(IllegalArgumentException.class, () -> b.numFiles(100).build());
        assertEquals(99, b.numFiles(99).build().numFiles());
    }

    @Test
    void invalid_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> StatLogConfig.builder("").build());
        assertThrows(IllegalArgumentException.class,
                () -> StatLogConfig.builder(dir.resolve("stats").toString()).sizeLimit(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> StatLogConfig.builder(dir.resolve("stats").toString()).timestampFormat("yyyy-MM-dd'T").build());
    }

    @Test
    void json_file_overrides_defaults() throws Exception {
        Path json = dir.resolve("statlog.json");
        Files.writeString(json, """
                {"fileName": "%s", "sizeLimit": 4096, "numFiles": 3, "dedupe": true, "compress": false}
                """.formatted(dir.resolve("app/stats").toString().replace("\\", "\\\\")));

        var cfg = StatLogConfig.fromJsonFile(json);

        assertEquals(4096, cfg.sizeLimit());
        assertEquals(3, cfg.numFiles());
        assertTrue(cfg.dedupe());
        assertFalse(cfg.compress());
        assertEquals(dir.resolve("app/stats.00.log"), cfg.segmentFiles().active());
    }

    @Test
    void json_file_without_file_name_is_rejected() throws Exception {
        Path json = dir.resolve("statlog.json");
        Files.writeString(json, "{\"numFiles\": 3}");

        assertThrows(IllegalArgumentException.class, () -> StatLogConfig.fromJsonFile(json));
    }

    @Test
    void json_file_with_too_many_files_is_rejected() throws Exception {
        Path json = dir.resolve("statlog.json");
        Files.writeString(json, "{\"fileName\": \"stats\", \"numFiles\": 100}");

        assertThrows(IllegalArgumentException.class, () -> StatLogConfig.fromJsonFile(json));
    }

    @Test
    void missing_json_file_is_an_io_error() {
        assertThrows(UncheckedIOException.class, () -> StatLogConfig.fromJsonFile(dir.resolve("missing.json")));
    }
}
