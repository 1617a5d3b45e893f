package io.logstats.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReconstructCliTest {

    @TempDir Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return ReconstructCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void reconstructs_next_to_the_source() throws Exception {
        Path source = dir.resolve("stats.00.log");
        Files.writeString(source, "1 kStats {\"k1\":10,\"k2\":\"V2\"}\n2 kStats {\"k1\":99}\n");

        int code = run("--reconstruct-stat-file", source.toString());

        Path dest = dir.resolve("stats.00_duped.log");
        assertEquals(ReconstructCli.EXIT_OK, code);
        assertEquals("1 kStats {\"k1\":10,\"k2\":\"V2\"}\n2 kStats {\"k1\":99,\"k2\":\"V2\"}\n", Files.readString(dest));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains(dest.toString()));
    }

    @Test
    void missing_source_is_an_io_error() {
        int code = run("-f", dir.resolve("nope.log").toString());

        assertEquals(ReconstructCli.EXIT_IO, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("nope.log"));
        assertFalse(Files.exists(dir.resolve("nope_duped.log")));
    }

    @Test
    void missing_flag_prints_usage() {
        int code = run();

        assertEquals(ReconstructCli.EXIT_USAGE, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    void help_prints_usage_to_stdout() {
        assertEquals(ReconstructCli.EXIT_OK, run("--help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("--reconstruct-stat-file"));
    }
}
