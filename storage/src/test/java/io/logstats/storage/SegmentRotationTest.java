// file: src/test/java/io/logstats/storage/SegmentRotationTest.java
package io.logstats.storage;

import io.logstats.core.Snapshot;
import io.logstats.core.StatValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class SegmentRotationTest {

    @TempDir Path dir;

    private StatLogConfig.Builder config(long sizeLimit, int numFiles, boolean compress) {
        return StatLogConfig.builder(dir.resolve("stats.log").toString())
                .sizeLimit(sizeLimit)
                .numFiles(numFiles)
                .compress(compress)
                .clock(TestSegments.FIXED_CLOCK);
    }

    private static Snapshot snapshot(int seq, int padLength) {
        return Snapshot.builder()
                .put("seq", seq)
                .put("pad", "x".repeat(padLength))
                .build();
    }

    private static Snapshot firstPayload(Path segment) throws Exception {
        return TestSegments.payloadOf(TestSegments.lines(segment).get(0));
    }

    @Test
    void five_writes_fit_in_four_segments_and_read_back_in_order() throws Exception {
        // Two short lines share the oldest segment, every longer line fills one on its own.
        List<Snapshot> written = new ArrayList<>();
        try (StatLog log = StatLogs.open(config(128, 4, false).build())) {
            for (int i = 1; i <= 5; i++) {
                Snapshot s = snapshot(i, i <= 2 ? 40 : 120);
                log.write("kStats", s);
                written.add(s);
            }
            assertEquals(3, log.metrics().rotations());
            assertEquals(0, log.metrics().segmentsDropped());
        }

        var files = SegmentFiles.forLogFile(dir.resolve("stats.log").toString());
        assertEquals(4, files.list().size());
        for (int i = 0; i < 4; i++) {
            assertTrue(Files.exists(files.path(i, false)), "missing segment " + i);
        }

        List<Snapshot> readBack = new ArrayList<>();
        for (String line : TestSegments.linesOldestFirst(files)) {
            readBack.add(TestSegments.payloadOf(line));
        }
        assertEquals(written, readBack);
    }

    @Test
    void retention_never_exceeds_num_files() throws Exception {
        var metrics = new StatLogMetrics();
        try (StatLog log = StatLogs.open(config(1, 3, true).build(), metrics)) {
            for (int i = 1; i <= 10; i++) {
                log.write("kStats", snapshot(i, 0));
            }
        }

        var files = SegmentFiles.forLogFile(dir.resolve("stats.log").toString());
        List<SegmentFiles.Segment> segments = files.list();
        assertEquals(3, segments.size());
        assertFalse(segments.get(0).compressed());
        assertTrue(segments.get(1).compressed());
        assertTrue(segments.get(2).compressed());

        assertEquals(9, metrics.rotations());
        assertEquals(9, metrics.segmentsCompressed());
        assertEquals(7, metrics.segmentsDropped());
        assertEquals(10, metrics.linesWritten());

        assertEquals(StatValue.of(10), firstPayload(files.path(0, false)).get("seq"));
        assertEquals(StatValue.of(9), firstPayload(files.path(1, true)).get("seq"));
        assertEquals(StatValue.of(8), firstPayload(files.path(2, true)).get("seq"));
    }

    @Test
    void compressed_rotation_leaves_no_plain_or_tmp_copy_behind() throws Exception {
        try (StatLog log = StatLogs.open(config(1, 4, true).build())) {
            log.write("kStats", snapshot(1, 0));
            log.write("kStats", snapshot(2, 0));
        }

        assertTrue(Files.exists(dir.resolve("stats.01.log.gz")));
        assertFalse(Files.exists(dir.resolve("stats.01.log")));
        assertFalse(Files.exists(dir.resolve("stats.01.log.gz.tmp")));
        assertEquals(1, TestSegments.lines(dir.resolve("stats.00.log")).size());
    }

    @Test
    void oversized_line_is_never_split() throws Exception {
        Snapshot big = snapshot(1, 500);
        try (StatLog log = StatLogs.open(config(16, 4, false).build())) {
            log.write("kStats", big);
            assertEquals(0, log.metrics().rotations());
            log.write("kStats", snapshot(2, 0));
            assertEquals(1, log.metrics().rotations());
        }

        List<String> sealed = TestSegments.lines(dir.resolve("stats.01.log"));
        assertEquals(1, sealed.size());
        assertEquals(big, TestSegments.payloadOf(sealed.get(0)));
    }

    @Test
    void single_file_retention_discards_the_full_segment() throws Exception {
        try (StatLog log = StatLogs.open(config(1, 1, true).build())) {
            for (int i = 1; i <= 3; i++) {
                log.write("kStats", snapshot(i, 0));
            }
        }

        var files = SegmentFiles.forLogFile(dir.resolve("stats.log").toString());
        assertEquals(1, files.list().size());
        List<String> lines = TestSegments.lines(files.active());
        assertEquals(1, lines.size());
        assertEquals(snapshot(3, 0), TestSegments.payloadOf(lines.get(0)));
    }

    @Test
    void existing_active_segment_counts_toward_size_limit() throws Exception {
        try (StatLog log = StatLogs.open(config(64, 4, false).build())) {
            log.write("kStats", snapshot(1, 60));
        }
        try (StatLog log = StatLogs.open(config(64, 4, false).build())) {
            log.write("kStats", snapshot(2, 0));
            assertEquals(1, log.metrics().rotations());
        }

        assertEquals(snapshot(1, 60), TestSegments.payloadOf(TestSegments.lines(dir.resolve("stats.01.log")).get(0)));
        assertEquals(snapshot(2, 0), TestSegments.payloadOf(TestSegments.lines(dir.resolve("stats.00.log")).get(0)));
    }

    @Test
    void lines_carry_configured_timestamp_and_type() throws Exception {
        try (StatLog log = StatLogs.open(config(1024, 2, false).timestampFormat("yyyyMMddHHmmss").build())) {
            log.write("kStats", Snapshot.builder().put("k1", 10).build());
        }

        assertEquals(List.of("20240102030405 kStats {\"k1\":10}"), TestSegments.lines(dir.resolve("stats.00.log")));
    }

    @Test
    void durable_writes_fsync_every_append() throws Exception {
        try (StatLog log = StatLogs.open(config(1024, 2, false).durable(true).build())) {
            log.write("kStats", snapshot(1, 0));
            log.setDurable(false);
            log.write("kStats", snapshot(2, 0));
            assertEquals(1, log.metrics().syncs());
            assertEquals(2, log.metrics().linesWritten());
        }
    }

    @Test
    void plain_writer_rejects_dedupe_writes() {
        try (StatLog log = StatLogs.open(config(1024, 2, false).build())) {
            assertThrows(UnsupportedOperationException.class, () -> log.writeDedupe("kStats", snapshot(1, 0)));
        }
    }

    private Map<String, List<String>> contentsByName(SegmentFiles files) throws Exception {
        Map<String, List<String>> out = new TreeMap<>();
        for (SegmentFiles.Segment s : files.list()) {
            out.put(s.path().getFileName().toString(), TestSegments.lines(s.path()));
        }
        return out;
    }

    @Test
    void failed_compression_leaves_sealed_segments_untouched_across_retries() throws Exception {
        var files = SegmentFiles.forLogFile(dir.resolve("stats.log").toString());
        var metrics = new StatLogMetrics();
        try (StatLog log = StatLogs.open(config(1, 4, true).build(), metrics)) {
            for (int i = 1; i <= 4; i++) {
                log.write("kStats", snapshot(i, 0));
            }
            Map<String, List<String>> before = contentsByName(files);
            assertEquals(4, before.size());

            // A non-empty directory where the gzip staging file goes.
            Path blocker = dir.resolve("stats.01.log.gz.tmp");
            Files.createDirectory(blocker);
            Files.writeString(blocker.resolve("keep"), "x");

            for (int attempt = 0; attempt < 3; attempt++) {
                int seq = 5 + attempt;
                assertThrows(UncheckedIOException.class, () -> log.write("kStats", snapshot(seq, 0)));
                assertEquals(before, contentsByName(files), "attempt " + attempt);
            }
            assertEquals(0, metrics.segmentsDropped());
            assertEquals(3, metrics.failedWrites());

            Files.delete(blocker.resolve("keep"));
            Files.delete(blocker);
            log.write("kStats", snapshot(8, 0));

            Map<String, List<String>> after = contentsByName(files);
            assertEquals(4, after.size());
            assertEquals(before.get("stats.00.log"), after.get("stats.01.log.gz"));
            assertEquals(before.get("stats.01.log.gz"), after.get("stats.02.log.gz"));
            assertEquals(before.get("stats.02.log.gz"), after.get("stats.03.log.gz"));
            assertEquals(1, metrics.segmentsDropped());
        }
        assertEquals(snapshot(8, 0), firstPayload(dir.resolve("stats.00.log")));
    }

    @Test
    void failed_plain_seal_restores_the_active_segment() throws Exception {
        var files = SegmentFiles.forLogFile(dir.resolve("stats.log").toString());
        try (StatLog log = StatLogs.open(config(1, 3, false).build())) {
            log.write("kStats", snapshot(1, 0));
            log.write("kStats", snapshot(2, 0));
            Map<String, List<String>> before = contentsByName(files);

            Path blocker = dir.resolve("stats.01.log.tmp");
            Files.createDirectory(blocker);
            Files.writeString(blocker.resolve("keep"), "x");

            assertThrows(UncheckedIOException.class, () -> log.write("kStats", snapshot(3, 0)));
            assertThrows(UncheckedIOException.class, () -> log.write("kStats", snapshot(3, 0)));
            assertEquals(before, contentsByName(files));

            Files.delete(blocker.resolve("keep"));
            Files.delete(blocker);
            log.write("kStats", snapshot(3, 0));
        }

        assertEquals(snapshot(1, 0), firstPayload(dir.resolve("stats.02.log")));
        assertEquals(snapshot(2, 0), firstPayload(dir.resolve("stats.01.log")));
        assertEquals(snapshot(3, 0), firstPayload(dir.resolve("stats.00.log")));
    }

    @Test
    void segment_left_at_staging_name_is_restored_on_open() throws Exception {
        Files.writeString(dir.resolve("stats.01.log.tmp"), TestSegments.FIXED_TIMESTAMP + " kStats {\"seq\":1}\n");
        Files.writeString(dir.resolve("stats.01.log.gz.tmp"), "partial");

        try (StatLog log = StatLogs.open(config(1024, 3, false).build())) {
            log.write("kStats", snapshot(2, 0));
        }

        assertFalse(Files.exists(dir.resolve("stats.01.log.tmp")));
        assertFalse(Files.exists(dir.resolve("stats.01.log.gz.tmp")));
        List<String> lines = TestSegments.lines(dir.resolve("stats.00.log"));
        assertEquals(2, lines.size());
        assertEquals(Snapshot.builder().put("seq", 1).build(), TestSegments.payloadOf(lines.get(0)));
    }
}
