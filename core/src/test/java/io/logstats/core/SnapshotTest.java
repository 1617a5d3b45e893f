package io.logstats.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotTest {

    @Test
    void plain_map_values_map_onto_tagged_cases() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("i", 7);
        raw.put("b", true);
        raw.put("s", "v");
        raw.put("n", Map.of("x", 1L));
        raw.put("f", 2.5);

        Snapshot s = Snapshot.of(raw);

        assertEquals(StatValue.of(7), s.get("i"));
        assertEquals(StatValue.of(true), s.get("b"));
        assertEquals(StatValue.of("v"), s.get("s"));
        assertEquals(StatValue.of(Snapshot.builder().put("x", 1).build()), s.get("n"));
        assertInstanceOf(StatValue.Opaque.class, s.get("f"));
        assertEquals(List.of("i", "b", "s", "n", "f"), List.copyOf(s.keys()));
    }

    @Test
    void nested_map_keys_that_are_not_strings_are_stringified() {
        Map<Integer, Object> buckets = new LinkedHashMap<>();
        buckets.put(10, 3);
        buckets.put(20, 5);

        Snapshot s = Snapshot.of(Map.of("latency", buckets));

        assertEquals("{\"latency\":{\"10\":3,\"20\":5}}",
                new String(SnapshotCodec.encode(s), StandardCharsets.UTF_8));
    }

    @Test
    void timestamp_values_are_rendered_when_converted() {
        var fixed = StatTimestamp.withRenderer(Instant.EPOCH, ts -> "epoch+" + ts.instant().getEpochSecond());

        Snapshot s = Snapshot.of(Map.of("started", fixed));

        assertEquals("{\"started\":\"epoch+0\"}", new String(SnapshotCodec.encode(s), StandardCharsets.UTF_8));
        assertInstanceOf(StatValue.Opaque.class, s.get("started"));
    }
}
