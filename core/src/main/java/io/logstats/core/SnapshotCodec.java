// file: src/main/java/io/logstats/core/SnapshotCodec.java
package io.logstats.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.Map;

/**
 * Compact JSON form of a {@link Snapshot}.
 * <p>
 * Encoding writes keys in snapshot order with no whitespace, so the output
 * never contains a newline and can be embedded in a single log line.
 * <p>
 * Decoding maps JSON back onto the tagged model:
 *  - integral number fitting a long          -> Int64
 *  - integral number in (2^63-1, 2^64-1]     -> UInt64
 *  - true/false                              -> Bool
 *  - string                                  -> Str
 *  - object                                  -> Nested
 *  - anything else                           -> Opaque
 * <p>
 * Thread safe: the shared ObjectMapper is only used for reads and tree conversion.
 */
public final class SnapshotCodec {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private SnapshotCodec() {
        // utility
    }

    public static byte[] encode(Snapshot snapshot) {
        var out = new ByteArrayOutputStream(128);
        try (JsonGenerator gen = MAPPER.getFactory().createGenerator(out)) {
            writeSnapshot(gen, snapshot);
        } catch (IOException e) {
            throw new SnapshotEncodingException("Failed to encode snapshot " + snapshot, e);
        }
        return out.toByteArray();
    }

    public static Snapshot decode(byte[] json) {
        return decode(json, 0, json.length);
    }

    /** Decode the JSON object held in {@code json[offset, offset+length)}. */
    public static Snapshot decode(byte[] json, int offset, int length) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json, offset, length);
        } catch (IOException e) {
            throw new SnapshotEncodingException("Failed to parse snapshot JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SnapshotEncodingException(
                    "Expected a JSON object but got " + (root == null ? "nothing" : root.getNodeType()));
        }
        return fromObject(root);
    }

    // ----------------- helpers -----------------

    private static void writeSnapshot(JsonGenerator gen, Snapshot snapshot) throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, StatValue> e : snapshot.asMap().entrySet()) {
            gen.writeFieldName(e.getKey());
            writeValue(gen, e.getValue());
        }
        gen.writeEndObject();
    }

    private static void writeValue(JsonGenerator gen, StatValue v) throws IOException {
        if (v instanceof StatValue.Int64 i) {
            gen.writeNumber(i.value());
        } else if (v instanceof StatValue.UInt64 u) {
            gen.writeNumber(new BigInteger(Long.toUnsignedString(u.bits())));
        } else if (v instanceof StatValue.Bool b) {
            gen.writeBoolean(b.value());
        } else if (v instanceof StatValue.Str s) {
            gen.writeString(s.value());
        } else if (v instanceof StatValue.Nested n) {
            writeSnapshot(gen, n.value());
        } else if (v instanceof StatValue.Opaque o) {
            gen.writeTree(o.value());
        } else {
            throw new IllegalStateException("Unknown stat value type: " + v);
        }
    }

    private static Snapshot fromObject(JsonNode obj) {
        Snapshot.Builder b = Snapshot.builder();
        for (Iterator<Map.Entry<String, JsonNode>> it = obj.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            b.put(field.getKey(), fromNode(field.getValue()));
        }
        return b.build();
    }

    private static StatValue fromNode(JsonNode node) {
        if (node.isIntegralNumber()) {
            if (node.canConvertToLong()) {
                return new StatValue.Int64(node.longValue());
            }
            BigInteger big = node.bigIntegerValue();
            if (big.signum() > 0 && big.compareTo(UINT64_MAX) <= 0) {
                return new StatValue.UInt64(big.longValue());
            }
            return new StatValue.Opaque(node);
        }
        if (node.isBoolean()) return new StatValue.Bool(node.booleanValue());
        if (node.isTextual()) return new StatValue.Str(node.textValue());
        if (node.isObject()) return new StatValue.Nested(fromObject(node));
        return new StatValue.Opaque(node);
    }
}
