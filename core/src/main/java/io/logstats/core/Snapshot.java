// file: src/main/java/io/logstats/core/Snapshot.java
package io.logstats.core;

import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, insertion-ordered mapping from stat key to {@link StatValue}.
 * <p>
 * Key order does not matter for equality but is kept so that a snapshot
 * renders the same way every time it is encoded.
 */
public final class Snapshot {

    private static final Snapshot EMPTY = new Snapshot(new LinkedHashMap<>());
    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final Map<String, StatValue> values;

    private Snapshot(LinkedHashMap<String, StatValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Snapshot empty() { return EMPTY; }

    public static Builder builder() { return new Builder(); }

    /**
     * Convert a plain Java map into a snapshot.
     * <p>
     * Mapping:
     *  - Byte/Short/Integer/Long    -> Int64
     *  - BigInteger within uint64   -> Int64 or UInt64
     *  - Boolean                    -> Bool
     *  - CharSequence               -> Str
     *  - StatTimestamp              -> Opaque string, rendered now
 *  - Map                        -> Nested (recursively, keys through String.valueOf)
     *  - Snapshot / StatValue       -> as is
     *  - anything else              -> Opaque (through Jackson's tree model)
     */
    public static Snapshot of(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw");
        return fromMap(raw);
    }

    public StatValue get(String key) { return values.get(key); }

    public boolean containsKey(String key) { return values.containsKey(key); }

    public Set<String> keys() { return values.keySet(); }

    /** Read-only view in insertion order. */
    public Map<String, StatValue> asMap() { return values; }

    public int size() { return values.size(); }

    public boolean isEmpty() { return values.isEmpty(); }

    private static Snapshot fromMap(Map<?, ?> raw) {
        Builder b = builder();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            b.put(String.valueOf(e.getKey()), toStatValue(e.getValue()));
        }
        return b.build();
    }

    private static StatValue toStatValue(Object v) {
        if (v instanceof StatValue sv) return sv;
        if (v instanceof Snapshot s) return new StatValue.Nested(s);
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return new StatValue.Int64(((Number) v).longValue());
        }
        if (v instanceof BigInteger big && big.signum() >= 0 && big.compareTo(UINT64_MAX) <= 0) {
            return big.bitLength() < 64
                    ? new StatValue.Int64(big.longValue())
                    : new StatValue.UInt64(big.longValue());
        }
        if (v instanceof Boolean bool) return new StatValue.Bool(bool);
        if (v instanceof CharSequence cs) return new StatValue.Str(cs.toString());
        if (v instanceof StatTimestamp ts) return new StatValue.Opaque(TextNode.valueOf(ts.render()));
        if (v instanceof Map<?, ?> m) return new StatValue.Nested(fromMap(m));
        return new StatValue.Opaque(SnapshotCodec.MAPPER.valueToTree(v));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return values.toString(); }

    public static final class Builder {
        private final LinkedHashMap<String, StatValue> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, StatValue value) {
            values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String key, long value) { return put(key, new StatValue.Int64(value)); }

        public Builder put(String key, boolean value) { return put(key, new StatValue.Bool(value)); }

        public Builder put(String key, String value) { return put(key, new StatValue.Str(value)); }

        public Builder put(String key, Snapshot value) { return put(key, new StatValue.Nested(value)); }

        public Builder put(String key, StatTimestamp value) {
            return put(key, new StatValue.Opaque(TextNode.valueOf(value.render())));
        }

        public Builder putUnsigned(String key, long bits) { return put(key, new StatValue.UInt64(bits)); }

        public Snapshot build() { return new Snapshot(new LinkedHashMap<>(values)); }
    }
}
