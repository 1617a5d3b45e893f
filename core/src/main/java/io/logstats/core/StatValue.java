// file: src/main/java/io/logstats/core/StatValue.java
package io.logstats.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One value inside a {@link Snapshot}.
 * <p>
 * Cases:
 *  - Int64:  signed 64-bit integer.
 *  - UInt64: unsigned 64-bit integer, stored as raw bits.
 *  - Bool:   boolean.
 *  - Str:    string.
 *  - Nested: a nested snapshot.
 *  - Opaque: anything else (floats, arrays, null, ...), carried through untouched.
 * <p>
 * Dedup equality ({@link #sameAs(StatValue)}) is only defined for the primitive cases.
 * Nested snapshots are compared key by key by the dedup engine, and opaque values
 * always count as changed.
 */
public sealed interface StatValue
        permits StatValue.Int64, StatValue.UInt64, StatValue.Bool, StatValue.Str,
                StatValue.Nested, StatValue.Opaque {

    /**
     * @return true if both values are the same primitive case with equal content.
     */
    boolean sameAs(StatValue other);

    static StatValue of(long v) { return new Int64(v); }

    static StatValue unsigned(long bits) { return new UInt64(bits); }

    static StatValue of(boolean v) { return new Bool(v); }

    static StatValue of(String v) { return new Str(v); }

    static StatValue of(Snapshot v) { return new Nested(v); }

    record Int64(long value) implements StatValue {
        @Override
        public boolean sameAs(StatValue other) {
            return other instanceof Int64 o && o.value == value;
        }
    }

    record UInt64(long bits) implements StatValue {
        @Override
        public boolean sameAs(StatValue other) {
            return other instanceof UInt64 o && o.bits == bits;
        }

        @Override
        public String toString() { return "UInt64[" + Long.toUnsignedString(bits) + "]"; }
    }

    record Bool(boolean value) implements StatValue {
        @Override
        public boolean sameAs(StatValue other) {
            return other instanceof Bool o && o.value == value;
        }
    }

    record Str(String value) implements StatValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean sameAs(StatValue other) {
            return other instanceof Str o && o.value.equals(value);
        }
    }

    record Nested(Snapshot value) implements StatValue {
        public Nested {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean sameAs(StatValue other) { return false; }
    }

    record Opaque(JsonNode value) implements StatValue {
        public Opaque {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean sameAs(StatValue other) { return false; }
    }
}
