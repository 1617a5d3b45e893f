// file: src/main/java/io/logstats/core/DedupEngine.java
package io.logstats.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;

/**
 * Computes what to write for a stat snapshot, given the last snapshot written for its type.
 * <p>
 * Semantics of {@link #diff(Snapshot, Snapshot)}, per key of the current snapshot:
 *  - key missing from prev                      -> included.
 *  - same primitive case with equal content     -> omitted.
 *  - both nested                                -> recurse; included only if the
 *                                                  nested delta is non-empty.
 *  - anything else (type change, opaque value)  -> included verbatim.
 * <p>
 * Keys that disappear between two writes are not represented at all; there is no
 * tombstone, so a reader filling values forward will keep the last value it saw.
 * <p>
 * Baselines are per stat type and hold the full (not delta) snapshot. The owner calls
 * {@link #commit(String, Snapshot)} once the line is on disk and {@link #reset()} on
 * every rotation. Not thread safe: the owning writer serializes access.
 */
public final class DedupEngine {

    private final Map<String, Snapshot> baselines = new HashMap<>();

    /**
     * @return the snapshot to write for {@code type}: the full snapshot if this type
     *         has no baseline yet, otherwise only the changed keys.
     */
    public Snapshot delta(String type, Snapshot curr) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(curr, "curr");
        Snapshot prev = baselines.get(type);
        return prev == null ? curr : diff(prev, curr);
    }

    /** Record {@code curr} as the baseline for the next write of {@code type}. */
    public void commit(String type, Snapshot curr) {
        baselines.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(curr, "curr"));
    }

    /** Forget every baseline; the next write of each type will be full. */
    public void reset() {
        baselines.clear();
    }

    public boolean hasBaseline(String type) {
        return baselines.containsKey(type);
    }

    public static Snapshot diff(Snapshot prev, Snapshot curr) {
        Snapshot.Builder out = Snapshot.builder();
        for (Entry<String, StatValue> e : curr.asMap().entrySet()) {
            String key = e.getKey();
            StatValue v = e.getValue();
            StatValue before = prev.get(key);

            if (before == null) {
                out.put(key, v);
                continue;
            }
            if (v.sameAs(before)) {
                continue;
            }
            if (v instanceof StatValue.Nested n && before instanceof StatValue.Nested p) {
                Snapshot inner = diff(p.value(), n.value());
                if (!inner.isEmpty()) {
                    out.put(key, new StatValue.Nested(inner));
                }
                continue;
            }
            // Unsupported for filtering: treat as changed.
            out.put(key, v);
        }
        return out.build();
    }
}
