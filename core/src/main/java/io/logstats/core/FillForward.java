// file: src/main/java/io/logstats/core/FillForward.java
package io.logstats.core;

import java.util.Map.Entry;

/**
 * Inverse of {@link DedupEngine#diff(Snapshot, Snapshot)}: restores keys that a delta
 * left out by copying them from the last fully known snapshot of the same type.
 * <p>
 * Result order: the baseline's keys first (with updated values), then keys the
 * baseline never had. Nested snapshots on both sides are merged recursively.
 */
public final class FillForward {

    private FillForward() {
        // utility
    }

    public static Snapshot merge(Snapshot baseline, Snapshot decoded) {
        Snapshot.Builder out = Snapshot.builder();
        for (Entry<String, StatValue> e : baseline.asMap().entrySet()) {
            String key = e.getKey();
            StatValue known = e.getValue();
            StatValue fresh = decoded.get(key);
            if (fresh == null) {
                out.put(key, known);
            } else if (fresh instanceof StatValue.Nested f && known instanceof StatValue.Nested k) {
                out.put(key, new StatValue.Nested(merge(k.value(), f.value())));
            } else {
                out.put(key, fresh);
            }
        }
        for (Entry<String, StatValue> e : decoded.asMap().entrySet()) {
            if (!baseline.containsKey(e.getKey())) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out.build();
    }
}
