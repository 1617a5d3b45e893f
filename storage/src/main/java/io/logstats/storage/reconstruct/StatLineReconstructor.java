// file: src/main/java/io/logstats/storage/reconstruct/StatLineReconstructor.java
package io.logstats.storage.reconstruct;

import io.logstats.core.FillForward;
import io.logstats.core.Snapshot;
import io.logstats.core.SnapshotCodec;
import io.logstats.core.SnapshotEncodingException;
import io.logstats.storage.LineCodec;
import io.logstats.storage.LineFormatException;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Expands one deduplicated line at a time, keeping the last full snapshot per stat type.
 * <p>
 * Per line:
 *  - not a stat line, or malformed   -> returned unchanged.
 *  - first line of its type          -> recorded as baseline, returned unchanged.
 *  - otherwise                       -> missing keys filled from the baseline, merged
 *                                       snapshot recorded and spliced into the line
 *                                       after the "timestamp type " prefix.
 * <p>
 * State is per file. Not thread safe: owned by the pipeline's transformer stage.
 */
public final class StatLineReconstructor {

    private final Map<String, Snapshot> lastKnown = new HashMap<>();
    private final ReconstructionListener listener;

    private long filled;
    private long passedThrough;

    public StatLineReconstructor(ReconstructionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public byte[] reconstruct(byte[] line) {
        LineCodec.DecodedLine decoded;
        try {
            decoded = LineCodec.decode(line);
        } catch (LineFormatException e) {
            return passThrough(line, e.getMessage());
        }
        if (decoded == null) {
            passedThrough++;
            return line;
        }

        int start = decoded.payloadStart();
        Snapshot stats;
        try {
            stats = SnapshotCodec.decode(line, start, line.length - start);
        } catch (SnapshotEncodingException e) {
            return passThrough(line, e.getMessage());
        }

        Snapshot prev = lastKnown.get(decoded.type());
        if (prev == null) {
            lastKnown.put(decoded.type(), stats);
            return line;
        }

        Snapshot merged = FillForward.merge(prev, stats);
        byte[] payload;
        try {
            payload = SnapshotCodec.encode(merged);
        } catch (SnapshotEncodingException e) {
            return passThrough(line, e.getMessage());
        }
        lastKnown.put(decoded.type(), merged);
        filled++;

        byte[] out = Arrays.copyOf(line, start + payload.length);
        System.arraycopy(payload, 0, out, start, payload.length);
        return out;
    }

    public long filled() { return filled; }

    public long passedThrough() { return passedThrough; }

    private byte[] passThrough(byte[] line, String reason) {
        passedThrough++;
        listener.onMalformedLine(line, reason);
        return line;
    }
}
