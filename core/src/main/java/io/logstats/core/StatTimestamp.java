// file: src/main/java/io/logstats/core/StatTimestamp.java
package io.logstats.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * A point in time recorded as a stat value.
 * <p>
 * Rendered when the snapshot holding it is built or serialized:
 *  - with a custom renderer: whatever the renderer returns,
 *  - otherwise: the time elapsed since then, as an ISO-8601 duration ("PT1M30S").
 * <p>
 * Inside a {@link Snapshot} it becomes an Opaque string value, so the dedup
 * engine always writes it.
 */
@JsonSerialize(using = StatTimestamp.Serializer.class)
public final class StatTimestamp {

    private final Instant instant;
    private final Clock clock;
    private final Function<StatTimestamp, String> renderer;

    private StatTimestamp(Instant instant, Clock clock, Function<StatTimestamp, String> renderer) {
        this.instant = Objects.requireNonNull(instant, "instant");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.renderer = renderer;
    }

    public static StatTimestamp of(Instant instant) {
        return of(instant, Clock.systemUTC());
    }

    /** Elapsed time is measured against {@code clock}. */
    public static StatTimestamp of(Instant instant, Clock clock) {
        return new StatTimestamp(instant, clock, null);
    }

    public static StatTimestamp now() {
        return now(Clock.systemUTC());
    }

    public static StatTimestamp now(Clock clock) {
        return of(clock.instant(), clock);
    }

    public static StatTimestamp withRenderer(Instant instant, Function<StatTimestamp, String> renderer) {
        return new StatTimestamp(instant, Clock.systemUTC(), Objects.requireNonNull(renderer, "renderer"));
    }

    public Instant instant() { return instant; }

    /** Same instant, regardless of how either side renders. */
    public boolean isEqual(StatTimestamp other) {
        return instant.equals(other.instant);
    }

    /** Time from this timestamp to {@code current}; negative when {@code current} is earlier. */
    public Duration since(StatTimestamp current) {
        return Duration.between(instant, current.instant);
    }

    public String render() {
        if (renderer != null) {
            return Objects.requireNonNull(renderer.apply(this), "renderer returned null");
        }
        return since(now(clock)).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatTimestamp other)) return false;
        return isEqual(other);
    }

    @Override
    public int hashCode() { return instant.hashCode(); }

    @Override
    public String toString() { return "StatTimestamp[" + instant + "]"; }

    static final class Serializer extends StdSerializer<StatTimestamp> {
        Serializer() {
            super(StatTimestamp.class);
        }

        @Override
        public void serialize(StatTimestamp value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.render());
        }
    }
}
