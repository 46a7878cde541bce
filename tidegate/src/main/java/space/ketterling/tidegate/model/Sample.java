package space.ketterling.tidegate.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One measurement of the tide height at an instant.
 */
public record Sample(Instant timestamp, double value) {
    public Sample {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Builds a sample from unix epoch seconds, which providers send as either
     * integers or fractions.
     */
    public static Sample ofEpochSeconds(double epochSeconds, double value) {
        long secs = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - secs) * 1_000_000_000L);
        return new Sample(Instant.ofEpochSecond(secs, nanos), value);
    }
}
