package space.ketterling.tidegate.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * An interpolated instant at which the tide height equals the gate threshold.
 *
 * @param instant   interpolated crossing time
 * @param day       calendar day of {@code instant} in the local zone
 * @param direction direction of the series at the crossing
 * @param threshold threshold that was crossed
 */
public record CrossingEvent(Instant instant, LocalDate day, Direction direction, double threshold) {
    public CrossingEvent {
        Objects.requireNonNull(instant, "instant");
        Objects.requireNonNull(day, "day");
        Objects.requireNonNull(direction, "direction");
    }

    /**
     * ISO {@code yyyy-MM-dd} day key.
     */
    public String dayKey() {
        return day.toString();
    }

    /**
     * Direction of the series relative to the threshold.
     */
    public enum Direction {
        /** Below the threshold before, at or above after. */
        UP,
        /** Above the threshold before, at or below after. */
        DOWN
    }
}
