package space.ketterling.tidegate.derive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.model.CrossingEvent;
import space.ketterling.tidegate.model.CrossingEvent.Direction;
import space.ketterling.tidegate.model.EventsByDay;
import space.ketterling.tidegate.model.Sample;
import space.ketterling.tidegate.model.SampleSeries;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Derives gate crossing events from a tide height series.
 *
 * <p>
 * Consecutive samples are compared against the threshold; when the pair
 * brackets it the crossing time is linearly interpolated between them and
 * filed under the local day of the interpolated instant. Gaps in the series
 * are interpolated across like any other interval.
 * </p>
 *
 * <p>
 * Samples at or before the previously accepted timestamp, and samples with a
 * non-finite value, are skipped. A run of samples exactly at the threshold
 * yields at most one event, emitted when the run is entered from the strictly
 * opposite side.
 * </p>
 */
public final class EventDeriver {
    private static final Logger log = LoggerFactory.getLogger(EventDeriver.class);

    /**
     * Builds events for every threshold crossing in {@code series}.
     */
    public EventsByDay derive(SampleSeries series, double threshold, ZoneId zone) {
        if (series.size() < 2)
            return EventsByDay.empty();

        EventsByDay.Builder out = EventsByDay.builder();
        Instant prevTs = null;
        double prevValue = Double.NaN;
        int skipped = 0;

        for (Sample s : series) {
            Instant ts = s.timestamp();
            double value = s.value();
            if (!Double.isFinite(value) || (prevTs != null && !ts.isAfter(prevTs))) {
                skipped++;
                continue;
            }

            if (prevTs != null) {
                // guard before dividing: equal values never satisfy either branch
                if (prevValue < threshold && threshold <= value) {
                    out.add(event(prevTs, prevValue, ts, value, threshold, Direction.UP, zone));
                } else if (prevValue > threshold && threshold >= value) {
                    out.add(event(prevTs, prevValue, ts, value, threshold, Direction.DOWN, zone));
                }
            }
            prevTs = ts;
            prevValue = value;
        }

        if (skipped > 0) {
            log.warn("Skipped {} of {} samples (duplicate, out-of-order or non-finite)", skipped, series.size());
        }
        return out.build();
    }

    private static CrossingEvent event(Instant prevTs, double prevValue, Instant ts, double value,
            double threshold, Direction direction, ZoneId zone) {
        Instant at = interpolate(prevTs, prevValue, ts, value, threshold);
        return new CrossingEvent(at, at.atZone(zone).toLocalDate(), direction, threshold);
    }

    /**
     * Instant between {@code t0} and {@code t1} at which the straight line
     * through both samples reaches {@code threshold}, to the nearest
     * nanosecond. Callers guarantee {@code v0 != v1} and that the threshold
     * lies between them.
     */
    static Instant interpolate(Instant t0, double v0, Instant t1, double v1, double threshold) {
        double ratio = (threshold - v0) / (v1 - v0);
        long spanNanos = Duration.between(t0, t1).toNanos();
        long offset = Math.round(ratio * spanNanos);
        return t0.plusNanos(Math.max(0L, Math.min(spanNanos, offset)));
    }
}
