package space.ketterling.tidegate.model;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable, chronologically ordered sequence of samples.
 *
 * <p>
 * A series is never modified after construction; a refresh publishes a new
 * series instead. Ordering is expected but not enforced here, see
 * {@link space.ketterling.tidegate.derive.EventDeriver} for how violations are
 * handled.
 * </p>
 */
public final class SampleSeries implements Iterable<Sample> {
    private static final SampleSeries EMPTY = new SampleSeries(List.of());

    private final List<Sample> samples;

    private SampleSeries(List<Sample> samples) {
        this.samples = samples;
    }

    public static SampleSeries empty() {
        return EMPTY;
    }

    /**
     * Copies the given samples into a new series.
     */
    public static SampleSeries of(List<Sample> samples) {
        if (samples == null || samples.isEmpty())
            return EMPTY;
        return new SampleSeries(List.copyOf(samples));
    }

    public static SampleSeries of(Sample... samples) {
        return of(List.of(samples));
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public Sample get(int index) {
        return samples.get(index);
    }

    public List<Sample> asList() {
        return samples;
    }

    /**
     * True when timestamps never decrease.
     */
    public boolean isChronological() {
        for (int i = 1; i < samples.size(); i++) {
            if (samples.get(i).timestamp().isBefore(samples.get(i - 1).timestamp()))
                return false;
        }
        return true;
    }

    /**
     * Returns up to {@code limit} samples starting at {@code offset}. Out of
     * range offsets give an empty list.
     */
    public List<Sample> slice(int offset, int limit) {
        if (offset < 0 || limit <= 0 || offset >= samples.size())
            return List.of();
        int end = (int) Math.min((long) offset + limit, samples.size());
        return samples.subList(offset, end);
    }

    /**
     * Samples whose local calendar day in {@code zone} lies in
     * {@code [startDay, endDay]}.
     */
    public List<Sample> between(LocalDate startDay, LocalDate endDay, ZoneId zone) {
        if (endDay.isBefore(startDay))
            return List.of();
        List<Sample> out = new ArrayList<>();
        for (Sample s : samples) {
            LocalDate day = s.timestamp().atZone(zone).toLocalDate();
            if (!day.isBefore(startDay) && !day.isAfter(endDay))
                out.add(s);
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public Iterator<Sample> iterator() {
        return samples.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof SampleSeries other && samples.equals(other.samples);
    }

    @Override
    public int hashCode() {
        return samples.hashCode();
    }

    @Override
    public String toString() {
        return "SampleSeries[size=" + samples.size() + "]";
    }
}
