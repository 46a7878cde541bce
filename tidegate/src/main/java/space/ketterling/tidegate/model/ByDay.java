package space.ketterling.tidegate.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable grouping of values by local calendar day, iterated in day order.
 * Values keep the order they were added in.
 */
public class ByDay<T> {
    private final NavigableMap<LocalDate, List<T>> days;

    protected ByDay(NavigableMap<LocalDate, List<T>> days) {
        this.days = days;
    }

    public static <T> ByDay<T> empty() {
        return new ByDay<>(Collections.emptyNavigableMap());
    }

    public Optional<List<T>> forDay(LocalDate day) {
        return Optional.ofNullable(days.get(day));
    }

    public Set<LocalDate> days() {
        return days.keySet();
    }

    public Map<LocalDate, List<T>> asMap() {
        return days;
    }

    public boolean isEmpty() {
        return days.isEmpty();
    }

    /**
     * Total number of values across all days.
     */
    public int size() {
        int n = 0;
        for (List<T> l : days.values())
            n += l.size();
        return n;
    }

    /**
     * All values, day by day.
     */
    public List<T> flatten() {
        List<T> out = new ArrayList<>(size());
        for (List<T> l : days.values())
            out.addAll(l);
        return Collections.unmodifiableList(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return days.equals(((ByDay<?>) o).days);
    }

    @Override
    public int hashCode() {
        return days.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + days;
    }

    /**
     * Collects values per day, then freezes them.
     */
    public static class Builder<T> {
        private final TreeMap<LocalDate, List<T>> days = new TreeMap<>();

        public Builder<T> add(LocalDate day, T value) {
            days.computeIfAbsent(day, d -> new ArrayList<>()).add(value);
            return this;
        }

        protected NavigableMap<LocalDate, List<T>> freeze() {
            TreeMap<LocalDate, List<T>> copy = new TreeMap<>();
            for (var e : days.entrySet())
                copy.put(e.getKey(), List.copyOf(e.getValue()));
            return Collections.unmodifiableNavigableMap(copy);
        }

        public ByDay<T> build() {
            return new ByDay<>(freeze());
        }
    }
}
