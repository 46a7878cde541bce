package space.ketterling.tidegate.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;

/**
 * Gate crossing events grouped by the local day of each interpolated instant.
 */
public final class EventsByDay extends ByDay<CrossingEvent> {
    private static final EventsByDay EMPTY = new EventsByDay(Collections.emptyNavigableMap());

    private EventsByDay(NavigableMap<LocalDate, List<CrossingEvent>> days) {
        super(days);
    }

    public static EventsByDay empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Every event in chronological order.
     */
    public List<CrossingEvent> allEvents() {
        return flatten();
    }

    public int eventCount() {
        return size();
    }

    public static final class Builder extends ByDay.Builder<CrossingEvent> {
        public Builder add(CrossingEvent event) {
            add(event.day(), event);
            return this;
        }

        @Override
        public EventsByDay build() {
            return new EventsByDay(freeze());
        }
    }
}
