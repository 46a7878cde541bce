package space.ketterling.tidegate.cache;

import space.ketterling.tidegate.model.EventsByDay;

/**
 * Latest gate events derived from {@link SampleStore}. The snapshot's fetch
 * time is the fetch time of the series it was derived from.
 */
public final class DerivedEventStore extends SnapshotStore<EventsByDay> {
    public DerivedEventStore() {
        super(EventsByDay.empty());
    }
}
