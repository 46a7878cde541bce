package space.ketterling.tidegate.cache;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest published snapshot of one cache.
 *
 * <p>
 * Writers replace the whole snapshot; readers never lock and always see one
 * complete snapshot.
 * </p>
 */
public class SnapshotStore<T> {
    private final AtomicReference<Snapshot<T>> ref;

    public SnapshotStore(T initial) {
        this.ref = new AtomicReference<>(new Snapshot<>(initial, null));
    }

    /**
     * Publishes {@code value} as fetched at {@code fetchedAt}.
     */
    public void replace(T value, Instant fetchedAt) {
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        ref.set(new Snapshot<>(value, fetchedAt));
    }

    public Snapshot<T> current() {
        return ref.get();
    }

    public T value() {
        return ref.get().value();
    }
}
