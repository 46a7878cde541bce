package space.ketterling.tidegate.ingest;

import java.time.Instant;

/**
 * Runs after a cache has published a new value, before the refresh counts as
 * finished.
 */
@FunctionalInterface
public interface RefreshHook<T> {
    void onRefreshed(T value, Instant fetchedAt);
}
