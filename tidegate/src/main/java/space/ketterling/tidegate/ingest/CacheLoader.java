package space.ketterling.tidegate.ingest;

import space.ketterling.tidegate.http.FetchException;

/**
 * Loads a complete new value for a cache.
 */
@FunctionalInterface
public interface CacheLoader<T> {
    T load() throws FetchException, InterruptedException;
}
