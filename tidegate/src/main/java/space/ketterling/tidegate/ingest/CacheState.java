package space.ketterling.tidegate.ingest;

/**
 * Freshness of a logical cache.
 */
public enum CacheState {
    FRESH,
    STALE,
    REFRESHING
}
