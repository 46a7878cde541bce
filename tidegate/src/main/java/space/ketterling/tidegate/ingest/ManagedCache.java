package space.ketterling.tidegate.ingest;

import space.ketterling.tidegate.cache.SnapshotStore;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One registered cache: its store, loader, staleness bound and the
 * single-flight slot for its running refresh.
 */
final class ManagedCache<T> {
    final CacheName name;
    final Duration maxAge;
    final SnapshotStore<T> store;
    final CacheLoader<T> loader;
    final RefreshHook<T> hook; // nullable

    // non-null while a refresh is running
    final AtomicReference<CompletableFuture<Void>> inflight = new AtomicReference<>();

    private volatile Instant lastFailure;
    private volatile String lastError;

    ManagedCache(CacheName name, Duration maxAge, SnapshotStore<T> store, CacheLoader<T> loader,
            RefreshHook<T> hook) {
        this.name = name;
        this.maxAge = maxAge;
        this.store = store;
        this.loader = loader;
        this.hook = hook;
    }

    boolean isStale(Instant now) {
        Instant fetchedAt = store.current().fetchedAt();
        return fetchedAt == null || Duration.between(fetchedAt, now).compareTo(maxAge) > 0;
    }

    CacheState state(Instant now) {
        if (inflight.get() != null)
            return CacheState.REFRESHING;
        return isStale(now) ? CacheState.STALE : CacheState.FRESH;
    }

    void recordFailure(Instant at, String error) {
        lastFailure = at;
        lastError = error;
    }

    void clearError() {
        lastError = null;
    }

    RefreshState snapshot(Instant now) {
        return new RefreshState(name, state(now), store.current().fetchedAt(), inflight.get() != null, maxAge,
                lastFailure, lastError);
    }
}
