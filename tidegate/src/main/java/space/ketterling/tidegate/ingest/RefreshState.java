package space.ketterling.tidegate.ingest;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of one cache's refresh bookkeeping.
 *
 * @param cache               which cache
 * @param state               freshness at the time of the call
 * @param lastSuccessfulFetch null until the first successful refresh
 * @param refreshInProgress   true while a refresh is running
 * @param maxAge              age after which the cache counts as stale
 * @param lastFailure         time of the most recent failed refresh, or null
 * @param lastError           message of the most recent failure, or null
 */
public record RefreshState(
        CacheName cache,
        CacheState state,
        Instant lastSuccessfulFetch,
        boolean refreshInProgress,
        Duration maxAge,
        Instant lastFailure,
        String lastError) {

    public Optional<Instant> lastSuccess() {
        return Optional.ofNullable(lastSuccessfulFetch);
    }
}
