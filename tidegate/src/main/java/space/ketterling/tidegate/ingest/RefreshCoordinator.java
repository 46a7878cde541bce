package space.ketterling.tidegate.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.tidegate.cache.SnapshotStore;
import space.ketterling.tidegate.http.FetchException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the registered caches fresh.
 *
 * <p>
 * A scheduler thread refreshes every cache on a fixed delay; readers call
 * {@link #awaitFresh(CacheName)} and trigger a refresh themselves when the
 * cache is stale. Both paths go through {@link #refresh(CacheName)}, which
 * starts at most one refresh per cache and hands later callers the running
 * one. Fetches run on worker threads, so a waiting reader can give up after
 * the configured wait without cancelling the fetch.
 * </p>
 *
 * <p>
 * A successful refresh replaces the cache's store, then runs its hook (for
 * example deriving gate times) before the refresh is finished. A failed
 * refresh leaves the store untouched and is only logged.
 * </p>
 */
public final class RefreshCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RefreshCoordinator.class);

    private final Clock clock;
    private final Duration interval;
    private final Duration readerWait;
    private final Map<CacheName, ManagedCache<?>> caches = new ConcurrentHashMap<>();

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler = Executors
            .newSingleThreadScheduledExecutor(r -> daemon(r, "refresh-scheduler"));
    private ScheduledFuture<?> periodicTask;

    public RefreshCoordinator(Clock clock, Duration interval, Duration readerWait) {
        this.clock = clock;
        this.interval = interval;
        this.readerWait = readerWait;
        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> daemon(r, "refresh-worker-" + n.incrementAndGet()));
    }

    /**
     * Registers a cache without a post-refresh hook.
     */
    public <T> void register(CacheName name, Duration maxAge, SnapshotStore<T> store, CacheLoader<T> loader) {
        register(name, maxAge, store, loader, null);
    }

    /**
     * Registers a cache. {@code hook} may be null.
     */
    public <T> void register(CacheName name, Duration maxAge, SnapshotStore<T> store, CacheLoader<T> loader,
            RefreshHook<T> hook) {
        ManagedCache<T> c = new ManagedCache<>(name, maxAge, store, loader, hook);
        if (caches.putIfAbsent(name, c) != null) {
            throw new IllegalStateException("Cache already registered: " + name);
        }
        log.debug("Registered cache {} maxAge={}", name, maxAge);
    }

    /**
     * Starts the periodic refresh; the first cycle runs immediately.
     */
    public synchronized void start() {
        if (periodicTask != null)
            return;
        periodicTask = scheduler.scheduleWithFixedDelay(safe("refresh-all", () -> refreshAll().join()),
                0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Refresh coordinator started, interval={} caches={}", interval, caches.keySet());
    }

    /**
     * Stops the periodic refresh and the worker threads. Running fetches are
     * interrupted.
     */
    public synchronized void stop() {
        if (periodicTask != null) {
            periodicTask.cancel(true);
            periodicTask = null;
        }
        shutdown(scheduler, "refresh-scheduler");
        shutdown(workers, "refresh-workers");
    }

    /**
     * Starts a refresh of {@code name} unless one is already running, and
     * returns the future of the running refresh. The future never completes
     * exceptionally because of a fetch failure.
     */
    public CompletableFuture<Void> refresh(CacheName name) {
        return trigger(cache(name));
    }

    /**
     * Refreshes every registered cache regardless of staleness.
     */
    public CompletableFuture<Void> refreshAll() {
        List<CompletableFuture<Void>> all = new ArrayList<>();
        for (ManagedCache<?> c : caches.values()) {
            all.add(trigger(c));
        }
        return CompletableFuture.allOf(all.toArray(new CompletableFuture[0]));
    }

    /**
     * Waits up to the reader wait for a running refresh of the cache, or
     * triggers one when the cache is stale. A running refresh is joined even
     * if the store already holds the new value, so derived data is complete
     * when this returns. Returns whether the cache is fresh afterwards; on a
     * timeout the caller serves whatever the stores hold.
     */
    public boolean awaitFresh(CacheName name) {
        ManagedCache<?> c = cache(name);
        CompletableFuture<Void> running = c.inflight.get();
        if (running == null && !c.isStale(clock.instant()))
            return true;

        CompletableFuture<Void> f = running != null ? running : trigger(c);
        try {
            f.get(readerWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Waited {} for {} refresh, serving stale data", readerWait, name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for {} refresh", name);
        } catch (ExecutionException e) {
            log.warn("Refresh of {} ended abnormally", name, e.getCause());
        }
        return !c.isStale(clock.instant());
    }

    public boolean isStale(CacheName name) {
        return cache(name).isStale(clock.instant());
    }

    public CacheState state(CacheName name) {
        return cache(name).state(clock.instant());
    }

    public RefreshState refreshState(CacheName name) {
        return cache(name).snapshot(clock.instant());
    }

    /**
     * One row per registered cache, in {@link CacheName} order.
     */
    public List<RefreshState> status() {
        Instant now = clock.instant();
        List<RefreshState> out = new ArrayList<>();
        for (CacheName n : CacheName.values()) {
            ManagedCache<?> c = caches.get(n);
            if (c != null)
                out.add(c.snapshot(now));
        }
        return out;
    }

    private ManagedCache<?> cache(CacheName name) {
        ManagedCache<?> c = caches.get(name);
        if (c == null)
            throw new IllegalArgumentException("Unknown cache: " + name);
        return c;
    }

    private CompletableFuture<Void> trigger(ManagedCache<?> c) {
        CompletableFuture<Void> mine = new CompletableFuture<>();
        CompletableFuture<Void> running = c.inflight.compareAndExchange(null, mine);
        if (running != null) {
            log.debug("Joining running refresh of {}", c.name);
            return running;
        }
        try {
            workers.execute(() -> runRefresh(c, mine));
        } catch (RejectedExecutionException e) {
            c.inflight.set(null);
            mine.completeExceptionally(e);
            log.warn("Refresh of {} rejected, coordinator stopped", c.name);
        }
        return mine;
    }

    private <T> void runRefresh(ManagedCache<T> c, CompletableFuture<Void> done) {
        MDC.put("job", c.name.jobName());
        long t0 = System.currentTimeMillis();
        try {
            T value = c.loader.load();
            Instant fetchedAt = clock.instant();
            c.store.replace(value, fetchedAt);
            c.clearError();
            log.info("Refreshed {} in {} ms", c.name, System.currentTimeMillis() - t0);
            if (c.hook != null) {
                try {
                    c.hook.onRefreshed(value, fetchedAt);
                } catch (RuntimeException e) {
                    log.error("Post-refresh step for {} failed, previous derived data kept", c.name, e);
                }
            }
        } catch (FetchException e) {
            c.recordFailure(clock.instant(), e.getMessage());
            if (e.kind() == FetchException.Kind.MISSING_CREDENTIAL) {
                log.info("Skipping {} refresh: {}", c.name, e.getMessage());
            } else {
                log.warn("Refresh of {} failed, keeping previous data: {}", c.name, e.getMessage(), e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            c.recordFailure(clock.instant(), "interrupted");
            log.warn("Refresh of {} interrupted", c.name);
        } catch (RuntimeException e) {
            c.recordFailure(clock.instant(), String.valueOf(e.getMessage()));
            log.error("Refresh of {} failed unexpectedly, keeping previous data", c.name, e);
        } finally {
            MDC.remove("job");
            c.inflight.set(null);
            done.complete(null);
        }
    }

    private void shutdown(ExecutorService es, String name) {
        es.shutdownNow();
        try {
            if (!es.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable safe(String name, Runnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (RuntimeException e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }
}
