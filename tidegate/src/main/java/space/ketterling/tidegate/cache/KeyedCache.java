package space.ketterling.tidegate.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.http.FetchException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * On-demand cache from a structured key to a loaded value.
 *
 * <p>
 * The first caller for a key loads it on its own thread; concurrent callers
 * for the same key wait for that load. Failed loads are not cached, so the
 * next call tries again. Values never expire.
 * </p>
 */
public final class KeyedCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(KeyedCache.class);

    private final String name;
    private final Loader<K, V> loader;
    private final ConcurrentHashMap<K, CompletableFuture<V>> entries = new ConcurrentHashMap<>();

    public KeyedCache(String name, Loader<K, V> loader) {
        this.name = name;
        this.loader = loader;
    }

    public V get(K key) throws FetchException, InterruptedException {
        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = entries.putIfAbsent(key, mine);
        if (existing == null) {
            return loadInto(key, mine);
        }
        try {
            return existing.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchException fe)
                throw fe;
            if (cause instanceof RuntimeException re)
                throw re;
            throw new FetchException(FetchException.Kind.NETWORK, name + " load failed for " + key, cause);
        }
    }

    public int size() {
        return entries.size();
    }

    private V loadInto(K key, CompletableFuture<V> slot) throws FetchException, InterruptedException {
        try {
            V v = loader.load(key);
            slot.complete(v);
            log.debug("{} cached {}", name, key);
            return v;
        } catch (FetchException | InterruptedException | RuntimeException e) {
            entries.remove(key, slot);
            slot.completeExceptionally(e);
            throw e;
        }
    }

    @FunctionalInterface
    public interface Loader<K, V> {
        V load(K key) throws FetchException, InterruptedException;
    }
}
