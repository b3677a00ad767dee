package io.github.cyfko.typemapper.dispatch;

import io.github.cyfko.typemapper.TypePairKey;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Caches one invoker per {@link TypePairKey} for type-inferred calls.
 *
 * <p>
 * An invoker depends on nothing but its key, so it can be memoized indefinitely. The first
 * inferred call for a pair builds it through the supplied factory; every later call is a map
 * lookup followed by a direct call.
 * </p>
 *
 * <h2>Bounded growth</h2>
 * <p>
 * The cache has a soft ceiling. When an insertion takes the entry count above
 * {@link #maxEntries()}, the whole cache is cleared and entries are rebuilt on demand. There is
 * no ordering or partial eviction: the number of distinct type pairs in a program is small and
 * fixed, and the ceiling is only reached by pathological use.
 * </p>
 *
 * <h2>Concurrency</h2>
 * <p>
 * Lookups never block. Threads missing the same key may each build an invoker; the first one
 * stored wins and is returned to all of them. A clear is not coordinated with readers: a
 * reader that loses its entry to a concurrent clear simply builds it again.
 * </p>
 *
 * @param <I> invoker type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DispatchCache<I> {

    private static final Logger log = Logger.getLogger(DispatchCache.class.getName());

    /**
     * Default soft ceiling on the number of cached invokers.
     */
    public static final int DEFAULT_MAX_ENTRIES = 2048;

    private final ConcurrentMap<TypePairKey, I> invokers = new ConcurrentHashMap<>();
    private final int maxEntries;

    /**
     * Creates a cache with the {@linkplain #DEFAULT_MAX_ENTRIES default} ceiling.
     */
    public DispatchCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    /**
     * Creates a cache cleared whenever it grows beyond {@code maxEntries} entries.
     *
     * @param maxEntries soft ceiling; must be at least 1
     * @throws IllegalArgumentException if {@code maxEntries < 1}
     */
    public DispatchCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Returns the cached invoker for {@code key}, building and storing it on a miss.
     *
     * @param key     requested pair; must not be {@code null}
     * @param factory builds the invoker for a key; must not be {@code null} nor return {@code null}
     * @return the stored invoker for {@code key}
     */
    public I get(TypePairKey key, Function<TypePairKey, ? extends I> factory) {
        Objects.requireNonNull(key, "key cannot be null");

        I invoker = invokers.get(key);
        if (invoker != null) return invoker;

        I created = Objects.requireNonNull(factory.apply(key), "factory returned null for " + key);
        I existing = invokers.putIfAbsent(key, created);

        if (invokers.size() > maxEntries) {
            log.fine(() -> "Dispatch cache exceeded " + maxEntries + " entries; clearing");
            invokers.clear();
        }

        return existing != null ? existing : created;
    }

    /**
     * Returns the current number of cached invokers.
     */
    public int size() {
        return invokers.size();
    }

    public int maxEntries() {
        return maxEntries;
    }

    /**
     * Drops every cached invoker.
     */
    public void clear() {
        invokers.clear();
    }
}
