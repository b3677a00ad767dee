package io.github.cyfko.typemapper;

import io.github.cyfko.typemapper.exceptions.MapperConfigurationException;
import io.github.cyfko.typemapper.exceptions.MapperNotFoundException;
import io.github.cyfko.typemapper.model.MapperRegistration;
import io.github.cyfko.typemapper.providers.MapperProvider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds at most one {@link Mapper} per {@link TypePairKey} and resolves missing ones lazily.
 *
 * <h2>Resolution Strategy</h2>
 * <p>
 * Resolving a key proceeds in tiers:
 * </p>
 * <ol>
 *   <li><b>Resolved mappers</b>: instances already resolved for this key.</li>
 *   <li><b>Registrations</b>: the factory of a {@link MapperRegistration} committed through
 *       {@link #register(Collection)}.</li>
 *   <li><b>Provider</b>: the external {@link MapperProvider} given at construction.</li>
 * </ol>
 * <p>
 * A successful resolution is kept for the lifetime of the registry. A failed one is not:
 * the next call retries tiers 2 and 3, so mappers made available after an early failure
 * are still picked up.
 * </p>
 *
 * <h2>Concurrency</h2>
 * <p>
 * Population is get-or-create, not compute-once. Two threads missing the same key may both
 * call the factory or provider; only the first result stored through
 * {@link ConcurrentMap#putIfAbsent(Object, Object)} is kept and every caller, the loser of the
 * race included, receives that stored instance. No lock is held while a mapper is created.
 * </p>
 *
 * <h2>Registration</h2>
 * <p>
 * {@link #register(Collection)} validates a whole batch before committing any of it, and
 * reports every conflicting key at once.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MapperRegistry {

    private static final Logger log = Logger.getLogger(MapperRegistry.class.getName());

    private final MapperProvider provider;

    /**
     * Resolved mappers. Entries are never replaced or removed.
     */
    private final ConcurrentMap<TypePairKey, Mapper<?, ?>> mappers = new ConcurrentHashMap<>();

    /**
     * Committed registrations, first registration per key wins.
     */
    private final ConcurrentMap<TypePairKey, MapperRegistration> registrations = new ConcurrentHashMap<>();

    /**
     * Creates a registry backed by the given external provider.
     *
     * @param provider consulted for keys without a registration; must not be {@code null}.
     *                 Use {@link MapperProvider#empty()} when all mappers are registered explicitly.
     */
    public MapperRegistry(MapperProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
    }

    /**
     * Resolves the mapper for {@code (sourceType, destinationType)}.
     *
     * @param sourceType      source class; must not be {@code null}
     * @param destinationType destination class; must not be {@code null}
     * @return the stored mapper for the pair
     * @throws MapperNotFoundException if no mapper is available for the pair
     */
    @SuppressWarnings("unchecked")
    public <S, D> Mapper<S, D> resolve(Class<S> sourceType, Class<D> destinationType) {
        return (Mapper<S, D>) resolve(TypePairKey.of(sourceType, destinationType));
    }

    /**
     * Resolves the mapper for {@code key}.
     *
     * @param key requested pair; must not be {@code null}
     * @return the stored mapper for the pair
     * @throws MapperNotFoundException if no mapper is available for the pair
     */
    public Mapper<?, ?> resolve(TypePairKey key) {
        Objects.requireNonNull(key, "key cannot be null");

        Mapper<?, ?> mapper = mappers.get(key);
        if (mapper != null) return mapper;

        Mapper<?, ?> created = create(key);
        if (created == null) {
            throw new MapperNotFoundException(key.sourceType(), key.destinationType());
        }

        Mapper<?, ?> existing = mappers.putIfAbsent(key, created);
        if (existing != null) return existing;

        log.fine(() -> "Resolved " + created.getClass().getName() + " for " + key);
        return created;
    }

    /**
     * Checks whether a mapper can be resolved for the given pair.
     *
     * <p>
     * This method delegates to {@link #resolve(Class, Class)} and therefore stores the mapper
     * when it succeeds.
     * </p>
     *
     * @return {@code true} if {@link #resolve(Class, Class)} succeeds, {@code false} otherwise
     */
    public boolean canResolve(Class<?> sourceType, Class<?> destinationType) {
        try {
            resolve(TypePairKey.of(sourceType, destinationType));
            return true;
        } catch (MapperNotFoundException e) {
            return false;
        }
    }

    /**
     * Validates and commits a batch of registrations.
     *
     * <p>
     * The batch is rejected as a whole, with nothing committed, if any key receives two or more
     * registrations with different implementation types. Repeating the same implementation type
     * for a key is not a conflict.
     * </p>
     *
     * <p>
     * Keys already registered by an earlier batch keep their first registration; the new one is
     * ignored, with a warning if its implementation type differs.
     * </p>
     *
     * @param batch registrations produced by one discovery pass; must not be {@code null}
     * @throws MapperConfigurationException if the batch contains conflicting registrations
     */
    public void register(Collection<MapperRegistration> batch) {
        Objects.requireNonNull(batch, "batch cannot be null");

        Map<TypePairKey, List<MapperRegistration>> byKey = new LinkedHashMap<>();
        for (MapperRegistration registration : batch) {
            Objects.requireNonNull(registration, "batch cannot contain null registrations");
            List<MapperRegistration> candidates = byKey.computeIfAbsent(registration.key(), k -> new ArrayList<>());
            boolean sameImplementation = candidates.stream()
                    .anyMatch(c -> c.implementationType() == registration.implementationType());
            if (!sameImplementation) {
                candidates.add(registration);
            }
        }

        Map<TypePairKey, List<String>> conflicts = new LinkedHashMap<>();
        for (Map.Entry<TypePairKey, List<MapperRegistration>> entry : byKey.entrySet()) {
            if (entry.getValue().size() > 1) {
                conflicts.put(entry.getKey(), entry.getValue().stream()
                        .map(MapperRegistration::implementationName)
                        .toList());
            }
        }
        if (!conflicts.isEmpty()) {
            throw new MapperConfigurationException(conflicts);
        }

        int committed = 0;
        for (List<MapperRegistration> candidates : byKey.values()) {
            MapperRegistration registration = candidates.get(0);
            MapperRegistration existing = registrations.putIfAbsent(registration.key(), registration);
            if (existing == null) {
                committed++;
            } else if (existing.implementationType() != registration.implementationType()) {
                log.warning("Ignoring " + registration.implementationName() + " for " + registration.key()
                        + ": already registered to " + existing.implementationName());
            }
        }

        if (log.isLoggable(Level.CONFIG)) {
            log.config("Registered " + committed + " of " + byKey.size() + " mappers");
        }
    }

    /**
     * Returns a snapshot of the keys committed through {@link #register(Collection)}.
     */
    public Set<TypePairKey> registeredKeys() {
        return Set.copyOf(registrations.keySet());
    }

    private Mapper<?, ?> create(TypePairKey key) {
        MapperRegistration registration = registrations.get(key);
        if (registration != null) {
            Mapper<?, ?> mapper = registration.factory().get();
            if (mapper != null) return mapper;
        }
        return provider.provide(key);
    }
}
