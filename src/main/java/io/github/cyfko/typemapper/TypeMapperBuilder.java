package io.github.cyfko.typemapper;

import io.github.cyfko.typemapper.discovery.MapperDiscovery;
import io.github.cyfko.typemapper.dispatch.DispatchCache;
import io.github.cyfko.typemapper.model.MapperRegistration;
import io.github.cyfko.typemapper.providers.MapperProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Assembles a {@link TypeMapper} from mapper classes, mapper instances, the generated mapper
 * index and an optional external {@link MapperProvider}.
 *
 * <p>
 * Everything collected by the builder is registered as a single batch by {@link #build()}, so
 * conflicting mappers are all reported together and a failing build registers nothing.
 * </p>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@link #maxCachedEntries(int)} sets the soft ceiling of the dispatch caches.</li>
 *   <li>Otherwise the system property {@value #MAX_ENTRIES_PROPERTY} is used when set to a
 *       positive integer.</li>
 *   <li>Otherwise {@link DispatchCache#DEFAULT_MAX_ENTRIES}.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeMapperBuilder {

    private static final Logger log = Logger.getLogger(TypeMapperBuilder.class.getName());

    /**
     * System property overriding the default dispatch cache ceiling.
     */
    public static final String MAX_ENTRIES_PROPERTY = "typemapper.dispatch.maxEntries";

    private MapperProvider provider = MapperProvider.empty();
    private final List<Class<?>> mapperClasses = new ArrayList<>();
    private final List<MapperRegistration> registrations = new ArrayList<>();
    private boolean indexed;
    private Integer maxCachedEntries;

    TypeMapperBuilder() {
    }

    /**
     * Sets the provider consulted for pairs without a registration.
     */
    public TypeMapperBuilder provider(MapperProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        return this;
    }

    /**
     * Adds a mapper class, instantiated through its public no-arg constructor on first use.
     *
     * @throws io.github.cyfko.typemapper.exceptions.MapperDefinitionException at {@link #build()}
     *         if the class is not a concrete mapper
     */
    public TypeMapperBuilder mapper(Class<?> mapperClass) {
        mapperClasses.add(Objects.requireNonNull(mapperClass, "mapperClass cannot be null"));
        return this;
    }

    public TypeMapperBuilder mappers(Class<?>... mapperClasses) {
        for (Class<?> mapperClass : mapperClasses) {
            mapper(mapperClass);
        }
        return this;
    }

    /**
     * Adds a mapper instance for {@code (sourceType, destinationType)}.
     */
    public <S, D> TypeMapperBuilder mapper(Class<S> sourceType, Class<D> destinationType, Mapper<S, D> mapper) {
        return registration(MapperRegistration.of(sourceType, destinationType, mapper));
    }

    public TypeMapperBuilder registration(MapperRegistration registration) {
        registrations.add(Objects.requireNonNull(registration, "registration cannot be null"));
        return this;
    }

    /**
     * Includes the mappers listed in the generated index of {@code @IndexedMapper} classes.
     */
    public TypeMapperBuilder indexed() {
        this.indexed = true;
        return this;
    }

    /**
     * Sets the soft ceiling of the dispatch caches.
     *
     * @param maxCachedEntries at least 1
     * @throws IllegalArgumentException if {@code maxCachedEntries < 1}
     */
    public TypeMapperBuilder maxCachedEntries(int maxCachedEntries) {
        if (maxCachedEntries < 1) {
            throw new IllegalArgumentException("maxCachedEntries must be at least 1, got " + maxCachedEntries);
        }
        this.maxCachedEntries = maxCachedEntries;
        return this;
    }

    /**
     * Registers everything collected as one batch and returns a new mapper.
     *
     * @throws io.github.cyfko.typemapper.exceptions.MapperConfigurationException
     *         if two different mappers target the same pair
     * @throws io.github.cyfko.typemapper.exceptions.MapperDefinitionException
     *         if an added class is not a concrete mapper
     */
    public TypeMapper build() {
        List<MapperRegistration> batch = new ArrayList<>();
        if (indexed) {
            batch.addAll(MapperDiscovery.fromIndex());
        }
        for (Class<?> mapperClass : mapperClasses) {
            batch.add(MapperDiscovery.registrationFor(mapperClass));
        }
        batch.addAll(registrations);

        MapperRegistry registry = new MapperRegistry(provider);
        registry.register(batch);

        return new DefaultTypeMapper(registry, effectiveMaxEntries());
    }

    int effectiveMaxEntries() {
        if (maxCachedEntries != null) return maxCachedEntries;

        String configured = System.getProperty(MAX_ENTRIES_PROPERTY);
        if (configured == null || configured.isBlank()) return DispatchCache.DEFAULT_MAX_ENTRIES;

        int value = parsePositive(configured.trim());
        if (value >= 1) return value;

        log.warning("Ignoring " + MAX_ENTRIES_PROPERTY + "=" + configured
                + ": expected a positive integer, using " + DispatchCache.DEFAULT_MAX_ENTRIES);
        return DispatchCache.DEFAULT_MAX_ENTRIES;
    }

    /** Returns the parsed value, or -1 if {@code s} is not an integer. */
    private static int parsePositive(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
