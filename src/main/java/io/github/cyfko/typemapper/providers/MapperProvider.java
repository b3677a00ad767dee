package io.github.cyfko.typemapper.providers;

import io.github.cyfko.typemapper.Mapper;
import io.github.cyfko.typemapper.TypePairKey;

/**
 * External source of mapper instances, consulted by the
 * {@link io.github.cyfko.typemapper.MapperRegistry} when a key has no registration of its own.
 * <p>
 * Adapt an inversion-of-control container to this interface to let it create mappers.
 * Returning {@code null} means "nothing available"; the registry does not distinguish
 * "not registered yet" from "never will be", and asks again on the next miss.
 */
@FunctionalInterface
public interface MapperProvider {

    /**
     * Returns a mapper for the given pair, or {@code null} if none is available.
     *
     * @param key requested pair
     * @return a mapper from {@code key.sourceType()} to {@code key.destinationType()}, or {@code null}
     */
    Mapper<?, ?> provide(TypePairKey key);

    /**
     * Returns a provider that never has anything.
     */
    static MapperProvider empty() {
        return key -> null;
    }
}
