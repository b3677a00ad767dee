package io.github.cyfko.typemapper.model;

import io.github.cyfko.typemapper.Mapper;
import io.github.cyfko.typemapper.TypePairKey;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Immutable candidate registration fed into
 * {@link io.github.cyfko.typemapper.MapperRegistry#register(java.util.Collection)}.
 *
 * <p>
 * The {@code implementationType} identifies the mapper implementation. Two registrations for
 * the same key with the same implementation type are considered the same registration; any
 * other pair of registrations for one key is a conflict, even when the class names read alike
 * (same simple name in two packages, two anonymous classes).
 * </p>
 *
 * <p>
 * The {@code factory} is called lazily, on the first resolution of {@code key}. It may return
 * {@code null}, which the registry treats as "no mapper available".
 * </p>
 *
 * @param key                the pair served by the mapper; never {@code null}
 * @param implementationType class of the mapper implementation; never {@code null}
 * @param factory            creates the mapper instance; never {@code null}
 */
public record MapperRegistration(
        TypePairKey key,
        Class<?> implementationType,
        Supplier<? extends Mapper<?, ?>> factory
) {

    public MapperRegistration {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(implementationType, "implementationType cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
    }

    /**
     * Returns the binary name of the implementation, as used in conflict reports and logs.
     */
    public String implementationName() {
        return implementationType.getName();
    }

    /**
     * Registers an existing mapper instance for {@code (sourceType, destinationType)}.
     * The implementation type is the class of the instance.
     */
    public static <S, D> MapperRegistration of(Class<S> sourceType, Class<D> destinationType, Mapper<S, D> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");
        return new MapperRegistration(
                TypePairKey.of(sourceType, destinationType),
                mapper.getClass(),
                () -> mapper
        );
    }
}
