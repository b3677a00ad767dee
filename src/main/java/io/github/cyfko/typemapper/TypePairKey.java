package io.github.cyfko.typemapper;

import java.util.Objects;

/**
 * Ordered {@code (source type, destination type)} pair used as the lookup key of the
 * {@link MapperRegistry} and of the dispatch caches.
 *
 * <p>
 * Two keys are equal iff both classes are the same {@link Class} instances. The hash code is
 * computed once at construction. Keys are cheap, immutable and created on every lookup.
 * </p>
 *
 * <p>
 * Primitive classes are distinct from their wrappers: {@code int.class} and
 * {@code Integer.class} produce different keys.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypePairKey {

    private final Class<?> sourceType;
    private final Class<?> destinationType;
    private final int hash;

    private TypePairKey(Class<?> sourceType, Class<?> destinationType) {
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType cannot be null");
        this.destinationType = Objects.requireNonNull(destinationType, "destinationType cannot be null");
        this.hash = 31 * System.identityHashCode(sourceType) + System.identityHashCode(destinationType);
    }

    /**
     * Creates the key for the given pair.
     *
     * @param sourceType      source class; must not be {@code null}
     * @param destinationType destination class; must not be {@code null}
     * @return the key
     * @throws NullPointerException if either class is {@code null}
     */
    public static TypePairKey of(Class<?> sourceType, Class<?> destinationType) {
        return new TypePairKey(sourceType, destinationType);
    }

    public Class<?> sourceType() {
        return sourceType;
    }

    public Class<?> destinationType() {
        return destinationType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypePairKey)) return false;
        TypePairKey other = (TypePairKey) o;
        return sourceType == other.sourceType && destinationType == other.destinationType;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Returns {@code "Source -> Destination"} using simple class names.
     */
    @Override
    public String toString() {
        return sourceType.getSimpleName() + " -> " + destinationType.getSimpleName();
    }
}
