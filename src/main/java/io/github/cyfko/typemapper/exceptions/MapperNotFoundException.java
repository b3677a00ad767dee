package io.github.cyfko.typemapper.exceptions;

/**
 * Thrown when no mapper is available for a {@code (source, destination)} pair.
 * <p>
 * The failed lookup is never cached: the same call may succeed later once a mapper
 * becomes available.
 */
public class MapperNotFoundException extends IllegalStateException {
    private final Class<?> sourceType;
    private final Class<?> destinationType;

    public MapperNotFoundException(Class<?> sourceType, Class<?> destinationType) {
        super("No mapper registered for " + sourceType.getSimpleName() + " -> " + destinationType.getSimpleName());
        this.sourceType = sourceType;
        this.destinationType = destinationType;
    }

    public Class<?> sourceType() {
        return sourceType;
    }

    public Class<?> destinationType() {
        return destinationType;
    }
}
