package io.github.cyfko.typemapper.providers;

import java.util.List;

/**
 * Provides access to the generated index of {@code @IndexedMapper} classes.
 * <p>
 * This interface is implemented automatically by the annotation processor,
 * generating a deterministic and immutable list.
 */
public interface MapperIndex {

    /**
     * Returns the indexed mapper classes, in declaration order.
     *
     * @return unmodifiable list of mapper classes
     */
    List<Class<?>> getMapperClasses();
}
