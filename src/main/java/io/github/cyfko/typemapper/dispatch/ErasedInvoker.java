package io.github.cyfko.typemapper.dispatch;

/**
 * Type-erased entry point to the mapper of one {@code (source, destination)} pair.
 * <p>
 * Built once per pair and cached in a {@link DispatchCache}; calling it involves no reflection.
 */
@FunctionalInterface
public interface ErasedInvoker {

    /**
     * Maps {@code source}, which must be an instance of the pair's source type.
     *
     * @param source value to map; never {@code null}
     * @return the mapped value
     */
    Object invoke(Object source);
}
