package io.github.cyfko.typemapper.dispatch;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Type-erased entry point mapping a whole sequence for one {@code (element, destination)} pair.
 * <p>
 * Implementations resolve the mapper when invoked and return a lazy stream: the elements are
 * pulled from the iterator, and mapped, only while the stream is consumed.
 */
@FunctionalInterface
public interface SequenceInvoker {

    /**
     * Returns a lazy, single-pass stream of the mapped non-{@code null} elements.
     *
     * @param elements elements to map, consumed at most once
     * @return mapped elements, in encounter order
     */
    Stream<Object> invoke(Iterator<?> elements);
}
