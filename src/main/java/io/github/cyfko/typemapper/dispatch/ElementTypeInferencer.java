package io.github.cyfko.typemapper.dispatch;

import io.github.cyfko.typemapper.exceptions.TypeInferenceException;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Determines the element type of a sequence whose static element type is unknown at the call
 * site.
 *
 * <h2>Inference Strategy</h2>
 * <p>
 * Each step returns as soon as it succeeds:
 * </p>
 * <ol>
 *   <li><b>Reified element type</b>: the component type of an array.</li>
 *   <li><b>Generic capability</b>: the {@code T} the runtime class binds for
 *       {@link Iterable Iterable&lt;T&gt;} through its generic supertypes, as in
 *       {@code class Users extends ArrayList<User>} or {@code new ArrayList<User>() {}}.</li>
 *   <li><b>First element</b>: the runtime class of the first non-{@code null} element.</li>
 * </ol>
 * <p>
 * Steps 1 and 2 work on empty sequences and are authoritative when the elements are a mix of
 * subtypes. Step 3 is the fallback for untyped containers; an empty or all-{@code null}
 * untyped container cannot be typed and fails with {@link TypeInferenceException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ElementTypeInferencer {

    static final String INFERENCE_FAILURE =
            "Cannot infer source type from the collection. The collection appears to be empty or contains null values.";

    /**
     * {@code Iterable<T>} binding per runtime class, resolved once. Empty when the class leaves
     * {@code T} open.
     */
    private static final ClassValue<Optional<Class<?>>> DECLARED_ELEMENT_TYPES = new ClassValue<>() {
        @Override
        protected Optional<Class<?>> computeValue(Class<?> type) {
            return Optional.ofNullable(TypeArguments.resolve(type, Iterable.class, 0));
        }
    };

    private ElementTypeInferencer() {
        // Utility class; not instantiable.
    }

    /**
     * A sequence together with its inferred element type.
     *
     * @param elementType inferred element type
     * @param elements    iterator over all elements of the original sequence, including any
     *                    element already inspected during inference; to be consumed once
     */
    public record InferredSequence(Class<?> elementType, Iterator<?> elements) {}

    /**
     * Infers the element type of an array or {@link Iterable}.
     *
     * @param sequence an {@code Object[]} or {@link Iterable}; must not be {@code null}
     * @return the inferred element type
     * @throws NullPointerException     if {@code sequence} is {@code null}
     * @throws IllegalArgumentException if {@code sequence} is neither an object array nor an {@link Iterable}
     * @throws TypeInferenceException   if no strategy can determine the element type
     */
    public static Class<?> inferElementType(Object sequence) {
        return open(sequence).elementType();
    }

    /**
     * Infers the element type and returns it with an iterator over the whole sequence.
     *
     * <p>
     * When inference has to inspect elements, the inspected prefix is replayed by the returned
     * iterator, so a caller consuming it walks the original sequence exactly once in total.
     * Leading {@code null} elements skipped during inspection are not replayed.
     * </p>
     *
     * @param sequence an {@code Object[]} or {@link Iterable}; must not be {@code null}
     * @return element type and elements
     * @throws NullPointerException     if {@code sequence} is {@code null}
     * @throws IllegalArgumentException if {@code sequence} is neither an object array nor an {@link Iterable}
     * @throws TypeInferenceException   if no strategy can determine the element type
     */
    public static InferredSequence open(Object sequence) {
        Objects.requireNonNull(sequence, "sources cannot be null");

        // 1. Reified
        if (sequence instanceof Object[]) {
            Object[] array = (Object[]) sequence;
            return new InferredSequence(array.getClass().getComponentType(), Arrays.asList(array).iterator());
        }

        if (!(sequence instanceof Iterable<?>)) {
            throw new IllegalArgumentException(
                    "Expected an object array or an Iterable, found: " + sequence.getClass().getName());
        }
        Iterable<?> iterable = (Iterable<?>) sequence;

        // 2. Generic capability
        Optional<Class<?>> declared = declaredElementType(iterable.getClass());
        if (declared.isPresent()) {
            return new InferredSequence(declared.get(), iterable.iterator());
        }

        // 3. First non-null element
        Iterator<?> elements = iterable.iterator();
        while (elements.hasNext()) {
            Object element = elements.next();
            if (element != null) {
                return new InferredSequence(element.getClass(), new ReplayIterator(element, elements));
            }
        }

        throw new TypeInferenceException(INFERENCE_FAILURE);
    }

    /**
     * Returns the element type {@code type} binds for {@link Iterable}, reflecting on the class
     * only the first time it is seen.
     */
    static Optional<Class<?>> declaredElementType(Class<?> type) {
        return DECLARED_ELEMENT_TYPES.get(type);
    }

    /**
     * Yields one already-consumed element, then the rest of the underlying iterator.
     */
    private static final class ReplayIterator implements Iterator<Object> {
        private final Iterator<?> rest;
        private Object head;
        private boolean headPending = true;

        ReplayIterator(Object head, Iterator<?> rest) {
            this.head = head;
            this.rest = rest;
        }

        @Override
        public boolean hasNext() {
            return headPending || rest.hasNext();
        }

        @Override
        public Object next() {
            if (headPending) {
                headPending = false;
                Object result = head;
                head = null;
                return result;
            }
            if (!rest.hasNext()) {
                throw new NoSuchElementException();
            }
            return rest.next();
        }
    }
}
