package io.github.cyfko.typemapper;

import java.util.List;
import java.util.stream.Stream;

/**
 * Entry point for mapping values with registered {@link Mapper}s.
 *
 * <p>
 * Two call shapes exist for single values and for sequences:
 * </p>
 * <ul>
 *   <li><b>Explicit</b>: the caller names the source type. The mapper is looked up directly in
 *       the {@link MapperRegistry}.</li>
 *   <li><b>Inferred</b>: the source type is taken from the runtime class of the value, or
 *       inferred from the sequence. Dispatch goes through a per-pair invoker cached after the
 *       first call.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TypeMapper mapper = TypeMapper.builder()
 *         .mappers(UserMapper.class, OrderMapper.class)
 *         .build();
 *
 * UserDto dto = mapper.map(user, UserDto.class);
 * UserDto same = mapper.map(user, User.class, UserDto.class);
 *
 * List<UserDto> dtos = mapper.mapAll(users, UserDto.class).toList();
 * }</pre>
 *
 * <p>
 * Sequence operations return lazy, single-pass streams: the input is iterated once, while the
 * stream is consumed, and {@code null} elements are skipped. Implementations are thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TypeMapper {

    /**
     * Maps {@code source} using the mapper registered for its runtime class.
     *
     * @param source          value to map; must not be {@code null}
     * @param destinationType destination class; must not be {@code null}
     * @return the mapped value
     * @throws NullPointerException if {@code source} or {@code destinationType} is {@code null}
     * @throws io.github.cyfko.typemapper.exceptions.MapperNotFoundException
     *         if no mapper exists from the runtime class of {@code source} to {@code destinationType}
     */
    <D> D map(Object source, Class<D> destinationType);

    /**
     * Maps {@code source} using the mapper registered for {@code (sourceType, destinationType)}.
     *
     * @throws NullPointerException if any argument is {@code null}
     * @throws io.github.cyfko.typemapper.exceptions.MapperNotFoundException if no such mapper exists
     */
    <S, D> D map(S source, Class<S> sourceType, Class<D> destinationType);

    /**
     * Maps every non-{@code null} element of {@code sources}, inferring the element type once.
     *
     * @param sources         elements to map; must not be {@code null}
     * @param destinationType destination class; must not be {@code null}
     * @return lazy, single-pass stream of mapped elements, in encounter order
     * @throws io.github.cyfko.typemapper.exceptions.TypeInferenceException
     *         if the element type cannot be inferred
     * @throws io.github.cyfko.typemapper.exceptions.MapperNotFoundException
     *         if no mapper exists for the inferred element type
     * @see io.github.cyfko.typemapper.dispatch.ElementTypeInferencer
     */
    <D> Stream<D> mapAll(Iterable<?> sources, Class<D> destinationType);

    /**
     * Array variant of {@link #mapAll(Iterable, Class)}; the element type is the array's
     * component type.
     */
    <D> Stream<D> mapAll(Object[] sources, Class<D> destinationType);

    /**
     * Maps every non-{@code null} element of {@code sources} with the mapper registered for
     * {@code (sourceType, destinationType)}.
     *
     * @return lazy, single-pass stream of mapped elements, in encounter order
     * @throws NullPointerException if any argument is {@code null}
     * @throws io.github.cyfko.typemapper.exceptions.MapperNotFoundException if no such mapper exists
     */
    <S, D> Stream<D> mapAll(Iterable<? extends S> sources, Class<S> sourceType, Class<D> destinationType);

    /**
     * Collects {@link #mapAll(Iterable, Class, Class)} into an unmodifiable list.
     */
    default <S, D> List<D> mapToList(Iterable<? extends S> sources, Class<S> sourceType, Class<D> destinationType) {
        return this.<S, D>mapAll(sources, sourceType, destinationType).toList();
    }

    /**
     * Returns a builder for a new, independent {@link TypeMapper}.
     */
    static TypeMapperBuilder builder() {
        return new TypeMapperBuilder();
    }
}
