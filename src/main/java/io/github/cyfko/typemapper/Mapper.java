package io.github.cyfko.typemapper;

/**
 * A pure transformation from a source type to a destination type.
 *
 * <p>
 * Implementations are expected to be synchronous and free of side effects: given equal input
 * they return equal output, and they perform no I/O. A {@link MapperRegistry} holds at most one
 * mapper per ordered {@code (S, D)} pair and keeps the resolved instance for its whole lifetime,
 * so implementations must also be safe to call from several threads at once.
 * </p>
 *
 * <h3>Typical Usage</h3>
 * <pre>{@code
 * @IndexedMapper
 * public final class UserMapper implements Mapper<User, UserDto> {
 *     @Override
 *     public UserDto map(User source) {
 *         return new UserDto(source.firstName() + " " + source.lastName());
 *     }
 * }
 * }</pre>
 *
 * <p>
 * Exceptions thrown by {@link #map(Object)} are never wrapped by the library: callers of
 * {@link TypeMapper} observe exactly the exception the mapper threw.
 * </p>
 *
 * @param <S> source type
 * @param <D> destination type
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface Mapper<S, D> {

    /**
     * Maps a source value to a destination value.
     *
     * @param source value to map; never {@code null} when invoked through {@link TypeMapper}
     * @return the mapped value
     */
    D map(S source);
}
