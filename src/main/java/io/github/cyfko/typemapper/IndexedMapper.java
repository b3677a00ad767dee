package io.github.cyfko.typemapper;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link Mapper} implementation for the compile-time mapper index.
 * <p>
 * {@code @IndexedMapper} is used in conjunction with the type-mapper annotation processor to
 * generate a registry of mapper classes. At runtime, {@code TypeMapper.builder().indexed()}
 * registers every indexed mapper without classpath scanning.
 * </p>
 *
 * <h3>Validation Rules</h3>
 * <p>
 * The processor enforces the following constraints at compile time:
 * </p>
 * <ul>
 *   <li>{@code @IndexedMapper} can only be applied to classes, which must be neither abstract
 *       nor generic.</li>
 *   <li>The class must implement {@code Mapper<S, D>} with concrete {@code S} and {@code D}.</li>
 *   <li>The class must declare no constructor with parameters and must be instantiable
 *       through a public no-arg constructor. Mappers are pure data transformations and do not
 *       receive services.</li>
 *   <li>{@code D} must not be an asynchronous type ({@code Future}, {@code CompletionStage}):
 *       mappers are synchronous.</li>
 *   <li>Each {@code (S, D)} pair may be served by one indexed mapper only; any duplicate
 *       causes compilation to fail, with diagnostics pointing to both declarations.</li>
 * </ul>
 *
 * <h3>Retention and Processing</h3>
 * <ul>
 *   <li>The retention policy is {@link RetentionPolicy#SOURCE}.</li>
 *   <li>The index is available at runtime exclusively through generated code
 *       ({@code MapperIndexImpl}).</li>
 * </ul>
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
 *
 * TypeMapper mapper = TypeMapper.builder().indexed().build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface IndexedMapper {
}
