package io.github.cyfko.typemapper.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.Compiler;
import com.google.testing.compile.JavaFileObjects;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.io.IOException;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the MapperIndexProcessor annotation processor.
 * Tests validation, code generation, and error handling.
 */
class MapperIndexProcessorTest {

    @Test
    void testSuccessfulIndexGeneration() throws IOException {
        JavaFileObject productMapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.ProductMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "@IndexedMapper",
                "public final class ProductMapper implements Mapper<Integer, String> {",
                "    @Override",
                "    public String map(Integer source) {",
                "        return \"#\" + source;",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(userSources(productMapper));

        assertThat(compilation).succeeded();

        String generatedCode = getGeneratedIndexCode(compilation);

        // Verify index structure
        assertTrue(generatedCode.contains("class MapperIndexImpl implements MapperIndex"));
        assertTrue(generatedCode.contains("List.of("));

        // Verify both mappers are listed
        assertTrue(generatedCode.contains("io.github.cyfko.example.UserMapper.class"));
        assertTrue(generatedCode.contains("io.github.cyfko.example.ProductMapper.class"));

        // Verify @Generated annotation
        assertTrue(generatedCode.contains("@Generated(\"io.github.cyfko.typemapper.processor.MapperIndexProcessor\")"));

        assertThat(compilation).hadNoteContaining("Generated MapperIndexImpl with 2 mappers");
    }

    @Test
    void testMapperBoundThroughAbstractBaseIsIndexed() throws IOException {
        JavaFileObject base = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.DtoMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "public abstract class DtoMapper<S> implements Mapper<S, UserDto> {",
                "}"
        );

        JavaFileObject mapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.UserDtoMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "",
                "@IndexedMapper",
                "public class UserDtoMapper extends DtoMapper<User> {",
                "    @Override",
                "    public UserDto map(User source) {",
                "        return new UserDto(source.getLastName());",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(user(), userDto(), base, mapper);

        assertThat(compilation).succeeded();
        assertTrue(getGeneratedIndexCode(compilation).contains("io.github.cyfko.example.UserDtoMapper.class"));
    }

    @Test
    void testStaticNestedMapperIsIndexed() throws IOException {
        JavaFileObject mappers = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.Mappers",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "public final class Mappers {",
                "    @IndexedMapper",
                "    public static class LastNameMapper implements Mapper<User, String> {",
                "        @Override",
                "        public String map(User source) {",
                "            return source.getLastName();",
                "        }",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(user(), mappers);

        assertThat(compilation).succeeded();
        assertTrue(getGeneratedIndexCode(compilation).contains("io.github.cyfko.example.Mappers.LastNameMapper.class"));
    }

    @Test
    void testDuplicatePairFailsCompilation() {
        JavaFileObject otherMapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.OtherUserMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "@IndexedMapper",
                "public class OtherUserMapper implements Mapper<User, UserDto> {",
                "    @Override",
                "    public UserDto map(User source) {",
                "        return new UserDto(source.getLastName());",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(userSources(otherMapper));

        // Compilation must fail
        assertThat(compilation).failed();

        // Verify error messages
        assertThat(compilation).hadErrorContaining("Duplicate mapper for User -> UserDto");
        assertThat(compilation).hadErrorContaining("io.github.cyfko.example.UserMapper");
        assertThat(compilation).hadErrorContaining("io.github.cyfko.example.OtherUserMapper");
        assertThat(compilation).hadErrorContaining("First mapper for User -> UserDto");
        assertThat(compilation).hadErrorContaining("Cannot generate mapper index due to @IndexedMapper validation errors");
    }

    @Test
    void testConstructorParametersFailCompilation() {
        JavaFileObject mapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.PrefixMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "@IndexedMapper",
                "public class PrefixMapper implements Mapper<User, String> {",
                "    private final String prefix;",
                "",
                "    public PrefixMapper(String prefix) {",
                "        this.prefix = prefix;",
                "    }",
                "",
                "    @Override",
                "    public String map(User source) {",
                "        return prefix + source.getLastName();",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(user(), mapper);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("Mapper 'PrefixMapper' should not have constructor parameters");
        assertThat(compilation).hadErrorContaining("Mappers should be pure data transformation functions with no dependencies");
    }

    @Test
    void testPrivateConstructorFailsCompilation() {
        JavaFileObject mapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.HiddenMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "@IndexedMapper",
                "public class HiddenMapper implements Mapper<User, String> {",
                "    private HiddenMapper() {",
                "    }",
                "",
                "    @Override",
                "    public String map(User source) {",
                "        return source.getLastName();",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(user(), mapper);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("Mapper 'HiddenMapper' must have a public no-arg constructor");
    }

    @Test
    void testAsynchronousDestinationFailsCompilation() {
        JavaFileObject mapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.AsyncUserMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "import java.util.concurrent.CompletableFuture;",
                "",
                "@IndexedMapper",
                "public class AsyncUserMapper implements Mapper<User, CompletableFuture<UserDto>> {",
                "    @Override",
                "    public CompletableFuture<UserDto> map(User source) {",
                "        return CompletableFuture.completedFuture(new UserDto(source.getLastName()));",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(user(), userDto(), mapper);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("Mapper 'AsyncUserMapper' maps to asynchronous type");
        assertThat(compilation).hadErrorContaining("Mappers should be synchronous. Move async logic to the service layer.");
    }

    @Test
    void testGenericMapperFailsCompilation() {
        JavaFileObject mapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.IdentityMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "@IndexedMapper",
                "public class IdentityMapper<T> implements Mapper<T, T> {",
                "    @Override",
                "    public T map(T source) {",
                "        return source;",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(mapper);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("Mapper 'IdentityMapper' cannot declare type parameters");
    }

    @Test
    void testAbstractMapperFailsCompilation() {
        JavaFileObject mapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.AbstractUserMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "@IndexedMapper",
                "public abstract class AbstractUserMapper implements Mapper<User, UserDto> {",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(user(), userDto(), mapper);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("Mapper 'AbstractUserMapper' cannot be abstract");
    }

    @Test
    void testNonPublicMapperFailsCompilation() {
        JavaFileObject mapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.PackageMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "@IndexedMapper",
                "class PackageMapper implements Mapper<User, String> {",
                "    @Override",
                "    public String map(User source) {",
                "        return source.getLastName();",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(user(), mapper);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("Mapper 'PackageMapper' must be public");
    }

    @Test
    void testInnerClassFailsCompilation() {
        JavaFileObject mappers = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.Mappers",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "public class Mappers {",
                "    @IndexedMapper",
                "    public class LastNameMapper implements Mapper<User, String> {",
                "        @Override",
                "        public String map(User source) {",
                "            return source.getLastName();",
                "        }",
                "    }",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(user(), mappers);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("Mapper 'LastNameMapper' must be a static nested class");
    }

    @Test
    void testClassNotImplementingMapperFailsCompilation() {
        JavaFileObject notAMapper = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.NotAMapper",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "",
                "@IndexedMapper",
                "public class NotAMapper {",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(notAMapper);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("Mapper 'NotAMapper' must implement io.github.cyfko.typemapper.Mapper");
    }

    @Test
    void testAnnotationOnNonClassFailsCompilation() {
        JavaFileObject interfaceWithAnnotation = JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.UserMapperContract",
                "package io.github.cyfko.example;",
                "",
                "import io.github.cyfko.typemapper.IndexedMapper;",
                "import io.github.cyfko.typemapper.Mapper;",
                "",
                "@IndexedMapper",
                "public interface UserMapperContract extends Mapper<User, UserDto> {",
                "}"
        );

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(user(), userDto(), interfaceWithAnnotation);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("@IndexedMapper can only be applied to classes");
    }

    @Test
    void testLargeNumberOfMappers() throws IOException {
        // More than 10 entries: List.of must take the varargs overload
        JavaFileObject[] classes = new JavaFileObject[15];

        for (int i = 0; i < 15; i++) {
            classes[i] = JavaFileObjects.forSourceLines(
                    "io.github.cyfko.example.Mapper" + i,
                    "package io.github.cyfko.example;",
                    "",
                    "import io.github.cyfko.typemapper.IndexedMapper;",
                    "import io.github.cyfko.typemapper.Mapper;",
                    "",
                    "@IndexedMapper",
                    "public class Mapper" + i + " implements Mapper<Model" + i + ", String> {",
                    "    @Override",
                    "    public String map(Model" + i + " source) {",
                    "        return \"" + i + "\";",
                    "    }",
                    "}",
                    "",
                    "class Model" + i + " {",
                    "}"
            );
        }

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(classes);

        assertThat(compilation).succeeded();

        String generatedCode = getGeneratedIndexCode(compilation);

        // Verify all 15 entries are present
        for (int i = 0; i < 15; i++) {
            assertTrue(generatedCode.contains("io.github.cyfko.example.Mapper" + i + ".class"),
                    "Missing entry for Mapper" + i);
        }

        assertThat(compilation).hadNoteContaining("Generated MapperIndexImpl with 15 mappers");
    }

    @Test
    void testMultipleDuplicatesReportsAll() {
        JavaFileObject[] classes = new JavaFileObject[3];
        for (int i = 0; i < 3; i++) {
            classes[i] = JavaFileObjects.forSourceLines(
                    "io.github.cyfko.example.Class" + i,
                    "package io.github.cyfko.example;",
                    "",
                    "import io.github.cyfko.typemapper.IndexedMapper;",
                    "import io.github.cyfko.typemapper.Mapper;",
                    "",
                    "@IndexedMapper",
                    "public class Class" + i + " implements Mapper<Integer, String> {",
                    "    @Override",
                    "    public String map(Integer source) {",
                    "        return String.valueOf(source);",
                    "    }",
                    "}"
            );
        }

        Compilation compilation = Compiler.javac()
                .withProcessors(new MapperIndexProcessor())
                .compile(classes);

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("Duplicate mapper for Integer -> String");

        String diagnostics = compilation.errors().toString();
        int duplicateCount = countOccurrences(diagnostics, "Duplicate mapper for Integer -> String");
        assertTrue(duplicateCount >= 2, "Should report every duplicate, found: " + duplicateCount);
    }

    // ==================== Helper Methods ====================

    private static JavaFileObject user() {
        return JavaFileObjects.forResource("testdata/User.java");
    }

    private static JavaFileObject userDto() {
        return JavaFileObjects.forResource("testdata/UserDto.java");
    }

    /**
     * Returns the User model, its DTO and the indexed UserMapper, followed by {@code extra}.
     */
    private static JavaFileObject[] userSources(JavaFileObject... extra) {
        JavaFileObject[] sources = new JavaFileObject[3 + extra.length];
        sources[0] = user();
        sources[1] = userDto();
        sources[2] = JavaFileObjects.forResource("testdata/UserMapper.java");
        System.arraycopy(extra, 0, sources, 3, extra.length);
        return sources;
    }

    /**
     * Extracts the generated MapperIndexImpl source code from compilation results.
     */
    private String getGeneratedIndexCode(Compilation compilation) throws IOException {
        return compilation
                .generatedSourceFile("io.github.cyfko.typemapper.providers.MapperIndexImpl")
                .orElseThrow(() -> new AssertionError("Generated MapperIndexImpl not found"))
                .getCharContent(true)
                .toString();
    }

    /**
     * Counts the number of occurrences of a substring in a string.
     */
    private int countOccurrences(String str, String substring) {
        int count = 0;
        int index = 0;
        while ((index = str.indexOf(substring, index)) != -1) {
            count++;
            index += substring.length();
        }
        return count;
    }
}
