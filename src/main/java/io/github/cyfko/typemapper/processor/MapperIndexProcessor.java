package io.github.cyfko.typemapper.processor;

import com.google.auto.service.AutoService;
import io.github.cyfko.typemapper.IndexedMapper;

import javax.annotation.processing.*;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.Writer;
import java.util.*;

/**
 * Annotation processor responsible for generating the index of {@link IndexedMapper} classes.
 * <p>
 * The processor validates:
 * <ul>
 *     <li>that @IndexedMapper is used only on public, concrete, non-generic classes</li>
 *     <li>that the class implements {@code Mapper<S, D>} with concrete type arguments</li>
 *     <li>that the class has no constructor parameters and a public no-arg constructor</li>
 *     <li>that the destination type is not asynchronous</li>
 *     <li>that every {@code (S, D)} pair is served by a single class</li>
 * </ul>
 * At the end of processing, a class named
 * {@code io.github.cyfko.typemapper.providers.MapperIndexImpl}
 * is generated containing a static, immutable list of mapper classes.
 * <p>
 * Compilation will fail if any validation errors are detected.
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("io.github.cyfko.typemapper.IndexedMapper")
public final class MapperIndexProcessor extends AbstractProcessor {

    private static final String MAPPER_TYPE = "io.github.cyfko.typemapper.Mapper";
    private static final List<String> ASYNC_TYPES = List.of(
            "java.util.concurrent.Future",
            "java.util.concurrent.CompletionStage"
    );

    /**
     * Valid mappers keyed by the erased {@code S -> D} pair, in declaration order.
     */
    private final Map<String, MapperElementInfo> entries = new LinkedHashMap<>();
    private boolean hasErrors = false;
    private boolean generated = false;

    private static class MapperElementInfo {
        final String qualifiedName;
        final String pair;
        final Element element;

        MapperElementInfo(String qualifiedName, String pair, Element element) {
            this.qualifiedName = qualifiedName;
            this.pair = pair;
            this.element = element;
        }
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment env) {
        if (env.processingOver()) {
            finish();
            return false;
        }
        if (annotations.isEmpty()) {
            return false;
        }

        Messager log = processingEnv.getMessager();
        log.printMessage(Diagnostic.Kind.NOTE, "Processing @IndexedMapper...");

        for (Element element : env.getElementsAnnotatedWith(IndexedMapper.class)) {
            if (element.getKind() != ElementKind.CLASS) {
                error("@IndexedMapper can only be applied to classes", element);
                continue;
            }

            TypeElement type = (TypeElement) element;
            if (!validateDeclaration(type)) {
                continue;
            }

            DeclaredType mapperType = findMapperType(type.asType());
            if (mapperType == null) {
                error("Mapper '" + type.getSimpleName() + "' must implement " + MAPPER_TYPE, element);
                continue;
            }

            List<? extends TypeMirror> arguments = mapperType.getTypeArguments();
            if (arguments.size() != 2 || !isConcrete(arguments.get(0)) || !isConcrete(arguments.get(1))) {
                error("Mapper '" + type.getSimpleName() + "' must bind concrete types for Mapper<S, D>, found "
                        + mapperType, element);
                continue;
            }

            TypeMirror source = arguments.get(0);
            TypeMirror destination = arguments.get(1);

            if (isAsynchronous(destination)) {
                error("Mapper '" + type.getSimpleName() + "' maps to asynchronous type '" + destination
                        + "'. Mappers should be synchronous. Move async logic to the service layer.", element);
                continue;
            }

            Types types = processingEnv.getTypeUtils();
            String key = types.erasure(source) + " -> " + types.erasure(destination);
            String pair = displayName(source) + " -> " + displayName(destination);

            // Check for duplicate pairs
            if (entries.containsKey(key)) {
                MapperElementInfo existing = entries.get(key);
                error("Duplicate mapper for " + pair + " found on " + type.getQualifiedName()
                        + ". Already mapped by " + existing.qualifiedName, element);

                // Also report on the first occurrence for clarity
                error("First mapper for " + existing.pair, existing.element);
                continue;
            }

            entries.put(key, new MapperElementInfo(type.getQualifiedName().toString(), pair, element));
        }

        return true;
    }

    private void finish() {
        if (generated) {
            return;
        }
        generated = true;

        if (hasErrors) {
            processingEnv.getMessager().printMessage(
                    Diagnostic.Kind.ERROR,
                    "Cannot generate mapper index due to @IndexedMapper validation errors. " +
                            "Fix the errors above and recompile."
            );
        } else {
            writeIndex();
        }
    }

    /**
     * Checks modifiers, type parameters and constructors. Reports every problem found.
     */
    private boolean validateDeclaration(TypeElement type) {
        boolean valid = true;
        Set<Modifier> modifiers = type.getModifiers();
        String name = type.getSimpleName().toString();

        if (!modifiers.contains(Modifier.PUBLIC)) {
            error("Mapper '" + name + "' must be public", type);
            valid = false;
        }
        if (modifiers.contains(Modifier.ABSTRACT)) {
            error("Mapper '" + name + "' cannot be abstract", type);
            valid = false;
        }
        if (type.getNestingKind() == NestingKind.MEMBER && !modifiers.contains(Modifier.STATIC)) {
            error("Mapper '" + name + "' must be a static nested class", type);
            valid = false;
        }
        if (!type.getTypeParameters().isEmpty()) {
            error("Mapper '" + name + "' cannot declare type parameters", type);
            valid = false;
        }

        boolean hasPublicNoArg = false;
        for (ExecutableElement constructor : ElementFilter.constructorsIn(type.getEnclosedElements())) {
            if (!constructor.getParameters().isEmpty()) {
                error("Mapper '" + name + "' should not have constructor parameters. "
                        + "Mappers should be pure data transformation functions with no dependencies.", constructor);
                valid = false;
            } else if (constructor.getModifiers().contains(Modifier.PUBLIC)) {
                hasPublicNoArg = true;
            }
        }
        if (!hasPublicNoArg && valid) {
            error("Mapper '" + name + "' must have a public no-arg constructor", type);
            valid = false;
        }

        return valid;
    }

    /**
     * Walks the supertypes of {@code type} until it reaches {@code Mapper}, keeping the type
     * arguments substituted along the way.
     */
    private DeclaredType findMapperType(TypeMirror type) {
        Types types = processingEnv.getTypeUtils();
        TypeElement mapperElement = processingEnv.getElementUtils().getTypeElement(MAPPER_TYPE);
        if (mapperElement == null) {
            return null;
        }
        TypeMirror mapperErasure = types.erasure(mapperElement.asType());

        Deque<TypeMirror> pending = new ArrayDeque<>(List.of(type));
        while (!pending.isEmpty()) {
            TypeMirror current = pending.poll();
            if (types.isSameType(types.erasure(current), mapperErasure)) {
                return current.getKind() == TypeKind.DECLARED ? (DeclaredType) current : null;
            }
            pending.addAll(types.directSupertypes(current));
        }
        return null;
    }

    private boolean isConcrete(TypeMirror type) {
        return type.getKind() == TypeKind.DECLARED || type.getKind() == TypeKind.ARRAY;
    }

    private boolean isAsynchronous(TypeMirror type) {
        Types types = processingEnv.getTypeUtils();
        for (String asyncType : ASYNC_TYPES) {
            TypeElement element = processingEnv.getElementUtils().getTypeElement(asyncType);
            if (element != null && types.isAssignable(types.erasure(type), types.erasure(element.asType()))) {
                return true;
            }
        }
        return false;
    }

    private String displayName(TypeMirror type) {
        if (type.getKind() == TypeKind.DECLARED) {
            return ((DeclaredType) type).asElement().getSimpleName().toString();
        }
        return type.toString();
    }

    private void error(String message, Element element) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, message, element);
        hasErrors = true;
    }

    private void writeIndex() {
        Messager log = processingEnv.getMessager();

        try {
            JavaFileObject file = processingEnv.getFiler()
                    .createSourceFile("io.github.cyfko.typemapper.providers.MapperIndexImpl");

            try (Writer writer = file.openWriter()) {
                writeIndexClass(writer);
            }

            log.printMessage(Diagnostic.Kind.NOTE,
                    "Generated MapperIndexImpl with " + entries.size() + " mappers");

        } catch (IOException e) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "Failed to generate mapper index: " + e.getMessage());
        }
    }

    private void writeIndexClass(Writer out) throws IOException {
        out.write("""
                package io.github.cyfko.typemapper.providers;

                import java.util.List;
                import javax.annotation.processing.Generated;

                @Generated("io.github.cyfko.typemapper.processor.MapperIndexProcessor")
                public final class MapperIndexImpl implements MapperIndex {

                    private static final List<Class<?>> MAPPERS = List.of(
                """);

        int i = 0;
        int last = entries.size() - 1;

        for (MapperElementInfo entry : entries.values()) {
            out.write("        " + entry.qualifiedName + ".class");
            if (i++ != last) {
                out.write(",");
            }
            out.write("\n");
        }

        out.write("""
                    );

                    @Override
                    public List<Class<?>> getMapperClasses() {
                        return MAPPERS;
                    }
                }
                """);
    }
}
