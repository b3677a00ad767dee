package io.github.cyfko.typemapper.discovery;

import io.github.cyfko.typemapper.Mapper;
import io.github.cyfko.typemapper.TypePairKey;
import io.github.cyfko.typemapper.dispatch.TypeArguments;
import io.github.cyfko.typemapper.exceptions.MapperDefinitionException;
import io.github.cyfko.typemapper.model.MapperRegistration;
import io.github.cyfko.typemapper.providers.MapperIndex;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns mapper classes into {@link MapperRegistration}s.
 *
 * <p>
 * Discovery only produces registrations; validating a batch and committing it is the job of
 * {@link io.github.cyfko.typemapper.MapperRegistry#register(Collection)}.
 * </p>
 *
 * <h2>Sources</h2>
 * <ul>
 *   <li><b>Classes</b>: {@link #registrationsFor(Collection)} filters a set of candidate classes
 *       down to concrete mappers, {@link #registrationFor(Class)} accepts exactly one.</li>
 *   <li><b>Generated index</b>: {@link #fromIndex()} reads the {@code MapperIndexImpl} generated
 *       at compile time for classes annotated with
 *       {@link io.github.cyfko.typemapper.IndexedMapper}.</li>
 * </ul>
 *
 * <p>
 * The source and destination types come from the {@code Mapper<S, D>} arguments bound anywhere
 * in the class hierarchy. Instances are created lazily through the public no-arg constructor.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MapperDiscovery {

    private static final Logger log = Logger.getLogger(MapperDiscovery.class.getName());

    static final String INDEX_CLASS = "io.github.cyfko.typemapper.providers.MapperIndexImpl";

    private MapperDiscovery() {
        // Utility class; not instantiable.
    }

    /**
     * Returns registrations for the concrete mappers among {@code candidates}.
     *
     * <p>
     * Interfaces, abstract classes, generic classes and classes not implementing {@link Mapper}
     * are skipped.
     * </p>
     *
     * @param candidates classes to inspect; must not be {@code null}
     * @return one registration per concrete mapper, in input order
     * @throws MapperDefinitionException if a concrete mapper cannot be registered
     */
    public static List<MapperRegistration> registrationsFor(Collection<? extends Class<?>> candidates) {
        Objects.requireNonNull(candidates, "candidates cannot be null");

        List<MapperRegistration> result = new ArrayList<>();
        for (Class<?> candidate : candidates) {
            if (isConcreteMapper(candidate)) {
                result.add(registrationFor(candidate));
            } else {
                log.fine(() -> "Skipping " + candidate.getName() + ": not a concrete mapper class");
            }
        }
        return result;
    }

    public static List<MapperRegistration> registrationsFor(Class<?>... candidates) {
        return registrationsFor(List.of(candidates));
    }

    /**
     * Returns the registration for a single mapper class.
     *
     * @param mapperClass concrete, non-generic class implementing {@link Mapper}; must not be {@code null}
     * @return the registration, identified by {@code mapperClass}
     * @throws MapperDefinitionException if the class is not a concrete mapper, if its
     *         {@code Mapper<S, D>} arguments cannot be resolved, or if it has no public no-arg constructor
     */
    public static MapperRegistration registrationFor(Class<?> mapperClass) {
        Objects.requireNonNull(mapperClass, "mapperClass cannot be null");

        if (!isConcreteMapper(mapperClass)) {
            throw new MapperDefinitionException(mapperClass,
                    "must be a concrete, non-generic class implementing " + Mapper.class.getName());
        }

        Class<?> sourceType = TypeArguments.resolve(mapperClass, Mapper.class, 0);
        Class<?> destinationType = TypeArguments.resolve(mapperClass, Mapper.class, 1);
        if (sourceType == null || destinationType == null) {
            throw new MapperDefinitionException(mapperClass, "cannot resolve the types of Mapper<S, D>");
        }

        Constructor<?> constructor;
        try {
            constructor = mapperClass.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new MapperDefinitionException(mapperClass, "a public no-arg constructor is required", e);
        }

        return new MapperRegistration(
                TypePairKey.of(sourceType, destinationType),
                mapperClass,
                () -> instantiate(constructor)
        );
    }

    /**
     * Returns registrations for the classes of the generated mapper index.
     *
     * <p>
     * If the generated class cannot be found (for example, because annotation processing was
     * disabled), an error is logged and an empty list is returned.
     * </p>
     *
     * @return registrations for every indexed mapper
     * @throws IllegalStateException if the generated class exists but cannot be instantiated
     */
    public static List<MapperRegistration> fromIndex() {
        MapperIndex index = loadIndex();
        return index == null ? List.of() : fromIndex(index);
    }

    /**
     * Returns registrations for the classes listed by {@code index}.
     */
    public static List<MapperRegistration> fromIndex(MapperIndex index) {
        Objects.requireNonNull(index, "index cannot be null");

        List<MapperRegistration> result = new ArrayList<>();
        for (Class<?> mapperClass : index.getMapperClasses()) {
            result.add(registrationFor(mapperClass));
        }
        return result;
    }

    static boolean isConcreteMapper(Class<?> type) {
        return Mapper.class.isAssignableFrom(type)
                && !type.isInterface()
                && !Modifier.isAbstract(type.getModifiers())
                && type.getTypeParameters().length == 0;
    }

    private static MapperIndex loadIndex() {
        try {
            Class<?> cls = Class.forName(INDEX_CLASS);
            return (MapperIndex) cls.getConstructor().newInstance();

        } catch (ClassNotFoundException e) {
            log.severe("""
                Cannot load the generated mapper index.
                Expected generated class: io.github.cyfko.typemapper.providers.MapperIndexImpl
                Ensure that the annotation processor has run and your build
                system is configured for annotation processing.
                """ + e);
            return null;

        } catch (InvocationTargetException | InstantiationException |
                 NoSuchMethodException | IllegalAccessException e) {
            throw new IllegalStateException("Failed to instantiate MapperIndexImpl", e);
        }
    }

    /**
     * Creates a mapper, rethrowing the constructor's own exception rather than the reflective
     * wrapper.
     */
    private static Mapper<?, ?> instantiate(Constructor<?> constructor) {
        try {
            return (Mapper<?, ?>) constructor.newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new MapperDefinitionException(constructor.getDeclaringClass(), "constructor failed", cause);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new MapperDefinitionException(constructor.getDeclaringClass(), "cannot be instantiated", e);
        }
    }
}
