package io.github.cyfko.typemapper.dispatch;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the type arguments a class binds for one of its generic supertypes.
 *
 * <p>
 * Type variables are followed through the whole hierarchy, so
 * {@code class Users extends ArrayList<User>} binds {@code Iterable<T>} to {@code User}, and
 * {@code class UserMapper extends AbstractMapper<User, UserDto>} binds the type arguments of
 * whatever interface {@code AbstractMapper} passes them on to.
 * </p>
 */
public final class TypeArguments {

    private TypeArguments() {
        // Utility class; not instantiable.
    }

    /**
     * Returns the class bound to the {@code index}-th type parameter of {@code target} as seen
     * from {@code type}, or {@code null} if that argument is not a concrete type (a type
     * variable left open, a wildcard, or a raw usage of {@code target}).
     *
     * <p>
     * Parameterized arguments resolve to their raw class: an {@code Iterable<List<User>>}
     * yields {@code List.class}.
     * </p>
     *
     * @param type   class to inspect; must not be {@code null}
     * @param target generic supertype whose argument is requested; must not be {@code null}
     * @param index  index of the type parameter of {@code target}
     * @return the resolved class, or {@code null}
     * @throws IndexOutOfBoundsException if {@code target} has no type parameter at {@code index}
     */
    public static Class<?> resolve(Class<?> type, Class<?> target, int index) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Objects.checkIndex(index, target.getTypeParameters().length);

        if (!target.isAssignableFrom(type)) return null;
        return toClass(search(type, target, index, Map.of()));
    }

    private static Type search(Type type, Class<?> target, int index, Map<TypeVariable<?>, Type> bindings) {
        Class<?> raw;
        Map<TypeVariable<?>, Type> local;

        if (type instanceof Class<?>) {
            raw = (Class<?>) type;
            local = Map.of();
        } else if (type instanceof ParameterizedType) {
            ParameterizedType pt = (ParameterizedType) type;
            raw = (Class<?>) pt.getRawType();
            TypeVariable<?>[] variables = raw.getTypeParameters();
            Type[] arguments = pt.getActualTypeArguments();
            local = new HashMap<>();
            for (int i = 0; i < variables.length; i++) {
                local.put(variables[i], substitute(arguments[i], bindings));
            }
        } else {
            return null;
        }

        if (raw == target) {
            // Raw usage of the target leaves the argument unknown.
            return local.get(target.getTypeParameters()[index]);
        }
        if (!target.isAssignableFrom(raw)) return null;

        // Prefer a concrete binding over an open type variable reached through another path.
        Type open = null;
        for (Type supertype : supertypes(raw)) {
            Type found = search(supertype, target, index, local);
            if (found instanceof TypeVariable<?>) {
                open = found;
            } else if (found != null) {
                return found;
            }
        }
        return open;
    }

    private static List<Type> supertypes(Class<?> raw) {
        List<Type> result = new ArrayList<>(List.of(raw.getGenericInterfaces()));
        Type superclass = raw.getGenericSuperclass();
        if (superclass != null) {
            result.add(superclass);
        }
        return result;
    }

    private static Type substitute(Type type, Map<TypeVariable<?>, Type> bindings) {
        if (type instanceof TypeVariable<?> && bindings.containsKey(type)) {
            return bindings.get(type);
        }
        return type;
    }

    private static Class<?> toClass(Type type) {
        if (type instanceof Class<?>) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        if (type instanceof GenericArrayType) {
            Class<?> component = toClass(((GenericArrayType) type).getGenericComponentType());
            return component == null ? null : Array.newInstance(component, 0).getClass();
        }
        return null;
    }
}
