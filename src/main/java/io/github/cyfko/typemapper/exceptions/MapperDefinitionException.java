package io.github.cyfko.typemapper.exceptions;

/**
 * Thrown when a class handed to discovery cannot serve as a mapper.
 */
public class MapperDefinitionException extends IllegalArgumentException {
    private final Class<?> mapperClass;

    public MapperDefinitionException(Class<?> mapperClass, String message) {
        super(fullMessage(mapperClass, message));
        this.mapperClass = mapperClass;
    }

    public MapperDefinitionException(Class<?> mapperClass, String message, Throwable cause) {
        super(fullMessage(mapperClass, message), cause);
        this.mapperClass = mapperClass;
    }

    public Class<?> mapperClass() {
        return mapperClass;
    }

    private static String fullMessage(Class<?> mapperClass, String message) {
        return "Invalid mapper " + mapperClass.getName() + ": " + message;
    }
}
