package io.github.cyfko.typemapper.exceptions;

/**
 * Thrown when the element type of a sequence cannot be determined: the sequence carries no
 * static element type and has no non-{@code null} element to inspect.
 */
public class TypeInferenceException extends IllegalArgumentException {

    public TypeInferenceException(String message) {
        super(message);
    }
}
