package io.github.cyfko.typemapper.exceptions;

import io.github.cyfko.typemapper.TypePairKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when a registration batch assigns more than one mapper implementation to the same
 * {@code (source, destination)} pair. The message lists every conflicting pair together with
 * every competing implementation.
 */
public class MapperConfigurationException extends IllegalStateException {
    private final Map<TypePairKey, List<String>> conflicts;

    public MapperConfigurationException(Map<TypePairKey, List<String>> conflicts) {
        super(fullMessage(conflicts));
        this.conflicts = Collections.unmodifiableMap(new LinkedHashMap<>(conflicts));
    }

    /**
     * Conflicting pairs mapped to the names of their competing implementations.
     */
    public Map<TypePairKey, List<String>> conflicts() {
        return conflicts;
    }

    private static String fullMessage(Map<TypePairKey, List<String>> conflicts) {
        String lines = conflicts.entrySet().stream()
                .map(e -> e.getKey() + ": " + String.join(", ", e.getValue()))
                .collect(Collectors.joining("\n"));
        return "Multiple mappers found for the same source/destination pairs:\n" + lines + "\n"
                + "Only one mapper per source/destination pair is allowed.";
    }
}
