package org.octconverter.model;

import java.util.List;

/**
 * A decoded entity together with the warnings collected while producing it.
 *
 * @param value    the decoded entity
 * @param warnings non-fatal problems, in the order they were found
 * @param <T>      entity type
 */
public record Decoded<T>(T value, List<DecodeWarning> warnings) {

    public Decoded {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
