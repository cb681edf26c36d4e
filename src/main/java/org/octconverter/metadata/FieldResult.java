package org.octconverter.metadata;

import java.util.Optional;

import org.octconverter.errors.DecodeException;

/**
 * Outcome of decoding one metadata field: present with a value, absent from the file, or
 * failed with an error.
 *
 * @param <V> field value type
 */
public final class FieldResult<V> {

    private static final FieldResult<?> ABSENT = new FieldResult<>(null, null);

    private final V value;
    private final DecodeException error;

    private FieldResult(V value, DecodeException error) {
        this.value = value;
        this.error = error;
    }

    public static <V> FieldResult<V> present(V value) {
        if (value == null) {
            throw new IllegalArgumentException("A present field needs a value");
        }
        return new FieldResult<>(value, null);
    }

    @SuppressWarnings("unchecked")
    public static <V> FieldResult<V> absent() {
        return (FieldResult<V>) ABSENT;
    }

    public static <V> FieldResult<V> error(DecodeException error) {
        return new FieldResult<>(null, error);
    }

    /**
     * Wraps a decoder result, treating {@code null} as absent.
     */
    public static <V> FieldResult<V> ofNullable(V value) {
        return value == null ? absent() : present(value);
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isAbsent() {
        return value == null && error == null;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * @return the value; empty for both absent and failed fields
     */
    public Optional<V> value() {
        return Optional.ofNullable(value);
    }

    public Optional<DecodeException> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        if (error != null) {
            return "error(" + error.getMessage() + ")";
        }
        return value != null ? "present(" + value + ")" : "absent";
    }
}
