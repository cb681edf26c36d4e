package org.octconverter.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry mapping the chunk types of one format to the fields they carry.
 * <p>
 * Each format builds its table once in a static {@code initialize()} method; a chunk type may
 * carry several fields, each decoded independently.
 *
 * @param <T> the format's chunk type enum
 */
public final class MetadataTable<T extends Enum<T>> {

    /**
     * One field carried by a chunk type.
     */
    public record Binding<T extends Enum<T>, V>(T type, MetadataField<V> field, IFieldDecoder<V> decoder) {
    }

    private final Map<T, List<Binding<T, ?>>> bindings;

    public MetadataTable(Class<T> typeClass) {
        this.bindings = new EnumMap<>(typeClass);
    }

    /**
     * Registers a field decoder for a chunk type.
     *
     * @param type    chunk type carrying the field
     * @param field   target field
     * @param decoder decoder reading the field from the chunk payload
     * @return this table
     */
    public <V> MetadataTable<T> register(T type, MetadataField<V> field, IFieldDecoder<V> decoder) {
        bindings.computeIfAbsent(type, t -> new ArrayList<>()).add(new Binding<>(type, field, decoder));
        return this;
    }

    /**
     * @return the bindings for a chunk type in registration order, empty if it carries no metadata
     */
    public List<Binding<T, ?>> get(T type) {
        return Collections.unmodifiableList(bindings.getOrDefault(type, List.of()));
    }

    public boolean handles(T type) {
        return bindings.containsKey(type);
    }
}
