package org.octconverter.container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.octconverter.model.DecodeWarning;

/**
 * The validated records of one container, in directory order and grouped by type.
 *
 * @param <T> the format's chunk type enum
 */
public final class Directory<T extends Enum<T>> {

    private final List<DirectoryEntry<T>> entries;
    private final Map<T, List<DirectoryEntry<T>>> byType;
    private final List<DecodeWarning> warnings;

    public Directory(Class<T> typeClass, List<DirectoryEntry<T>> entries, List<DecodeWarning> warnings) {
        this.entries = List.copyOf(entries);
        this.warnings = List.copyOf(warnings);
        Map<T, List<DirectoryEntry<T>>> grouped = new EnumMap<>(typeClass);
        for (DirectoryEntry<T> e : this.entries) {
            grouped.computeIfAbsent(e.type(), t -> new ArrayList<>()).add(e);
        }
        grouped.replaceAll((t, list) -> Collections.unmodifiableList(list));
        this.byType = grouped;
    }

    /**
     * @return every entry in directory order
     */
    public List<DirectoryEntry<T>> entries() {
        return entries;
    }

    /**
     * @return the entries of one type in directory order, possibly empty
     */
    public List<DirectoryEntry<T>> entries(T type) {
        return byType.getOrDefault(type, List.of());
    }

    public Optional<DirectoryEntry<T>> first(T type) {
        List<DirectoryEntry<T>> list = entries(type);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    public Optional<DirectoryEntry<T>> last(T type) {
        List<DirectoryEntry<T>> list = entries(type);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
    }

    public boolean contains(T type) {
        return byType.containsKey(type);
    }

    /**
     * @return problems found while the directory was walked
     */
    public List<DecodeWarning> warnings() {
        return warnings;
    }

    public int size() {
        return entries.size();
    }
}
