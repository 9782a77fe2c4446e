package com.taskforge.coordination.streaming;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Add/remove patch for a list of JSON objects. Removal matches entries on a key field.
 */
public record ListDelta(List<Map<String, Object>> add, List<Map<String, Object>> remove) {

    public ListDelta {
        add = add != null ? List.copyOf(add) : List.of();
        remove = remove != null ? List.copyOf(remove) : List.of();
    }

    public boolean isEmpty() {
        return add.isEmpty() && remove.isEmpty();
    }

    /**
     * Appends the added entries, then drops every entry whose {@code keyField} matches a removed one.
     */
    public List<Map<String, Object>> applyTo(List<Map<String, Object>> current, String keyField) {
        List<Map<String, Object>> merged = new ArrayList<>(current);
        merged.addAll(add);
        if (remove.isEmpty()) {
            return merged;
        }
        Set<Object> removedKeys = remove.stream()
                .map(entry -> entry.get(keyField))
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        merged.removeIf(entry -> removedKeys.contains(entry.get(keyField)));
        return merged;
    }
}
