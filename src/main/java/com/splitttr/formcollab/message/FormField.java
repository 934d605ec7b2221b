package com.splitttr.formcollab.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One field of a form definition. Everything except the id and the position
 * (label, input type, validation rules, ...) lives in {@code properties};
 * an {@code id} key is never kept there.
 */
public record FormField(
    String id,
    int position,
    Map<String, Object> properties
) {
    public FormField {
        if (properties == null) {
            properties = Map.of();
        } else {
            var copy = new LinkedHashMap<>(properties);
            copy.remove("id");
            properties = Collections.unmodifiableMap(copy);
        }
    }

    public FormField atPosition(int newPosition) {
        return newPosition == position ? this : new FormField(id, newPosition, properties);
    }

    // Later values win, keys absent from the update are kept.
    public FormField mergedWith(Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(properties);
        merged.putAll(updates);
        return new FormField(id, position, merged);
    }
}
