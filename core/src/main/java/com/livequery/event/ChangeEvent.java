package com.livequery.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable notification that a row of a data source was mutated.
 *
 * <p>The key preserves the insertion order of its columns so that refresh
 * filters are generated in a stable order. An empty key means the affected
 * row is unknown and subscribers must fall back to a full refresh.
 *
 * @param sourceName logical table the mutation was applied to
 * @param operation  kind of mutation
 * @param key        key column name to key value, possibly empty
 */
public record ChangeEvent(String sourceName, Operation operation, Map<String, Object> key) {

    public ChangeEvent {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        key = key == null || key.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(key));
    }

    /**
     * Creates an event whose affected row is unknown.
     */
    public static ChangeEvent withoutKey(String sourceName, Operation operation) {
        return new ChangeEvent(sourceName, operation, Collections.emptyMap());
    }

    /**
     * @return true if the event identifies the affected row
     */
    public boolean hasKey() {
        return !key.isEmpty();
    }
}
