package com.livequery.event;

import java.util.Locale;

/**
 * Kind of mutation that produced a {@link ChangeEvent}.
 */
public enum Operation {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Parses an operation name case-insensitively ("insert", "UPDATE", ...).
     *
     * @param name the operation name
     * @return the matching operation
     * @throws IllegalArgumentException if the name is null or not a known operation
     */
    public static Operation fromString(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Operation name cannot be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown operation: " + name, e);
        }
    }
}
