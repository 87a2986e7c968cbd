package com.changeguard.core.model;

import java.util.Locale;

/**
 * The kind of modification a {@link ChangeRecord} proposes for its target file.
 */
public enum ChangeKind {
    CREATE,
    UPDATE,
    DELETE,
    REFACTOR;

    /**
     * Parses a kind name case-insensitively ("update", "UPDATE", "Update").
     *
     * @throws IllegalArgumentException if the value names no known kind
     */
    public static ChangeKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Change kind must not be blank");
        }
        return ChangeKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
