package com.changeguard.core.model;

import java.io.Serializable;

/**
 * A mechanical fix found by the cleanup scan. It never touches disk itself; it must be turned
 * into a {@link ChangeRecord} first.
 *
 * @param type            fix type tag (e.g. "remove-unused-import")
 * @param description     human-readable summary
 * @param autoApply       true only when the fix is lexically local and provably non-semantic
 * @param filePath        absolute path of the affected file
 * @param line            1-based line of the first affected location
 * @param proposedContent full file content after the fix
 */
public record CleanupOpportunity(
    String type,
    String description,
    boolean autoApply,
    String filePath,
    int line,
    String proposedContent
) implements Serializable {}
