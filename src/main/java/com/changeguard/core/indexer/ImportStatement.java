package com.changeguard.core.indexer;

import java.util.List;

/**
 * One import / require statement found in a source file.
 *
 * @param line       1-based line of the statement start
 * @param endLine    1-based line of the statement end (same as {@code line} for one-liners)
 * @param target     imported module, package or class as written
 * @param boundNames local names the statement introduces; empty for side-effect or wildcard imports
 */
public record ImportStatement(
    int line,
    int endLine,
    String target,
    List<String> boundNames
) {

    public ImportStatement {
        boundNames = boundNames == null ? List.of() : List.copyOf(boundNames);
    }

    public boolean isSingleLine() {
        return line == endLine;
    }
}
