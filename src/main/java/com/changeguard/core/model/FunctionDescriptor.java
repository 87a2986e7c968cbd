package com.changeguard.core.model;

import java.io.Serializable;

/**
 * A function or method located by the heuristic extractor.
 *
 * @param name      function name
 * @param startLine 1-based line of the declaration
 * @param endLine   1-based line where the body ends (best effort)
 * @param exported  whether the function is visible outside its file
 */
public record FunctionDescriptor(
    String name,
    int startLine,
    int endLine,
    boolean exported
) implements Serializable {}
