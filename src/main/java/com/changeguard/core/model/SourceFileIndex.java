package com.changeguard.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Structural summary of one source file, part of an immutable index snapshot.
 *
 * @param path         path relative to the indexed root, using forward slashes
 * @param absolutePath absolute filesystem path
 * @param language     language tag detected from the file extension
 * @param imports      textual import / require targets in source order
 * @param functions    functions located by the extractor
 * @param lineCount    number of lines in the file
 * @param sizeBytes    file size in bytes
 * @param contentHash  hex SHA-256 of the file content
 * @param lastModified last-modified time at indexing
 */
public record SourceFileIndex(
    String path,
    String absolutePath,
    String language,
    List<String> imports,
    List<FunctionDescriptor> functions,
    int lineCount,
    long sizeBytes,
    String contentHash,
    Instant lastModified
) implements Serializable {

    public SourceFileIndex {
        imports = imports == null ? List.of() : List.copyOf(imports);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public List<FunctionDescriptor> exportedFunctions() {
        return functions.stream().filter(FunctionDescriptor::exported).toList();
    }
}
