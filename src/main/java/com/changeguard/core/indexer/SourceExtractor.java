package com.changeguard.core.indexer;

import com.changeguard.core.model.FunctionDescriptor;

import java.util.List;

/**
 * Best-effort structural extraction from source text.
 * <p>
 * Implementations may miss exports (false negatives are acceptable) but must never throw
 * on unfamiliar input; unknown languages yield empty results. Consumers depend only on this
 * interface so a parser-backed implementation can replace the heuristic one.
 */
public interface SourceExtractor {

    List<ImportStatement> importStatements(String language, List<String> lines);

    List<FunctionDescriptor> functions(String language, List<String> lines);

    default List<String> imports(String language, List<String> lines) {
        return importStatements(language, lines).stream().map(ImportStatement::target).toList();
    }
}
