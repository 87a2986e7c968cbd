package com.changeguard.core.cleanup;

import com.changeguard.core.exception.FileAccessException;
import com.changeguard.core.indexer.CodebaseIndexer;
import com.changeguard.core.indexer.HeuristicSourceExtractor;
import com.changeguard.core.indexer.ImportStatement;
import com.changeguard.core.indexer.SourceExtractor;
import com.changeguard.core.indexer.SourceLanguages;
import com.changeguard.core.model.CleanupOpportunity;
import com.changeguard.core.model.FunctionDescriptor;
import com.changeguard.core.model.SourceFileIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read-only pass that finds mechanical fixes in source files.
 * <p>
 * Nothing here writes to disk. Every opportunity carries the full proposed content so it can be
 * proposed as a change and go through the normal risk gate. Only fixes that are lexically local
 * and provably non-semantic get {@code autoApply=true}; anything ambiguous is left to a human.
 */
@Service
public class CleanupScanner {

    private static final Logger log = LoggerFactory.getLogger(CleanupScanner.class);

    public static final String REMOVE_UNUSED_IMPORT = "remove-unused-import";
    public static final String TRAILING_WHITESPACE = "trailing-whitespace";
    public static final String EXCESS_BLANK_LINES = "excess-blank-lines";
    public static final String ADD_DOCS = "add-docs";

    private static final Pattern TRAILING_WS = Pattern.compile("[ \\t]+$");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");

    private final CodebaseIndexer indexer;
    private final SourceExtractor extractor;

    public CleanupScanner(CodebaseIndexer indexer, SourceExtractor extractor) {
        this.indexer = indexer;
        this.extractor = extractor;
    }

    /**
     * Scans a file or every indexed file under a directory. Results are ordered by file path,
     * then by line. A file that cannot be read is logged and skipped.
     */
    public List<CleanupOpportunity> scanForCleanup(Path path) {
        Path target = path.toAbsolutePath().normalize();
        Collection<SourceFileIndex> files;
        if (Files.isDirectory(target)) {
            files = indexer.buildIndex(target).values();
        } else if (Files.isRegularFile(target)) {
            files = indexer.indexFile(target.getParent(), target).stream().toList();
        } else {
            throw new FileAccessException(target, "Nothing to scan", null);
        }

        var result = new ArrayList<CleanupOpportunity>();
        for (SourceFileIndex file : files) {
            Path filePath = Path.of(file.absolutePath());
            readText(filePath).ifPresent(text -> result.addAll(scanFile(filePath, file.language(), text)));
        }
        log.info("Cleanup scan of {} found {} opportunities in {} files", target, result.size(), files.size());
        return result;
    }

    /**
     * Finds imports in one file whose bound names are never referenced. Returns at most one
     * opportunity covering every such import in the file.
     */
    public Optional<CleanupOpportunity> removeUnusedImports(Path path) {
        Path filePath = path.toAbsolutePath().normalize();
        String language = SourceLanguages.detect(filePath.getFileName().toString());
        return readText(filePath).flatMap(text -> unusedImports(filePath, language, text));
    }

    List<CleanupOpportunity> scanFile(Path filePath, String language, SourceText text) {
        var found = new ArrayList<CleanupOpportunity>();
        unusedImports(filePath, language, text).ifPresent(found::add);
        trailingWhitespace(filePath, text).ifPresent(found::add);
        excessBlankLines(filePath, text).ifPresent(found::add);
        missingDocs(filePath, language, text).ifPresent(found::add);
        found.sort((a, b) -> Integer.compare(a.line(), b.line()));
        return found;
    }

    // ── Unused imports ──────────────────────────────────────────────

    Optional<CleanupOpportunity> unusedImports(Path filePath, String language, SourceText text) {
        List<String> lines = text.lines();
        List<ImportStatement> statements = extractor.importStatements(language, lines);
        if (statements.isEmpty()) {
            return Optional.empty();
        }

        Set<Integer> importLines = new HashSet<>();
        for (ImportStatement s : statements) {
            for (int l = s.line(); l <= s.endLine(); l++) {
                importLines.add(l);
            }
        }
        String body = bodyWithout(lines, importLines);

        List<ImportStatement> unused = statements.stream()
                .filter(s -> !s.boundNames().isEmpty())
                .filter(s -> s.boundNames().stream().noneMatch(name -> isReferenced(body, name)))
                .toList();
        if (unused.isEmpty()) {
            return Optional.empty();
        }

        // A line goes only when every statement on it is unused and safely removable.
        Map<Integer, List<ImportStatement>> byLine = statements.stream()
                .collect(Collectors.groupingBy(ImportStatement::line, TreeMap::new, Collectors.toList()));
        Set<Integer> removable = new HashSet<>();
        byLine.forEach((line, onLine) -> {
            if (onLine.stream().allMatch(s -> unused.contains(s) && isRemovable(s, language, lines.get(line - 1)))) {
                removable.add(line);
            }
        });

        boolean allRemoved = unused.stream().allMatch(s -> removable.contains(s.line()));
        String targets = unused.stream().map(ImportStatement::target).collect(Collectors.joining(", "));
        String proposed = removable.isEmpty() ? null : text.join(dropLines(lines, removable));
        return Optional.of(new CleanupOpportunity(
                REMOVE_UNUSED_IMPORT,
                "Remove %d unused import(s): %s".formatted(unused.size(), targets),
                allRemoved && proposed != null,
                filePath.toString(),
                unused.get(0).line(),
                proposed));
    }

    private static boolean isRemovable(ImportStatement statement, String language, String line) {
        if (!statement.isSingleLine() || !isSoleStatement(line)) {
            return false;
        }
        if (!statement.boundNames().stream().allMatch(name -> IDENTIFIER.matcher(name).matches())) {
            return false;
        }
        // JSX may use React without naming it in the source.
        return !(SourceLanguages.isJsx(language) && statement.boundNames().contains("React"));
    }

    /** True when nothing but one statement (and an optional trailing terminator) sits on the line. */
    static boolean isSoleStatement(String line) {
        String code = HeuristicSourceExtractor.stripLiterals(line).strip();
        if (code.endsWith(";")) {
            code = code.substring(0, code.length() - 1);
        }
        return code.indexOf(';') < 0 && code.indexOf('#') < 0;
    }

    static boolean isReferenced(String body, String name) {
        return Pattern.compile("(?<![\\w$])" + Pattern.quote(name) + "(?![\\w$])").matcher(body).find();
    }

    private static String bodyWithout(List<String> lines, Set<Integer> skipLines) {
        var sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            if (!skipLines.contains(i + 1)) {
                sb.append(lines.get(i)).append('\n');
            }
        }
        return sb.toString();
    }

    private static List<String> dropLines(List<String> lines, Set<Integer> drop) {
        var kept = new ArrayList<String>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            if (!drop.contains(i + 1)) {
                kept.add(lines.get(i));
            }
        }
        return kept;
    }

    // ── Whitespace ──────────────────────────────────────────────────

    // Never auto-applied: the whitespace may sit inside a multi-line string literal.
    Optional<CleanupOpportunity> trailingWhitespace(Path filePath, SourceText text) {
        List<String> lines = text.lines();
        int first = -1;
        int count = 0;
        var cleaned = new ArrayList<String>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String stripped = TRAILING_WS.matcher(line).replaceAll("");
            if (!stripped.equals(line)) {
                count++;
                if (first < 0) {
                    first = i + 1;
                }
            }
            cleaned.add(stripped);
        }
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(new CleanupOpportunity(TRAILING_WHITESPACE,
                "Remove trailing whitespace on %d line(s)".formatted(count),
                false, filePath.toString(), first, text.join(cleaned)));
    }

    Optional<CleanupOpportunity> excessBlankLines(Path filePath, SourceText text) {
        List<String> lines = text.lines();
        var collapsed = new ArrayList<String>(lines.size());
        int first = -1;
        int runs = 0;
        int i = 0;
        while (i < lines.size()) {
            if (!lines.get(i).isBlank()) {
                collapsed.add(lines.get(i));
                i++;
                continue;
            }
            int start = i;
            while (i < lines.size() && lines.get(i).isBlank()) {
                i++;
            }
            if (i - start >= 3) {
                runs++;
                if (first < 0) {
                    first = start + 1;
                }
                collapsed.add("");
            } else {
                collapsed.addAll(lines.subList(start, i));
            }
        }
        if (runs == 0) {
            return Optional.empty();
        }
        return Optional.of(new CleanupOpportunity(EXCESS_BLANK_LINES,
                "Collapse %d run(s) of three or more blank lines".formatted(runs),
                false, filePath.toString(), first, text.join(collapsed)));
    }

    // ── Documentation ───────────────────────────────────────────────

    // Inserts a skeleton comment naming the function; a human has to write the text.
    Optional<CleanupOpportunity> missingDocs(Path filePath, String language, SourceText text) {
        List<String> lines = text.lines();
        List<FunctionDescriptor> undocumented = extractor.functions(language, lines).stream()
                .filter(FunctionDescriptor::exported)
                .filter(f -> !hasDoc(language, lines, f.startLine() - 1))
                .toList();
        if (undocumented.isEmpty()) {
            return Optional.empty();
        }

        Map<Integer, FunctionDescriptor> byIndex = new TreeMap<>();
        undocumented.forEach(f -> byIndex.put(f.startLine() - 1, f));
        boolean python = "python".equals(language);
        var out = new ArrayList<String>(lines.size() + undocumented.size() * 3);
        for (int i = 0; i < lines.size(); i++) {
            FunctionDescriptor f = byIndex.get(i);
            String line = lines.get(i);
            String indent = line.substring(0, line.length() - line.stripLeading().length());
            if (f != null && !python) {
                int insertAt = firstAnnotationLine(lines, i);
                String annotationIndent = lines.get(insertAt).substring(0,
                        lines.get(insertAt).length() - lines.get(insertAt).stripLeading().length());
                out.add(out.size() - (i - insertAt), annotationIndent + "/**");
                out.add(out.size() - (i - insertAt), annotationIndent + " * " + f.name());
                out.add(out.size() - (i - insertAt), annotationIndent + " */");
            }
            out.add(line);
            if (f != null && python && line.stripTrailing().endsWith(":")) {
                out.add(indent + "    \"\"\"" + f.name() + ".\"\"\"");
            }
        }
        String names = undocumented.stream().map(FunctionDescriptor::name).collect(Collectors.joining(", "));
        return Optional.of(new CleanupOpportunity(ADD_DOCS,
                "Add documentation for %d exported function(s): %s".formatted(undocumented.size(), names),
                false, filePath.toString(), undocumented.get(0).startLine(), text.join(out)));
    }

    static boolean hasDoc(String language, List<String> lines, int declIdx) {
        if ("python".equals(language)) {
            int headerEnd = declIdx;
            while (headerEnd < lines.size() - 1 && !lines.get(headerEnd).stripTrailing().endsWith(":")) {
                headerEnd++;
            }
            for (int j = headerEnd + 1; j < lines.size(); j++) {
                String next = lines.get(j).strip();
                if (!next.isEmpty()) {
                    return next.startsWith("\"\"\"") || next.startsWith("'''");
                }
            }
            return false;
        }
        int j = firstAnnotationLine(lines, declIdx) - 1;
        if (j < 0) {
            return false;
        }
        String prev = lines.get(j).strip();
        return prev.endsWith("*/") || prev.startsWith("//") || prev.startsWith("*") || prev.startsWith("/**");
    }

    /** Index of the first annotation or decorator line directly above the declaration. */
    private static int firstAnnotationLine(List<String> lines, int declIdx) {
        int j = declIdx;
        while (j > 0 && lines.get(j - 1).strip().startsWith("@")) {
            j--;
        }
        return j;
    }

    private Optional<SourceText> readText(Path file) {
        try {
            return Optional.of(SourceText.of(Files.readString(file)));
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
