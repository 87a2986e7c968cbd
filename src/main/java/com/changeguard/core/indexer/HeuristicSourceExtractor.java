package com.changeguard.core.indexer;

import com.changeguard.core.model.FunctionDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line/regex based {@link SourceExtractor} for JavaScript/TypeScript, Java and Python.
 * <p>
 * Function end lines come from brace matching (or indentation for Python) with string
 * literals and line comments blanked out first. Block comments and template literals that
 * span lines can fool it; the result is a hint for scoping, not a parse.
 */
@Component
public class HeuristicSourceExtractor implements SourceExtractor {

    // ── Imports ───────────────────────────────────────────────────────────

    static final Pattern ES_IMPORT_FROM = Pattern.compile(
            "^\\s*import\\s+(?:type\\s+)?([^'\";]+?)\\s+from\\s+['\"]([^'\"]+)['\"]\\s*;?\\s*$");

    static final Pattern ES_IMPORT_SIDE_EFFECT = Pattern.compile(
            "^\\s*import\\s+['\"]([^'\"]+)['\"]\\s*;?\\s*$");

    /** Opening line of an import whose specifier list continues on following lines. */
    static final Pattern ES_IMPORT_OPEN = Pattern.compile("^\\s*import\\s+(?:type\\s+)?[^'\"]*\\{[^}]*$");

    static final Pattern ES_FROM_CLAUSE = Pattern.compile("from\\s+['\"]([^'\"]+)['\"]");

    static final Pattern ES_IMPORT_KEYWORD = Pattern.compile("^\\s*import\\b");

    /** Module specifier of any ES import on a line, named or side-effect. */
    static final Pattern ES_ANY_SPECIFIER = Pattern.compile("(?:from|import)\\s+['\"]([^'\"]+)['\"]");

    static final Pattern REQUIRE_BINDING = Pattern.compile(
            "^\\s*(?:const|let|var)\\s+([A-Za-z_$][\\w$]*|\\{[^}]*})\\s*=\\s*require\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)\\s*;?\\s*$");

    static final Pattern REQUIRE_ANY = Pattern.compile("require\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    static final Pattern JAVA_IMPORT = Pattern.compile(
            "^\\s*import\\s+(static\\s+)?([\\w$.]+(?:\\.\\*)?)\\s*;\\s*$");

    static final Pattern PY_IMPORT = Pattern.compile("^\\s*import\\s+(.+?)\\s*$");

    static final Pattern PY_FROM_IMPORT = Pattern.compile("^\\s*from\\s+([\\w.]+)\\s+import\\s+(.+?)\\s*$");

    // ── Functions ─────────────────────────────────────────────────────────

    static final Pattern ES_FUNCTION = Pattern.compile(
            "^\\s*(export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*([A-Za-z_$][\\w$]*)\\s*[(<]");

    static final Pattern ES_ARROW = Pattern.compile(
            "^\\s*(export\\s+)?(?:const|let|var)\\s+([A-Za-z_$][\\w$]*)\\s*(?::[^=]+)?=\\s*(?:async\\s+)?"
                    + "(?:\\([^)]*\\)|[A-Za-z_$][\\w$]*)\\s*(?::\\s*[^=]+?)?\\s*=>");

    static final Pattern ES_FUNCTION_EXPRESSION = Pattern.compile(
            "^\\s*(export\\s+)?(?:const|let|var)\\s+([A-Za-z_$][\\w$]*)\\s*=\\s*(?:async\\s+)?function\\b");

    static final Pattern ES_EXPORT_LIST = Pattern.compile("^\\s*export\\s*\\{([^}]*)}");

    static final Pattern ES_EXPORT_DEFAULT_NAME = Pattern.compile(
            "^\\s*export\\s+default\\s+([A-Za-z_$][\\w$]*)\\s*;?\\s*$");

    static final Pattern JAVA_METHOD = Pattern.compile(
            "^\\s*((?:(?:public|protected|private|static|final|abstract|synchronized|native|default)\\s+)+)"
                    + "(?:<[^>]+>\\s+)?(?:([\\w$.]+(?:<[^()]*?>)?(?:\\[])*)\\s+)?([\\w$]+)\\s*\\(");

    static final Pattern PY_DEF = Pattern.compile("^(\\s*)(?:async\\s+)?def\\s+(\\w+)\\s*\\(");

    private static final Set<String> JAVA_NON_METHOD_TYPES = Set.of(
            "class", "interface", "enum", "record", "new", "return", "throw"
    );

    @Override
    public List<ImportStatement> importStatements(String language, List<String> lines) {
        if (SourceLanguages.isScript(language)) {
            return scriptImports(lines);
        }
        return switch (language) {
            case "java" -> javaImports(lines);
            case "python" -> pythonImports(lines);
            default -> List.of();
        };
    }

    @Override
    public List<FunctionDescriptor> functions(String language, List<String> lines) {
        if (SourceLanguages.isScript(language)) {
            return scriptFunctions(lines);
        }
        return switch (language) {
            case "java" -> javaMethods(lines);
            case "python" -> pythonFunctions(lines);
            default -> List.of();
        };
    }

    // ── JavaScript / TypeScript ───────────────────────────────────────────

    private List<ImportStatement> scriptImports(List<String> lines) {
        var result = new ArrayList<ImportStatement>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher from = ES_IMPORT_FROM.matcher(line);
            if (from.matches()) {
                result.add(new ImportStatement(i + 1, i + 1, from.group(2), esBoundNames(from.group(1))));
                continue;
            }

            Matcher sideEffect = ES_IMPORT_SIDE_EFFECT.matcher(line);
            if (sideEffect.matches()) {
                result.add(new ImportStatement(i + 1, i + 1, sideEffect.group(1), List.of()));
                continue;
            }

            if (ES_IMPORT_OPEN.matcher(line).matches()) {
                var joined = new StringBuilder(line);
                int end = i;
                Matcher clause = null;
                while (end + 1 < lines.size()) {
                    end++;
                    joined.append(' ').append(lines.get(end).trim());
                    Matcher candidate = ES_FROM_CLAUSE.matcher(lines.get(end));
                    if (candidate.find()) {
                        clause = candidate;
                        break;
                    }
                }
                if (clause != null) {
                    Matcher full = ES_IMPORT_FROM.matcher(joined.toString());
                    List<String> names = full.matches() ? esBoundNames(full.group(1)) : List.of();
                    result.add(new ImportStatement(i + 1, end + 1, clause.group(1), names));
                    i = end;
                }
                continue;
            }

            Matcher binding = REQUIRE_BINDING.matcher(line);
            if (binding.matches()) {
                String bound = binding.group(1);
                List<String> names = bound.startsWith("{")
                        ? namedSpecifiers(bound.substring(1, bound.length() - 1), ":")
                        : List.of(bound);
                result.add(new ImportStatement(i + 1, i + 1, binding.group(2), names));
                continue;
            }

            // Several statements on one line, or code after the import: targets only, no bindings.
            if (ES_IMPORT_KEYWORD.matcher(line).find()) {
                Matcher specifier = ES_ANY_SPECIFIER.matcher(line);
                boolean found = false;
                while (specifier.find()) {
                    result.add(new ImportStatement(i + 1, i + 1, specifier.group(1), List.of()));
                    found = true;
                }
                if (found) {
                    continue;
                }
            }

            Matcher require = REQUIRE_ANY.matcher(line);
            while (require.find()) {
                result.add(new ImportStatement(i + 1, i + 1, require.group(1), List.of()));
            }
        }
        return result;
    }

    /** Local names bound by an ES import clause such as {@code React, { useState as useS }}. */
    static List<String> esBoundNames(String clause) {
        var names = new ArrayList<String>();
        String rest = clause.trim();
        int open = rest.indexOf('{');
        String head = open >= 0 ? rest.substring(0, open) : rest;
        for (String part : head.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) {
                continue;
            }
            if (p.startsWith("*")) {
                int as = p.indexOf(" as ");
                if (as > 0) {
                    names.add(p.substring(as + 4).trim());
                }
            } else {
                names.add(p);
            }
        }
        if (open >= 0) {
            int close = rest.indexOf('}', open);
            names.addAll(namedSpecifiers(rest.substring(open + 1, close < 0 ? rest.length() : close), " as "));
        }
        return names;
    }

    private static List<String> namedSpecifiers(String inner, String aliasSeparator) {
        var names = new ArrayList<String>();
        for (String part : inner.split(",")) {
            String p = part.trim();
            if (p.startsWith("type ")) {
                p = p.substring(5).trim();
            }
            if (p.isEmpty()) {
                continue;
            }
            int alias = p.indexOf(aliasSeparator);
            names.add(alias >= 0 ? p.substring(alias + aliasSeparator.length()).trim() : p);
        }
        return names;
    }

    private List<FunctionDescriptor> scriptFunctions(List<String> lines) {
        var exportedByList = new HashSet<String>();
        for (String line : lines) {
            Matcher list = ES_EXPORT_LIST.matcher(line);
            if (list.find()) {
                for (String part : list.group(1).split(",")) {
                    String p = part.trim();
                    int as = p.indexOf(" as ");
                    if (!p.isEmpty()) {
                        exportedByList.add(as >= 0 ? p.substring(0, as).trim() : p);
                    }
                }
            }
            Matcher def = ES_EXPORT_DEFAULT_NAME.matcher(line);
            if (def.matches()) {
                exportedByList.add(def.group(1));
            }
        }

        var result = new ArrayList<FunctionDescriptor>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher m = ES_FUNCTION.matcher(line);
            if (!m.find()) {
                m = ES_ARROW.matcher(line);
                if (!m.find()) {
                    m = ES_FUNCTION_EXPRESSION.matcher(line);
                    if (!m.find()) {
                        continue;
                    }
                }
            }
            String name = m.group(2);
            boolean exported = m.group(1) != null || exportedByList.contains(name);
            result.add(new FunctionDescriptor(name, i + 1, braceBlockEnd(lines, i), exported));
        }
        return result;
    }

    // ── Java ──────────────────────────────────────────────────────────────

    private List<ImportStatement> javaImports(List<String> lines) {
        var result = new ArrayList<ImportStatement>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = JAVA_IMPORT.matcher(lines.get(i));
            if (!m.matches()) {
                continue;
            }
            String target = m.group(2);
            List<String> names = target.endsWith(".*")
                    ? List.of()
                    : List.of(target.substring(target.lastIndexOf('.') + 1));
            result.add(new ImportStatement(i + 1, i + 1, target, names));
        }
        return result;
    }

    private List<FunctionDescriptor> javaMethods(List<String> lines) {
        var result = new ArrayList<FunctionDescriptor>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher m = JAVA_METHOD.matcher(line);
            if (!m.find()) {
                continue;
            }
            String type = m.group(2);
            if (type != null && JAVA_NON_METHOD_TYPES.contains(type)) {
                continue;
            }
            boolean exported = m.group(1).contains("public");
            result.add(new FunctionDescriptor(m.group(3), i + 1, braceBlockEnd(lines, i), exported));
        }
        return result;
    }

    // ── Python ────────────────────────────────────────────────────────────

    private List<ImportStatement> pythonImports(List<String> lines) {
        var result = new ArrayList<ImportStatement>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher from = PY_FROM_IMPORT.matcher(line);
            if (from.matches()) {
                String names = from.group(2);
                int end = i;
                if (names.startsWith("(") && !names.contains(")")) {
                    var joined = new StringBuilder(names);
                    while (end + 1 < lines.size() && !lines.get(end).contains(")")) {
                        end++;
                        joined.append(' ').append(lines.get(end).trim());
                    }
                    names = joined.toString();
                }
                names = names.replace("(", "").replace(")", "");
                List<String> bound = names.trim().equals("*") ? List.of() : pythonAliases(names, false);
                result.add(new ImportStatement(i + 1, end + 1, from.group(1), bound));
                i = end;
                continue;
            }

            Matcher plain = PY_IMPORT.matcher(line);
            if (plain.matches()) {
                for (String part : plain.group(1).split(",")) {
                    String module = part.trim();
                    int as = module.indexOf(" as ");
                    String target = as >= 0 ? module.substring(0, as).trim() : module;
                    result.add(new ImportStatement(i + 1, i + 1, target, pythonAliases(module, true)));
                }
            }
        }
        return result;
    }

    private static List<String> pythonAliases(String names, boolean moduleImport) {
        var result = new ArrayList<String>();
        for (String part : names.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) {
                continue;
            }
            int as = p.indexOf(" as ");
            if (as >= 0) {
                result.add(p.substring(as + 4).trim());
            } else if (moduleImport) {
                // "import os.path" binds "os"
                int dot = p.indexOf('.');
                result.add(dot >= 0 ? p.substring(0, dot) : p);
            } else {
                result.add(p);
            }
        }
        return result;
    }

    private List<FunctionDescriptor> pythonFunctions(List<String> lines) {
        var result = new ArrayList<FunctionDescriptor>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = PY_DEF.matcher(lines.get(i));
            if (!m.find()) {
                continue;
            }
            int indent = indentation(lines.get(i));
            int end = i;
            for (int j = i + 1; j < lines.size(); j++) {
                String next = lines.get(j);
                if (next.isBlank()) {
                    continue;
                }
                if (indentation(next) <= indent) {
                    break;
                }
                end = j;
            }
            String name = m.group(2);
            result.add(new FunctionDescriptor(name, i + 1, end + 1, !name.startsWith("_")));
        }
        return result;
    }

    // ── Shared helpers ────────────────────────────────────────────────────

    /**
     * 1-based line on which the brace block opened at or after {@code startIdx} closes.
     * A declaration that ends with {@code ;} before any brace opens ends on that line.
     */
    static int braceBlockEnd(List<String> lines, int startIdx) {
        int depth = 0;
        boolean opened = false;
        for (int i = startIdx; i < lines.size(); i++) {
            String code = stripLiterals(lines.get(i));
            for (int c = 0; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '{') {
                    depth++;
                    opened = true;
                } else if (ch == '}') {
                    depth--;
                    if (opened && depth <= 0) {
                        return i + 1;
                    }
                }
            }
            if (!opened && code.trim().endsWith(";")) {
                return i + 1;
            }
        }
        return opened ? lines.size() : startIdx + 1;
    }

    /** Blanks out quoted string contents and drops a trailing line comment. */
    public static String stripLiterals(String line) {
        var out = new StringBuilder(line.length());
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quote != 0) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                    out.append(ch);
                }
                continue;
            }
            if (ch == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            }
            if (ch == '"' || ch == '\'' || ch == '`') {
                quote = ch;
            }
            out.append(ch);
        }
        return out.toString();
    }

    private static int indentation(String line) {
        int n = 0;
        while (n < line.length() && Character.isWhitespace(line.charAt(n))) {
            n++;
        }
        return n;
    }
}
