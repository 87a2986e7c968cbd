package com.changeguard.core.indexer;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extension-based language tags.
 */
public final class SourceLanguages {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry(".ts", "typescript"),
            Map.entry(".tsx", "typescript-react"),
            Map.entry(".js", "javascript"),
            Map.entry(".mjs", "javascript"),
            Map.entry(".cjs", "javascript"),
            Map.entry(".jsx", "javascript-react"),
            Map.entry(".java", "java"),
            Map.entry(".py", "python"),
            Map.entry(".json", "json"),
            Map.entry(".md", "markdown"),
            Map.entry(".prisma", "prisma-schema"),
            Map.entry(".yml", "yaml"),
            Map.entry(".yaml", "yaml")
    );

    private static final Set<String> SCRIPT_FAMILY = Set.of(
            "typescript", "typescript-react", "javascript", "javascript-react"
    );

    private SourceLanguages() {
        // utility class
    }

    public static String detect(String fileName) {
        return BY_EXTENSION.getOrDefault(extension(fileName), UNKNOWN);
    }

    /** Lower-cased extension including the dot, or an empty string. */
    public static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    public static boolean isScript(String language) {
        return SCRIPT_FAMILY.contains(language);
    }

    /** Languages whose files may carry implicit JSX references to an imported React binding. */
    public static boolean isJsx(String language) {
        return "typescript-react".equals(language) || "javascript-react".equals(language);
    }
}
