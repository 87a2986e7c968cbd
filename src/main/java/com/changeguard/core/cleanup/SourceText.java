package com.changeguard.core.cleanup;

import java.util.List;

/**
 * File content split into lines, remembering the line separator and whether the text ended with
 * one, so that an edited line list joins back into the same layout.
 */
record SourceText(List<String> lines, String separator, boolean trailingNewline) {

    static SourceText of(String content) {
        String separator = content.contains("\r\n") ? "\r\n" : "\n";
        boolean trailing = content.endsWith("\n");
        return new SourceText(content.lines().toList(), separator, trailing);
    }

    String join(List<String> newLines) {
        if (newLines.isEmpty()) {
            return "";
        }
        String body = String.join(separator, newLines);
        return trailingNewline ? body + separator : body;
    }
}
