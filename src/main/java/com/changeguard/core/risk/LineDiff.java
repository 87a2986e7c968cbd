package com.changeguard.core.risk;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-level diff between two texts.
 * <p>
 * Output lists removed lines as {@code "- text"} and added lines as {@code "+ text"}, each run
 * preceded by an {@code "@@ -a +b @@"} header giving the 1-based line in the old and new text.
 * Uses a longest-common-subsequence alignment; inputs too large for the quadratic table fall back
 * to a position-by-position comparison.
 */
public final class LineDiff {

    static final long MAX_TABLE_CELLS = 4_000_000L;

    private LineDiff() {
        // utility class
    }

    public static String diff(String oldText, String newText) {
        List<String> oldLines = oldText == null ? List.of() : oldText.lines().toList();
        List<String> newLines = newText == null ? List.of() : newText.lines().toList();
        return String.join("\n", diffLines(oldLines, newLines));
    }

    static List<String> diffLines(List<String> a, List<String> b) {
        if ((long) a.size() * b.size() > MAX_TABLE_CELLS) {
            return positional(a, b);
        }
        int n = a.size();
        int m = b.size();
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = a.get(i).equals(b.get(j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }

        var out = new ArrayList<String>();
        var hunk = new ArrayList<String>();
        int i = 0;
        int j = 0;
        int hunkOld = -1;
        int hunkNew = -1;
        while (i < n || j < m) {
            if (i < n && j < m && a.get(i).equals(b.get(j))) {
                flush(out, hunk, hunkOld, hunkNew);
                hunkOld = -1;
                i++;
                j++;
                continue;
            }
            if (hunkOld < 0) {
                hunkOld = i + 1;
                hunkNew = j + 1;
            }
            if (i < n && (j == m || lcs[i + 1][j] >= lcs[i][j + 1])) {
                hunk.add("- " + a.get(i++));
            } else {
                hunk.add("+ " + b.get(j++));
            }
        }
        flush(out, hunk, hunkOld, hunkNew);
        return out;
    }

    private static List<String> positional(List<String> a, List<String> b) {
        var out = new ArrayList<String>();
        var hunk = new ArrayList<String>();
        int hunkStart = -1;
        int max = Math.max(a.size(), b.size());
        for (int i = 0; i < max; i++) {
            String oldLine = i < a.size() ? a.get(i) : null;
            String newLine = i < b.size() ? b.get(i) : null;
            if (oldLine != null && oldLine.equals(newLine)) {
                flush(out, hunk, hunkStart, hunkStart);
                hunkStart = -1;
                continue;
            }
            if (hunkStart < 0) {
                hunkStart = i + 1;
            }
            if (oldLine != null) {
                hunk.add("- " + oldLine);
            }
            if (newLine != null) {
                hunk.add("+ " + newLine);
            }
        }
        flush(out, hunk, hunkStart, hunkStart);
        return out;
    }

    private static void flush(List<String> out, List<String> hunk, int oldLine, int newLine) {
        if (hunk.isEmpty()) {
            return;
        }
        out.add("@@ -%d +%d @@".formatted(oldLine, newLine));
        out.addAll(hunk);
        hunk.clear();
    }

    /**
     * Changed-line count of a diff produced by {@link #diff}: the larger of the added and removed
     * line counts, so that editing a line in place counts once.
     */
    public static int changedLines(String diff) {
        if (diff == null || diff.isEmpty()) {
            return 0;
        }
        int added = 0;
        int removed = 0;
        for (String line : diff.lines().toList()) {
            if (line.startsWith("+ ")) {
                added++;
            } else if (line.startsWith("- ")) {
                removed++;
            }
        }
        return Math.max(added, removed);
    }
}
