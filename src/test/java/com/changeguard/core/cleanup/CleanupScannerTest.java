package com.changeguard.core.cleanup;

import com.changeguard.core.exception.FileAccessException;
import com.changeguard.core.indexer.CodebaseIndexer;
import com.changeguard.core.indexer.HeuristicSourceExtractor;
import com.changeguard.core.indexer.IndexerProperties;
import com.changeguard.core.model.CleanupOpportunity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CleanupScannerTest {

    @TempDir
    Path tempDir;

    private CleanupScanner scanner;

    @BeforeEach
    void setUp() {
        var extractor = new HeuristicSourceExtractor();
        scanner = new CleanupScanner(new CodebaseIndexer(new IndexerProperties(), extractor), extractor);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    private List<CleanupOpportunity> ofType(List<CleanupOpportunity> all, String type) {
        return all.stream().filter(o -> o.type().equals(type)).toList();
    }

    // ── Unused imports ───────────────────────────────────────────────

    @Nested
    @DisplayName("unused imports")
    class UnusedImports {

        @Test
        @DisplayName("removes a provably unused single-line import and flags it auto-applicable")
        void removesUnusedScriptImport() throws IOException {
            Path file = write("app.ts", """
                    import { a } from './a';
                    import { b } from './b';
                    console.log(a);
                    """);

            CleanupOpportunity op = scanner.removeUnusedImports(file).orElseThrow();

            assertEquals(CleanupScanner.REMOVE_UNUSED_IMPORT, op.type());
            assertTrue(op.autoApply());
            assertEquals(2, op.line());
            assertEquals(file.toAbsolutePath().normalize().toString(), op.filePath());
            assertEquals("import { a } from './a';\nconsole.log(a);\n", op.proposedContent());
        }

        @Test
        @DisplayName("reports nothing when every import is referenced")
        void allUsed() throws IOException {
            Path file = write("Used.java", """
                    import java.util.List;

                    class Used { List<String> names; }
                    """);

            assertTrue(scanner.removeUnusedImports(file).isEmpty());
        }

        @Test
        @DisplayName("removes an unused Java import")
        void javaImport() throws IOException {
            Path file = write("A.java", """
                    import java.util.List;
                    import java.util.Map;

                    class A { List<String> x; }
                    """);

            CleanupOpportunity op = scanner.removeUnusedImports(file).orElseThrow();

            assertTrue(op.autoApply());
            assertEquals("import java.util.List;\n\nclass A { List<String> x; }\n", op.proposedContent());
        }

        @Test
        @DisplayName("never auto-removes React from a JSX file")
        void keepsReactInJsx() throws IOException {
            Path file = write("App.jsx", """
                    import React from 'react';
                    export default function App() {
                      return <div/>;
                    }
                    """);

            CleanupOpportunity op = scanner.removeUnusedImports(file).orElseThrow();

            assertFalse(op.autoApply());
            assertNull(op.proposedContent(), "nothing is safe to remove, so no fix is offered");
        }

        @Test
        @DisplayName("keeps a line that also imports a used name")
        void sharedLineKept() throws IOException {
            Path file = write("tool.py", """
                    import os, sys
                    print(os.getcwd())
                    """);

            CleanupOpportunity op = scanner.removeUnusedImports(file).orElseThrow();

            assertTrue(op.description().contains("sys"));
            assertFalse(op.autoApply());
            assertNull(op.proposedContent());
        }

        @Test
        @DisplayName("partially fixable files are offered the fix but not auto-applied")
        void partialFix() throws IOException {
            Path file = write("mod.py", """
                    import json
                    from typing import (
                        List,
                    )
                    x = 1
                    """);

            CleanupOpportunity op = scanner.removeUnusedImports(file).orElseThrow();

            assertFalse(op.autoApply());
            assertEquals("from typing import (\n    List,\n)\nx = 1\n", op.proposedContent());
        }

        @Test
        @DisplayName("keeps CRLF line endings in the proposed content")
        void keepsLineEndings() throws IOException {
            Path file = write("crlf.py", "import os\r\nprint(1)\r\n");

            assertEquals("print(1)\r\n", scanner.removeUnusedImports(file).orElseThrow().proposedContent());
        }

        @Test
        @DisplayName("never removes used imports that share a line")
        void twoImportsOnOneLine() throws IOException {
            Path file = write("both.js", """
                    import a from './a'; import b from './b';
                    console.log(a, b);
                    """);

            assertTrue(scanner.removeUnusedImports(file).isEmpty());
            assertTrue(ofType(scanner.scanForCleanup(file), CleanupScanner.REMOVE_UNUSED_IMPORT).isEmpty());
        }

        @Test
        @DisplayName("leaves an import line alone when code follows the statement")
        void importWithTrailingCode() throws IOException {
            Path file = write("boot.js", """
                    import fs from 'fs'; fs.readFileSync('x');
                    console.log(1);
                    """);

            assertTrue(scanner.removeUnusedImports(file).isEmpty());
        }

        @Test
        @DisplayName("bindings that are not plain identifiers are reported but never auto-applied")
        void ambiguousPythonLine() throws IOException {
            Path file = write("multi.py", """
                    import os; import sys
                    print(sys.argv)
                    """);

            CleanupOpportunity op = scanner.removeUnusedImports(file).orElseThrow();

            assertFalse(op.autoApply());
            assertNull(op.proposedContent());
        }

        @Test
        @DisplayName("a line holds a sole statement only when nothing follows its terminator")
        void soleStatement() {
            assertTrue(CleanupScanner.isSoleStatement("import a from './a';"));
            assertTrue(CleanupScanner.isSoleStatement("import x from 'semi;colon'"));
            assertFalse(CleanupScanner.isSoleStatement("import a from './a'; import b from './b';"));
            assertFalse(CleanupScanner.isSoleStatement("import os  # noqa"));
        }

        @Test
        @DisplayName("identifier boundaries include $ and _")
        void referenceBoundaries() {
            assertTrue(CleanupScanner.isReferenced("x = a + 1", "a"));
            assertFalse(CleanupScanner.isReferenced("x = a$b", "a"));
            assertFalse(CleanupScanner.isReferenced("x = a_b", "a"));
            assertTrue(CleanupScanner.isReferenced("a.b()", "a"));
        }
    }

    // ── Whitespace ───────────────────────────────────────────────────

    @Nested
    @DisplayName("whitespace")
    class Whitespace {

        @Test
        @DisplayName("strips trailing whitespace but requires review")
        void trailingWhitespace() throws IOException {
            Path file = write("ws.js", "const a = 1;   \nconst b = 2;\t\nconst c = 3;\n");

            List<CleanupOpportunity> found = ofType(scanner.scanForCleanup(file), CleanupScanner.TRAILING_WHITESPACE);

            assertEquals(1, found.size());
            CleanupOpportunity op = found.get(0);
            assertFalse(op.autoApply());
            assertEquals(1, op.line());
            assertTrue(op.description().contains("2 line(s)"));
            assertEquals("const a = 1;\nconst b = 2;\nconst c = 3;\n", op.proposedContent());
        }

        @Test
        @DisplayName("collapses runs of three or more blank lines to one")
        void blankRuns() throws IOException {
            Path file = write("blank.js", "a();\n\n\n\nb();\n\n\nc();\n");

            List<CleanupOpportunity> found = ofType(scanner.scanForCleanup(file), CleanupScanner.EXCESS_BLANK_LINES);

            assertEquals(1, found.size());
            assertEquals(2, found.get(0).line());
            assertFalse(found.get(0).autoApply());
            assertEquals("a();\n\nb();\n\n\nc();\n", found.get(0).proposedContent());
        }
    }

    // ── Documentation ────────────────────────────────────────────────

    @Nested
    @DisplayName("documentation")
    class Documentation {

        @Test
        @DisplayName("inserts a Javadoc skeleton above annotations of an undocumented public method")
        void javaSkeleton() throws IOException {
            Path file = write("Svc.java", """
                    public class Svc {
                        @Override
                        public String toString() {
                            return "svc";
                        }
                    }
                    """);

            List<CleanupOpportunity> found = ofType(scanner.scanForCleanup(file), CleanupScanner.ADD_DOCS);

            assertEquals(1, found.size());
            CleanupOpportunity op = found.get(0);
            assertFalse(op.autoApply());
            assertEquals(3, op.line());
            assertEquals("""
                    public class Svc {
                        /**
                         * toString
                         */
                        @Override
                        public String toString() {
                            return "svc";
                        }
                    }
                    """, op.proposedContent());
        }

        @Test
        @DisplayName("skips functions that already carry a comment and private ones")
        void documentedAndPrivateSkipped() throws IOException {
            Path file = write("lib.js", """
                    /** Adds. */
                    export function add(a, b) {
                      return a + b;
                    }
                    function hidden() {
                      return 0;
                    }
                    """);

            assertTrue(ofType(scanner.scanForCleanup(file), CleanupScanner.ADD_DOCS).isEmpty());
        }

        @Test
        @DisplayName("adds a docstring below an undocumented Python def")
        void pythonDocstring() throws IOException {
            Path file = write("calc.py", """
                    def run(x):
                        return x

                    def documented():
                        \"\"\"Has one.\"\"\"
                        pass
                    """);

            CleanupOpportunity op = ofType(scanner.scanForCleanup(file), CleanupScanner.ADD_DOCS).get(0);

            assertTrue(op.description().contains("run"));
            assertFalse(op.description().contains("documented"));
            assertTrue(op.proposedContent().startsWith("def run(x):\n    \"\"\"run.\"\"\"\n    return x\n"));
        }
    }

    // ── Scan entry point ─────────────────────────────────────────────

    @Test
    @DisplayName("directory scans cover every indexed file, ordered by path then line")
    void directoryScan() throws IOException {
        write("b.js", "const b = 1;  \n");
        write("a.js", "import { x } from './x';\nconst y = 1;  \n");

        List<CleanupOpportunity> found = scanner.scanForCleanup(tempDir);

        assertEquals(3, found.size());
        assertTrue(found.get(0).filePath().endsWith("a.js"));
        assertEquals(CleanupScanner.REMOVE_UNUSED_IMPORT, found.get(0).type());
        assertEquals(CleanupScanner.TRAILING_WHITESPACE, found.get(1).type());
        assertTrue(found.get(2).filePath().endsWith("b.js"));
    }

    @Test
    @DisplayName("scanning a missing path fails")
    void missingPath() {
        assertThrows(FileAccessException.class, () -> scanner.scanForCleanup(tempDir.resolve("nope")));
    }

    @Test
    @DisplayName("scanning never modifies files")
    void readOnly() throws IOException {
        String content = "import os\n\n\n\nx = 1   \n";
        Path file = write("r.py", content);

        scanner.scanForCleanup(tempDir);

        assertEquals(content, Files.readString(file));
    }
}
