package com.changeguard.dispatch.cli;

import com.changeguard.core.config.WorkspaceProperties;
import com.changeguard.core.indexer.CodebaseIndexer;
import com.changeguard.core.model.SourceFileIndex;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

@Command(name = "index", mixinStandardHelpOptions = true, description = "Index source files under a directory")
@Component
public class IndexCommand extends CommandSupport {

    @Parameters(index = "0", arity = "0..1", description = "Directory to index (default: workspace root)")
    private Path path;

    @Option(names = {"--files", "-f"}, description = "List every indexed file")
    private boolean listFiles;

    private final CodebaseIndexer indexer;
    private final WorkspaceProperties workspace;

    public IndexCommand(CodebaseIndexer indexer, WorkspaceProperties workspace) {
        this.indexer = indexer;
        this.workspace = workspace;
    }

    @Override
    protected int execute() {
        Path root = path != null ? path : workspace.rootPath();
        ConsoleOutput.info("Indexing " + root.toAbsolutePath().normalize());

        Map<String, SourceFileIndex> index = indexer.indexCodebase(root);
        Map<String, Integer> byLanguage = new TreeMap<>();
        int functions = 0;
        for (SourceFileIndex file : index.values()) {
            byLanguage.merge(file.language(), 1, Integer::sum);
            functions += file.functions().size();
        }

        ConsoleOutput.success("Indexed %d file(s), %d function(s)".formatted(index.size(), functions));
        byLanguage.forEach((language, count) -> System.out.printf("  %-12s %d%n", language, count));
        if (listFiles) {
            index.values().forEach(f -> System.out.printf("  %s  (%d lines, %d imports, %d functions)%n",
                    f.path(), f.lineCount(), f.imports().size(), f.functions().size()));
        }
        return 0;
    }
}
