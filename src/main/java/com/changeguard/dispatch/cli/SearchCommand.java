package com.changeguard.dispatch.cli;

import com.changeguard.core.config.WorkspaceProperties;
import com.changeguard.core.indexer.CodebaseIndexer;
import com.changeguard.core.model.SourceFileIndex;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

@Command(name = "search", mixinStandardHelpOptions = true,
        description = "Find indexed files whose relative path matches a regular expression")
@Component
public class SearchCommand extends CommandSupport {

    @Parameters(index = "0", description = "Regular expression matched against relative paths")
    private String pattern;

    private final CodebaseIndexer indexer;
    private final WorkspaceProperties workspace;

    public SearchCommand(CodebaseIndexer indexer, WorkspaceProperties workspace) {
        this.indexer = indexer;
        this.workspace = workspace;
    }

    @Override
    protected int execute() {
        indexer.indexCodebase(workspace.rootPath());
        List<SourceFileIndex> matches = indexer.searchFiles(pattern).toList();
        if (matches.isEmpty()) {
            ConsoleOutput.info("No files match '" + pattern + "'");
            return 0;
        }
        matches.forEach(f -> System.out.printf("  %s  [%s]%n", f.path(), f.language()));
        ConsoleOutput.success(matches.size() + " file(s) found");
        return 0;
    }
}
