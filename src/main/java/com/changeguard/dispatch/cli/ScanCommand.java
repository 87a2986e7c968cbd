package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import com.changeguard.core.cleanup.CleanupScanner;
import com.changeguard.core.config.WorkspaceProperties;
import com.changeguard.core.exception.ChangeguardException;
import com.changeguard.core.model.ChangeRecord;
import com.changeguard.core.model.CleanupOpportunity;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;

@Command(name = "scan", mixinStandardHelpOptions = true,
        description = "Scan a file or directory for mechanical cleanup opportunities")
@Component
public class ScanCommand extends CommandSupport {

    @Parameters(index = "0", arity = "0..1", description = "File or directory (default: workspace root)")
    private Path path;

    @Option(names = "--propose", description = "Turn every fixable finding into a pending change")
    private boolean propose;

    private final CleanupScanner scanner;
    private final ChangeManager changeManager;
    private final WorkspaceProperties workspace;

    public ScanCommand(CleanupScanner scanner, ChangeManager changeManager, WorkspaceProperties workspace) {
        this.scanner = scanner;
        this.changeManager = changeManager;
        this.workspace = workspace;
    }

    @Override
    protected int execute() {
        Path target = path != null ? path : workspace.rootPath();
        List<CleanupOpportunity> found = scanner.scanForCleanup(target);
        if (found.isEmpty()) {
            ConsoleOutput.success("Nothing to clean up");
            return 0;
        }
        found.forEach(ConsoleOutput::opportunity);
        ConsoleOutput.info(found.size() + " opportunit" + (found.size() == 1 ? "y" : "ies") + " found");
        if (!propose) {
            return 0;
        }

        int proposed = 0;
        int failed = 0;
        for (CleanupOpportunity opportunity : found) {
            if (opportunity.proposedContent() == null) {
                continue;
            }
            try {
                ChangeRecord record = changeManager.proposeCleanup(opportunity);
                ConsoleOutput.change(record);
                proposed++;
            } catch (ChangeguardException e) {
                ConsoleOutput.error(opportunity.filePath() + ": " + e.getMessage());
                failed++;
            }
        }
        ConsoleOutput.success(proposed + " change(s) proposed");
        return failed == 0 ? 0 : 1;
    }
}
