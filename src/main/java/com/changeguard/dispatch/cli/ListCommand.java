package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import com.changeguard.core.model.ChangeRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

@Command(name = "list", mixinStandardHelpOptions = true, description = "List changes (pending by default)")
@Component
public class ListCommand extends CommandSupport {

    @ArgGroup(exclusive = true)
    private Filter filter;

    static class Filter {
        @Option(names = "--pending", description = "Pending changes only")
        boolean pending;

        @Option(names = "--applied", description = "Applied changes only")
        boolean applied;

        @Option(names = "--all", description = "Every recorded change")
        boolean all;
    }

    private final ChangeManager changeManager;

    public ListCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        List<ChangeRecord> changes;
        if (filter != null && filter.all) {
            changes = changeManager.getAllChanges();
        } else if (filter != null && filter.applied) {
            changes = changeManager.getAppliedChanges();
        } else {
            changes = changeManager.getPendingChanges();
        }
        if (changes.isEmpty()) {
            ConsoleOutput.info("No changes found.");
            return 0;
        }
        changes.forEach(ConsoleOutput::change);
        return 0;
    }
}
