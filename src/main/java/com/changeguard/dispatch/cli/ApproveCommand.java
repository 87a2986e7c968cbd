package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import com.changeguard.core.model.ChangeRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "approve", mixinStandardHelpOptions = true,
        description = "Approve a pending change after re-assessing it against the current file")
@Component
public class ApproveCommand extends CommandSupport {

    @Parameters(index = "0", description = "Change ID")
    private String changeId;

    @Option(names = {"--execute", "-x"}, description = "Write the change right after approving it")
    private boolean execute;

    private final ChangeManager changeManager;

    public ApproveCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        ChangeRecord record = changeManager.approveChange(changeId);
        ConsoleOutput.success("Approved " + record.id());
        if (record.assessment() != null) {
            ConsoleOutput.assessment(record.assessment());
        }
        if (!execute) {
            return 0;
        }
        return ExecuteCommand.report(changeManager.executeChange(changeId));
    }
}
