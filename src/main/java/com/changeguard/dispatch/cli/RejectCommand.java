package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "reject", mixinStandardHelpOptions = true, description = "Reject a pending or approved change")
@Component
public class RejectCommand extends CommandSupport {

    @Parameters(index = "0", description = "Change ID")
    private String changeId;

    @Option(names = {"--reason", "-r"}, defaultValue = "Rejected by reviewer", description = "Reason recorded on the change")
    private String reason;

    private final ChangeManager changeManager;

    public RejectCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        ConsoleOutput.change(changeManager.rejectChange(changeId, reason));
        return 0;
    }
}
