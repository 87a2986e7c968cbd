package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "retry", mixinStandardHelpOptions = true,
        description = "Send a failed change back to pending with a fresh assessment")
@Component
public class RetryCommand extends CommandSupport {

    @Parameters(index = "0", description = "Change ID")
    private String changeId;

    private final ChangeManager changeManager;

    public RetryCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        var record = changeManager.retryChange(changeId);
        ConsoleOutput.success("Retrying " + record.id());
        ConsoleOutput.change(record);
        return 0;
    }
}
