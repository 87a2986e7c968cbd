package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "rollback", mixinStandardHelpOptions = true,
        description = "Restore the pre-write content of an applied change")
@Component
public class RollbackCommand extends CommandSupport {

    @Parameters(index = "0", description = "Change ID")
    private String changeId;

    @Option(names = {"--reason", "-r"}, defaultValue = "Rolled back by operator", description = "Reason recorded on the change")
    private String reason;

    private final ChangeManager changeManager;

    public RollbackCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        var record = changeManager.rollbackChange(changeId, reason);
        ConsoleOutput.success("Rolled back " + record.id());
        ConsoleOutput.change(record);
        return 0;
    }
}
