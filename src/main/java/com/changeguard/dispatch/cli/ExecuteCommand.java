package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import com.changeguard.core.model.ChangeRecord;
import com.changeguard.core.model.ChangeStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "execute", mixinStandardHelpOptions = true,
        description = "Back up the target file and write an approved change")
@Component
public class ExecuteCommand extends CommandSupport {

    @Parameters(index = "0", description = "Change ID")
    private String changeId;

    private final ChangeManager changeManager;

    public ExecuteCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        return report(changeManager.executeChange(changeId));
    }

    static int report(ChangeRecord record) {
        if (record.status() == ChangeStatus.APPLIED) {
            ConsoleOutput.success("Applied " + record.id());
            ConsoleOutput.change(record);
            return 0;
        }
        ConsoleOutput.error("Change " + record.id() + " failed; the original file was restored");
        ConsoleOutput.change(record);
        return 1;
    }
}
