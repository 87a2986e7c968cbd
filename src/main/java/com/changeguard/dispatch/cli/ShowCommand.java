package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import com.changeguard.core.model.ChangeRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "show", mixinStandardHelpOptions = true, description = "Show one change with its assessment")
@Component
public class ShowCommand extends CommandSupport {

    @Parameters(index = "0", description = "Change ID")
    private String changeId;

    @Option(names = "--diff", description = "Print the line diff")
    private boolean showDiff;

    private final ChangeManager changeManager;

    public ShowCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        ChangeRecord record = changeManager.getChange(changeId);
        ConsoleOutput.change(record);
        System.out.println("      origin: " + record.originModel()
                + (record.rationale() != null ? " (" + record.rationale() + ")" : ""));
        if (record.assessment() != null) {
            ConsoleOutput.assessment(record.assessment());
        }
        if (showDiff && record.diff() != null) {
            System.out.println();
            System.out.print(record.diff());
        }
        return 0;
    }
}
