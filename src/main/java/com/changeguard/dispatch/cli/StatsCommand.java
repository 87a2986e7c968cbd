package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import com.changeguard.core.model.ChangeStatistics;
import com.changeguard.core.model.ChangeStatus;
import com.changeguard.core.model.RiskCategory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show change counts by status and risk")
@Component
public class StatsCommand extends CommandSupport {

    private final ChangeManager changeManager;

    public StatsCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        ChangeStatistics stats = changeManager.getStatistics();
        ConsoleOutput.info("Total changes: " + stats.total());
        System.out.println("  By status:");
        for (ChangeStatus status : ChangeStatus.values()) {
            System.out.printf("    %-10s %d%n", status, stats.count(status));
        }
        System.out.println("  By risk:");
        for (RiskCategory category : RiskCategory.values()) {
            System.out.printf("    %-10s %d%n", category, stats.byCategory().getOrDefault(category, 0L));
        }
        return 0;
    }
}
