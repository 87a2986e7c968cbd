package com.changeguard.dispatch.cli;

import com.changeguard.core.health.HealthCheckService;
import com.changeguard.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.List;

@Command(name = "health", mixinStandardHelpOptions = true, description = "Check backups, change store, git and model access")
@Component
public class HealthCommand extends CommandSupport {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    protected int execute() {
        List<HealthStatus> results = healthCheckService.checkAll();

        boolean allUp = true;
        for (HealthStatus result : results) {
            String icon = switch (result.status()) {
                case UP -> "@|fg(green) +|@";
                case DEGRADED -> "@|fg(yellow) ~|@";
                case DOWN -> "@|fg(red) x|@";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    icon + " " + result.component() + ": " + result.detail()));
            if (result.status() != HealthStatus.Status.UP) {
                allUp = false;
            }
        }

        System.out.println();
        if (allUp) {
            ConsoleOutput.success("All systems operational");
        } else {
            ConsoleOutput.info("Some components are degraded or down");
        }
        boolean anyDown = results.stream().anyMatch(r -> r.status() == HealthStatus.Status.DOWN);
        return anyDown ? 1 : 0;
    }
}
