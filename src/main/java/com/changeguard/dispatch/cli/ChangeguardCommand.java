package com.changeguard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "changeguard",
        mixinStandardHelpOptions = true,
        version = "changeguard 0.1.0",
        description = "Risk-gated change management for a source tree",
        subcommands = {
                IndexCommand.class,
                SearchCommand.class,
                ScanCommand.class,
                ProposeCommand.class,
                ApproveCommand.class,
                RejectCommand.class,
                ExecuteCommand.class,
                RollbackCommand.class,
                RetryCommand.class,
                ListCommand.class,
                ShowCommand.class,
                StatsCommand.class,
                PublishCommand.class,
                BackupsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ChangeguardCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
