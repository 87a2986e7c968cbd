package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import com.changeguard.core.model.PublishResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.stream.Collectors;

@Command(name = "publish", mixinStandardHelpOptions = true,
        description = "Apply changes on a new branch, push it and open a review request")
@Component
public class PublishCommand extends CommandSupport {

    @Parameters(arity = "1..*", description = "Change IDs")
    private List<String> changeIds;

    @Option(names = {"--branch", "-b"}, required = true, description = "Branch to create")
    private String branch;

    @Option(names = {"--title", "-t"}, required = true, description = "Commit message and review title")
    private String title;

    @Option(names = {"--description", "-d"}, defaultValue = "", description = "Review request body")
    private String description;

    private final ChangeManager changeManager;

    public PublishCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        ConsoleOutput.info("Publishing %d change(s) on '%s'".formatted(changeIds.size(), branch));
        PublishResult result = changeManager.publishChanges(changeIds, branch, title, description);

        String steps = result.completedSteps().stream().map(Enum::name).collect(Collectors.joining(" -> "));
        if (result.success()) {
            ConsoleOutput.success("Completed: " + steps);
            ConsoleOutput.success("Commit " + result.commitSha());
            ConsoleOutput.success("Review: " + result.reviewUrl());
            return 0;
        }
        ConsoleOutput.error("Failed at %s: %s".formatted(result.failedStep(), result.failureReason()));
        if (!steps.isEmpty()) {
            ConsoleOutput.info("Completed before failure: " + steps);
        }
        if (result.rolledBack()) {
            ConsoleOutput.info("All written files were restored");
            return 1;
        }
        ConsoleOutput.error("MANUAL INTERVENTION REQUIRED: some files could not be restored");
        result.restoreFailures().forEach(ConsoleOutput::error);
        return 2;
    }
}
