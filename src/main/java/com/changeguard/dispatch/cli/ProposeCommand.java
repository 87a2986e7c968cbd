package com.changeguard.dispatch.cli;

import com.changeguard.core.change.ChangeManager;
import com.changeguard.core.exception.FileAccessException;
import com.changeguard.core.model.ChangeKind;
import com.changeguard.core.model.ChangeRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Command(name = "propose", mixinStandardHelpOptions = true,
        description = "Propose a change to one file and show its risk assessment")
@Component
public class ProposeCommand extends CommandSupport {

    @Parameters(index = "0", description = "Target file")
    private String filePath;

    @Option(names = {"--kind", "-k"}, defaultValue = "UPDATE",
            description = "Change kind: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ChangeKind kind;

    @Option(names = {"--description", "-d"}, defaultValue = "", description = "What the change does")
    private String description;

    @ArgGroup(exclusive = true)
    private ContentSource content;

    @Option(names = {"--model", "-m"}, description = "Model for --generate (default: configured model)")
    private String model;

    @Option(names = "--origin", defaultValue = "cli", description = "Proposer recorded on the change")
    private String origin;

    @Option(names = "--rationale", description = "Why the change is wanted")
    private String rationale;

    static class ContentSource {
        @Option(names = "--content-file", description = "File holding the full new content")
        Path contentFile;

        @Option(names = "--generate", description = "Instruction for the code-generation model")
        String instruction;
    }

    private final ChangeManager changeManager;

    public ProposeCommand(ChangeManager changeManager) {
        this.changeManager = changeManager;
    }

    @Override
    protected int execute() {
        ChangeRecord record;
        if (content != null && content.instruction != null) {
            ConsoleOutput.info("Generating content for " + filePath + "...");
            record = changeManager.proposeGeneratedChange(filePath, kind, content.instruction, model);
        } else {
            String newContent = content != null && content.contentFile != null ? read(content.contentFile) : null;
            if (newContent == null && kind != ChangeKind.DELETE) {
                throw new IllegalArgumentException("--content-file or --generate is required for " + kind);
            }
            record = changeManager.proposeChange(filePath, kind, description, newContent, origin, rationale);
        }

        ConsoleOutput.success("Proposed " + record.id());
        ConsoleOutput.change(record);
        if (record.assessment() != null) {
            ConsoleOutput.assessment(record.assessment());
        }
        return 0;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new FileAccessException(file, "Cannot read content file", e);
        }
    }
}
