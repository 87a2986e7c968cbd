package com.changeguard.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges Spring Boot and picocli: the parsed command's exit code becomes the process exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ChangeguardCommand changeguardCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ChangeguardCommand changeguardCommand, IFactory factory) {
        this.changeguardCommand = changeguardCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(changeguardCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
