package com.changeguard.dispatch.cli;

import com.changeguard.core.model.ChangeRecord;
import com.changeguard.core.model.CleanupOpportunity;
import com.changeguard.core.model.RiskAssessment;
import com.changeguard.core.model.RiskCategory;
import com.changeguard.core.model.RiskFactor;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Changeguard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CHANGEGUARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CHANGEGUARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void change(ChangeRecord record) {
        String status = switch (record.status()) {
            case APPLIED -> "@|fg(green) APPLIED|@";
            case FAILED -> "@|fg(red) FAILED|@";
            case REJECTED -> "@|fg(magenta) REJECTED|@";
            case APPROVED -> "@|fg(cyan) APPROVED|@";
            case PENDING -> "@|fg(yellow) PENDING|@";
        };
        String score = record.riskScore() == null ? "-" : record.riskScore() + "/10";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + record.id() + "  " + record.kind() + " " + record.filePath()
                        + "  risk " + score));
        if (record.description() != null && !record.description().isBlank()) {
            System.out.println("      " + record.description());
        }
        if (record.errorMessage() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("      @|fg(red) error:|@ " + record.errorMessage()));
        }
        if (record.rejectReason() != null) {
            System.out.println("      reason: " + record.rejectReason());
        }
        if (record.backup() != null && record.backup().backupPath() != null) {
            System.out.println("      backup: " + record.backup().backupPath());
        }
        if (record.remoteReference() != null) {
            System.out.println("      review: " + record.remoteReference());
        }
    }

    public static void assessment(RiskAssessment assessment) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold Risk|@ " + colored(assessment.category(), assessment.score() + "/10 " + assessment.category())
                        + " -> " + assessment.recommendation()));
        for (RiskFactor factor : assessment.factors()) {
            System.out.printf("    %-20s +%-3d %s%n", factor.name(), factor.impact(), factor.description());
        }
    }

    public static void opportunity(CleanupOpportunity opportunity) {
        String flag = opportunity.autoApply() ? "@|fg(green) auto|@" : "@|fg(yellow) review|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + flag + " [" + opportunity.type() + "] " + opportunity.filePath() + ":" + opportunity.line()
                        + " " + opportunity.description()));
    }

    private static String colored(RiskCategory category, String text) {
        String color = switch (category) {
            case SAFE, LOW -> "fg(green)";
            case MEDIUM -> "fg(yellow)";
            case HIGH, CRITICAL -> "fg(red)";
        };
        return "@|" + color + " " + text + "|@";
    }
}
