package com.specgate.dispatch.cli;

import com.specgate.core.fix.FixResult;
import com.specgate.core.model.ValidationReport;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Specgate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SPECGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SPECGATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void finding(ValidationReport.Entry entry) {
        String color = switch (entry.severity()) {
            case "HIGH" -> "fg(red)";
            case "MEDIUM" -> "fg(yellow)";
            default -> "fg(white)";
        };
        String location = entry.file() == null ? "-"
                : entry.line() != null ? entry.file() + ":" + entry.line() : entry.file();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " [" + entry.severity() + "]|@ " + location + " - " + entry.message()));
    }

    public static void counts(ValidationReport.Counts counts) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) " + counts.high() + " high|@, @|fg(yellow) " + counts.medium()
                + " medium|@, " + counts.low() + " low"));
    }

    public static void fixSummary(FixResult fix) {
        if (fix.errorsFixed() == 0) {
            info("Auto-fix: nothing to fix");
            return;
        }
        success("Auto-fix: " + fix.errorsFixed() + " error" + (fix.errorsFixed() != 1 ? "s" : "")
                + " fixed in " + fix.filesModified() + " file" + (fix.filesModified() != 1 ? "s" : ""));
        for (String detail : fix.details()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(green) ~|@ " + detail));
        }
    }
}
