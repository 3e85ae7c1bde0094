package com.keystone.dispatch.cli;

import com.keystone.core.blueprint.Violation;
import com.keystone.core.pack.PackMetadata;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Keystone CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) KEYSTONE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [KEYSTONE]|@ " + message));
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

    public static void fileChange(String action, String path) {
        String symbol = "created".equals(action) ? "+" : "~";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) " + symbol + "|@ " + path));
    }

    public static void violations(List<Violation> violations) {
        error("Configuration rejected (" + violations.size() + " violation"
                + (violations.size() != 1 ? "s" : "") + "):");
        for (Violation v : violations) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ @|bold " + v.path() + "|@ " + v.message()
                            + " @|faint [" + v.rule() + "]|@"));
        }
    }

    public static void packTable(List<PackMetadata> packs) {
        System.out.printf("  %-16s %-8s %-12s %-10s %s%n", "ID", "VERSION", "LANGUAGE", "FRAMEWORK", "DESCRIPTION");
        System.out.println("  " + "-".repeat(76));
        for (PackMetadata pack : packs) {
            System.out.printf("  %-16s %-8s %-12s %-10s %s%n",
                    pack.id(), pack.version(), pack.language(), pack.framework(),
                    pack.description() == null ? "" : pack.description());
        }
    }

    public static void regions(String label, List<String> names) {
        if (!names.isEmpty()) {
            System.out.println("  " + label + ": " + String.join(", ", names));
        }
    }
}
