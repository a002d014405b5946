package com.qoeguard.dispatch.cli;

import com.qoeguard.core.model.GateDecision;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the qoe-guard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) QOE-GUARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    /** Errors go to stderr so machine-readable reports on stdout stay clean. */
    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void decision(String name, GateDecision outcome, double risk) {
        String color = switch (outcome) {
            case PASS -> "green";
            case WARN -> "yellow";
            case FAIL -> "red";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(" + color + ") " + outcome + "|@ " + name
                        + String.format(Locale.ROOT, " (risk %.4f)", risk)));
    }
}
