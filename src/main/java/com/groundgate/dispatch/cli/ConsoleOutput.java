package com.groundgate.dispatch.cli;

import com.groundgate.core.model.FailReason;
import com.groundgate.core.model.VerifyResult;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Groundgate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GROUNDGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GROUNDGATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void droppedCitation(String warning) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [DROPPED]|@ " + warning));
    }

    public static void failReason(FailReason reason) {
        String marker = reason.isError() ? "@|fg(red) [x]|@" : "@|fg(yellow) [!]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + marker + " [" + reason.code().name() + "] " + reason.message()));
    }

    public static void gate(VerifyResult result) {
        if (result.gatePassed()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(green),bold [GATE PASSED]|@ " + warningCount(result) + " warning(s)"));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red),bold [GATE FAILED]|@ " + result.errors().size() + " error(s)"));
        }
    }

    public static void metrics(Map<String, Number> metrics) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Gate Metrics|@"));
        metrics.forEach((name, value) -> System.out.println("  " + name + ": " + value));
    }

    private static long warningCount(VerifyResult result) {
        return result.failReasons().stream().filter(r -> !r.isError()).count();
    }
}
