package com.planwatch.dispatch.cli;

import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Planwatch CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) PLANWATCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PLANWATCH]|@ ") + message);
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ ") + message);
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ ") + message);
    }

    static String formatDuration(double seconds) {
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.2fs", seconds);
        }
        long whole = (long) seconds;
        return (whole / 60) + "m " + (whole % 60) + "s";
    }
}
