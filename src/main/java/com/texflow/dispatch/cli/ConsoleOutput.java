package com.texflow.dispatch.cli;

import com.texflow.core.events.StatusEvent;
import com.texflow.core.model.JobStatus;
import com.texflow.core.model.ParsedLogEntry;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the TexFlow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TEXFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TEXFLOW]|@ " + message));
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

    public static void logEntry(ParsedLogEntry entry) {
        String tag = switch (entry.type()) {
            case ERROR -> "@|fg(red) [ERROR]|@";
            case WARNING -> "@|fg(yellow) [WARN]|@";
            case INFO -> "@|fg(white) [INFO]|@";
        };
        String location = entry.line() > 0 ? entry.file() + ":" + entry.line() : entry.file();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + tag + " " + location + " " + entry.message()));
    }

    public static void statusEvent(StatusEvent event) {
        String color = switch (event.status()) {
            case SUCCESS -> "fg(green)";
            case ERROR, TIMEOUT -> "fg(red)";
            case CANCELED -> "fg(magenta)";
            default -> "fg(blue)";
        };
        StringBuilder line = new StringBuilder("@|" + color + " [" + event.status().wireName().toUpperCase() + "]|@ ")
                .append(event.jobId());
        if (event.engineUsed() != null) {
            line.append(" (").append(event.engineUsed().wireName()).append(")");
        }
        if (event.durationMs() != null && event.status() != JobStatus.QUEUED) {
            line.append(" ").append(formatDuration(event.durationMs()));
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString()));
        if (event.errors() != null) {
            event.errors().forEach(ConsoleOutput::logEntry);
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
