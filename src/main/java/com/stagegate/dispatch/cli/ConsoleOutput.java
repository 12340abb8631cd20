package com.stagegate.dispatch.cli;

import com.stagegate.core.events.WorkflowEvent;
import com.stagegate.core.qualitygate.GateAction;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the StageGate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STAGEGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STAGEGATE]|@ " + message));
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

    public static void gate(String stage, GateAction action, int errorCount) {
        String color = switch (action) {
            case PROCEED -> "fg(green)";
            case REVISE -> "fg(yellow)";
            case ESCALATE -> "fg(magenta)";
            case STOP -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + ",bold [GATE " + stage + "] " + action + "|@"
                        + (errorCount > 0 ? " (" + errorCount + " errors)" : "")));
    }

    public static void report(String report) {
        for (String line : report.split("\n")) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|faint " + line + "|@"));
        }
    }

    public static void watchEvent(WorkflowEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.created", "run.resumed" -> "@|fg(cyan) [RUN]|@";
            case "stage.entered" -> "@|bold,fg(yellow) [STAGE]|@";
            case "task.started", "task.finished" -> "@|fg(blue) [TASK]|@";
            case "gate.decided" -> "@|fg(magenta) [GATE]|@";
            case "run.escalated" -> "@|fg(magenta),bold [ESCALATE]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.aborted" -> "@|fg(red),bold [ABORTED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + event.payload()));
    }
}
