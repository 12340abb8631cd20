package com.stagegate.sandbox;

import com.stagegate.core.StageGateException;
import com.stagegate.core.collaborator.TestRunResult;
import com.stagegate.core.collaborator.TestRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a shell test command and reads counts from surefire-style summary lines.
 * Without such a line the exit code decides.
 */
public class CommandTestRunner implements TestRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandTestRunner.class);

    private static final Pattern SUMMARY =
            Pattern.compile("Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+),\\s*Errors:\\s*(\\d+)");

    private final List<String> command;
    private final Duration timeout;
    private final Path workingDir;

    public CommandTestRunner(String command, Duration timeout, Path workingDir) {
        this.command = Arrays.asList(command.trim().split("\\s+"));
        this.timeout = timeout;
        this.workingDir = workingDir;
    }

    @Override
    public TestRunResult run(String suiteSelector) {
        var args = new ArrayList<>(command);
        if (suiteSelector != null && !suiteSelector.isBlank()) {
            args.add(suiteSelector);
        }
        try {
            Path logFile = Files.createTempFile("stagegate-test-", ".log");
            log.info("Running tests: {}", String.join(" ", args));
            Process process = new ProcessBuilder(args)
                    .directory(workingDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Test command timed out after {}s", timeout.toSeconds());
                return new TestRunResult(0, 1, logFile);
            }
            return parse(Files.readString(logFile), process.exitValue(), logFile);
        } catch (IOException e) {
            throw new StageGateException("Cannot run test command " + args, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageGateException("Interrupted while running tests", e);
        }
    }

    static TestRunResult parse(String output, int exitCode, Path logFile) {
        Matcher matcher = SUMMARY.matcher(output);
        int run = -1;
        int broken = 0;
        while (matcher.find()) {
            run = Integer.parseInt(matcher.group(1));
            broken = Integer.parseInt(matcher.group(2)) + Integer.parseInt(matcher.group(3));
        }
        if (run < 0) {
            return exitCode == 0 ? new TestRunResult(1, 0, logFile) : new TestRunResult(0, 1, logFile);
        }
        if (exitCode != 0 && broken == 0) {
            broken = 1;
        }
        return new TestRunResult(Math.max(run - broken, 0), broken, logFile);
    }
}
