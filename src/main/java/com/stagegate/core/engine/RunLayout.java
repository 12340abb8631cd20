package com.stagegate.core.engine;

import com.stagegate.core.StageGateException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

/**
 * Run identifiers and the directory tree each run writes into.
 */
public final class RunLayout {

    public static final List<String> SUBDIRECTORIES =
            List.of("todo", "evidence", "logs", "docs", "test", "plans", "parallel");

    private static final DateTimeFormatter RUN_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private RunLayout() {}

    /** {@code yyyyMMdd_HHmmss_} followed by eight hex characters. */
    public static String newRunId(Clock clock) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return RUN_ID_TIME.format(clock.instant()) + "_" + suffix;
    }

    public static Path create(Path runDir) {
        try {
            for (String sub : SUBDIRECTORIES) {
                Files.createDirectories(runDir.resolve(sub));
            }
            return runDir;
        } catch (IOException e) {
            throw new StageGateException("Cannot create run directory " + runDir, e);
        }
    }

    public static boolean isComplete(Path runDir) {
        return SUBDIRECTORIES.stream().allMatch(sub -> Files.isDirectory(runDir.resolve(sub)));
    }

    public static Path logs(Path runDir) {
        return runDir.resolve("logs");
    }

    public static Path docs(Path runDir) {
        return runDir.resolve("docs");
    }
}
