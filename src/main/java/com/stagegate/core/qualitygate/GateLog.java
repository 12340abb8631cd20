package com.stagegate.core.qualitygate;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagegate.core.model.Stage;
import com.stagegate.core.store.RecordCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only JSON-lines log of gate decisions, one stream per stage occurrence
 * ({@code gate_<stage>.jsonl}) plus {@code gate_failures.jsonl} for every non-PROCEED decision.
 */
public class GateLog {

    public static final String FAILURES_FILE = "gate_failures.jsonl";

    private static final ConcurrentHashMap<Path, Object> LOCKS = new ConcurrentHashMap<>();

    private final Path logDir;
    private final RecordCodec codec;

    public GateLog(Path logDir, RecordCodec codec) {
        this.logDir = logDir;
        this.codec = codec;
    }

    public Path streamFor(Stage stage) {
        return logDir.resolve("gate_" + stage.instanceName() + ".jsonl");
    }

    public Path failuresFile() {
        return logDir.resolve(FAILURES_FILE);
    }

    public void append(GateDecision decision) {
        String line = codec.toJson(decision);
        appendLine(streamFor(decision.stage()), line);
        if (!decision.proceeds()) {
            appendLine(failuresFile(), line);
        }
    }

    public List<JsonNode> read(Stage stage) {
        return readLines(streamFor(stage));
    }

    public List<JsonNode> readFailures() {
        return readLines(failuresFile());
    }

    private List<JsonNode> readLines(Path file) {
        var entries = new ArrayList<JsonNode>();
        if (!Files.exists(file)) {
            return entries;
        }
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    entries.add(codec.parse(line));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read gate log " + file, e);
        }
        return entries;
    }

    private static void appendLine(Path file, String line) {
        Path key = file.toAbsolutePath().normalize();
        synchronized (LOCKS.computeIfAbsent(key, k -> new Object())) {
            try {
                Files.createDirectories(key.getParent());
                Files.writeString(key, line + System.lineSeparator(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot append to gate log " + key, e);
            }
        }
    }
}
