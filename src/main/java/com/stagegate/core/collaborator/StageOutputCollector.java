package com.stagegate.core.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagegate.core.model.Stage;
import com.stagegate.core.store.RecordCodec;
import com.stagegate.core.store.RecordSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Picks up records an agent wrote by hand for a stage: {@code <run>/<stage>_output.json},
 * holding one record or an array of them.
 */
@Component
public class StageOutputCollector {

    private static final Logger log = LoggerFactory.getLogger(StageOutputCollector.class);

    private final RecordCodec codec;

    public StageOutputCollector(RecordCodec codec) {
        this.codec = codec;
    }

    public Path outputFile(Path runDir, Stage stage) {
        return runDir.resolve(stage.instanceName() + "_output.json");
    }

    /**
     * An unreadable file contributes nothing; the gate then reports the schemas it lacks.
     */
    public List<JsonNode> collect(Path runDir, Stage stage) {
        Path file = outputFile(runDir, stage);
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            List<JsonNode> records = codec.readDocuments(file);
            log.debug("Collected {} record(s) from {}", records.size(), file);
            return records;
        } catch (RecordSerializationException e) {
            log.error("Ignoring unparseable stage output {}: {}", file, e.getMessage());
            return List.of();
        }
    }
}
