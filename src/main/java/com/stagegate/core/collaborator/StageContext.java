package com.stagegate.core.collaborator;

import com.stagegate.core.model.Stage;

import java.nio.file.Path;

/**
 * What a handler knows about the attempt it is working in.
 *
 * @param runId          run identifier
 * @param objective      the user objective for the run
 * @param stage          stage occurrence being executed
 * @param runDir         run directory holding todo/, evidence/, logs/ and the rest
 * @param executingAgent agent currently responsible for the stage
 * @param attempt        zero-based retry count of this stage
 */
public record StageContext(
    String runId,
    String objective,
    Stage stage,
    Path runDir,
    String executingAgent,
    int attempt
) {
}
