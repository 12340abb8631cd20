package com.stagegate.core.collaborator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Material handed to the external reviewer.
 *
 * @param stage      gate name of the stage under review
 * @param records    every output record of the batch
 * @param findings   errors the engine already found, empty when everything else passed
 */
public record EvidencePackage(
    String stage,
    List<JsonNode> records,
    List<String> findings
) {

    public EvidencePackage {
        records = List.copyOf(records);
        findings = List.copyOf(findings);
    }
}
