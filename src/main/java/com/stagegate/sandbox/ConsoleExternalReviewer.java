package com.stagegate.sandbox;

import com.stagegate.core.collaborator.EvidencePackage;
import com.stagegate.core.collaborator.ExternalReviewer;
import com.stagegate.core.collaborator.ReviewVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A human at the terminal acts as the external reviewer.
 */
public class ConsoleExternalReviewer implements ExternalReviewer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleExternalReviewer.class);

    private final ConsolePrompt prompt;

    public ConsoleExternalReviewer(ConsolePrompt prompt) {
        this.prompt = prompt;
    }

    @Override
    public ReviewVerdict review(EvidencePackage evidencePackage) {
        prompt.print("");
        prompt.print("External review requested for " + evidencePackage.stage()
                + " (" + evidencePackage.records().size() + " records)");
        evidencePackage.findings().forEach(f -> prompt.print("  finding: " + f));

        var answer = prompt.confirm("Approve " + evidencePackage.stage() + "?");
        if (answer.isEmpty()) {
            log.warn("No reviewer input available; treating {} as rejected", evidencePackage.stage());
            return ReviewVerdict.reject("No reviewer input");
        }
        if (answer.get()) {
            return ReviewVerdict.approve();
        }
        String reason = prompt.ask("Reason for rejection:").filter(r -> !r.isBlank()).orElse("Rejected at console");
        return ReviewVerdict.reject(reason);
    }
}
