package com.stagegate.core.collaborator;

/**
 * Independent approval authority consulted at the assumption-challenge and
 * final-acceptance stages. A rejection is binding.
 */
public interface ExternalReviewer {

    ReviewVerdict review(EvidencePackage evidencePackage);
}
