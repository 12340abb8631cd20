package com.stagegate.core.model;

import java.io.Serializable;

/**
 * A handler's assertion that an artifact proves its work. Becomes an {@link Evidence}
 * record once the run assigns it an id.
 *
 * @param type     artifact kind
 * @param claim    what the artifact is supposed to show
 * @param location path of the artifact
 */
public record EvidenceClaim(
    EvidenceType type,
    String claim,
    String location
) implements Serializable {
}
