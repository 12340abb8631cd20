package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * A named phase of the fixed pipeline.
 * <p>
 * REVIEW runs twice: once before implementation ({@link #REVIEW}) and once after
 * ({@link #REVIEW_POST}). Both occurrences share the wire name {@code REVIEW} but keep
 * separate retry counters and gate-log streams.
 */
public enum Stage {
    PLAN("PLAN", false),
    REVIEW("REVIEW", false),
    DISRUPT("DISRUPT", true),
    IMPLEMENT("IMPLEMENT", false),
    TEST("TEST", false),
    REVIEW_POST("REVIEW", false),
    VALIDATE("VALIDATE", true),
    LEARN("LEARN", false);

    private final String gateName;
    private final boolean requiresExternalApproval;

    Stage(String gateName, boolean requiresExternalApproval) {
        this.gateName = gateName;
        this.requiresExternalApproval = requiresExternalApproval;
    }

    /** Name written into records ({@code workflow_stage}, evidence ids). */
    @JsonValue
    public String gateName() {
        return gateName;
    }

    /** Name of this occurrence, used for log streams and file names. */
    public String instanceName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean requiresExternalApproval() {
        return requiresExternalApproval;
    }

    @JsonCreator
    public static Stage fromWireName(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "REVIEW(POST)", "REVIEW_POST", "POST_REVIEW" -> REVIEW_POST;
            default -> valueOf(normalized);
        };
    }
}
