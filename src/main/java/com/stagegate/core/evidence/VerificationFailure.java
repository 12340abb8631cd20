package com.stagegate.core.evidence;

/**
 * Why an artifact failed to prove its claim.
 */
public enum VerificationFailure {
    MISSING_FILE("missing_file"),
    CRITERIA_NOT_FOUND("criteria_not_found"),
    FAILURE_MARKER_PRESENT("failure_marker_present"),
    STALE_ARTIFACT("stale_artifact"),
    UNREADABLE_FILE("unreadable_file");

    private final String code;

    VerificationFailure(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
