package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of proof artifact, shared by {@code evidence_required} on tasks and {@code type} on evidence.
 */
public enum EvidenceType {
    LOG,
    OUTPUT,
    TEST_RESULT,
    DIFF,
    SCREENSHOT,
    API_RESPONSE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EvidenceType fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
