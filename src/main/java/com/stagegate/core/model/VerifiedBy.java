package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who verified a piece of evidence. Logs use {@code agent}, {@code third-party} and {@code user};
 * {@code external-reviewer} and {@code human} are read as synonyms.
 */
public enum VerifiedBy {
    AGENT("agent"),
    THIRD_PARTY("third-party"),
    USER("user");

    private final String wireName;

    VerifiedBy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static VerifiedBy fromWireName(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "agent" -> AGENT;
            case "third-party", "external-reviewer" -> THIRD_PARTY;
            case "user", "human" -> USER;
            default -> throw new IllegalArgumentException("Unknown verifier: " + value);
        };
    }
}
