package com.stagegate.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;

/**
 * Any structured document the engine reads or writes during a run.
 * <p>
 * Every record carries an explicit {@code kind} discriminator on the wire so that
 * schema resolution is a single switch instead of shape inspection.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Task.class, name = "todo"),
        @JsonSubTypes.Type(value = Evidence.class, name = "evidence"),
        @JsonSubTypes.Type(value = ReviewGate.class, name = "review_gate"),
        @JsonSubTypes.Type(value = Conflict.class, name = "conflict"),
        @JsonSubTypes.Type(value = Handoff.class, name = "handoff"),
        @JsonSubTypes.Type(value = RecoveryRecord.class, name = "recovery"),
        @JsonSubTypes.Type(value = RunMetrics.class, name = "metrics"),
        @JsonSubTypes.Type(value = Skill.class, name = "skill"),
        @JsonSubTypes.Type(value = StartupReport.class, name = "startup")
})
public interface WorkflowRecord extends Serializable {
}
