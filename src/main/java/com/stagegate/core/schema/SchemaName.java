package com.stagegate.core.schema;

import com.stagegate.core.model.Conflict;
import com.stagegate.core.model.Evidence;
import com.stagegate.core.model.Handoff;
import com.stagegate.core.model.RecoveryRecord;
import com.stagegate.core.model.ReviewGate;
import com.stagegate.core.model.RunMetrics;
import com.stagegate.core.model.Skill;
import com.stagegate.core.model.StartupReport;
import com.stagegate.core.model.Task;
import com.stagegate.core.model.WorkflowRecord;

import java.util.Arrays;
import java.util.Optional;

/**
 * Names of the record schemas, identical to the {@code kind} discriminator values.
 */
public enum SchemaName {
    TODO("todo", Task.class),
    EVIDENCE("evidence", Evidence.class),
    REVIEW_GATE("review_gate", ReviewGate.class),
    CONFLICT("conflict", Conflict.class),
    HANDOFF("handoff", Handoff.class),
    RECOVERY("recovery", RecoveryRecord.class),
    METRICS("metrics", RunMetrics.class),
    SKILL("skill", Skill.class),
    STARTUP("startup", StartupReport.class);

    private final String wireName;
    private final Class<? extends WorkflowRecord> recordType;

    SchemaName(String wireName, Class<? extends WorkflowRecord> recordType) {
        this.wireName = wireName;
        this.recordType = recordType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends WorkflowRecord> recordType() {
        return recordType;
    }

    public static Optional<SchemaName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(name))
                .findFirst();
    }

    public static SchemaName of(WorkflowRecord record) {
        return Arrays.stream(values())
                .filter(s -> s.recordType.isInstance(record))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "No schema for record type " + record.getClass().getSimpleName()));
    }

    public static SchemaName of(Class<? extends WorkflowRecord> type) {
        return Arrays.stream(values())
                .filter(s -> s.recordType == type)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No schema for record type " + type.getSimpleName()));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
