package com.stagegate.core.qualitygate;

import com.stagegate.core.model.Stage;
import com.stagegate.core.schema.SchemaName;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Schemas that must each have at least one record in a stage's output.
 */
public final class StageRequirements {

    private static final Map<Stage, List<SchemaName>> REQUIRED = new EnumMap<>(Stage.class);

    static {
        REQUIRED.put(Stage.PLAN, List.of(SchemaName.TODO, SchemaName.EVIDENCE));
        REQUIRED.put(Stage.REVIEW, List.of(SchemaName.REVIEW_GATE, SchemaName.EVIDENCE));
        REQUIRED.put(Stage.DISRUPT, List.of(SchemaName.CONFLICT, SchemaName.EVIDENCE));
        REQUIRED.put(Stage.IMPLEMENT, List.of(SchemaName.TODO, SchemaName.EVIDENCE));
        REQUIRED.put(Stage.TEST, List.of(SchemaName.EVIDENCE, SchemaName.METRICS));
        REQUIRED.put(Stage.REVIEW_POST, List.of(SchemaName.REVIEW_GATE, SchemaName.EVIDENCE));
        REQUIRED.put(Stage.VALIDATE, List.of(SchemaName.REVIEW_GATE, SchemaName.EVIDENCE));
        REQUIRED.put(Stage.LEARN, List.of(SchemaName.SKILL, SchemaName.METRICS));
    }

    private StageRequirements() {
    }

    public static List<SchemaName> requiredFor(Stage stage) {
        return REQUIRED.get(stage);
    }

    public static String describe(SchemaName schema) {
        return switch (schema) {
            case TODO -> "task records with all 17 fields";
            case EVIDENCE -> "evidence records pointing at proof artifacts";
            case REVIEW_GATE -> "review gate verdict";
            case CONFLICT -> "conflict record from assumption challenge";
            case HANDOFF -> "agent handoff";
            case RECOVERY -> "recovery checkpoint";
            case METRICS -> "run metrics";
            case SKILL -> "learned skill";
            case STARTUP -> "startup report";
        };
    }
}
