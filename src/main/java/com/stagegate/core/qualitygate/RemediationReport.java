package com.stagegate.core.qualitygate;

import com.stagegate.core.schema.SchemaName;

import java.util.List;

/**
 * Renders the corrective-action report that accompanies every non-PROCEED decision.
 */
public final class RemediationReport {

    private static final String RULE = "=".repeat(80);
    private static final String LINE = "-".repeat(80);

    private RemediationReport() {
    }

    public static String render(GateDecision decision, GatePolicy policy, List<SchemaName> required) {
        var sb = new StringBuilder();
        sb.append(RULE).append('\n')
          .append("QUALITY GATE FAILED\n")
          .append(RULE).append("\n\n")
          .append(String.format("STAGE:        %s%n", decision.stage().instanceName().toUpperCase()))
          .append(String.format("ATTEMPT:      %d/%d%n", decision.retry() + 1, policy.maxRetry()))
          .append(String.format("TIMESTAMP:    %s%n", decision.timestamp()))
          .append(String.format("ACTION:       %s%n%n", decision.action()));

        sb.append(LINE).append('\n')
          .append(String.format("ERRORS (%d):%n", decision.errors().size()))
          .append(LINE).append('\n');
        for (GateError error : decision.errors()) {
            sb.append("  x ").append(error.render()).append('\n');
        }

        if (!decision.missingSchemas().isEmpty()) {
            sb.append('\n').append(LINE).append('\n')
              .append("REQUIRED SCHEMAS NOT SATISFIED:\n")
              .append(LINE).append('\n');
            for (String name : decision.missingSchemas()) {
                String desc = SchemaName.fromWireName(name).map(StageRequirements::describe).orElse("unknown");
                sb.append("  ! ").append(name).append(": ").append(desc).append('\n');
            }
        }

        sb.append('\n').append(LINE).append('\n')
          .append("SCHEMAS CHECKED:\n")
          .append(LINE).append('\n');
        var requiredNames = required.stream().map(SchemaName::wireName).toList();
        for (String name : decision.checkedSchemas()) {
            sb.append(requiredNames.contains(name) ? "  + " : "  i ").append(name).append('\n');
        }

        sb.append('\n').append(RULE).append('\n')
          .append("CORRECTIVE ACTION REQUIRED\n")
          .append(RULE).append('\n')
          .append(instruction(decision, policy)).append('\n')
          .append("REQUIRED SCHEMAS: ").append(String.join(", ", requiredNames)).append('\n');
        return sb.toString();
    }

    private static String instruction(GateDecision decision, GatePolicy policy) {
        return switch (decision.action()) {
            case REVISE -> """
                    INSTRUCTION: Fix every error above and resubmit the stage output.
                      [ ] all required fields present
                      [ ] enum values valid (status, priority, evidence_required, ...)
                      [ ] evidence file exists at its location and contains the success criteria
                      [ ] timestamps ISO-8601
                    """;
            case ESCALATE -> decision.hasError(GateErrorKind.FABRICATION)
                    ? "INSTRUCTION: Completion was claimed without evidence. Escalating to a more capable agent.\n"
                    : String.format("INSTRUCTION: Retries exhausted (%d). Escalating to a more capable agent with a handoff.%n",
                            policy.maxRetry());
            case STOP -> """
                    INSTRUCTION: Critical failure. The run is terminated and a recovery record is written.
                    Resume from the recovery checkpoint once the cause is fixed.
                    """;
            case PROCEED -> "";
        };
    }
}
