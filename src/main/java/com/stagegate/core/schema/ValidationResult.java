package com.stagegate.core.schema;

import java.util.List;

/**
 * Outcome of validating one record against one schema.
 *
 * @param schema the schema checked, {@code null} when the requested name is unknown
 * @param errors field-level errors, empty when the record is valid
 */
public record ValidationResult(SchemaName schema, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult unknownSchema(String requested) {
        return new ValidationResult(null, List.of("Unknown schema: " + requested));
    }

    public boolean ok() {
        return schema != null && errors.isEmpty();
    }

    public boolean schemaKnown() {
        return schema != null;
    }
}
