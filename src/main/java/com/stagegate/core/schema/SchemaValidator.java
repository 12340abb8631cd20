package com.stagegate.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stagegate.core.model.Task;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks JSON records against the {@link SchemaCatalog}.
 * <p>
 * Aliased field names and enum synonyms are first rewritten to the names the logs use.
 * Checks then run in a fixed order: required top-level fields, required nested fields,
 * enum membership, id patterns, then value types. No I/O.
 */
@Component
public class SchemaValidator {

    private static final String KIND = "kind";

    public ValidationResult validate(JsonNode record, String schemaName) {
        Optional<SchemaName> name = SchemaName.fromWireName(schemaName);
        if (name.isEmpty()) {
            return ValidationResult.unknownSchema(schemaName);
        }
        return validate(record, name.get());
    }

    public ValidationResult validate(JsonNode record, SchemaName schemaName) {
        RecordSchema schema = SchemaCatalog.get(schemaName);
        JsonNode body = canonical(unwrap(record), schema);
        var errors = new ArrayList<String>();

        if (body == null || !body.isObject()) {
            errors.add("Record is not a JSON object");
            return new ValidationResult(schemaName, errors);
        }

        // (a) required top-level fields
        for (String field : schema.required()) {
            if (isEmpty(body.get(field))) {
                errors.add("Missing required field: " + field);
            }
        }

        // (b) nested required fields
        if (schema.nestedKey() != null) {
            JsonNode nested = body.get(schema.nestedKey());
            if (nested != null && nested.isObject()) {
                for (String field : schema.nestedRequired()) {
                    if (!nested.has(field)) {
                        errors.add("Missing " + schema.nestedKey() + " field: " + field);
                    }
                }
            }
        }

        // (c) enums
        for (Map.Entry<String, List<String>> rule : schema.enums().entrySet()) {
            JsonNode value = resolve(body, rule.getKey());
            if (!isEmpty(value) && !rule.getValue().contains(value.asText())) {
                errors.add(String.format("%s: '%s' not in %s", rule.getKey(), value.asText(), rule.getValue()));
            }
        }

        // (d) patterns
        for (Map.Entry<String, Pattern> rule : schema.patterns().entrySet()) {
            JsonNode value = resolve(body, rule.getKey());
            if (!isEmpty(value) && (!value.isTextual() || !rule.getValue().matcher(value.asText()).matches())) {
                errors.add(String.format("%s: pattern mismatch (expected %s)",
                        rule.getKey(), rule.getValue().pattern()));
            }
        }

        // (e) types
        for (Map.Entry<String, FieldType> rule : schema.types().entrySet()) {
            JsonNode value = resolve(body, rule.getKey());
            if (value != null && !value.isNull() && !rule.getValue().matches(value)) {
                errors.add(String.format("%s: expected %s, got %s",
                        rule.getKey(), rule.getValue().label(), FieldType.labelOf(value)));
            }
        }

        // field count only adds information when nothing is missing
        boolean anyMissing = errors.stream().anyMatch(e -> e.startsWith("Missing "));
        if (schemaName == SchemaName.TODO && !anyMissing) {
            int count = countTaskFields(body);
            if (count != Task.FIELD_COUNT) {
                errors.add(String.format("Field count: %d (expected %d)", count, Task.FIELD_COUNT));
            }
        }

        return new ValidationResult(schemaName, errors);
    }

    /**
     * Resolves the schema of a record from its {@code kind} discriminator.
     * Older logs without {@code kind} are matched by their single envelope key
     * ({@code {"evidence": {...}}}) or, for tasks, by {@code metadata.objective}.
     */
    public Optional<SchemaName> detectSchema(JsonNode record) {
        if (record == null || !record.isObject()) {
            return Optional.empty();
        }
        JsonNode kind = record.get(KIND);
        if (kind != null && kind.isTextual()) {
            return SchemaName.fromWireName(kind.asText());
        }
        Optional<String> envelope = envelopeKey(record);
        if (envelope.isPresent()) {
            return SchemaName.fromWireName(envelope.get());
        }
        JsonNode metadata = record.get("metadata");
        if (metadata != null && metadata.has("objective")) {
            return Optional.of(SchemaName.TODO);
        }
        return Optional.empty();
    }

    /**
     * Strips a legacy envelope, returning the record body.
     */
    public JsonNode unwrap(JsonNode record) {
        if (record == null || !record.isObject() || record.has(KIND)) {
            return record;
        }
        return envelopeKey(record).map(record::get).orElse(record);
    }

    /**
     * Number of task fields: base fields plus metadata fields, ignoring the discriminator.
     */
    public int countTaskFields(JsonNode record) {
        JsonNode body = unwrap(record);
        int count = 0;
        Iterator<String> names = body.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KIND.equals(name) && !"metadata".equals(name)) {
                count++;
            }
        }
        JsonNode metadata = body.get("metadata");
        if (metadata != null && metadata.isObject()) {
            count += metadata.size();
        }
        return count;
    }

    /**
     * Copy of {@code body} with aliased fields renamed and enum synonyms replaced. A field already
     * present under its own name wins over its alias. The input is returned as is when nothing applies.
     */
    JsonNode canonical(JsonNode body, RecordSchema schema) {
        if (body == null || !body.isObject() || (schema.aliases().isEmpty() && schema.synonyms().isEmpty())) {
            return body;
        }
        ObjectNode copy = body.deepCopy();
        for (Map.Entry<String, String> alias : schema.aliases().entrySet()) {
            String path = alias.getKey();
            int dot = path.lastIndexOf('.');
            JsonNode parent = dot < 0 ? copy : resolve(copy, path.substring(0, dot));
            if (parent instanceof ObjectNode block) {
                String aliasName = path.substring(dot + 1);
                if (block.has(aliasName) && !block.has(alias.getValue())) {
                    block.set(alias.getValue(), block.remove(aliasName));
                }
            }
        }
        for (Map.Entry<String, Map<String, String>> rule : schema.synonyms().entrySet()) {
            String path = rule.getKey();
            int dot = path.lastIndexOf('.');
            JsonNode parent = dot < 0 ? copy : resolve(copy, path.substring(0, dot));
            JsonNode value = resolve(copy, path);
            if (parent instanceof ObjectNode block && value != null && value.isTextual()) {
                String canonical = rule.getValue().get(value.asText());
                if (canonical != null) {
                    block.put(path.substring(dot + 1), canonical);
                }
            }
        }
        return copy;
    }

    private Optional<String> envelopeKey(JsonNode record) {
        if (record.size() != 1) {
            return Optional.empty();
        }
        String key = record.fieldNames().next();
        if (SchemaName.fromWireName(key).isPresent() && record.get(key).isObject()) {
            return Optional.of(key);
        }
        return Optional.empty();
    }

    private static JsonNode resolve(JsonNode body, String path) {
        JsonNode current = body;
        for (String part : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    private static boolean isEmpty(JsonNode value) {
        return value == null || value.isNull()
                || (value.isTextual() && value.asText().isEmpty())
                || (value.isArray() && value.isEmpty());
    }
}
