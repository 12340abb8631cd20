package com.stagegate.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Structural rules for one record kind.
 * <p>
 * Field paths for nested rules use dot notation, e.g. {@code metadata.parallel}.
 *
 * @param name           schema name
 * @param required       top-level fields that must be present and non-empty
 * @param nestedKey      name of the nested block ({@code metadata} or {@code context}), or {@code null}
 * @param nestedRequired fields that must be present inside the nested block
 * @param enums          allowed values per field path
 * @param patterns       regular expression per field path
 * @param types          expected JSON type per field path
 * @param aliases        alternative field path per field name it stands for, e.g. {@code metadata.responsible_agent}
 *                       for {@code agent_model}
 * @param synonyms       alternative enum values per field path, mapped to the value they stand for
 */
public record RecordSchema(
    SchemaName name,
    List<String> required,
    String nestedKey,
    List<String> nestedRequired,
    Map<String, List<String>> enums,
    Map<String, Pattern> patterns,
    Map<String, FieldType> types,
    Map<String, String> aliases,
    Map<String, Map<String, String>> synonyms
) {

    public static Builder builder(SchemaName name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final SchemaName name;
        private List<String> required = List.of();
        private String nestedKey;
        private List<String> nestedRequired = List.of();
        private final Map<String, List<String>> enums = new LinkedHashMap<>();
        private final Map<String, Pattern> patterns = new LinkedHashMap<>();
        private final Map<String, FieldType> types = new LinkedHashMap<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> synonyms = new LinkedHashMap<>();

        private Builder(SchemaName name) {
            this.name = name;
        }

        public Builder required(String... fields) {
            this.required = List.of(fields);
            return this;
        }

        public Builder nested(String key, String... fields) {
            this.nestedKey = key;
            this.nestedRequired = List.of(fields);
            return this;
        }

        public Builder oneOf(String path, String... allowed) {
            enums.put(path, List.of(allowed));
            return this;
        }

        public Builder pattern(String path, String regex) {
            patterns.put(path, Pattern.compile(regex));
            return this;
        }

        public Builder type(String path, FieldType type) {
            types.put(path, type);
            return this;
        }

        /** Reads {@code aliasPath} as the sibling field {@code fieldName} when that field is absent. */
        public Builder alias(String aliasPath, String fieldName) {
            aliases.put(aliasPath, fieldName);
            return this;
        }

        public Builder synonym(String path, String value, String canonical) {
            synonyms.computeIfAbsent(path, p -> new LinkedHashMap<>()).put(value, canonical);
            return this;
        }

        public RecordSchema build() {
            return new RecordSchema(name, required, nestedKey, nestedRequired,
                    Collections.unmodifiableMap(new LinkedHashMap<>(enums)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(patterns)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(types)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(aliases)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(synonyms)));
        }
    }
}
