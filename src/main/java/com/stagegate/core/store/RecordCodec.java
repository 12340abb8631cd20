package com.stagegate.core.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stagegate.core.model.WorkflowRecord;
import com.stagegate.core.schema.SchemaName;
import com.stagegate.core.schema.SchemaValidator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON conversion for workflow records and run files.
 */
@Component
public class RecordCodec {

    private final ObjectMapper mapper;
    private final SchemaValidator validator;

    public RecordCodec(SchemaValidator validator) {
        this.validator = validator;
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public ObjectNode toTree(WorkflowRecord record) {
        ObjectNode tree = mapper.valueToTree(record);
        tree.put("kind", SchemaName.of(record).wireName());
        return tree;
    }

    public List<JsonNode> toTrees(List<? extends WorkflowRecord> records) {
        var trees = new ArrayList<JsonNode>(records.size());
        for (WorkflowRecord record : records) {
            trees.add(toTree(record));
        }
        return trees;
    }

    /**
     * Converts a JSON document to its typed record, if its schema can be resolved
     * and its fields bind.
     */
    public Optional<WorkflowRecord> toRecord(JsonNode node) {
        Optional<SchemaName> schema = validator.detectSchema(node);
        if (schema.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(toRecord(node, schema.get()));
        } catch (RecordSerializationException e) {
            return Optional.empty();
        }
    }

    public <T extends WorkflowRecord> T toRecord(JsonNode node, Class<T> type) {
        return type.cast(toRecord(node, SchemaName.of(type)));
    }

    private WorkflowRecord toRecord(JsonNode node, SchemaName schema) {
        JsonNode body = validator.unwrap(node);
        if (body == null || !body.isObject()) {
            throw new RecordSerializationException("Not a JSON object: " + node);
        }
        ObjectNode copy = ((ObjectNode) body).deepCopy();
        copy.put("kind", schema.wireName());
        try {
            return mapper.treeToValue(copy, WorkflowRecord.class);
        } catch (JsonProcessingException e) {
            throw new RecordSerializationException(
                    "Cannot bind " + schema.wireName() + " record: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RecordSerializationException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RecordSerializationException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a file holding either one JSON record or an array of records.
     */
    public List<JsonNode> readDocuments(Path file) {
        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new RecordSerializationException("Malformed JSON in " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        var documents = new ArrayList<JsonNode>();
        if (root == null || root.isMissingNode()) {
            return documents;
        }
        if (root.isArray()) {
            root.forEach(documents::add);
        } else {
            documents.add(root);
        }
        return documents;
    }

    public void write(Path file, Object value) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }
}
