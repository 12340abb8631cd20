package com.stagegate.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagegate.core.schema.SchemaName;
import com.stagegate.core.schema.SchemaValidator;
import com.stagegate.core.schema.ValidationResult;
import com.stagegate.core.store.RecordCodec;
import com.stagegate.core.store.RecordSerializationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: stagegate validate &lt;recordFile&gt; &lt;schema&gt;
 * <p>
 * Exit 0 when every record in the file is valid, 1 when any is not,
 * 2 when the schema is unknown or the file cannot be read.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Validate records in a JSON file against a schema")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "JSON file holding one record or an array of records")
    private Path recordFile;

    @Parameters(index = "1", description = "Schema name: todo, evidence, review_gate, conflict, handoff, recovery, metrics, skill, startup")
    private String schema;

    private final SchemaValidator validator;
    private final RecordCodec codec;

    public ValidateCommand(SchemaValidator validator, RecordCodec codec) {
        this.validator = validator;
        this.codec = codec;
    }

    @Override
    public Integer call() {
        if (SchemaName.fromWireName(schema).isEmpty()) {
            ConsoleOutput.error("Unknown schema: " + schema + ". Known: "
                    + Arrays.stream(SchemaName.values()).map(SchemaName::wireName).toList());
            return 2;
        }
        List<JsonNode> records;
        try {
            records = codec.readDocuments(recordFile);
        } catch (RecordSerializationException | UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        int invalid = 0;
        for (int i = 0; i < records.size(); i++) {
            ValidationResult result = validator.validate(records.get(i), schema);
            String label = "Record #" + (i + 1);
            if (result.ok()) {
                ConsoleOutput.success(label + ": valid " + schema);
            } else {
                invalid++;
                ConsoleOutput.error(label + ": " + result.errors().size() + " error(s)");
                result.errors().forEach(err -> System.out.println("    - " + err));
            }
        }
        return invalid == 0 ? 0 : 1;
    }
}
