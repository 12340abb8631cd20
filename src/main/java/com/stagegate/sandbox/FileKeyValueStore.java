package com.stagegate.sandbox;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagegate.core.StageGateException;
import com.stagegate.core.collaborator.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Key/value memory kept as one JSON object on disk. Writes replace the file atomically.
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(FileKeyValueStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public FileKeyValueStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(load().get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        Map<String, String> entries = load();
        entries.put(key, value);
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, "memory-", ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StageGateException("Cannot write key/value store " + file, e);
        }
        log.debug("Stored key {}", key);
    }

    private Map<String, String> load() {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            return mapper.readValue(file.toFile(), new TypeReference<TreeMap<String, String>>() {});
        } catch (IOException e) {
            throw new StageGateException("Cannot read key/value store " + file, e);
        }
    }
}
