package com.stagegate.core.collaborator;

import java.util.Optional;

/**
 * Persistent memory that outlives a run: checkpoints and recovery records live here.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);
}
