/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.store;

import com.tessera.engine.api.model.EngineMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for engine metadata, the only state needed to rebuild the
 * live set after a restart.
 *
 * <p>Implementations throw {@link com.tessera.engine.api.exceptions.StorageException}
 * on I/O failures.
 */
public interface MetadataStore {

    /**
     * Inserts or replaces the record of one instance.
     */
    void save(EngineMetadata metadata);

    Optional<EngineMetadata> findById(String engineId);

    /**
     * @return ids of every persisted instance, sorted
     */
    List<String> findAllIds();

    /**
     * @return true if a record was removed
     */
    boolean delete(String engineId);

    default boolean exists(String engineId) {
        return findById(engineId).isPresent();
    }
}
