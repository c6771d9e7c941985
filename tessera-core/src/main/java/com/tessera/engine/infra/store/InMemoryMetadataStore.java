/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.store;

import com.tessera.engine.api.model.EngineMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store for tests and development.
 */
public class InMemoryMetadataStore implements MetadataStore {

    private final Map<String, EngineMetadata> records = new ConcurrentHashMap<>();

    @Override
    public void save(EngineMetadata metadata) {
        records.put(metadata.engineId(), metadata);
    }

    @Override
    public Optional<EngineMetadata> findById(String engineId) {
        return Optional.ofNullable(records.get(engineId));
    }

    @Override
    public List<String> findAllIds() {
        List<String> ids = new ArrayList<>(records.keySet());
        ids.sort(null);
        return ids;
    }

    @Override
    public boolean delete(String engineId) {
        return records.remove(engineId) != null;
    }

    @Override
    public boolean exists(String engineId) {
        return records.containsKey(engineId);
    }
}
