/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.engine.api.model.EngineStatus;
import com.tessera.engine.api.model.RestoreReport;

import java.util.List;

/**
 * Contract for the owner of the live engine instances.
 */
public interface IEngineRegistry {

    /**
     * Creates and registers an instance from its parameters.
     *
     * @return the new engine id
     */
    String create(JsonNode params);

    /**
     * Re-initializes a live instance with new parameters, keeping its Dataset.
     */
    void update(String engineId, JsonNode params);

    /**
     * Removes an instance and releases its Dataset and Model. Mirror logs survive.
     */
    void destroy(String engineId);

    /**
     * Rebuilds the live set from persisted metadata, skipping instances that fail.
     */
    RestoreReport restoreAll();

    EngineStatus status(String engineId);

    List<EngineStatus> list();

    /**
     * Stops background work and releases resources.
     */
    void shutdown();
}
