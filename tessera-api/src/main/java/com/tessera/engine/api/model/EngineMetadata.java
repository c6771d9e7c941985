/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted description of one engine instance. Read in full at start-up to
 * reconstruct the live set.
 *
 * @param engineId      resource id
 * @param engineFactory factory identifier used to build the engine
 * @param params        full parameter JSON as last applied
 * @param mirroring     whether mirroring was enabled
 * @param createdAt     when the instance was first created
 * @param updatedAt     when the parameters were last replaced
 */
public record EngineMetadata(
        @JsonProperty("engineId") String engineId,
        @JsonProperty("engineFactory") String engineFactory,
        @JsonProperty("params") String params,
        @JsonProperty("mirroring") boolean mirroring,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) implements Serializable {

    public EngineMetadata {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }

    public EngineMetadata withParams(String newParams, boolean newMirroring) {
        return new EngineMetadata(engineId, engineFactory, newParams, newMirroring, createdAt, Instant.now());
    }
}
