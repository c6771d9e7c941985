/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import java.util.Map;

/**
 * Inspection view of a live engine instance.
 *
 * @param trainable whether the engine accepts explicit training runs
 */
public record EngineStatus(
        String engineId,
        String engineFactory,
        EngineState state,
        TrainingDiscipline discipline,
        boolean trainable,
        boolean mirroring,
        TrainingStatus training,
        Map<String, Object> details) {

    public EngineStatus {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
