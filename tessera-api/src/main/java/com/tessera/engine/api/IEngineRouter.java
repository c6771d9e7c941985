/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.engine.api.model.InputResult;
import com.tessera.engine.api.model.TrainingStatus;

/**
 * Contract for dispatching per-instance calls by resource id.
 */
public interface IEngineRouter {

    InputResult input(String engineId, JsonNode event);

    JsonNode query(String engineId, JsonNode query);

    /**
     * Starts a batch training run and returns without waiting for it.
     */
    TrainingStatus train(String engineId);

    TrainingStatus trainingStatus(String engineId);

    /**
     * Feeds the mirrored events of one instance through the input path of another.
     *
     * @return number of events replayed
     */
    int replayInto(String sourceEngineId, String sinkEngineId);
}
