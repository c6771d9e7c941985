/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.engine.api.Engine;
import com.tessera.engine.api.model.EngineMetadata;
import com.tessera.engine.api.model.EngineState;
import com.tessera.engine.api.model.TrainingDiscipline;
import com.tessera.engine.runtime.training.TrainingSlot;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Live instance: the canonical record kept by the registry plus the running
 * engine derived from it.
 */
public final class EngineHandle {

    private final String engineId;
    private final String engineFactory;
    private final Engine engine;
    private final TrainingSlot trainingSlot;
    private final ReentrantLock inputLock = new ReentrantLock();

    private volatile JsonNode params;
    private volatile EngineMetadata metadata;
    private volatile EngineState state = EngineState.ACTIVE;

    public EngineHandle(String engineId, String engineFactory, Engine engine, TrainingSlot trainingSlot,
                        JsonNode params, EngineMetadata metadata) {
        this.engineId = engineId;
        this.engineFactory = engineFactory;
        this.engine = engine;
        this.trainingSlot = trainingSlot;
        this.params = params;
        this.metadata = metadata;
    }

    public String engineId() {
        return engineId;
    }

    public String engineFactory() {
        return engineFactory;
    }

    public Engine engine() {
        return engine;
    }

    public TrainingSlot trainingSlot() {
        return trainingSlot;
    }

    public TrainingDiscipline discipline() {
        return trainingSlot.discipline();
    }

    /**
     * Serializes the input path of this instance: mirror append, dataset
     * input and incremental update happen in acceptance order.
     */
    public ReentrantLock inputLock() {
        return inputLock;
    }

    public JsonNode params() {
        return params;
    }

    public EngineMetadata metadata() {
        return metadata;
    }

    public EngineState state() {
        return state;
    }

    public boolean isRoutable() {
        return state != EngineState.DESTROYED;
    }

    public void markState(EngineState newState) {
        this.state = newState;
    }

    public void applyParams(JsonNode newParams, EngineMetadata newMetadata) {
        this.params = newParams;
        this.metadata = newMetadata;
    }
}
