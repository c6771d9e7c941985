/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

/**
 * Per-instance training state. {@code FAILED} is left by the next successful run.
 */
public enum TrainingState {
    IDLE,
    TRAINING,
    FAILED
}
