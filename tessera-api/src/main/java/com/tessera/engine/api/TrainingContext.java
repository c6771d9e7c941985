/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api;

/**
 * Handle given to a batch training run.
 */
public interface TrainingContext {

    String engineId();

    /**
     * @return true once the instance is being destroyed; the run should stop early
     */
    boolean isCancelled();
}
