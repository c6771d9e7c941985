/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api;

/**
 * A model produced by a batch run, not yet serving.
 */
public interface TrainedModel {

    /**
     * Makes this model the serving model of its engine.
     */
    void activate();

    /**
     * @return short description for logs and status
     */
    default String summary() {
        return getClass().getSimpleName();
    }
}
