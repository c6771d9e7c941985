/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api;

import com.tessera.engine.api.model.Event;

/**
 * Capability of engines that update their model from each accepted event.
 */
public interface IncrementalLearner {

    /**
     * Applies one accepted event to the model. The host guarantees at most one
     * call in flight per instance and calls in acceptance order.
     *
     * @throws Exception if the update fails; reported to the caller whose input triggered it
     */
    void learn(Event event) throws Exception;
}
