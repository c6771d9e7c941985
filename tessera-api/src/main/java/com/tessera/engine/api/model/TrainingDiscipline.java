/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import com.tessera.engine.api.BatchTrainable;
import com.tessera.engine.api.Engine;
import com.tessera.engine.api.IncrementalLearner;

/**
 * How an engine turns events into model state. Derived from the capabilities
 * an engine declares, never configured directly.
 *
 * <p>An engine with neither capability only keeps a Dataset. It reports
 * {@link #PERIODIC} but cannot be trained; {@link EngineStatus#trainable()}
 * tells the two apart.
 */
public enum TrainingDiscipline {
    /** Every accepted event updates the model immediately. */
    CONTINUOUS,
    /** Events accumulate; an explicit training run builds a new model. */
    PERIODIC,
    /** Both, with at most one mutation path active at a time. */
    MIXED;

    public static TrainingDiscipline of(Engine engine) {
        boolean incremental = engine instanceof IncrementalLearner;
        boolean batch = engine instanceof BatchTrainable;
        if (incremental && batch) {
            return MIXED;
        }
        return incremental ? CONTINUOUS : PERIODIC;
    }
}
