/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api;

/**
 * Capability of engines that build their model in a batch run over the Dataset.
 */
public interface BatchTrainable {

    /**
     * Builds a new model. Runs on a training thread and may take a long time.
     * Must not replace the serving model; the host activates the returned
     * candidate only when the run succeeds and was not cancelled.
     *
     * @param context run context; long runs should check {@link TrainingContext#isCancelled()}
     * @return the candidate model
     * @throws Exception if training fails; the previous model stays active
     */
    TrainedModel train(TrainingContext context) throws Exception;
}
