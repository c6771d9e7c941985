/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Snapshot of an instance's training slot.
 *
 * @param engineId          engine instance
 * @param state             current state
 * @param lastError         error message of the last failed run, if any
 * @param lastStartedAt     start of the most recent batch run
 * @param lastCompletedAt   end of the most recent successful batch run
 * @param completedRuns     number of successful batch runs
 * @param deferredUpdates   incremental updates waiting for the current batch run to end
 * @param message           status message of the most recent request
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrainingStatus(
        String engineId,
        TrainingState state,
        String lastError,
        Instant lastStartedAt,
        Instant lastCompletedAt,
        long completedRuns,
        int deferredUpdates,
        String message) {
}
