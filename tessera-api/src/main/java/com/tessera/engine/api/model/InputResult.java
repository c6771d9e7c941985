/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Acknowledgement of an accepted input event.
 *
 * @param engineId       engine the event was routed to
 * @param sequence       mirror sequence number, {@code null} when mirroring is off
 * @param modelUpdate    what happened to the model as a follow-on of this event
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InputResult(String engineId, Long sequence, ModelUpdate modelUpdate) {

    public enum ModelUpdate {
        /** The engine only accumulates events; the model changes on the next training run. */
        NONE,
        /** The incremental update was applied before acknowledging. */
        APPLIED,
        /** A batch run was in flight; the update is queued and applied when it ends. */
        DEFERRED
    }
}
