/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One archived event in an engine's mirror log.
 *
 * @param engineId owning engine instance
 * @param sequence monotonic, gapless per engine, starting at 1
 * @param event    the event exactly as accepted
 */
public record MirrorRecord(
        @JsonProperty("engineId") String engineId,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("event") Event event) {
}
