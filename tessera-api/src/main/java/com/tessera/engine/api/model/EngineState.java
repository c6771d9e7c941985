/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

/**
 * Lifecycle state of an engine instance record.
 */
public enum EngineState {
    ACTIVE,
    UPDATING,
    DESTROYED
}
