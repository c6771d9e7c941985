/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.exceptions;

/**
 * Error kinds surfaced across the engine host boundary.
 */
public enum ErrorKind {
    /** Malformed or missing parameter or event field. Rejected before any mutation. */
    VALIDATION_ERROR,
    /** Unknown resource id. */
    NOT_FOUND,
    /** Create collided with a live engine id. */
    DUPLICATE_ID,
    /** Structural change an engine refuses to apply in place. */
    UNSUPPORTED_UPDATE,
    /** A batch training run is already in flight for the instance. */
    ALREADY_TRAINING,
    /** Mirror log or metadata persistence I/O error. */
    STORAGE_FAILURE,
    /** Error raised inside a pluggable engine or algorithm. */
    ALGORITHM_FAILURE
}
