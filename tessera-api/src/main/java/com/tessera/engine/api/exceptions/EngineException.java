/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.exceptions;

/**
 * Base class of every error the engine host reports to its callers.
 *
 * <p>Unchecked so it can cross the {@link com.tessera.engine.api.Engine} SPI
 * without forcing every engine implementation to declare it.
 */
public abstract class EngineException extends RuntimeException {

    private final String engineId;

    protected EngineException(String engineId, String message) {
        super(message);
        this.engineId = engineId;
    }

    protected EngineException(String engineId, String message, Throwable cause) {
        super(message, cause);
        this.engineId = engineId;
    }

    /**
     * @return the error kind used by the boundary to pick a response
     */
    public abstract ErrorKind kind();

    /**
     * @return the engine id the error relates to, or {@code null} when unknown
     */
    public String engineId() {
        return engineId;
    }
}
