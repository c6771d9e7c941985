/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.exceptions;

/**
 * Thrown by an engine's {@code init} when new parameters change configuration
 * that cannot be altered on a live instance. The previous configuration stays active.
 */
public class UnsupportedUpdateException extends EngineException {

    private final String field;

    public UnsupportedUpdateException(String engineId, String field, String message) {
        super(engineId, message);
        this.field = field;
    }

    public String field() {
        return field;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNSUPPORTED_UPDATE;
    }
}
