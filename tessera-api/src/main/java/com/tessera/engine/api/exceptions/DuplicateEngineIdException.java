/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.exceptions;

public class DuplicateEngineIdException extends EngineException {

    public DuplicateEngineIdException(String engineId) {
        super(engineId, "Engine '" + engineId + "' already exists. Use update instead.");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DUPLICATE_ID;
    }
}
