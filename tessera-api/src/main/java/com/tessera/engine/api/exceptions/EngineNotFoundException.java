/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.exceptions;

public class EngineNotFoundException extends EngineException {

    public EngineNotFoundException(String engineId) {
        super(engineId, "Engine '" + engineId + "' not found");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
