/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.exceptions;

public class AlreadyTrainingException extends EngineException {

    public AlreadyTrainingException(String engineId) {
        super(engineId, "Engine '" + engineId + "' is already training. Retry when the current run completes.");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ALREADY_TRAINING;
    }
}
