/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.exceptions;

/**
 * Wraps an error raised inside an engine with the instance id and the
 * operation that was running.
 */
public class AlgorithmException extends EngineException {

    private final String operation;

    public AlgorithmException(String engineId, String operation, Throwable cause) {
        super(engineId, "Engine '" + engineId + "' failed during " + operation + ": " + describe(cause), cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ALGORITHM_FAILURE;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
