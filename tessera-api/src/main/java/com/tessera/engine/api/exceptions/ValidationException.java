/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.exceptions;

/**
 * A parameter or event field is missing or malformed.
 */
public class ValidationException extends EngineException {

    private final String field;

    public ValidationException(String field, String message) {
        this(null, field, message);
    }

    public ValidationException(String engineId, String field, String message) {
        super(engineId, message);
        this.field = field;
    }

    /**
     * @return dotted path of the offending field, e.g. {@code algorithm.num}
     */
    public String field() {
        return field;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION_ERROR;
    }
}
