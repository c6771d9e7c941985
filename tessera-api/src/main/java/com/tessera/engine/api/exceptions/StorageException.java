/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.exceptions;

/**
 * Mirror log or metadata persistence failed.
 */
public class StorageException extends EngineException {

    public StorageException(String engineId, String message, Throwable cause) {
        super(engineId, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STORAGE_FAILURE;
    }
}
