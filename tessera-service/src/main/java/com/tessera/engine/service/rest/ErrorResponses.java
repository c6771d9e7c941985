/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.service.rest;

import com.tessera.engine.api.exceptions.EngineException;
import com.tessera.engine.api.exceptions.ErrorKind;
import com.tessera.engine.api.exceptions.UnsupportedUpdateException;
import com.tessera.engine.api.exceptions.ValidationException;
import jakarta.ws.rs.core.Response;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns engine host errors into HTTP responses.
 *
 * <p>Body: {@code {error, message, field?, engineId?}}. Stack traces never
 * leave the process; unexpected errors are logged here instead.
 */
public final class ErrorResponses {

    private static final Logger logger = Logger.getLogger(ErrorResponses.class.getName());

    private ErrorResponses() {
        // utility class
    }

    public static int status(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> 400;
            case NOT_FOUND -> 404;
            case DUPLICATE_ID, ALREADY_TRAINING -> 409;
            case UNSUPPORTED_UPDATE -> 422;
            case STORAGE_FAILURE -> 503;
            case ALGORITHM_FAILURE -> 500;
        };
    }

    public static Response of(EngineException e) {
        if (e.kind() == ErrorKind.ALGORITHM_FAILURE || e.kind() == ErrorKind.STORAGE_FAILURE) {
            logger.log(Level.WARNING, "Request failed for engine '" + e.engineId() + "'", e);
        }
        return Response.status(status(e.kind())).entity(body(e)).build();
    }

    public static Response internal(Exception e) {
        logger.log(Level.SEVERE, "Unexpected error while handling a request", e);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "INTERNAL_ERROR");
        body.put("message", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(body).build();
    }

    static Map<String, Object> body(EngineException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.kind().name());
        body.put("message", e.getMessage());
        String field = null;
        if (e instanceof ValidationException validation) {
            field = validation.field();
        } else if (e instanceof UnsupportedUpdateException unsupported) {
            field = unsupported.field();
        }
        if (field != null) {
            body.put("field", field);
        }
        if (e.engineId() != null) {
            body.put("engineId", e.engineId());
        }
        return body;
    }
}
