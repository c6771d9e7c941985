/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.service.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.engine.api.IMirrorLog;
import com.tessera.engine.api.exceptions.EngineException;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.EngineStatus;
import com.tessera.engine.api.model.InputResult;
import com.tessera.engine.api.model.TrainingStatus;
import com.tessera.engine.infra.management.EngineRegistry;
import com.tessera.engine.params.ParameterStore;
import com.tessera.engine.runtime.routing.EngineRouter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriBuilder;

import java.util.List;
import java.util.Map;

/**
 * JAX-RS resource for engine instances.
 * Lifecycle operations go to the registry; per-instance calls go to the router.
 */
@Path("/engines")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EngineResource {

    @Inject
    EngineRegistry registry;

    @Inject
    EngineRouter router;

    @Inject
    IMirrorLog mirrorLog;

    @Inject
    Tracer tracer;

    // ========================================
    // Lifecycle
    // ========================================

    /**
     * Create a new engine instance from its parameter document.
     *
     * @param params full parameter document including engineId and engineFactory
     * @return 201 with the new engine id
     */
    @POST
    public Response createEngine(JsonNode params) {
        Span span = tracer.spanBuilder("http-create-engine").startSpan();
        try (Scope scope = span.makeCurrent()) {
            String engineId = registry.create(requireBody(params, "params"));
            span.setAttribute("engineId", engineId);

            return Response.created(UriBuilder.fromPath("/engines/{id}").build(engineId))
                    .entity(Map.of(
                            "engineId", engineId,
                            "message", "Engine created"
                    ))
                    .build();

        } catch (EngineException e) {
            span.recordException(e);
            return ErrorResponses.of(e);
        } catch (Exception e) {
            span.recordException(e);
            return ErrorResponses.internal(e);
        } finally {
            span.end();
        }
    }

    @GET
    public Response listEngines() {
        try {
            List<EngineStatus> engines = registry.list();
            return Response.ok(engines).build();
        } catch (EngineException e) {
            return ErrorResponses.of(e);
        }
    }

    @GET
    @Path("/{engineId}")
    public Response getEngine(@PathParam("engineId") String engineId) {
        try {
            return Response.ok(registry.status(engineId)).build();
        } catch (EngineException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * Re-initialize an engine with new parameters. The Dataset is kept.
     */
    @POST
    @Path("/{engineId}")
    public Response updateEngine(@PathParam("engineId") String engineId, JsonNode params) {
        Span span = tracer.spanBuilder("http-update-engine").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("engineId", engineId);

            registry.update(engineId, requireBody(params, "params"));

            return Response.ok(Map.of(
                    "engineId", engineId,
                    "message", "Engine updated"
            )).build();

        } catch (EngineException e) {
            span.recordException(e);
            return ErrorResponses.of(e);
        } catch (Exception e) {
            span.recordException(e);
            return ErrorResponses.internal(e);
        } finally {
            span.end();
        }
    }

    @DELETE
    @Path("/{engineId}")
    public Response deleteEngine(@PathParam("engineId") String engineId) {
        Span span = tracer.spanBuilder("http-delete-engine").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("engineId", engineId);

            registry.destroy(engineId);

            return Response.ok(Map.of(
                    "engineId", engineId,
                    "message", "Engine destroyed"
            )).build();

        } catch (EngineException e) {
            span.recordException(e);
            return ErrorResponses.of(e);
        } catch (Exception e) {
            span.recordException(e);
            return ErrorResponses.internal(e);
        } finally {
            span.end();
        }
    }

    // ========================================
    // Per-instance calls
    // ========================================

    @POST
    @Path("/{engineId}/events")
    public Response sendEvent(@PathParam("engineId") String engineId, JsonNode event) {
        try {
            InputResult result = router.input(engineId, requireBody(event, "event"));
            return Response.status(Response.Status.CREATED).entity(result).build();
        } catch (EngineException e) {
            return ErrorResponses.of(e);
        } catch (Exception e) {
            return ErrorResponses.internal(e);
        }
    }

    @POST
    @Path("/{engineId}/queries")
    public Response query(@PathParam("engineId") String engineId, JsonNode query) {
        try {
            return Response.ok(router.query(engineId, requireBody(query, "query"))).build();
        } catch (EngineException e) {
            return ErrorResponses.of(e);
        } catch (Exception e) {
            return ErrorResponses.internal(e);
        }
    }

    /**
     * Start a batch training run. Returns as soon as the run is scheduled.
     */
    @POST
    @Path("/{engineId}/train")
    public Response train(@PathParam("engineId") String engineId) {
        Span span = tracer.spanBuilder("http-train-engine").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("engineId", engineId);

            TrainingStatus status = router.train(engineId);
            return Response.accepted(status).build();

        } catch (EngineException e) {
            span.recordException(e);
            return ErrorResponses.of(e);
        } catch (Exception e) {
            span.recordException(e);
            return ErrorResponses.internal(e);
        } finally {
            span.end();
        }
    }

    @GET
    @Path("/{engineId}/train")
    public Response trainingStatus(@PathParam("engineId") String engineId) {
        try {
            return Response.ok(router.trainingStatus(engineId)).build();
        } catch (EngineException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * Replay a mirror log into this engine. Without {@code sourceEngineId} the
     * engine's own log is replayed, which rebuilds its Dataset after a restart.
     */
    @POST
    @Path("/{engineId}/replay")
    public Response replay(@PathParam("engineId") String engineId, JsonNode body) {
        Span span = tracer.spanBuilder("http-replay-engine").startSpan();
        try (Scope scope = span.makeCurrent()) {
            String source = engineId;
            if (body != null && body.hasNonNull("sourceEngineId")) {
                if (!body.get("sourceEngineId").isTextual()) {
                    throw new ValidationException(engineId, "sourceEngineId", "sourceEngineId must be a string");
                }
                source = body.get("sourceEngineId").asText();
            }
            span.setAttribute("engineId", engineId);
            span.setAttribute("source", source);

            int replayed = router.replayInto(source, engineId);

            return Response.ok(Map.of(
                    "engineId", engineId,
                    "sourceEngineId", source,
                    "replayed", replayed
            )).build();

        } catch (EngineException e) {
            span.recordException(e);
            return ErrorResponses.of(e);
        } catch (Exception e) {
            span.recordException(e);
            return ErrorResponses.internal(e);
        } finally {
            span.end();
        }
    }

    /**
     * Check the mirror log of an engine for torn records and sequence gaps.
     * Works for destroyed engines too, since mirror history is never deleted.
     */
    @GET
    @Path("/{engineId}/mirror")
    public Response verifyMirror(@PathParam("engineId") String engineId) {
        try {
            ParameterStore.validateEngineId(engineId);
            return Response.ok(mirrorLog.verify(engineId)).build();
        } catch (EngineException e) {
            return ErrorResponses.of(e);
        }
    }

    private static JsonNode requireBody(JsonNode body, String name) {
        if (body == null || !body.isObject()) {
            throw new ValidationException(name, "Request body must be a JSON object");
        }
        return body;
    }
}
