/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.runtime.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.engine.api.Engine;
import com.tessera.engine.api.IEngineRouter;
import com.tessera.engine.api.IMirrorLog;
import com.tessera.engine.api.exceptions.AlgorithmException;
import com.tessera.engine.api.exceptions.EngineException;
import com.tessera.engine.api.exceptions.EngineNotFoundException;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.Event;
import com.tessera.engine.api.model.InputResult;
import com.tessera.engine.api.model.MirrorRecord;
import com.tessera.engine.api.model.TrainingStatus;
import com.tessera.engine.infra.management.EngineRegistry;
import com.tessera.engine.infra.metrics.MetricsRegistry;
import com.tessera.engine.runtime.EngineHandle;
import com.tessera.engine.runtime.event.EventParser;
import com.tessera.engine.runtime.training.TrainingOrchestrator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.List;
import java.util.logging.Logger;

/**
 * Dispatches input, query and training calls to the instance named by the
 * engine id. Holds no state of its own beyond collaborators.
 */
public class EngineRouter implements IEngineRouter {
    private static final Logger logger = Logger.getLogger(EngineRouter.class.getName());

    private final EngineRegistry registry;
    private final IMirrorLog mirrorLog;
    private final TrainingOrchestrator orchestrator;
    private final EventParser eventParser;
    private final Tracer tracer;
    private final MetricsRegistry metrics;

    public EngineRouter(EngineRegistry registry,
                        IMirrorLog mirrorLog,
                        TrainingOrchestrator orchestrator,
                        EventParser eventParser,
                        Tracer tracer,
                        MetricsRegistry metrics) {
        this.registry = registry;
        this.mirrorLog = mirrorLog;
        this.orchestrator = orchestrator;
        this.eventParser = eventParser;
        this.tracer = tracer;
        this.metrics = metrics;
    }

    @Override
    public InputResult input(String engineId, JsonNode eventJson) {
        Span span = tracer.spanBuilder("engine-input").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("engineId", engineId);
            EngineHandle handle = registry.lookup(engineId);
            Event event = eventParser.parse(eventJson);
            span.setAttribute("event", event.event());
            InputResult result = accept(handle, event, true);
            metrics.counter("engine_events_accepted_total", "engine", engineId).increment();
            return result;
        } catch (EngineException e) {
            span.recordException(e);
            metrics.counter("engine_events_rejected_total", "kind", e.kind().name()).increment();
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public JsonNode query(String engineId, JsonNode query) {
        Span span = tracer.spanBuilder("engine-query").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("engineId", engineId);
            Engine engine = registry.lookup(engineId).engine();
            if (query == null || !query.isObject()) {
                throw new ValidationException(engineId, "query", "Query must be a JSON object");
            }
            return metrics.timer("engine_query", "engine", engineId).time(() -> {
                try {
                    return engine.query(query);
                } catch (EngineException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new AlgorithmException(engineId, "query", e);
                }
            });
        } catch (EngineException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public TrainingStatus train(String engineId) {
        Span span = tracer.spanBuilder("engine-train-request").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("engineId", engineId);
            return orchestrator.requestTraining(registry.lookup(engineId).trainingSlot());
        } catch (EngineException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public TrainingStatus trainingStatus(String engineId) {
        return orchestrator.status(registry.lookup(engineId).trainingSlot());
    }

    /**
     * Replays the mirror log of {@code sourceEngineId} through the input path
     * of {@code sinkEngineId}. Events the sink rejects as invalid are skipped.
     * An event the sink stores but fails to learn from counts as replayed.
     * Storage and other algorithm failures abort the replay. Replaying an
     * instance into itself does not mirror the events a second time.
     */
    @Override
    public int replayInto(String sourceEngineId, String sinkEngineId) {
        Span span = tracer.spanBuilder("engine-replay").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("source", sourceEngineId);
            span.setAttribute("sink", sinkEngineId);
            EngineHandle sink = registry.lookup(sinkEngineId);
            List<MirrorRecord> records = mirrorLog.read(sourceEngineId);
            boolean remirror = !sourceEngineId.equals(sinkEngineId);

            int replayed = 0;
            int skipped = 0;
            for (MirrorRecord record : records) {
                try {
                    accept(sink, record.event(), remirror);
                    replayed++;
                } catch (ValidationException e) {
                    skipped++;
                    logger.warning(String.format("Replay %s -> %s skipped record %d: %s",
                            sourceEngineId, sinkEngineId, record.sequence(), e.getMessage()));
                } catch (AlgorithmException e) {
                    if (!"learn".equals(e.operation())) {
                        throw e;
                    }
                    replayed++;
                    logger.warning(String.format("Replay %s -> %s: record %d is in the Dataset but the model did not learn it: %s",
                            sourceEngineId, sinkEngineId, record.sequence(), e.getMessage()));
                }
            }
            span.setAttribute("replayed", replayed);
            logger.info(String.format("Replayed %d of %d mirrored event(s) from '%s' into '%s' (%d skipped)",
                    replayed, records.size(), sourceEngineId, sinkEngineId, skipped));
            return replayed;
        } catch (EngineException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private InputResult accept(EngineHandle handle, Event event, boolean mirror) {
        String engineId = handle.engineId();
        Engine engine = handle.engine();
        if (event.isReserved() && !engine.supportsReservedEvent(event.event())) {
            throw new ValidationException(engineId, "event", String.format(
                    "Reserved event '%s' is not supported by engine factory '%s'", event.event(), handle.engineFactory()));
        }
        invoke(engineId, "validate", () -> engine.validate(event));

        handle.inputLock().lock();
        try {
            if (!handle.isRoutable()) {
                throw new EngineNotFoundException(engineId);
            }
            if (event.isReserved()) {
                invoke(engineId, "input", () -> engine.applyReservedEvent(event));
            } else {
                invoke(engineId, "input", () -> engine.input(event));
            }
            // only events the Dataset took are mirrored; a failed append leaves the Dataset ahead of the log
            Long sequence = null;
            if (mirror && mirrorLog.isEnabled(engineId)) {
                sequence = mirrorLog.record(engineId, event).sequence();
            }
            return new InputResult(engineId, sequence, orchestrator.onAccepted(handle.trainingSlot(), event));
        } finally {
            handle.inputLock().unlock();
        }
    }

    private static void invoke(String engineId, String operation, Runnable call) {
        try {
            call.run();
        } catch (EngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AlgorithmException(engineId, operation, e);
        }
    }
}
