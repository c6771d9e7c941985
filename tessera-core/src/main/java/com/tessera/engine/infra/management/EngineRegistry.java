/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.management;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.tessera.engine.api.Engine;
import com.tessera.engine.api.EngineFactory;
import com.tessera.engine.api.IEngineRegistry;
import com.tessera.engine.api.IMirrorLog;
import com.tessera.engine.api.exceptions.AlgorithmException;
import com.tessera.engine.api.exceptions.DuplicateEngineIdException;
import com.tessera.engine.api.exceptions.EngineException;
import com.tessera.engine.api.exceptions.EngineNotFoundException;
import com.tessera.engine.api.exceptions.StorageException;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.EngineMetadata;
import com.tessera.engine.api.model.EngineState;
import com.tessera.engine.api.model.EngineStatus;
import com.tessera.engine.api.model.MirrorSettings;
import com.tessera.engine.api.model.RestoreReport;
import com.tessera.engine.infra.metrics.Gauge;
import com.tessera.engine.infra.metrics.MetricsRegistry;
import com.tessera.engine.infra.store.MetadataStore;
import com.tessera.engine.params.EngineParams;
import com.tessera.engine.params.ParameterStore;
import com.tessera.engine.runtime.EngineHandle;
import com.tessera.engine.runtime.training.TrainingOrchestrator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the live engine instances, keyed by engine id.
 *
 * <p>Structural operations on one id (create, update, destroy, restore) are
 * serialized by a per-id lock; different ids never wait on each other. The
 * locks live in a weak-valued cache, so ids that are no longer touched do not
 * pin memory.
 *
 * <p>In a multi-process deployment the per-id lock must be replaced by a
 * shared one; this class only guards a single process.
 */
public class EngineRegistry implements IEngineRegistry {
    private static final Logger logger = Logger.getLogger(EngineRegistry.class.getName());

    private final ConcurrentMap<String, EngineHandle> liveEngines = new ConcurrentHashMap<>();
    private final LoadingCache<String, ReentrantLock> engineLocks = Caffeine.newBuilder()
            .weakValues()
            .build(id -> new ReentrantLock());

    private final EngineFactoryRegistry factories;
    private final MetadataStore metadataStore;
    private final IMirrorLog mirrorLog;
    private final TrainingOrchestrator orchestrator;
    private final Tracer tracer;
    private final Gauge liveGauge;

    private volatile RestoreReport lastRestore = new RestoreReport(List.of(), Map.of());

    public EngineRegistry(EngineFactoryRegistry factories,
                          MetadataStore metadataStore,
                          IMirrorLog mirrorLog,
                          TrainingOrchestrator orchestrator,
                          Tracer tracer,
                          MetricsRegistry metrics) {
        this.factories = factories;
        this.metadataStore = metadataStore;
        this.mirrorLog = mirrorLog;
        this.orchestrator = orchestrator;
        this.tracer = tracer;
        this.liveGauge = metrics.gauge("engine_instances_live");
    }

    @Override
    public String create(JsonNode params) {
        Span span = tracer.spanBuilder("engine-create").startSpan();
        try (Scope scope = span.makeCurrent()) {
            EngineParams parsed = ParameterStore.parseAndValidate(params,
                    ParameterStore.ENGINE_ID, ParameterStore.ENGINE_FACTORY);
            String engineId = parsed.engineId();
            span.setAttribute("engineId", engineId);
            span.setAttribute("engineFactory", parsed.engineFactory());

            ReentrantLock lock = engineLocks.get(engineId);
            lock.lock();
            try {
                if (liveEngines.containsKey(engineId)) {
                    throw new DuplicateEngineIdException(engineId);
                }
                EngineMetadata metadata = new EngineMetadata(engineId, parsed.engineFactory(),
                        ParameterStore.write(params), parsed.mirror().enabled(), null, null);
                EngineHandle handle = instantiate(engineId, parsed.engineFactory(), params, metadata);
                register(handle, parsed.mirror(), true);
                logger.info(String.format("Created engine '%s' (factory=%s, discipline=%s, mirroring=%s)",
                        engineId, handle.engineFactory(), handle.discipline(), parsed.mirror().enabled()));
                return engineId;
            } finally {
                lock.unlock();
            }
        } catch (EngineException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public void update(String engineId, JsonNode params) {
        Span span = tracer.spanBuilder("engine-update").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("engineId", engineId);
            EngineParams parsed = ParameterStore.parseAndValidate(params);
            if (parsed.engineId() != null && !parsed.engineId().equals(engineId)) {
                throw new ValidationException(engineId, ParameterStore.ENGINE_ID, String.format(
                        "engineId '%s' in parameters does not match the engine being updated ('%s')",
                        parsed.engineId(), engineId));
            }

            ReentrantLock lock = engineLocks.get(engineId);
            lock.lock();
            try {
                EngineHandle handle = lookup(engineId);
                if (parsed.engineFactory() != null && !parsed.engineFactory().equals(handle.engineFactory())) {
                    throw new ValidationException(engineId, ParameterStore.ENGINE_FACTORY, String.format(
                            "engineFactory cannot change on update (current '%s', requested '%s'). Destroy and create instead.",
                            handle.engineFactory(), parsed.engineFactory()));
                }
                reconfigure(handle, params, parsed.mirror());
                logger.info(String.format("Updated engine '%s' (mirroring=%s)", engineId, parsed.mirror().enabled()));
            } finally {
                lock.unlock();
            }
        } catch (EngineException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public void destroy(String engineId) {
        Span span = tracer.spanBuilder("engine-destroy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("engineId", engineId);
            ReentrantLock lock = engineLocks.get(engineId);
            lock.lock();
            try {
                EngineHandle handle = liveEngines.remove(engineId);
                if (handle == null) {
                    throw new EngineNotFoundException(engineId);
                }
                liveGauge.set(liveEngines.size());
                handle.markState(EngineState.DESTROYED);

                // let an input that already holds the lock finish
                handle.inputLock().lock();
                handle.inputLock().unlock();

                orchestrator.retire(handle.trainingSlot());
                mirrorLog.release(engineId);
                RuntimeException releaseFailure = null;
                try {
                    handle.engine().destroy();
                } catch (RuntimeException e) {
                    releaseFailure = e;
                }
                metadataStore.delete(engineId);
                if (releaseFailure != null) {
                    throw new AlgorithmException(engineId, "destroy", releaseFailure);
                }
                logger.info("Destroyed engine '" + engineId + "'");
            } finally {
                lock.unlock();
            }
        } catch (EngineException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public RestoreReport restoreAll() {
        Span span = tracer.spanBuilder("engine-restore-all").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<String> restored = new ArrayList<>();
            Map<String, String> failed = new LinkedHashMap<>();
            List<String> ids;
            try {
                ids = metadataStore.findAllIds();
            } catch (StorageException e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Cannot list persisted engines; nothing restored", e);
                failed.put("*", e.getMessage());
                return remember(new RestoreReport(restored, failed));
            }

            for (String engineId : ids) {
                try {
                    restore(engineId);
                    restored.add(engineId);
                } catch (RuntimeException e) {
                    span.recordException(e);
                    failed.put(engineId, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
                    logger.log(Level.WARNING, "Failed to restore engine '" + engineId + "'", e);
                }
            }
            span.setAttribute("restored", restored.size());
            span.setAttribute("failed", failed.size());
            logger.info(String.format("Restored %d engine(s), %d failed", restored.size(), failed.size()));
            return remember(new RestoreReport(restored, failed));
        } finally {
            span.end();
        }
    }

    @Override
    public EngineStatus status(String engineId) {
        return describe(lookup(engineId));
    }

    @Override
    public List<EngineStatus> list() {
        List<EngineStatus> statuses = new ArrayList<>();
        for (EngineHandle handle : liveEngines.values()) {
            statuses.add(describe(handle));
        }
        statuses.sort(Comparator.comparing(EngineStatus::engineId));
        return statuses;
    }

    @Override
    public void shutdown() {
        logger.info("Shutting down engine registry with " + liveEngines.size() + " live engine(s)");
        orchestrator.shutdown();
        mirrorLog.close();
    }

    /**
     * @throws EngineNotFoundException if the id is not live, including mid-destroy
     */
    public EngineHandle lookup(String engineId) {
        EngineHandle handle = engineId == null ? null : liveEngines.get(engineId);
        if (handle == null || !handle.isRoutable()) {
            throw new EngineNotFoundException(engineId);
        }
        return handle;
    }

    public RestoreReport lastRestoreReport() {
        return lastRestore;
    }

    public int liveCount() {
        return liveEngines.size();
    }

    private void restore(String engineId) {
        ReentrantLock lock = engineLocks.get(engineId);
        lock.lock();
        try {
            if (liveEngines.containsKey(engineId)) {
                return;
            }
            EngineMetadata metadata = metadataStore.findById(engineId)
                    .orElseThrow(() -> new EngineNotFoundException(engineId));
            JsonNode params = ParameterStore.readTree(metadata.params());
            EngineParams parsed = ParameterStore.parseAndValidate(params);
            EngineHandle handle = instantiate(engineId, metadata.engineFactory(), params, metadata);
            register(handle, parsed.mirror(), false);
            logger.fine("Restored engine '" + engineId + "'");
        } finally {
            lock.unlock();
        }
    }

    private EngineHandle instantiate(String engineId, String factoryType, JsonNode params, EngineMetadata metadata) {
        EngineFactory factory = factories.resolve(factoryType);
        Engine engine;
        try {
            engine = factory.create();
        } catch (RuntimeException e) {
            throw new AlgorithmException(engineId, "create", e);
        }
        try {
            initialize(engineId, engine, params);
        } catch (RuntimeException e) {
            release(engineId, engine);
            throw e;
        }
        return new EngineHandle(engineId, factory.type(), engine,
                orchestrator.newSlot(engineId, engine), params, metadata);
    }

    private void register(EngineHandle handle, MirrorSettings mirror, boolean persist) {
        String engineId = handle.engineId();
        Optional<MirrorSettings> previousMirror = mirrorLog.settings(engineId);
        try {
            mirrorLog.configure(engineId, mirror);
            if (persist) {
                metadataStore.save(handle.metadata());
            }
        } catch (RuntimeException e) {
            mirrorLog.configure(engineId, previousMirror.orElse(MirrorSettings.DISABLED));
            release(engineId, handle.engine());
            throw e;
        }
        liveEngines.put(engineId, handle);
        liveGauge.set(liveEngines.size());
    }

    private void reconfigure(EngineHandle handle, JsonNode params, MirrorSettings mirror) {
        String engineId = handle.engineId();
        JsonNode previousParams = handle.params();
        handle.markState(EngineState.UPDATING);
        // inputs wait while the engine re-reads its parameters
        handle.inputLock().lock();
        try {
            initialize(engineId, handle.engine(), params);
            EngineMetadata updated = handle.metadata().withParams(ParameterStore.write(params), mirror.enabled());
            Optional<MirrorSettings> previousMirror = mirrorLog.settings(engineId);
            try {
                if (previousMirror.isPresent() && movesAway(previousMirror.get(), mirror)) {
                    mirrorLog.release(engineId);
                }
                mirrorLog.configure(engineId, mirror);
                metadataStore.save(updated);
            } catch (RuntimeException e) {
                mirrorLog.configure(engineId, previousMirror.orElse(MirrorSettings.DISABLED));
                restorePreviousParams(handle, previousParams);
                throw e;
            }
            handle.applyParams(params, updated);
        } finally {
            handle.inputLock().unlock();
            handle.markState(EngineState.ACTIVE);
        }
    }

    private static boolean movesAway(MirrorSettings current, MirrorSettings next) {
        return current.enabled() && (!next.enabled() || !Objects.equals(current.location(), next.location()));
    }

    private void restorePreviousParams(EngineHandle handle, JsonNode previousParams) {
        try {
            initialize(handle.engineId(), handle.engine(), previousParams);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Engine '" + handle.engineId()
                    + "' could not return to its previous parameters after a failed update", e);
        }
    }

    private static void initialize(String engineId, Engine engine, JsonNode params) {
        try {
            engine.init(engineId, params);
        } catch (EngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AlgorithmException(engineId, "init", e);
        }
    }

    private static void release(String engineId, Engine engine) {
        try {
            engine.destroy();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Engine '" + engineId + "' failed to release resources after a rollback", e);
        }
    }

    private EngineStatus describe(EngineHandle handle) {
        Map<String, Object> details;
        try {
            details = handle.engine().status();
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Engine '" + handle.engineId() + "' status failed", e);
            details = Map.of("statusError", String.valueOf(e.getMessage()));
        }
        return new EngineStatus(handle.engineId(), handle.engineFactory(), handle.state(), handle.discipline(),
                handle.trainingSlot().trainable(), mirrorLog.isEnabled(handle.engineId()), handle.trainingSlot().snapshot(), details);
    }

    private RestoreReport remember(RestoreReport report) {
        this.lastRestore = report;
        return report;
    }
}
