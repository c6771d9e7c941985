/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.service.config;

import com.tessera.engine.api.IMirrorLog;
import com.tessera.engine.infra.management.EngineFactoryRegistry;
import com.tessera.engine.infra.management.EngineRegistry;
import com.tessera.engine.infra.metrics.MetricsRegistry;
import com.tessera.engine.infra.mirror.FileMirrorLog;
import com.tessera.engine.infra.store.FileMetadataStore;
import com.tessera.engine.infra.store.MetadataStore;
import com.tessera.engine.infra.telemetry.TracingService;
import com.tessera.engine.runtime.event.EventParser;
import com.tessera.engine.runtime.routing.EngineRouter;
import com.tessera.engine.runtime.training.TrainingOrchestrator;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * CDI producers for the engine host components.
 * Everything is a singleton shared by all resources.
 */
@ApplicationScoped
public class EngineHostProducers {

    private static final Logger logger = Logger.getLogger(EngineHostProducers.class.getName());

    @ConfigProperty(name = "tessera.metadata.dir", defaultValue = "data/engines")
    String metadataDir;

    @ConfigProperty(name = "tessera.mirror.root", defaultValue = "data/mirrors")
    String mirrorRoot;

    @Produces
    @Singleton
    public TracingService tracingService() {
        return TracingService.getInstance();
    }

    @Produces
    @Singleton
    public Tracer tracer(TracingService tracingService) {
        return tracingService.getTracer();
    }

    /**
     * Produces the metrics registry selected through ServiceLoader (Prometheus in production).
     */
    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        return MetricsRegistry.getInstance();
    }

    /**
     * Produces the registry of compiled-in engine types.
     */
    @Produces
    @Singleton
    public EngineFactoryRegistry engineFactoryRegistry() {
        EngineFactoryRegistry factories = EngineFactoryRegistry.fromServiceLoader();
        logger.info("Engine types available: " + factories.types());
        return factories;
    }

    @Produces
    @Singleton
    public MetadataStore metadataStore() {
        return new FileMetadataStore(Path.of(metadataDir));
    }

    @Produces
    @Singleton
    public IMirrorLog mirrorLog() {
        return new FileMirrorLog(Path.of(mirrorRoot));
    }

    @Produces
    @Singleton
    public TrainingOrchestrator trainingOrchestrator(Tracer tracer) {
        return new TrainingOrchestrator(tracer);
    }

    @Produces
    @Singleton
    public EngineRegistry engineRegistry(EngineFactoryRegistry factories,
                                         MetadataStore metadataStore,
                                         IMirrorLog mirrorLog,
                                         TrainingOrchestrator orchestrator,
                                         Tracer tracer,
                                         MetricsRegistry metrics) {
        return new EngineRegistry(factories, metadataStore, mirrorLog, orchestrator, tracer, metrics);
    }

    @Produces
    @Singleton
    public EngineRouter engineRouter(EngineRegistry registry,
                                     IMirrorLog mirrorLog,
                                     TrainingOrchestrator orchestrator,
                                     Tracer tracer,
                                     MetricsRegistry metrics) {
        return new EngineRouter(registry, mirrorLog, orchestrator, new EventParser(), tracer, metrics);
    }
}
