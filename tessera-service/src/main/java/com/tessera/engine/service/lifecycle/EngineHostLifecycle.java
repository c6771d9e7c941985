/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.service.lifecycle;

import com.tessera.engine.api.model.RestoreReport;
import com.tessera.engine.infra.management.EngineRegistry;
import com.tessera.engine.infra.telemetry.TracingService;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import java.util.logging.Logger;

/**
 * Application lifecycle management for the engine host.
 * Restores persisted instances on startup and stops training on shutdown.
 */
@ApplicationScoped
public class EngineHostLifecycle {

    private static final Logger logger = Logger.getLogger(EngineHostLifecycle.class.getName());

    @Inject
    EngineRegistry registry;

    @Inject
    TracingService tracingService;

    void onStart(@Observes StartupEvent event) {
        logger.info("Starting Tessera engine host (tracing " + (tracingService.isEnabled() ? "enabled" : "disabled") + ")");
        RestoreReport report = registry.restoreAll();
        if (report.isComplete()) {
            logger.info("Engine host is ready with " + report.restored().size() + " engine instance(s)");
        } else {
            logger.warning("Engine host started with " + report.failed().size()
                    + " instance(s) that could not be restored: " + report.failed().keySet());
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        logger.info("Shutting down engine host");
        registry.shutdown();
        tracingService.shutdown();
        logger.info("Engine host shutdown complete");
    }
}
