/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.service.health;

import com.tessera.engine.api.model.RestoreReport;
import com.tessera.engine.infra.management.EngineRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness of the engine host. Down while any persisted instance failed to
 * restore, since callers would get NOT_FOUND for it.
 */
@Readiness
@ApplicationScoped
public class EngineRegistryHealthCheck implements HealthCheck {

    @Inject
    EngineRegistry registry;

    @Override
    public HealthCheckResponse call() {
        RestoreReport report = registry.lastRestoreReport();
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder()
                .name("engine-registry")
                .withData("liveEngines", (long) registry.liveCount())
                .withData("restoredEngines", (long) report.restored().size());

        if (report.isComplete()) {
            return builder.up().build();
        }
        report.failed().forEach((engineId, reason) -> builder.withData("restoreFailed." + engineId, reason));
        return builder.down().build();
    }
}
