/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.metrics.impl.inmemory;

import com.tessera.engine.infra.metrics.MetricsRegistry;
import com.tessera.engine.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider, registered from test resources only.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;  // wins over Prometheus when on the test classpath
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
