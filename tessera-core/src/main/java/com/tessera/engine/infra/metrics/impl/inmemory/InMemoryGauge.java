/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.metrics.impl.inmemory;

import com.tessera.engine.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {
    private volatile double value;

    @Override
    public void set(double newValue) {
        value = newValue;
    }

    @Override
    public double value() {
        return value;
    }
}
