/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.metrics;

/**
 * Instantaneous value metric. Thread-safe.
 */
public interface Gauge {
    void set(double value);

    double value();
}
