/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.metrics;

/**
 * Monotonically increasing counter. Thread-safe.
 */
public interface Counter {
    void increment();

    void increment(long amount);

    long count();
}
