/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.metrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Latency histogram. Thread-safe.
 */
public interface Timer {

    /**
     * Records a pre-measured duration.
     */
    void record(Duration duration);

    /**
     * Times a supplier and records its duration, also when it throws.
     */
    default <T> T time(Supplier<T> supplier) {
        long start = System.nanoTime();
        try {
            return supplier.get();
        } finally {
            record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * @return number of recorded observations
     */
    long count();
}
