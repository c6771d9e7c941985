/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api;

/**
 * Builds engine instances for one engine type.
 *
 * <p>Factories are compiled in and discovered through {@link java.util.ServiceLoader}
 * or registered explicitly at start-up. Implementations must have a public
 * no-arg constructor to be discoverable.
 */
public interface EngineFactory {

    /**
     * @return the identifier callers put in {@code engineFactory}
     */
    String type();

    /**
     * @return a new, uninitialized engine
     */
    Engine create();
}
