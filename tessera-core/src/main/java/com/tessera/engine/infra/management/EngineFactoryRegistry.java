/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.management;

import com.tessera.engine.api.EngineFactory;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.params.ParameterStore;

import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Maps {@code engineFactory} identifiers to compiled-in factories. Populated
 * once at start-up from {@link ServiceLoader} and explicit registrations;
 * nothing is loaded from outside the classpath.
 */
public class EngineFactoryRegistry {
    private static final Logger logger = Logger.getLogger(EngineFactoryRegistry.class.getName());

    private final ConcurrentMap<String, EngineFactory> factories = new ConcurrentHashMap<>();

    public static EngineFactoryRegistry fromServiceLoader() {
        return fromServiceLoader(Thread.currentThread().getContextClassLoader());
    }

    public static EngineFactoryRegistry fromServiceLoader(ClassLoader classLoader) {
        EngineFactoryRegistry registry = new EngineFactoryRegistry();
        for (EngineFactory factory : ServiceLoader.load(EngineFactory.class, classLoader)) {
            registry.register(factory);
        }
        logger.info("Discovered engine factories: " + registry.types());
        return registry;
    }

    /**
     * @throws IllegalStateException if another factory already claims the type
     */
    public EngineFactoryRegistry register(EngineFactory factory) {
        EngineFactory existing = factories.putIfAbsent(factory.type(), factory);
        if (existing != null && existing.getClass() != factory.getClass()) {
            throw new IllegalStateException(String.format("Engine factory type '%s' is claimed by both %s and %s",
                    factory.type(), existing.getClass().getName(), factory.getClass().getName()));
        }
        return this;
    }

    /**
     * @throws ValidationException on {@code engineFactory} when the type is unknown
     */
    public EngineFactory resolve(String type) {
        EngineFactory factory = type == null ? null : factories.get(type);
        if (factory == null) {
            throw new ValidationException(ParameterStore.ENGINE_FACTORY,
                    "Unknown engineFactory '" + type + "'. Available: " + types());
        }
        return factory;
    }

    public Set<String> types() {
        return new TreeSet<>(factories.keySet());
    }
}
