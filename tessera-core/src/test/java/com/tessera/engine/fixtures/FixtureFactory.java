/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.fixtures;

import com.tessera.engine.api.Engine;
import com.tessera.engine.api.EngineFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Factory that remembers every engine it created, newest last.
 */
public class FixtureFactory<E extends Engine> implements EngineFactory {

    private final String type;
    private final Supplier<E> supplier;
    private final List<E> created = new CopyOnWriteArrayList<>();

    public FixtureFactory(String type, Supplier<E> supplier) {
        this.type = type;
        this.supplier = supplier;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public Engine create() {
        E engine = supplier.get();
        created.add(engine);
        return engine;
    }

    public E last() {
        return created.get(created.size() - 1);
    }

    public List<E> created() {
        return created;
    }
}
