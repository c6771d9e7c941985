/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.engines.popularity;

import com.tessera.engine.api.Engine;
import com.tessera.engine.api.EngineFactory;

public class PopularityEngineFactory implements EngineFactory {

    @Override
    public String type() {
        return PopularityEngine.TYPE;
    }

    @Override
    public Engine create() {
        return new PopularityEngine();
    }
}
