/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.engines.properties;

import com.tessera.engine.api.Engine;
import com.tessera.engine.api.EngineFactory;

public class EntityPropertiesEngineFactory implements EngineFactory {

    @Override
    public String type() {
        return EntityPropertiesEngine.TYPE;
    }

    @Override
    public Engine create() {
        return new EntityPropertiesEngine();
    }
}
