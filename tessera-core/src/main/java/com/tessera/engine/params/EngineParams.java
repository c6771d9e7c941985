/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.params;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.engine.api.model.MirrorSettings;

/**
 * Typed top level of a parameter document. The raw tree travels alongside so
 * every component can bind the sub-tree it owns.
 *
 * @param engineId      resource id, {@code null} when the document omits it (update bodies)
 * @param engineFactory factory type, {@code null} when omitted
 * @param mirror        mirroring settings; {@link MirrorSettings#DISABLED} when absent
 * @param raw           the untouched document
 */
public record EngineParams(String engineId, String engineFactory, MirrorSettings mirror, JsonNode raw) {
}
