/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.Event;

import java.util.Map;

/**
 * Contract every hosted engine instance implements.
 *
 * <p>An engine owns its Dataset and Model. The host never looks inside them; it
 * only decides when to call into the engine. Training capabilities are declared
 * by also implementing {@link IncrementalLearner} and/or {@link BatchTrainable}.
 *
 * <p><b>Thread Safety:</b> the host serializes {@link #input} and model mutation
 * per instance, but {@link #query} runs concurrently with both. Implementations
 * must make reads safe against concurrent writes themselves.
 */
public interface Engine {

    /**
     * Initializes the engine from the full parameter document. Called once on
     * create and again on every update of the same instance; the Dataset must
     * survive re-initialization.
     *
     * @param engineId resource id of this instance
     * @param params   the whole parameter tree; the engine reads only the sub-trees it owns
     * @throws ValidationException if the engine's own parameters are missing or malformed
     * @throws com.tessera.engine.api.exceptions.UnsupportedUpdateException if a
     *         re-initialization changes configuration that cannot change in place
     */
    void init(String engineId, JsonNode params);

    /**
     * Checks an event before anything is persisted. Must not mutate state.
     */
    default void validate(Event event) {
    }

    /**
     * Accumulates an accepted, non-reserved event into the Dataset.
     */
    void input(Event event);

    /**
     * Answers an engine-specific query. Never mutates state.
     */
    JsonNode query(JsonNode query);

    /**
     * Releases the Dataset and Model. After this call no state of the instance
     * may be recoverable.
     */
    void destroy();

    /**
     * @return engine-specific details for status reporting
     */
    default Map<String, Object> status() {
        return Map.of();
    }

    /**
     * @return whether this engine applies the given reserved event (e.g. {@code $set})
     */
    default boolean supportsReservedEvent(String eventName) {
        return false;
    }

    /**
     * Applies a reserved event in place of {@link #input}. Only called when
     * {@link #supportsReservedEvent} returned true for its name.
     */
    default void applyReservedEvent(Event event) {
        throw new ValidationException("event", "Reserved event '" + event.event() + "' is not supported by this engine");
    }
}
