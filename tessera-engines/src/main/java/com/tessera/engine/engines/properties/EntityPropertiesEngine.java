/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.engines.properties;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.engine.api.Engine;
import com.tessera.engine.api.IncrementalLearner;
import com.tessera.engine.api.exceptions.UnsupportedUpdateException;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.Event;
import com.tessera.engine.api.model.ReservedEvents;
import com.tessera.engine.params.ParameterStore;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.logging.Logger;

/**
 * Keeps the current properties of entities of the configured types.
 *
 * <p>Continuous: each accepted {@code $set}, {@code $unset} or {@code $delete}
 * is journaled into the Dataset and applied to the property map right away.
 * Plain interaction events are rejected.
 */
public class EntityPropertiesEngine implements Engine, IncrementalLearner {

    private static final Logger logger = Logger.getLogger(EntityPropertiesEngine.class.getName());

    public static final String TYPE = "entity-properties";

    public record AlgorithmParams(List<String> entityTypes) {
        public AlgorithmParams {
            if (entityTypes == null || entityTypes.isEmpty()) {
                throw new ValidationException("entityTypes", "Must have at least one entry in entityTypes");
            }
            entityTypes = List.copyOf(entityTypes);
        }
    }

    public record Query(String entityType, String entityId) {
        public Query {
            if (entityType == null || entityType.isBlank()) {
                throw new ValidationException("entityType", "Missing required field 'entityType'");
            }
            if (entityId == null || entityId.isBlank()) {
                throw new ValidationException("entityId", "Missing required field 'entityId'");
            }
        }
    }

    private final ConcurrentLinkedQueue<Event> journal = new ConcurrentLinkedQueue<>();
    private final Map<String, Map<String, Map<String, JsonNode>>> properties = new ConcurrentHashMap<>();

    private volatile String engineId;
    private volatile Set<String> entityTypes;

    @Override
    public void init(String engineId, JsonNode params) {
        AlgorithmParams algorithm = ParameterStore.requireSection(params, "algorithm", AlgorithmParams.class);
        Set<String> next = Set.copyOf(algorithm.entityTypes());
        if (entityTypes != null && !entityTypes.equals(next)) {
            throw new UnsupportedUpdateException(engineId, "algorithm.entityTypes",
                    "entityTypes cannot change on an existing instance; create a new one and replay into it");
        }
        this.engineId = engineId;
        this.entityTypes = next;
        logger.info("Entity properties engine " + engineId + " tracks entity types " + algorithm.entityTypes());
    }

    @Override
    public void validate(Event event) {
        if (!event.isReserved()) {
            throw new ValidationException("event",
                    "Only $set, $unset and $delete are accepted, got '" + event.event() + "'");
        }
        if (entityTypes.contains(event.entityType())) {
            return;
        }
        if (ReservedEvents.DELETE.equals(event.event())) {
            throw new ValidationException("entityType",
                    "Deleting unknown entityType '" + event.entityType() + "' is not supported");
        }
        throw new ValidationException("entityType",
                "Using " + event.event() + " on unknown entityType '" + event.entityType() + "' is not supported");
    }

    @Override
    public void input(Event event) {
        journal.add(event);
    }

    @Override
    public boolean supportsReservedEvent(String eventName) {
        return ReservedEvents.isKnown(eventName);
    }

    @Override
    public void applyReservedEvent(Event event) {
        journal.add(event);
    }

    @Override
    public void learn(Event event) {
        Map<String, Map<String, JsonNode>> ofType =
                properties.computeIfAbsent(event.entityType(), type -> new ConcurrentHashMap<>());
        String id = event.entityId();
        switch (event.event()) {
            case ReservedEvents.SET -> ofType.merge(id, event.properties(), (current, update) -> {
                Map<String, JsonNode> merged = new HashMap<>(current);
                merged.putAll(update);
                return Map.copyOf(merged);
            });
            case ReservedEvents.UNSET -> ofType.computeIfPresent(id, (key, current) -> {
                Map<String, JsonNode> kept = new HashMap<>(current);
                kept.keySet().removeAll(event.properties().keySet());
                return Map.copyOf(kept);
            });
            case ReservedEvents.DELETE -> ofType.remove(id);
            default -> {
                // plain events never reach the model
            }
        }
    }

    @Override
    public JsonNode query(JsonNode queryJson) {
        Query query = ParameterStore.bind(queryJson, "query", Query.class);
        if (!entityTypes.contains(query.entityType())) {
            throw new ValidationException("query.entityType",
                    "entityType '" + query.entityType() + "' is not tracked by " + engineId);
        }
        Map<String, JsonNode> current = properties
                .getOrDefault(query.entityType(), Map.of())
                .get(query.entityId());

        ObjectNode result = ParameterStore.mapper().createObjectNode();
        result.put("entityType", query.entityType());
        result.put("entityId", query.entityId());
        result.put("found", current != null);
        ObjectNode props = result.putObject("properties");
        if (current != null) {
            current.forEach(props::set);
        }
        return result;
    }

    @Override
    public void destroy() {
        journal.clear();
        properties.clear();
    }

    @Override
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("journaled", journal.size());
        properties.forEach((type, entities) -> status.put(type, entities.size()));
        return status;
    }
}
