/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.runtime.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.Event;
import com.tessera.engine.api.model.ReservedEvents;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns an inbound event document into an {@link Event}, stamping the
 * acceptance time. Fails fast on the first invalid field.
 */
public class EventParser {

    private final Clock clock;

    public EventParser() {
        this(Clock.systemUTC());
    }

    public EventParser(Clock clock) {
        this.clock = clock;
    }

    public Event parse(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new ValidationException("event", "Event must be a JSON object");
        }
        String entityType = requiredText(json, "entityType");
        String entityId = requiredText(json, "entityId");
        String eventName = requiredText(json, "event");
        String targetEntityType = optionalText(json, "targetEntityType");
        String targetEntityId = optionalText(json, "targetEntityId");
        if (targetEntityType != null && targetEntityId == null) {
            throw new ValidationException("targetEntityId", "targetEntityId is required when targetEntityType is set");
        }
        if (targetEntityId != null && targetEntityType == null) {
            throw new ValidationException("targetEntityType", "targetEntityType is required when targetEntityId is set");
        }

        Map<String, JsonNode> properties = properties(json);
        if (ReservedEvents.isReserved(eventName)) {
            if (!ReservedEvents.isKnown(eventName)) {
                throw new ValidationException("event",
                        "Unknown reserved event '" + eventName + "'. Supported: " + ReservedEvents.KNOWN);
            }
            if (!ReservedEvents.DELETE.equals(eventName) && properties.isEmpty()) {
                throw new ValidationException("properties", "Event '" + eventName + "' requires non-empty properties");
            }
        }

        Instant creationTime = clock.instant();
        Instant eventTime = eventTime(json, creationTime);
        return new Event(entityType, entityId, eventName, targetEntityType, targetEntityId,
                properties, eventTime, creationTime);
    }

    private static Map<String, JsonNode> properties(JsonNode json) {
        JsonNode node = json.get("properties");
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new ValidationException("properties", "properties must be a JSON object");
        }
        Map<String, JsonNode> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            properties.put(field.getKey(), field.getValue());
        }
        return properties;
    }

    private static Instant eventTime(JsonNode json, Instant defaultTime) {
        String raw = optionalText(json, "eventTime");
        if (raw == null) {
            return defaultTime;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(raw).toInstant();
            } catch (DateTimeParseException ignored) {
                throw new ValidationException("eventTime", "eventTime '" + raw + "' is not an ISO-8601 timestamp");
            }
        }
    }

    private static String requiredText(JsonNode json, String field) {
        String value = optionalText(json, field);
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "Missing required field '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ValidationException(field, "Field '" + field + "' must be a string");
        }
        return value.asText();
    }
}
