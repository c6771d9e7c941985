/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * An input event accepted for one engine instance.
 *
 * <p>Events are immutable once accepted. The host only looks at the envelope
 * (entity, event name, times); {@code properties} are opaque to it and are
 * interpreted by the engine.
 *
 * @param entityType       type of the acting entity (e.g. "user")
 * @param entityId         id of the acting entity
 * @param event            event name; names starting with {@code $} are reserved
 * @param targetEntityType optional type of the entity acted upon
 * @param targetEntityId   optional id of the entity acted upon
 * @param properties       free-form event payload
 * @param eventTime        when the event happened, as reported by the caller
 * @param creationTime     when the host accepted the event
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Event(
        @JsonProperty("entityType") String entityType,
        @JsonProperty("entityId") String entityId,
        @JsonProperty("event") String event,
        @JsonProperty("targetEntityType") String targetEntityType,
        @JsonProperty("targetEntityId") String targetEntityId,
        @JsonProperty("properties") Map<String, JsonNode> properties,
        @JsonProperty("eventTime") Instant eventTime,
        @JsonProperty("creationTime") Instant creationTime) {

    public Event {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    @JsonIgnore
    public boolean isReserved() {
        return ReservedEvents.isReserved(event);
    }

    @JsonIgnore
    public boolean hasTarget() {
        return targetEntityId != null;
    }
}
