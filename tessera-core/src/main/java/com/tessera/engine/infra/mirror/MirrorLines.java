/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.mirror;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.engine.api.model.Event;
import com.tessera.engine.api.model.MirrorRecord;
import com.tessera.engine.params.ParameterStore;

import java.util.Optional;

/**
 * Line format of a mirror log: one JSON object per line carrying
 * {@code sequence}, {@code engineId}, {@code eventTime}, {@code creationTime}
 * and the raw {@code event}.
 */
final class MirrorLines {

    private static final ObjectMapper MAPPER = ParameterStore.mapper();

    private MirrorLines() {
    }

    static String encode(MirrorRecord record) throws JsonProcessingException {
        ObjectNode line = MAPPER.createObjectNode();
        line.put("sequence", record.sequence());
        line.put("engineId", record.engineId());
        line.put("eventTime", record.event().eventTime().toString());
        line.put("creationTime", record.event().creationTime().toString());
        line.set("event", MAPPER.valueToTree(record.event()));
        return MAPPER.writeValueAsString(line);
    }

    /**
     * @return the record, or empty when the line is torn or unreadable
     */
    static Optional<MirrorRecord> decode(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(line);
            JsonNode sequence = node.get("sequence");
            JsonNode event = node.get("event");
            if (sequence == null || !sequence.canConvertToLong() || event == null || !event.isObject()) {
                return Optional.empty();
            }
            return Optional.of(new MirrorRecord(node.path("engineId").asText(null), sequence.asLong(),
                    MAPPER.treeToValue(event, Event.class)));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
