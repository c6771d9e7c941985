/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.engines.popularity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.engine.api.BatchTrainable;
import com.tessera.engine.api.Engine;
import com.tessera.engine.api.IncrementalLearner;
import com.tessera.engine.api.TrainedModel;
import com.tessera.engine.api.TrainingContext;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.Event;
import com.tessera.engine.api.model.ReservedEvents;
import com.tessera.engine.params.ParameterStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Ranks items by how often they were the target of selected events inside a
 * time window.
 *
 * <p>The Dataset is the accepted interaction events plus item properties set
 * through {@code $set}/{@code $unset}. A training run counts events named in
 * {@code algorithm.eventNames} per target item and swaps in the new ranking.
 * Between runs the live ranking follows {@code $delete} of items.
 *
 * <pre>{@code
 * "algorithm": {
 *   "eventNames": ["buy", "view"],
 *   "num": 20,
 *   "blacklistEvents": ["buy"],
 *   "duration": "30 days",
 *   "offsetDate": "2025-01-01T00:00:00Z"
 * }
 * }</pre>
 */
public class PopularityEngine implements Engine, BatchTrainable, IncrementalLearner {

    private static final Logger logger = Logger.getLogger(PopularityEngine.class.getName());

    public static final String TYPE = "popularity";
    public static final String USER = "user";
    public static final String ITEM = "item";

    static final int DEFAULT_NUM = 20;
    static final String DEFAULT_DURATION = "3650 days";
    private static final int CANCEL_CHECK_INTERVAL = 1024;

    /**
     * The {@code algorithm} section as sent by the caller.
     */
    public record AlgorithmParams(List<String> eventNames,
                                  Integer num,
                                  List<String> blacklistEvents,
                                  String duration,
                                  String offsetDate) {
        public AlgorithmParams {
            if (eventNames == null || eventNames.isEmpty()) {
                throw new ValidationException("eventNames", "Must have at least one entry in eventNames");
            }
            if (num != null && num <= 0) {
                throw new ValidationException("num", "num must be > 0");
            }
            eventNames = List.copyOf(eventNames);
            blacklistEvents = blacklistEvents == null ? null : List.copyOf(blacklistEvents);
        }
    }

    /**
     * A query body. Every member is optional.
     *
     * @param filters item property name to accepted values; an item must match all of them
     */
    public record Query(Integer num,
                       List<String> blacklistItems,
                       String user,
                       Map<String, List<String>> filters) {
        public Query {
            if (num != null && num <= 0) {
                throw new ValidationException("num", "num must be > 0");
            }
            blacklistItems = blacklistItems == null ? List.of() : List.copyOf(blacklistItems);
            filters = filters == null ? Map.of() : Map.copyOf(filters);
        }
    }

    record Settings(List<String> eventNames, int num, List<String> blacklistEvents,
                    Duration window, Instant offsetDate) {
    }

    public record ItemScore(String item, double score) {
    }

    record Ranking(List<ItemScore> items, Instant trainedAt) {
        static final Ranking EMPTY = new Ranking(List.of(), null);

        Ranking without(String item) {
            List<ItemScore> kept = new ArrayList<>(items.size());
            for (ItemScore score : items) {
                if (!score.item().equals(item)) {
                    kept.add(score);
                }
            }
            return kept.size() == items.size() ? this : new Ranking(List.copyOf(kept), trainedAt);
        }
    }

    private final Clock clock;
    private final ConcurrentLinkedQueue<Event> events = new ConcurrentLinkedQueue<>();
    private final Map<String, Map<String, JsonNode>> itemProperties = new ConcurrentHashMap<>();
    private final AtomicReference<Ranking> ranking = new AtomicReference<>(Ranking.EMPTY);

    private volatile String engineId;
    private volatile Settings settings;

    public PopularityEngine() {
        this(Clock.systemUTC());
    }

    public PopularityEngine(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void init(String engineId, JsonNode params) {
        AlgorithmParams algorithm = ParameterStore.requireSection(params, "algorithm", AlgorithmParams.class);
        Settings next = new Settings(
                algorithm.eventNames(),
                algorithm.num() == null ? DEFAULT_NUM : algorithm.num(),
                algorithm.blacklistEvents() == null ? List.of(algorithm.eventNames().get(0)) : algorithm.blacklistEvents(),
                Durations.parse("algorithm.duration",
                        algorithm.duration() == null ? DEFAULT_DURATION : algorithm.duration()),
                parseOffsetDate(algorithm.offsetDate()));
        this.engineId = engineId;
        this.settings = next;
        logSettings(engineId, next);
    }

    @Override
    public void validate(Event event) {
        if (!event.isReserved()) {
            if (settings.eventNames().contains(event.event()) && !event.hasTarget()) {
                throw new ValidationException("targetEntityId",
                        "Event '" + event.event() + "' is used for ranking and needs a targetEntityId");
            }
            return;
        }
        switch (event.event()) {
            case ReservedEvents.DELETE -> {
                if (!USER.equals(event.entityType()) && !ITEM.equals(event.entityType())) {
                    throw new ValidationException("entityType",
                            "Deleting unknown entityType '" + event.entityType() + "' is not supported");
                }
            }
            case ReservedEvents.SET, ReservedEvents.UNSET -> {
                if (!ITEM.equals(event.entityType())) {
                    throw new ValidationException("entityType",
                            "Using " + event.event() + " on entityType '" + event.entityType() + "' is not supported");
                }
            }
            default -> throw new ValidationException("event", "Reserved event '" + event.event() + "' is not supported");
        }
    }

    @Override
    public void input(Event event) {
        events.add(event);
    }

    @Override
    public boolean supportsReservedEvent(String eventName) {
        return ReservedEvents.isKnown(eventName);
    }

    @Override
    public void applyReservedEvent(Event event) {
        String id = event.entityId();
        switch (event.event()) {
            case ReservedEvents.SET -> itemProperties.merge(id, event.properties(), (current, update) -> {
                Map<String, JsonNode> merged = new HashMap<>(current);
                merged.putAll(update);
                return Map.copyOf(merged);
            });
            case ReservedEvents.UNSET -> itemProperties.computeIfPresent(id, (key, current) -> {
                Map<String, JsonNode> kept = new HashMap<>(current);
                kept.keySet().removeAll(event.properties().keySet());
                return Map.copyOf(kept);
            });
            case ReservedEvents.DELETE -> {
                if (ITEM.equals(event.entityType())) {
                    itemProperties.remove(id);
                    events.removeIf(e -> id.equals(e.targetEntityId()));
                } else {
                    events.removeIf(e -> USER.equals(e.entityType()) && id.equals(e.entityId()));
                }
            }
            default -> throw new ValidationException("event", "Reserved event '" + event.event() + "' is not supported");
        }
    }

    /**
     * Keeps the live ranking consistent with item deletions between training runs.
     */
    @Override
    public void learn(Event event) {
        if (ReservedEvents.DELETE.equals(event.event()) && ITEM.equals(event.entityType())) {
            ranking.updateAndGet(current -> current.without(event.entityId()));
        }
    }

    @Override
    public TrainedModel train(TrainingContext context) {
        Settings current = settings;
        Instant end = current.offsetDate() != null ? current.offsetDate() : clock.instant();
        Instant start = end.minus(current.window());
        Set<String> counted = Set.copyOf(current.eventNames());

        Map<String, Long> counts = new HashMap<>();
        int seen = 0;
        for (Event event : events) {
            if (++seen % CANCEL_CHECK_INTERVAL == 0 && context.isCancelled()) {
                throw new CancellationException("Training of " + context.engineId() + " cancelled");
            }
            if (!counted.contains(event.event()) || !event.hasTarget()) {
                continue;
            }
            Instant at = event.eventTime();
            if (at.isBefore(start) || at.isAfter(end)) {
                continue;
            }
            counts.merge(event.targetEntityId(), 1L, Long::sum);
        }

        List<ItemScore> ranked = new ArrayList<>(counts.size());
        counts.forEach((item, count) -> ranked.add(new ItemScore(item, count)));
        ranked.sort(Comparator.comparingDouble(ItemScore::score).reversed().thenComparing(ItemScore::item));
        Ranking candidate = new Ranking(List.copyOf(ranked), clock.instant());

        return new TrainedModel() {
            @Override
            public void activate() {
                ranking.set(candidate);
            }

            @Override
            public String summary() {
                return candidate.items().size() + " items ranked from " + start + " to " + end;
            }
        };
    }

    @Override
    public JsonNode query(JsonNode queryJson) {
        Query query = ParameterStore.bind(queryJson, "query", Query.class);
        Settings current = settings;
        int limit = query.num() != null ? query.num() : current.num();

        Set<String> excluded = new HashSet<>(query.blacklistItems());
        if (query.user() != null && !current.blacklistEvents().isEmpty()) {
            Set<String> blacklistEvents = Set.copyOf(current.blacklistEvents());
            for (Event event : events) {
                if (USER.equals(event.entityType()) && query.user().equals(event.entityId())
                        && blacklistEvents.contains(event.event()) && event.hasTarget()) {
                    excluded.add(event.targetEntityId());
                }
            }
        }

        ObjectNode result = ParameterStore.mapper().createObjectNode();
        ArrayNode items = result.putArray("result");
        for (ItemScore score : ranking.get().items()) {
            if (items.size() >= limit) {
                break;
            }
            if (excluded.contains(score.item()) || !matches(score.item(), query.filters())) {
                continue;
            }
            items.addObject().put("item", score.item()).put("score", score.score());
        }
        return result;
    }

    @Override
    public void destroy() {
        events.clear();
        itemProperties.clear();
        ranking.set(Ranking.EMPTY);
    }

    @Override
    public Map<String, Object> status() {
        Ranking current = ranking.get();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("events", events.size());
        status.put("itemsWithProperties", itemProperties.size());
        status.put("rankedItems", current.items().size());
        if (current.trainedAt() != null) {
            status.put("trainedAt", current.trainedAt().toString());
        }
        return status;
    }

    Map<String, JsonNode> itemProperties(String item) {
        return itemProperties.getOrDefault(item, Map.of());
    }

    Settings settings() {
        return settings;
    }

    private boolean matches(String item, Map<String, List<String>> filters) {
        if (filters.isEmpty()) {
            return true;
        }
        Map<String, JsonNode> properties = itemProperties(item);
        for (Map.Entry<String, List<String>> filter : filters.entrySet()) {
            JsonNode value = properties.get(filter.getKey());
            if (value == null || !anyMatch(value, filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean anyMatch(JsonNode value, List<String> accepted) {
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (accepted.contains(element.asText())) {
                    return true;
                }
            }
            return false;
        }
        return accepted.contains(value.asText());
    }

    private static Instant parseOffsetDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException inner) {
                throw new ValidationException("algorithm.offsetDate",
                        "Cannot parse offsetDate '" + text + "', expected an ISO-8601 date-time");
            }
        }
    }

    private static void logSettings(String engineId, Settings settings) {
        String rule = "=".repeat(72);
        StringBuilder table = new StringBuilder()
                .append("Popularity engine initialization parameters including defaults\n")
                .append(rule).append('\n');
        row(table, "Engine id:", engineId);
        row(table, "Event names:", settings.eventNames());
        row(table, "Blacklist events:", settings.blacklistEvents());
        row(table, "Result limit:", settings.num());
        row(table, "Window:", settings.window());
        row(table, "Offset date:", settings.offsetDate() == null ? "now" : settings.offsetDate());
        table.append(rule);
        logger.info(table.toString());
    }

    private static void row(StringBuilder table, String label, Object value) {
        table.append(String.format("%-30s%s%n", label, value));
    }
}
