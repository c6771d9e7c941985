/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.params;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.MirrorSettings;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses and validates engine parameter documents.
 *
 * <p>Only the top level is interpreted here ({@code engineId},
 * {@code engineFactory}, {@code mirrorType}, {@code mirrorLocation}). Every
 * other key is passed through untouched; components bind the sub-trees they
 * own with {@link #section} or {@link #requireSection}. Unknown keys are
 * never errors.
 */
public final class ParameterStore {

    public static final String ENGINE_ID = "engineId";
    public static final String ENGINE_FACTORY = "engineFactory";
    public static final String MIRROR_TYPE = "mirrorType";
    public static final String MIRROR_LOCATION = "mirrorLocation";

    public static final String MIRROR_TYPE_LOCALFS = "localfs";
    public static final String MIRROR_TYPE_FILE = "file";
    public static final String MIRROR_TYPE_NONE = "none";

    private static final Pattern ENGINE_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ParameterStore() {
        // utility class
    }

    /**
     * @return the shared mapper, configured for ISO-8601 instants and lenient binding
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("params", "Parameters are empty");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("params", "Malformed JSON: " + e.getOriginalMessage());
        }
    }

    public static String write(JsonNode json) {
        try {
            return MAPPER.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize parameter tree", e);
        }
    }

    /**
     * Validates the typed top level of a document.
     *
     * @param json         the parameter document
     * @param requiredKeys top-level keys that must be present and non-blank
     * @throws ValidationException naming the first offending key
     */
    public static EngineParams parseAndValidate(JsonNode json, String... requiredKeys) {
        if (json == null || !json.isObject()) {
            throw new ValidationException("params", "Parameters must be a JSON object");
        }
        for (String key : requiredKeys) {
            JsonNode value = json.get(key);
            if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
                throw new ValidationException(key, "Missing required parameter '" + key + "'");
            }
        }

        String engineId = optionalText(json, ENGINE_ID);
        if (engineId != null) {
            validateEngineId(engineId);
        }
        String engineFactory = optionalText(json, ENGINE_FACTORY);
        if (engineFactory != null && engineFactory.isBlank()) {
            throw new ValidationException(ENGINE_FACTORY, "Parameter 'engineFactory' must not be blank");
        }
        return new EngineParams(engineId, engineFactory, mirrorSettings(json), json);
    }

    public static void validateEngineId(String engineId) {
        if (engineId == null || !ENGINE_ID_PATTERN.matcher(engineId).matches()) {
            throw new ValidationException(ENGINE_ID,
                    "Invalid engineId '" + engineId + "': expected letters, digits, '_', '.' or '-' (max 128), starting with a letter or digit");
        }
    }

    /**
     * Binds an optional sub-tree to a component schema.
     *
     * @return empty when the key is absent or null
     * @throws ValidationException with the dotted path of the first mismatch
     */
    public static <T> Optional<T> section(JsonNode root, String key, Class<T> schema) {
        JsonNode node = root == null ? null : root.get(key);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.ofNullable(bind(node, key, schema));
    }

    /**
     * Binds a JSON object to a schema, reporting errors under {@code name}.
     */
    public static <T> T bind(JsonNode node, String name, Class<T> schema) {
        if (node == null || !node.isObject()) {
            throw new ValidationException(name, "'" + name + "' must be a JSON object");
        }
        try {
            return MAPPER.treeToValue(node, schema);
        } catch (ValidationException e) {
            throw new ValidationException(e.field() == null ? name : name + "." + e.field(), e.getMessage());
        } catch (JsonMappingException e) {
            throw bindingFailure(name, e);
        } catch (JsonProcessingException e) {
            throw new ValidationException(name, "Cannot read '" + name + "': " + e.getOriginalMessage());
        }
    }

    public static <T> T requireSection(JsonNode root, String key, Class<T> schema) {
        return section(root, key, schema)
                .orElseThrow(() -> new ValidationException(key, "Missing required parameter '" + key + "'"));
    }

    private static ValidationException bindingFailure(String key, JsonMappingException e) {
        // schema constructors report their own field relative to the section
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof ValidationException inner) {
                String field = inner.field() == null ? key : key + "." + inner.field();
                return new ValidationException(field, inner.getMessage());
            }
        }
        String path = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."));
        String field = path.isEmpty() ? key : key + "." + path.replace(".[", "[");
        return new ValidationException(field, "Invalid value for '" + field + "': " + e.getOriginalMessage());
    }

    private static MirrorSettings mirrorSettings(JsonNode json) {
        String type = optionalText(json, MIRROR_TYPE);
        String location = optionalText(json, MIRROR_LOCATION);
        if (type == null || MIRROR_TYPE_NONE.equalsIgnoreCase(type)) {
            return MirrorSettings.DISABLED;
        }
        String normalized = type.toLowerCase(Locale.ROOT);
        if (!MIRROR_TYPE_LOCALFS.equals(normalized) && !MIRROR_TYPE_FILE.equals(normalized)) {
            throw new ValidationException(MIRROR_TYPE,
                    "Unsupported mirrorType '" + type + "'. Supported: localfs, file, none");
        }
        Path path = null;
        if (location != null && !location.isBlank()) {
            try {
                path = Path.of(location);
            } catch (InvalidPathException e) {
                throw new ValidationException(MIRROR_LOCATION, "Invalid mirrorLocation '" + location + "': " + e.getReason());
            }
        }
        return new MirrorSettings(true, MIRROR_TYPE_LOCALFS, path);
    }

    private static String optionalText(JsonNode json, String key) {
        JsonNode value = json.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ValidationException(key, "Parameter '" + key + "' must be a string");
        }
        return value.asText();
    }
}
