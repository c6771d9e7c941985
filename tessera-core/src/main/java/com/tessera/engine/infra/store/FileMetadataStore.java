/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.engine.api.exceptions.StorageException;
import com.tessera.engine.api.model.EngineMetadata;
import com.tessera.engine.params.ParameterStore;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * One JSON document per instance under a directory: {@code <dir>/<engineId>.json}.
 * Writes go to a temporary file that is moved over the old document, so a
 * crash leaves either the old or the new record.
 */
public class FileMetadataStore implements MetadataStore {
    private static final Logger logger = Logger.getLogger(FileMetadataStore.class.getName());

    private static final String SUFFIX = ".json";
    private static final ObjectMapper MAPPER = ParameterStore.mapper();

    private final Path directory;

    public FileMetadataStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public void save(EngineMetadata metadata) {
        Path target = fileFor(metadata.engineId());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, metadata.engineId() + "-", ".tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), metadata);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException(metadata.engineId(), "Failed to persist metadata to " + target, e);
        }
    }

    @Override
    public Optional<EngineMetadata> findById(String engineId) {
        Path file = fileFor(engineId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(file.toFile(), EngineMetadata.class));
        } catch (IOException e) {
            throw new StorageException(engineId, "Failed to read metadata from " + file, e);
        }
    }

    @Override
    public List<String> findAllIds() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                ids.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new StorageException(null, "Failed to list metadata in " + directory, e);
        }
        ids.sort(null);
        return ids;
    }

    @Override
    public boolean delete(String engineId) {
        try {
            return Files.deleteIfExists(fileFor(engineId));
        } catch (IOException e) {
            throw new StorageException(engineId, "Failed to delete metadata of '" + engineId + "'", e);
        }
    }

    @Override
    public boolean exists(String engineId) {
        return Files.exists(fileFor(engineId));
    }

    private Path fileFor(String engineId) {
        return directory.resolve(engineId + SUFFIX);
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warning("Could not remove temporary metadata file " + temp + ": " + e.getMessage());
        }
    }
}
