/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api;

import com.tessera.engine.api.model.Event;
import com.tessera.engine.api.model.MirrorRecord;
import com.tessera.engine.api.model.MirrorSettings;
import com.tessera.engine.api.model.MirrorVerification;

import java.util.List;
import java.util.Optional;

/**
 * Contract for the append-only per-instance event archive.
 *
 * <p>The mirror log is never read while serving. It exists so a Dataset can be
 * rebuilt by replaying accepted events, possibly into an engine configured differently.
 */
public interface IMirrorLog {

    /**
     * Applies the mirroring settings of an instance. Disabling stops new writes
     * but never deletes history.
     */
    void configure(String engineId, MirrorSettings settings);

    boolean isEnabled(String engineId);

    /**
     * @return the settings last applied for the id, if any were
     */
    Optional<MirrorSettings> settings(String engineId);

    /**
     * Appends one event durably before returning.
     *
     * @return the record with its assigned sequence number
     */
    MirrorRecord record(String engineId, Event event);

    /**
     * @return all readable records of the instance in sequence order
     */
    List<MirrorRecord> read(String engineId);

    /**
     * Scans the log for sequence gaps and torn lines without repairing them.
     */
    MirrorVerification verify(String engineId);

    /**
     * Closes whatever the log holds open for the instance and forgets its
     * settings. Recorded history stays readable.
     */
    void release(String engineId);

    void close();
}
