/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import java.nio.file.Path;

/**
 * Mirroring configuration of one engine instance, taken from the
 * {@code mirrorType} / {@code mirrorLocation} parameters.
 *
 * @param enabled  whether accepted events are archived
 * @param type     the configured mirror type, {@code null} when disabled
 * @param location directory holding per-engine logs, {@code null} for the host default
 */
public record MirrorSettings(boolean enabled, String type, Path location) {

    public static final MirrorSettings DISABLED = new MirrorSettings(false, null, null);
}
