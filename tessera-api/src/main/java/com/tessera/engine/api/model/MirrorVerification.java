/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import java.util.List;

/**
 * Result of scanning a mirror log for integrity.
 *
 * @param engineId     engine whose log was scanned
 * @param recordCount  number of readable records
 * @param lastSequence highest sequence number found, 0 for an empty log
 * @param gaps         human-readable description of each discontinuity or torn line
 */
public record MirrorVerification(
        String engineId,
        long recordCount,
        long lastSequence,
        List<String> gaps) {

    public MirrorVerification {
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public boolean isIntact() {
        return gaps.isEmpty();
    }
}
