/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of reconstructing the live set from persisted metadata.
 *
 * @param restored ids that are live again
 * @param failed   ids that could not be restored, with the reason
 */
public record RestoreReport(List<String> restored, Map<String, String> failed) {

    public RestoreReport {
        restored = List.copyOf(restored);
        failed = Map.copyOf(failed);
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
