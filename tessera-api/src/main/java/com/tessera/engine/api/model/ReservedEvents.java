/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.api.model;

import java.util.Set;

/**
 * Names of reserved events. Reserved events mutate entity state in an engine's
 * model directly instead of being accumulated as interactions.
 */
public final class ReservedEvents {

    public static final String PREFIX = "$";
    public static final String SET = "$set";
    public static final String UNSET = "$unset";
    public static final String DELETE = "$delete";

    public static final Set<String> KNOWN = Set.of(SET, UNSET, DELETE);

    private ReservedEvents() {
        // utility class
    }

    public static boolean isReserved(String eventName) {
        return eventName != null && eventName.startsWith(PREFIX);
    }

    public static boolean isKnown(String eventName) {
        return KNOWN.contains(eventName);
    }
}
