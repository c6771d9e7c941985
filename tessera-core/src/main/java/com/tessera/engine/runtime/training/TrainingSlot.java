/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.runtime.training;

import com.tessera.engine.api.BatchTrainable;
import com.tessera.engine.api.Engine;
import com.tessera.engine.api.TrainingContext;
import com.tessera.engine.api.model.Event;
import com.tessera.engine.api.model.TrainingDiscipline;
import com.tessera.engine.api.model.TrainingState;
import com.tessera.engine.api.model.TrainingStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Training state of one instance. All fields are guarded by {@link #lock};
 * {@link #settled} is signalled whenever a run leaves {@code TRAINING}.
 */
public final class TrainingSlot {

    private final String engineId;
    private final Engine engine;
    private final TrainingDiscipline discipline;

    final ReentrantLock lock = new ReentrantLock();
    final Condition settled = lock.newCondition();
    final Deque<Event> deferred = new ArrayDeque<>();

    TrainingState state = TrainingState.IDLE;
    String lastError;
    Instant lastStartedAt;
    Instant lastCompletedAt;
    long completedRuns;
    boolean retired;
    volatile boolean cancelled;

    TrainingSlot(String engineId, Engine engine) {
        this.engineId = engineId;
        this.engine = engine;
        this.discipline = TrainingDiscipline.of(engine);
    }

    public String engineId() {
        return engineId;
    }

    public Engine engine() {
        return engine;
    }

    public TrainingDiscipline discipline() {
        return discipline;
    }

    public boolean trainable() {
        return engine instanceof BatchTrainable;
    }

    public TrainingState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public TrainingStatus snapshot() {
        return snapshot(null);
    }

    TrainingStatus snapshot(String message) {
        lock.lock();
        try {
            return new TrainingStatus(engineId, state, lastError, lastStartedAt, lastCompletedAt,
                    completedRuns, deferred.size(), message);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until no batch run is in flight.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitSettled(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (state == TrainingState.TRAINING) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = settled.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    TrainingContext context() {
        return new TrainingContext() {
            @Override
            public String engineId() {
                return engineId;
            }

            @Override
            public boolean isCancelled() {
                return cancelled;
            }
        };
    }
}
