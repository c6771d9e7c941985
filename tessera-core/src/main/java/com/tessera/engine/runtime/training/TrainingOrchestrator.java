/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.runtime.training;

import com.tessera.engine.api.BatchTrainable;
import com.tessera.engine.api.Engine;
import com.tessera.engine.api.IncrementalLearner;
import com.tessera.engine.api.TrainedModel;
import com.tessera.engine.api.exceptions.AlgorithmException;
import com.tessera.engine.api.exceptions.AlreadyTrainingException;
import com.tessera.engine.api.exceptions.EngineException;
import com.tessera.engine.api.exceptions.EngineNotFoundException;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.Event;
import com.tessera.engine.api.model.InputResult.ModelUpdate;
import com.tessera.engine.api.model.TrainingState;
import com.tessera.engine.api.model.TrainingStatus;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides when model mutation happens for each instance.
 *
 * <ul>
 *   <li>Continuous engines learn from each accepted event inside the input call.</li>
 *   <li>Periodic engines train on request, off the request thread, one run at a time.</li>
 *   <li>Mixed engines do both; incremental updates that arrive during a run are
 *       queued and applied in arrival order once the run ends.</li>
 * </ul>
 *
 * A candidate model is activated only when its run succeeded and the instance
 * was not retired meanwhile. A failed run leaves the previous model serving.
 */
public class TrainingOrchestrator {
    private static final Logger logger = Logger.getLogger(TrainingOrchestrator.class.getName());

    public static final String TRAINING_STARTED = "Training started";

    private final ExecutorService executor;
    private final Tracer tracer;
    private final Clock clock;

    public TrainingOrchestrator(Tracer tracer) {
        this(tracer, Executors.newCachedThreadPool(new TrainingThreadFactory()), Clock.systemUTC());
    }

    public TrainingOrchestrator(Tracer tracer, ExecutorService executor, Clock clock) {
        this.tracer = tracer;
        this.executor = executor;
        this.clock = clock;
    }

    public TrainingSlot newSlot(String engineId, Engine engine) {
        return new TrainingSlot(engineId, engine);
    }

    /**
     * Follow-on for an accepted event. Callers hold the instance's input lock,
     * so at most one incremental update is in flight per instance.
     *
     * @throws AlgorithmException if the engine fails to learn from the event
     */
    public ModelUpdate onAccepted(TrainingSlot slot, Event event) {
        if (!(slot.engine() instanceof IncrementalLearner learner)) {
            return ModelUpdate.NONE;
        }
        slot.lock.lock();
        try {
            if (slot.retired) {
                throw new EngineNotFoundException(slot.engineId());
            }
            if (slot.state == TrainingState.TRAINING) {
                slot.deferred.addLast(event);
                return ModelUpdate.DEFERRED;
            }
            // a run cannot start while the update is applied
            learn(slot, learner, event);
            return ModelUpdate.APPLIED;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Starts a batch run and returns immediately.
     *
     * @throws ValidationException      if the engine cannot train in batch
     * @throws AlreadyTrainingException if a run is in flight
     */
    public TrainingStatus requestTraining(TrainingSlot slot) {
        if (!(slot.engine() instanceof BatchTrainable trainable)) {
            throw new ValidationException(slot.engineId(), "engineId",
                    "Engine '" + slot.engineId() + "' does not support batch training");
        }
        slot.lock.lock();
        try {
            if (slot.retired) {
                throw new EngineNotFoundException(slot.engineId());
            }
            if (slot.state == TrainingState.TRAINING) {
                throw new AlreadyTrainingException(slot.engineId());
            }
            TrainingState previous = slot.state;
            slot.state = TrainingState.TRAINING;
            slot.lastStartedAt = clock.instant();
            try {
                executor.execute(() -> run(slot, trainable));
            } catch (RejectedExecutionException e) {
                slot.state = previous;
                throw new AlgorithmException(slot.engineId(), "train", e);
            }
            logger.info("Training started for engine '" + slot.engineId() + "'");
            return slot.snapshot(TRAINING_STARTED);
        } finally {
            slot.lock.unlock();
        }
    }

    public TrainingStatus status(TrainingSlot slot) {
        return slot.snapshot();
    }

    /**
     * Cancels and waits out any in-flight run of an instance being destroyed.
     * Queued incremental updates are dropped.
     */
    public void retire(TrainingSlot slot) {
        slot.lock.lock();
        try {
            slot.retired = true;
            slot.cancelled = true;
            while (slot.state == TrainingState.TRAINING) {
                slot.settled.awaitUninterruptibly();
            }
            slot.deferred.clear();
        } finally {
            slot.lock.unlock();
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warning("Training runs still active after 30s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void run(TrainingSlot slot, BatchTrainable trainable) {
        Span span = tracer.spanBuilder("engine-train").startSpan();
        TrainedModel candidate = null;
        Throwable failure = null;
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("engineId", slot.engineId());
            candidate = trainable.train(slot.context());
            if (candidate == null) {
                failure = new IllegalStateException("Training produced no model");
            }
        } catch (Throwable e) {
            failure = e;
        }
        try {
            failure = complete(slot, candidate, failure);
            if (failure != null) {
                span.recordException(failure);
            }
        } finally {
            span.end();
        }
        // the slot is already FAILED; let the JVM see fatal errors
        if (failure instanceof VirtualMachineError fatal) {
            throw fatal;
        }
    }

    /**
     * Moves the slot out of TRAINING whatever happens here.
     *
     * @return the failure of the run including activation, or {@code null}
     */
    private Throwable complete(TrainingSlot slot, TrainedModel candidate, Throwable failure) {
        slot.lock.lock();
        try {
            if (slot.cancelled) {
                slot.state = TrainingState.IDLE;
                logger.info("Discarded training result of retired engine '" + slot.engineId() + "'");
                return failure;
            }
            if (failure == null) {
                try {
                    candidate.activate();
                } catch (Throwable e) {
                    failure = e;
                }
            }
            if (failure == null) {
                slot.state = TrainingState.IDLE;
                slot.lastError = null;
                slot.lastCompletedAt = clock.instant();
                slot.completedRuns++;
                logger.info(String.format("Training of engine '%s' completed: %s", slot.engineId(), candidate.summary()));
            } else {
                markFailed(slot, failure);
                logger.log(Level.SEVERE, "Training of engine '" + slot.engineId() + "' failed. Previous model remains active.", failure);
            }
            drainDeferred(slot);
            return failure;
        } catch (Throwable e) {
            if (slot.state == TrainingState.TRAINING) {
                markFailed(slot, e);
            }
            throw e;
        } finally {
            slot.settled.signalAll();
            slot.lock.unlock();
        }
    }

    private static void markFailed(TrainingSlot slot, Throwable failure) {
        slot.state = TrainingState.FAILED;
        slot.lastError = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
    }

    // Runs under the slot lock, so new inputs queue behind the drained ones.
    private void drainDeferred(TrainingSlot slot) {
        if (!(slot.engine() instanceof IncrementalLearner learner)) {
            slot.deferred.clear();
            return;
        }
        int applied = 0;
        Event event;
        while ((event = slot.deferred.pollFirst()) != null) {
            try {
                learn(slot, learner, event);
                applied++;
            } catch (EngineException e) {
                logger.log(Level.WARNING, "Deferred update of engine '" + slot.engineId() + "' failed", e);
            }
        }
        if (applied > 0) {
            logger.fine("Applied " + applied + " deferred updates to engine '" + slot.engineId() + "'");
        }
    }

    private static void learn(TrainingSlot slot, IncrementalLearner learner, Event event) {
        try {
            learner.learn(event);
        } catch (EngineException e) {
            throw e;
        } catch (Exception e) {
            throw new AlgorithmException(slot.engineId(), "learn", e);
        }
    }

    private static final class TrainingThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "engine-training-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
