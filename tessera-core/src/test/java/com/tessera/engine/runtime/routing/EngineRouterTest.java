/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.runtime.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.engine.api.exceptions.AlgorithmException;
import com.tessera.engine.api.exceptions.AlreadyTrainingException;
import com.tessera.engine.api.exceptions.EngineNotFoundException;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.InputResult;
import com.tessera.engine.api.model.InputResult.ModelUpdate;
import com.tessera.engine.api.model.MirrorVerification;
import com.tessera.engine.api.model.TrainingState;
import com.tessera.engine.api.model.TrainingStatus;
import com.tessera.engine.fixtures.BatchFixtureEngine;
import com.tessera.engine.fixtures.TestHost;
import com.tessera.engine.infra.store.InMemoryMetadataStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.tessera.engine.fixtures.TestHost.event;
import static com.tessera.engine.fixtures.TestHost.json;
import static com.tessera.engine.fixtures.TestHost.mirroredParams;
import static com.tessera.engine.fixtures.TestHost.params;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineRouterTest {

    @TempDir
    Path mirrors;

    private TestHost host;
    private EngineRouter router;

    @BeforeEach
    void setUp() {
        host = new TestHost(new InMemoryMetadataStore(), mirrors);
        router = host.router;
    }

    @AfterEach
    void tearDown() {
        host.registry.shutdown();
    }

    private int count(String engineId) {
        return router.query(engineId, json("{}")).get("count").asInt();
    }

    @Test
    @DisplayName("Inputs to one instance never show up in another")
    void shouldIsolateInstances() {
        host.registry.create(params("A", "input-only"));
        host.registry.create(params("B", "input-only"));

        router.input("A", event("u1", "view"));
        router.input("A", event("u2", "view"));

        assertThat(count("A")).isEqualTo(2);
        assertThat(count("B")).isZero();
        assertThat(router.query("B", json("{}")).get("engineId").asText()).isEqualTo("B");
    }

    @Test
    void shouldRejectUnknownEngine() {
        assertThatThrownBy(() -> router.input("ghost", event("u1", "view"))).isInstanceOf(EngineNotFoundException.class);
        assertThatThrownBy(() -> router.query("ghost", json("{}"))).isInstanceOf(EngineNotFoundException.class);
        assertThatThrownBy(() -> router.train("ghost")).isInstanceOf(EngineNotFoundException.class);
        assertThatThrownBy(() -> router.trainingStatus("ghost")).isInstanceOf(EngineNotFoundException.class);
    }

    @Test
    void shouldReportMirrorSequenceOnlyWhenMirrored() {
        host.registry.create(mirroredParams("m", "input-only"));
        host.registry.create(params("p", "input-only"));

        InputResult mirrored = router.input("m", event("u1", "view"));
        InputResult plain = router.input("p", event("u1", "view"));

        assertThat(mirrored.sequence()).isEqualTo(1L);
        assertThat(mirrored.modelUpdate()).isEqualTo(ModelUpdate.NONE);
        assertThat(plain.sequence()).isNull();
        assertThat(host.metrics.getCounterValue("engine_events_accepted_total", "engine", "m")).isEqualTo(1);
    }

    @Test
    @DisplayName("Invalid events are rejected before anything is mirrored")
    void shouldValidateBeforeMirroring() {
        host.registry.create(mirroredParams("m", "input-only"));

        assertThatThrownBy(() -> router.input("m", json("{\"entityType\":\"user\",\"event\":\"view\"}")))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.field()).isEqualTo("entityId"));
        assertThatThrownBy(() -> router.input("m", event("invalid", "view")))
                .isInstanceOf(ValidationException.class);

        assertThat(host.mirrorLog.read("m")).isEmpty();
        assertThat(count("m")).isZero();
    }

    @Test
    void shouldRejectReservedEventsTheEngineDoesNotSupport() {
        host.registry.create(params("m", "input-only"));
        JsonNode set = json("{\"entityType\":\"item\",\"entityId\":\"i1\",\"event\":\"$set\",\"properties\":{\"a\":1}}");

        assertThatThrownBy(() -> router.input("m", set))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.field()).isEqualTo("event");
                    assertThat(e.getMessage()).contains("input-only");
                });
    }

    @Test
    void shouldRouteSupportedReservedEventsToTheReservedHook() {
        host.registry.create(params("m", "input-only"));
        router.input("m", event("u1", "view"));
        router.input("m", event("u2", "view"));

        router.input("m", json("{\"entityType\":\"user\",\"entityId\":\"u1\",\"event\":\"$delete\"}"));

        assertThat(count("m")).isEqualTo(1);
    }

    @Test
    void shouldWrapEngineFailuresAsAlgorithmFailure() {
        host.registry.create(params("m", "input-only"));

        assertThatThrownBy(() -> router.input("m", event("u1", "explode")))
                .isInstanceOfSatisfying(AlgorithmException.class, e -> {
                    assertThat(e.engineId()).isEqualTo("m");
                    assertThat(e.operation()).isEqualTo("input");
                });
    }

    @Test
    void shouldRejectNonObjectQuery() {
        host.registry.create(params("m", "input-only"));

        assertThatThrownBy(() -> router.query("m", json("[1]")))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.field()).isEqualTo("query"));
    }

    @Test
    void shouldApplyIncrementalUpdatesForContinuousEngines() {
        host.registry.create(params("c", "online"));

        InputResult result = router.input("c", event("u1", "view"));

        assertThat(result.modelUpdate()).isEqualTo(ModelUpdate.APPLIED);
        assertThat(host.online.last().learned()).containsExactly("u1");
        assertThatThrownBy(() -> router.input("c", event("u2", "poison")))
                .isInstanceOf(AlgorithmException.class);
    }

    @Test
    @DisplayName("N concurrent inputs to a mirrored instance produce a gapless log and no drops")
    void shouldMirrorConcurrentInputsWithoutGaps() throws Exception {
        host.registry.create(mirroredParams("m", "online"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<InputResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 100; i++) {
                String entity = "u" + i;
                futures.add(pool.submit(() -> router.input("m", event(entity, "view"))));
            }
            for (Future<InputResult> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        MirrorVerification verification = host.mirrorLog.verify("m");
        assertThat(verification.isIntact()).isTrue();
        assertThat(verification.recordCount()).isEqualTo(100);
        assertThat(verification.lastSequence()).isEqualTo(100);
        assertThat(count("m")).isEqualTo(100);

        List<String> mirrored = host.mirrorLog.read("m").stream().map(r -> r.event().entityId()).toList();
        assertThat(host.online.last().learned()).containsExactlyElementsOf(mirrored);
    }

    @Test
    @DisplayName("reco-1: destroy, recreate and replay rebuilds the Dataset from the mirror")
    void shouldRebuildRecreatedInstanceFromItsMirror() {
        host.registry.create(mirroredParams("reco-1", "input-only"));
        router.input("reco-1", event("u1", "view"));
        router.input("reco-1", event("u2", "view"));
        router.input("reco-1", event("u3", "buy"));

        host.registry.destroy("reco-1");
        host.registry.create(mirroredParams("reco-1", "input-only"));
        int replayed = router.replayInto("reco-1", "reco-1");

        assertThat(replayed).isEqualTo(3);
        assertThat(count("reco-1")).isEqualTo(3);
        assertThat(host.mirrorLog.verify("reco-1").recordCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Replaying into a fresh instance with the same config yields the same Dataset")
    void shouldReplayIntoAnotherInstance() {
        host.registry.create(mirroredParams("source", "input-only"));
        host.registry.create(mirroredParams("sink", "input-only"));
        router.input("source", event("u1", "view"));
        router.input("source", event("u2", "view"));

        int replayed = router.replayInto("source", "sink");

        assertThat(replayed).isEqualTo(2);
        assertThat(host.inputOnly.created().get(1).dataset())
                .containsExactlyElementsOf(host.inputOnly.created().get(0).dataset());
        assertThat(host.mirrorLog.read("sink")).hasSize(2);
    }

    @Test
    void shouldSkipEventsTheSinkRejects() {
        host.registry.create(mirroredParams("source", "input-only"));
        host.registry.create(params("sink", "strict"));
        router.input("source", event("u1", "view"));
        router.input("source", json("{\"entityType\":\"user\",\"entityId\":\"u1\",\"event\":\"$delete\"}"));

        assertThat(router.replayInto("source", "sink")).isEqualTo(1);
        assertThat(count("sink")).isEqualTo(1);
        assertThat(count("source")).isZero();
    }

    @Test
    @DisplayName("An input the engine fails on is not mirrored and the mirror still replays in full")
    void shouldNotMirrorEventsTheEngineFailedOn() {
        host.registry.create(mirroredParams("m", "input-only"));
        router.input("m", event("u1", "view"));
        assertThatThrownBy(() -> router.input("m", event("u2", "explode")))
                .isInstanceOf(AlgorithmException.class);
        InputResult after = router.input("m", event("u3", "view"));

        assertThat(after.sequence()).isEqualTo(2L);
        assertThat(host.mirrorLog.read("m")).extracting(r -> r.event().entityId()).containsExactly("u1", "u3");

        host.registry.destroy("m");
        host.registry.create(mirroredParams("m", "input-only"));

        assertThat(router.replayInto("m", "m")).isEqualTo(2);
        assertThat(count("m")).isEqualTo(2);
    }

    @Test
    @DisplayName("An event stored but not learned stays mirrored and replays without aborting")
    void shouldReplayEventsTheModelFailedToLearn() {
        host.registry.create(mirroredParams("source", "online"));
        host.registry.create(params("sink", "online"));
        router.input("source", event("u1", "view"));
        assertThatThrownBy(() -> router.input("source", event("u2", "poison")))
                .isInstanceOfSatisfying(AlgorithmException.class, e -> assertThat(e.operation()).isEqualTo("learn"));
        router.input("source", event("u3", "view"));

        assertThat(count("source")).isEqualTo(3);
        assertThat(host.mirrorLog.read("source")).hasSize(3);

        assertThat(router.replayInto("source", "sink")).isEqualTo(3);
        assertThat(count("sink")).isEqualTo(3);
        assertThat(host.online.last().learned()).containsExactly("u1", "u3");
    }

    @Test
    @DisplayName("rank-1: two back-to-back trains yield one AlreadyTraining and the first run completes")
    void shouldRejectSecondTrainWhileFirstRuns() throws Exception {
        host.registry.create(params("rank-1", "batch"));
        BatchFixtureEngine engine = host.batch.last().holdTraining();
        router.input("rank-1", event("u1", "view"));

        TrainingStatus first = router.train("rank-1");
        assertThatThrownBy(() -> router.train("rank-1")).isInstanceOf(AlreadyTrainingException.class);

        engine.releaseTraining();
        assertThat(host.registry.lookup("rank-1").trainingSlot().awaitSettled(5, TimeUnit.SECONDS)).isTrue();
        assertThat(first.state()).isEqualTo(TrainingState.TRAINING);
        assertThat(router.trainingStatus("rank-1").state()).isEqualTo(TrainingState.IDLE);
        assertThat(router.query("rank-1", json("{}")).get("model").asInt()).isEqualTo(1);
    }

    @Test
    void shouldDestroyWhileTrainingAndDiscardTheRun() throws Exception {
        host.registry.create(params("rank-1", "batch"));
        BatchFixtureEngine engine = host.batch.last().holdTraining();
        router.train("rank-1");
        assertThat(engine.awaitTrainingStarted()).isTrue();

        host.registry.destroy("rank-1");

        assertThat(engine.sawCancel()).isTrue();
        assertThat(engine.model()).isEqualTo(-1);
        assertThatThrownBy(() -> router.trainingStatus("rank-1")).isInstanceOf(EngineNotFoundException.class);
    }
}
