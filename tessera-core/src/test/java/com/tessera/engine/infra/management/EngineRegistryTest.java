/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.infra.management;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.engine.api.exceptions.AlgorithmException;
import com.tessera.engine.api.exceptions.DuplicateEngineIdException;
import com.tessera.engine.api.exceptions.EngineNotFoundException;
import com.tessera.engine.api.exceptions.StorageException;
import com.tessera.engine.api.exceptions.UnsupportedUpdateException;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.EngineMetadata;
import com.tessera.engine.api.model.EngineState;
import com.tessera.engine.api.model.EngineStatus;
import com.tessera.engine.api.model.InputResult;
import com.tessera.engine.api.model.MirrorSettings;
import com.tessera.engine.api.model.RestoreReport;
import com.tessera.engine.api.model.TrainingDiscipline;
import com.tessera.engine.fixtures.FixtureEngine;
import com.tessera.engine.fixtures.TestHost;
import com.tessera.engine.infra.store.FileMetadataStore;
import com.tessera.engine.infra.store.InMemoryMetadataStore;
import com.tessera.engine.infra.store.MetadataStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.tessera.engine.fixtures.TestHost.event;
import static com.tessera.engine.fixtures.TestHost.params;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class EngineRegistryTest {

    @TempDir
    Path tempDir;

    private TestHost host;
    private EngineRegistry registry;

    @BeforeEach
    void setUp() {
        host = new TestHost(new FileMetadataStore(tempDir.resolve("engines")), tempDir.resolve("mirrors"));
        registry = host.registry;
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    void shouldCreateAndPersistInstance() {
        String id = registry.create(params("reco-1", "batch").put("mirrorType", "file"));

        EngineStatus status = registry.status(id);
        assertThat(id).isEqualTo("reco-1");
        assertThat(status.engineFactory()).isEqualTo("batch");
        assertThat(status.state()).isEqualTo(EngineState.ACTIVE);
        assertThat(status.discipline()).isEqualTo(TrainingDiscipline.PERIODIC);
        assertThat(status.trainable()).isTrue();
        assertThat(status.mirroring()).isTrue();
        assertThat(host.metadataStore.findById("reco-1")).hasValueSatisfying(m -> {
            assertThat(m.engineFactory()).isEqualTo("batch");
            assertThat(m.mirroring()).isTrue();
        });
        assertThat(host.metrics.getGaugeValue("engine_instances_live")).isEqualTo(1.0);
    }

    @Test
    void shouldRejectDuplicateId() {
        registry.create(params("reco-1", "batch"));

        assertThatThrownBy(() -> registry.create(params("reco-1", "online")))
                .isInstanceOf(DuplicateEngineIdException.class);
        assertThat(registry.status("reco-1").engineFactory()).isEqualTo("batch");
    }

    @Test
    void shouldRejectUnknownFactoryWithoutSideEffects() {
        assertThatThrownBy(() -> registry.create(params("reco-1", "nope")))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("engineFactory"));

        assertThat(registry.list()).isEmpty();
        assertThat(host.metadataStore.findAllIds()).isEmpty();
    }

    @Test
    @DisplayName("A failing init leaves nothing registered and the engine released")
    void shouldRollBackFailedInit() {
        ObjectNode params = params("reco-1", "input-only");
        params.putObject("algorithm").put("failInit", true);

        assertThatThrownBy(() -> registry.create(params))
                .isInstanceOfSatisfying(AlgorithmException.class, e -> assertThat(e.operation()).isEqualTo("init"));

        assertThat(registry.list()).isEmpty();
        assertThat(host.metadataStore.exists("reco-1")).isFalse();
        assertThat(host.inputOnly.last().isDestroyed()).isTrue();
    }

    @Test
    void shouldReportEngineParameterErrorsWithPath() {
        ObjectNode params = params("reco-1", "input-only");
        params.putObject("algorithm").put("threshold", -1);

        assertThatThrownBy(() -> registry.create(params))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("algorithm.threshold"));
    }

    @Test
    @DisplayName("A metadata write failure on create rolls back the registration")
    void shouldRollBackWhenMetadataCannotBeSaved() {
        MetadataStore failing = spy(new InMemoryMetadataStore());
        doThrow(new StorageException("reco-1", "disk full", new IOException("disk full")))
                .when(failing).save(any(EngineMetadata.class));
        TestHost broken = new TestHost(failing, tempDir.resolve("mirrors"));

        assertThatThrownBy(() -> broken.registry.create(params("reco-1", "input-only").put("mirrorType", "file")))
                .isInstanceOf(StorageException.class);

        assertThat(broken.registry.list()).isEmpty();
        assertThat(broken.mirrorLog.isEnabled("reco-1")).isFalse();
        assertThat(broken.inputOnly.last().isDestroyed()).isTrue();
        broken.registry.shutdown();
    }

    @Test
    @DisplayName("Update re-initializes in place and keeps the Dataset")
    void shouldUpdateWithoutLosingDataset() {
        registry.create(params("reco-1", "input-only"));
        host.router.input("reco-1", event("u1", "view"));
        host.router.input("reco-1", event("u2", "view"));
        FixtureEngine engine = host.inputOnly.last();

        ObjectNode updated = params("reco-1", "input-only").put("mirrorType", "file");
        updated.putObject("algorithm").put("threshold", 3);
        registry.update("reco-1", updated);

        assertThat(host.inputOnly.created()).hasSize(1);
        assertThat(engine.initCount()).isEqualTo(2);
        assertThat(engine.settings().threshold()).isEqualTo(3);
        assertThat(engine.dataset()).hasSize(2);
        assertThat(registry.status("reco-1").mirroring()).isTrue();
        assertThat(host.metadataStore.findById("reco-1")).hasValueSatisfying(m -> {
            assertThat(m.mirroring()).isTrue();
            assertThat(m.params()).contains("\"threshold\":3");
        });
    }

    @Test
    void shouldAcceptUpdateBodyWithoutTopLevelKeys() {
        registry.create(params("reco-1", "input-only"));

        registry.update("reco-1", TestHost.json("{\"algorithm\":{\"threshold\":1}}"));

        assertThat(host.inputOnly.last().settings().threshold()).isEqualTo(1);
    }

    @Test
    void shouldRejectUpdateThatRenamesOrChangesFactory() {
        registry.create(params("reco-1", "input-only"));

        assertThatThrownBy(() -> registry.update("reco-1", params("reco-2", "input-only")))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.field()).isEqualTo("engineId"));
        assertThatThrownBy(() -> registry.update("reco-1", params("reco-1", "batch")))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.field()).isEqualTo("engineFactory"));
    }

    @Test
    void shouldKeepOldConfigurationOnUnsupportedUpdate() {
        ObjectNode original = params("reco-1", "input-only");
        original.putObject("algorithm").put("partition", "eu");
        registry.create(original);

        ObjectNode changed = params("reco-1", "input-only");
        changed.putObject("algorithm").put("partition", "us");

        assertThatThrownBy(() -> registry.update("reco-1", changed))
                .isInstanceOfSatisfying(UnsupportedUpdateException.class,
                        e -> assertThat(e.field()).isEqualTo("algorithm.partition"));
        assertThat(host.inputOnly.last().settings().partition()).isEqualTo("eu");
        assertThat(registry.status("reco-1").state()).isEqualTo(EngineState.ACTIVE);
        assertThat(host.metadataStore.findById("reco-1").orElseThrow().params()).contains("\"eu\"");
    }

    @Test
    void shouldReinitializeWithPreviousParamsWhenUpdateCannotBePersisted() {
        MetadataStore store = spy(new InMemoryMetadataStore());
        TestHost flaky = new TestHost(store, tempDir.resolve("mirrors"));
        ObjectNode original = params("reco-1", "input-only");
        original.putObject("algorithm").put("threshold", 1);
        flaky.registry.create(original);

        doThrow(new StorageException("reco-1", "disk full", null)).when(store).save(any(EngineMetadata.class));
        ObjectNode changed = params("reco-1", "input-only");
        changed.putObject("algorithm").put("threshold", 9);

        assertThatThrownBy(() -> flaky.registry.update("reco-1", changed)).isInstanceOf(StorageException.class);
        assertThat(flaky.inputOnly.last().settings().threshold()).isEqualTo(1);

        doCallRealMethod().when(store).save(any(EngineMetadata.class));
        flaky.registry.shutdown();
    }

    @Test
    void shouldFailUpdateAndDestroyOfUnknownId() {
        assertThatThrownBy(() -> registry.update("ghost", params("ghost", "batch")))
                .isInstanceOf(EngineNotFoundException.class);
        assertThatThrownBy(() -> registry.destroy("ghost"))
                .isInstanceOf(EngineNotFoundException.class);
        assertThatThrownBy(() -> registry.status("ghost"))
                .isInstanceOf(EngineNotFoundException.class);
    }

    @Test
    @DisplayName("Destroy releases engine state and metadata but keeps the mirror log")
    void shouldDestroyInstance() {
        registry.create(TestHost.mirroredParams("reco-1", "input-only"));
        host.router.input("reco-1", event("u1", "view"));
        FixtureEngine engine = host.inputOnly.last();

        registry.destroy("reco-1");

        assertThat(engine.isDestroyed()).isTrue();
        assertThat(engine.dataset()).isEmpty();
        assertThat(host.metadataStore.exists("reco-1")).isFalse();
        assertThat(host.mirrorLog.read("reco-1")).hasSize(1);
        assertThatThrownBy(() -> host.router.input("reco-1", event("u2", "view")))
                .isInstanceOf(EngineNotFoundException.class);
        assertThat(host.metrics.getGaugeValue("engine_instances_live")).isZero();
    }

    @Test
    @DisplayName("Create after destroy starts from an empty Dataset")
    void shouldStartFreshAfterRecreate() {
        registry.create(params("reco-1", "input-only"));
        host.router.input("reco-1", event("u1", "view"));
        registry.destroy("reco-1");

        registry.create(params("reco-1", "input-only"));

        assertThat(host.router.query("reco-1", TestHost.json("{}")).get("count").asInt()).isZero();
    }

    @Test
    @DisplayName("Destroy closes the mirror log and a recreated instance continues its sequence")
    void shouldReleaseMirrorOnDestroy() {
        registry.create(TestHost.mirroredParams("reco-1", "input-only"));
        host.router.input("reco-1", event("u1", "view"));

        registry.destroy("reco-1");

        assertThat(host.mirrorLog.settings("reco-1")).isEmpty();
        assertThat(host.mirrorLog.read("reco-1")).hasSize(1);

        registry.create(TestHost.mirroredParams("reco-1", "input-only"));
        assertThat(host.router.input("reco-1", event("u2", "view")).sequence()).isEqualTo(2L);
    }

    @Test
    void shouldMoveMirrorWhenUpdateChangesLocation() throws IOException {
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        registry.create(TestHost.mirroredParams("reco-1", "input-only").put("mirrorLocation", first.toString()));
        host.router.input("reco-1", event("u1", "view"));

        registry.update("reco-1", TestHost.mirroredParams("reco-1", "input-only").put("mirrorLocation", second.toString()));
        InputResult moved = host.router.input("reco-1", event("u2", "view"));

        assertThat(moved.sequence()).isEqualTo(1L);
        assertThat(host.mirrorLog.settings("reco-1").map(MirrorSettings::location)).contains(second);
        assertThat(Files.readAllLines(first.resolve("reco-1").resolve("events.jsonl"))).hasSize(1);
        assertThat(Files.readAllLines(second.resolve("reco-1").resolve("events.jsonl"))).hasSize(1);
    }

    @Test
    @DisplayName("A failed update leaves the previous mirror settings in force")
    void shouldKeepMirrorSettingsWhenUpdateCannotBePersisted() {
        MetadataStore store = spy(new InMemoryMetadataStore());
        TestHost flaky = new TestHost(store, tempDir.resolve("mirrors"));
        Path first = tempDir.resolve("first");
        flaky.registry.create(TestHost.mirroredParams("reco-1", "input-only").put("mirrorLocation", first.toString()));
        flaky.router.input("reco-1", event("u1", "view"));

        doThrow(new StorageException("reco-1", "disk full", null)).when(store).save(any(EngineMetadata.class));
        assertThatThrownBy(() -> flaky.registry.update("reco-1",
                TestHost.mirroredParams("reco-1", "input-only").put("mirrorLocation", tempDir.resolve("second").toString())))
                .isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> flaky.registry.update("reco-1", params("reco-1", "input-only")))
                .isInstanceOf(StorageException.class);

        assertThat(flaky.mirrorLog.settings("reco-1")).hasValueSatisfying(settings -> {
            assertThat(settings.enabled()).isTrue();
            assertThat(settings.location()).isEqualTo(first);
        });
        assertThat(flaky.router.input("reco-1", event("u2", "view")).sequence()).isEqualTo(2L);
        assertThat(flaky.mirrorLog.read("reco-1")).hasSize(2);

        doCallRealMethod().when(store).save(any(EngineMetadata.class));
        flaky.registry.shutdown();
    }

    @Test
    @DisplayName("Concurrent creates of one id register it exactly once")
    void shouldCreateSameIdOnceUnderContention() throws Exception {
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<Throwable>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                outcomes.add(pool.submit(() -> {
                    start.await();
                    try {
                        registry.create(params("reco-1", "input-only"));
                        return null;
                    } catch (RuntimeException e) {
                        return e;
                    }
                }));
            }
            start.countDown();

            int created = 0;
            List<Throwable> failures = new ArrayList<>();
            for (Future<Throwable> outcome : outcomes) {
                Throwable failure = outcome.get(10, TimeUnit.SECONDS);
                if (failure == null) {
                    created++;
                } else {
                    failures.add(failure);
                }
            }

            assertThat(created).isEqualTo(1);
            assertThat(failures).hasSize(threads - 1)
                    .allSatisfy(e -> assertThat(e).isInstanceOf(DuplicateEngineIdException.class));
            assertThat(registry.liveCount()).isEqualTo(1);
            assertThat(host.metadataStore.exists("reco-1")).isTrue();
            assertThat(registry.status("reco-1").trainable()).isFalse();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Destroy waits for an in-flight input and later inputs see the instance gone")
    void shouldLetInFlightInputFinishBeforeDestroy() throws Exception {
        registry.create(params("reco-1", "input-only"));
        FixtureEngine engine = host.inputOnly.last().holdInput();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<InputResult> inFlight = pool.submit(() -> host.router.input("reco-1", event("u1", "view")));
            assertThat(engine.awaitInputEntered()).isTrue();

            Future<?> destroy = pool.submit(() -> registry.destroy("reco-1"));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (registry.liveCount() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }

            assertThat(registry.liveCount()).isZero();
            assertThatThrownBy(() -> host.router.input("reco-1", event("u2", "view")))
                    .isInstanceOf(EngineNotFoundException.class);
            assertThat(engine.isDestroyed()).isFalse();
            assertThat(destroy).isNotDone();

            engine.releaseInput();

            assertThat(inFlight.get(5, TimeUnit.SECONDS).engineId()).isEqualTo("reco-1");
            destroy.get(5, TimeUnit.SECONDS);
            assertThat(engine.isDestroyed()).isTrue();
            assertThat(engine.dataset()).isEmpty();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Restore rebuilds every valid instance and reports the broken ones")
    void shouldRestoreAndContinuePastCorruptMetadata() throws IOException {
        registry.create(params("a", "input-only"));
        registry.create(TestHost.mirroredParams("b", "batch"));
        registry.shutdown();
        Files.writeString(tempDir.resolve("engines").resolve("broken.json"), "{ not json");
        host.metadataStore.save(new EngineMetadata("gone", "retired-factory", "{\"engineId\":\"gone\"}", false, null, null));

        TestHost restarted = new TestHost(new FileMetadataStore(tempDir.resolve("engines")), tempDir.resolve("mirrors"));
        RestoreReport report = restarted.registry.restoreAll();

        assertThat(report.restored()).containsExactly("a", "b");
        assertThat(report.failed()).containsOnlyKeys("broken", "gone");
        assertThat(report.isComplete()).isFalse();
        assertThat(restarted.registry.lastRestoreReport()).isEqualTo(report);
        assertThat(restarted.registry.status("b").mirroring()).isTrue();
        assertThat(restarted.registry.list()).extracting(EngineStatus::engineId).containsExactly("a", "b");
        restarted.registry.shutdown();
    }

    @Test
    void shouldNotRewriteMetadataOnRestore() throws IOException {
        registry.create(params("a", "input-only"));
        Path file = tempDir.resolve("engines").resolve("a.json");
        String before = Files.readString(file);

        TestHost restarted = new TestHost(new FileMetadataStore(tempDir.resolve("engines")), tempDir.resolve("mirrors"));
        restarted.registry.restoreAll();

        assertThat(Files.readString(file)).isEqualTo(before);
        restarted.registry.shutdown();
    }
}
