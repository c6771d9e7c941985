/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.engines;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.engine.api.exceptions.UnsupportedUpdateException;
import com.tessera.engine.api.exceptions.ValidationException;
import com.tessera.engine.api.model.InputResult.ModelUpdate;
import com.tessera.engine.api.model.RestoreReport;
import com.tessera.engine.api.model.TrainingDiscipline;
import com.tessera.engine.api.model.TrainingState;
import com.tessera.engine.infra.management.EngineFactoryRegistry;
import com.tessera.engine.infra.management.EngineRegistry;
import com.tessera.engine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.tessera.engine.infra.mirror.FileMirrorLog;
import com.tessera.engine.infra.store.FileMetadataStore;
import com.tessera.engine.params.ParameterStore;
import com.tessera.engine.runtime.event.EventParser;
import com.tessera.engine.runtime.routing.EngineRouter;
import com.tessera.engine.runtime.training.TrainingOrchestrator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the compiled-in engines through a fully wired host, discovering them
 * through {@link java.util.ServiceLoader} as the service does.
 */
class ReferenceEnginesHostTest {

    @TempDir
    Path dataDir;

    private Host host;

    private final class Host {
        final Tracer tracer = OpenTelemetry.noop().getTracer("test");
        final TrainingOrchestrator orchestrator = new TrainingOrchestrator(tracer);
        final FileMirrorLog mirrorLog = new FileMirrorLog(dataDir.resolve("mirrors"));
        final EngineRegistry registry = new EngineRegistry(EngineFactoryRegistry.fromServiceLoader(),
                new FileMetadataStore(dataDir.resolve("engines")), mirrorLog, orchestrator, tracer,
                new InMemoryMetricsRegistry());
        final EngineRouter router = new EngineRouter(registry, mirrorLog, orchestrator, new EventParser(), tracer,
                new InMemoryMetricsRegistry());
    }

    @BeforeEach
    void setUp() {
        host = new Host();
    }

    @AfterEach
    void tearDown() {
        host.registry.shutdown();
    }

    private static ObjectNode popularityParams(String engineId) {
        ObjectNode params = ParameterStore.mapper().createObjectNode()
                .put("engineId", engineId)
                .put("engineFactory", "popularity")
                .put("mirrorType", "localfs");
        params.putObject("algorithm").putArray("eventNames").add("buy").add("view");
        return params;
    }

    private static ObjectNode propertiesParams(String engineId, String... entityTypes) {
        ObjectNode params = ParameterStore.mapper().createObjectNode()
                .put("engineId", engineId)
                .put("engineFactory", "entity-properties");
        var types = params.putObject("algorithm").putArray("entityTypes");
        for (String type : entityTypes) {
            types.add(type);
        }
        return params;
    }

    private static JsonNode interaction(String user, String name, String item) {
        return ParameterStore.mapper().createObjectNode()
                .put("entityType", "user")
                .put("entityId", user)
                .put("event", name)
                .put("targetEntityType", "item")
                .put("targetEntityId", item);
    }

    private void trainAndWait(String engineId) throws InterruptedException {
        host.router.train(engineId);
        assertThat(host.registry.lookup(engineId).trainingSlot().awaitSettled(5, TimeUnit.SECONDS)).isTrue();
        assertThat(host.router.trainingStatus(engineId).state()).isEqualTo(TrainingState.IDLE);
    }

    private JsonNode topItems(String engineId) {
        return host.router.query(engineId, ParameterStore.mapper().createObjectNode()).get("result");
    }

    private void feedPopularity(String engineId) {
        host.router.input(engineId, interaction("u1", "buy", "i1"));
        host.router.input(engineId, interaction("u2", "buy", "i1"));
        host.router.input(engineId, interaction("u2", "view", "i2"));
        host.router.input(engineId, interaction("u3", "view", "i3"));
        host.router.input(engineId, interaction("u3", "view", "i3"));
        host.router.input(engineId, interaction("u3", "view", "i3"));
    }

    @Test
    void shouldDiscoverReferenceEngines() {
        assertThat(EngineFactoryRegistry.fromServiceLoader().types())
                .contains("popularity", "entity-properties");
    }

    @Test
    @DisplayName("Popularity engine trains on routed events and is MIXED")
    void shouldTrainPopularityThroughHost() throws Exception {
        host.registry.create(popularityParams("pop-1"));
        feedPopularity("pop-1");

        trainAndWait("pop-1");

        assertThat(host.registry.status("pop-1").discipline()).isEqualTo(TrainingDiscipline.MIXED);
        assertThat(topItems("pop-1")).extracting(n -> n.get("item").asText()).containsExactly("i3", "i1", "i2");
        assertThat(host.mirrorLog.verify("pop-1").isIntact()).isTrue();
    }

    @Test
    void shouldApplyItemDeleteToLiveRanking() throws Exception {
        host.registry.create(popularityParams("pop-1"));
        feedPopularity("pop-1");
        trainAndWait("pop-1");

        var result = host.router.input("pop-1", ParameterStore.mapper().createObjectNode()
                .put("entityType", "item")
                .put("entityId", "i3")
                .put("event", "$delete"));

        assertThat(result.modelUpdate()).isEqualTo(ModelUpdate.APPLIED);
        assertThat(topItems("pop-1")).extracting(n -> n.get("item").asText()).containsExactly("i1", "i2");
    }

    @Test
    @DisplayName("A restarted host rebuilds a Dataset by replaying the instance's own mirror")
    void shouldRebuildAfterRestartFromMirror() throws Exception {
        host.registry.create(popularityParams("pop-1"));
        feedPopularity("pop-1");
        host.registry.shutdown();

        host = new Host();
        RestoreReport report = host.registry.restoreAll();
        assertThat(report.restored()).containsExactly("pop-1");
        assertThat(host.registry.status("pop-1").details()).containsEntry("events", 0);

        int replayed = host.router.replayInto("pop-1", "pop-1");
        trainAndWait("pop-1");

        assertThat(replayed).isEqualTo(6);
        assertThat(host.mirrorLog.read("pop-1")).hasSize(6);
        assertThat(topItems("pop-1")).extracting(n -> n.get("item").asText()).containsExactly("i3", "i1", "i2");
    }

    @Test
    void shouldReplayIntoFreshInstanceWithSameResult() throws Exception {
        host.registry.create(popularityParams("pop-1"));
        host.registry.create(popularityParams("pop-2"));
        feedPopularity("pop-1");
        trainAndWait("pop-1");

        host.router.replayInto("pop-1", "pop-2");
        trainAndWait("pop-2");

        assertThat(topItems("pop-2")).isEqualTo(topItems("pop-1"));
    }

    @Test
    void shouldServeEntityPropertiesContinuously() {
        host.registry.create(propertiesParams("props-1", "user"));

        var result = host.router.input("props-1", ParameterStore.readTree(
                "{\"entityType\":\"user\",\"entityId\":\"u1\",\"event\":\"$set\",\"properties\":{\"tier\":\"gold\"}}"));
        JsonNode answer = host.router.query("props-1", ParameterStore.readTree(
                "{\"entityType\":\"user\",\"entityId\":\"u1\"}"));

        assertThat(result.modelUpdate()).isEqualTo(ModelUpdate.APPLIED);
        assertThat(host.registry.status("props-1").discipline()).isEqualTo(TrainingDiscipline.CONTINUOUS);
        assertThat(answer.get("properties").get("tier").asText()).isEqualTo("gold");
    }

    @Test
    void shouldRejectUnknownEntityTypeBeforeStoringIt() {
        host.registry.create(propertiesParams("props-1", "user"));

        assertThatThrownBy(() -> host.router.input("props-1", ParameterStore.readTree(
                "{\"entityType\":\"model\",\"entityId\":\"m1\",\"event\":\"$delete\"}")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Deleting unknown entityType");
        assertThat(host.registry.status("props-1").details()).containsEntry("journaled", 0);
    }

    @Test
    void shouldRefuseEntityTypeChangeOnUpdate() {
        host.registry.create(propertiesParams("props-1", "user"));

        assertThatThrownBy(() -> host.registry.update("props-1", propertiesParams("props-1", "user", "item")))
                .isInstanceOf(UnsupportedUpdateException.class);
        host.registry.update("props-1", propertiesParams("props-1", "user"));
        assertThat(host.registry.status("props-1").engineFactory()).isEqualTo("entity-properties");
    }
}
