/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.service.rest;

import com.tessera.engine.infra.metrics.MetricsRegistry;
import com.tessera.engine.infra.metrics.impl.prometheus.PrometheusMetricsRegistry;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Response;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Exposes host metrics in the Prometheus text format.
 */
@Path("/monitoring")
public class MonitoringResource {

    @Inject
    MetricsRegistry metrics;

    @GET
    @Path("/metrics")
    @Produces(TextFormat.CONTENT_TYPE_004)
    public Response getMetrics() {
        CollectorRegistry registry = metrics instanceof PrometheusMetricsRegistry prometheus
                ? prometheus.collectorRegistry()
                : CollectorRegistry.defaultRegistry;
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, registry.metricFamilySamples());
        } catch (IOException e) {
            return ErrorResponses.internal(e);
        }
        return Response.ok(writer.toString()).build();
    }
}
