/*
 * Copyright (c) 2025 Pathways Typing Tool
 * Licensed under the Apache License, Version 2.0
 */
package com.pathways.typing.core.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracing for compilation runs.
 *
 * <p>Spans are exported synchronously through the logging exporter: a compilation is a short
 * batch run, so there is no export queue to drain.
 *
 * <p>Configuration via environment variables or system properties:
 * <ul>
 *   <li>OTEL_DISABLED: disable tracing entirely (default: false)</li>
 *   <li>OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0)</li>
 *   <li>SERVICE_NAME: service identifier (default: typing-tool)</li>
 *   <li>SERVICE_VERSION: tool version (default: unknown)</li>
 * </ul>
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.pathways.typing-tool";
    private static final String DEFAULT_SERVICE_NAME = "typing-tool";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;
    private final boolean isNoop;

    private TracingService(OpenTelemetry openTelemetry, Tracer tracer,
                           SdkTracerProvider tracerProvider, boolean isNoop) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
        this.isNoop = isNoop;
    }

    /**
     * Get singleton instance with double-checked locking.
     */
    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Tracing service that records nothing, for tests and embedded use.
     */
    public static TracingService noop() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new TracingService(noop, noop.getTracer(INSTRUMENTATION_NAME), null, true);
    }

    private static TracingService initialize() {
        try {
            if (isTracingDisabled()) {
                logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
                return noop();
            }

            Sampler sampler = configureSampler();
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(buildResource())
                    .setSampler(sampler)
                    .addSpanProcessor(SimpleSpanProcessor.create(LoggingSpanExporter.create()))
                    .build();

            OpenTelemetrySdk openTelemetrySdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .build();

            logger.info(String.format("OpenTelemetry initialized: service=%s, version=%s, sampler=%s",
                    getServiceName(), getServiceVersion(), sampler.getDescription()));

            return new TracingService(openTelemetrySdk, openTelemetrySdk.getTracer(INSTRUMENTATION_NAME),
                    tracerProvider, false);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static Resource buildResource() {
        return Resource.getDefault().merge(Resource.create(Attributes.builder()
                .put(SERVICE_NAME, getServiceName())
                .put(SERVICE_VERSION, getServiceVersion())
                .build()));
    }

    private static Sampler configureSampler() {
        double samplingRatio;
        try {
            samplingRatio = Double.parseDouble(getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", "1.0"));
            samplingRatio = Math.max(0.0, Math.min(1.0, samplingRatio));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using 1.0");
            samplingRatio = 1.0;
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio)).build();
    }

    /**
     * Flushes and closes the exporter. Safe to call more than once.
     */
    public void shutdown() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return !isNoop;
    }

    private static boolean isTracingDisabled() {
        return Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"));
    }

    private static String getServiceName() {
        return getEnvOrProperty("SERVICE_NAME", DEFAULT_SERVICE_NAME);
    }

    private static String getServiceVersion() {
        return getEnvOrProperty("SERVICE_VERSION", "unknown");
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
