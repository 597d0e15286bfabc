package com.p14n.shadowsync.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.semconv.ResourceAttributes;

/**
 * An in-process OpenTelemetry SDK with W3C propagation and no exporters.
 * Spans still carry real trace ids, so traceparents survive a round trip
 * through the broker.
 */
public class DefaultTelemetryConfig implements TelemetryConfig, AutoCloseable {

    private final OpenTelemetrySdk sdk;

    public DefaultTelemetryConfig(String serviceName) {
        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(ResourceAttributes.SERVICE_NAME, serviceName)));

        sdk = OpenTelemetrySdk.builder()
                .setMeterProvider(SdkMeterProvider.builder().setResource(resource).build())
                .setTracerProvider(SdkTracerProvider.builder().setResource(resource).build())
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
    }

    @Override
    public OpenTelemetry getOpenTelemetry() {
        return sdk;
    }

    @Override
    public void close() {
        sdk.getSdkTracerProvider().close();
        sdk.getSdkMeterProvider().close();
    }
}
