package com.p14n.shadowsync.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;

/**
 * Telemetry handles shared by the engine's components, all scoped to the
 * {@code com.p14n.shadowsync} instrumentation.
 */
public interface TelemetryConfig {

    String INSTRUMENTATION_NAME = "com.p14n.shadowsync";

    OpenTelemetry getOpenTelemetry();

    default Meter getMeter() {
        return getOpenTelemetry().getMeter(INSTRUMENTATION_NAME);
    }

    default Tracer getTracer() {
        return getOpenTelemetry().getTracer(INSTRUMENTATION_NAME);
    }

    default BrokerMetrics brokerMetrics() {
        return new BrokerMetrics(getMeter());
    }

    default ShadowMetrics shadowMetrics() {
        return new ShadowMetrics(getMeter());
    }

    /**
     * Wraps an instance built elsewhere, such as the app's OTLP exporter
     * setup or {@link OpenTelemetry#noop()}.
     */
    static TelemetryConfig of(OpenTelemetry openTelemetry) {
        return () -> openTelemetry;
    }
}
