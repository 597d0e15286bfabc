package com.p14n.shadowsync.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.p14n.shadowsync.data.Traceable;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        private static final String TRACEPARENT = "traceparent";

        private static final TextMapGetter<Map<String, String>> MAP_GETTER = new TextMapGetter<>() {
                @Override
                public Iterable<String> keys(Map<String, String> carrier) {
                        return carrier.keySet();
                }

                @Override
                public String get(Map<String, String> carrier, String key) {
                        return carrier == null ? null : carrier.get(key);
                }
        };

        private OpenTelemetryFunctions() {
        }

        /**
         * Serializes the current span context as a W3C traceparent, or null when
         * there is no active span.
         */
        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get(TRACEPARENT);
        }

        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                Map<String, String> carrier = new HashMap<>();
                carrier.put(TRACEPARENT, traceparent);
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), carrier, MAP_GETTER);
        }

        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, String spanName, String topic,
                        String messageId, String correlationId, String traceparent, Supplier<T> action) {

                Context parentContext = traceparent == null ? null : deserializeTraceContext(ot, traceparent);
                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("topic", topic)
                                .setAttribute("message.id", messageId == null ? "" : messageId);
                if (correlationId != null) {
                        sb.setAttribute("correlation.id", correlationId);
                }
                if (parentContext != null) {
                        sb.setParent(parentContext);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, Traceable message,
                        String spanName, Supplier<T> action) {
                return processWithTelemetry(ot, tracer, spanName, message.topic(), message.id(),
                                message.correlationId(), message.traceparent(), action);
        }
}
