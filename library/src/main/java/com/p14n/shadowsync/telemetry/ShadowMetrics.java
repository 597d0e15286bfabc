package com.p14n.shadowsync.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

public class ShadowMetrics {

        private static final AttributeKey<String> KIND = AttributeKey.stringKey("kind");

        private final LongCounter mutations;
        private final LongCounter noops;
        private final LongCounter conflicts;

        public ShadowMetrics(Meter meter) {
                mutations = meter.counterBuilder("shadow_mutations")
                                .setDescription("Number of accepted shadow mutations")
                                .build();

                noops = meter.counterBuilder("shadow_noops")
                                .setDescription("Number of shadow updates that changed nothing")
                                .build();

                conflicts = meter.counterBuilder("shadow_conflicts")
                                .setDescription("Number of shadow updates rejected on a version conflict")
                                .build();
        }

        public void recordMutation(String kind) {
                mutations.add(1, Attributes.of(KIND, kind));
        }

        public void recordNoop(String kind) {
                noops.add(1, Attributes.of(KIND, kind));
        }

        public void recordConflict(String kind) {
                conflicts.add(1, Attributes.of(KIND, kind));
        }
}
