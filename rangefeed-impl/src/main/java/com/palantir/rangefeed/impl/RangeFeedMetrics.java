/*
 * (c) Copyright 2024 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.rangefeed.impl;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.palantir.rangefeed.Span;

/**
 * Processor metrics. Meters and the disconnect counter are shared by every processor on a registry. The gauges are
 * scoped to the processor's span and read a snapshot the event loop publishes after every message, so they may lag
 * the loop's state by one message.
 */
final class RangeFeedMetrics {
    private final MetricRegistry registry;
    private final Meter logicalOps;
    private final Meter valuesPublished;
    private final Meter checkpointsPublished;
    private final Counter disconnects;

    private volatile int registrations;
    private volatile int intents;

    private final Gauge<Integer> registrationsGauge;
    private final Gauge<Integer> intentsGauge;

    private RangeFeedMetrics(MetricRegistry registry) {
        this.registry = registry;
        this.logicalOps = registry.meter(name("logicalOps"));
        this.valuesPublished = registry.meter(name("valuesPublished"));
        this.checkpointsPublished = registry.meter(name("checkpointsPublished"));
        this.disconnects = registry.counter(name("disconnects"));
        this.registrationsGauge = () -> registrations;
        this.intentsGauge = () -> intents;
    }

    /**
     * Creates the metrics of the processor for {@code span}. Gauges left behind by an earlier processor for the same
     * span are replaced.
     */
    static RangeFeedMetrics create(MetricRegistry registry, Span span) {
        RangeFeedMetrics metrics = new RangeFeedMetrics(registry);
        metrics.replaceGauge(gaugeName(span, "registrations"), metrics.registrationsGauge);
        metrics.replaceGauge(gaugeName(span, "intents"), metrics.intentsGauge);
        return metrics;
    }

    static String gaugeName(Span span, String metric) {
        return MetricRegistry.name(Processor.class, span.toString(), metric);
    }

    void markLogicalOps(int count) {
        logicalOps.mark(count);
    }

    void markValuePublished() {
        valuesPublished.mark();
    }

    void markCheckpointPublished() {
        checkpointsPublished.mark();
    }

    void markDisconnect() {
        disconnects.inc();
    }

    void updateSnapshot(int liveRegistrations, int trackedIntents) {
        registrations = liveRegistrations;
        intents = trackedIntents;
    }

    /**
     * Removes this processor's gauges, unless a newer processor for the same span has replaced them.
     */
    void unregisterGauges() {
        registry.removeMatching((name, metric) -> metric == registrationsGauge || metric == intentsGauge);
    }

    private void replaceGauge(String gaugeName, Gauge<Integer> gauge) {
        registry.remove(gaugeName);
        registry.register(gaugeName, gauge);
    }

    private static String name(String metric) {
        return MetricRegistry.name(Processor.class, metric);
    }
}
