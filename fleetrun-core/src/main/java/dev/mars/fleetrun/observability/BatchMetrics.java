/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.fleetrun.observability;

import dev.mars.fleetrun.config.FleetRunConfiguration;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for batch runs.
 *
 * Provides:
 * - fleetrun.batch.nodes.admitted (counter) - Nodes dispatched to an agent
 * - fleetrun.batch.nodes.completed (counter) - Terminal nodes, by outcome
 * - fleetrun.batch.runs.aborted (counter) - Runs aborted, by reason
 * - fleetrun.batch.nodes.in_flight (gauge) - Nodes currently holding a slot
 * - fleetrun.batch.run.duration (histogram) - Wall clock time per run
 *
 * Recording is a no-op unless an OpenTelemetry SDK has been registered globally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class BatchMetrics {

    private static final Logger logger = LoggerFactory.getLogger(BatchMetrics.class);
    private static final String METER_NAME = "fleetrun-batch";

    private static BatchMetrics instance;

    private final LongCounter nodesAdmitted;
    private final LongCounter nodesCompleted;
    private final LongCounter runsAborted;
    private final DoubleHistogram runDuration;

    private final AtomicLong inFlight = new AtomicLong(0);

    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");

    private BatchMetrics(Meter meter) {
        nodesAdmitted = meter.counterBuilder("fleetrun.batch.nodes.admitted")
                .setDescription("Number of nodes dispatched to an agent")
                .setUnit("1")
                .build();

        nodesCompleted = meter.counterBuilder("fleetrun.batch.nodes.completed")
                .setDescription("Number of nodes that reached a terminal state")
                .setUnit("1")
                .build();

        runsAborted = meter.counterBuilder("fleetrun.batch.runs.aborted")
                .setDescription("Number of batch runs that did not complete normally")
                .setUnit("1")
                .build();

        runDuration = meter.histogramBuilder("fleetrun.batch.run.duration")
                .setDescription("Wall clock duration of batch runs")
                .setUnit("ms")
                .build();

        meter.gaugeBuilder("fleetrun.batch.nodes.in_flight")
                .setDescription("Nodes currently dispatched or running")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(inFlight.get()));
    }

    /**
     * Get the shared instance backed by {@link GlobalOpenTelemetry}.
     */
    public static synchronized BatchMetrics getInstance() {
        if (instance == null) {
            instance = new BatchMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
            logger.info("BatchMetrics initialized");
        }
        return instance;
    }

    /**
     * Metrics that record nothing.
     */
    public static BatchMetrics noop() {
        return new BatchMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public static BatchMetrics forConfiguration(FleetRunConfiguration configuration) {
        return configuration.isMetricsEnabled() ? getInstance() : noop();
    }

    public void recordAdmitted() {
        nodesAdmitted.add(1);
        inFlight.incrementAndGet();
    }

    /**
     * Record a node that left its slot in a terminal state.
     */
    public void recordCompleted(String outcome) {
        nodesCompleted.add(1, Attributes.of(OUTCOME_KEY, outcome));
        inFlight.decrementAndGet();
    }

    public void recordAborted(String reason) {
        runsAborted.add(1, Attributes.of(REASON_KEY, reason));
    }

    public void recordRunDuration(Duration duration) {
        runDuration.record(duration.toMillis());
    }

    public long getInFlight() {
        return inFlight.get();
    }
}
