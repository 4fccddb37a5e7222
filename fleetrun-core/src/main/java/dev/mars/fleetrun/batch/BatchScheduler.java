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

package dev.mars.fleetrun.batch;

import dev.mars.fleetrun.client.AgentClient;
import dev.mars.fleetrun.client.ProgressSink;
import dev.mars.fleetrun.config.FleetRunConfiguration;
import dev.mars.fleetrun.core.CommandDescriptor;
import dev.mars.fleetrun.core.ConfigurationError;
import dev.mars.fleetrun.core.Node;
import dev.mars.fleetrun.core.NodeSet;
import dev.mars.fleetrun.core.NodeState;
import dev.mars.fleetrun.core.RunStatistics;
import dev.mars.fleetrun.core.ValidationResult;
import dev.mars.fleetrun.core.exceptions.ConfigurationException;
import dev.mars.fleetrun.core.exceptions.FatalTransportException;
import dev.mars.fleetrun.core.exceptions.InvalidTransitionException;
import dev.mars.fleetrun.observability.BatchMetrics;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one command across a node set with at most C nodes in flight.
 *
 * <p>Nodes are admitted in node set order. The calling thread owns the admission queue and the
 * in-flight set, and blocks only while waiting on the event channel for the next node event.
 * A failed, rejected or timed out node never stops the batch; its slot goes to the next queued
 * node. Only a lost transport aborts the run.</p>
 *
 * <p>Cancellation ({@link #cancel()}, interruption of the calling thread, or the run-wide
 * timeout) stops admission, gives in-flight nodes up to the configured abandon timeout to
 * finish, and then records the rest as abandoned. Nodes that were never admitted are reported
 * as skipped.</p>
 *
 * <p>A scheduler runs one batch at a time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class BatchScheduler {

    private static final Logger logger = LoggerFactory.getLogger(BatchScheduler.class);

    private final Vertx vertx;
    private final AgentClient client;
    private final FleetRunConfiguration configuration;
    private final BatchMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile BlockingQueue<NodeEvent> activeChannel;
    private volatile boolean cancelRequested;

    public BatchScheduler(Vertx vertx, AgentClient client, FleetRunConfiguration configuration) {
        this(vertx, client, configuration, BatchMetrics.forConfiguration(configuration), Clock.systemUTC());
    }

    public BatchScheduler(Vertx vertx, AgentClient client, FleetRunConfiguration configuration,
                          BatchMetrics metrics, Clock clock) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.client = Objects.requireNonNull(client, "Agent client cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Check a request without running it.
     */
    public ValidationResult validate(BatchRequest request) {
        ValidationResult result = new ValidationResult();

        Optional<Integer> limit = request.getConcurrencyLimit();
        if (limit.isEmpty()) {
            result.addError(ConfigurationError.Kind.MISSING_CONCURRENCY);
        } else if (limit.get() <= 0) {
            result.addError(ConfigurationError.Kind.NON_POSITIVE_CONCURRENCY);
        }

        if (request.getFilter().isCompound()) {
            result.addError(ConfigurationError.Kind.COMPOUND_FILTER);
        }

        request.getNodeSet().stream()
                .filter(node -> node.getState() != NodeState.QUEUED)
                .forEach(node -> result.addError(ConfigurationError.Kind.NODE_NOT_QUEUED,
                        node.getIdentity(), node.getState().name()));

        if (request.getCommand().isEmpty()) {
            result.addError(ConfigurationError.Kind.MISSING_COMMAND);
        }

        return result;
    }

    /**
     * Run a batch over an explicit node set with no filter.
     */
    public RunStatistics run(NodeSet nodeSet, Integer concurrencyLimit, CommandDescriptor command,
                             ProgressSink progressSink) throws ConfigurationException, FatalTransportException {
        return run(BatchRequest.builder()
                .nodeSet(nodeSet)
                .concurrencyLimit(concurrencyLimit)
                .command(command)
                .build(), progressSink);
    }

    /**
     * Run a batch to completion on the calling thread.
     *
     * @return statistics covering every node in the request
     * @throws ConfigurationException if the request is invalid; nothing is dispatched
     * @throws FatalTransportException if the agent client became unusable during the run
     * @throws IllegalStateException if this scheduler is already running a batch
     */
    public RunStatistics run(BatchRequest request, ProgressSink progressSink)
            throws ConfigurationException, FatalTransportException {
        Objects.requireNonNull(request, "Batch request cannot be null");
        ProgressSink sink = progressSink != null ? progressSink : ProgressSink.NONE;

        ValidationResult validation = validate(request);
        if (!validation.isValid()) {
            logger.warn("Batch request rejected: {}", validation.getErrors());
            throw new ConfigurationException(validation);
        }

        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A batch run is already in progress on this scheduler");
        }

        BlockingQueue<NodeEvent> channel = new LinkedBlockingQueue<>();
        activeChannel = channel;
        try {
            return new Run(request, sink, channel).execute();
        } finally {
            activeChannel = null;
            cancelRequested = false;
            running.set(false);
        }
    }

    /**
     * Request cancellation of the batch in progress. Safe to call from any thread.
     *
     * <p>A request made while no batch is running applies to the next {@link #run}, which then
     * admits no nodes and reports all of them as skipped.</p>
     */
    public void cancel() {
        cancelRequested = true;
        BlockingQueue<NodeEvent> channel = activeChannel;
        if (channel == null) {
            logger.info("Cancellation requested before the batch started; no nodes will be admitted");
            return;
        }
        logger.info("Cancellation requested for batch run in progress");
        channel.offer(NodeEvent.cancelled());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * State of a single invocation. Only touched by the thread executing {@link #run}.
     */
    private final class Run {

        private final BatchRequest request;
        private final ProgressSink sink;
        private final BlockingQueue<NodeEvent> channel;
        private final int concurrencyLimit;
        private final CommandDescriptor command;
        private final Duration nodeTimeout;
        private final Duration abandonTimeout;

        private final Deque<Node> pending;
        private final Map<String, RunStateTracker> inFlight = new LinkedHashMap<>();
        private final StatsAggregator aggregator;
        private final Instant startTime;

        private boolean abandoning;
        private boolean interrupted;
        private long abandonDeadlineNanos;
        private int admittedCount;
        private long runTimerId = -1;

        Run(BatchRequest request, ProgressSink sink, BlockingQueue<NodeEvent> channel) {
            this.request = request;
            this.sink = sink;
            this.channel = channel;
            this.concurrencyLimit = request.getConcurrencyLimit().orElseThrow();
            this.command = request.getCommand().orElseThrow();
            this.nodeTimeout = request.getNodeTimeout().orElse(configuration.getNodeTimeout());
            this.abandonTimeout = configuration.getAbandonTimeout();
            this.pending = new ArrayDeque<>(request.getNodeSet().getNodes());
            this.startTime = clock.instant();
            this.aggregator = new StatsAggregator(request.getNodeSet().size(), startTime);
        }

        RunStatistics execute() throws FatalTransportException {
            int total = request.getNodeSet().size();
            if (total == 0) {
                logger.info("Batch has no nodes, nothing to do");
                aggregator.markComplete(startTime, 0, cancelRequested);
                return aggregator.finalizeStatistics();
            }

            logger.info("Starting batch: {} nodes, concurrency {}, command {}", total, concurrencyLimit,
                    command.getAction());
            progress(String.format("Running %s on %d nodes with a concurrency of %d",
                    command.getAction(), total, concurrencyLimit));

            armRunTimer();
            try {
                // a cancel() racing with activeChannel publication lands here or on the channel
                if (cancelRequested) {
                    beginAbandon("cancelled");
                }
                loop();
            } finally {
                cancelRunTimer();
                inFlight.values().forEach(RunStateTracker::disarm);
                metrics.recordRunDuration(Duration.between(startTime, clock.instant()));
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }

            aggregator.markComplete(clock.instant(), pending.size(), abandoning);
            RunStatistics statistics = aggregator.finalizeStatistics();
            logger.info("Batch finished: {}", statistics);
            return statistics;
        }

        private void loop() throws FatalTransportException {
            while (true) {
                if (!abandoning) {
                    admitWhileCapacity();
                }
                if (inFlight.isEmpty() && (abandoning || pending.isEmpty())) {
                    return;
                }

                NodeEvent event;
                try {
                    event = abandoning
                            ? channel.poll(remainingAbandonNanos(), TimeUnit.NANOSECONDS)
                            : channel.take();
                } catch (InterruptedException e) {
                    interrupted = true;
                    beginAbandon("interrupted");
                    continue;
                }

                if (event == null) {
                    abandonInFlight();
                    return;
                }
                handle(event);
            }
        }

        private void admitWhileCapacity() {
            while (inFlight.size() < concurrencyLimit && !pending.isEmpty()) {
                Node node = pending.poll();
                RunStateTracker tracker = new RunStateTracker(node, client, vertx, channel, nodeTimeout, clock);
                inFlight.put(node.getIdentity(), tracker);
                admittedCount++;
                aggregator.recordDispatched(node.getIdentity());
                metrics.recordAdmitted();
                logger.debug("Admitting node {} ({} in flight)", node.getIdentity(), inFlight.size());
                progress(String.format("Admitted %s (%d of %d)", node.getIdentity(), admittedCount,
                        request.getNodeSet().size()));
                try {
                    tracker.dispatch(command);
                } catch (InvalidTransitionException e) {
                    throw new IllegalStateException("Queued node could not be dispatched: " + e.getMessage(), e);
                }
            }
        }

        private void handle(NodeEvent event) throws FatalTransportException {
            switch (event.getType()) {
                case CANCELLED:
                    beginAbandon("cancelled");
                    return;
                case RUN_TIMEOUT:
                    beginAbandon("run timeout");
                    return;
                case TRANSPORT_LOST:
                    abort(event);
                    return;
                default:
                    break;
            }

            String identity = event.getNodeIdentity().orElse(null);
            RunStateTracker tracker = identity != null ? inFlight.get(identity) : null;
            if (tracker == null) {
                logger.debug("Ignoring {} for node no longer in flight", event);
                return;
            }

            boolean terminal;
            try {
                terminal = tracker.apply(event);
            } catch (InvalidTransitionException e) {
                logger.warn("Agent client reported out of order event for node {}: {}", identity, e.getMessage());
                return;
            }
            if (terminal) {
                complete(tracker);
            }
        }

        private void complete(RunStateTracker tracker) {
            inFlight.remove(tracker.getIdentity());
            Node node = tracker.getNode();
            if (!aggregator.record(node)) {
                return;
            }
            metrics.recordCompleted(node.getState().name());

            String detail = node.getErrorDetail().map(d -> ": " + d).orElse("");
            switch (node.getState()) {
                case SUCCEEDED:
                    logger.info("Node {} succeeded", node.getIdentity());
                    progress(String.format("%s succeeded", node.getIdentity()));
                    break;
                case FAILED:
                    logger.warn("Node {} failed{}", node.getIdentity(), detail);
                    progress(String.format("%s failed%s", node.getIdentity(), detail));
                    break;
                case TIMED_OUT:
                    logger.warn("Node {} timed out{}", node.getIdentity(), detail);
                    progress(String.format("%s timed out%s", node.getIdentity(), detail));
                    break;
                default:
                    break;
            }
        }

        private void beginAbandon(String reason) {
            if (abandoning) {
                return;
            }
            abandoning = true;
            abandonDeadlineNanos = System.nanoTime() + abandonTimeout.toNanos();
            metrics.recordAborted(reason);
            logger.warn("Batch {}: stopping admission with {} nodes queued, waiting up to {}ms for {} in flight",
                    reason, pending.size(), abandonTimeout.toMillis(), inFlight.size());
            progress(String.format("Run %s: not admitting %d queued nodes, waiting for %d in flight",
                    reason, pending.size(), inFlight.size()));
        }

        private void abandonInFlight() {
            String detail = "Abandoned after " + abandonTimeout.toMillis() + "ms wait on cancellation";
            for (RunStateTracker tracker : new ArrayList<>(inFlight.values())) {
                if (tracker.abandon(detail)) {
                    complete(tracker);
                }
            }
        }

        private void abort(NodeEvent event) throws FatalTransportException {
            String identity = event.getNodeIdentity().orElse("unknown");
            String detail = "Agent transport lost: " + event.getDetail().orElse("unknown error");
            logger.error("Aborting batch, transport lost while handling node {}: {}", identity,
                    event.getDetail().orElse("unknown error"));
            metrics.recordAborted("transport");

            List<RunStateTracker> trackers = new ArrayList<>(inFlight.values());
            for (RunStateTracker tracker : trackers) {
                if (tracker.fail(detail)) {
                    complete(tracker);
                }
            }
            progress(String.format("Run aborted: %s", detail));

            aggregator.markComplete(clock.instant(), pending.size(), false);
            RunStatistics partial = aggregator.finalizeStatistics();
            throw new FatalTransportException(detail, event.getCause().orElse(null), partial);
        }

        private long remainingAbandonNanos() {
            return Math.max(0, abandonDeadlineNanos - System.nanoTime());
        }

        private void armRunTimer() {
            Optional<Duration> runTimeout = request.getRunTimeout().or(configuration::getRunTimeout);
            runTimeout.ifPresent(timeout -> runTimerId = vertx.setTimer(Math.max(1, timeout.toMillis()),
                    id -> channel.offer(NodeEvent.runTimeout())));
        }

        private void cancelRunTimer() {
            if (runTimerId >= 0) {
                vertx.cancelTimer(runTimerId);
            }
        }

        private void progress(String message) {
            try {
                sink.emit(clock.instant(), message);
            } catch (RuntimeException e) {
                logger.warn("Progress sink failed on '{}': {}", message, e.getMessage());
                logger.debug("Stack trace", e);
            }
        }
    }
}
