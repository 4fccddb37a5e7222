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
import dev.mars.fleetrun.core.CommandDescriptor;
import dev.mars.fleetrun.core.Node;
import dev.mars.fleetrun.core.NodeOutcome;
import dev.mars.fleetrun.core.NodeState;
import dev.mars.fleetrun.core.TriggerResponse;
import dev.mars.fleetrun.core.exceptions.AgentTransportException;
import dev.mars.fleetrun.core.exceptions.InvalidTransitionException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * Drives one node from admission to a terminal state.
 *
 * <p>Asynchronous work (the trigger, the outcome subscription, the node timer) only posts
 * {@link NodeEvent}s onto the shared channel. State changes happen in {@link #dispatch},
 * {@link #apply}, {@link #abandon} and {@link #fail}, all of which must be called from the
 * scheduling thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
class RunStateTracker {

    private static final Logger logger = LoggerFactory.getLogger(RunStateTracker.class);

    private final AgentClient client;
    private final Vertx vertx;
    private final BlockingQueue<NodeEvent> channel;
    private final Duration nodeTimeout;
    private final Clock clock;

    private Node node;
    private long timerId = -1;

    RunStateTracker(Node node, AgentClient client, Vertx vertx, BlockingQueue<NodeEvent> channel,
                    Duration nodeTimeout, Clock clock) {
        this.node = Objects.requireNonNull(node, "Node cannot be null");
        this.client = Objects.requireNonNull(client, "Agent client cannot be null");
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.channel = Objects.requireNonNull(channel, "Event channel cannot be null");
        this.nodeTimeout = Objects.requireNonNull(nodeTimeout, "Node timeout cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    String getIdentity() {
        return node.getIdentity();
    }

    Node getNode() {
        return node;
    }

    NodeState getState() {
        return node.getState();
    }

    /**
     * Admit the node: mark it DISPATCHED, arm its timer and send the trigger.
     */
    void dispatch(CommandDescriptor command) throws InvalidTransitionException {
        moveTo(NodeState.DISPATCHED);
        armTimer();

        String identity = getIdentity();
        Future<TriggerResponse> response;
        try {
            response = client.trigger(identity, command);
        } catch (RuntimeException e) {
            logger.warn("Trigger for node {} failed before it was sent: {}", identity, e.getMessage());
            channel.offer(NodeEvent.triggerFailed(identity, e));
            return;
        }

        response.onComplete(ar -> {
            if (ar.failed()) {
                channel.offer(failureEvent(identity, ar.cause(), true));
            } else if (ar.result() == null) {
                channel.offer(NodeEvent.rejected(identity, "Agent returned no trigger response"));
            } else if (ar.result().isAccepted()) {
                channel.offer(NodeEvent.acknowledged(identity));
            } else {
                channel.offer(NodeEvent.rejected(identity,
                        ar.result().getReason().orElse("Trigger rejected by agent")));
            }
        });
    }

    /**
     * Apply an event addressed to this node.
     *
     * @return true if the node reached a terminal state because of this event
     * @throws InvalidTransitionException if the event asks for a transition the current state does not allow
     */
    boolean apply(NodeEvent event) throws InvalidTransitionException {
        if (node.isTerminal()) {
            logger.debug("Ignoring {} for node {} already in {}", event.getType(), getIdentity(), node.getState().name());
            return false;
        }

        switch (event.getType()) {
            case ACKNOWLEDGED:
                if (node.getState() != NodeState.DISPATCHED) {
                    logger.debug("Ignoring duplicate acknowledgement for node {}", getIdentity());
                    return false;
                }
                moveTo(NodeState.RUNNING);
                subscribe();
                return false;

            case REJECTED:
            case TRIGGER_FAILED:
            case OUTCOME_FAILED:
                terminate(NodeState.FAILED, event.getDetail().orElse(event.getType().name()));
                return true;

            case OUTCOME:
                NodeOutcome outcome = event.getOutcome().orElseThrow();
                if (outcome.isSuccessful()) {
                    requireTransition(NodeState.SUCCEEDED);
                    setNode(node.withSuccess(outcome.getPayload(), clock.instant()));
                } else {
                    requireTransition(NodeState.FAILED);
                    setNode(node.withFailure(NodeState.FAILED,
                            outcome.getMessage().orElse("Agent reported failure"), clock.instant()));
                }
                return true;

            case NODE_TIMEOUT:
                if (node.getState() == NodeState.DISPATCHED) {
                    terminate(NodeState.FAILED, "Trigger not acknowledged within " + nodeTimeout.toMillis() + "ms");
                } else {
                    terminate(NodeState.TIMED_OUT, "No result within " + nodeTimeout.toMillis() + "ms");
                }
                return true;

            default:
                throw new IllegalArgumentException("Not a per-node event: " + event.getType());
        }
    }

    /**
     * Give up on an in-flight node after cancellation. A node that never acknowledged the trigger
     * becomes FAILED, a running one TIMED_OUT.
     *
     * @return false if the node was not in flight
     */
    boolean abandon(String detail) {
        if (!node.getState().isInFlight()) {
            return false;
        }
        NodeState target = node.getState() == NodeState.DISPATCHED ? NodeState.FAILED : NodeState.TIMED_OUT;
        terminateInFlight(target, detail);
        return true;
    }

    /**
     * Mark an in-flight node FAILED, used when the whole run is aborted.
     *
     * @return false if the node was not in flight
     */
    boolean fail(String detail) {
        if (!node.getState().isInFlight()) {
            return false;
        }
        terminateInFlight(NodeState.FAILED, detail);
        return true;
    }

    void disarm() {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
            timerId = -1;
        }
    }

    private void subscribe() {
        String identity = getIdentity();
        Future<NodeOutcome> outcome;
        try {
            outcome = client.awaitOutcome(identity);
        } catch (RuntimeException e) {
            logger.warn("Could not subscribe to outcome of node {}: {}", identity, e.getMessage());
            channel.offer(NodeEvent.outcomeFailed(identity, e));
            return;
        }

        outcome.onComplete(ar -> {
            if (ar.failed()) {
                channel.offer(failureEvent(identity, ar.cause(), false));
            } else if (ar.result() == null) {
                channel.offer(NodeEvent.outcomeFailed(identity,
                        new IllegalStateException("Agent returned no outcome")));
            } else {
                channel.offer(NodeEvent.outcome(identity, ar.result()));
            }
        });
    }

    private void armTimer() {
        String identity = getIdentity();
        timerId = vertx.setTimer(Math.max(1, nodeTimeout.toMillis()),
                id -> channel.offer(NodeEvent.nodeTimeout(identity)));
    }

    private void moveTo(NodeState target) throws InvalidTransitionException {
        requireTransition(target);
        setNode(node.withState(target, clock.instant()));
    }

    private void terminate(NodeState target, String detail) throws InvalidTransitionException {
        requireTransition(target);
        setNode(node.withFailure(target, detail, clock.instant()));
    }

    private void terminateInFlight(NodeState target, String detail) {
        try {
            terminate(target, detail);
        } catch (InvalidTransitionException e) {
            // callers only pick targets reachable from the current in-flight state
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private void requireTransition(NodeState target) throws InvalidTransitionException {
        if (!node.getState().canTransitionTo(target)) {
            throw new InvalidTransitionException(getIdentity(), node.getState(), target);
        }
    }

    private void setNode(Node updated) {
        logger.debug("Node {}: {} -> {}", updated.getIdentity(), node.getState().name(), updated.getState().name());
        this.node = updated;
        if (updated.isTerminal()) {
            disarm();
        }
    }

    private static NodeEvent failureEvent(String identity, Throwable cause, boolean duringTrigger) {
        if (cause instanceof AgentTransportException) {
            return NodeEvent.transportLost(identity, cause);
        }
        return duringTrigger ? NodeEvent.triggerFailed(identity, cause) : NodeEvent.outcomeFailed(identity, cause);
    }

    @Override
    public String toString() {
        return "RunStateTracker{" + node + '}';
    }
}
