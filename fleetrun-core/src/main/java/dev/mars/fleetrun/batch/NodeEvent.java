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

import dev.mars.fleetrun.core.NodeOutcome;

import java.util.Objects;
import java.util.Optional;

/**
 * Message posted onto the scheduler's event channel.
 *
 * <p>Agent client callbacks and timers never touch run state directly; they post one of
 * these and the scheduling thread applies it.</p>
 */
final class NodeEvent {

    enum Type {
        /** Agent accepted the trigger. */
        ACKNOWLEDGED,
        /** Agent refused the trigger. */
        REJECTED,
        /** Trigger could not be delivered to this agent. */
        TRIGGER_FAILED,
        /** Agent reported a terminal result. */
        OUTCOME,
        /** Waiting for the result failed for this agent. */
        OUTCOME_FAILED,
        /** Per-node timer fired. */
        NODE_TIMEOUT,
        /** The agent client as a whole is unusable. */
        TRANSPORT_LOST,
        /** Run-wide timer fired. */
        RUN_TIMEOUT,
        /** Cancellation requested from outside the scheduling thread. */
        CANCELLED
    }

    private final Type type;
    private final String nodeIdentity;
    private final NodeOutcome outcome;
    private final String detail;
    private final Throwable cause;

    private NodeEvent(Type type, String nodeIdentity, NodeOutcome outcome, String detail, Throwable cause) {
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.nodeIdentity = nodeIdentity;
        this.outcome = outcome;
        this.detail = detail;
        this.cause = cause;
    }

    static NodeEvent acknowledged(String nodeIdentity) {
        return new NodeEvent(Type.ACKNOWLEDGED, nodeIdentity, null, null, null);
    }

    static NodeEvent rejected(String nodeIdentity, String reason) {
        return new NodeEvent(Type.REJECTED, nodeIdentity, null, reason, null);
    }

    static NodeEvent triggerFailed(String nodeIdentity, Throwable cause) {
        return new NodeEvent(Type.TRIGGER_FAILED, nodeIdentity, null, describe(cause), cause);
    }

    static NodeEvent outcome(String nodeIdentity, NodeOutcome outcome) {
        return new NodeEvent(Type.OUTCOME, nodeIdentity, Objects.requireNonNull(outcome, "Outcome cannot be null"),
                null, null);
    }

    static NodeEvent outcomeFailed(String nodeIdentity, Throwable cause) {
        return new NodeEvent(Type.OUTCOME_FAILED, nodeIdentity, null, describe(cause), cause);
    }

    static NodeEvent nodeTimeout(String nodeIdentity) {
        return new NodeEvent(Type.NODE_TIMEOUT, nodeIdentity, null, null, null);
    }

    static NodeEvent transportLost(String nodeIdentity, Throwable cause) {
        return new NodeEvent(Type.TRANSPORT_LOST, nodeIdentity, null, describe(cause), cause);
    }

    static NodeEvent runTimeout() {
        return new NodeEvent(Type.RUN_TIMEOUT, null, null, null, null);
    }

    static NodeEvent cancelled() {
        return new NodeEvent(Type.CANCELLED, null, null, null, null);
    }

    Type getType() {
        return type;
    }

    Optional<String> getNodeIdentity() {
        return Optional.ofNullable(nodeIdentity);
    }

    Optional<NodeOutcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return "NodeEvent{" + type + (nodeIdentity != null ? ", node=" + nodeIdentity : "") +
                (detail != null ? ", detail='" + detail + '\'' : "") + '}';
    }
}
