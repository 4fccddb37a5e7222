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

package dev.mars.fleetrun.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a remote agent and its last known outcome within a batch.
 *
 * <p>Instances are immutable. The run state tracker that drives a node replaces its
 * snapshot on every transition using the {@code with*} methods; nothing else creates
 * modified copies.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class Node {

    private final String identity;
    private final NodeState state;
    private final Map<String, Object> result;
    private final String errorDetail;
    private final Instant admittedAt;
    private final Instant acknowledgedAt;
    private final Instant completedAt;

    private Node(Builder builder) {
        this.identity = Objects.requireNonNull(builder.identity, "Node identity cannot be null");
        if (identity.isBlank()) {
            throw new IllegalArgumentException("Node identity cannot be blank");
        }
        this.state = Objects.requireNonNull(builder.state, "State cannot be null");
        this.result = builder.result != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.result))
                : Map.of();
        this.errorDetail = builder.errorDetail;
        this.admittedAt = builder.admittedAt;
        this.acknowledgedAt = builder.acknowledgedAt;
        this.completedAt = builder.completedAt;
    }

    /**
     * Creates a freshly discovered node in the {@link NodeState#QUEUED} state.
     */
    public static Node queued(String identity) {
        return new Builder().identity(identity).build();
    }

    public String getIdentity() {
        return identity;
    }

    public NodeState getState() {
        return state;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public Optional<String> getErrorDetail() {
        return Optional.ofNullable(errorDetail);
    }

    public Optional<Instant> getAdmittedAt() {
        return Optional.ofNullable(admittedAt);
    }

    public Optional<Instant> getAcknowledgedAt() {
        return Optional.ofNullable(acknowledgedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    /**
     * Time from admission to the terminal transition, if both are known.
     */
    public Optional<Duration> getDuration() {
        if (admittedAt != null && completedAt != null) {
            return Optional.of(Duration.between(admittedAt, completedAt));
        }
        return Optional.empty();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Create a new snapshot in the given state, stamping the timestamp that belongs to it.
     */
    public Node withState(NodeState newState, Instant timestamp) {
        Builder builder = new Builder(this).state(newState);

        switch (newState) {
            case DISPATCHED:
                builder.admittedAt(timestamp);
                break;
            case RUNNING:
                builder.acknowledgedAt(timestamp);
                break;
            case SUCCEEDED:
            case FAILED:
            case TIMED_OUT:
                builder.completedAt(timestamp);
                break;
            case QUEUED:
                break;
        }

        return builder.build();
    }

    /**
     * Create a successful terminal snapshot carrying the agent's result payload.
     */
    public Node withSuccess(Map<String, Object> payload, Instant timestamp) {
        return new Builder(this)
                .state(NodeState.SUCCEEDED)
                .result(payload)
                .completedAt(timestamp)
                .build();
    }

    /**
     * Create a FAILED or TIMED_OUT snapshot with error detail.
     */
    public Node withFailure(NodeState terminalState, String detail, Instant timestamp) {
        if (terminalState != NodeState.FAILED && terminalState != NodeState.TIMED_OUT) {
            throw new IllegalArgumentException("Not a failure state: " + terminalState);
        }
        return new Builder(this)
                .state(terminalState)
                .errorDetail(detail)
                .completedAt(timestamp)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node that = (Node) o;
        return identity.equals(that.identity) && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, state);
    }

    @Override
    public String toString() {
        return "Node{" +
                "identity='" + identity + '\'' +
                ", state=" + state.name() +
                (errorDetail != null ? ", error='" + errorDetail + '\'' : "") +
                '}';
    }

    /**
     * Builder for creating Node instances.
     */
    public static class Builder {
        private String identity;
        private NodeState state;
        private Map<String, Object> result;
        private String errorDetail;
        private Instant admittedAt;
        private Instant acknowledgedAt;
        private Instant completedAt;

        public Builder() {
            this.state = NodeState.QUEUED;
        }

        public Builder(Node existing) {
            this.identity = existing.identity;
            this.state = existing.state;
            this.result = existing.result;
            this.errorDetail = existing.errorDetail;
            this.admittedAt = existing.admittedAt;
            this.acknowledgedAt = existing.acknowledgedAt;
            this.completedAt = existing.completedAt;
        }

        public Builder identity(String identity) {
            this.identity = identity;
            return this;
        }

        public Builder state(NodeState state) {
            this.state = state;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder errorDetail(String errorDetail) {
            this.errorDetail = errorDetail;
            return this;
        }

        public Builder admittedAt(Instant admittedAt) {
            this.admittedAt = admittedAt;
            return this;
        }

        public Builder acknowledgedAt(Instant acknowledgedAt) {
            this.acknowledgedAt = acknowledgedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
