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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate result of one batch run.
 *
 * <p>Read-only once produced. For a run that completed normally
 * {@code succeeded + failed + timedOut == total}. A cancelled run additionally counts the
 * nodes it never admitted as {@code skipped}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"total", "dispatched", "succeeded", "failed", "timedOut", "skipped",
        "cancelled", "successful", "startTime", "endTime", "elapsed", "failedNodes", "timedOutNodes"})
public final class RunStatistics {

    private final int total;
    private final int dispatched;
    private final int succeeded;
    private final int failed;
    private final int timedOut;
    private final int skipped;
    private final boolean cancelled;
    private final Instant startTime;
    private final Instant endTime;
    private final List<String> failedNodes;
    private final List<String> timedOutNodes;

    private RunStatistics(Builder builder) {
        this.total = builder.total;
        this.dispatched = builder.dispatched;
        this.succeeded = builder.succeeded;
        this.failed = builder.failed;
        this.timedOut = builder.timedOut;
        this.skipped = builder.skipped;
        this.cancelled = builder.cancelled;
        this.startTime = Objects.requireNonNull(builder.startTime, "Start time cannot be null");
        this.endTime = Objects.requireNonNull(builder.endTime, "End time cannot be null");
        this.failedNodes = List.copyOf(builder.failedNodes);
        this.timedOutNodes = List.copyOf(builder.timedOutNodes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Statistics of a run over an empty node set: all counts zero.
     */
    public static RunStatistics empty(Instant at) {
        return builder().startTime(at).endTime(at).build();
    }

    public int getTotal() {
        return total;
    }

    public int getDispatched() {
        return dispatched;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return failed;
    }

    public int getTimedOut() {
        return timedOut;
    }

    public int getSkipped() {
        return skipped;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getElapsed() {
        return Duration.between(startTime, endTime);
    }

    public List<String> getFailedNodes() {
        return failedNodes;
    }

    public List<String> getTimedOutNodes() {
        return timedOutNodes;
    }

    /**
     * Number of nodes that reached a terminal state.
     */
    public int getCompleted() {
        return succeeded + failed + timedOut;
    }

    /**
     * True when the run was not cancelled and every node succeeded.
     */
    public boolean isSuccessful() {
        return !cancelled && failed == 0 && timedOut == 0 && skipped == 0;
    }

    @Override
    public String toString() {
        return "RunStatistics{" +
                "total=" + total +
                ", dispatched=" + dispatched +
                ", succeeded=" + succeeded +
                ", failed=" + failed +
                ", timedOut=" + timedOut +
                ", skipped=" + skipped +
                ", cancelled=" + cancelled +
                ", elapsed=" + getElapsed() +
                '}';
    }

    public static class Builder {
        private int total;
        private int dispatched;
        private int succeeded;
        private int failed;
        private int timedOut;
        private int skipped;
        private boolean cancelled;
        private Instant startTime;
        private Instant endTime;
        private List<String> failedNodes = List.of();
        private List<String> timedOutNodes = List.of();

        public Builder total(int total) {
            this.total = total;
            return this;
        }

        public Builder dispatched(int dispatched) {
            this.dispatched = dispatched;
            return this;
        }

        public Builder succeeded(int succeeded) {
            this.succeeded = succeeded;
            return this;
        }

        public Builder failed(int failed) {
            this.failed = failed;
            return this;
        }

        public Builder timedOut(int timedOut) {
            this.timedOut = timedOut;
            return this;
        }

        public Builder skipped(int skipped) {
            this.skipped = skipped;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder failedNodes(List<String> failedNodes) {
            this.failedNodes = failedNodes;
            return this;
        }

        public Builder timedOutNodes(List<String> timedOutNodes) {
            this.timedOutNodes = timedOutNodes;
            return this;
        }

        public RunStatistics build() {
            return new RunStatistics(this);
        }
    }
}
