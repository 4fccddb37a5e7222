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

import dev.mars.fleetrun.core.CommandDescriptor;
import dev.mars.fleetrun.core.NodeFilter;
import dev.mars.fleetrun.core.NodeSet;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one batch run needs: which nodes, how many at a time, and what to run.
 *
 * <p>The concurrency limit is nullable so that an absent limit can be reported as a
 * configuration error rather than failing at construction. Timeouts left unset fall back to
 * the scheduler's configuration.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class BatchRequest {

    private final NodeSet nodeSet;
    private final Integer concurrencyLimit;
    private final CommandDescriptor command;
    private final NodeFilter filter;
    private final Duration nodeTimeout;
    private final Duration runTimeout;

    private BatchRequest(Builder builder) {
        this.nodeSet = Objects.requireNonNull(builder.nodeSet, "Node set cannot be null");
        this.concurrencyLimit = builder.concurrencyLimit;
        this.command = builder.command;
        this.filter = builder.filter != null ? builder.filter : NodeFilter.matchAll();
        this.nodeTimeout = builder.nodeTimeout;
        this.runTimeout = builder.runTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public NodeSet getNodeSet() {
        return nodeSet;
    }

    public Optional<Integer> getConcurrencyLimit() {
        return Optional.ofNullable(concurrencyLimit);
    }

    public Optional<CommandDescriptor> getCommand() {
        return Optional.ofNullable(command);
    }

    public NodeFilter getFilter() {
        return filter;
    }

    public Optional<Duration> getNodeTimeout() {
        return Optional.ofNullable(nodeTimeout);
    }

    public Optional<Duration> getRunTimeout() {
        return Optional.ofNullable(runTimeout);
    }

    @Override
    public String toString() {
        return "BatchRequest{" +
                "nodes=" + nodeSet.size() +
                ", concurrencyLimit=" + concurrencyLimit +
                ", command=" + command +
                ", filter=" + filter +
                '}';
    }

    public static class Builder {
        private NodeSet nodeSet;
        private Integer concurrencyLimit;
        private CommandDescriptor command;
        private NodeFilter filter;
        private Duration nodeTimeout;
        private Duration runTimeout;

        public Builder nodeSet(NodeSet nodeSet) {
            this.nodeSet = nodeSet;
            return this;
        }

        public Builder concurrencyLimit(Integer concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        public Builder command(CommandDescriptor command) {
            this.command = command;
            return this;
        }

        public Builder filter(NodeFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder nodeTimeout(Duration nodeTimeout) {
            this.nodeTimeout = nodeTimeout;
            return this;
        }

        public Builder runTimeout(Duration runTimeout) {
            this.runTimeout = runTimeout;
            return this;
        }

        public BatchRequest build() {
            return new BatchRequest(this);
        }
    }
}
