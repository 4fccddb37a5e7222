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

import dev.mars.fleetrun.core.Node;
import dev.mars.fleetrun.core.RunStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Folds terminal node outcomes into run counts.
 *
 * <p>Each node is counted at most once; a second terminal report for the same identity is
 * logged and ignored. Not thread-safe: owned by the scheduling thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class StatsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(StatsAggregator.class);

    private final int total;
    private final Instant startTime;
    private final Set<String> dispatched = new HashSet<>();
    private final Set<String> recorded = new HashSet<>();
    private final List<String> failedNodes = new ArrayList<>();
    private final List<String> timedOutNodes = new ArrayList<>();

    private int succeeded;
    private int failed;
    private int timedOut;

    private Instant endTime;
    private int skipped;
    private boolean cancelled;

    public StatsAggregator(int total, Instant startTime) {
        if (total < 0) {
            throw new IllegalArgumentException("Total cannot be negative: " + total);
        }
        this.total = total;
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
    }

    public void recordDispatched(String nodeIdentity) {
        dispatched.add(nodeIdentity);
    }

    /**
     * Count a terminal node.
     *
     * @return false if this node had already been recorded
     * @throws IllegalArgumentException if the node is not in a terminal state
     */
    public boolean record(Node node) {
        if (!node.isTerminal()) {
            throw new IllegalArgumentException("Cannot record non-terminal node: " + node);
        }
        if (!recorded.add(node.getIdentity())) {
            logger.warn("Duplicate terminal outcome for node {} ignored", node.getIdentity());
            return false;
        }

        switch (node.getState()) {
            case SUCCEEDED:
                succeeded++;
                break;
            case FAILED:
                failed++;
                failedNodes.add(node.getIdentity());
                break;
            case TIMED_OUT:
                timedOut++;
                timedOutNodes.add(node.getIdentity());
                break;
            default:
                break;
        }
        return true;
    }

    /**
     * Close the run. {@code skipped} is the number of nodes that were never admitted.
     */
    public void markComplete(Instant endTime, int skipped, boolean cancelled) {
        if (this.endTime != null) {
            throw new IllegalStateException("Run already marked complete");
        }
        this.endTime = Objects.requireNonNull(endTime, "End time cannot be null");
        this.skipped = skipped;
        this.cancelled = cancelled;
    }

    /**
     * Counts so far, for progress reporting and aborted runs.
     */
    public RunStatistics snapshot(Instant now) {
        return build(now);
    }

    /**
     * Final statistics of the run.
     *
     * @throws IllegalStateException if the run has not been marked complete
     */
    public RunStatistics finalizeStatistics() {
        if (endTime == null) {
            throw new IllegalStateException("Statistics cannot be finalized before the run completes");
        }
        return build(endTime);
    }

    private RunStatistics build(Instant end) {
        return RunStatistics.builder()
                .total(total)
                .dispatched(dispatched.size())
                .succeeded(succeeded)
                .failed(failed)
                .timedOut(timedOut)
                .skipped(skipped)
                .cancelled(cancelled)
                .startTime(startTime)
                .endTime(end)
                .failedNodes(failedNodes)
                .timedOutNodes(timedOutNodes)
                .build();
    }
}
