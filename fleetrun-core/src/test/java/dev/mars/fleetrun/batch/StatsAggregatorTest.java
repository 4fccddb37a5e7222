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
import dev.mars.fleetrun.core.NodeState;
import dev.mars.fleetrun.core.RunStatistics;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatsAggregatorTest {

    private static final Instant START = Instant.parse("2026-10-17T10:00:00Z");

    private static Node terminal(String identity, NodeState state) {
        Node dispatched = Node.queued(identity).withState(NodeState.DISPATCHED, START);
        if (state == NodeState.SUCCEEDED) {
            return dispatched.withState(NodeState.RUNNING, START).withSuccess(null, START.plusSeconds(1));
        }
        return dispatched.withFailure(state, "boom", START.plusSeconds(1));
    }

    @Test
    void countsEachOutcomeKind() {
        StatsAggregator aggregator = new StatsAggregator(4, START);
        for (String id : new String[]{"a", "b", "c", "d"}) {
            aggregator.recordDispatched(id);
        }

        aggregator.record(terminal("a", NodeState.SUCCEEDED));
        aggregator.record(terminal("b", NodeState.SUCCEEDED));
        aggregator.record(terminal("c", NodeState.FAILED));
        aggregator.record(terminal("d", NodeState.TIMED_OUT));
        aggregator.markComplete(START.plusSeconds(10), 0, false);

        RunStatistics stats = aggregator.finalizeStatistics();
        assertThat(stats.getTotal()).isEqualTo(4);
        assertThat(stats.getDispatched()).isEqualTo(4);
        assertThat(stats.getSucceeded()).isEqualTo(2);
        assertThat(stats.getFailed()).isEqualTo(1);
        assertThat(stats.getTimedOut()).isEqualTo(1);
        assertThat(stats.getFailedNodes()).containsExactly("c");
        assertThat(stats.getTimedOutNodes()).containsExactly("d");
        assertThat(stats.getElapsed().getSeconds()).isEqualTo(10);
        assertThat(stats.isSuccessful()).isFalse();
    }

    @Test
    void recordsEachNodeOnlyOnce() {
        StatsAggregator aggregator = new StatsAggregator(1, START);

        assertThat(aggregator.record(terminal("a", NodeState.FAILED))).isTrue();
        assertThat(aggregator.record(terminal("a", NodeState.FAILED))).isFalse();
        assertThat(aggregator.record(terminal("a", NodeState.SUCCEEDED))).isFalse();

        aggregator.markComplete(START, 0, false);
        RunStatistics stats = aggregator.finalizeStatistics();
        assertThat(stats.getFailed()).isEqualTo(1);
        assertThat(stats.getSucceeded()).isZero();
        assertThat(stats.getCompleted()).isEqualTo(1);
    }

    @Test
    void refusesNonTerminalNodes() {
        StatsAggregator aggregator = new StatsAggregator(1, START);

        assertThatThrownBy(() -> aggregator.record(Node.queued("a").withState(NodeState.DISPATCHED, START)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cannotFinalizeBeforeCompletion() {
        StatsAggregator aggregator = new StatsAggregator(2, START);
        aggregator.record(terminal("a", NodeState.SUCCEEDED));

        assertThatThrownBy(aggregator::finalizeStatistics)
                .isInstanceOf(IllegalStateException.class);
        assertThat(aggregator.snapshot(START.plusSeconds(1)).getSucceeded()).isEqualTo(1);
    }

    @Test
    void cancelledRunCountsSkippedNodes() {
        StatsAggregator aggregator = new StatsAggregator(5, START);
        aggregator.recordDispatched("a");
        aggregator.record(terminal("a", NodeState.SUCCEEDED));
        aggregator.markComplete(START.plusSeconds(1), 4, true);

        RunStatistics stats = aggregator.finalizeStatistics();
        assertThat(stats.isCancelled()).isTrue();
        assertThat(stats.getSkipped()).isEqualTo(4);
        assertThat(stats.getSucceeded() + stats.getSkipped()).isEqualTo(stats.getTotal());
        assertThat(stats.isSuccessful()).isFalse();
    }

    @Test
    void cannotCompleteTwice() {
        StatsAggregator aggregator = new StatsAggregator(0, START);
        aggregator.markComplete(START, 0, false);

        assertThatThrownBy(() -> aggregator.markComplete(START, 0, false))
                .isInstanceOf(IllegalStateException.class);
    }
}
