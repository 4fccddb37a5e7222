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
import java.util.Objects;

/**
 * Request statistics kept by the agent client itself.
 * Informational only; batch decisions use {@link RunStatistics}.
 */
public final class AgentStats {

    private final long okCount;
    private final long failCount;
    private final Duration elapsed;

    public AgentStats(long okCount, long failCount, Duration elapsed) {
        this.okCount = Math.max(0, okCount);
        this.failCount = Math.max(0, failCount);
        this.elapsed = Objects.requireNonNull(elapsed, "Elapsed cannot be null");
    }

    public static AgentStats empty() {
        return new AgentStats(0, 0, Duration.ZERO);
    }

    public long getOkCount() {
        return okCount;
    }

    public long getFailCount() {
        return failCount;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "AgentStats{ok=" + okCount + ", failed=" + failCount + ", elapsed=" + elapsed + '}';
    }
}
