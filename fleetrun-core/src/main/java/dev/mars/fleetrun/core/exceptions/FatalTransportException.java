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

package dev.mars.fleetrun.core.exceptions;

import dev.mars.fleetrun.core.RunStatistics;

/**
 * The agent client became unusable and the batch was aborted.
 *
 * <p>Statistics gathered up to the abort are attached. Nodes still in flight at that
 * point are counted as failed; nodes never admitted are counted as skipped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class FatalTransportException extends FleetRunException {

    private final RunStatistics partialStatistics;

    public FatalTransportException(String message, Throwable cause, RunStatistics partialStatistics) {
        super(message, cause);
        this.partialStatistics = partialStatistics;
    }

    public RunStatistics getPartialStatistics() {
        return partialStatistics;
    }
}
