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

package dev.mars.fleetrun.client;

import java.time.Instant;

/**
 * Receives human readable progress lines during a batch run.
 *
 * <p>Used for observation only. Implementations should not throw; the scheduler logs and
 * ignores anything they do throw.</p>
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = (timestamp, message) -> { };

    void emit(Instant timestamp, String message);
}
