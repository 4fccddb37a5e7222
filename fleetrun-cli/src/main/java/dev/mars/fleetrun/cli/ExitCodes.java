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

package dev.mars.fleetrun.cli;

/**
 * Process exit statuses.
 */
public final class ExitCodes {

    /** Every node succeeded, or there was nothing to do. */
    public static final int OK = 0;

    /** Configuration error, fatal transport error or unexpected failure. */
    public static final int ERROR = 1;

    /** The run completed but some nodes failed or timed out. */
    public static final int NODES_FAILED = 2;

    /** The run was cancelled before it completed. */
    public static final int CANCELLED = 130;

    private ExitCodes() {
    }
}
