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

import java.util.Objects;
import java.util.Optional;

/**
 * An agent's answer to a trigger request.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 */
public final class TriggerResponse {

    private static final TriggerResponse ACCEPTED = new TriggerResponse(true, null);

    private final boolean accepted;
    private final String reason;

    private TriggerResponse(boolean accepted, String reason) {
        this.accepted = accepted;
        this.reason = reason;
    }

    public static TriggerResponse accepted() {
        return ACCEPTED;
    }

    public static TriggerResponse rejected(String reason) {
        return new TriggerResponse(false, Objects.requireNonNull(reason, "Rejection reason cannot be null"));
    }

    public boolean isAccepted() {
        return accepted;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return accepted ? "Accepted" : "Rejected(" + reason + ")";
    }
}
