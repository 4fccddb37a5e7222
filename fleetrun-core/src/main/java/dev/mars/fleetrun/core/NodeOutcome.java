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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal report delivered by an agent once the triggered command has finished.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 */
public final class NodeOutcome {

    private final boolean successful;
    private final Map<String, Object> payload;
    private final String message;

    private NodeOutcome(boolean successful, Map<String, Object> payload, String message) {
        this.successful = successful;
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
        this.message = message;
    }

    public static NodeOutcome succeeded() {
        return new NodeOutcome(true, null, null);
    }

    public static NodeOutcome succeeded(Map<String, Object> payload) {
        return new NodeOutcome(true, payload, null);
    }

    public static NodeOutcome failed(String message) {
        return new NodeOutcome(false, null, Objects.requireNonNull(message, "Failure message cannot be null"));
    }

    public static NodeOutcome failed(String message, Map<String, Object> payload) {
        return new NodeOutcome(false, payload, Objects.requireNonNull(message, "Failure message cannot be null"));
    }

    public boolean isSuccessful() {
        return successful;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return successful ? "Succeeded" + payload : "Failed(" + message + ")";
    }
}
