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

import dev.mars.fleetrun.core.NodeState;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Thrown when a node is asked to move to a state its current state cannot reach.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class InvalidTransitionException extends FleetRunException {

    private final String nodeIdentity;
    private final NodeState currentState;
    private final NodeState requestedState;

    public InvalidTransitionException(String nodeIdentity, NodeState currentState, NodeState requestedState) {
        super(String.format("Invalid transition for node '%s': %s -> %s. Valid targets: %s",
                nodeIdentity, currentState.name(), requestedState.name(),
                formatTargets(currentState.getValidTransitions())));
        this.nodeIdentity = nodeIdentity;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getNodeIdentity() {
        return nodeIdentity;
    }

    public NodeState getCurrentState() {
        return currentState;
    }

    public NodeState getRequestedState() {
        return requestedState;
    }

    public NodeState[] getValidTransitions() {
        return currentState.getValidTransitions();
    }

    private static String formatTargets(NodeState[] targets) {
        return Arrays.stream(targets)
                .map(NodeState::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
