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

/**
 * Lifecycle of a single node within a batch run.
 *
 * The typical flow is:
 * QUEUED -> DISPATCHED -> RUNNING -> SUCCEEDED
 *
 * Alternative flows:
 * DISPATCHED -> FAILED (trigger rejected or agent unreachable)
 * RUNNING -> FAILED (agent reported an error)
 * RUNNING -> TIMED_OUT (no terminal report within the node timeout)
 *
 * <p>Terminal states never transition. TIMED_OUT is reported separately from FAILED
 * but frees its concurrency slot in exactly the same way.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public enum NodeState {

    /**
     * Node has been discovered but not yet sent to the agent client.
     * This is the initial state of every node in a node set.
     */
    QUEUED("Waiting for a free slot", false, false),

    /**
     * Trigger request has been sent; waiting for the agent to acknowledge it.
     */
    DISPATCHED("Trigger sent, awaiting acknowledgement", false, false),

    /**
     * Agent acknowledged the trigger and is executing the command.
     */
    RUNNING("Command running on agent", false, false),

    /**
     * Agent reported successful completion.
     * This is a terminal state.
     */
    SUCCEEDED("Command completed successfully", true, true),

    /**
     * Agent reported an error, or the trigger itself failed.
     * This is a terminal state.
     */
    FAILED("Command failed", true, false),

    /**
     * No terminal report arrived within the timeout budget.
     * This is a terminal state.
     */
    TIMED_OUT("No result within timeout", true, false);

    private final String description;
    private final boolean terminal;
    private final boolean successful;

    NodeState(String description, boolean terminal, boolean successful) {
        this.description = description;
        this.terminal = terminal;
        this.successful = successful;
    }

    /**
     * Get a human-readable description of this state.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Check if this state is terminal.
     * Terminal states cannot transition to other states.
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Check if this state represents a successful completion.
     */
    public boolean isSuccessful() {
        return successful;
    }

    /**
     * Check if a node in this state occupies a concurrency slot.
     */
    public boolean isInFlight() {
        return this == DISPATCHED || this == RUNNING;
    }

    /**
     * Check if transition from this state to the target state is valid.
     *
     * @param target the target state to transition to
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(NodeState target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case QUEUED:
                return target == DISPATCHED;

            case DISPATCHED:
                return target == RUNNING || target == FAILED;

            case RUNNING:
                return target == SUCCEEDED || target == FAILED || target == TIMED_OUT;

            default:
                return false;
        }
    }

    /**
     * Get all valid transition targets from this state.
     *
     * @return array of valid target states
     */
    public NodeState[] getValidTransitions() {
        switch (this) {
            case QUEUED:
                return new NodeState[]{DISPATCHED};
            case DISPATCHED:
                return new NodeState[]{RUNNING, FAILED};
            case RUNNING:
                return new NodeState[]{SUCCEEDED, FAILED, TIMED_OUT};
            default:
                return new NodeState[0];
        }
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
