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

import dev.mars.fleetrun.core.AgentStats;
import dev.mars.fleetrun.core.CommandDescriptor;
import dev.mars.fleetrun.core.NodeFilter;
import dev.mars.fleetrun.core.NodeOutcome;
import dev.mars.fleetrun.core.NodeSet;
import dev.mars.fleetrun.core.TriggerResponse;
import dev.mars.fleetrun.core.exceptions.AgentTransportException;
import io.vertx.core.Future;

/**
 * Handle on the remote agents a batch operates on.
 *
 * <p>Implementations own discovery, addressing and transport. The batch scheduler only
 * relies on the contracts below:</p>
 * <ul>
 *   <li>{@link #trigger} completes once the agent accepted or refused the command.</li>
 *   <li>{@link #awaitOutcome} completes once the agent reports a terminal result for the
 *       command last triggered on it.</li>
 *   <li>A future failed with {@link AgentTransportException} means the client as a whole is
 *       unusable. Any other failure concerns only the addressed node.</li>
 * </ul>
 *
 * <p>Futures may be completed on any thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public interface AgentClient {

    /**
     * Enumerate the agents matching a filter, in discovery order.
     *
     * @throws AgentTransportException if discovery could not reach the fleet
     */
    NodeSet discover(NodeFilter filter) throws AgentTransportException;

    /**
     * Ask one agent to start the command.
     */
    Future<TriggerResponse> trigger(String nodeIdentity, CommandDescriptor command);

    /**
     * Subscribe to the terminal result of the command running on one agent.
     */
    Future<NodeOutcome> awaitOutcome(String nodeIdentity);

    /**
     * Request statistics kept by the client. Informational only.
     */
    AgentStats stats();
}
