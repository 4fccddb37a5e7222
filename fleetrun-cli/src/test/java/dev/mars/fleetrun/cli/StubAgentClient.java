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

import dev.mars.fleetrun.client.AgentClient;
import dev.mars.fleetrun.client.AgentClientProvider;
import dev.mars.fleetrun.config.FleetRunConfiguration;
import dev.mars.fleetrun.core.AgentStats;
import dev.mars.fleetrun.core.CommandDescriptor;
import dev.mars.fleetrun.core.NodeFilter;
import dev.mars.fleetrun.core.NodeOutcome;
import dev.mars.fleetrun.core.NodeSet;
import dev.mars.fleetrun.core.TriggerResponse;
import dev.mars.fleetrun.core.exceptions.AgentTransportException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Agent client for CLI tests. Every future completes immediately.
 */
public class StubAgentClient implements AgentClient {

    private final List<String> identities;
    private final Set<String> failing = new HashSet<>();
    private final Set<String> losingTransport = new HashSet<>();
    private final List<NodeFilter> discoveryFilters = new CopyOnWriteArrayList<>();
    private final Map<String, CommandDescriptor> commands = new ConcurrentHashMap<>();
    private final AtomicLong ok = new AtomicLong();
    private final AtomicLong fail = new AtomicLong();
    private final CountDownLatch discoveryStarted = new CountDownLatch(1);
    private volatile CountDownLatch discoveryGate;
    private boolean discoveryFails;

    public StubAgentClient(String... identities) {
        this.identities = List.of(identities);
    }

    public StubAgentClient failing(String identity) {
        failing.add(identity);
        return this;
    }

    public StubAgentClient losingTransport(String identity) {
        losingTransport.add(identity);
        return this;
    }

    public StubAgentClient discoveryFails() {
        this.discoveryFails = true;
        return this;
    }

    /**
     * Make {@link #discover} wait until {@link #releaseDiscovery()} is called.
     */
    public StubAgentClient holdingDiscovery() {
        this.discoveryGate = new CountDownLatch(1);
        return this;
    }

    public void releaseDiscovery() {
        discoveryGate.countDown();
    }

    public boolean awaitDiscoveryStarted() throws InterruptedException {
        return discoveryStarted.await(5, TimeUnit.SECONDS);
    }

    public List<String> getTriggered() {
        return List.copyOf(commands.keySet());
    }

    public List<NodeFilter> getDiscoveryFilters() {
        return discoveryFilters;
    }

    public CommandDescriptor getReceivedCommand(String identity) {
        return commands.get(identity);
    }

    @Override
    public NodeSet discover(NodeFilter filter) throws AgentTransportException {
        discoveryFilters.add(filter);
        discoveryStarted.countDown();
        CountDownLatch gate = discoveryGate;
        if (gate != null) {
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    throw new AgentTransportException("discovery was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AgentTransportException("interrupted during discovery", e);
            }
        }
        if (discoveryFails) {
            throw new AgentTransportException("broker unreachable");
        }
        return NodeSet.ofIdentities(identities);
    }

    @Override
    public Future<TriggerResponse> trigger(String nodeIdentity, CommandDescriptor command) {
        commands.put(nodeIdentity, command);
        return Future.succeededFuture(TriggerResponse.accepted());
    }

    @Override
    public Future<NodeOutcome> awaitOutcome(String nodeIdentity) {
        if (losingTransport.contains(nodeIdentity)) {
            fail.incrementAndGet();
            return Future.failedFuture(new AgentTransportException("connection reset"));
        }
        if (failing.contains(nodeIdentity)) {
            fail.incrementAndGet();
            return Future.succeededFuture(NodeOutcome.failed("catalog compile error"));
        }
        ok.incrementAndGet();
        return Future.succeededFuture(NodeOutcome.succeeded());
    }

    @Override
    public AgentStats stats() {
        return new AgentStats(ok.get(), fail.get(), Duration.ZERO);
    }

    /**
     * Provider handing out a fixed client.
     */
    public static AgentClientProvider providerFor(StubAgentClient client) {
        return new AgentClientProvider() {
            @Override
            public String name() {
                return "stub";
            }

            @Override
            public AgentClient create(Vertx vertx, FleetRunConfiguration configuration) {
                return client;
            }
        };
    }
}
