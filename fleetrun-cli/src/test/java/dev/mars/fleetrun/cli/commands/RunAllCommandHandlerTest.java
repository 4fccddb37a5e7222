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

package dev.mars.fleetrun.cli.commands;

import dev.mars.fleetrun.batch.BatchScheduler;
import dev.mars.fleetrun.cli.Action;
import dev.mars.fleetrun.cli.CommandLineOptions;
import dev.mars.fleetrun.cli.ExitCodes;
import dev.mars.fleetrun.cli.StubAgentClient;
import dev.mars.fleetrun.config.FleetRunConfiguration;
import dev.mars.fleetrun.core.CommandDescriptor;
import dev.mars.fleetrun.core.RunStatistics;
import dev.mars.fleetrun.core.exceptions.AgentTransportException;
import dev.mars.fleetrun.core.exceptions.ConfigurationException;
import dev.mars.fleetrun.core.exceptions.FatalTransportException;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunAllCommandHandlerTest {

    private Vertx vertx;
    private FleetRunConfiguration configuration;
    private final List<String> progress = new CopyOnWriteArrayList<>();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        Properties overrides = new Properties();
        overrides.setProperty(FleetRunConfiguration.METRICS_ENABLED, "false");
        configuration = new FleetRunConfiguration(overrides);
    }

    @AfterEach
    void tearDown() {
        vertx.close();
    }

    private RunAllCommandHandler handlerFor(StubAgentClient client) {
        BatchScheduler scheduler = new BatchScheduler(vertx, client, configuration);
        return new RunAllCommandHandler(client, scheduler, (Instant at, String message) -> progress.add(message),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private static CommandLineOptions.Builder runall(int concurrency) {
        return CommandLineOptions.builder().action(Action.RUNALL).concurrency(concurrency);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void allNodesSucceed() throws Exception {
        StubAgentClient client = new StubAgentClient("web1", "web2", "web3");

        int code = handlerFor(client).execute(runall(2).noop(true).withClass("role::web").build());

        assertThat(code).isEqualTo(ExitCodes.OK);
        assertThat(progress).startsWith("Discovering nodes to manage", "Found 3 nodes");
        assertThat(progress).contains("web1 succeeded", "web2 succeeded", "web3 succeeded");
        assertThat(client.getDiscoveryFilters()).hasSize(1);
        assertThat(client.getDiscoveryFilters().get(0).getClasses()).containsExactly("role::web");
        assertThat(client.getReceivedCommand("web2").getAction()).isEqualTo(CommandDescriptor.RUN_ONCE);
        assertThat(client.getReceivedCommand("web2").getArgument("noop")).contains(true);
        assertThat(output()).contains("Finished processing 3 / 3 nodes").contains("Agent client: 3 ok, 0 failed");
    }

    @Test
    void failedNodeGivesNodesFailedExitCode() throws Exception {
        StubAgentClient client = new StubAgentClient("web1", "db1").failing("db1");

        int code = handlerFor(client).execute(runall(1).build());

        assertThat(code).isEqualTo(ExitCodes.NODES_FAILED);
        assertThat(output()).contains("      Failed: 1 (db1)");
    }

    @Test
    void emptyDiscoveryIsNotAnError() throws Exception {
        int code = handlerFor(new StubAgentClient()).execute(runall(3).build());

        assertThat(code).isEqualTo(ExitCodes.OK);
        assertThat(progress).contains("Found 0 nodes");
        assertThat(output()).contains("Finished processing 0 / 0 nodes");
    }

    @Test
    void compoundFilterRejectedBeforeDiscovery() {
        StubAgentClient client = new StubAgentClient("web1");

        assertThatThrownBy(() -> handlerFor(client).execute(runall(2).select("uptime > 10").build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("The runall command cannot be used with compound or -S filters on the CLI");
        assertThat(client.getDiscoveryFilters()).isEmpty();
    }

    @Test
    void discoveryFailurePropagates() {
        StubAgentClient client = new StubAgentClient("web1").discoveryFails();

        assertThatThrownBy(() -> handlerFor(client).execute(runall(2).build()))
                .isInstanceOf(AgentTransportException.class)
                .hasMessage("broker unreachable");
    }

    @Test
    void transportLossPrintsPartialStatisticsAndRethrows() {
        StubAgentClient client = new StubAgentClient("web1", "web2").losingTransport("web1");

        assertThatThrownBy(() -> handlerFor(client).execute(runall(1).build()))
                .isInstanceOf(FatalTransportException.class);
        assertThat(output()).contains("Finished processing").contains("Failed: 1 (web1)");
    }

    @Test
    void cancelDuringDiscoveryAdmitsNoNodes() throws Exception {
        StubAgentClient client = new StubAgentClient("web1", "web2", "web3").holdingDiscovery();
        RunAllCommandHandler handler = handlerFor(client);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> code = executor.submit(() -> handler.execute(runall(1).build()));
            assertThat(client.awaitDiscoveryStarted()).isTrue();

            handler.cancel();
            client.releaseDiscovery();

            assertThat(code.get(5, TimeUnit.SECONDS)).isEqualTo(ExitCodes.CANCELLED);
            assertThat(client.getTriggered()).isEmpty();
            assertThat(output()).contains("     Skipped: 3").contains("Run was cancelled");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void failingProgressSinkDoesNotStopTheRun() throws Exception {
        StubAgentClient client = new StubAgentClient("web1", "web2");
        BatchScheduler scheduler = new BatchScheduler(vertx, client, configuration);
        RunAllCommandHandler handler = new RunAllCommandHandler(client, scheduler,
                (Instant at, String message) -> {
                    throw new IllegalStateException("terminal closed");
                },
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        int code = handler.execute(runall(2).build());

        assertThat(code).isEqualTo(ExitCodes.OK);
        assertThat(client.getTriggered()).containsExactlyInAnyOrder("web1", "web2");
        assertThat(output()).contains("Finished processing 2 / 2 nodes");
    }

    @Test
    void exitCodeMapping() {
        Instant now = Instant.now();
        RunStatistics ok = RunStatistics.builder().total(1).succeeded(1).startTime(now).endTime(now).build();
        RunStatistics failed = RunStatistics.builder().total(1).timedOut(1).startTime(now).endTime(now).build();
        RunStatistics cancelled = RunStatistics.builder().total(2).succeeded(1).skipped(1).cancelled(true)
                .startTime(now).endTime(now).build();

        assertThat(RunAllCommandHandler.exitCodeFor(ok)).isEqualTo(ExitCodes.OK);
        assertThat(RunAllCommandHandler.exitCodeFor(failed)).isEqualTo(ExitCodes.NODES_FAILED);
        assertThat(RunAllCommandHandler.exitCodeFor(cancelled)).isEqualTo(ExitCodes.CANCELLED);
    }
}
