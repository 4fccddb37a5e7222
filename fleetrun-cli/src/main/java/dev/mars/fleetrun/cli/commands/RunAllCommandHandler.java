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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.fleetrun.batch.BatchRequest;
import dev.mars.fleetrun.batch.BatchScheduler;
import dev.mars.fleetrun.cli.CommandHandler;
import dev.mars.fleetrun.cli.CommandLineOptions;
import dev.mars.fleetrun.cli.ExitCodes;
import dev.mars.fleetrun.cli.StatisticsPrinter;
import dev.mars.fleetrun.client.AgentClient;
import dev.mars.fleetrun.client.ProgressSink;
import dev.mars.fleetrun.core.ConfigurationError;
import dev.mars.fleetrun.core.NodeFilter;
import dev.mars.fleetrun.core.NodeSet;
import dev.mars.fleetrun.core.RunStatistics;
import dev.mars.fleetrun.core.ValidationResult;
import dev.mars.fleetrun.core.exceptions.ConfigurationException;
import dev.mars.fleetrun.core.exceptions.FatalTransportException;
import dev.mars.fleetrun.core.exceptions.FleetRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Instant;
import java.util.Objects;

/**
 * Handler for {@code runall}: run the agents' run-once command on every matching node,
 * at most CONCURRENCY at a time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class RunAllCommandHandler implements CommandHandler {

    private static final Logger logger = LoggerFactory.getLogger(RunAllCommandHandler.class);

    private final AgentClient client;
    private final BatchScheduler scheduler;
    private final ProgressSink progressSink;
    private final PrintStream out;

    public RunAllCommandHandler(AgentClient client, BatchScheduler scheduler, ProgressSink progressSink,
                                PrintStream out) {
        this.client = Objects.requireNonNull(client, "Agent client cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.progressSink = Objects.requireNonNull(progressSink, "Progress sink cannot be null");
        this.out = Objects.requireNonNull(out, "Output stream cannot be null");
    }

    @Override
    public int execute(CommandLineOptions options) throws FleetRunException {
        NodeFilter filter = options.getFilter();
        if (filter.isCompound()) {
            throw new ConfigurationException(ValidationResult.of(
                    ConfigurationError.of(ConfigurationError.Kind.COMPOUND_FILTER)));
        }

        progress("Discovering nodes to manage");
        NodeSet nodes = client.discover(filter);
        logger.info("Discovered {} nodes for runall", nodes.size());
        progress(String.format("Found %d nodes", nodes.size()));

        BatchRequest request = BatchRequest.builder()
                .nodeSet(nodes)
                .concurrencyLimit(options.getConcurrency().orElse(null))
                .command(options.toRunCommand())
                .filter(filter)
                .build();

        StatisticsPrinter printer = new StatisticsPrinter(out, options.isJson());
        RunStatistics statistics;
        try {
            statistics = scheduler.run(request, progressSink);
        } catch (FatalTransportException e) {
            print(printer, e.getPartialStatistics());
            throw e;
        }

        print(printer, statistics);
        return exitCodeFor(statistics);
    }

    /**
     * Request cancellation of the run in progress, or of the coming run while discovery is
     * still under way.
     */
    public void cancel() {
        scheduler.cancel();
    }

    static int exitCodeFor(RunStatistics statistics) {
        if (statistics.isCancelled()) {
            return ExitCodes.CANCELLED;
        }
        return statistics.isSuccessful() ? ExitCodes.OK : ExitCodes.NODES_FAILED;
    }

    private void progress(String message) {
        try {
            progressSink.emit(Instant.now(), message);
        } catch (RuntimeException e) {
            logger.warn("Progress sink failed on '{}': {}", message, e.getMessage());
        }
    }

    private void print(StatisticsPrinter printer, RunStatistics statistics) {
        try {
            printer.print(statistics, client.stats());
        } catch (JsonProcessingException e) {
            logger.error("Could not render run statistics: {}", e.getMessage());
            logger.debug("Stack trace", e);
            throw new IllegalStateException("Could not render run statistics", e);
        }
    }
}
