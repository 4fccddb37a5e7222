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

import dev.mars.fleetrun.batch.BatchScheduler;
import dev.mars.fleetrun.cli.commands.RunAllCommandHandler;
import dev.mars.fleetrun.client.AgentClient;
import dev.mars.fleetrun.client.AgentClientProvider;
import dev.mars.fleetrun.config.FleetRunConfiguration;
import dev.mars.fleetrun.core.ConfigurationError;
import dev.mars.fleetrun.core.ValidationResult;
import dev.mars.fleetrun.core.exceptions.AgentTransportException;
import dev.mars.fleetrun.core.exceptions.ConfigurationException;
import dev.mars.fleetrun.core.exceptions.FatalTransportException;
import dev.mars.fleetrun.core.exceptions.FleetRunException;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.ZoneId;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point.
 *
 * <pre>
 * fleetrun [OPTIONS] [FILTERS] runall CONCURRENCY
 * </pre>
 *
 * <p>The agent client is obtained from the first {@link AgentClientProvider} registered with
 * {@link ServiceLoader}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class FleetRunCli {

    private static final Logger logger = LoggerFactory.getLogger(FleetRunCli.class);

    private final AgentClientProvider provider;
    private final FleetRunConfiguration configuration;
    private final PrintStream out;
    private final PrintStream err;
    private final CommandLineParser parser = new CommandLineParser();
    private final OptionsValidator validator = new OptionsValidator();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile RunAllCommandHandler runAllHandler;
    private volatile boolean executing;
    private volatile boolean shutdownRequested;

    /**
     * @param provider agent client provider, or null when none is installed; only help output
     *                 and argument errors work without one
     */
    public FleetRunCli(AgentClientProvider provider, FleetRunConfiguration configuration,
                       PrintStream out, PrintStream err) {
        this.provider = provider;
        this.configuration = configuration;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        Optional<AgentClientProvider> provider = ServiceLoader.load(AgentClientProvider.class).findFirst();
        FleetRunCli cli = new FleetRunCli(provider.orElse(null), new FleetRunConfiguration(), System.out, System.err);
        Runtime.getRuntime().addShutdownHook(new Thread(cli::shutdown, "fleetrun-shutdown"));
        System.exit(cli.execute(args));
    }

    /**
     * Parse, validate and run one command line.
     *
     * @return process exit status, see {@link ExitCodes}
     */
    public int execute(String[] args) {
        executing = true;
        try {
            return doExecute(args);
        } finally {
            finished.countDown();
        }
    }

    /**
     * Cancel a run in progress and wait for it to wind down. Called from the JVM shutdown hook.
     */
    public void shutdown() {
        shutdownRequested = true;
        RunAllCommandHandler handler = runAllHandler;
        if (handler != null) {
            logger.info("Shutdown requested, cancelling batch run");
            handler.cancel();
        }
        if (!executing) {
            return;
        }
        try {
            long waitMs = configuration.getAbandonTimeout().toMillis() + 5_000;
            if (!finished.await(waitMs, TimeUnit.MILLISECONDS)) {
                logger.warn("Batch run did not finish within {}ms of shutdown", waitMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private int doExecute(String[] args) {
        CommandLineParser.ParseResult parsed = parser.parse(args);
        if (!parsed.isValid()) {
            return reportErrors(parsed.getValidation());
        }

        CommandLineOptions options = parsed.getOptions();
        if (options.isHelp()) {
            printUsage(out);
            return ExitCodes.OK;
        }

        ValidationResult validation = validator.validate(options);
        if (!validation.isValid()) {
            return reportErrors(validation);
        }

        try {
            configuration.validate();
        } catch (IllegalStateException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return ExitCodes.ERROR;
        }
        configuration.logConfiguration();

        if (provider == null) {
            err.println("No agent client provider found on the classpath");
            return ExitCodes.ERROR;
        }

        Vertx vertx = Vertx.vertx();
        try {
            AgentClient client = provider.create(vertx, configuration);
            logger.debug("Using agent client provider {}", provider.name());
            return buildRegistry(vertx, client).dispatch(options);
        } catch (ConfigurationException e) {
            return reportErrors(e.getValidationResult());
        } catch (FatalTransportException e) {
            logger.error("Batch aborted: {}", e.getMessage(), e);
            err.println("Fatal: " + e.getMessage());
            return ExitCodes.ERROR;
        } catch (AgentTransportException e) {
            logger.error("Agent client unavailable: {}", e.getMessage(), e);
            err.println("Could not reach agents: " + e.getMessage());
            return ExitCodes.ERROR;
        } catch (FleetRunException e) {
            logger.error("Command failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return ExitCodes.ERROR;
        } finally {
            runAllHandler = null;
            vertx.close();
        }
    }

    private CommandRegistry buildRegistry(Vertx vertx, AgentClient client) {
        BatchScheduler scheduler = new BatchScheduler(vertx, client, configuration);
        TimestampedProgressSink progress =
                new TimestampedProgressSink(out, configuration.getTimestampPattern(), ZoneId.systemDefault());
        runAllHandler = new RunAllCommandHandler(client, scheduler, progress, out);
        if (shutdownRequested) {
            runAllHandler.cancel();
        }

        return CommandRegistry.builder()
                .register(Action.RUNALL, runAllHandler)
                .build();
    }

    private int reportErrors(ValidationResult validation) {
        for (ConfigurationError error : validation.getErrors()) {
            err.println(error.getMessage());
        }
        err.println("Try 'fleetrun --help' for usage.");
        return ExitCodes.ERROR;
    }

    static void printUsage(PrintStream out) {
        out.println("Usage: fleetrun [OPTIONS] [FILTERS] runall CONCURRENCY");
        out.println();
        out.println("Invoke a run on matching nodes, making sure to only run CONCURRENCY nodes at a time.");
        out.println();
        out.println("Options:");
        out.println("  --force                  Bypass splay options when running");
        out.println("  --server SERVER          Connect to a specific server or port");
        out.println("  --tag TAG                Restrict the run to specific tags (repeatable)");
        out.println("  --noop                   Do a noop run");
        out.println("  --no-noop                Do a run with noop disabled");
        out.println("  --environment ENV        Place the node in a specific environment for this run");
        out.println("  --splay                  Splay the run by up to splaylimit seconds");
        out.println("  --no-splay               Do a run with splay disabled");
        out.println("  --splaylimit SECONDS     Maximum splay time for this run if splay is set");
        out.println("  --json                   Print the final statistics as JSON");
        out.println("  -h, --help               Show this help");
        out.println();
        out.println("Filters:");
        out.println("  -I, --with-identity ID   Match nodes by identity");
        out.println("  -C, --with-class CLASS   Match nodes by class");
        out.println("  -F, --with-fact FACT     Match nodes by fact (name=value)");
        out.println("  -S, --select EXPR        Compound filter (not allowed with runall)");
        out.println();
        out.println("Exit status: 0 all nodes succeeded, 1 error, 2 some nodes failed or timed out, 130 cancelled");
    }
}
