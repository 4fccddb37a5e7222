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

import dev.mars.fleetrun.core.ConfigurationError;
import dev.mars.fleetrun.core.ValidationResult;
import dev.mars.fleetrun.core.exceptions.ConfigurationException;
import dev.mars.fleetrun.core.exceptions.FleetRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each {@link Action} to the handler that executes it. Built once at startup and
 * read-only afterwards.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class CommandRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<Action, CommandHandler> handlers;

    private CommandRegistry(Map<Action, CommandHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<CommandHandler> lookup(Action action) {
        return Optional.ofNullable(handlers.get(action));
    }

    public Set<Action> getSupportedActions() {
        return handlers.keySet();
    }

    /**
     * Run the handler registered for the options' action.
     *
     * @throws ConfigurationException if no action was given or no handler is registered for it
     */
    public int dispatch(CommandLineOptions options) throws FleetRunException {
        Action action = options.getAction()
                .orElseThrow(() -> new ConfigurationException(
                        ValidationResult.of(ConfigurationError.of(ConfigurationError.Kind.MISSING_COMMAND))));

        CommandHandler handler = handlers.get(action);
        if (handler == null) {
            throw new ConfigurationException(ValidationResult.of(
                    ConfigurationError.of(ConfigurationError.Kind.UNKNOWN_COMMAND, action.getCommandName())));
        }

        logger.debug("Dispatching {} to {}", action.getCommandName(), handler.getClass().getSimpleName());
        return handler.execute(options);
    }

    public static class Builder {
        private final Map<Action, CommandHandler> handlers = new EnumMap<>(Action.class);

        public Builder register(Action action, CommandHandler handler) {
            Objects.requireNonNull(action, "Action cannot be null");
            Objects.requireNonNull(handler, "Handler cannot be null");
            if (handlers.putIfAbsent(action, handler) != null) {
                throw new IllegalStateException("Handler already registered for " + action.getCommandName());
            }
            return this;
        }

        public CommandRegistry build() {
            return new CommandRegistry(handlers);
        }
    }
}
