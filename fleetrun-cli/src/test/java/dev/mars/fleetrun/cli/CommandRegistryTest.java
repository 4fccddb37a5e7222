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
import dev.mars.fleetrun.core.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandRegistryTest {

    @Test
    void dispatchesToRegisteredHandler() throws Exception {
        CommandRegistry registry = CommandRegistry.builder()
                .register(Action.RUNALL, options -> 42)
                .build();

        int code = registry.dispatch(CommandLineOptions.builder().action(Action.RUNALL).concurrency(1).build());

        assertThat(code).isEqualTo(42);
        assertThat(registry.getSupportedActions()).containsExactly(Action.RUNALL);
        assertThat(registry.lookup(Action.COUNT)).isEmpty();
    }

    @Test
    void unregisteredActionIsUnknownCommand() {
        CommandRegistry registry = CommandRegistry.builder()
                .register(Action.RUNALL, options -> ExitCodes.OK)
                .build();

        assertThatThrownBy(() -> registry.dispatch(CommandLineOptions.builder().action(Action.ENABLE).build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Do not know how to handle the 'enable' command")
                .satisfies(e -> assertThat(((ConfigurationException) e).getValidationResult()
                        .hasError(ConfigurationError.Kind.UNKNOWN_COMMAND)).isTrue());
    }

    @Test
    void missingActionIsMissingCommand() {
        CommandRegistry registry = CommandRegistry.builder().build();

        assertThatThrownBy(() -> registry.dispatch(CommandLineOptions.builder().build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Please specify a command.");
    }

    @Test
    void duplicateRegistrationRejected() {
        CommandRegistry.Builder builder = CommandRegistry.builder().register(Action.RUNALL, options -> 0);

        assertThatThrownBy(() -> builder.register(Action.RUNALL, options -> 1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("runall");
    }
}
