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

/**
 * Checks that parsed options can be used together.
 *
 * <ul>
 *   <li>A forced run cannot also set {@code --splay} or {@code --splaylimit}.</li>
 *   <li>{@code runall} needs a concurrency limit greater than zero.</li>
 *   <li>Some action must be given unless help was requested.</li>
 * </ul>
 *
 * <p>Filter checks belong to the command that cares about them; see
 * {@link dev.mars.fleetrun.cli.commands.RunAllCommandHandler}.</p>
 */
public class OptionsValidator {

    public ValidationResult validate(CommandLineOptions options) {
        ValidationResult result = new ValidationResult();

        if (options.getAction().isEmpty()) {
            if (!options.isHelp()) {
                result.addError(ConfigurationError.Kind.MISSING_COMMAND);
            }
            return result;
        }

        if (options.isForce()) {
            if (options.isSplay()) {
                result.addError(ConfigurationError.Kind.SPLAY_WITH_FORCE);
            }
            if (options.getSplaylimit().isPresent()) {
                result.addError(ConfigurationError.Kind.SPLAYLIMIT_WITH_FORCE);
            }
        }

        if (options.getAction().get() == Action.RUNALL) {
            if (options.getConcurrency().isEmpty()) {
                result.addError(ConfigurationError.Kind.MISSING_CONCURRENCY);
            } else if (options.getConcurrency().get() <= 0) {
                result.addError(ConfigurationError.Kind.NON_POSITIVE_CONCURRENCY);
            }
        }

        return result;
    }
}
