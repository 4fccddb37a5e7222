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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OptionsValidatorTest {

    private final OptionsValidator validator = new OptionsValidator();

    private static CommandLineOptions.Builder runall(Integer concurrency) {
        return CommandLineOptions.builder().action(Action.RUNALL).concurrency(concurrency);
    }

    @Test
    void validRunall() {
        assertThat(validator.validate(runall(4).build()).isValid()).isTrue();
    }

    @Test
    void missingCommand() {
        ValidationResult result = validator.validate(CommandLineOptions.builder().build());

        assertThat(result.hasError(ConfigurationError.Kind.MISSING_COMMAND)).isTrue();
        assertThat(result.getFirstError().get().getMessage()).isEqualTo("Please specify a command.");
    }

    @Test
    void helpNeedsNoCommand() {
        assertThat(validator.validate(CommandLineOptions.builder().help(true).build()).isValid()).isTrue();
    }

    @Test
    void missingConcurrency() {
        ValidationResult result = validator.validate(runall(null).build());

        assertThat(result.hasError(ConfigurationError.Kind.MISSING_CONCURRENCY)).isTrue();
    }

    @Test
    void zeroAndNegativeConcurrency() {
        assertThat(validator.validate(runall(0).build()).getFirstError().get().getMessage())
                .isEqualTo("The concurrency for the runall command has to be greater than 0");
        assertThat(validator.validate(runall(-3).build())
                .hasError(ConfigurationError.Kind.NON_POSITIVE_CONCURRENCY)).isTrue();
    }

    @Test
    void splayConflictsWithForce() {
        ValidationResult result = validator.validate(runall(2).force(true).splay(true).splaylimit(10).build());

        assertThat(result.getErrors()).extracting(ConfigurationError::getKind)
                .containsExactly(ConfigurationError.Kind.SPLAY_WITH_FORCE,
                        ConfigurationError.Kind.SPLAYLIMIT_WITH_FORCE);
    }

    @Test
    void noSplayIsAllowedWithForce() {
        assertThat(validator.validate(runall(2).force(true).noSplay(true).build()).isValid()).isTrue();
    }

    @Test
    void concurrencyIsOnlyCheckedForRunall() {
        assertThat(validator.validate(CommandLineOptions.builder().action(Action.STATUS).build()).isValid())
                .isTrue();
    }
}
