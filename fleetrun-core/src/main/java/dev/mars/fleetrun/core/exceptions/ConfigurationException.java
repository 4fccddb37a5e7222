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

package dev.mars.fleetrun.core.exceptions;

import dev.mars.fleetrun.core.ConfigurationError;
import dev.mars.fleetrun.core.ValidationResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a batch is refused before any node is dispatched.
 *
 * <p>The exception only wraps a {@link ValidationResult} that callers could have obtained
 * up front; it never carries errors of its own.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public class ConfigurationException extends FleetRunException {

    private final ValidationResult validationResult;

    public ConfigurationException(ValidationResult validationResult) {
        super(describe(validationResult));
        if (validationResult.isValid()) {
            throw new IllegalArgumentException("ConfigurationException requires at least one error");
        }
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    public List<ConfigurationError> getErrors() {
        return validationResult.getErrors();
    }

    private static String describe(ValidationResult result) {
        return result.getErrors().stream()
                .map(ConfigurationError::getMessage)
                .collect(Collectors.joining("; "));
    }
}
