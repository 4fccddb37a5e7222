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

package dev.mars.fleetrun.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of checking user input or a batch request before anything is dispatched.
 */
public class ValidationResult {

    private final List<ConfigurationError> errors;

    public ValidationResult() {
        this.errors = new ArrayList<>();
    }

    public ValidationResult(List<ConfigurationError> errors) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
    }

    public static ValidationResult valid() {
        return new ValidationResult();
    }

    public static ValidationResult of(ConfigurationError error) {
        ValidationResult result = new ValidationResult();
        result.addError(error);
        return result;
    }

    public void addError(ConfigurationError error) {
        errors.add(error);
    }

    public void addError(ConfigurationError.Kind kind, Object... parameters) {
        errors.add(ConfigurationError.of(kind, parameters));
    }

    public List<ConfigurationError> getErrors() {
        return List.copyOf(errors);
    }

    public Optional<ConfigurationError> getFirstError() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
    }

    public boolean hasError(ConfigurationError.Kind kind) {
        return errors.stream().anyMatch(e -> e.getKind() == kind);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors);
        sb.append("}");
        return sb.toString();
    }
}
