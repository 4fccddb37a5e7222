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

import java.util.List;
import java.util.Objects;

/**
 * A caller mistake detected before any node is dispatched.
 *
 * <p>Carries a structured {@link Kind} and the parameters needed to render its message,
 * so callers can branch on the kind instead of parsing text.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class ConfigurationError {

    public enum Kind {
        MISSING_COMMAND("Please specify a command."),
        UNKNOWN_ACTION("Action must be one of: %s"),
        UNKNOWN_COMMAND("Do not know how to handle the '%s' command"),
        INVALID_OPTION("Invalid option '%s': %s"),
        SPLAY_WITH_FORCE("Cannot set splay when forcing runs"),
        SPLAYLIMIT_WITH_FORCE("Cannot set splaylimit when forcing runs"),
        MISSING_CONCURRENCY("The runall command needs a concurrency limit"),
        INVALID_CONCURRENCY("The concurrency for the runall command must be an integer, got '%s'"),
        NON_POSITIVE_CONCURRENCY("The concurrency for the runall command has to be greater than 0"),
        COMPOUND_FILTER("The runall command cannot be used with compound or -S filters on the CLI"),
        NODE_NOT_QUEUED("Node '%s' is %s; only queued nodes can be scheduled");

        private final String template;

        Kind(String template) {
            this.template = template;
        }

        public String getTemplate() {
            return template;
        }
    }

    private final Kind kind;
    private final List<Object> parameters;

    private ConfigurationError(Kind kind, List<Object> parameters) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.parameters = parameters;
    }

    public static ConfigurationError of(Kind kind, Object... parameters) {
        return new ConfigurationError(kind, List.of(parameters));
    }

    public Kind getKind() {
        return kind;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    public String getMessage() {
        return String.format(kind.getTemplate(), parameters.toArray());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConfigurationError that = (ConfigurationError) o;
        return kind == that.kind && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, parameters);
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
