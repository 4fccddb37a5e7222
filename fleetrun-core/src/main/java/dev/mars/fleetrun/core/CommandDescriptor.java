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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The command to trigger on every node of a batch.
 *
 * <p>The scheduler never interprets the arguments; they are forwarded unchanged to
 * {@link dev.mars.fleetrun.client.AgentClient#trigger}. Serialisable with Jackson so that
 * client implementations can put it on the wire as-is.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
@JsonDeserialize(builder = CommandDescriptor.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CommandDescriptor {

    /** Action name agents understand as "perform one run now". */
    public static final String RUN_ONCE = "runonce";

    private final String action;
    private final Map<String, Object> arguments;

    private CommandDescriptor(Builder builder) {
        this.action = Objects.requireNonNull(builder.action, "Action cannot be null");
        if (action.isBlank()) {
            throw new IllegalArgumentException("Action cannot be blank");
        }
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CommandDescriptor runOnce() {
        return builder().action(RUN_ONCE).build();
    }

    public String getAction() {
        return action;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public Optional<Object> getArgument(String name) {
        return Optional.ofNullable(arguments.get(name));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CommandDescriptor that = (CommandDescriptor) o;
        return action.equals(that.action) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, arguments);
    }

    @Override
    public String toString() {
        return action + arguments;
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String action;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder arguments(Map<String, Object> arguments) {
            this.arguments.clear();
            if (arguments != null) {
                this.arguments.putAll(arguments);
            }
            return this;
        }

        public Builder argument(String name, Object value) {
            this.arguments.put(Objects.requireNonNull(name, "Argument name cannot be null"), value);
            return this;
        }

        public CommandDescriptor build() {
            return new CommandDescriptor(this);
        }
    }
}
