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

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Actions accepted on the command line.
 *
 * <p>The set is closed: the parser only accepts these names, and the {@link CommandRegistry}
 * decides which of them this build can actually execute.</p>
 */
public enum Action {

    COUNT("count"),
    ENABLE("enable"),
    DISABLE("disable"),
    RUNALL("runall"),
    RUNONCE("runonce"),
    STATUS("status"),
    SUMMARY("summary");

    private final String commandName;

    Action(String commandName) {
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    /**
     * True for actions whose second positional argument is a concurrency limit.
     */
    public boolean takesConcurrency() {
        return this == RUNALL;
    }

    public static Optional<Action> fromCommandName(String name) {
        return Arrays.stream(values())
                .filter(a -> a.commandName.equals(name))
                .findFirst();
    }

    /**
     * Command names as shown in error messages, e.g. "count, enable, runall".
     */
    public static String commandNames() {
        return Arrays.stream(values())
                .map(Action::getCommandName)
                .collect(Collectors.joining(", "));
    }
}
