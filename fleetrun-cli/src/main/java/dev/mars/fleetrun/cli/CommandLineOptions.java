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

import dev.mars.fleetrun.core.CommandDescriptor;
import dev.mars.fleetrun.core.NodeFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed command line. Values are as typed; {@link OptionsValidator} decides whether they
 * are usable together.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class CommandLineOptions {

    private final Action action;
    private final Integer concurrency;
    private final boolean force;
    private final String server;
    private final List<String> tags;
    private final boolean noop;
    private final boolean noNoop;
    private final String environment;
    private final boolean splay;
    private final boolean noSplay;
    private final Integer splaylimit;
    private final boolean json;
    private final boolean help;
    private final NodeFilter filter;

    private CommandLineOptions(Builder builder) {
        this.action = builder.action;
        this.concurrency = builder.concurrency;
        this.force = builder.force;
        this.server = builder.server;
        this.tags = List.copyOf(builder.tags);
        this.noop = builder.noop;
        this.noNoop = builder.noNoop;
        this.environment = builder.environment;
        this.splay = builder.splay;
        this.noSplay = builder.noSplay;
        this.splaylimit = builder.splaylimit;
        this.json = builder.json;
        this.help = builder.help;
        this.filter = builder.filter.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Action> getAction() {
        return Optional.ofNullable(action);
    }

    public Optional<Integer> getConcurrency() {
        return Optional.ofNullable(concurrency);
    }

    public boolean isForce() {
        return force;
    }

    public Optional<String> getServer() {
        return Optional.ofNullable(server);
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isNoop() {
        return noop;
    }

    public boolean isNoNoop() {
        return noNoop;
    }

    public Optional<String> getEnvironment() {
        return Optional.ofNullable(environment);
    }

    public boolean isSplay() {
        return splay;
    }

    public boolean isNoSplay() {
        return noSplay;
    }

    public Optional<Integer> getSplaylimit() {
        return Optional.ofNullable(splaylimit);
    }

    public boolean isJson() {
        return json;
    }

    public boolean isHelp() {
        return help;
    }

    public NodeFilter getFilter() {
        return filter;
    }

    /**
     * The run arguments forwarded to each agent. Only options given on the command line are
     * included; {@code --no-noop} and {@code --no-splay} win over their positive forms.
     */
    public CommandDescriptor toRunCommand() {
        CommandDescriptor.Builder command = CommandDescriptor.builder().action(CommandDescriptor.RUN_ONCE);
        if (force) {
            command.argument("force", true);
        }
        if (server != null) {
            command.argument("server", server);
        }
        if (noNoop) {
            command.argument("noop", false);
        } else if (noop) {
            command.argument("noop", true);
        }
        if (environment != null) {
            command.argument("environment", environment);
        }
        if (noSplay) {
            command.argument("splay", false);
        } else if (splay) {
            command.argument("splay", true);
        }
        if (splaylimit != null) {
            command.argument("splaylimit", splaylimit);
        }
        if (!tags.isEmpty()) {
            command.argument("tags", String.join(",", tags));
        }
        return command.build();
    }

    public static class Builder {
        private Action action;
        private Integer concurrency;
        private boolean force;
        private String server;
        private final List<String> tags = new ArrayList<>();
        private boolean noop;
        private boolean noNoop;
        private String environment;
        private boolean splay;
        private boolean noSplay;
        private Integer splaylimit;
        private boolean json;
        private boolean help;
        private final NodeFilter.Builder filter = NodeFilter.builder();

        public Builder action(Action action) {
            this.action = action;
            return this;
        }

        public Builder concurrency(Integer concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder server(String server) {
            this.server = server;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder noop(boolean noop) {
            this.noop = noop;
            return this;
        }

        public Builder noNoop(boolean noNoop) {
            this.noNoop = noNoop;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder splay(boolean splay) {
            this.splay = splay;
            return this;
        }

        public Builder noSplay(boolean noSplay) {
            this.noSplay = noSplay;
            return this;
        }

        public Builder splaylimit(Integer splaylimit) {
            this.splaylimit = splaylimit;
            return this;
        }

        public Builder json(boolean json) {
            this.json = json;
            return this;
        }

        public Builder help(boolean help) {
            this.help = help;
            return this;
        }

        public Builder withIdentity(String identity) {
            filter.identity(identity);
            return this;
        }

        public Builder withClass(String agentClass) {
            filter.agentClass(agentClass);
            return this;
        }

        public Builder withFact(String fact) {
            filter.fact(fact);
            return this;
        }

        public Builder select(String expression) {
            filter.compound(expression);
            return this;
        }

        public CommandLineOptions build() {
            return new CommandLineOptions(this);
        }
    }
}
