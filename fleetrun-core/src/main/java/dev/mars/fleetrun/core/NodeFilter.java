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
import java.util.Objects;

/**
 * Node selection criteria handed to the agent client for discovery.
 *
 * <p>Identity, class and fact predicates are evaluated once at discovery time. Compound
 * expressions ({@code -S}) may depend on agent state that changes while a batch runs, so
 * the batch path refuses any filter where {@link #isCompound()} is true.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class NodeFilter {

    private static final NodeFilter MATCH_ALL = builder().build();

    private final List<String> identities;
    private final List<String> classes;
    private final List<String> facts;
    private final List<String> compound;

    private NodeFilter(Builder builder) {
        this.identities = List.copyOf(builder.identities);
        this.classes = List.copyOf(builder.classes);
        this.facts = List.copyOf(builder.facts);
        this.compound = List.copyOf(builder.compound);
    }

    /**
     * A filter with no predicates, matching every discoverable agent.
     */
    public static NodeFilter matchAll() {
        return MATCH_ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getIdentities() {
        return identities;
    }

    public List<String> getClasses() {
        return classes;
    }

    public List<String> getFacts() {
        return facts;
    }

    public List<String> getCompound() {
        return compound;
    }

    public boolean isCompound() {
        return !compound.isEmpty();
    }

    public boolean isEmpty() {
        return identities.isEmpty() && classes.isEmpty() && facts.isEmpty() && compound.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeFilter that = (NodeFilter) o;
        return identities.equals(that.identities) && classes.equals(that.classes)
                && facts.equals(that.facts) && compound.equals(that.compound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identities, classes, facts, compound);
    }

    @Override
    public String toString() {
        return "NodeFilter{" +
                "identities=" + identities +
                ", classes=" + classes +
                ", facts=" + facts +
                ", compound=" + compound +
                '}';
    }

    public static class Builder {
        private final List<String> identities = new ArrayList<>();
        private final List<String> classes = new ArrayList<>();
        private final List<String> facts = new ArrayList<>();
        private final List<String> compound = new ArrayList<>();

        public Builder identity(String identity) {
            identities.add(Objects.requireNonNull(identity, "identity"));
            return this;
        }

        public Builder agentClass(String agentClass) {
            classes.add(Objects.requireNonNull(agentClass, "agentClass"));
            return this;
        }

        public Builder fact(String fact) {
            facts.add(Objects.requireNonNull(fact, "fact"));
            return this;
        }

        public Builder compound(String expression) {
            compound.add(Objects.requireNonNull(expression, "expression"));
            return this;
        }

        public NodeFilter build() {
            return new NodeFilter(this);
        }
    }
}
