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
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered, duplicate-free collection of discovered nodes.
 *
 * <p>Iteration order is discovery order, which is also the FIFO admission order used by
 * the batch scheduler.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class NodeSet implements Iterable<Node> {

    private static final NodeSet EMPTY = new NodeSet(List.of());

    private final List<Node> nodes;

    private NodeSet(List<Node> nodes) {
        this.nodes = nodes;
    }

    public static NodeSet empty() {
        return EMPTY;
    }

    /**
     * Creates a node set of freshly queued nodes in the given order.
     *
     * @throws IllegalArgumentException if an identity occurs more than once
     */
    public static NodeSet of(String... identities) {
        return ofIdentities(List.of(identities));
    }

    /**
     * Creates a node set of freshly queued nodes in iteration order of the collection.
     *
     * @throws IllegalArgumentException if an identity occurs more than once
     */
    public static NodeSet ofIdentities(Collection<String> identities) {
        Objects.requireNonNull(identities, "Identities cannot be null");
        List<Node> queued = new ArrayList<>(identities.size());
        for (String identity : identities) {
            queued.add(Node.queued(identity));
        }
        return fromNodes(queued);
    }

    /**
     * Creates a node set from existing node snapshots.
     *
     * @throws IllegalArgumentException if an identity occurs more than once
     */
    public static NodeSet fromNodes(Collection<Node> nodes) {
        Objects.requireNonNull(nodes, "Nodes cannot be null");
        Set<String> seen = new LinkedHashSet<>();
        for (Node node : nodes) {
            Objects.requireNonNull(node, "Node set cannot contain null nodes");
            if (!seen.add(node.getIdentity())) {
                throw new IllegalArgumentException("Duplicate node identity: " + node.getIdentity());
            }
        }
        return nodes.isEmpty() ? EMPTY : new NodeSet(List.copyOf(nodes));
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<String> getIdentities() {
        return nodes.stream().map(Node::getIdentity).collect(Collectors.toList());
    }

    public boolean contains(String identity) {
        return nodes.stream().anyMatch(n -> n.getIdentity().equals(identity));
    }

    public Stream<Node> stream() {
        return nodes.stream();
    }

    @Override
    public Iterator<Node> iterator() {
        return nodes.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return nodes.equals(((NodeSet) o).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "NodeSet" + getIdentities();
    }
}
