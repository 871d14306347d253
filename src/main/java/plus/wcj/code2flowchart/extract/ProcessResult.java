/*
 *  Copyright 2025-present The original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       https://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package plus.wcj.code2flowchart.extract;

import org.jetbrains.annotations.Nullable;
import plus.wcj.code2flowchart.ir.Edge;
import plus.wcj.code2flowchart.ir.Node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A region of the flowchart built from one syntax subtree.
 * <ul>
 *     <li>{@code entryNodeId} absent means the region is a no-op and has no exit points.</li>
 *     <li>{@code exitPoints} are mutually exclusive successors left for the caller to wire.</li>
 *     <li>{@code nodesConnectedToExit} holds nodes whose only outgoing edge already targets a
 *     terminal (function exit or cleanup entry). They never appear among the exit points: the
 *     constructor drops any exit point whose id is in that set.</li>
 * </ul>
 */
public record ProcessResult(List<Node> nodes,
                            List<Edge> edges,
                            @Nullable String entryNodeId,
                            List<ExitPoint> exitPoints,
                            Set<String> nodesConnectedToExit) {
    private static final ProcessResult EMPTY = new ProcessResult(List.of(), List.of(), null, List.of(), Set.of());

    public ProcessResult {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        nodesConnectedToExit = Set.copyOf(nodesConnectedToExit);
        Set<String> connected = nodesConnectedToExit;
        exitPoints = exitPoints.stream().filter(ep -> !connected.contains(ep.id())).toList();
        if (entryNodeId == null && !exitPoints.isEmpty()) {
            throw new IllegalArgumentException("a region without entry cannot have exit points");
        }
    }

    public static ProcessResult empty() {
        return EMPTY;
    }

    /**
     * Region made of one node that falls through to whatever follows.
     */
    public static ProcessResult of(Node node) {
        return new ProcessResult(List.of(node), List.of(), node.id(), List.of(ExitPoint.of(node.id())), Set.of());
    }

    public boolean isEmpty() {
        return entryNodeId == null;
    }

    public boolean hasEdgeTo(String nodeId) {
        return edges.stream().anyMatch(e -> e.to().equals(nodeId));
    }

    /**
     * Sequencing: this region followed by {@code next}. Every exit point of this region gets an
     * edge to the entry of {@code next}, keeping its label. A no-op {@code next} is transparent.
     */
    public ProcessResult then(ProcessResult next) {
        if (next.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return next;
        }
        return builder()
                .absorb(this)
                .absorb(next)
                .connect(exitPoints, next.entryNodeId())
                .entry(entryNodeId)
                .exits(next.exitPoints())
                .build();
    }

    public static ProcessResult sequence(List<ProcessResult> regions) {
        ProcessResult result = EMPTY;
        for (ProcessResult region : regions) {
            result = result.then(region);
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator used by the composition rules.
     */
    public static final class Builder {
        private final List<Node> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Set<String> connected = new LinkedHashSet<>();
        private final List<ExitPoint> exits = new ArrayList<>();
        private String entry;

        private Builder() {
        }

        public Builder node(Node node) {
            nodes.add(node);
            return this;
        }

        public Builder edge(String from, String to, String label) {
            edges.add(new Edge(from, to, label));
            return this;
        }

        /**
         * Takes over the nodes, edges and connected-to-exit marks of {@code region}.
         */
        public Builder absorb(ProcessResult region) {
            nodes.addAll(region.nodes());
            edges.addAll(region.edges());
            connected.addAll(region.nodesConnectedToExit());
            return this;
        }

        /**
         * Wires each exit point to {@code target}, carrying the exit point's label.
         */
        public Builder connect(Collection<ExitPoint> from, String target) {
            for (ExitPoint ep : from) {
                edges.add(new Edge(ep.id(), target, ep.label()));
            }
            return this;
        }

        /**
         * Wires each exit point to a terminal target and marks its node as connected to exit.
         */
        public Builder connectToTerminal(Collection<ExitPoint> from, String target, String fallbackLabel) {
            for (ExitPoint ep : from) {
                edges.add(new Edge(ep.id(), target, ep.orLabel(fallbackLabel).label()));
                connected.add(ep.id());
            }
            return this;
        }

        public Builder markConnected(String nodeId) {
            connected.add(nodeId);
            return this;
        }

        public Builder entry(@Nullable String entryNodeId) {
            this.entry = entryNodeId;
            return this;
        }

        public Builder exit(ExitPoint exitPoint) {
            exits.add(exitPoint);
            return this;
        }

        public Builder exits(Collection<ExitPoint> exitPoints) {
            exits.addAll(exitPoints);
            return this;
        }

        public ProcessResult build() {
            return new ProcessResult(nodes, edges, entry, exits, connected);
        }
    }
}
