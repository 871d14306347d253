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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plus.wcj.code2flowchart.ir.Complexity;
import plus.wcj.code2flowchart.ir.Edge;
import plus.wcj.code2flowchart.ir.FlowchartIR;
import plus.wcj.code2flowchart.ir.Node;
import plus.wcj.code2flowchart.ir.NodeType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Wraps the body region of a callable between Start and End and produces the final chart.
 */
public final class FlowchartAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(FlowchartAssembler.class);

    private final ComplexityAnalyzer complexityAnalyzer;

    public FlowchartAssembler(ComplexityAnalyzer complexityAnalyzer) {
        this.complexityAnalyzer = complexityAnalyzer;
    }

    /**
     * @param bodyBuilder builds the body region given the scope whose exit is the End node
     */
    public FlowchartIR assemble(Callable callable, BuildContext ctx, Function<Scope, ProcessResult> bodyBuilder) {
        Node start = ctx.sentinel("start", NodeType.ENTRY, "Start");
        Node end = ctx.sentinel("end", NodeType.EXIT, "End");
        ProcessResult body = bodyBuilder.apply(Scope.root(end.id()));

        List<Node> nodes = new ArrayList<>(body.nodes().size() + 2);
        nodes.add(start);
        nodes.addAll(body.nodes());
        nodes.add(end);

        List<Edge> edges = new ArrayList<>(body.edges().size() + body.exitPoints().size() + 1);
        edges.add(Edge.of(start.id(), body.isEmpty() ? end.id() : body.entryNodeId()));
        edges.addAll(body.edges());
        for (ExitPoint ep : body.exitPoints()) {
            // an unlabelled fall-through adds nothing next to an edge that already reaches End
            if (!ep.label().isEmpty() || !hasEdge(edges, ep.id(), end.id())) {
                edges.add(new Edge(ep.id(), end.id(), ep.label()));
            }
        }

        List<Edge> valid = dropDanglingEdges(nodes, edges);
        Complexity complexity = complexityAnalyzer.analyze(nodes);
        LOG.debug("Built {}: {} nodes, {} edges, complexity {}",
                callable.title(), nodes.size(), valid.size(), complexity.cyclomaticComplexity());
        return new FlowchartIR(nodes, valid, ctx.locationMap(), start.id(), end.id(), callable.title(),
                callable.node().range(), complexity);
    }

    private static boolean hasEdge(List<Edge> edges, String from, String to) {
        return edges.stream().anyMatch(e -> e.from().equals(from) && e.to().equals(to));
    }

    static List<Edge> dropDanglingEdges(List<Node> nodes, List<Edge> edges) {
        Set<String> ids = new HashSet<>();
        for (Node node : nodes) {
            ids.add(node.id());
        }
        List<Edge> valid = new ArrayList<>(edges.size());
        for (Edge edge : edges) {
            if (ids.contains(edge.from()) && ids.contains(edge.to())) {
                valid.add(edge);
            } else {
                LOG.debug("Dropping edge {} -> {} with a missing endpoint", edge.from(), edge.to());
            }
        }
        return valid;
    }
}
