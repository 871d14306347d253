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

package plus.wcj.code2flowchart.ir;

import org.jetbrains.annotations.Nullable;
import plus.wcj.code2flowchart.syntax.SourceRange;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The finished flowchart of one callable. A placeholder chart has a single message node and no
 * entry, exit or complexity.
 */
public record FlowchartIR(List<Node> nodes,
                          List<Edge> edges,
                          List<LocationMapEntry> locationMap,
                          @Nullable String entryNodeId,
                          @Nullable String exitNodeId,
                          String title,
                          @Nullable SourceRange functionRange,
                          @Nullable Complexity complexity) {
    public FlowchartIR {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        locationMap = List.copyOf(locationMap);
        title = Optional.ofNullable(title).orElse("");
    }

    public static FlowchartIR placeholder(String message) {
        Objects.requireNonNull(message, "message");
        Node node = new Node("A", NodeType.PROCESS, message, null);
        return new FlowchartIR(List.of(node), List.of(), List.of(), null, null, "", null, null);
    }

    public boolean isPlaceholder() {
        return entryNodeId == null;
    }

    public Optional<Node> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public List<Edge> outgoing(String nodeId) {
        return edges.stream().filter(e -> e.from().equals(nodeId)).toList();
    }

    public List<Edge> incoming(String nodeId) {
        return edges.stream().filter(e -> e.to().equals(nodeId)).toList();
    }

    /**
     * Node drawn for the source offset, preferring the narrowest mapped range.
     */
    public Optional<String> nodeAt(int offset) {
        return locationMap.stream()
                .filter(entry -> entry.contains(offset))
                .min((a, b) -> Integer.compare(a.end() - a.start(), b.end() - b.start()))
                .map(LocationMapEntry::nodeId);
    }
}
