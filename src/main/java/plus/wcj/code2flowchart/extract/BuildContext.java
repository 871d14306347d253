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
import plus.wcj.code2flowchart.ir.LocationMapEntry;
import plus.wcj.code2flowchart.ir.Node;
import plus.wcj.code2flowchart.ir.NodeType;
import plus.wcj.code2flowchart.syntax.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * State of a single build: node ids, the location map and the statement labels a goto can
 * jump to. Never shared between builds.
 */
public final class BuildContext {
    private final ExtractOptions options;
    private final LabelFormatter labels;
    private final List<LocationMapEntry> locationMap = new ArrayList<>();
    private final Deque<Map<String, String>> jumpLabels = new ArrayDeque<>(List.of(new HashMap<>()));
    private int idSequence = 0;

    public BuildContext(ExtractOptions options, LabelFormatter labels) {
        this.options = Objects.requireNonNull(options, "options");
        this.labels = Objects.requireNonNull(labels, "labels");
    }

    public ExtractOptions options() {
        return options;
    }

    public LabelFormatter labels() {
        return labels;
    }

    public String nextId(String prefix) {
        return prefix + "_" + (idSequence++);
    }

    /**
     * Creates a node for {@code source}, formatting {@code rawLabel} and recording its location.
     */
    public Node node(String prefix, NodeType type, String rawLabel, @Nullable SyntaxNode source) {
        return node(nextId(prefix), type, rawLabel, source, true);
    }

    /**
     * Creates a node under an id reserved earlier with {@link #nextId(String)}.
     */
    public Node node(String id, NodeType type, String rawLabel, @Nullable SyntaxNode source, boolean format) {
        String label = format ? labels.format(rawLabel) : rawLabel;
        Node node = new Node(id, type, label, source == null ? null : source.range());
        if (source != null) {
            mapLocation(source, id);
        }
        return node;
    }

    /**
     * Synthetic node with a fixed label and no source location.
     */
    public Node sentinel(String prefix, NodeType type, String label) {
        return new Node(nextId(prefix), type, label, null);
    }

    public Node reservedSentinel(String reservedId, NodeType type, String label) {
        return new Node(reservedId, type, label, null);
    }

    public void mapLocation(SyntaxNode source, String nodeId) {
        locationMap.add(new LocationMapEntry(source.startByte(), source.endByte(), nodeId));
    }

    public List<LocationMapEntry> locationMap() {
        return List.copyOf(locationMap);
    }

    public void reserveJumpLabel(String label, String nodeId) {
        jumpLabels.peek().putIfAbsent(label, nodeId);
    }

    @Nullable
    public String jumpLabel(String label) {
        return jumpLabels.peek().get(label);
    }

    /**
     * Starts an empty label table for a nested callable body; labels of the enclosing body are
     * out of reach until {@link #exitJumpLabelScope()}.
     */
    public void enterJumpLabelScope() {
        jumpLabels.push(new HashMap<>());
    }

    public void exitJumpLabelScope() {
        if (jumpLabels.size() == 1) {
            throw new IllegalStateException("no nested label scope to leave");
        }
        jumpLabels.pop();
    }
}
