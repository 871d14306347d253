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

import java.util.Objects;
import java.util.Optional;

/**
 * A flowchart node. {@code range} is absent for synthetic sentinels.
 */
public record Node(String id, NodeType type, String label, @Nullable SourceRange range) {
    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        label = Optional.ofNullable(label).orElse("");
    }

    public NodeCategory category() {
        return type.category();
    }
}
