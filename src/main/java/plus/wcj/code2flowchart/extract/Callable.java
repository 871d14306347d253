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
import plus.wcj.code2flowchart.syntax.SyntaxNode;

import java.util.Objects;

/**
 * Something a flowchart can be drawn for.
 *
 * @param node the declaration that owns the callable; its range is used for selection
 * @param body the body to build, or {@code null} for a declaration without one
 */
public record Callable(CallableKind kind, String name, SyntaxNode node, @Nullable SyntaxNode body) {
    public Callable {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(node, "node");
    }

    public String listName() {
        return name + kind.listSuffix();
    }

    public String title() {
        if (kind == CallableKind.IMPL_BLOCK) {
            return name;
        }
        return "Flowchart for " + kind.word() + ": " + name;
    }

    public boolean contains(int position) {
        return node.contains(position);
    }

    public int length() {
        return node.endByte() - node.startByte();
    }
}
