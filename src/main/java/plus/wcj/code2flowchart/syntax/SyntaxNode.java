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

package plus.wcj.code2flowchart.syntax;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Read-only view of one node of a parsed syntax tree. Offsets are UTF-8 byte offsets.
 * <p>
 * Implementations compare equal when they denote the same node of the same tree.
 */
public interface SyntaxNode {

    String type();

    int startByte();

    int endByte();

    String text();

    boolean isNamed();

    @Nullable
    SyntaxNode parent();

    int childCount();

    SyntaxNode child(int index);

    int namedChildCount();

    SyntaxNode namedChild(int index);

    /**
     * @return the child stored under the grammar field, or {@code null} when absent
     */
    @Nullable
    SyntaxNode childByFieldName(String fieldName);

    default SourceRange range() {
        return new SourceRange(startByte(), endByte());
    }

    default boolean contains(int position) {
        return position >= startByte() && position < endByte();
    }

    default boolean is(String... types) {
        for (String t : types) {
            if (t.equals(type())) {
                return true;
            }
        }
        return false;
    }

    default List<SyntaxNode> children() {
        List<SyntaxNode> result = new ArrayList<>(childCount());
        for (int i = 0; i < childCount(); i++) {
            result.add(child(i));
        }
        return result;
    }

    default List<SyntaxNode> namedChildren() {
        List<SyntaxNode> result = new ArrayList<>(namedChildCount());
        for (int i = 0; i < namedChildCount(); i++) {
            result.add(namedChild(i));
        }
        return result;
    }

    @Nullable
    default SyntaxNode firstNamedChildOfType(String... types) {
        for (SyntaxNode child : namedChildren()) {
            if (child.is(types)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Pre-order list of descendants (excluding this node) whose type is one of {@code types}.
     */
    default List<SyntaxNode> descendantsOfType(String... types) {
        Set<String> wanted = Set.of(types);
        List<SyntaxNode> result = new ArrayList<>();
        collectDescendants(this, wanted, result);
        return result;
    }

    private static void collectDescendants(SyntaxNode node, Set<String> wanted, List<SyntaxNode> out) {
        for (int i = 0; i < node.namedChildCount(); i++) {
            SyntaxNode child = node.namedChild(i);
            if (wanted.contains(child.type())) {
                out.add(child);
            }
            collectDescendants(child, wanted, out);
        }
    }

    /**
     * Nearest ancestor whose type is one of {@code types}, or {@code null}.
     */
    @Nullable
    default SyntaxNode ancestorOfType(String... types) {
        SyntaxNode current = parent();
        while (current != null) {
            if (current.is(types)) {
                return current;
            }
            current = current.parent();
        }
        return null;
    }
}
