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
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link SyntaxNode} backed by a tree-sitter node. Text is sliced from the UTF-8 bytes the
 * tree was parsed from, since tree-sitter reports byte offsets.
 */
public final class TreeSitterSyntaxNode implements SyntaxNode {
    private final TSNode node;
    private final byte[] source;
    // keeps the native tree alive while any of its nodes is reachable
    private final TSTree tree;

    TreeSitterSyntaxNode(TSNode node, byte[] source, TSTree tree) {
        this.node = Objects.requireNonNull(node, "node");
        this.source = Objects.requireNonNull(source, "source");
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    @Nullable
    private SyntaxNode wrap(@Nullable TSNode other) {
        if (other == null || other.isNull()) {
            return null;
        }
        return new TreeSitterSyntaxNode(other, source, tree);
    }

    @Override
    public String type() {
        return node.getType();
    }

    @Override
    public int startByte() {
        return node.getStartByte();
    }

    @Override
    public int endByte() {
        return node.getEndByte();
    }

    @Override
    public String text() {
        int start = Math.max(0, Math.min(startByte(), source.length));
        int end = Math.max(start, Math.min(endByte(), source.length));
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    @Override
    public boolean isNamed() {
        return node.isNamed();
    }

    @Override
    @Nullable
    public SyntaxNode parent() {
        return wrap(node.getParent());
    }

    @Override
    public int childCount() {
        return node.getChildCount();
    }

    @Override
    public SyntaxNode child(int index) {
        return Objects.requireNonNull(wrap(node.getChild(index)), "child " + index);
    }

    @Override
    public int namedChildCount() {
        return node.getNamedChildCount();
    }

    @Override
    public SyntaxNode namedChild(int index) {
        return Objects.requireNonNull(wrap(node.getNamedChild(index)), "named child " + index);
    }

    @Override
    @Nullable
    public SyntaxNode childByFieldName(String fieldName) {
        return wrap(node.getChildByFieldName(fieldName));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TreeSitterSyntaxNode other)) {
            return false;
        }
        return source == other.source
                && startByte() == other.startByte()
                && endByte() == other.endByte()
                && type().equals(other.type());
    }

    @Override
    public int hashCode() {
        return Objects.hash(startByte(), endByte(), type());
    }

    @Override
    public String toString() {
        return type() + "[" + startByte() + ", " + endByte() + ")";
    }
}
