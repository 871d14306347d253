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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import plus.wcj.code2flowchart.FlowchartException;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parses source text with the bundled tree-sitter grammars. Parsers are not thread safe, so each
 * thread keeps its own parser per language.
 */
public final class TreeSitterParsers {
    private static final Logger LOG = LoggerFactory.getLogger(TreeSitterParsers.class);

    private static final ThreadLocal<Map<SourceLanguage, TSParser>> PARSERS =
            ThreadLocal.withInitial(() -> new EnumMap<>(SourceLanguage.class));

    private TreeSitterParsers() {
    }

    public static SyntaxTree parse(SourceLanguage language, String source) {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(source, "source");
        TSParser parser = PARSERS.get().computeIfAbsent(language, TreeSitterParsers::newParser);
        TSTree tree;
        try {
            tree = parser.parseString(null, source);
        } catch (RuntimeException e) {
            throw new FlowchartException("Failed to parse " + language.id() + " source", e);
        }
        if (tree == null) {
            throw new FlowchartException("Parser returned no tree for " + language.id() + " source");
        }
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        TreeSitterSyntaxNode root = new TreeSitterSyntaxNode(tree.getRootNode(), bytes, tree);
        LOG.debug("Parsed {} bytes of {} source", bytes.length, language.id());
        return new SyntaxTree(language, root);
    }

    private static TSParser newParser(SourceLanguage language) {
        try {
            TSParser parser = new TSParser();
            parser.setLanguage(language.newGrammar());
            return parser;
        } catch (RuntimeException | LinkageError e) {
            throw new FlowchartException("Unable to load the " + language.id() + " grammar", e);
        }
    }
}
