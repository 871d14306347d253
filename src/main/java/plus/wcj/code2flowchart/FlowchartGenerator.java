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

package plus.wcj.code2flowchart;

import org.jetbrains.annotations.Nullable;
import plus.wcj.code2flowchart.extract.CallableSelector;
import plus.wcj.code2flowchart.extract.CppFlowExtractor;
import plus.wcj.code2flowchart.extract.ExtractOptions;
import plus.wcj.code2flowchart.extract.FlowExtractor;
import plus.wcj.code2flowchart.extract.JavaFlowExtractor;
import plus.wcj.code2flowchart.extract.RustFlowExtractor;
import plus.wcj.code2flowchart.ir.FlowchartIR;
import plus.wcj.code2flowchart.syntax.SourceLanguage;
import plus.wcj.code2flowchart.syntax.SyntaxTree;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: turns a function, method, lambda or closure of a source file into a
 * {@link FlowchartIR}. Stateless apart from its options; safe to share between threads.
 */
public class FlowchartGenerator {
    private final ExtractOptions options;
    private final Map<SourceLanguage, FlowExtractor> extractors = new EnumMap<>(SourceLanguage.class);

    public FlowchartGenerator() {
        this(ExtractOptions.defaultOptions());
    }

    public FlowchartGenerator(ExtractOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        register(new CppFlowExtractor());
        register(new JavaFlowExtractor());
        register(new RustFlowExtractor());
    }

    private void register(FlowExtractor extractor) {
        extractors.put(extractor.language(), extractor);
    }

    public ExtractOptions options() {
        return options;
    }

    /**
     * @param name     callable to draw, as returned by {@link #listFunctions}; may be null
     * @param position UTF-8 byte offset inside the callable to draw; wins over {@code name}
     */
    public FlowchartIR generateFlowchart(SourceLanguage language, String source,
                                         @Nullable String name, @Nullable Integer position) {
        return generateFlowchart(SyntaxTree.parse(language, source), new CallableSelector(name, position));
    }

    public FlowchartIR generateFlowchart(SourceLanguage language, String source) {
        return generateFlowchart(SyntaxTree.parse(language, source), CallableSelector.first());
    }

    public FlowchartIR generateFlowchart(SyntaxTree tree, CallableSelector selector) {
        Objects.requireNonNull(tree, "tree");
        return extractor(tree.language()).extract(tree, selector, options);
    }

    public List<String> listFunctions(SourceLanguage language, String source) {
        return listFunctions(SyntaxTree.parse(language, source));
    }

    public List<String> listFunctions(SyntaxTree tree) {
        Objects.requireNonNull(tree, "tree");
        return extractor(tree.language()).listFunctions(tree);
    }

    @Nullable
    public String findEnclosingCallableName(SourceLanguage language, String source, int position) {
        return findEnclosingCallableName(SyntaxTree.parse(language, source), position);
    }

    @Nullable
    public String findEnclosingCallableName(SyntaxTree tree, int position) {
        Objects.requireNonNull(tree, "tree");
        return extractor(tree.language()).findEnclosingCallableName(tree, position);
    }

    private FlowExtractor extractor(SourceLanguage language) {
        FlowExtractor extractor = extractors.get(language);
        if (extractor == null) {
            throw new IllegalArgumentException("No flowchart extractor for " + language.id());
        }
        return extractor;
    }
}
