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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plus.wcj.code2flowchart.ir.FlowchartIR;
import plus.wcj.code2flowchart.syntax.SyntaxNode;
import plus.wcj.code2flowchart.syntax.SyntaxTree;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Callable discovery, selection and assembly shared by all languages. Subclasses find the
 * callables of their grammar and supply a per-build {@link AbstractFlowBuilder}.
 */
public abstract class AbstractFlowExtractor implements FlowExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractFlowExtractor.class);

    public static final String NO_CALLABLE_MESSAGE = "Place cursor inside a function to generate a flowchart.";

    /**
     * All callables of the file in source order.
     */
    protected abstract List<Callable> collectCallables(SyntaxNode root);

    protected abstract AbstractFlowBuilder newBuilder(BuildContext ctx);

    protected LabelFormatter labelFormatter(ExtractOptions options) {
        return new LabelFormatter(options.labelMaxLength());
    }

    @Override
    public FlowchartIR extract(SyntaxTree tree, CallableSelector selector, ExtractOptions options) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(options, "options");
        Callable target = select(collectCallables(tree.root()), selector).orElse(null);
        if (target == null) {
            if (!selector.isEmpty()) {
                LOG.warn("No {} callable matches {}", language().id(), selector);
            }
            return FlowchartIR.placeholder(NO_CALLABLE_MESSAGE);
        }
        if (target.body() == null) {
            return FlowchartIR.placeholder("Function " + target.name() + " has no body.");
        }
        BuildContext ctx = new BuildContext(options, labelFormatter(options));
        AbstractFlowBuilder builder = newBuilder(ctx);
        FlowchartAssembler assembler = new FlowchartAssembler(new ComplexityAnalyzer(options));
        return assembler.assemble(target, ctx, scope -> builder.buildCallable(target, scope));
    }

    @Override
    public List<String> listFunctions(SyntaxTree tree) {
        Objects.requireNonNull(tree, "tree");
        return collectCallables(tree.root()).stream()
                .filter(c -> c.kind() != CallableKind.IMPL_BLOCK)
                .map(Callable::listName)
                .toList();
    }

    @Override
    @Nullable
    public String findEnclosingCallableName(SyntaxTree tree, int position) {
        Objects.requireNonNull(tree, "tree");
        return select(collectCallables(tree.root()), CallableSelector.atPosition(position))
                .map(Callable::name)
                .orElse(null);
    }

    /**
     * Definitions first, then lambdas and closures bound to variables, then impl blocks.
     */
    static Optional<Callable> select(List<Callable> callables, CallableSelector selector) {
        List<Predicate<Callable>> tiers = List.of(
                c -> c.kind().isDefinition(),
                c -> c.kind().isAnonymous(),
                c -> c.kind() == CallableKind.IMPL_BLOCK);
        for (Predicate<Callable> tier : tiers) {
            Optional<Callable> found = selectInTier(callables.stream().filter(tier).toList(), selector);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static Optional<Callable> selectInTier(List<Callable> candidates, CallableSelector selector) {
        if (selector.position() != null) {
            int position = selector.position();
            // innermost wins; on equal length the later (deeper) declaration
            return candidates.stream()
                    .filter(c -> c.contains(position))
                    .min(Comparator.comparingInt(Callable::length)
                            .thenComparing(c -> -c.node().startByte()));
        }
        String name = selector.normalizedName();
        if (name != null && !name.isEmpty()) {
            return candidates.stream().filter(c -> c.name().equals(name)).findFirst();
        }
        return candidates.stream().findFirst();
    }
}
