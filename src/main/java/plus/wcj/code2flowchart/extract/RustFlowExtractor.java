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
import plus.wcj.code2flowchart.ir.Node;
import plus.wcj.code2flowchart.ir.NodeType;
import plus.wcj.code2flowchart.syntax.SourceLanguage;
import plus.wcj.code2flowchart.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rust front-end. Blocks are expressions here, so the last expression of a function or closure
 * body is its implicit return value.
 */
public class RustFlowExtractor extends AbstractFlowExtractor {
    private static final Set<String> DECOMPOSED_OPERANDS = Set.of("if_expression", "match_expression",
            "while_expression", "loop_expression", "for_expression", "block", "unsafe_block");
    private static final Set<String> PANIC_MACROS = Set.of("panic", "unreachable", "todo", "unimplemented");
    private static final Set<String> PRINT_MACROS = Set.of("println", "print", "eprintln", "eprint", "dbg");
    private static final Set<String> ITEMS = Set.of("use_declaration", "type_item", "struct_item", "enum_item",
            "impl_item", "trait_item", "mod_item", "const_item", "static_item", "macro_definition", "function_item",
            "union_item", "extern_crate_declaration", "foreign_mod_item", "attribute_item", "inner_attribute_item");

    @Override
    public SourceLanguage language() {
        return SourceLanguage.RUST;
    }

    @Override
    protected LabelFormatter labelFormatter(ExtractOptions options) {
        return new LabelFormatter(options.compactLabelMaxLength());
    }

    @Override
    protected List<Callable> collectCallables(SyntaxNode root) {
        List<Callable> callables = new ArrayList<>();
        for (SyntaxNode node : root.descendantsOfType("function_item", "let_declaration", "impl_item")) {
            switch (node.type()) {
                case "function_item" -> {
                    SyntaxNode name = node.childByFieldName("name");
                    if (name != null) {
                        boolean method = node.ancestorOfType("impl_item", "trait_item") != null
                                && node.ancestorOfType("function_item") == null;
                        callables.add(new Callable(method ? CallableKind.METHOD : CallableKind.FUNCTION,
                                name.text(), node, node.childByFieldName("body")));
                    }
                }
                case "let_declaration" -> {
                    SyntaxNode pattern = node.childByFieldName("pattern");
                    SyntaxNode value = node.childByFieldName("value");
                    if (pattern != null && value != null && value.is("closure_expression")) {
                        callables.add(new Callable(CallableKind.CLOSURE, pattern.text(), node, value.childByFieldName("body")));
                    }
                }
                default -> {
                    SyntaxNode type = node.childByFieldName("type");
                    String name = "impl " + (type == null ? "block" : LabelFormatter.squash(type.text()));
                    callables.add(new Callable(CallableKind.IMPL_BLOCK, name, node, node.childByFieldName("body")));
                }
            }
        }
        return callables;
    }

    @Override
    protected AbstractFlowBuilder newBuilder(BuildContext ctx) {
        return new Builder(ctx);
    }

    private static final class Builder extends AbstractFlowBuilder {

        Builder(BuildContext ctx) {
            super(ctx);
        }

        @Override
        protected ProcessResult processCallableBody(Callable callable, SyntaxNode body, Scope scope) {
            if (callable.kind() == CallableKind.IMPL_BLOCK) {
                return processImplOverview(body);
            }
            return super.processCallableBody(callable, body, scope);
        }

        /**
         * Methods one after another, each a subroutine header followed by its body. A method's
         * returns lead to the next method rather than to the end of the chart.
         */
        private ProcessResult processImplOverview(SyntaxNode declarations) {
            ProcessResult result = ProcessResult.empty();
            for (SyntaxNode method : declarations.namedChildren()) {
                if (!method.is("function_item")) {
                    continue;
                }
                SyntaxNode name = method.childByFieldName("name");
                Node header = ctx.node("method", NodeType.SUBROUTINE, "fn " + (name == null ? "?" : name.text()), method);
                String standIn = ctx.nextId("method_end");
                SyntaxNode body = method.childByFieldName("body");
                ProcessResult bodyRegion = body == null
                        ? ProcessResult.empty()
                        : processBlock(body, Scope.root(standIn).inTail());
                result = result.then(Regions.detachTerminal(ProcessResult.of(header).then(bodyRegion), standIn));
            }
            return result;
        }

        @Override
        protected ProcessResult processStatement(SyntaxNode node, Scope scope) {
            return switch (node.type()) {
                case "block" -> processBlock(node, scope);
                case "unsafe_block", "async_block", "const_block" ->
                        processBody(node.firstNamedChildOfType("block"), scope);
                case "expression_statement" -> node.namedChildCount() == 0
                        ? ProcessResult.empty()
                        : processStatement(node.namedChild(0), scope);
                case "let_declaration" -> handleLet(node, scope);
                case "if_expression" -> handleIf(node, scope);
                case "match_expression" -> handleMatch(node, scope);
                case "while_expression" -> handleWhile(node, labelled(node, scope));
                case "loop_expression" ->
                        handleUnconditionalLoop("loop", node, node.childByFieldName("body"), List.of(), labelled(node, scope));
                case "for_expression" -> handleFor(node, labelled(node, scope));
                case "return_expression" -> handleReturn(node, "return", firstExpression(node), scope);
                case "break_expression" -> handleBreak(node, jumpLabel(node), scope);
                case "continue_expression" -> handleContinue(node, jumpLabel(node), scope);
                case "assignment_expression" -> handleAssignment(node, scope);
                case "compound_assignment_expr" -> handleLeaf(node, NodeType.ASSIGNMENT);
                case "call_expression" -> handleCallExpression(node, scope);
                case "macro_invocation" -> handleMacro(node, scope);
                case "try_expression" -> handleQuestionMark(node, scope);
                case "await_expression" -> handleLeaf(node, NodeType.AWAIT);
                case "parenthesized_expression" -> processStatement(unwrapParentheses(node), scope);
                default -> ITEMS.contains(node.type()) ? ProcessResult.empty() : handleLeaf(node, NodeType.PROCESS);
            };
        }

        private ProcessResult handleLet(SyntaxNode node, Scope scope) {
            SyntaxNode pattern = node.childByFieldName("pattern");
            SyntaxNode value = node.childByFieldName("value");
            SyntaxNode alternative = node.childByFieldName("alternative");
            String target = "let " + (pattern == null ? "_" : pattern.text());
            if (alternative == null) {
                return handleBinding(node, node.text(), target, value, scope);
            }
            // let-else: the pattern either matches or the diverging block runs
            String label = value == null ? target : target + " = " + value.text();
            Node decision = ctx.node("let", NodeType.DECISION, label, value == null ? node : value);
            return Regions.branch(decision, ProcessResult.empty(), Regions.MATCH,
                    processBody(alternative, scope.nested()), "else");
        }

        private ProcessResult handleAssignment(SyntaxNode node, Scope scope) {
            SyntaxNode left = node.childByFieldName("left");
            if (left == null) {
                return handleLeaf(node, NodeType.ASSIGNMENT);
            }
            return handleBinding(node, node.text(), left.text(), node.childByFieldName("right"), scope);
        }

        private ProcessResult handleIf(SyntaxNode node, Scope scope) {
            SyntaxNode condition = node.childByFieldName("condition");
            SyntaxNode alternative = node.childByFieldName("alternative");
            if (alternative != null && alternative.is("else_clause")) {
                alternative = alternative.namedChildCount() == 0 ? null : alternative.namedChild(alternative.namedChildCount() - 1);
            }
            return handleIf("if " + (condition == null ? "?" : condition.text()), condition == null ? node : condition,
                    node.childByFieldName("consequence"), alternative, scope);
        }

        private ProcessResult handleMatch(SyntaxNode node, Scope scope) {
            SyntaxNode value = node.childByFieldName("value");
            SyntaxNode body = node.childByFieldName("body");
            List<CaseSpec> arms = new ArrayList<>();
            if (body != null) {
                for (SyntaxNode arm : body.namedChildren()) {
                    if (!arm.is("match_arm", "last_match_arm")) {
                        continue;
                    }
                    SyntaxNode pattern = arm.childByFieldName("pattern");
                    SyntaxNode armValue = arm.childByFieldName("value");
                    arms.add(new CaseSpec(arm, pattern == null ? "_" : pattern.text(),
                            armValue == null ? List.of() : List.of(armValue)));
                }
            }
            return handleCaseChain("match " + (value == null ? "?" : value.text()), value == null ? node : value,
                    arms, false, false, scope);
        }

        private ProcessResult handleWhile(SyntaxNode node, Scope scope) {
            SyntaxNode condition = node.childByFieldName("condition");
            return handlePreTestLoop("while " + (condition == null ? "?" : condition.text()),
                    condition == null ? node : condition, node.childByFieldName("body"), List.of(),
                    Regions.TRUE, Regions.FALSE, scope);
        }

        private ProcessResult handleFor(SyntaxNode node, Scope scope) {
            SyntaxNode pattern = node.childByFieldName("pattern");
            SyntaxNode value = node.childByFieldName("value");
            String header = "for " + (pattern == null ? "_" : pattern.text()) + " in " + (value == null ? "?" : value.text());
            return handlePreTestLoop(header, node, node.childByFieldName("body"), List.of(),
                    "next item", "no more items", scope);
        }

        private Scope labelled(SyntaxNode loop, Scope scope) {
            SyntaxNode label = loop.firstNamedChildOfType("label");
            return label == null ? scope : scope.withPendingLabel(label.text());
        }

        private ProcessResult handleCallExpression(SyntaxNode node, Scope scope) {
            MethodChain chain = methodChain(node);
            if (chain != null && isCompoundChain(chain)) {
                return handleMethodChain(chain, scope);
            }
            SyntaxNode function = node.childByFieldName("function");
            NodeType type = function != null && function.is("field_expression") ? NodeType.METHOD_CALL : NodeType.FUNCTION_CALL;
            return handleCall(node, type, node.childByFieldName("arguments"));
        }

        /**
         * {@code expr?}. A branching or chained operand is drawn first and flows into the check;
         * {@code fut.await?} is one await node carrying the Ok and Err edges.
         */
        private ProcessResult handleQuestionMark(SyntaxNode node, Scope scope) {
            SyntaxNode operand = node.namedChildCount() == 0 ? null : unwrapParentheses(node.namedChild(0));
            if (operand == null) {
                return handleErrorPropagation(node, scope);
            }
            NodeType type = NodeType.EARLY_RETURN_ERROR;
            String prefix = "try_op";
            if (operand.is("await_expression")) {
                type = NodeType.AWAIT;
                prefix = "await";
                operand = operand.namedChildCount() == 0 ? operand : unwrapParentheses(operand.namedChild(0));
            }
            ProcessResult operandRegion = ProcessResult.empty();
            if (DECOMPOSED_OPERANDS.contains(operand.type())) {
                operandRegion = processStatement(operand, scope.nested());
            } else {
                MethodChain chain = methodChain(operand);
                if (chain != null && isCompoundChain(chain)) {
                    operandRegion = handleMethodChain(chain, scope);
                }
            }
            Node check = ctx.node(prefix, type, node.text(), node);
            return operandRegion.then(Regions.errorPropagation(check, scope.terminalTarget()));
        }

        private ProcessResult handleMacro(SyntaxNode node, Scope scope) {
            SyntaxNode macro = node.childByFieldName("macro");
            String name = macro == null ? "" : macro.text();
            int separator = name.lastIndexOf("::");
            if (separator >= 0) {
                name = name.substring(separator + 2);
            }
            if (PANIC_MACROS.contains(name)) {
                return handleTerminal(node, "panic", NodeType.PANIC, node.text(), scope);
            }
            return handleLeaf(node, PRINT_MACROS.contains(name) ? NodeType.FUNCTION_CALL : NodeType.MACRO_CALL);
        }

        @Override
        @Nullable
        protected MethodChain methodChain(SyntaxNode expr) {
            List<ChainCall> calls = new ArrayList<>();
            SyntaxNode current = expr;
            while (current.is("call_expression")) {
                SyntaxNode function = current.childByFieldName("function");
                if (function == null || !function.is("field_expression")) {
                    break;
                }
                SyntaxNode field = function.childByFieldName("field");
                SyntaxNode receiver = function.childByFieldName("value");
                if (field == null || receiver == null) {
                    break;
                }
                calls.add(0, new ChainCall(current, field.text(), current.childByFieldName("arguments")));
                current = receiver;
            }
            return calls.isEmpty() ? null : new MethodChain(current, calls);
        }

        @Override
        protected boolean isSimpleReceiver(SyntaxNode receiver) {
            if (receiver.is("identifier", "self", "scoped_identifier", "field_identifier")) {
                return true;
            }
            if (receiver.is("field_expression")) {
                SyntaxNode value = receiver.childByFieldName("value");
                return value != null && isSimpleReceiver(value);
            }
            return false;
        }

        @Override
        protected boolean isCompoundValue(SyntaxNode value) {
            return value.is("if_expression", "match_expression", "block", "unsafe_block", "loop_expression",
                    "try_expression", "await_expression") || super.isCompoundValue(value);
        }

        /**
         * A match head only evaluates the scrutinee; the arms are the decisions.
         */
        @Override
        protected NodeType caseHeadType() {
            return NodeType.PROCESS;
        }

        @Override
        protected boolean isTailBlock(Callable callable) {
            return true;
        }

        @Override
        protected boolean isTailClosureBlock() {
            return true;
        }

        @Override
        protected boolean isTailExpression(SyntaxNode statement) {
            SyntaxNode expr = statement;
            if (statement.is("expression_statement")) {
                if (statement.childCount() == 0 || statement.child(statement.childCount() - 1).is(";")) {
                    return false;
                }
                expr = unwrapTail(statement);
            }
            return !expr.is("let_declaration", "while_expression", "for_expression", "loop_expression",
                    "assignment_expression", "compound_assignment_expr", "expression_statement")
                    && !ITEMS.contains(expr.type());
        }

        @Override
        protected SyntaxNode unwrapTail(SyntaxNode statement) {
            if (statement.is("expression_statement") && statement.namedChildCount() > 0) {
                return statement.namedChild(0);
            }
            return statement;
        }

        @Override
        protected boolean isExpandableClosureBody(SyntaxNode body) {
            return body.is("if_expression", "match_expression") || super.isExpandableClosureBody(body);
        }

        @Override
        protected boolean isClosure(SyntaxNode node) {
            return node.is("closure_expression");
        }

        @Override
        protected boolean isBlock(SyntaxNode node) {
            return node.is("block");
        }

        @Override
        protected boolean isIgnorable(SyntaxNode node) {
            return node.is("line_comment", "block_comment", "empty_statement", "label");
        }

        @Nullable
        private SyntaxNode firstExpression(SyntaxNode node) {
            return node.namedChildren().stream()
                    .filter(child -> !isIgnorable(child))
                    .findFirst()
                    .orElse(null);
        }

        @Nullable
        private static String jumpLabel(SyntaxNode node) {
            SyntaxNode label = node.firstNamedChildOfType("label");
            return label == null ? null : label.text();
        }
    }
}
