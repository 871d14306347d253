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
import plus.wcj.code2flowchart.ir.NodeType;
import plus.wcj.code2flowchart.syntax.SourceLanguage;
import plus.wcj.code2flowchart.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

public class JavaFlowExtractor extends AbstractFlowExtractor {

    @Override
    public SourceLanguage language() {
        return SourceLanguage.JAVA;
    }

    @Override
    protected List<Callable> collectCallables(SyntaxNode root) {
        List<Callable> callables = new ArrayList<>();
        for (SyntaxNode node : root.descendantsOfType("method_declaration", "constructor_declaration",
                "compact_constructor_declaration", "variable_declarator")) {
            SyntaxNode name = node.childByFieldName("name");
            if (name == null) {
                continue;
            }
            switch (node.type()) {
                case "method_declaration" ->
                        callables.add(new Callable(CallableKind.METHOD, name.text(), node, node.childByFieldName("body")));
                case "constructor_declaration", "compact_constructor_declaration" ->
                        callables.add(new Callable(CallableKind.CONSTRUCTOR, name.text(), node, node.childByFieldName("body")));
                default -> {
                    SyntaxNode value = node.childByFieldName("value");
                    if (value != null && value.is("lambda_expression")) {
                        callables.add(new Callable(CallableKind.LAMBDA, name.text(), node, value.childByFieldName("body")));
                    }
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
        protected ProcessResult processStatement(SyntaxNode node, Scope scope) {
            return switch (node.type()) {
                case "block" -> processBlock(node, scope);
                case "expression_statement" -> node.namedChildCount() == 0
                        ? ProcessResult.empty()
                        : processStatement(node.namedChild(0), scope);
                case "local_variable_declaration", "field_declaration" -> handleDeclaration(node, scope);
                case "if_statement" -> handleIf(node, scope);
                case "while_statement" -> handleWhile(node, scope);
                case "do_statement" -> handleDoWhile(node, scope);
                case "for_statement" -> handleFor(node, scope);
                case "enhanced_for_statement" -> handleForeach(node, scope);
                case "switch_expression", "switch_statement" -> handleSwitch(node, scope);
                case "try_statement", "try_with_resources_statement" -> handleTry(node, scope);
                case "return_statement" -> handleReturn(node, "return", firstExpression(node), scope);
                case "throw_statement" -> handleTerminal(node, "throw", NodeType.EXCEPTION, node.text(), scope);
                case "break_statement" -> handleBreak(node, jumpLabel(node), scope);
                case "continue_statement" -> handleContinue(node, jumpLabel(node), scope);
                case "labeled_statement" -> handleLabeled(node, scope);
                case "synchronized_statement" -> handleSynchronized(node, scope);
                case "method_invocation" -> handleInvocation(node, scope);
                case "object_creation_expression", "explicit_constructor_invocation" ->
                        handleCall(node, NodeType.FUNCTION_CALL, node.childByFieldName("arguments"));
                case "assignment_expression" -> handleAssignment(node, scope);
                case "update_expression" -> handleLeaf(node, NodeType.ASSIGNMENT);
                case "ternary_expression" -> handleTernary(node);
                case "parenthesized_expression" -> processStatement(unwrapParentheses(node), scope);
                case "class_declaration", "record_declaration", "interface_declaration", "enum_declaration",
                     "local_class_declaration" -> ProcessResult.empty();
                default -> handleLeaf(node, NodeType.PROCESS);
            };
        }

        private ProcessResult handleDeclaration(SyntaxNode declaration, Scope scope) {
            SyntaxNode type = declaration.childByFieldName("type");
            String typeText = type == null ? "" : type.text() + " ";
            List<SyntaxNode> declarators = declaration.namedChildren().stream()
                    .filter(child -> child.is("variable_declarator"))
                    .toList();
            if (declarators.size() == 1) {
                SyntaxNode declarator = declarators.get(0);
                return handleBinding(declaration, declaration.text(), typeText + nameOf(declarator),
                        declarator.childByFieldName("value"), scope);
            }
            ProcessResult result = ProcessResult.empty();
            for (SyntaxNode declarator : declarators) {
                result = result.then(handleBinding(declarator, typeText + declarator.text(), typeText + nameOf(declarator),
                        declarator.childByFieldName("value"), scope));
            }
            return result;
        }

        private ProcessResult handleAssignment(SyntaxNode assignment, Scope scope) {
            SyntaxNode left = assignment.childByFieldName("left");
            SyntaxNode operator = assignment.childByFieldName("operator");
            if (left == null || operator == null || !"=".equals(operator.text())) {
                return handleLeaf(assignment, NodeType.ASSIGNMENT);
            }
            return handleBinding(assignment, assignment.text(), left.text(), assignment.childByFieldName("right"), scope);
        }

        private ProcessResult handleIf(SyntaxNode node, Scope scope) {
            SyntaxNode condition = condition(node);
            return handleIf(condition.text(), condition,
                    node.childByFieldName("consequence"), node.childByFieldName("alternative"), scope);
        }

        private ProcessResult handleWhile(SyntaxNode node, Scope scope) {
            SyntaxNode condition = condition(node);
            return handlePreTestLoop(condition.text(), condition, node.childByFieldName("body"), List.of(),
                    Regions.TRUE, Regions.FALSE, scope);
        }

        private ProcessResult handleDoWhile(SyntaxNode node, Scope scope) {
            SyntaxNode condition = condition(node);
            return handlePostTestLoop(condition.text(), condition, node.childByFieldName("body"), scope);
        }

        private ProcessResult handleFor(SyntaxNode node, Scope scope) {
            SyntaxNode condition = node.childByFieldName("condition");
            SyntaxNode body = node.childByFieldName("body");
            List<SyntaxNode> init = new ArrayList<>();
            List<SyntaxNode> updates = new ArrayList<>();
            int semicolons = 0;
            for (SyntaxNode child : node.children()) {
                if (child.is(";")) {
                    semicolons++;
                } else if (child.isNamed() && !child.equals(body) && !child.equals(condition) && !isIgnorable(child)) {
                    if (semicolons == 0) {
                        init.add(child);
                        // a declaration carries its own semicolon
                        if (child.is("local_variable_declaration")) {
                            semicolons++;
                        }
                    } else if (semicolons >= 2) {
                        updates.add(child);
                    }
                }
            }
            ProcessResult initRegion = processStatements(init, scope.nested());
            ProcessResult loop = condition == null
                    ? handleUnconditionalLoop("for (;;)", node, body, updates, scope)
                    : handlePreTestLoop(condition.text(), condition, body, updates, Regions.TRUE, Regions.FALSE, scope);
            return initRegion.then(loop);
        }

        private ProcessResult handleForeach(SyntaxNode node, Scope scope) {
            SyntaxNode name = node.childByFieldName("name");
            SyntaxNode value = node.childByFieldName("value");
            String header = "for (" + (name == null ? "?" : name.text()) + " : " + (value == null ? "?" : value.text()) + ")";
            return handlePreTestLoop(header, node, node.childByFieldName("body"), List.of(),
                    "next item", "no more items", scope);
        }

        private ProcessResult handleSwitch(SyntaxNode node, Scope scope) {
            SyntaxNode condition = node.childByFieldName("condition");
            SyntaxNode body = node.childByFieldName("body");
            List<CaseSpec> cases = new ArrayList<>();
            boolean fallthrough = false;
            if (body != null) {
                for (SyntaxNode child : body.namedChildren()) {
                    if (child.is("switch_block_statement_group")) {
                        fallthrough = true;
                        cases.add(caseOf(child));
                    } else if (child.is("switch_rule")) {
                        cases.add(caseOf(child));
                    }
                }
            }
            String head = "switch " + (condition == null ? "(?)" : condition.text());
            return handleCaseChain(head, condition == null ? node : condition, cases, fallthrough, true, scope);
        }

        private CaseSpec caseOf(SyntaxNode group) {
            List<String> labels = new ArrayList<>();
            List<SyntaxNode> statements = new ArrayList<>();
            for (SyntaxNode child : group.namedChildren()) {
                if (child.is("switch_label")) {
                    labels.add(LabelFormatter.squash(child.text()));
                } else if (child.is("block") && group.is("switch_rule")) {
                    statements.addAll(statementsOf(child));
                } else if (!isIgnorable(child)) {
                    statements.add(child);
                }
            }
            return new CaseSpec(group, String.join(", ", labels), statements);
        }

        private ProcessResult handleTry(SyntaxNode node, Scope scope) {
            SyntaxNode resources = node.childByFieldName("resources");
            String entryLabel = resources == null ? "try" : "try " + resources.text();
            List<HandlerSpec> handlers = new ArrayList<>();
            SyntaxNode cleanup = null;
            for (SyntaxNode child : node.namedChildren()) {
                if (child.is("catch_clause")) {
                    SyntaxNode parameter = child.firstNamedChildOfType("catch_formal_parameter");
                    SyntaxNode type = parameter == null ? null : parameter.firstNamedChildOfType("catch_type");
                    handlers.add(new HandlerSpec("catch " + (type == null ? "" : LabelFormatter.squash(type.text())),
                            child.childByFieldName("body")));
                } else if (child.is("finally_clause")) {
                    cleanup = child.firstNamedChildOfType("block");
                }
            }
            return handleTry(entryLabel, node, node.childByFieldName("body"), handlers, cleanup, scope);
        }

        private ProcessResult handleLabeled(SyntaxNode node, Scope scope) {
            SyntaxNode label = node.firstNamedChildOfType("identifier");
            SyntaxNode statement = null;
            for (SyntaxNode child : node.namedChildren()) {
                if (!child.is("identifier") && !isIgnorable(child)) {
                    statement = child;
                }
            }
            if (statement == null) {
                return ProcessResult.empty();
            }
            return processStatement(statement, label == null ? scope : scope.withPendingLabel(label.text()));
        }

        private ProcessResult handleSynchronized(SyntaxNode node, Scope scope) {
            SyntaxNode lock = node.firstNamedChildOfType("parenthesized_expression");
            String label = "synchronized " + (lock == null ? "" : lock.text());
            return handleLeaf(lock == null ? node : lock, NodeType.PROCESS, label)
                    .then(processBody(node.childByFieldName("body"), scope.nested()));
        }

        private ProcessResult handleTernary(SyntaxNode node) {
            Conditional conditional = conditional(node);
            if (conditional == null) {
                return handleLeaf(node, NodeType.PROCESS);
            }
            return handleConditional(conditional, arm -> handleLeaf(arm, NodeType.PROCESS));
        }

        private ProcessResult handleInvocation(SyntaxNode node, Scope scope) {
            MethodChain chain = methodChain(node);
            if (chain != null && isCompoundChain(chain)) {
                return handleMethodChain(chain, scope);
            }
            NodeType type = node.childByFieldName("object") == null ? NodeType.FUNCTION_CALL : NodeType.METHOD_CALL;
            return handleCall(node, type, node.childByFieldName("arguments"));
        }

        @Override
        @Nullable
        protected MethodChain methodChain(SyntaxNode expr) {
            List<ChainCall> calls = new ArrayList<>();
            SyntaxNode current = expr;
            while (current.is("method_invocation") && current.childByFieldName("object") != null) {
                SyntaxNode name = current.childByFieldName("name");
                calls.add(0, new ChainCall(current, name == null ? "?" : name.text(), current.childByFieldName("arguments")));
                current = current.childByFieldName("object");
            }
            return calls.isEmpty() ? null : new MethodChain(current, calls);
        }

        @Override
        protected boolean isSimpleReceiver(SyntaxNode receiver) {
            if (receiver.is("identifier", "this", "super", "type_identifier", "scoped_identifier")) {
                return true;
            }
            if (receiver.is("field_access")) {
                SyntaxNode object = receiver.childByFieldName("object");
                return object != null && isSimpleReceiver(object);
            }
            return false;
        }

        @Override
        protected boolean isCompoundValue(SyntaxNode value) {
            return value.is("switch_expression") || super.isCompoundValue(value);
        }

        @Override
        @Nullable
        protected Conditional conditional(SyntaxNode expr) {
            if (!expr.is("ternary_expression")) {
                return null;
            }
            SyntaxNode condition = expr.childByFieldName("condition");
            SyntaxNode consequence = expr.childByFieldName("consequence");
            SyntaxNode alternative = expr.childByFieldName("alternative");
            if (condition == null || consequence == null || alternative == null) {
                return null;
            }
            return new Conditional(condition, consequence, alternative);
        }

        @Override
        protected boolean isClosure(SyntaxNode node) {
            return node.is("lambda_expression");
        }

        @Override
        protected String closureWord() {
            return "lambda";
        }

        @Override
        protected boolean isBlock(SyntaxNode node) {
            return node.is("block", "constructor_body");
        }

        @Override
        protected boolean isIgnorable(SyntaxNode node) {
            return node.is("line_comment", "block_comment", ";");
        }

        /**
         * The condition without its parentheses, or the statement itself when it has none.
         */
        private SyntaxNode condition(SyntaxNode node) {
            SyntaxNode condition = node.childByFieldName("condition");
            return condition == null ? node : unwrapParentheses(condition);
        }

        @Nullable
        private SyntaxNode firstExpression(SyntaxNode node) {
            return node.namedChildren().stream().filter(child -> !isIgnorable(child)).findFirst().orElse(null);
        }

        @Nullable
        private static String jumpLabel(SyntaxNode node) {
            SyntaxNode label = node.firstNamedChildOfType("identifier");
            return label == null ? null : label.text();
        }

        private static String nameOf(SyntaxNode declarator) {
            SyntaxNode name = declarator.childByFieldName("name");
            return name == null ? declarator.text() : name.text();
        }
    }
}
