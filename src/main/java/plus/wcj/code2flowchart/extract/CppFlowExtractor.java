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

public class CppFlowExtractor extends AbstractFlowExtractor {

    @Override
    public SourceLanguage language() {
        return SourceLanguage.CPP;
    }

    @Override
    protected List<Callable> collectCallables(SyntaxNode root) {
        List<Callable> callables = new ArrayList<>();
        for (SyntaxNode node : root.descendantsOfType("function_definition", "init_declarator")) {
            if (node.is("function_definition")) {
                Callable function = functionOf(node);
                if (function != null) {
                    callables.add(function);
                }
                continue;
            }
            SyntaxNode value = node.childByFieldName("value");
            SyntaxNode declarator = node.childByFieldName("declarator");
            if (value != null && value.is("lambda_expression") && declarator != null) {
                callables.add(new Callable(CallableKind.LAMBDA, nameOf(declarator), node, value.childByFieldName("body")));
            }
        }
        return callables;
    }

    @Nullable
    private static Callable functionOf(SyntaxNode definition) {
        SyntaxNode declarator = definition.childByFieldName("declarator");
        SyntaxNode function = declarator == null ? null : functionDeclarator(declarator);
        if (function == null) {
            return null;
        }
        SyntaxNode nameNode = function.childByFieldName("declarator");
        if (nameNode == null) {
            return null;
        }
        boolean member = nameNode.is("qualified_identifier", "field_identifier", "destructor_name")
                || definition.ancestorOfType("field_declaration_list") != null;
        CallableKind kind = CallableKind.FUNCTION;
        if (member) {
            boolean destructor = nameOf(nameNode).startsWith("~");
            kind = definition.childByFieldName("type") == null && !destructor ? CallableKind.CONSTRUCTOR : CallableKind.METHOD;
        }
        return new Callable(kind, nameOf(nameNode), definition, definition.childByFieldName("body"));
    }

    @Nullable
    private static SyntaxNode functionDeclarator(SyntaxNode declarator) {
        SyntaxNode current = declarator;
        while (current != null && !current.is("function_declarator")) {
            SyntaxNode inner = current.childByFieldName("declarator");
            if (inner == null && current.is("reference_declarator", "parenthesized_declarator")) {
                inner = current.namedChildCount() > 0 ? current.namedChild(current.namedChildCount() - 1) : null;
            }
            current = inner;
        }
        return current;
    }

    /**
     * Plain name of a declarator: the last segment of a qualified name, without pointers or
     * references.
     */
    static String nameOf(SyntaxNode declarator) {
        SyntaxNode current = declarator;
        while (true) {
            switch (current.type()) {
                case "qualified_identifier", "template_function", "template_method" -> {
                    SyntaxNode name = current.childByFieldName("name");
                    if (name == null) {
                        return current.text();
                    }
                    current = name;
                }
                case "function_declarator", "pointer_declarator", "reference_declarator", "parenthesized_declarator" -> {
                    SyntaxNode inner = current.childByFieldName("declarator");
                    if (inner == null && current.namedChildCount() > 0) {
                        inner = current.namedChild(current.namedChildCount() - 1);
                    }
                    if (inner == null) {
                        return current.text();
                    }
                    current = inner;
                }
                default -> {
                    return LabelFormatter.squash(current.text());
                }
            }
        }
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
        protected void indexJumpLabels(SyntaxNode body) {
            for (SyntaxNode child : body.namedChildren()) {
                if (child.is("lambda_expression")) {
                    continue;
                }
                if (child.is("labeled_statement")) {
                    SyntaxNode label = child.childByFieldName("label");
                    if (label != null) {
                        ctx.reserveJumpLabel(label.text(), ctx.nextId("label"));
                    }
                }
                indexJumpLabels(child);
            }
        }

        @Override
        protected ProcessResult processStatement(SyntaxNode node, Scope scope) {
            return switch (node.type()) {
                case "compound_statement" -> processBlock(node, scope);
                case "expression_statement" -> node.namedChildCount() == 0
                        ? ProcessResult.empty()
                        : processStatement(node.namedChild(0), scope);
                case "declaration" -> handleDeclaration(node, scope);
                case "if_statement" -> handleIf(node, scope);
                case "while_statement" -> handleWhile(node, scope);
                case "do_statement" -> handleDoWhile(node, scope);
                case "for_statement" -> handleFor(node, scope);
                case "for_range_loop" -> handleRangeFor(node, scope);
                case "switch_statement" -> handleSwitch(node, scope);
                case "try_statement" -> handleTry(node, scope);
                case "return_statement" -> handleReturn(node, "return", firstExpression(node), scope);
                case "co_return_statement" -> handleReturn(node, "co_return", firstExpression(node), scope);
                case "throw_statement" -> handleTerminal(node, "throw", NodeType.EXCEPTION, node.text(), scope);
                case "break_statement" -> handleBreak(node, null, scope);
                case "continue_statement" -> handleContinue(node, null, scope);
                case "goto_statement" -> handleGoto(node);
                case "labeled_statement" -> handleLabeled(node, scope);
                case "call_expression" -> handleCallExpression(node, scope);
                case "assignment_expression" -> handleAssignment(node, scope);
                case "update_expression" -> handleLeaf(node, NodeType.ASSIGNMENT);
                case "co_await_expression" -> handleLeaf(node, NodeType.AWAIT);
                case "conditional_expression" -> handleTernary(node);
                case "parenthesized_expression" -> processStatement(unwrapParentheses(node), scope);
                case "type_definition", "alias_declaration", "using_declaration", "namespace_alias_definition",
                     "static_assert_declaration" -> ProcessResult.empty();
                default -> handleLeaf(node, NodeType.PROCESS);
            };
        }

        private ProcessResult handleDeclaration(SyntaxNode declaration, Scope scope) {
            SyntaxNode type = declaration.childByFieldName("type");
            String typeText = type == null ? "" : type.text() + " ";
            List<SyntaxNode> declarators = new ArrayList<>();
            for (SyntaxNode child : declaration.namedChildren()) {
                if (!child.equals(type) && !isIgnorable(child) && child.is("init_declarator", "identifier",
                        "pointer_declarator", "reference_declarator", "array_declarator")) {
                    declarators.add(child);
                }
            }
            if (declarators.size() <= 1) {
                SyntaxNode declarator = declarators.isEmpty() ? null : declarators.get(0);
                return bindDeclarator(declaration, declaration.text(), typeText, declarator, scope);
            }
            ProcessResult result = ProcessResult.empty();
            for (SyntaxNode declarator : declarators) {
                result = result.then(bindDeclarator(declarator, typeText + declarator.text(), typeText, declarator, scope));
            }
            return result;
        }

        private ProcessResult bindDeclarator(SyntaxNode source, String leafLabel, String typeText,
                                             @Nullable SyntaxNode declarator, Scope scope) {
            if (declarator == null || !declarator.is("init_declarator")) {
                return handleLeaf(source, NodeType.ASSIGNMENT, leafLabel);
            }
            SyntaxNode name = declarator.childByFieldName("declarator");
            String target = typeText + (name == null ? "?" : name.text());
            return handleBinding(source, leafLabel, target, declarator.childByFieldName("value"), scope);
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
            SyntaxNode condition = conditionValue(node.childByFieldName("condition"), node);
            SyntaxNode alternative = node.childByFieldName("alternative");
            if (alternative != null && alternative.is("else_clause")) {
                alternative = alternative.namedChildCount() == 0 ? null : alternative.namedChild(alternative.namedChildCount() - 1);
            }
            return handleIf(condition.text(), condition, node.childByFieldName("consequence"), alternative, scope);
        }

        private ProcessResult handleWhile(SyntaxNode node, Scope scope) {
            SyntaxNode condition = conditionValue(node.childByFieldName("condition"), node);
            return handlePreTestLoop(condition.text(), condition, node.childByFieldName("body"), List.of(),
                    Regions.TRUE, Regions.FALSE, scope);
        }

        private ProcessResult handleDoWhile(SyntaxNode node, Scope scope) {
            SyntaxNode condition = conditionValue(node.childByFieldName("condition"), node);
            return handlePostTestLoop(condition.text(), condition, node.childByFieldName("body"), scope);
        }

        private ProcessResult handleFor(SyntaxNode node, Scope scope) {
            SyntaxNode initializer = node.childByFieldName("initializer");
            SyntaxNode condition = node.childByFieldName("condition");
            SyntaxNode update = node.childByFieldName("update");
            SyntaxNode body = node.childByFieldName("body");
            List<SyntaxNode> updates = update == null ? List.of() : List.of(update);
            ProcessResult init = initializer == null ? ProcessResult.empty() : processStatement(initializer, scope.nested());
            ProcessResult loop = condition == null
                    ? handleUnconditionalLoop("for (;;)", node, body, updates, scope)
                    : handlePreTestLoop(condition.text(), condition, body, updates, Regions.TRUE, Regions.FALSE, scope);
            return init.then(loop);
        }

        private ProcessResult handleRangeFor(SyntaxNode node, Scope scope) {
            SyntaxNode type = node.childByFieldName("type");
            SyntaxNode declarator = node.childByFieldName("declarator");
            SyntaxNode range = node.childByFieldName("right");
            String header = "for (" + (type == null ? "" : type.text() + " ")
                    + (declarator == null ? "?" : declarator.text()) + " : "
                    + (range == null ? "?" : range.text()) + ")";
            return handlePreTestLoop(header, node, node.childByFieldName("body"), List.of(),
                    "next item", "no more items", scope);
        }

        private ProcessResult handleSwitch(SyntaxNode node, Scope scope) {
            SyntaxNode clause = node.childByFieldName("condition");
            SyntaxNode condition = conditionValue(clause, node);
            SyntaxNode body = node.childByFieldName("body");
            List<CaseSpec> cases = new ArrayList<>();
            if (body != null) {
                for (SyntaxNode child : body.namedChildren()) {
                    if (child.is("case_statement")) {
                        cases.add(caseOf(child));
                    }
                }
            }
            String head = "switch (" + LabelFormatter.squash(condition.text()) + ")";
            return handleCaseChain(head, condition, cases, true, true, scope);
        }

        private CaseSpec caseOf(SyntaxNode caseStatement) {
            SyntaxNode value = caseStatement.childByFieldName("value");
            List<SyntaxNode> statements = new ArrayList<>();
            for (SyntaxNode child : caseStatement.namedChildren()) {
                if (!child.equals(value) && !isIgnorable(child)) {
                    statements.add(child);
                }
            }
            return new CaseSpec(caseStatement, value == null ? "default" : "case " + value.text(), statements);
        }

        private ProcessResult handleTry(SyntaxNode node, Scope scope) {
            List<HandlerSpec> handlers = new ArrayList<>();
            for (SyntaxNode child : node.namedChildren()) {
                if (child.is("catch_clause")) {
                    handlers.add(new HandlerSpec("catch " + caughtType(child.childByFieldName("parameters")),
                            child.childByFieldName("body")));
                }
            }
            return handleTry("try", node, node.childByFieldName("body"), handlers, null, scope);
        }

        private static String caughtType(@Nullable SyntaxNode parameters) {
            if (parameters == null) {
                return "...";
            }
            SyntaxNode parameter = parameters.firstNamedChildOfType("parameter_declaration", "optional_parameter_declaration");
            SyntaxNode type = parameter == null ? null : parameter.childByFieldName("type");
            if (type != null) {
                return type.text();
            }
            String text = LabelFormatter.squash(parameters.text());
            if (text.startsWith("(") && text.endsWith(")")) {
                text = text.substring(1, text.length() - 1).trim();
            }
            return text;
        }

        private ProcessResult handleGoto(SyntaxNode node) {
            SyntaxNode label = node.childByFieldName("label");
            return handleGoto(node, label == null ? "" : label.text());
        }

        private ProcessResult handleLabeled(SyntaxNode node, Scope scope) {
            SyntaxNode label = node.childByFieldName("label");
            SyntaxNode statement = null;
            for (SyntaxNode child : node.namedChildren()) {
                if (!child.equals(label) && !isIgnorable(child)) {
                    statement = child;
                }
            }
            return handleLabeledStatement(node, label == null ? "" : label.text(), statement, scope);
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

        private ProcessResult handleTernary(SyntaxNode node) {
            Conditional conditional = conditional(node);
            if (conditional == null) {
                return handleLeaf(node, NodeType.PROCESS);
            }
            return handleConditional(conditional, arm -> handleLeaf(arm, NodeType.PROCESS));
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
                SyntaxNode receiver = function.childByFieldName("argument");
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
            if (receiver.is("identifier", "this", "field_identifier", "qualified_identifier")) {
                return true;
            }
            if (receiver.is("field_expression")) {
                SyntaxNode argument = receiver.childByFieldName("argument");
                return argument != null && isSimpleReceiver(argument);
            }
            return false;
        }

        @Override
        @Nullable
        protected Conditional conditional(SyntaxNode expr) {
            if (!expr.is("conditional_expression")) {
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
            return node.is("compound_statement");
        }

        @Override
        protected boolean isIgnorable(SyntaxNode node) {
            return node.is("comment", ";");
        }

        /**
         * The tested expression of a condition clause or parenthesized condition.
         */
        private SyntaxNode conditionValue(@Nullable SyntaxNode clause, SyntaxNode fallback) {
            if (clause == null) {
                return fallback;
            }
            if (clause.is("condition_clause")) {
                SyntaxNode value = clause.childByFieldName("value");
                if (value == null && clause.namedChildCount() == 1) {
                    value = clause.namedChild(0);
                }
                if (value != null && clause.childByFieldName("initializer") == null) {
                    return value;
                }
                return clause;
            }
            return unwrapParentheses(clause);
        }

        @Nullable
        private SyntaxNode firstExpression(SyntaxNode node) {
            return node.namedChildren().stream().filter(child -> !isIgnorable(child)).findFirst().orElse(null);
        }
    }
}
