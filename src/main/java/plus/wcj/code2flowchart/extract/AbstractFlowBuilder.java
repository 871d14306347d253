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
import plus.wcj.code2flowchart.ir.Node;
import plus.wcj.code2flowchart.ir.NodeType;
import plus.wcj.code2flowchart.syntax.SyntaxNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Statement builder shared by the language front-ends. One instance builds one chart.
 * <p>
 * Subclasses own the dispatch from syntax kinds to the {@code handle*} methods here, which in
 * turn compose regions through {@link Regions}. Nothing in this class knows a grammar; the
 * hooks near the bottom tell it what a block, a conditional or a closure looks like.
 */
public abstract class AbstractFlowBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractFlowBuilder.class);

    protected static final String BREAK = "break";
    protected static final String CONTINUE = "continue";
    protected static final String RESULT = "<result>";

    protected final BuildContext ctx;

    protected AbstractFlowBuilder(BuildContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    public ProcessResult buildCallable(Callable callable, Scope scope) {
        SyntaxNode body = callable.body();
        if (body == null) {
            return ProcessResult.empty();
        }
        indexJumpLabels(body);
        return processCallableBody(callable, body, scope);
    }

    protected ProcessResult processCallableBody(Callable callable, SyntaxNode body, Scope scope) {
        if (isBlock(body)) {
            return processBlock(body, isTailBlock(callable) ? scope.inTail() : scope);
        }
        return processTailStatement(body, scope.inTail());
    }

    /**
     * Reserves node ids for statement labels before the body is built, so that a forward
     * {@code goto} can be wired. Labels inside nested closures belong to those closures.
     */
    protected void indexJumpLabels(SyntaxNode body) {
    }

    /**
     * Dispatches one statement (or expression used as a statement) to its handler.
     */
    protected abstract ProcessResult processStatement(SyntaxNode node, Scope scope);

    /**
     * Block, single statement or missing body.
     */
    protected ProcessResult processBody(@Nullable SyntaxNode body, Scope scope) {
        if (body == null) {
            return ProcessResult.empty();
        }
        if (isBlock(body)) {
            return processBlock(body, scope);
        }
        return processStatements(List.of(body), scope);
    }

    protected ProcessResult processBlock(SyntaxNode block, Scope scope) {
        return processStatements(statementsOf(block), scope);
    }

    protected ProcessResult processStatements(List<SyntaxNode> statements, Scope scope) {
        List<SyntaxNode> relevant = statements.stream().filter(s -> !isIgnorable(s)).toList();
        ProcessResult result = ProcessResult.empty();
        int last = relevant.size() - 1;
        for (int i = 0; i <= last; i++) {
            SyntaxNode statement = relevant.get(i);
            ProcessResult region = scope.tail() && i == last && isTailExpression(statement)
                    ? processTailStatement(statement, scope)
                    : processStatement(statement, scope.nested());
            result = result.then(region);
        }
        return result;
    }

    /**
     * Builds a statement whose value is the result of the callable and wires whatever is left
     * dangling to the terminal target.
     */
    protected ProcessResult processTailStatement(SyntaxNode statement, Scope scope) {
        SyntaxNode expr = unwrapParentheses(unwrapTail(statement));
        Conditional conditional = conditional(expr);
        ProcessResult region;
        if (conditional != null) {
            Node decision = ctx.node("if", NodeType.DECISION, conditional.condition().text(), conditional.condition());
            region = Regions.branch(decision,
                    processTailStatement(conditional.consequence(), scope),
                    processTailStatement(conditional.alternative(), scope));
        } else {
            region = processStatement(expr, scope.inTail().arm());
        }
        return Regions.implicitReturn(region, scope.terminalTarget());
    }

    // ---------------------------------------------------------------- branching

    protected ProcessResult handleIf(String conditionLabel, SyntaxNode conditionSource,
                                     @Nullable SyntaxNode consequence, @Nullable SyntaxNode alternative,
                                     Scope scope) {
        Node decision = ctx.node("if", NodeType.DECISION, conditionLabel, conditionSource);
        Scope arm = scope.arm();
        ProcessResult then = processBody(consequence, arm);
        ProcessResult otherwise = alternative == null ? null : processBody(alternative, arm);
        return Regions.branch(decision, then, otherwise);
    }

    /**
     * Expands a conditional expression into a decision whose arms are built by {@code arm}.
     * Nested conditionals in either arm expand as well.
     */
    protected ProcessResult handleConditional(Conditional conditional, Function<SyntaxNode, ProcessResult> arm) {
        Node decision = ctx.node("if", NodeType.DECISION, conditional.condition().text(), conditional.condition());
        return Regions.branch(decision,
                expandArm(conditional.consequence(), arm),
                expandArm(conditional.alternative(), arm));
    }

    private ProcessResult expandArm(SyntaxNode value, Function<SyntaxNode, ProcessResult> arm) {
        SyntaxNode unwrapped = unwrapParentheses(value);
        Conditional nested = conditional(unwrapped);
        return nested == null ? arm.apply(unwrapped) : handleConditional(nested, arm);
    }

    public record CaseSpec(SyntaxNode source, String label, List<SyntaxNode> statements) {
        public CaseSpec {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(label, "label");
            statements = List.copyOf(statements);
        }
    }

    /**
     * switch and match.
     *
     * @param fallthrough a body that completes normally runs into the next case
     * @param breakable   {@code break} inside a case leaves the construct
     */
    protected ProcessResult handleCaseChain(String headLabel, SyntaxNode headSource, List<CaseSpec> cases,
                                            boolean fallthrough, boolean breakable, Scope scope) {
        Node head = ctx.node("switch", caseHeadType(), headLabel, headSource);
        String endId = breakable ? ctx.nextId("switch_end") : null;
        Scope caseScope = breakable
                ? scope.withLoop(LoopContext.switchBlock(endId, scope.loop()))
                : scope.arm();
        List<Regions.Case> built = new ArrayList<>(cases.size());
        for (CaseSpec spec : cases) {
            Node decision = ctx.node("case", NodeType.DECISION, spec.label(), spec.source());
            built.add(new Regions.Case(decision, processStatements(spec.statements(), caseScope)));
        }
        ProcessResult region = Regions.caseChain(head, built, fallthrough);
        if (endId == null) {
            return region;
        }
        return Regions.withSentinelIfTargeted(region, ctx.reservedSentinel(endId, NodeType.PROCESS, "end switch"));
    }

    // ---------------------------------------------------------------- loops

    /**
     * while, classic for and for-each.
     *
     * @param updates expressions run after the body; the first one is the continue target
     */
    protected ProcessResult handlePreTestLoop(String headerLabel, SyntaxNode headerSource,
                                              @Nullable SyntaxNode body, List<SyntaxNode> updates,
                                              String enterLabel, String exitLabel, Scope scope) {
        Node header = ctx.node("loop", NodeType.LOOP_START, headerLabel, headerSource);
        Node loopExit = loopExit();
        ProcessResult update = ProcessResult.empty();
        for (SyntaxNode expr : updates) {
            update = update.then(processStatement(expr, scope.nested()));
        }
        String continueTarget = update.isEmpty() ? header.id() : update.entryNodeId();
        ProcessResult bodyRegion = processBody(body,
                scope.withLoop(LoopContext.loop(loopExit.id(), continueTarget, scope.pendingLabel(), scope.loop())));
        return Regions.preTestLoop(header, loopExit, bodyRegion, update, enterLabel, exitLabel);
    }

    /**
     * do/while: the test node is the continue target.
     */
    protected ProcessResult handlePostTestLoop(String testLabel, SyntaxNode testSource,
                                               @Nullable SyntaxNode body, Scope scope) {
        Node test = ctx.node("loop", NodeType.LOOP_START, testLabel, testSource);
        Node loopExit = loopExit();
        ProcessResult bodyRegion = processBody(body,
                scope.withLoop(LoopContext.loop(loopExit.id(), test.id(), scope.pendingLabel(), scope.loop())));
        return Regions.postTestLoop(test, loopExit, bodyRegion, Regions.TRUE, Regions.FALSE);
    }

    /**
     * Loop without a test. {@code updates} run after each iteration, as in {@code for (;; i++)}.
     */
    protected ProcessResult handleUnconditionalLoop(String headerLabel, SyntaxNode headerSource,
                                                    @Nullable SyntaxNode body, List<SyntaxNode> updates,
                                                    Scope scope) {
        Node header = ctx.node("loop", NodeType.LOOP_START, headerLabel, headerSource);
        Node loopExit = loopExit();
        ProcessResult update = ProcessResult.empty();
        for (SyntaxNode expr : updates) {
            update = update.then(processStatement(expr, scope.nested()));
        }
        String continueTarget = update.isEmpty() ? header.id() : update.entryNodeId();
        ProcessResult bodyRegion = processBody(body,
                scope.withLoop(LoopContext.loop(loopExit.id(), continueTarget, scope.pendingLabel(), scope.loop())));
        return Regions.unconditionalLoop(header, loopExit, bodyRegion.then(update));
    }

    private Node loopExit() {
        return ctx.sentinel("loop_end", NodeType.LOOP_END, "end loop");
    }

    // ---------------------------------------------------------------- exceptions

    public record HandlerSpec(String label, @Nullable SyntaxNode body) {
        public HandlerSpec {
            Objects.requireNonNull(label, "label");
        }
    }

    /**
     * try/catch/finally. The cleanup is built first, in the enclosing scope; everything inside the
     * protected body and the handlers then sees it as its terminal target, and the cleanup passes
     * abrupt completions on to the enclosing terminal target.
     */
    protected ProcessResult handleTry(String entryLabel, SyntaxNode source, @Nullable SyntaxNode body,
                                      List<HandlerSpec> handlers, @Nullable SyntaxNode cleanupBody, Scope scope) {
        Node cleanupEntry = null;
        ProcessResult cleanup = null;
        Scope inner = scope.nested();
        if (cleanupBody != null) {
            cleanup = processBody(cleanupBody, scope.nested());
            cleanupEntry = ctx.sentinel("finally", NodeType.EXCEPTION, "finally");
            inner = scope.withCleanup(new FinallyContext(cleanupEntry.id()));
        }
        Node tryEntry = ctx.node("try", NodeType.EXCEPTION, entryLabel, source);
        ProcessResult bodyRegion = processBody(body, inner);
        List<Regions.Handler> built = new ArrayList<>(handlers.size());
        for (HandlerSpec handler : handlers) {
            built.add(new Regions.Handler(handler.label(), processBody(handler.body(), inner)));
        }
        return Regions.protectedRegion(tryEntry, bodyRegion, built, cleanupEntry, cleanup, scope.terminalTarget());
    }

    protected ProcessResult handleErrorPropagation(SyntaxNode node, Scope scope) {
        Node check = ctx.node("try_op", NodeType.EARLY_RETURN_ERROR, node.text(), node);
        return Regions.errorPropagation(check, scope.terminalTarget());
    }

    // ---------------------------------------------------------------- jumps

    /**
     * return, throw and panic: one edge to the terminal target, nothing falls through.
     */
    protected ProcessResult handleTerminal(SyntaxNode node, String prefix, NodeType type, String label, Scope scope) {
        return Regions.terminal(ctx.node(prefix, type, label, node), scope.terminalTarget());
    }

    /**
     * return statement; a conditional return value becomes a decision with one return per arm.
     */
    protected ProcessResult handleReturn(SyntaxNode node, String keyword, @Nullable SyntaxNode value, Scope scope) {
        if (value == null) {
            return handleTerminal(node, "return", NodeType.RETURN, keyword, scope);
        }
        SyntaxNode unwrapped = unwrapParentheses(value);
        Conditional conditional = conditional(unwrapped);
        if (conditional != null) {
            return handleConditional(conditional,
                    arm -> handleTerminal(arm, "return", NodeType.RETURN, keyword + " " + arm.text(), scope));
        }
        return handleTerminal(node, "return", NodeType.RETURN, keyword + " " + unwrapped.text(), scope);
    }

    protected ProcessResult handleBreak(SyntaxNode node, @Nullable String label, Scope scope) {
        Node jump = ctx.node(BREAK, NodeType.BREAK_CONTINUE, node.text(), node);
        LoopContext target = scope.loop() == null ? null : scope.loop().resolve(label);
        if (target == null) {
            LOG.warn("break outside loop at {}", LabelFormatter.squash(node.text()));
            return ProcessResult.of(jump);
        }
        return Regions.jump(jump, target.breakTargetId(), BREAK);
    }

    protected ProcessResult handleContinue(SyntaxNode node, @Nullable String label, Scope scope) {
        Node jump = ctx.node(CONTINUE, NodeType.BREAK_CONTINUE, node.text(), node);
        LoopContext target = scope.loop() == null ? null : scope.loop().resolve(label);
        if (target == null || target.continueTargetId() == null) {
            LOG.warn("continue outside loop at {}", LabelFormatter.squash(node.text()));
            return ProcessResult.of(jump);
        }
        return Regions.jump(jump, target.continueTargetId(), CONTINUE);
    }

    protected ProcessResult handleGoto(SyntaxNode node, String label) {
        Node jump = ctx.node("goto", NodeType.BREAK_CONTINUE, node.text(), node);
        String target = ctx.jumpLabel(label);
        if (target == null) {
            LOG.warn("goto to unknown label {}", label);
            return ProcessResult.of(jump);
        }
        return Regions.jump(jump, target, "");
    }

    /**
     * A statement label that a goto can target, followed by the statement it labels.
     */
    protected ProcessResult handleLabeledStatement(SyntaxNode node, String label, @Nullable SyntaxNode statement,
                                                   Scope scope) {
        String id = ctx.jumpLabel(label);
        if (id == null) {
            id = ctx.nextId("label");
        }
        Node target = ctx.node(id, NodeType.PROCESS, LabelFormatter.escape(label) + ":", node, false);
        ProcessResult labelled = statement == null ? ProcessResult.empty() : processStatement(statement, scope.nested());
        return ProcessResult.of(target).then(labelled);
    }

    // ---------------------------------------------------------------- calls and values

    protected ProcessResult handleLeaf(SyntaxNode node, NodeType type) {
        return handleLeaf(node, type, node.text());
    }

    protected ProcessResult handleLeaf(SyntaxNode node, NodeType type, String label) {
        return ProcessResult.of(ctx.node(prefixOf(type), type, label, node));
    }

    /**
     * A call node with its closure arguments hanging off it.
     */
    protected ProcessResult handleCall(SyntaxNode call, NodeType type, @Nullable SyntaxNode arguments) {
        Node node = ctx.node("call", type, call.text(), call);
        return attachClosureArguments(ProcessResult.of(node), node, arguments);
    }

    public record ChainCall(SyntaxNode call, String name, @Nullable SyntaxNode arguments) {
        public ChainCall {
            Objects.requireNonNull(call, "call");
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * {@code root.first(..).second(..)}; calls are listed in evaluation order.
     */
    public record MethodChain(SyntaxNode root, List<ChainCall> calls) {
        public MethodChain {
            Objects.requireNonNull(root, "root");
            calls = List.copyOf(calls);
            if (calls.isEmpty()) {
                throw new IllegalArgumentException("a method chain needs at least one call");
            }
        }
    }

    protected ProcessResult handleMethodChain(MethodChain chain, Scope scope) {
        ProcessResult result = ProcessResult.empty();
        String receiver = "";
        if (isSimpleReceiver(chain.root())) {
            receiver = chain.root().text();
        } else {
            result = processStatement(chain.root(), scope.nested());
        }
        for (ChainCall call : chain.calls()) {
            String label = receiver + "." + call.name() + "(" + argumentsLabel(call.arguments()) + ")";
            receiver = "";
            Node node = ctx.node("call", NodeType.METHOD_CALL, label, call.call());
            result = result.then(attachClosureArguments(ProcessResult.of(node), node, call.arguments()));
        }
        return result;
    }

    /**
     * A chain worth drawing call by call rather than as one statement node.
     */
    protected boolean isCompoundChain(MethodChain chain) {
        if (chain.calls().size() > 1 || !isSimpleReceiver(chain.root())) {
            return true;
        }
        return hasExpandableClosure(chain.calls().get(0).arguments());
    }

    private String argumentsLabel(@Nullable SyntaxNode arguments) {
        if (arguments == null) {
            return "";
        }
        String text = LabelFormatter.squash(arguments.text());
        if (text.startsWith("(") && text.endsWith(")")) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return LabelFormatter.truncate(text, ctx.options().argumentLabelMaxLength());
    }

    /**
     * {@code target = value}: conditional values become a decision with one assignment per arm,
     * compound values are built first and bound as {@code target = <result>}, anything else is
     * one assignment node labelled {@code leafLabel}.
     */
    protected ProcessResult handleBinding(SyntaxNode source, String leafLabel, String target,
                                          @Nullable SyntaxNode value, Scope scope) {
        if (value == null) {
            return handleLeaf(source, NodeType.ASSIGNMENT, leafLabel);
        }
        SyntaxNode unwrapped = unwrapParentheses(value);
        Conditional conditional = conditional(unwrapped);
        if (conditional != null) {
            return handleConditional(conditional,
                    arm -> handleLeaf(arm, NodeType.ASSIGNMENT, target + " = " + arm.text()));
        }
        if (isCompoundValue(unwrapped)) {
            ProcessResult valueRegion = processStatement(unwrapped, scope.nested());
            Node bind = ctx.node("assign", NodeType.ASSIGNMENT, target + " = " + RESULT, source);
            return valueRegion.then(ProcessResult.of(bind));
        }
        return handleLeaf(source, NodeType.ASSIGNMENT, leafLabel);
    }

    // ---------------------------------------------------------------- closures

    protected ProcessResult attachClosureArguments(ProcessResult anchor, Node call, @Nullable SyntaxNode arguments) {
        if (arguments == null || !ctx.options().expandClosureArguments()) {
            return anchor;
        }
        ProcessResult result = anchor;
        int position = 0;
        for (SyntaxNode argument : arguments.namedChildren()) {
            if (isIgnorable(argument)) {
                continue;
            }
            position++;
            SyntaxNode body = isClosure(argument) ? closureBody(argument) : null;
            if (body != null && isExpandableClosureBody(body)) {
                result = Regions.attachSideRegion(result, call.id(), buildClosure(argument, body), "arg " + position);
            }
        }
        return result;
    }

    private boolean hasExpandableClosure(@Nullable SyntaxNode arguments) {
        if (arguments == null || !ctx.options().expandClosureArguments()) {
            return false;
        }
        for (SyntaxNode argument : arguments.namedChildren()) {
            SyntaxNode body = isClosure(argument) ? closureBody(argument) : null;
            if (body != null && isExpandableClosureBody(body)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A closure as its own sub-chart: a header, the body, and an end node that exists only if
     * some path reaches it. Loop and finally contexts and statement labels of the enclosing
     * function do not apply.
     */
    private ProcessResult buildClosure(SyntaxNode closure, SyntaxNode body) {
        Node header = ctx.node("closure", NodeType.SUBROUTINE, closureWord() + " " + closureHead(closure, body), closure);
        String endId = ctx.nextId("closure_end");
        Scope scope = Scope.root(endId);
        ProcessResult bodyRegion;
        ctx.enterJumpLabelScope();
        try {
            indexJumpLabels(body);
            bodyRegion = isBlock(body)
                    ? processBlock(body, isTailClosureBlock() ? scope.inTail() : scope)
                    : processTailStatement(body, scope.inTail());
        } finally {
            ctx.exitJumpLabelScope();
        }
        ProcessResult closureRegion = Regions.implicitReturn(ProcessResult.of(header).then(bodyRegion), endId);
        return Regions.withSentinelIfTargeted(closureRegion,
                ctx.reservedSentinel(endId, NodeType.PROCESS, "end " + closureWord()));
    }

    private static String closureHead(SyntaxNode closure, SyntaxNode body) {
        byte[] bytes = closure.text().getBytes(StandardCharsets.UTF_8);
        int length = Math.max(0, Math.min(bytes.length, body.startByte() - closure.startByte()));
        return LabelFormatter.squash(new String(bytes, 0, length, StandardCharsets.UTF_8));
    }

    protected boolean isExpandableClosureBody(SyntaxNode body) {
        if (isBlock(body)) {
            return !statementsOf(body).isEmpty();
        }
        return conditional(body) != null;
    }

    // ---------------------------------------------------------------- hooks

    /**
     * Type of the node that evaluates a switch or match subject.
     */
    protected NodeType caseHeadType() {
        return NodeType.DECISION;
    }

    protected abstract boolean isBlock(SyntaxNode node);

    /**
     * Comments, empty statements and punctuation that never produce a node.
     */
    protected abstract boolean isIgnorable(SyntaxNode node);

    protected List<SyntaxNode> statementsOf(SyntaxNode block) {
        List<SyntaxNode> statements = new ArrayList<>();
        for (SyntaxNode child : block.namedChildren()) {
            if (!isIgnorable(child)) {
                statements.add(child);
            }
        }
        return statements;
    }

    /**
     * Whether the value of the callable's body block is its result.
     */
    protected boolean isTailBlock(Callable callable) {
        return false;
    }

    protected boolean isTailClosureBlock() {
        return false;
    }

    /**
     * Whether {@code statement}, last in a block in tail position, yields the block's value.
     */
    protected boolean isTailExpression(SyntaxNode statement) {
        return false;
    }

    protected SyntaxNode unwrapTail(SyntaxNode statement) {
        return statement;
    }

    public record Conditional(SyntaxNode condition, SyntaxNode consequence, SyntaxNode alternative) {
        public Conditional {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(consequence, "consequence");
            Objects.requireNonNull(alternative, "alternative");
        }
    }

    /**
     * The parts of a {@code c ? a : b} expression, or {@code null}.
     */
    @Nullable
    protected Conditional conditional(SyntaxNode expr) {
        return null;
    }

    protected SyntaxNode unwrapParentheses(SyntaxNode expr) {
        SyntaxNode current = expr;
        while (current.is("parenthesized_expression") && current.namedChildCount() == 1) {
            current = current.namedChild(0);
        }
        return current;
    }

    /**
     * A value that gets its own region before being bound to a name.
     */
    protected boolean isCompoundValue(SyntaxNode value) {
        MethodChain chain = methodChain(value);
        return chain != null && isCompoundChain(chain);
    }

    @Nullable
    protected MethodChain methodChain(SyntaxNode expr) {
        return null;
    }

    protected boolean isSimpleReceiver(SyntaxNode receiver) {
        return receiver.is("identifier", "this", "self", "field_identifier");
    }

    protected boolean isClosure(SyntaxNode node) {
        return false;
    }

    @Nullable
    protected SyntaxNode closureBody(SyntaxNode closure) {
        return closure.childByFieldName("body");
    }

    protected String closureWord() {
        return "closure";
    }

    private static String prefixOf(NodeType type) {
        return switch (type) {
            case FUNCTION_CALL, METHOD_CALL -> "call";
            case MACRO_CALL -> "macro";
            case ASSIGNMENT -> "assign";
            case AWAIT -> "await";
            case RETURN -> "return";
            case PANIC -> "panic";
            case EXCEPTION -> "throw";
            default -> "stmt";
        };
    }
}
