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

import org.junit.jupiter.api.Test;
import plus.wcj.code2flowchart.Flowcharts;
import plus.wcj.code2flowchart.ir.Edge;
import plus.wcj.code2flowchart.ir.FlowchartIR;
import plus.wcj.code2flowchart.ir.Node;
import plus.wcj.code2flowchart.ir.NodeType;
import plus.wcj.code2flowchart.syntax.SourceLanguage;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static plus.wcj.code2flowchart.Flowcharts.assertEdge;
import static plus.wcj.code2flowchart.Flowcharts.assertNoEdge;
import static plus.wcj.code2flowchart.Flowcharts.end;
import static plus.wcj.code2flowchart.Flowcharts.generator;
import static plus.wcj.code2flowchart.Flowcharts.labels;
import static plus.wcj.code2flowchart.Flowcharts.node;
import static plus.wcj.code2flowchart.Flowcharts.nodeOfType;
import static plus.wcj.code2flowchart.Flowcharts.start;
import static plus.wcj.code2flowchart.Flowcharts.target;

class JavaFlowExtractorTest {

    private static FlowchartIR build(String classBody, String name) {
        return plus.wcj.code2flowchart.Flowcharts.build(SourceLanguage.JAVA, "class Sample {\n" + classBody + "\n}", name);
    }

    @Test
    void ifElse() {
        FlowchartIR ir = build("""
                void pay(boolean cash) {
                    if (cash) {
                        count();
                    } else {
                        swipe();
                    }
                }
                """, "pay");

        assertEquals(List.of("Start", "cash", "count()", "swipe()", "End"), labels(ir));
        assertEquals(NodeType.DECISION, node(ir, "cash").type());
        assertEquals(Set.of(
                Edge.of(start(ir).id(), node(ir, "cash").id()),
                new Edge(node(ir, "cash").id(), node(ir, "count()").id(), "true"),
                new Edge(node(ir, "cash").id(), node(ir, "swipe()").id(), "false"),
                Edge.of(node(ir, "count()").id(), end(ir).id()),
                Edge.of(node(ir, "swipe()").id(), end(ir).id())), Set.copyOf(ir.edges()));
        assertEquals(2, ir.complexity().cyclomaticComplexity());
    }

    @Test
    void ifWithoutElseFallsThroughOnFalse() {
        FlowchartIR ir = build("""
                void greet(String name) {
                    if (name == null) {
                        name = "guest";
                    }
                    System.out.println(name);
                }
                """, "greet");

        assertEdge(ir, "name == null", "name = #quot;guest#quot;", "true");
        assertEdge(ir, "name == null", "System.out.println(name)", "false");
        assertEdge(ir, "name = #quot;guest#quot;", "System.out.println(name)", "");
    }

    @Test
    void whileLoop() {
        FlowchartIR ir = build("""
                void drain(java.util.Queue<String> queue) {
                    while (!queue.isEmpty()) {
                        queue.poll();
                    }
                }
                """, "drain");

        Node header = node(ir, "!queue.isEmpty()");
        Node loopEnd = node(ir, "end loop");
        assertEquals(NodeType.LOOP_START, header.type());
        assertEquals(NodeType.LOOP_END, loopEnd.type());
        assertEdge(ir, start(ir), header, "");
        assertEdge(ir, header, node(ir, "queue.poll()"), "true");
        assertEdge(ir, node(ir, "queue.poll()"), header, "");
        assertEdge(ir, header, loopEnd, "false");
        assertEdge(ir, loopEnd, end(ir), "");
    }

    @Test
    void emptyBodyConnectsStartToEnd() {
        FlowchartIR ir = build("void noop() {}", "noop");

        assertEquals(List.of("Start", "End"), labels(ir));
        assertEquals(List.of(Edge.of(start(ir).id(), end(ir).id())), ir.edges());
        assertEquals(1, ir.complexity().cyclomaticComplexity());
    }

    @Test
    void returnGoesStraightToEnd() {
        FlowchartIR ir = build("int answer() { return 42; }", "answer");

        Node ret = node(ir, "return 42");
        assertEquals(NodeType.RETURN, ret.type());
        assertEquals(List.of(Edge.of(ret.id(), end(ir).id())), ir.outgoing(ret.id()));
        assertEquals("Flowchart for method: answer", ir.title());
    }

    @Test
    void switchCasesEndingInExits() {
        FlowchartIR ir = build("""
                int price(int size) {
                    switch (size) {
                        case 1:
                            return 10;
                        case 2:
                            throw new IllegalArgumentException();
                        default:
                            return 30;
                    }
                }
                """, "price");

        assertEdge(ir, "switch (size)", "case 1", "");
        assertEdge(ir, "case 1", "return 10", "match");
        assertEdge(ir, "case 1", "case 2", "no match");
        assertEdge(ir, "case 2", "throw new IllegalArgumentException()", "match");
        assertEdge(ir, "case 2", "default", "no match");
        assertEdge(ir, "default", "return 30", "match");
        assertEdge(ir, node(ir, "default"), end(ir), "no match");
        assertEdge(ir, node(ir, "return 10"), end(ir), "");
        assertEquals(NodeType.EXCEPTION, node(ir, "throw new IllegalArgumentException()").type());
        assertTrue(labels(ir).stream().noneMatch("end switch"::equals));
    }

    @Test
    void switchFallsThroughUntilBreak() {
        FlowchartIR ir = build("""
                void route(int code) {
                    switch (code) {
                        case 1:
                            open();
                        case 2:
                            close();
                            break;
                        default:
                            reset();
                    }
                    done();
                }
                """, "route");

        assertEdge(ir, "open()", "close()", "");
        assertEdge(ir, "close()", "break", "");
        assertEdge(ir, "break", "end switch", "break");
        assertEdge(ir, "end switch", "done()", "");
        assertEdge(ir, "reset()", "done()", "");
        assertEdge(ir, "default", "done()", "no match");
        assertNoEdge(ir, node(ir, "break"), node(ir, "default"));
    }

    @Test
    void arrowSwitchCasesAreDisjoint() {
        FlowchartIR ir = build("""
                void paint(Color color) {
                    switch (color) {
                        case RED -> stop();
                        case GREEN -> go();
                    }
                }
                """, "paint");

        assertEdge(ir, "case RED", "stop()", "match");
        assertNoEdge(ir, node(ir, "stop()"), node(ir, "go()"));
        assertEdge(ir, node(ir, "stop()"), end(ir), "");
        assertEdge(ir, node(ir, "go()"), end(ir), "");
    }

    @Test
    void classicForWithContinue() {
        FlowchartIR ir = build("""
                void scan(int n) {
                    for (int i = 0; i != n; i++) {
                        if (skip(i)) {
                            continue;
                        }
                        visit(i);
                    }
                }
                """, "scan");

        assertEquals(NodeType.ASSIGNMENT, node(ir, "int i = 0").type());
        assertEdge(ir, "int i = 0", "i != n", "");
        assertEdge(ir, "i != n", "skip(i)", "true");
        assertEdge(ir, "skip(i)", "continue", "true");
        assertEdge(ir, "continue", "i++", "continue");
        assertEdge(ir, "skip(i)", "visit(i)", "false");
        assertEdge(ir, "visit(i)", "i++", "");
        assertEdge(ir, "i++", "i != n", "");
        assertEdge(ir, "i != n", "end loop", "false");
    }

    @Test
    void forWithoutConditionLeavesOnlyThroughBreak() {
        FlowchartIR ir = build("""
                void spin() {
                    for (;;) {
                        if (ready()) {
                            break;
                        }
                    }
                }
                """, "spin");

        Node header = node(ir, "for (;;)");
        assertEquals(NodeType.LOOP_START, header.type());
        assertEdge(ir, "ready()", "break", "true");
        assertEdge(ir, node(ir, "ready()"), header, "false");
        assertEdge(ir, "break", "end loop", "break");
        assertEquals(1, ir.outgoing(header.id()).size());
    }

    @Test
    void doWhileRunsBodyFirst() {
        FlowchartIR ir = build("""
                void retry() {
                    do {
                        attempt();
                    } while (failed());
                }
                """, "retry");

        assertEdge(ir, start(ir), node(ir, "attempt()"), "");
        assertEdge(ir, "attempt()", "failed()", "");
        assertEdge(ir, "failed()", "attempt()", "true");
        assertEdge(ir, "failed()", "end loop", "false");
    }

    @Test
    void labelledBreakLeavesOuterLoop() {
        FlowchartIR ir = build("""
                void find(int[][] grid) {
                    outer:
                    for (int[] row : grid) {
                        for (int cell : row) {
                            if (cell == 0) {
                                break outer;
                            }
                        }
                    }
                }
                """, "find");

        Node outer = node(ir, "for (row : grid)");
        Node inner = node(ir, "for (cell : row)");
        Node outerEnd = target(ir, outer, "no more items");
        Node innerEnd = target(ir, inner, "no more items");
        Node jump = node(ir, "break outer");

        assertEdge(ir, jump, outerEnd, "break");
        assertNoEdge(ir, jump, innerEnd);
        assertEdge(ir, inner, node(ir, "cell == 0"), "next item");
        assertEdge(ir, innerEnd, outer, "");
    }

    @Test
    void finallyRunsOnReturnAndAfterHandlers() {
        FlowchartIR ir = build("""
                void save(Store store) {
                    try {
                        store.open();
                        return;
                    } catch (IOException e) {
                        log(e);
                    } finally {
                        store.close();
                    }
                    audit();
                }
                """, "save");

        Node cleanup = node(ir, "finally");
        assertEquals(NodeType.EXCEPTION, node(ir, "try").type());
        assertEdge(ir, "try", "store.open()", "");
        assertEdge(ir, "try", "log(e)", "catch IOException");
        assertEdge(ir, node(ir, "return"), cleanup, "");
        assertEdge(ir, node(ir, "log(e)"), cleanup, "");
        assertEdge(ir, cleanup, node(ir, "store.close()"), "");
        assertEdge(ir, "store.close()", "audit()", "");
        // the early return leaves through the cleanup, not past it
        assertEdge(ir, node(ir, "store.close()"), end(ir), "return");
        assertNoEdge(ir, node(ir, "return"), end(ir));
    }

    @Test
    void returnInsideTrySkipsStatementsAfterFinally() {
        FlowchartIR ir = build("""
                int pick() {
                    try {
                        return 1;
                    } finally {
                        close();
                    }
                    after();
                    return 2;
                }
                """, "pick");

        assertEdge(ir, "return 1", "finally", "");
        assertEdge(ir, "finally", "close()", "");
        assertEdge(ir, node(ir, "close()"), end(ir), "return");
        assertNoEdge(ir, node(ir, "close()"), node(ir, "after()"));
        assertTrue(ir.incoming(node(ir, "after()").id()).isEmpty());
        assertTrue(Flowcharts.reachable(ir).contains(end(ir).id()));
    }

    @Test
    void nestedFinallyRunsInnerThenOuterCleanup() {
        FlowchartIR ir = build("""
                void shutdown() {
                    try {
                        try {
                            return;
                        } finally {
                            flush();
                        }
                    } finally {
                        release();
                    }
                }
                """, "shutdown");

        Node flush = node(ir, "flush()");
        Node release = node(ir, "release()");
        Node outerCleanup = ir.incoming(release.id()).stream()
                .map(e -> ir.node(e.from()).orElseThrow())
                .filter(n -> n.label().equals("finally"))
                .findFirst().orElseThrow();
        assertEdge(ir, flush, outerCleanup, "return");
        assertEdge(ir, release, end(ir), "return");
        assertNoEdge(ir, flush, end(ir));
    }

    @Test
    void tryWithResourcesLabel() {
        FlowchartIR ir = build("""
                void copy() {
                    try (var in = open()) {
                        in.transferTo(out);
                    }
                }
                """, "copy");

        assertEdge(ir, "try (var in = open())", "in.transferTo(out)", "");
    }

    @Test
    void conditionalReturnValueSplits() {
        FlowchartIR ir = build("int pick(boolean fast) { return fast ? 1 : 2; }", "pick");

        assertEdge(ir, "fast", "return 1", "true");
        assertEdge(ir, "fast", "return 2", "false");
        assertEdge(ir, node(ir, "return 1"), end(ir), "");
        assertEdge(ir, node(ir, "return 2"), end(ir), "");
    }

    @Test
    void conditionalInitializerBecomesOneAssignmentPerArm() {
        FlowchartIR ir = build("""
                void size(boolean big) {
                    int n = big ? 100 : 10;
                    use(n);
                }
                """, "size");

        assertEdge(ir, "big", "int n = 100", "true");
        assertEdge(ir, "big", "int n = 10", "false");
        assertEdge(ir, "int n = 100", "use(n)", "");
        assertEdge(ir, "int n = 10", "use(n)", "");
    }

    @Test
    void streamChainWithLambdaArgument() {
        FlowchartIR ir = build("""
                long nonEmpty(java.util.List<String> items) {
                    return count(items);
                }

                void report(java.util.List<String> items) {
                    items.stream().filter(s -> {
                        if (s.isEmpty()) {
                            return false;
                        }
                        return true;
                    }).count();
                }
                """, "report");

        Node first = node(ir, "items.stream()");
        Node filter = ir.nodes().stream().filter(n -> n.label().startsWith(".filter(")).findFirst().orElseThrow();
        Node last = node(ir, ".count()");
        Node lambda = nodeOfType(ir, NodeType.SUBROUTINE);

        assertEquals(NodeType.METHOD_CALL, first.type());
        assertEdge(ir, first, filter, "");
        assertEdge(ir, filter, last, "");
        assertEdge(ir, last, end(ir), "");
        assertEdge(ir, filter, lambda, "arg 1");
        assertEquals("lambda s -#62;", lambda.label());
        assertEdge(ir, lambda, node(ir, "s.isEmpty()"), "");
        assertEdge(ir, "return false", "end lambda", "");
        assertEdge(ir, "return true", "end lambda", "");
    }

    @Test
    void lambdaFieldWithExpressionBody() {
        String source = """
                class Tasks {
                    Runnable job = () -> run();
                }
                """;
        assertEquals(List.of("job"), generator().listFunctions(SourceLanguage.JAVA, source));

        FlowchartIR ir = plus.wcj.code2flowchart.Flowcharts.build(SourceLanguage.JAVA, source, "job");
        assertEquals("Flowchart for lambda: job", ir.title());
        assertEdge(ir, node(ir, "run()"), end(ir), "return");
    }

    @Test
    void listsConstructorsMethodsAndLambdas() {
        String source = """
                class Shop {
                    private final java.util.List<String> items;

                    Shop() {
                        this(new java.util.ArrayList<>());
                    }

                    Shop(java.util.List<String> items) {
                        this.items = items;
                    }

                    void buy(String item) {
                        items.add(item);
                    }

                    Runnable reset = () -> items.clear();
                }
                """;

        assertEquals(List.of("Shop (constructor)", "Shop (constructor)", "buy (method)", "reset"),
                generator().listFunctions(SourceLanguage.JAVA, source));
        assertEquals("buy", generator().findEnclosingCallableName(SourceLanguage.JAVA, source, source.indexOf("items.add")));

        FlowchartIR ir = generator().generateFlowchart(SourceLanguage.JAVA, source, null, source.indexOf("this.items"));
        assertEquals("Flowchart for constructor: Shop", ir.title());
        assertEquals(NodeType.ASSIGNMENT, node(ir, "this.items = items").type());
    }

    @Test
    void breakOutsideLoopIsInert() {
        FlowchartIR ir = build("""
                void odd() {
                    break;
                    done();
                }
                """, "odd");

        assertEquals(NodeType.BREAK_CONTINUE, node(ir, "break").type());
        assertEdge(ir, "break", "done()", "");
    }

    @Test
    void synchronizedBlockKeepsItsBody() {
        FlowchartIR ir = build("""
                void tick() {
                    synchronized (lock) {
                        count++;
                    }
                }
                """, "tick");

        assertEdge(ir, "synchronized (lock)", "count++", "");
        assertEquals(NodeType.ASSIGNMENT, node(ir, "count++").type());
    }
}
