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
import plus.wcj.code2flowchart.ir.FlowchartIR;
import plus.wcj.code2flowchart.ir.Node;
import plus.wcj.code2flowchart.ir.NodeType;
import plus.wcj.code2flowchart.syntax.SourceLanguage;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static plus.wcj.code2flowchart.Flowcharts.assertEdge;
import static plus.wcj.code2flowchart.Flowcharts.assertNoEdge;
import static plus.wcj.code2flowchart.Flowcharts.end;
import static plus.wcj.code2flowchart.Flowcharts.generator;
import static plus.wcj.code2flowchart.Flowcharts.node;
import static plus.wcj.code2flowchart.Flowcharts.nodeOfType;
import static plus.wcj.code2flowchart.Flowcharts.start;
import static plus.wcj.code2flowchart.Flowcharts.target;

class RustFlowExtractorTest {

    private static FlowchartIR build(String source, String name) {
        return Flowcharts.build(SourceLanguage.RUST, source, name);
    }

    @Test
    void tailIfReturnsFromBothArms() {
        FlowchartIR ir = build("""
                fn sign(n: i32) -> i32 {
                    if n.is_negative() {
                        -1
                    } else {
                        1
                    }
                }
                """, "sign");

        assertEdge(ir, "if n.is_negative()", "-1", "true");
        assertEdge(ir, "if n.is_negative()", "1", "false");
        assertEdge(ir, node(ir, "-1"), end(ir), "return");
        assertEdge(ir, node(ir, "1"), end(ir), "return");
    }

    @Test
    void questionMarkPropagatesErrors() {
        FlowchartIR ir = build("""
                fn load(path: &str) -> Result<String, Error> {
                    let text = read(path)?;
                    Ok(text)
                }
                """, "load");

        Node check = node(ir, "read(path)?");
        Node bind = node(ir, "let text = #60;result#62;");
        assertEquals(NodeType.EARLY_RETURN_ERROR, check.type());
        assertEquals(NodeType.ASSIGNMENT, bind.type());
        assertEdge(ir, check, end(ir), "Err");
        assertEdge(ir, check, bind, "Ok");
        assertEdge(ir, bind, node(ir, "Ok(text)"), "");
        assertEdge(ir, node(ir, "Ok(text)"), end(ir), "return");
        assertEquals(NodeType.FUNCTION_CALL, node(ir, "Ok(text)").type());
    }

    @Test
    void awaitedErrorPropagationIsOneAwaitNode() {
        FlowchartIR ir = build("""
                async fn load(c: &Client) -> Result<u32, Error> {
                    let v = c.fetch().await?;
                    Ok(v)
                }
                """, "load");

        Node wait = node(ir, "c.fetch().await?");
        assertEquals(NodeType.AWAIT, wait.type());
        assertTrue(Flowcharts.nodesOfType(ir, NodeType.EARLY_RETURN_ERROR).isEmpty());
        assertEdge(ir, start(ir), wait, "");
        assertEdge(ir, wait, end(ir), "Err");
        assertEdge(ir, wait, node(ir, "let v = #60;result#62;"), "Ok");
    }

    @Test
    void chainedOperandIsDrawnBeforeTheCheck() {
        FlowchartIR ir = build("""
                fn send(c: &Client, v: u32) -> Result<(), Error> {
                    c.get(v).send()?;
                    Ok(())
                }
                """, "send");

        Node check = nodeOfType(ir, NodeType.EARLY_RETURN_ERROR);
        assertEquals("c.get(v).send()?", check.label());
        assertEquals(2, Flowcharts.nodesOfType(ir, NodeType.METHOD_CALL).size());
        assertEdge(ir, start(ir), node(ir, "c.get(v)"), "");
        assertEdge(ir, "c.get(v)", ".send()", "");
        assertEdge(ir, node(ir, ".send()"), check, "");
        assertEdge(ir, check, end(ir), "Err");
        assertEdge(ir, check, node(ir, "Ok(())"), "Ok");
    }

    @Test
    void branchingOperandFlowsIntoTheCheck() {
        FlowchartIR ir = build("""
                fn pick(fast: bool) -> Result<u32, Error> {
                    let n = (if fast { quick() } else { slow() })?;
                    Ok(n)
                }
                """, "pick");

        Node check = nodeOfType(ir, NodeType.EARLY_RETURN_ERROR);
        assertEdge(ir, start(ir), node(ir, "if fast"), "");
        assertEdge(ir, node(ir, "quick()"), check, "");
        assertEdge(ir, node(ir, "slow()"), check, "");
        assertEdge(ir, check, node(ir, "let n = #60;result#62;"), "Ok");
    }

    @Test
    void matchArmsAreDisjointTailValues() {
        FlowchartIR ir = build("""
                fn describe(n: u8) -> &'static str {
                    match n {
                        0 => "zero",
                        1 => "one",
                        _ => "many",
                    }
                }
                """, "describe");

        assertEdge(ir, "match n", "0", "");
        assertEdge(ir, "0", "#quot;zero#quot;", "match");
        assertEdge(ir, "0", "1", "no match");
        assertEdge(ir, "1", "_", "no match");
        assertEdge(ir, node(ir, "#quot;zero#quot;"), end(ir), "return");
        assertEdge(ir, node(ir, "#quot;many#quot;"), end(ir), "return");
        assertEdge(ir, node(ir, "_"), end(ir), "no match");
        assertNoEdge(ir, node(ir, "#quot;zero#quot;"), node(ir, "1"));
        assertTrue(ir.nodes().stream().noneMatch(n -> n.label().equals("end switch")));
        // the arms decide, the head only evaluates n
        assertEquals(NodeType.PROCESS, node(ir, "match n").type());
        assertEquals(4, ir.complexity().cyclomaticComplexity());
    }

    @Test
    void labelledBreakLeavesOuterLoop() {
        FlowchartIR ir = build("""
                fn find(grid: &[Vec<i32>]) {
                    'outer: for row in grid {
                        for cell in row {
                            if *cell == 0 {
                                break 'outer;
                            }
                        }
                    }
                }
                """, "find");

        Node outer = node(ir, "for row in grid");
        Node inner = node(ir, "for cell in row");
        Node jump = node(ir, "break 'outer");
        Node outerEnd = target(ir, outer, "no more items");

        assertEdge(ir, jump, outerEnd, "break");
        assertNoEdge(ir, jump, target(ir, inner, "no more items"));
        assertEdge(ir, outerEnd, end(ir), "");
    }

    @Test
    void loopWithPanicAndBreak() {
        FlowchartIR ir = build("""
                fn spin(mut n: u32) -> u32 {
                    loop {
                        if n == 0 {
                            panic!("zero");
                        }
                        n -= 1;
                        if n == 10 {
                            break;
                        }
                    }
                    n
                }
                """, "spin");

        Node header = node(ir, "loop");
        Node panic = nodeOfType(ir, NodeType.PANIC);
        assertEquals(NodeType.LOOP_START, header.type());
        assertEquals("panic!(#quot;zero#quot;)", panic.label());
        assertEquals(List.of(end(ir).id()), ir.outgoing(panic.id()).stream().map(e -> e.to()).toList());
        assertEdge(ir, "if n == 0", "n -= 1", "false");
        assertEdge(ir, "break", "end loop", "break");
        assertEdge(ir, node(ir, "if n == 10"), header, "false");
        assertEdge(ir, "end loop", "n", "");
        assertEdge(ir, node(ir, "n"), end(ir), "return");
    }

    @Test
    void letElseBranchesOnPattern() {
        FlowchartIR ir = build("""
                fn first(xs: &[u32]) -> u32 {
                    let Some(v) = xs.first() else {
                        return 0;
                    };
                    *v
                }
                """, "first");

        Node decision = node(ir, "let Some(v) = xs.first()");
        assertEquals(NodeType.DECISION, decision.type());
        assertEdge(ir, decision, node(ir, "*v"), "match");
        assertEdge(ir, decision, node(ir, "return 0"), "else");
        assertEdge(ir, node(ir, "return 0"), end(ir), "");
    }

    @Test
    void ifValueIsBuiltBeforeBinding() {
        FlowchartIR ir = build("""
                fn clamp(v: i32) -> i32 {
                    let r = if v.is_positive() { 9 } else { v };
                    r
                }
                """, "clamp");

        assertEdge(ir, "if v.is_positive()", "9", "true");
        assertEdge(ir, "9", "let r = #60;result#62;", "");
        assertEdge(ir, "v", "let r = #60;result#62;", "");
        assertEdge(ir, "let r = #60;result#62;", "r", "");
        assertEdge(ir, node(ir, "r"), end(ir), "return");
    }

    @Test
    void closureArgumentIsExpanded() {
        FlowchartIR ir = build("""
                fn evens(v: Vec<i32>) -> Vec<i32> {
                    v.into_iter().filter(|x| {
                        if *x % 2 == 0 { true } else { false }
                    }).collect()
                }
                """, "evens");

        Node filter = ir.nodes().stream().filter(n -> n.label().startsWith(".filter(")).findFirst().orElseThrow();
        Node closure = nodeOfType(ir, NodeType.SUBROUTINE);
        assertEquals("closure |x|", closure.label());
        assertEdge(ir, start(ir), node(ir, "v.into_iter()"), "");
        assertEdge(ir, node(ir, "v.into_iter()"), filter, "");
        assertEdge(ir, filter, closure, "arg 1");
        assertEdge(ir, filter, node(ir, ".collect()"), "");
        assertEdge(ir, node(ir, ".collect()"), end(ir), "return");
        assertEdge(ir, closure, node(ir, "if *x % 2 == 0"), "");
        assertEdge(ir, "true", "end closure", "return");
        assertEdge(ir, "false", "end closure", "return");
    }

    @Test
    void implOverviewChainsMethods() {
        String source = """
                struct Counter {
                    value: u32,
                }

                impl Counter {
                    fn new() -> Self {
                        Counter { value: 0 }
                    }

                    fn get(&self) -> u32 {
                        self.value
                    }
                }
                """;

        assertEquals(List.of("new (method)", "get (method)"), generator().listFunctions(SourceLanguage.RUST, source));
        assertEquals("impl Counter",
                generator().findEnclosingCallableName(SourceLanguage.RUST, source, source.indexOf("impl Counter")));
        assertEquals("get", generator().findEnclosingCallableName(SourceLanguage.RUST, source, source.indexOf("self.value")));

        FlowchartIR ir = build(source, "impl Counter");
        assertEquals("impl Counter", ir.title());
        assertEdge(ir, start(ir), node(ir, "fn new"), "");
        assertEdge(ir, "fn new", "Counter { value: 0 }", "");
        assertEdge(ir, "Counter { value: 0 }", "fn get", "return");
        assertEdge(ir, "fn get", "self.value", "");
        assertEdge(ir, node(ir, "self.value"), end(ir), "return");
        assertEquals(NodeType.SUBROUTINE, node(ir, "fn get").type());
    }

    @Test
    void closureBoundToVariable() {
        String source = """
                fn main() {
                    let double = |x: i32| x * 2;
                    println!("{}", double(4));
                }
                """;

        assertEquals(List.of("main", "double"), generator().listFunctions(SourceLanguage.RUST, source));
        FlowchartIR ir = build(source, "double");
        assertEquals("Flowchart for closure: double", ir.title());
        assertEdge(ir, node(ir, "x * 2"), end(ir), "return");

        FlowchartIR main = build(source, "main");
        Node print = main.nodes().stream().filter(n -> n.label().startsWith("println!")).findFirst().orElseThrow();
        assertEquals(NodeType.FUNCTION_CALL, print.type());
    }

    @Test
    void labelsAreCompact() {
        FlowchartIR ir = build("""
                fn notify(user: &User) {
                    send_notification_email(user.primary_address(), user.display_name());
                }
                """, "notify");

        Node call = nodeOfType(ir, NodeType.FUNCTION_CALL);
        assertEquals(30, call.label().length());
        assertTrue(call.label().endsWith("..."));
    }
}
