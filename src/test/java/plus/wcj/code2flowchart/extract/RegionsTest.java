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
import plus.wcj.code2flowchart.ir.Edge;
import plus.wcj.code2flowchart.ir.Node;
import plus.wcj.code2flowchart.ir.NodeType;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegionsTest {

    private static Node node(String id) {
        return new Node(id, NodeType.PROCESS, id, null);
    }

    private static Node node(String id, NodeType type) {
        return new Node(id, type, id, null);
    }

    @Test
    void branchWithoutElseLeavesFalseExit() {
        ProcessResult region = Regions.branch(node("if", NodeType.DECISION), ProcessResult.of(node("a")), null);

        assertEquals(List.of(new Edge("if", "a", "true")), region.edges());
        assertEquals(Set.of(ExitPoint.of("a"), ExitPoint.of("if", "false")), Set.copyOf(region.exitPoints()));
    }

    @Test
    void branchWithEmptyArmsExitsFromDecision() {
        ProcessResult region = Regions.branch(node("if", NodeType.DECISION), ProcessResult.empty(), ProcessResult.empty());

        assertTrue(region.edges().isEmpty());
        assertEquals(List.of(ExitPoint.of("if", "true"), ExitPoint.of("if", "false")), region.exitPoints());
    }

    @Test
    void preTestLoopWithUpdate() {
        ProcessResult region = Regions.preTestLoop(node("cond", NodeType.LOOP_START), node("done", NodeType.LOOP_END),
                ProcessResult.of(node("body")), ProcessResult.of(node("i++")), "true", "false");

        assertEquals(Set.of(
                new Edge("i++", "cond", ""),
                new Edge("cond", "body", "true"),
                new Edge("body", "i++", ""),
                new Edge("cond", "done", "false")), Set.copyOf(region.edges()));
        assertEquals(List.of(ExitPoint.of("done")), region.exitPoints());
    }

    @Test
    void postTestLoopEntersThroughBody() {
        ProcessResult region = Regions.postTestLoop(node("test", NodeType.LOOP_START), node("done", NodeType.LOOP_END),
                ProcessResult.of(node("body")), "true", "false");

        assertEquals("body", region.entryNodeId());
        assertTrue(region.edges().contains(new Edge("test", "body", "true")));
        assertTrue(region.edges().contains(new Edge("body", "test", "")));
        assertTrue(region.edges().contains(new Edge("test", "done", "false")));
    }

    @Test
    void unconditionalLoopExitsOnlyThroughItsEnd() {
        ProcessResult region = Regions.unconditionalLoop(node("loop", NodeType.LOOP_START), node("done", NodeType.LOOP_END),
                ProcessResult.of(node("body")));

        assertEquals(Set.of(Edge.of("loop", "body"), Edge.of("body", "loop")), Set.copyOf(region.edges()));
        assertEquals(List.of(ExitPoint.of("done")), region.exitPoints());
    }

    @Test
    void caseChainWithFallthrough() {
        List<Regions.Case> cases = List.of(
                new Regions.Case(node("c1", NodeType.DECISION), ProcessResult.of(node("a"))),
                new Regions.Case(node("c2", NodeType.DECISION), ProcessResult.empty()),
                new Regions.Case(node("c3", NodeType.DECISION), ProcessResult.of(node("b"))));
        ProcessResult region = Regions.caseChain(node("switch", NodeType.DECISION), cases, true);

        assertTrue(region.edges().containsAll(List.of(
                Edge.of("switch", "c1"),
                new Edge("c1", "a", "match"),
                new Edge("c1", "c2", "no match"),
                new Edge("c2", "c3", "no match"),
                new Edge("c3", "b", "match"),
                // a falls into b, and so does the empty c2
                Edge.of("a", "b"),
                new Edge("c2", "b", "match"))));
        assertEquals(Set.of(ExitPoint.of("b"), ExitPoint.of("c3", "no match")), Set.copyOf(region.exitPoints()));
    }

    @Test
    void caseChainWithoutFallthrough() {
        List<Regions.Case> cases = List.of(
                new Regions.Case(node("p1", NodeType.DECISION), ProcessResult.of(node("a"))),
                new Regions.Case(node("p2", NodeType.DECISION), ProcessResult.of(node("b"))));
        ProcessResult region = Regions.caseChain(node("match", NodeType.DECISION), cases, false);

        assertFalse(region.edges().contains(Edge.of("a", "b")));
        assertEquals(Set.of(ExitPoint.of("a"), ExitPoint.of("b"), ExitPoint.of("p2", "no match")),
                Set.copyOf(region.exitPoints()));
    }

    @Test
    void sentinelOnlyWhenTargeted() {
        ProcessResult untouched = ProcessResult.of(node("a"));
        assertSame(untouched, Regions.withSentinelIfTargeted(untouched, node("end switch")));

        ProcessResult jumping = Regions.jump(node("break"), "end switch", "break");
        ProcessResult withEnd = Regions.withSentinelIfTargeted(jumping, node("end switch"));
        assertEquals(2, withEnd.nodes().size());
        assertEquals(List.of(ExitPoint.of("end switch")), withEnd.exitPoints());
    }

    @Test
    void protectedRegionRunsEverythingThroughCleanup() {
        ProcessResult body = Regions.terminal(node("return"), "finally");
        List<Regions.Handler> handlers = List.of(new Regions.Handler("catch IOException", ProcessResult.of(node("log"))));
        ProcessResult region = Regions.protectedRegion(node("try", NodeType.EXCEPTION), body, handlers,
                node("finally", NodeType.EXCEPTION), ProcessResult.of(node("close")), "end");

        assertTrue(region.edges().containsAll(List.of(
                Edge.of("try", "return"),
                new Edge("try", "log", "catch IOException"),
                Edge.of("return", "finally"),
                Edge.of("log", "finally"),
                Edge.of("finally", "close"),
                new Edge("close", "end", "return"))));
        assertEquals(List.of(ExitPoint.of("close")), region.exitPoints());
    }

    @Test
    void cleanupReachedOnlyByReturnHasNoExits() {
        ProcessResult body = Regions.terminal(node("return"), "finally");
        ProcessResult region = Regions.protectedRegion(node("try", NodeType.EXCEPTION), body, List.of(),
                node("finally", NodeType.EXCEPTION), ProcessResult.of(node("close")), "end");

        assertTrue(region.edges().contains(new Edge("close", "end", "return")));
        assertTrue(region.exitPoints().isEmpty());
        assertTrue(region.nodesConnectedToExit().contains("close"));
    }

    @Test
    void cleanupWithoutAbruptPathOnlyFallsThrough() {
        ProcessResult region = Regions.protectedRegion(node("try", NodeType.EXCEPTION), ProcessResult.of(node("work")),
                List.of(), node("finally", NodeType.EXCEPTION), ProcessResult.of(node("close")), "end");

        assertFalse(region.hasEdgeTo("end"));
        assertEquals(List.of(ExitPoint.of("close")), region.exitPoints());
    }

    @Test
    void errorPropagationHasOkAndErr() {
        ProcessResult region = Regions.errorPropagation(node("read()?", NodeType.EARLY_RETURN_ERROR), "end");

        assertEquals(List.of(new Edge("read()?", "end", "Err")), region.edges());
        assertEquals(List.of(ExitPoint.of("read()?", "Ok")), region.exitPoints());
        assertFalse(region.nodesConnectedToExit().contains("read()?"));
    }

    @Test
    void implicitReturnLabelsUnlabelledExits() {
        ProcessResult branch = Regions.branch(node("if", NodeType.DECISION), ProcessResult.of(node("a")), null);
        ProcessResult region = Regions.implicitReturn(branch, "end");

        assertTrue(region.edges().contains(new Edge("a", "end", "return")));
        assertTrue(region.edges().contains(new Edge("if", "end", "false")));
        assertTrue(region.exitPoints().isEmpty());
    }

    @Test
    void detachTerminalReopensEdges() {
        ProcessResult region = Regions.implicitReturn(ProcessResult.of(node("value")), "stand_in");
        ProcessResult reopened = Regions.detachTerminal(region, "stand_in");

        assertTrue(reopened.edges().isEmpty());
        assertEquals(List.of(ExitPoint.of("value", "return")), reopened.exitPoints());
    }

    @Test
    void sideRegionDoesNotChangeExits() {
        ProcessResult call = ProcessResult.of(node("call"));
        ProcessResult closure = ProcessResult.of(node("closure", NodeType.SUBROUTINE));
        ProcessResult region = Regions.attachSideRegion(call, "call", closure, "arg 1");

        assertEquals(List.of(new Edge("call", "closure", "arg 1")), region.edges());
        assertEquals(List.of(ExitPoint.of("call")), region.exitPoints());
    }
}
