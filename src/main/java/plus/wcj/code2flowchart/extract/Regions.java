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
import plus.wcj.code2flowchart.ir.Edge;
import plus.wcj.code2flowchart.ir.Node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Composition rules for structured constructs. Every method takes regions that were already
 * built and returns a new region; nothing here looks at syntax.
 */
public final class Regions {
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String MATCH = "match";
    public static final String NO_MATCH = "no match";
    public static final String RETURN = "return";
    public static final String OK = "Ok";
    public static final String ERR = "Err";

    private Regions() {
    }

    /**
     * A node whose single outgoing edge goes to {@code target}: return, throw, panic, break,
     * continue and goto all take this shape.
     */
    public static ProcessResult jump(Node node, String target, String label) {
        return ProcessResult.builder()
                .node(node)
                .edge(node.id(), target, label)
                .markConnected(node.id())
                .entry(node.id())
                .build();
    }

    public static ProcessResult terminal(Node node, String target) {
        return jump(node, target, "");
    }

    /**
     * Wires every dangling exit of {@code region} to {@code target}, labelled "return" unless it
     * already carries a label.
     */
    public static ProcessResult implicitReturn(ProcessResult region, String target) {
        if (region.isEmpty() || region.exitPoints().isEmpty()) {
            return region;
        }
        return ProcessResult.builder()
                .absorb(region)
                .connectToTerminal(region.exitPoints(), target, RETURN)
                .entry(region.entryNodeId())
                .build();
    }

    /**
     * if/else and conditional expressions. {@code alternative} is {@code null} when the construct
     * has no else clause at all.
     */
    public static ProcessResult branch(Node decision, ProcessResult consequence, @Nullable ProcessResult alternative) {
        return branch(decision, consequence, TRUE, alternative, FALSE);
    }

    public static ProcessResult branch(Node decision,
                                       ProcessResult consequence, String consequenceLabel,
                                       @Nullable ProcessResult alternative, String alternativeLabel) {
        ProcessResult.Builder b = ProcessResult.builder().node(decision).entry(decision.id());
        attachArm(b, decision.id(), consequence, consequenceLabel);
        if (alternative == null) {
            b.exit(ExitPoint.of(decision.id(), alternativeLabel));
        } else {
            attachArm(b, decision.id(), alternative, alternativeLabel);
        }
        return b.build();
    }

    private static void attachArm(ProcessResult.Builder b, String from, ProcessResult arm, String label) {
        if (arm.isEmpty()) {
            b.exit(ExitPoint.of(from, label));
            return;
        }
        b.absorb(arm).edge(from, arm.entryNodeId(), label).exits(arm.exitPoints());
    }

    /**
     * Loop tested before every iteration. When {@code update} is present the body falls into it
     * and it falls back into the header.
     */
    public static ProcessResult preTestLoop(Node header, Node loopExit, ProcessResult body,
                                            @Nullable ProcessResult update,
                                            String enterLabel, String exitLabel) {
        ProcessResult.Builder b = ProcessResult.builder().node(header).entry(header.id());
        String continueTarget = header.id();
        if (update != null && !update.isEmpty()) {
            b.absorb(update).connect(update.exitPoints(), header.id());
            continueTarget = update.entryNodeId();
        }
        if (body.isEmpty()) {
            b.edge(header.id(), continueTarget, enterLabel);
        } else {
            b.absorb(body)
                    .edge(header.id(), body.entryNodeId(), enterLabel)
                    .connect(body.exitPoints(), continueTarget);
        }
        b.node(loopExit).edge(header.id(), loopExit.id(), exitLabel);
        return b.exit(ExitPoint.of(loopExit.id())).build();
    }

    /**
     * do/while: the body runs once, then falls into the test.
     */
    public static ProcessResult postTestLoop(Node test, Node loopExit, ProcessResult body,
                                             String enterLabel, String exitLabel) {
        ProcessResult.Builder b = ProcessResult.builder();
        if (body.isEmpty()) {
            b.node(test).entry(test.id()).edge(test.id(), test.id(), enterLabel);
        } else {
            b.absorb(body)
                    .node(test)
                    .entry(body.entryNodeId())
                    .connect(body.exitPoints(), test.id())
                    .edge(test.id(), body.entryNodeId(), enterLabel);
        }
        b.node(loopExit).edge(test.id(), loopExit.id(), exitLabel);
        return b.exit(ExitPoint.of(loopExit.id())).build();
    }

    /**
     * Loop without a test; only a break reaches {@code loopExit}.
     */
    public static ProcessResult unconditionalLoop(Node header, Node loopExit, ProcessResult body) {
        ProcessResult.Builder b = ProcessResult.builder().node(header).entry(header.id());
        if (body.isEmpty()) {
            b.edge(header.id(), header.id(), "");
        } else {
            b.absorb(body)
                    .edge(header.id(), body.entryNodeId(), "")
                    .connect(body.exitPoints(), header.id());
        }
        b.node(loopExit);
        return b.exit(ExitPoint.of(loopExit.id())).build();
    }

    public record Case(Node decision, ProcessResult body) {
        public Case {
            Objects.requireNonNull(decision, "decision");
            Objects.requireNonNull(body, "body");
        }
    }

    /**
     * switch/match. Cases form a chain of decisions linked by "no match". With
     * {@code fallthrough} a case body that completes normally runs into the next non-empty body,
     * and an empty case shares the next body; without it every case leaves the region.
     */
    public static ProcessResult caseChain(Node head, List<Case> cases, boolean fallthrough) {
        ProcessResult.Builder b = ProcessResult.builder().node(head).entry(head.id());
        ExitPoint previous = ExitPoint.of(head.id());
        List<ExitPoint> pending = new ArrayList<>();
        for (Case c : cases) {
            String caseId = c.decision().id();
            b.node(c.decision()).edge(previous.id(), caseId, previous.label());
            ProcessResult body = c.body();
            if (body.isEmpty()) {
                ExitPoint matched = ExitPoint.of(caseId, MATCH);
                if (fallthrough) {
                    pending.add(matched);
                } else {
                    b.exit(matched);
                }
            } else {
                b.absorb(body).edge(caseId, body.entryNodeId(), MATCH);
                if (fallthrough) {
                    b.connect(pending, body.entryNodeId());
                    pending = new ArrayList<>(body.exitPoints());
                } else {
                    b.exits(body.exitPoints());
                }
            }
            previous = ExitPoint.of(caseId, NO_MATCH);
        }
        b.exits(pending);
        return b.exit(previous).build();
    }

    /**
     * Adds {@code sentinel} to the region, as an extra exit point, only when some edge of the
     * region targets it.
     */
    public static ProcessResult withSentinelIfTargeted(ProcessResult region, Node sentinel) {
        if (!region.hasEdgeTo(sentinel.id())) {
            return region;
        }
        return ProcessResult.builder()
                .absorb(region)
                .node(sentinel)
                .entry(region.entryNodeId())
                .exits(region.exitPoints())
                .exit(ExitPoint.of(sentinel.id()))
                .build();
    }

    public record Handler(String label, ProcessResult body) {
        public Handler {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(body, "body");
        }
    }

    /**
     * try/catch/finally. The try entry fans out to the body and to every handler. When
     * {@code cleanupEntry} is given, everything that completes inside the construct passes
     * through it into {@code cleanup}. Normal completions leave through the cleanup's exits; when
     * a return, throw or panic was routed into the cleanup, the cleanup's exits also lead on to
     * {@code exitTarget}.
     */
    public static ProcessResult protectedRegion(Node tryEntry, ProcessResult body, List<Handler> handlers,
                                                @Nullable Node cleanupEntry, @Nullable ProcessResult cleanup,
                                                String exitTarget) {
        ProcessResult.Builder b = ProcessResult.builder().node(tryEntry).entry(tryEntry.id());
        List<ExitPoint> completions = new ArrayList<>();
        boolean abrupt = false;
        if (body.isEmpty()) {
            completions.add(ExitPoint.of(tryEntry.id()));
        } else {
            b.absorb(body).edge(tryEntry.id(), body.entryNodeId(), "");
            completions.addAll(body.exitPoints());
            abrupt = cleanupEntry != null && body.hasEdgeTo(cleanupEntry.id());
        }
        for (Handler handler : handlers) {
            ProcessResult handlerBody = handler.body();
            if (handlerBody.isEmpty()) {
                completions.add(ExitPoint.of(tryEntry.id(), handler.label()));
            } else {
                b.absorb(handlerBody).edge(tryEntry.id(), handlerBody.entryNodeId(), handler.label());
                completions.addAll(handlerBody.exitPoints());
                abrupt |= cleanupEntry != null && handlerBody.hasEdgeTo(cleanupEntry.id());
            }
        }
        if (cleanupEntry == null) {
            return b.exits(completions).build();
        }
        b.node(cleanupEntry).connect(completions, cleanupEntry.id());
        List<ExitPoint> cleanupExits;
        if (cleanup == null || cleanup.isEmpty()) {
            cleanupExits = List.of(ExitPoint.of(cleanupEntry.id()));
        } else {
            b.absorb(cleanup).edge(cleanupEntry.id(), cleanup.entryNodeId(), "");
            cleanupExits = cleanup.exitPoints();
        }
        if (abrupt) {
            for (ExitPoint ep : cleanupExits) {
                b.edge(ep.id(), exitTarget, ep.orLabel(RETURN).label());
            }
        }
        if (completions.isEmpty()) {
            // only abrupt paths reach the cleanup, nothing continues after the construct
            cleanupExits.forEach(ep -> b.markConnected(ep.id()));
            return b.build();
        }
        return b.exits(cleanupExits).build();
    }

    /**
     * Error-propagation operator: "Ok" continues, "Err" leaves through {@code terminalTarget}.
     */
    public static ProcessResult errorPropagation(Node node, String terminalTarget) {
        return ProcessResult.builder()
                .node(node)
                .entry(node.id())
                .edge(node.id(), terminalTarget, ERR)
                .exit(ExitPoint.of(node.id(), OK))
                .build();
    }

    /**
     * Hangs {@code sideRegion} off {@code anchor} with a labelled edge without changing how
     * control leaves {@code anchor}.
     */
    public static ProcessResult attachSideRegion(ProcessResult anchor, String fromId, ProcessResult sideRegion, String label) {
        if (sideRegion.isEmpty()) {
            return anchor;
        }
        return ProcessResult.builder()
                .absorb(anchor)
                .absorb(sideRegion)
                .edge(fromId, sideRegion.entryNodeId(), label)
                .entry(anchor.entryNodeId())
                .exits(anchor.exitPoints())
                .build();
    }

    /**
     * Removes edges into {@code target} and turns their sources back into exit points. Used when
     * a body was built against a stand-in terminal that is not part of the final chart.
     */
    public static ProcessResult detachTerminal(ProcessResult region, String target) {
        List<Edge> kept = new ArrayList<>();
        List<ExitPoint> reopened = new ArrayList<>();
        Set<String> reopenedIds = new HashSet<>();
        for (Edge edge : region.edges()) {
            if (edge.to().equals(target)) {
                reopened.add(ExitPoint.of(edge.from(), edge.label()));
                reopenedIds.add(edge.from());
            } else {
                kept.add(edge);
            }
        }
        Set<String> connected = new HashSet<>(region.nodesConnectedToExit());
        connected.removeAll(reopenedIds);
        List<ExitPoint> exits = new ArrayList<>(region.exitPoints());
        exits.addAll(reopened);
        return new ProcessResult(region.nodes(), kept, region.entryNodeId(), exits, connected);
    }
}
