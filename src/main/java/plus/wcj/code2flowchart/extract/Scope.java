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

import java.util.Objects;

/**
 * What a statement can see of its surroundings while it is being built.
 *
 * @param exitId       the exit of the callable (or closure) being built
 * @param loop         innermost breakable construct, if any
 * @param cleanup      innermost finally, if any
 * @param tail         the statement's value is the callable's result
 * @param pendingLabel label written in front of the statement, consumed by the loop it names
 */
public record Scope(String exitId,
                    @Nullable LoopContext loop,
                    @Nullable FinallyContext cleanup,
                    boolean tail,
                    @Nullable String pendingLabel) {
    public Scope {
        Objects.requireNonNull(exitId, "exitId");
    }

    public static Scope root(String exitId) {
        return new Scope(exitId, null, null, false, null);
    }

    /**
     * Where return, throw, panic and error propagation go.
     */
    public String terminalTarget() {
        return cleanup != null ? cleanup.cleanupEntryId() : exitId;
    }

    public Scope withLoop(LoopContext loopContext) {
        return new Scope(exitId, loopContext, cleanup, false, null);
    }

    public Scope withCleanup(FinallyContext finallyContext) {
        return new Scope(exitId, loop, finallyContext, false, null);
    }

    public Scope inTail() {
        return tail ? this : new Scope(exitId, loop, cleanup, true, pendingLabel);
    }

    /**
     * Scope for a nested statement that is neither in tail position nor labelled.
     */
    public Scope nested() {
        return tail || pendingLabel != null ? new Scope(exitId, loop, cleanup, false, null) : this;
    }

    /**
     * Scope for a branch arm: keeps tail position, drops any pending label.
     */
    public Scope arm() {
        return pendingLabel == null ? this : new Scope(exitId, loop, cleanup, tail, null);
    }

    public Scope withPendingLabel(String label) {
        return new Scope(exitId, loop, cleanup, tail, label);
    }
}
