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
 * Jump targets of the innermost breakable construct. A switch binds only a break target and
 * inherits the continue target of the loop around it. {@code label} names a labelled loop.
 */
public record LoopContext(String breakTargetId,
                          @Nullable String continueTargetId,
                          @Nullable String label,
                          @Nullable LoopContext enclosing) {
    public LoopContext {
        Objects.requireNonNull(breakTargetId, "breakTargetId");
    }

    public static LoopContext loop(String breakTargetId, String continueTargetId,
                                   @Nullable String label, @Nullable LoopContext enclosing) {
        return new LoopContext(breakTargetId, continueTargetId, label, enclosing);
    }

    public static LoopContext switchBlock(String breakTargetId, @Nullable LoopContext enclosing) {
        return new LoopContext(breakTargetId, enclosing == null ? null : enclosing.continueTargetId(), null, enclosing);
    }

    /**
     * The context a {@code break label}/{@code continue label} refers to, or this one when
     * {@code label} is null.
     */
    @Nullable
    public LoopContext resolve(@Nullable String label) {
        if (label == null) {
            return this;
        }
        for (LoopContext current = this; current != null; current = current.enclosing) {
            if (label.equals(current.label)) {
                return current;
            }
        }
        return null;
    }
}
