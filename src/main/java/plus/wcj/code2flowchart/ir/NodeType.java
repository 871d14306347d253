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

package plus.wcj.code2flowchart.ir;

/**
 * Semantic kind of a flowchart node.
 */
public enum NodeType {
    ENTRY(NodeCategory.FUNCTION_BOUNDARY),
    EXIT(NodeCategory.FUNCTION_BOUNDARY),
    PROCESS(NodeCategory.PROCESS),
    DECISION(NodeCategory.CONTROL_FLOW),
    LOOP_START(NodeCategory.LOOP_CONTROL),
    LOOP_END(NodeCategory.LOOP_CONTROL),
    ASSIGNMENT(NodeCategory.DATA_OPERATION),
    RETURN(NodeCategory.CONTROL_FLOW),
    EXCEPTION(NodeCategory.EXCEPTION_HANDLING),
    BREAK_CONTINUE(NodeCategory.LOOP_CONTROL),
    FUNCTION_CALL(NodeCategory.PROCESS),
    METHOD_CALL(NodeCategory.PROCESS),
    MACRO_CALL(NodeCategory.PROCESS),
    AWAIT(NodeCategory.ASYNC_CONTROL),
    EARLY_RETURN_ERROR(NodeCategory.EXCEPTION_HANDLING),
    PANIC(NodeCategory.EXCEPTION_HANDLING),
    SUBROUTINE(NodeCategory.FUNCTION_BOUNDARY);

    private final NodeCategory category;

    NodeType(NodeCategory category) {
        this.category = category;
    }

    public NodeCategory category() {
        return category;
    }

    /**
     * Nodes of these kinds count as decision points for cyclomatic complexity.
     */
    public boolean isDecision() {
        return this == DECISION || this == LOOP_START;
    }
}
