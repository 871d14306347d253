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

public enum CallableKind {
    FUNCTION("function", ""),
    METHOD("method", " (method)"),
    CONSTRUCTOR("constructor", " (constructor)"),
    LAMBDA("lambda", ""),
    CLOSURE("closure", ""),
    IMPL_BLOCK("impl", "");

    private final String word;
    private final String listSuffix;

    CallableKind(String word, String listSuffix) {
        this.word = word;
        this.listSuffix = listSuffix;
    }

    public String word() {
        return word;
    }

    public String listSuffix() {
        return listSuffix;
    }

    /**
     * Full definitions win over lambdas and closures bound to variables during selection.
     */
    public boolean isDefinition() {
        return this == FUNCTION || this == METHOD || this == CONSTRUCTOR;
    }

    public boolean isAnonymous() {
        return this == LAMBDA || this == CLOSURE;
    }
}
