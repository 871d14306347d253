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
import plus.wcj.code2flowchart.ir.FlowchartIR;
import plus.wcj.code2flowchart.syntax.SourceLanguage;
import plus.wcj.code2flowchart.syntax.SyntaxTree;

import java.util.List;

public interface FlowExtractor {
    SourceLanguage language();

    /**
     * Builds the chart of the selected callable, or a placeholder chart when nothing matches.
     */
    FlowchartIR extract(SyntaxTree tree, CallableSelector selector, ExtractOptions options);

    List<String> listFunctions(SyntaxTree tree);

    @Nullable
    String findEnclosingCallableName(SyntaxTree tree, int position);
}
