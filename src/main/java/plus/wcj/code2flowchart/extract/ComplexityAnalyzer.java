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

import plus.wcj.code2flowchart.ir.Complexity;
import plus.wcj.code2flowchart.ir.ComplexityRating;
import plus.wcj.code2flowchart.ir.Node;

import java.util.Collection;

/**
 * Cyclomatic complexity of a built chart: one plus the number of decision nodes.
 */
public final class ComplexityAnalyzer {
    private final ExtractOptions options;

    public ComplexityAnalyzer(ExtractOptions options) {
        this.options = options;
    }

    public Complexity analyze(Collection<Node> nodes) {
        int decisions = (int) nodes.stream().filter(n -> n.type().isDecision()).count();
        return of(1 + decisions);
    }

    public Complexity of(int cyclomaticComplexity) {
        ComplexityRating rating = rate(cyclomaticComplexity);
        return new Complexity(cyclomaticComplexity, rating, rating.description());
    }

    public ComplexityRating rate(int cyclomaticComplexity) {
        if (cyclomaticComplexity <= options.complexityLowThreshold()) {
            return ComplexityRating.LOW;
        }
        if (cyclomaticComplexity <= options.complexityMediumThreshold()) {
            return ComplexityRating.MEDIUM;
        }
        if (cyclomaticComplexity <= options.complexityHighThreshold()) {
            return ComplexityRating.HIGH;
        }
        return ComplexityRating.VERY_HIGH;
    }
}
