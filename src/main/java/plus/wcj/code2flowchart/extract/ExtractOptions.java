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

import plus.wcj.code2flowchart.settings.FlowchartSettings;

import java.util.Objects;

/**
 * Immutable snapshot of the settings one build runs with.
 */
public record ExtractOptions(int labelMaxLength,
                             int compactLabelMaxLength,
                             int argumentLabelMaxLength,
                             boolean expandClosureArguments,
                             int complexityLowThreshold,
                             int complexityMediumThreshold,
                             int complexityHighThreshold) {
    public ExtractOptions {
        if (complexityLowThreshold > complexityMediumThreshold || complexityMediumThreshold > complexityHighThreshold) {
            throw new IllegalArgumentException("complexity thresholds must be ascending: "
                    + complexityLowThreshold + ", " + complexityMediumThreshold + ", " + complexityHighThreshold);
        }
    }

    public static ExtractOptions defaultOptions() {
        return from(FlowchartSettings.load());
    }

    public static ExtractOptions from(FlowchartSettings settings) {
        Objects.requireNonNull(settings, "settings");
        return new ExtractOptions(
                settings.getLabelMaxLength(),
                settings.getCompactLabelMaxLength(),
                settings.getArgumentLabelMaxLength(),
                settings.isExpandClosureArguments(),
                settings.getComplexityLowThreshold(),
                settings.getComplexityMediumThreshold(),
                settings.getComplexityHighThreshold());
    }
}
