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

public enum ComplexityRating {
    LOW("Simple function with low complexity"),
    MEDIUM("Moderately complex function"),
    HIGH("Complex function that may benefit from refactoring"),
    VERY_HIGH("Very complex function that should be refactored");

    private final String description;

    ComplexityRating(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
