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

import java.util.Objects;
import java.util.Optional;

/**
 * An unresolved successor of a region: whatever comes next gets an edge from {@code id}
 * carrying {@code label}.
 */
public record ExitPoint(String id, String label) {
    public ExitPoint {
        Objects.requireNonNull(id, "id");
        label = Optional.ofNullable(label).orElse("");
    }

    public static ExitPoint of(String id) {
        return new ExitPoint(id, "");
    }

    public static ExitPoint of(String id, String label) {
        return new ExitPoint(id, label);
    }

    public ExitPoint orLabel(String fallback) {
        return label.isEmpty() ? new ExitPoint(id, fallback) : this;
    }
}
