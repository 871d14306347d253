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

/**
 * Which callable to draw: by byte offset, by name, or (neither given) the first one.
 * A position takes precedence over a name.
 */
public record CallableSelector(@Nullable String name, @Nullable Integer position) {
    private static final String[] LIST_SUFFIXES = {" (method)", " (constructor)", "()"};

    public CallableSelector {
        if (position != null && position < 0) {
            throw new IllegalArgumentException("position must not be negative: " + position);
        }
    }

    public static CallableSelector first() {
        return new CallableSelector(null, null);
    }

    public static CallableSelector byName(String name) {
        return new CallableSelector(name, null);
    }

    public static CallableSelector atPosition(int position) {
        return new CallableSelector(null, position);
    }

    public boolean isEmpty() {
        return position == null && (name == null || name.isBlank());
    }

    /**
     * The requested name without the decoration {@code listFunctions} adds.
     */
    @Nullable
    public String normalizedName() {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        for (String suffix : LIST_SUFFIXES) {
            if (trimmed.endsWith(suffix)) {
                return trimmed.substring(0, trimmed.length() - suffix.length()).trim();
            }
        }
        return trimmed;
    }
}
