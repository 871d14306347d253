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

/**
 * Turns raw source text into node labels: one line, diagram-safe characters, bounded length.
 */
public final class LabelFormatter {
    private static final String ELLIPSIS = "...";

    private final int maxLength;

    public LabelFormatter(int maxLength) {
        this.maxLength = maxLength;
    }

    public int maxLength() {
        return maxLength;
    }

    /**
     * Collapses whitespace, strips a trailing {@code ;} or {@code :}, escapes and truncates.
     */
    public String format(String raw) {
        return escape(truncate(squash(raw), maxLength));
    }

    public static String squash(String raw) {
        if (raw == null) {
            return "";
        }
        String singleLine = raw.replaceAll("\\s+", " ").trim();
        while (singleLine.endsWith(";") || singleLine.endsWith(":")) {
            singleLine = singleLine.substring(0, singleLine.length() - 1).trim();
        }
        return singleLine;
    }

    public static String truncate(String text, int max) {
        if (max < 0 || text.length() <= max) {
            return text;
        }
        if (max <= ELLIPSIS.length()) {
            return text.substring(0, max);
        }
        return text.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }

    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("#quot;");
                case '\\' -> sb.append("\\\\");
                case '<' -> sb.append("#60;");
                case '>' -> sb.append("#62;");
                case '`' -> sb.append("#96;");
                case '\n', '\r' -> sb.append(' ');
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
