/*
 * RST-Writer - Document Tree to reStructuredText Rendering
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.rst.writer.output;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrapper. Long words are never broken and words are never split at hyphens; a word
 * wider than the budget gets a line of its own. Tabs are expanded and every other whitespace
 * character becomes a space before wrapping.
 */
public final class TextWrapper {
    private static final int TAB_SIZE = 8;

    private TextWrapper() {}

    public static List<String> wrap(String text, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Invalid width " + width + " (must be > 0)");
        }
        List<String> chunks = chunks(normalizeWhitespace(text));
        List<String> lines = new ArrayList<>();
        int next = 0;

        while (next < chunks.size()) {
            List<String> current = new ArrayList<>();
            int currentLen = 0;

            // Leading whitespace is only kept on the first line
            if (!lines.isEmpty() && isBlank(chunks.get(next))) {
                next++;
            }

            while (next < chunks.size()) {
                int len = chunks.get(next).length();
                if (currentLen + len <= width) {
                    current.add(chunks.get(next++));
                    currentLen += len;
                } else {
                    break;
                }
            }

            if (next < chunks.size() && chunks.get(next).length() > width && current.isEmpty()) {
                current.add(chunks.get(next++));
            }

            if (!current.isEmpty() && isBlank(current.get(current.size() - 1))) {
                current.remove(current.size() - 1);
            }

            if (!current.isEmpty()) {
                lines.add(String.join("", current));
            }
        }
        return lines;
    }

    /** Splits on line breaks ({@code \n}, {@code \r\n}, {@code \r}); a final break adds no line. */
    public static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                lines.add(text.substring(start, i));
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
            i++;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    /** Width of a string in output columns, counting one per code point. */
    public static int displayWidth(String text) {
        return text.codePointCount(0, text.length());
    }

    static String normalizeWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        int column = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t') {
                int pad = TAB_SIZE - (column % TAB_SIZE);
                sb.append(" ".repeat(pad));
                column += pad;
            } else if (c == '\n' || c == '\r') {
                sb.append(' ');
                column = 0;
            } else if (c == 0x0B || c == '\f') {
                sb.append(' ');
                column++;
            } else {
                sb.append(c);
                column++;
            }
        }
        return sb.toString();
    }

    private static List<String> chunks(String text) {
        List<String> chunks = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= text.length(); i++) {
            if (i == text.length() || (text.charAt(i) == ' ') != (text.charAt(start) == ' ')) {
                chunks.add(text.substring(start, i));
                start = i;
            }
        }
        return chunks;
    }

    private static boolean isBlank(String chunk) {
        return chunk.trim().isEmpty();
    }
}
