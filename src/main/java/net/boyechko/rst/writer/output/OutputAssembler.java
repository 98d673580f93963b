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

/** Turns the root frame into the final text. */
public final class OutputAssembler {
    private OutputAssembler() {}

    /**
     * Indents every line of the frame by its accumulated indent and joins the lines with {@code
     * newline}. Empty lines carry no indentation. Leading and trailing empty lines are dropped.
     */
    public static String assemble(StateFrame root, String newline) {
        List<String> lines = lines(root);

        int from = 0;
        int to = lines.size();
        while (from < to && lines.get(from).isEmpty()) {
            from++;
        }
        while (to > from && lines.get(to - 1).isEmpty()) {
            to--;
        }
        return String.join(newline, lines.subList(from, to));
    }

    static List<String> lines(StateFrame root) {
        List<String> out = new ArrayList<>();
        for (FrameEntry entry : root.entries()) {
            if (entry instanceof FrameEntry.Block block) {
                String pad = " ".repeat(Math.max(0, root.indent() + block.indent()));
                for (String line : block.lines()) {
                    out.add(line.isEmpty() ? "" : pad + line);
                }
            } else if (entry instanceof FrameEntry.RawSpan span) {
                // Only reachable when the root held text outside any block-level node
                out.addAll(TextWrapper.splitLines(span.text()));
            }
        }
        return out;
    }
}
