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

import java.util.List;

/** One entry of a {@link StateFrame}: text still to be formatted, or lines already formatted. */
public sealed interface FrameEntry permits FrameEntry.RawSpan, FrameEntry.Block {

    /** Unformatted text; contiguous spans are merged when their frame is popped. */
    record RawSpan(String text) implements FrameEntry {}

    /** Formatted lines, indented by {@code indent} relative to the frame holding them. */
    record Block(int indent, List<String> lines) implements FrameEntry {
        public Block {
            lines = List.copyOf(lines);
        }
    }
}
