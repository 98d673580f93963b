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
import java.util.Collections;
import java.util.List;

/** A unit of deferred, indentable output. */
public final class StateFrame {
    private final int indent;
    private final List<FrameEntry> entries = new ArrayList<>();

    StateFrame(int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("Frame indent must be non-negative: " + indent);
        }
        this.indent = indent;
    }

    public int indent() {
        return indent;
    }

    public List<FrameEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    void add(FrameEntry entry) {
        entries.add(entry);
    }

    void addAll(List<? extends FrameEntry> more) {
        entries.addAll(more);
    }
}
