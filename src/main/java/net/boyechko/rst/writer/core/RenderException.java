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
package net.boyechko.rst.writer.core;

/**
 * Raised when a document tree cannot be rendered at all. The whole render call is abandoned; no
 * partial output is produced.
 */
public class RenderException extends RuntimeException {

    public enum Kind {
        /** The tree contains a construct the renderer does not know. */
        UNIMPLEMENTED_CONSTRUCT,
        /** The construct is known but its arrangement cannot be expressed (nested tables). */
        UNSUPPORTED_STRUCTURE,
        /** A node lacks the attributes needed to render it. */
        MALFORMED_INPUT
    }

    private final Kind kind;
    private final String path;

    public RenderException(Kind kind, String path, String message) {
        super(path != null ? message + " (at " + path + ")" : message);
        this.kind = kind;
        this.path = path;
    }

    public Kind kind() {
        return kind;
    }

    /** Tree path of the offending node, or null when raised outside a traversal. */
    public String path() {
        return path;
    }

    public static RenderException unknownNode(String name) {
        return new RenderException(Kind.UNIMPLEMENTED_CONSTRUCT, null, "Unknown node: " + name);
    }

    public static RenderException nestedTable(String path) {
        return new RenderException(
                Kind.UNSUPPORTED_STRUCTURE, path, "Nested tables are not supported.");
    }

    public static RenderException malformed(String path, String message) {
        return new RenderException(Kind.MALFORMED_INPUT, path, message);
    }
}
