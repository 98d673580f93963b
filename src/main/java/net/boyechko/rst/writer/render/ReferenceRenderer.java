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
package net.boyechko.rst.writer.render;

import net.boyechko.rst.writer.core.RenderException;
import net.boyechko.rst.writer.document.DocNode;

/**
 * Decides how a reference node is written. References without a URI stay as named references;
 * references with one become inline links.
 */
public final class ReferenceRenderer {
    private ReferenceRenderer() {}

    public enum Form {
        /** {@code `name`_}, resolved elsewhere in the document. */
        NAMED,
        /** Only an internal id; no link target is produced, so only the text is kept. */
        UNLINKED,
        /** {@code `name <uri>`_} for an external link with a display name. */
        EXTERNAL_NAMED,
        /** {@code `uri <uri>`_} for a bare external link. */
        EXTERNAL_BARE,
        /**
         * {@code `text <uri>`_} for internal links, labelled with the plain text of the subtree
         * because a link label cannot hold nested markup.
         */
        TEXT_LABELLED
    }

    /**
     * @throws RenderException when the node has neither a URI, a name nor an id
     */
    public static Form classify(DocNode node, String path) {
        if (!node.has("refuri")) {
            if (node.has("name")) {
                return Form.NAMED;
            }
            if (node.has("refid")) {
                return Form.UNLINKED;
            }
            throw RenderException.malformed(path, "Reference has no refuri, name or refid");
        }
        if (!node.has("internal")) {
            return node.has("name") ? Form.EXTERNAL_NAMED : Form.EXTERNAL_BARE;
        }
        return Form.TEXT_LABELLED;
    }

    /** The link markup for {@code form}, or null for {@link Form#UNLINKED}. */
    public static String markup(DocNode node, Form form) {
        String uri = node.getString("refuri");
        return switch (form) {
            case NAMED -> "`" + node.getString("name") + "`_";
            case UNLINKED -> null;
            case EXTERNAL_NAMED -> link(node.getString("name"), uri);
            case EXTERNAL_BARE -> link(uri, uri);
            case TEXT_LABELLED -> link(node.astext(), uri);
        };
    }

    private static String link(String label, String uri) {
        return "`" + label + " <" + uri + ">`_";
    }
}
