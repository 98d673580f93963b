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
package net.boyechko.rst.writer.walk;

import java.util.List;
import net.boyechko.rst.writer.document.DocNode;
import net.boyechko.rst.writer.document.NodeKind;

/**
 * Immutable context passed to visitors during document tree traversal. Carries the current node,
 * its parent and its position so handlers can make parent-aware decisions.
 */
public record VisitorContext(
        DocNode node,
        /** Null for the root. */
        DocNode parent,
        String path,
        /** Depth in the tree (0 = root). */
        int depth,
        /** Position among the parent's children (0 for the root). */
        int index) {

    public NodeKind kind() {
        return node.kind();
    }

    public boolean parentIs(NodeKind kind) {
        return parent != null && parent.kind() == kind;
    }

    public boolean parentIsAdmonition() {
        return parent != null && parent.kind().isAdmonition();
    }

    /** The sibling right after this node, or null. */
    public DocNode nextSibling() {
        if (parent == null) {
            return null;
        }
        List<DocNode> siblings = parent.children();
        return index + 1 < siblings.size() ? siblings.get(index + 1) : null;
    }

    public boolean nextSiblingIs(NodeKind kind) {
        DocNode next = nextSibling();
        return next != null && next.kind() == kind;
    }

    /** True when no earlier sibling has the same kind as this node. */
    public boolean isFirstOfKind() {
        if (parent == null) {
            return true;
        }
        for (int i = 0; i < index; i++) {
            if (parent.children().get(i).kind() == node.kind()) {
                return false;
            }
        }
        return true;
    }
}
