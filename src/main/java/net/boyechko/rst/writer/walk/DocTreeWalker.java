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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.rst.writer.document.DocNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a document tree depth-first, invoking every registered visitor at each node. Exceptions
 * thrown by a visitor end the walk.
 */
public class DocTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(DocTreeWalker.class);

    private final List<DocTreeVisitor> visitors = new ArrayList<>();

    private int globalIndex;

    public DocTreeWalker addVisitor(DocTreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public void walk(DocNode root) {
        if (root == null) {
            throw new IllegalArgumentException("Document root is required");
        }
        this.globalIndex = 0;

        for (DocTreeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        walkNode(root, null, "/", 0, 0);

        for (DocTreeVisitor visitor : visitors) {
            visitor.afterTraversal();
        }
        logger.debug("Visited {} nodes with {} visitor(s)", globalIndex, visitors.size());
    }

    private void walkNode(DocNode node, DocNode parent, String parentPath, int depth, int index) {
        globalIndex++;
        String path = parentPath + node.kind().nodeName() + "[" + globalIndex + "]";
        VisitorContext ctx = new VisitorContext(node, parent, path, depth, index);

        // Children are skipped if any visitor asks for it
        boolean continueToChildren = true;
        for (DocTreeVisitor visitor : visitors) {
            if (visitor.enter(ctx) == Descent.SKIP_CHILDREN) {
                continueToChildren = false;
            }
        }

        if (continueToChildren) {
            List<DocNode> children = node.children();
            for (int i = 0; i < children.size(); i++) {
                walkNode(children.get(i), node, path + ".", depth + 1, i);
            }
        }

        for (DocTreeVisitor visitor : visitors) {
            visitor.leave(ctx);
        }
    }
}
