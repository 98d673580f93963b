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
package net.boyechko.rst.writer.document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Shorthand factories for assembling document trees in code. */
public final class DocTree {
    private DocTree() {}

    public static DocNode text(String value) {
        return DocNode.text(value);
    }

    public static DocNode node(NodeKind kind, DocNode... children) {
        return DocNode.builder(kind).children(Arrays.asList(children)).build();
    }

    /** A text element holding a single text child. */
    public static DocNode textual(NodeKind kind, String value) {
        return DocNode.builder(kind).text(value).build();
    }

    public static DocNode document(DocNode... children) {
        return node(NodeKind.DOCUMENT, children);
    }

    public static DocNode section(String title, DocNode... body) {
        List<DocNode> kids = new ArrayList<>();
        kids.add(title(title));
        kids.addAll(Arrays.asList(body));
        return DocNode.builder(NodeKind.SECTION).children(kids).build();
    }

    public static DocNode title(String value) {
        return textual(NodeKind.TITLE, value);
    }

    public static DocNode paragraph(String value) {
        return textual(NodeKind.PARAGRAPH, value);
    }

    public static DocNode paragraph(DocNode... inline) {
        return node(NodeKind.PARAGRAPH, inline);
    }

    public static DocNode emphasis(String value) {
        return textual(NodeKind.EMPHASIS, value);
    }

    public static DocNode strong(String value) {
        return textual(NodeKind.STRONG, value);
    }

    public static DocNode literal(String value) {
        return textual(NodeKind.LITERAL, value);
    }

    public static DocNode bulletList(DocNode... items) {
        return node(NodeKind.BULLET_LIST, items);
    }

    public static DocNode enumeratedList(DocNode... items) {
        return node(NodeKind.ENUMERATED_LIST, items);
    }

    public static DocNode listItem(DocNode... body) {
        return node(NodeKind.LIST_ITEM, body);
    }

    /** A list item whose body is one paragraph. */
    public static DocNode listItem(String paragraph) {
        return listItem(paragraph(paragraph));
    }

    public static DocNode definitionItem(String term, String classifier, DocNode... definition) {
        List<DocNode> kids = new ArrayList<>();
        kids.add(textual(NodeKind.TERM, term));
        if (classifier != null) {
            kids.add(textual(NodeKind.CLASSIFIER, classifier));
        }
        kids.add(node(NodeKind.DEFINITION, definition));
        return DocNode.builder(NodeKind.DEFINITION_LIST_ITEM).children(kids).build();
    }

    public static DocNode field(String name, DocNode... body) {
        return node(
                NodeKind.FIELD,
                textual(NodeKind.FIELD_NAME, name),
                node(NodeKind.FIELD_BODY, body));
    }

    public static DocNode admonition(NodeKind kind, DocNode... body) {
        if (!kind.isAdmonition()) {
            throw new IllegalArgumentException(kind.nodeName() + " is not an admonition");
        }
        return node(kind, body);
    }

    public static DocNode literalBlock(String language, String code) {
        return DocNode.builder(NodeKind.LITERAL_BLOCK)
                .attr("language", language)
                .text(code)
                .build();
    }

    public static DocNode image(String alt) {
        return DocNode.builder(NodeKind.IMAGE).attr("alt", alt).build();
    }

    /** An external link with a display name. */
    public static DocNode link(String name, String uri) {
        return DocNode.builder(NodeKind.REFERENCE)
                .attr("name", name)
                .attr("refuri", uri)
                .text(name)
                .build();
    }

    public static DocNode entry(String value) {
        return node(NodeKind.ENTRY, paragraph(value));
    }

    /** An entry that spans {@code moreCols} further columns and {@code moreRows} further rows. */
    public static DocNode entry(String value, int moreCols, int moreRows) {
        DocNode.Builder b = DocNode.builder(NodeKind.ENTRY).child(paragraph(value));
        if (moreCols > 0) {
            b.attr("morecols", moreCols);
        }
        if (moreRows > 0) {
            b.attr("morerows", moreRows);
        }
        return b.build();
    }

    public static DocNode row(DocNode... entries) {
        return node(NodeKind.ROW, entries);
    }

    /** A table of plain cells, every row in the body. */
    public static DocNode table(String[][] cells) {
        List<DocNode> rows = new ArrayList<>();
        for (String[] cellRow : cells) {
            List<DocNode> entries = new ArrayList<>();
            for (String cell : cellRow) {
                entries.add(entry(cell));
            }
            rows.add(DocNode.builder(NodeKind.ROW).children(entries).build());
        }
        return table(rows.toArray(new DocNode[0]));
    }

    public static DocNode table(DocNode... rows) {
        return node(NodeKind.TABLE, node(NodeKind.TGROUP, node(NodeKind.TBODY, rows)));
    }
}
