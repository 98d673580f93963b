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

import static net.boyechko.rst.writer.document.DocTree.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.rst.writer.core.RenderException;
import org.junit.jupiter.api.Test;

class DocNodeTest {

    @Test
    void textElementJoinsChildrenWithoutSeparator() {
        DocNode p = paragraph(text("Hello "), emphasis("big"), text(" world"));
        assertEquals("Hello big world", p.astext());
    }

    @Test
    void blockElementSeparatesChildrenByBlankLine() {
        DocNode quote = node(NodeKind.BLOCK_QUOTE, paragraph("One"), paragraph("Two"));
        assertEquals("One\n\nTwo", quote.astext());
    }

    @Test
    void builderByNameResolvesKind() {
        DocNode node = DocNode.builder("bullet_list").build();
        assertTrue(node.is(NodeKind.BULLET_LIST));
    }

    @Test
    void builderByUnknownNameFails() {
        RenderException e =
                assertThrows(RenderException.class, () -> DocNode.builder("marquee"));
        assertEquals(RenderException.Kind.UNIMPLEMENTED_CONSTRUCT, e.kind());
    }

    @Test
    void typedAttributeAccessors() {
        DocNode entry =
                DocNode.builder(NodeKind.ENTRY)
                        .attr("morecols", 2)
                        .attr("linenos", Boolean.TRUE)
                        .attr("name", "cell")
                        .build();

        assertEquals(2, entry.getInt("morecols", 0));
        assertEquals(0, entry.getInt("morerows", 0));
        assertTrue(entry.getBoolean("linenos"));
        assertFalse(entry.getBoolean("missing"));
        assertEquals("cell", entry.getString("name"));
        assertNull(entry.getString("missing"));
        assertEquals("fallback", entry.getString("missing", "fallback"));
    }

    @Test
    void nullAttributeValueRemovesAttribute() {
        DocNode node =
                DocNode.builder(NodeKind.LITERAL_BLOCK)
                        .attr("language", "python")
                        .attr("language", null)
                        .build();
        assertFalse(node.has("language"));
    }

    @Test
    void rejectsUnsupportedAttributeTypes() {
        DocNode.Builder builder = DocNode.builder(NodeKind.IMAGE);
        assertThrows(IllegalArgumentException.class, () -> builder.attr("alt", List.of("x")));
    }

    @Test
    void requiredAttributesAreValidated() {
        RenderException e =
                assertThrows(
                        RenderException.class,
                        () ->
                                DocNode.builder(NodeKind.VERSIONMODIFIED)
                                        .attr("type", "versionadded")
                                        .build());
        assertEquals(RenderException.Kind.MALFORMED_INPUT, e.kind());
        assertTrue(e.getMessage().contains("version"));
    }

    @Test
    void negativeSpanIsMalformed() {
        assertThrows(
                RenderException.class,
                () -> DocNode.builder(NodeKind.ENTRY).attr("morerows", -1).build());
    }

    @Test
    void textNodesHaveNoChildren() {
        DocNode.Builder builder = DocNode.builder(NodeKind.TEXT);
        assertThrows(IllegalStateException.class, () -> builder.child(paragraph("x")));
    }

    @Test
    void childrenAreImmutable() {
        DocNode doc = document(paragraph("x"));
        assertThrows(
                UnsupportedOperationException.class, () -> doc.children().add(paragraph("y")));
    }

    @Test
    void admonitionFactoryRejectsOtherKinds() {
        assertThrows(IllegalArgumentException.class, () -> admonition(NodeKind.PARAGRAPH));
    }
}
