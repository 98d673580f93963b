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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.rst.writer.core.RenderException;
import net.boyechko.rst.writer.document.DocNode;
import net.boyechko.rst.writer.document.NodeKind;
import net.boyechko.rst.writer.render.ReferenceRenderer.Form;
import org.junit.jupiter.api.Test;

class ReferenceRendererTest {

    private static DocNode.Builder reference(String text) {
        return DocNode.builder(NodeKind.REFERENCE).text(text);
    }

    @Test
    void namedReferenceWithoutUri() {
        DocNode node = reference("Intro").attr("name", "Intro").build();
        assertEquals(Form.NAMED, ReferenceRenderer.classify(node, "/r"));
        assertEquals("`Intro`_", ReferenceRenderer.markup(node, Form.NAMED));
    }

    @Test
    void idOnlyReferenceHasNoMarkup() {
        DocNode node = reference("here").attr("refid", "target-1").build();
        assertEquals(Form.UNLINKED, ReferenceRenderer.classify(node, "/r"));
        assertNull(ReferenceRenderer.markup(node, Form.UNLINKED));
    }

    @Test
    void externalLinkWithName() {
        DocNode node =
                reference("Example")
                        .attr("name", "Example")
                        .attr("refuri", "http://example.com")
                        .build();
        Form form = ReferenceRenderer.classify(node, "/r");
        assertEquals(Form.EXTERNAL_NAMED, form);
        assertEquals("`Example <http://example.com>`_", ReferenceRenderer.markup(node, form));
    }

    @Test
    void bareExternalLinkUsesUriAsLabel() {
        DocNode node = reference("http://example.com").attr("refuri", "http://example.com").build();
        Form form = ReferenceRenderer.classify(node, "/r");
        assertEquals(Form.EXTERNAL_BARE, form);
        assertEquals(
                "`http://example.com <http://example.com>`_", ReferenceRenderer.markup(node, form));
    }

    @Test
    void internalLinkIsLabelledWithPlainText() {
        DocNode node =
                DocNode.builder(NodeKind.REFERENCE)
                        .attr("refuri", "api.html#parse")
                        .attr("internal", Boolean.TRUE)
                        .child(DocNode.builder(NodeKind.LITERAL).text("parse()").build())
                        .build();
        Form form = ReferenceRenderer.classify(node, "/r");
        assertEquals(Form.TEXT_LABELLED, form);
        assertEquals("`parse() <api.html#parse>`_", ReferenceRenderer.markup(node, form));
    }

    @Test
    void referenceWithoutTargetIsMalformed() {
        DocNode node = reference("dangling").build();
        RenderException e =
                assertThrows(RenderException.class, () -> ReferenceRenderer.classify(node, "/p"));
        assertEquals(RenderException.Kind.MALFORMED_INPUT, e.kind());
        assertEquals("/p", e.path());
    }
}
