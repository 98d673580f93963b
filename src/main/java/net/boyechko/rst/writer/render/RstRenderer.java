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

import net.boyechko.rst.writer.core.Labels;
import net.boyechko.rst.writer.core.RenderConfig;
import net.boyechko.rst.writer.document.DocNode;
import net.boyechko.rst.writer.document.NodeKind;
import net.boyechko.rst.writer.walk.DocTreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for rendering document trees as reStructuredText. A renderer is stateless between
 * calls and may be shared; every call walks the tree with a fresh translator.
 */
public class RstRenderer {
    private static final Logger logger = LoggerFactory.getLogger(RstRenderer.class);

    private final RenderConfig config;
    private final Labels labels;

    /** Renderer with the bundled defaults and English labels. */
    public RstRenderer() {
        this(RenderConfig.loadDefault(), Labels.loadDefault());
    }

    public RstRenderer(RenderConfig config, Labels labels) {
        this.config = config.validate();
        this.labels = labels;
    }

    /**
     * Renders the document.
     *
     * @throws net.boyechko.rst.writer.core.RenderException if the tree holds a nested table, a
     *     malformed reference, or a span past the edge of its table
     */
    public String render(DocNode document) {
        return renderWithReport(document).text();
    }

    /** Renders the document and returns the non-fatal issues found along the way. */
    public RenderResult renderWithReport(DocNode document) {
        if (document == null || !document.is(NodeKind.DOCUMENT)) {
            throw new IllegalArgumentException(
                    "Root node must be a document, got "
                            + (document == null ? "null" : document.kind().nodeName()));
        }
        RstTranslator translator = new RstTranslator(config, labels);
        new DocTreeWalker().addVisitor(translator).walk(document);

        RenderResult result = new RenderResult(translator.body(), translator.getIssues());
        logger.debug(
                "Rendered {} characters with {} issue(s)",
                result.text().length(),
                result.issues().size());
        if (!result.issues().isEmpty()) {
            logger.debug("Issues:\n{}", result.issues().summary());
        }
        return result;
    }

    public RenderConfig getConfig() {
        return config;
    }
}
