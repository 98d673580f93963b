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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.rst.writer.core.RenderException;

/**
 * Closed set of node kinds a document tree may contain. Names follow the docutils doctree element
 * names so trees produced by an upstream parser can be mapped one to one.
 */
public enum NodeKind {
    // Root and plain text
    DOCUMENT("document", Shape.BLOCK),
    TEXT("#text", Shape.TEXTUAL),

    // Structure
    SECTION("section", Shape.BLOCK),
    TITLE("title", Shape.TEXTUAL),
    SUBTITLE("subtitle", Shape.TEXTUAL),
    TOPIC("topic", Shape.BLOCK),
    SIDEBAR("sidebar", Shape.BLOCK),
    RUBRIC("rubric", Shape.TEXTUAL),
    COMPOUND("compound", Shape.BLOCK),
    GLOSSARY("glossary", Shape.BLOCK),
    TRANSITION("transition", Shape.BLOCK),
    ATTRIBUTION("attribution", Shape.TEXTUAL),
    PARAGRAPH("paragraph", Shape.TEXTUAL),
    COMPACT_PARAGRAPH("compact_paragraph", Shape.TEXTUAL),
    CENTERED("centered", Shape.TEXTUAL),
    BLOCK_QUOTE("block_quote", Shape.BLOCK),
    LINE_BLOCK("line_block", Shape.BLOCK),
    LINE("line", Shape.TEXTUAL),
    LITERAL_BLOCK("literal_block", Shape.TEXTUAL),
    DOCTEST_BLOCK("doctest_block", Shape.TEXTUAL),
    TARGET("target", Shape.TEXTUAL),
    SUBSTITUTION_DEFINITION("substitution_definition", Shape.TEXTUAL),
    COMMENT("comment", Shape.TEXTUAL),
    RAW("raw", Shape.TEXTUAL),
    META("meta", Shape.BLOCK),
    INDEX("index", Shape.BLOCK),
    HIGHLIGHTLANG("highlightlang", Shape.BLOCK),
    ACKS("acks", Shape.BLOCK),
    HLIST("hlist", Shape.BLOCK),
    HLISTCOL("hlistcol", Shape.BLOCK),
    PRODUCTIONLIST("productionlist", Shape.BLOCK),
    PRODUCTION("production", Shape.TEXTUAL),
    SYSTEM_MESSAGE("system_message", Shape.BLOCK),
    FIGURE("figure", Shape.BLOCK),
    CAPTION("caption", Shape.TEXTUAL),
    IMAGE("image", Shape.BLOCK),

    // Lists
    BULLET_LIST("bullet_list", Shape.BLOCK),
    ENUMERATED_LIST("enumerated_list", Shape.BLOCK),
    LIST_ITEM("list_item", Shape.BLOCK),
    DEFINITION_LIST("definition_list", Shape.BLOCK),
    DEFINITION_LIST_ITEM("definition_list_item", Shape.BLOCK),
    TERM("term", Shape.TEXTUAL),
    TERMSEP("termsep", Shape.BLOCK),
    CLASSIFIER("classifier", Shape.TEXTUAL),
    DEFINITION("definition", Shape.BLOCK),
    FIELD_LIST("field_list", Shape.BLOCK),
    FIELD("field", Shape.BLOCK),
    FIELD_NAME("field_name", Shape.TEXTUAL),
    FIELD_BODY("field_body", Shape.BLOCK),
    OPTION_LIST("option_list", Shape.BLOCK),
    OPTION_LIST_ITEM("option_list_item", Shape.BLOCK),
    OPTION_GROUP("option_group", Shape.BLOCK),
    OPTION("option", Shape.BLOCK),
    OPTION_STRING("option_string", Shape.TEXTUAL),
    OPTION_ARGUMENT("option_argument", Shape.TEXTUAL, "delimiter"),
    DESCRIPTION("description", Shape.BLOCK),

    // Tables
    TABLE("table", Shape.BLOCK),
    TABULAR_COL_SPEC("tabular_col_spec", Shape.BLOCK),
    TGROUP("tgroup", Shape.BLOCK),
    COLSPEC("colspec", Shape.BLOCK),
    THEAD("thead", Shape.BLOCK),
    TBODY("tbody", Shape.BLOCK),
    ROW("row", Shape.BLOCK),
    ENTRY("entry", Shape.BLOCK),

    // Footnotes and citations
    FOOTNOTE("footnote", Shape.BLOCK),
    CITATION("citation", Shape.BLOCK),
    LABEL("label", Shape.TEXTUAL),
    FOOTNOTE_REFERENCE("footnote_reference", Shape.TEXTUAL),
    CITATION_REFERENCE("citation_reference", Shape.TEXTUAL),

    // Admonitions
    ADMONITION("admonition", Shape.ADMONITION),
    ATTENTION("attention", Shape.ADMONITION),
    CAUTION("caution", Shape.ADMONITION),
    DANGER("danger", Shape.ADMONITION),
    ERROR("error", Shape.ADMONITION),
    HINT("hint", Shape.ADMONITION),
    IMPORTANT("important", Shape.ADMONITION),
    NOTE("note", Shape.ADMONITION),
    TIP("tip", Shape.ADMONITION),
    WARNING("warning", Shape.ADMONITION),
    SEEALSO("seealso", Shape.ADMONITION),
    VERSIONMODIFIED("versionmodified", Shape.BLOCK, "type", "version"),

    // API descriptions
    DESC("desc", Shape.BLOCK),
    DESC_SIGNATURE("desc_signature", Shape.TEXTUAL),
    DESC_NAME("desc_name", Shape.TEXTUAL),
    DESC_ADDNAME("desc_addname", Shape.TEXTUAL),
    DESC_TYPE("desc_type", Shape.TEXTUAL),
    DESC_RETURNS("desc_returns", Shape.TEXTUAL),
    DESC_PARAMETERLIST("desc_parameterlist", Shape.TEXTUAL),
    DESC_PARAMETER("desc_parameter", Shape.TEXTUAL),
    DESC_OPTIONAL("desc_optional", Shape.TEXTUAL),
    DESC_ANNOTATION("desc_annotation", Shape.TEXTUAL),
    DESC_CONTENT("desc_content", Shape.BLOCK),
    REFCOUNT("refcount", Shape.TEXTUAL),

    // Inline markup
    EMPHASIS("emphasis", Shape.TEXTUAL),
    LITERAL_EMPHASIS("literal_emphasis", Shape.TEXTUAL),
    STRONG("strong", Shape.TEXTUAL),
    LITERAL("literal", Shape.TEXTUAL),
    SUBSCRIPT("subscript", Shape.TEXTUAL),
    SUPERSCRIPT("superscript", Shape.TEXTUAL),
    TITLE_REFERENCE("title_reference", Shape.TEXTUAL),
    ABBREVIATION("abbreviation", Shape.TEXTUAL),
    REFERENCE("reference", Shape.TEXTUAL),
    DOWNLOAD_REFERENCE("download_reference", Shape.TEXTUAL),
    PENDING_XREF("pending_xref", Shape.TEXTUAL),
    GENERATED("generated", Shape.TEXTUAL),
    INLINE("inline", Shape.TEXTUAL),
    PROBLEMATIC("problematic", Shape.TEXTUAL);

    /** How a kind joins its children's text and whether it is a labelled callout. */
    private enum Shape {
        BLOCK,
        TEXTUAL,
        ADMONITION
    }

    private static final Map<String, NodeKind> BY_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_NAME.put(kind.nodeName, kind);
        }
    }

    private final String nodeName;
    private final Shape shape;
    private final List<String> requiredAttributes;

    NodeKind(String nodeName, Shape shape, String... requiredAttributes) {
        this.nodeName = nodeName;
        this.shape = shape;
        this.requiredAttributes = Collections.unmodifiableList(Arrays.asList(requiredAttributes));
    }

    /** The docutils element name, e.g. {@code bullet_list}. */
    public String nodeName() {
        return nodeName;
    }

    /** Text elements concatenate their children's text; others separate it by a blank line. */
    public boolean isTextElement() {
        return shape == Shape.TEXTUAL;
    }

    public boolean isAdmonition() {
        return shape == Shape.ADMONITION;
    }

    public List<String> requiredAttributes() {
        return requiredAttributes;
    }

    /**
     * Resolves a docutils element name.
     *
     * @throws RenderException if no kind has that name
     */
    public static NodeKind forName(String name) {
        NodeKind kind = BY_NAME.get(name);
        if (kind == null) {
            throw RenderException.unknownNode(name);
        }
        return kind;
    }
}
