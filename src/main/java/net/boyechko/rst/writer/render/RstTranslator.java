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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.rst.writer.core.LabelKey;
import net.boyechko.rst.writer.core.Labels;
import net.boyechko.rst.writer.core.RenderConfig;
import net.boyechko.rst.writer.core.RenderException;
import net.boyechko.rst.writer.document.DocNode;
import net.boyechko.rst.writer.document.NodeKind;
import net.boyechko.rst.writer.issue.Issue;
import net.boyechko.rst.writer.issue.IssueList;
import net.boyechko.rst.writer.issue.IssueLoc;
import net.boyechko.rst.writer.issue.IssueSev;
import net.boyechko.rst.writer.issue.IssueType;
import net.boyechko.rst.writer.lists.ListTracker;
import net.boyechko.rst.writer.lists.ListType;
import net.boyechko.rst.writer.output.OutputAssembler;
import net.boyechko.rst.writer.output.StateStack;
import net.boyechko.rst.writer.output.TextWrapper;
import net.boyechko.rst.writer.table.TableLayout;
import net.boyechko.rst.writer.table.TableMatrix;
import net.boyechko.rst.writer.walk.Descent;
import net.boyechko.rst.writer.walk.DocTreeVisitor;
import net.boyechko.rst.writer.walk.VisitorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates one document tree into reStructuredText. Every node kind has an entry action and an
 * exit action; together they push and pop output frames, drive the list and table state, and emit
 * markup. One instance renders one document.
 */
public class RstTranslator implements DocTreeVisitor {
    private static final Logger logger = LoggerFactory.getLogger(RstTranslator.class);

    /** Column at which a field body starts, counted from the opening colon of its name. */
    static final int FIELD_NAME_WIDTH = 16;

    private static final Set<String> STRONG_SIGNATURES =
            Set.of("class", "exception", "method", "function");

    private final RenderConfig config;
    private final Labels labels;
    private final int indent;

    private final StateStack stack;
    private final ListTracker lists = new ListTracker();
    private TableMatrix table;

    private final Deque<String> noteLabels = new ArrayDeque<>();
    private final Deque<String> fieldPrefixes = new ArrayDeque<>();
    private int sectionLevel;
    private boolean firstParam;
    private boolean firstOption;

    private final IssueList issues = new IssueList();
    private final Set<NodeKind> reportedKinds = EnumSet.noneOf(NodeKind.class);
    private String body;

    public RstTranslator(RenderConfig config, Labels labels) {
        this.config = config;
        this.labels = labels;
        this.indent = config.getIndent();
        this.stack = new StateStack(config.getMaxWidth());
    }

    @Override
    public String name() {
        return "reStructuredText Translator";
    }

    /** The rendered text; available once the document node has been left. */
    public String body() {
        if (body == null) {
            throw new IllegalStateException("Document has not been rendered yet");
        }
        return body;
    }

    public IssueList getIssues() {
        return issues;
    }

    @Override
    public Descent enter(VisitorContext ctx) {
        DocNode node = ctx.node();
        return switch (ctx.kind()) {
            case DOCUMENT -> push(0);
            case TEXT -> raw(node.astext());

            case HIGHLIGHTLANG,
                    TABULAR_COL_SPEC,
                    COLSPEC,
                    LABEL,
                    INDEX,
                    SUBSTITUTION_DEFINITION,
                    COMMENT,
                    META -> Descent.SKIP_CHILDREN;

            case SECTION -> {
                sectionLevel++;
                yield Descent.CONTINUE;
            }
            case TOPIC, SIDEBAR, DESC, TERM, ENTRY, ADMONITION, OPTION_LIST_ITEM, DOCTEST_BLOCK,
                    LINE_BLOCK, FIELD -> push(0);
            case DESC_CONTENT, FIGURE, SEEALSO, DEFINITION, FIELD_BODY, ATTENTION, CAUTION,
                    DANGER, ERROR, HINT, IMPORTANT, NOTE, TIP, WARNING -> push(indent);
            case RUBRIC -> {
                stack.push(0);
                yield raw("-[ ");
            }
            case TITLE -> enterTitle(ctx);
            case SUBTITLE, CAPTION, HLIST, HLISTCOL, DOWNLOAD_REFERENCE -> unsupported(ctx);
            case ATTRIBUTION -> raw("-- ");

            case DESC_SIGNATURE -> raw(signatureMark(ctx));
            case DESC_NAME -> {
                stack.appendRaw(node.getString("rawsource", node.astext()));
                yield Descent.SKIP_CHILDREN;
            }
            case DESC_RETURNS -> raw(" -> ");
            case DESC_PARAMETERLIST -> {
                firstParam = true;
                yield raw("(");
            }
            case DESC_PARAMETER -> enterParameter(node);
            case DESC_OPTIONAL -> raw("[");
            case DESC_ANNOTATION -> enterAnnotation(ctx);
            case PRODUCTIONLIST -> renderProductionList(node);

            case FOOTNOTE, CITATION -> enterNote(node);
            case OPTION_GROUP -> {
                firstOption = true;
                yield Descent.CONTINUE;
            }
            case OPTION -> {
                if (firstOption) {
                    firstOption = false;
                    yield Descent.CONTINUE;
                }
                yield raw(", ");
            }
            case OPTION_ARGUMENT -> raw(node.getString("delimiter"));

            case TABLE -> enterTable(ctx);
            case ROW -> {
                requireTable(ctx).startRow();
                yield Descent.CONTINUE;
            }

            case ACKS -> renderAcks(node);
            case IMAGE -> {
                String alt = node.getString("alt");
                stack.appendRaw(alt != null ? "[image: " + alt + "]" : "[image]");
                yield Descent.SKIP_CHILDREN;
            }
            case TRANSITION -> renderTransition();

            case BULLET_LIST -> enterList(ListType.BULLET);
            case ENUMERATED_LIST -> enterList(ListType.ENUMERATED);
            case DEFINITION_LIST -> enterList(ListType.DEFINITION);
            case LIST_ITEM -> enterListItem();
            case TERMSEP -> {
                stack.appendRaw(", ");
                yield Descent.SKIP_CHILDREN;
            }
            case CLASSIFIER -> raw(" : ");
            case FIELD_NAME -> {
                stack.push(0);
                yield raw(":");
            }

            case VERSIONMODIFIED -> enterVersionModified(ctx);
            case LITERAL_BLOCK -> enterLiteralBlock(node);
            case LINE -> raw("| ");
            case BLOCK_QUOTE -> {
                stack.appendRaw("..");
                yield push(indent);
            }
            case PARAGRAPH -> inlinedParagraph(ctx) ? Descent.CONTINUE : push(0);
            case TARGET -> {
                if (node.has("refid")) {
                    stack.push(0);
                    stack.appendRaw(".. _" + node.getString("refid") + ":\n");
                }
                yield Descent.CONTINUE;
            }
            case REFERENCE -> enterReference(ctx);

            case EMPHASIS, LITERAL_EMPHASIS, TITLE_REFERENCE -> raw("*");
            case STRONG -> raw("**");
            case LITERAL -> raw("``");
            case SUBSCRIPT -> raw("_");
            case SUPERSCRIPT -> raw("^");
            case PROBLEMATIC -> raw(">>");
            case FOOTNOTE_REFERENCE, CITATION_REFERENCE -> {
                stack.appendRaw("[" + node.astext() + "]");
                yield Descent.SKIP_CHILDREN;
            }
            case SYSTEM_MESSAGE -> {
                stack.push(0);
                stack.appendRaw("<SYSTEM MESSAGE: " + node.astext() + ">");
                stack.pop();
                yield Descent.SKIP_CHILDREN;
            }
            case RAW -> renderRaw(ctx);

            // Wrappers whose children carry all the output
            case COMPOUND, GLOSSARY, COMPACT_PARAGRAPH, CENTERED, DESC_ADDNAME, DESC_TYPE,
                    REFCOUNT, PRODUCTION, OPTION_LIST, OPTION_STRING, DESCRIPTION, TGROUP,
                    THEAD, TBODY, DEFINITION_LIST_ITEM, FIELD_LIST, ABBREVIATION, PENDING_XREF,
                    GENERATED, INLINE -> Descent.CONTINUE;
        };
    }

    @Override
    public void leave(VisitorContext ctx) {
        DocNode node = ctx.node();
        switch (ctx.kind()) {
            case DOCUMENT -> {
                stack.pop();
                if (stack.depth() != 1) {
                    throw new IllegalStateException(
                            "Unbalanced output frames: " + stack.depth() + " left open");
                }
                body =
                        OutputAssembler.assemble(
                                stack.root(), config.getNewlines().separator());
            }
            case SECTION -> sectionLevel--;
            case TOPIC, SIDEBAR, DESC, DESC_CONTENT, FIGURE, ADMONITION, OPTION_LIST_ITEM,
                    VERSIONMODIFIED, BLOCK_QUOTE, DEFINITION, LITERAL_BLOCK,
                    DOCTEST_BLOCK, LINE_BLOCK -> stack.pop();
            case RUBRIC -> {
                stack.appendRaw(" ]-");
                stack.pop();
            }
            case TITLE -> leaveTitle(ctx);
            case DESC_SIGNATURE -> stack.appendRaw(signatureMark(ctx));
            case DESC_PARAMETERLIST -> stack.appendRaw(")");
            case DESC_OPTIONAL -> stack.appendRaw("]");
            case SEEALSO -> stack.pop(false, StateStack.BLANK_LINE, "");
            case FOOTNOTE, CITATION ->
                    stack.pop(false, StateStack.BLANK_LINE, "[" + noteLabels.pop() + "] ");
            case OPTION_GROUP -> stack.appendRaw("     ");

            case TABLE -> leaveTable(ctx);
            case ROW -> requireTable(ctx).endRow();
            case ENTRY ->
                    requireTable(ctx)
                            .addCell(
                                    stack.popFlattened(),
                                    node.getInt("morecols", 0),
                                    node.getInt("morerows", 0));

            case BULLET_LIST, ENUMERATED_LIST, DEFINITION_LIST -> lists.leave();
            case LIST_ITEM -> leaveListItem();
            case TERM, CLASSIFIER -> {
                // A term stays open until its last classifier has been written
                if (!ctx.nextSiblingIs(NodeKind.CLASSIFIER)) {
                    stack.pop(false, null, null);
                }
            }
            case FIELD_NAME -> {
                stack.appendRaw(":");
                String name = stack.popRawText();
                int pad = Math.max(1, FIELD_NAME_WIDTH - TextWrapper.displayWidth(node.astext()));
                fieldPrefixes.push(name + " ".repeat(pad));
            }
            case FIELD_BODY -> leaveFieldBody();
            case FIELD -> stack.pop(false, null, null);
            case ATTENTION, CAUTION, DANGER, ERROR, HINT, IMPORTANT, NOTE, TIP, WARNING ->
                    stack.pop(
                            false, StateStack.BLANK_LINE, labels.get(labelFor(ctx.kind())) + ": ");

            case LINE -> stack.appendRaw("\n");
            case PARAGRAPH -> {
                if (!inlinedParagraph(ctx)) {
                    stack.pop(config.isWrapParagraphs(), StateStack.BLANK_LINE, null);
                }
            }
            case TARGET -> {
                if (node.has("refid")) {
                    stack.pop();
                }
            }

            case EMPHASIS, LITERAL_EMPHASIS, TITLE_REFERENCE -> stack.appendRaw("*");
            case STRONG -> stack.appendRaw("**");
            case LITERAL -> stack.appendRaw("``");
            case PROBLEMATIC -> stack.appendRaw("<<");
            case ABBREVIATION -> {
                if (node.has("explanation")) {
                    stack.appendRaw(" (" + node.getString("explanation") + ")");
                }
            }

            // Nothing to close: either self-contained or pure wrappers
            case TEXT, HIGHLIGHTLANG, TABULAR_COL_SPEC, COLSPEC, LABEL, INDEX,
                    SUBSTITUTION_DEFINITION, COMMENT, META, SUBTITLE, CAPTION, HLIST, HLISTCOL,
                    DOWNLOAD_REFERENCE, ATTRIBUTION, DESC_NAME, DESC_RETURNS, DESC_PARAMETER,
                    DESC_ANNOTATION, PRODUCTIONLIST, OPTION, OPTION_ARGUMENT, ACKS, IMAGE,
                    TRANSITION, TERMSEP, REFERENCE, SUBSCRIPT, SUPERSCRIPT, FOOTNOTE_REFERENCE,
                    CITATION_REFERENCE, SYSTEM_MESSAGE, RAW, COMPOUND, GLOSSARY,
                    COMPACT_PARAGRAPH, CENTERED, DESC_ADDNAME, DESC_TYPE, REFCOUNT, PRODUCTION,
                    OPTION_LIST, OPTION_STRING, DESCRIPTION, TGROUP, THEAD, TBODY,
                    DEFINITION_LIST_ITEM, FIELD_LIST, PENDING_XREF, GENERATED, INLINE -> {}
        }
    }

    private Descent push(int frameIndent) {
        stack.push(frameIndent);
        return Descent.CONTINUE;
    }

    private Descent raw(String text) {
        stack.appendRaw(text);
        return Descent.CONTINUE;
    }

    private Descent enterTitle(VisitorContext ctx) {
        if (ctx.parentIsAdmonition()) {
            stack.appendRaw(ctx.node().astext() + ": ");
            return Descent.SKIP_CHILDREN;
        }
        return push(0);
    }

    private void leaveTitle(VisitorContext ctx) {
        if (ctx.parentIsAdmonition()) {
            return;
        }
        String text = stack.popRawText();
        char underline = ctx.parentIs(NodeKind.SECTION) ? config.sectionChar(sectionLevel) : '^';
        String rule = String.valueOf(underline).repeat(TextWrapper.displayWidth(text));
        stack.appendBlock(0, List.of("", text, rule, ""));
    }

    /** The first paragraph of a callout joins the label line instead of opening a block. */
    private boolean inlinedParagraph(VisitorContext ctx) {
        boolean labelled =
                (ctx.parentIsAdmonition() && !ctx.parentIs(NodeKind.SEEALSO))
                        || ctx.parentIs(NodeKind.VERSIONMODIFIED);
        return labelled && ctx.isFirstOfKind();
    }

    private String signatureMark(VisitorContext ctx) {
        String objtype = ctx.parent() != null ? ctx.parent().getString("objtype") : null;
        return objtype != null && STRONG_SIGNATURES.contains(objtype) ? "**" : "``";
    }

    private Descent enterParameter(DocNode node) {
        if (!firstParam) {
            stack.appendRaw(", ");
        } else {
            firstParam = false;
        }
        stack.appendRaw(node.astext());
        return Descent.SKIP_CHILDREN;
    }

    private Descent enterAnnotation(VisitorContext ctx) {
        String content = ctx.node().astext();
        int maxWidth = config.getMaxWidth();
        if (content.length() <= maxWidth) {
            return Descent.CONTINUE;
        }
        int half = maxWidth / 3;
        stack.appendRaw(
                content.substring(0, half) + " ... " + content.substring(content.length() - half));
        record(
                ctx,
                IssueType.ANNOTATION_SHORTENED,
                IssueSev.INFO,
                "Annotation of " + content.length() + " characters shortened");
        return Descent.SKIP_CHILDREN;
    }

    private Descent renderProductionList(DocNode node) {
        stack.push(indent);
        int maxLen = 0;
        for (DocNode production : node.children()) {
            maxLen = Math.max(maxLen, production.getString("tokenname", "").length());
        }
        String lastName = "";
        for (DocNode production : node.children()) {
            String token = production.getString("tokenname", "");
            if (!token.isEmpty()) {
                stack.appendRaw(token + " ".repeat(maxLen - token.length()) + " ::= ");
                lastName = token;
            } else {
                stack.appendRaw(" ".repeat(lastName.length()) + "     ");
            }
            stack.appendRaw(production.astext() + "\n");
        }
        stack.pop(false, StateStack.BLANK_LINE, null);
        return Descent.SKIP_CHILDREN;
    }

    private Descent enterNote(DocNode node) {
        DocNode first = node.firstChild();
        String label = first != null && first.is(NodeKind.LABEL) ? first.astext().strip() : "";
        noteLabels.push(label);
        return push(label.length() + indent);
    }

    private Descent enterTable(VisitorContext ctx) {
        if (table != null) {
            throw RenderException.nestedTable(ctx.path());
        }
        table = new TableMatrix();
        return push(0);
    }

    private void leaveTable(VisitorContext ctx) {
        table.finish(ctx.path());
        List<String> grid = TableLayout.draw(table);
        table = null;
        stack.appendRaw(String.join("\n", grid));
        stack.pop();
    }

    private TableMatrix requireTable(VisitorContext ctx) {
        if (table == null) {
            throw RenderException.malformed(ctx.path(), "Table row outside of a table");
        }
        return table;
    }

    private Descent renderAcks(DocNode node) {
        DocNode names = node.firstChild();
        String joined =
                names == null
                        ? ""
                        : names.children().stream()
                                .map(DocNode::astext)
                                .collect(Collectors.joining(", "));
        stack.push(0);
        stack.appendRaw(joined + ".");
        stack.pop();
        return Descent.SKIP_CHILDREN;
    }

    private Descent renderTransition() {
        int used = stack.cumulativeIndent();
        stack.push(0);
        stack.appendRaw("=".repeat(Math.max(1, config.getMaxWidth() - used)));
        stack.pop();
        return Descent.SKIP_CHILDREN;
    }

    private Descent enterList(ListType type) {
        lists.enter(type);
        return Descent.CONTINUE;
    }

    private Descent enterListItem() {
        switch (lists.current().type()) {
            case BULLET -> stack.push(2);
            case ENUMERATED -> stack.push(String.valueOf(lists.nextNumber()).length() + indent);
            case DEFINITION -> {}
        }
        return Descent.CONTINUE;
    }

    private void leaveListItem() {
        ListTracker.Level level = lists.current();
        switch (level.type()) {
            case BULLET -> stack.pop(false, null, "* ");
            case ENUMERATED -> stack.pop(false, null, level.counter() + ". ");
            case DEFINITION -> {}
        }
    }

    /** The padded field name becomes the head of the body's first line. */
    private void leaveFieldBody() {
        String prefix = fieldPrefixes.pop();
        if (stack.topIsEmpty()) {
            stack.pop();
            stack.appendBlock(0, List.of(prefix.stripTrailing(), ""));
        } else {
            stack.pop(false, StateStack.BLANK_LINE, prefix);
        }
    }

    private Descent enterVersionModified(VisitorContext ctx) {
        DocNode node = ctx.node();
        LabelKey key =
                switch (node.getString("type")) {
                    case "versionadded" -> LabelKey.VERSION_ADDED;
                    case "versionchanged" -> LabelKey.VERSION_CHANGED;
                    case "deprecated" -> LabelKey.DEPRECATED;
                    default -> throw RenderException.malformed(
                            ctx.path(),
                            "Unknown version change type '" + node.getString("type") + "'");
                };
        stack.push(0);
        String label = labels.format(key, node.getString("version"));
        stack.appendRaw(node.children().isEmpty() ? label + "." : label + ": ");
        return Descent.CONTINUE;
    }

    private Descent enterLiteralBlock(DocNode node) {
        String language = node.getString("language", "default");
        String rawSource = node.getString("rawsource");
        if (rawSource != null && !rawSource.equals(node.astext())) {
            // Parsed literal: its text went through inline markup and must not be highlighted
            stack.appendRaw("::");
        } else if (language.equals("default")) {
            stack.appendRaw("::");
        } else {
            stack.appendRaw(".. code-block:: " + language);
            if (config.isPreserveCodeBlockFlags() && node.getBoolean("linenos")) {
                stack.appendRaw("\n" + " ".repeat(indent) + ":linenos:");
            }
        }
        return push(indent);
    }

    private Descent enterReference(VisitorContext ctx) {
        DocNode node = ctx.node();
        ReferenceRenderer.Form form = ReferenceRenderer.classify(node, ctx.path());
        if (form == ReferenceRenderer.Form.UNLINKED) {
            record(
                    ctx,
                    IssueType.UNLINKED_REFERENCE,
                    IssueSev.INFO,
                    "Reference to '" + node.getString("refid") + "' written as plain text");
            return Descent.CONTINUE;
        }
        stack.appendRaw(ReferenceRenderer.markup(node, form));
        return Descent.SKIP_CHILDREN;
    }

    private Descent renderRaw(VisitorContext ctx) {
        DocNode node = ctx.node();
        List<String> formats = List.of(node.getString("format", "").trim().split("\\s+"));
        if (formats.contains("text")) {
            stack.appendBlock(0, TextWrapper.splitLines(node.astext()));
        } else {
            record(
                    ctx,
                    IssueType.RAW_CONTENT_SKIPPED,
                    IssueSev.INFO,
                    "Raw content for format '" + node.getString("format", "") + "' skipped");
        }
        return Descent.SKIP_CHILDREN;
    }

    /** Renders the children without formatting of their own. */
    private Descent unsupported(VisitorContext ctx) {
        if (!reportedKinds.contains(ctx.kind())) {
            record(
                    ctx,
                    IssueType.UNSUPPORTED_FORMATTING,
                    IssueSev.WARNING,
                    "<" + ctx.kind().nodeName() + "> has no text formatting; content kept");
        }
        return Descent.CONTINUE;
    }

    /** Collects an issue; the first one for each node kind is also logged as a warning. */
    private void record(VisitorContext ctx, IssueType type, IssueSev sev, String message) {
        if (reportedKinds.add(ctx.kind())) {
            logger.warn("{}({}): {}", ctx.kind().nodeName(), ctx.path(), message);
        } else {
            logger.debug("{}({}): {}", ctx.kind().nodeName(), ctx.path(), message);
        }
        issues.add(new Issue(type, sev, new IssueLoc(ctx.path(), ctx.kind()), message));
    }

    private static LabelKey labelFor(NodeKind kind) {
        return switch (kind) {
            case ATTENTION -> LabelKey.ATTENTION;
            case CAUTION -> LabelKey.CAUTION;
            case DANGER -> LabelKey.DANGER;
            case ERROR -> LabelKey.ERROR;
            case HINT -> LabelKey.HINT;
            case IMPORTANT -> LabelKey.IMPORTANT;
            case NOTE -> LabelKey.NOTE;
            case TIP -> LabelKey.TIP;
            case WARNING -> LabelKey.WARNING;
            default -> throw new IllegalArgumentException(kind.nodeName() + " has no label");
        };
    }
}
