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

import static net.boyechko.rst.writer.document.DocTree.*;
import static org.junit.jupiter.api.Assertions.fail;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import net.boyechko.rst.writer.document.DocNode;
import net.boyechko.rst.writer.document.NodeKind;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Renders whole documents and compares them against hand-checked renderings under {@code
 * src/test/resources/golden}.
 */
class RstGoldenTest {

    private static final Path GOLDEN_DIR = Path.of("src/test/resources/golden");

    static Stream<Arguments> documents() {
        return Stream.of(
                Arguments.of("user-guide", userGuide()),
                Arguments.of("api-reference", apiReference()));
    }

    @ParameterizedTest(name = "render {0}")
    @MethodSource("documents")
    void renderMatchesGolden(String name, DocNode document) throws Exception {
        Path goldenFile = GOLDEN_DIR.resolve(name + ".rst");
        assumeTrue(Files.exists(goldenFile), "Golden rendering not found: " + goldenFile);

        String actual = new RstRenderer().render(document);
        String expected = Files.readString(goldenFile).stripTrailing();

        if (!expected.equals(actual)) {
            fail(
                    "Rendering of "
                            + name
                            + " does not match "
                            + goldenFile
                            + "\n\n"
                            + unifiedDiff(expected, actual));
        }
    }

    private static DocNode userGuide() {
        return document(
                section(
                        "User Guide",
                        paragraph(
                                text("This guide shows "),
                                emphasis("how"),
                                text(" to render "),
                                strong("trees"),
                                text(".")),
                        admonition(NodeKind.NOTE, paragraph("Rendering is single-threaded.")),
                        section(
                                "Lists",
                                bulletList(listItem("first"), listItem("second")),
                                enumeratedList(listItem("one"), listItem("two"))),
                        section(
                                "Data",
                                table(new String[][] {{"Key", "Value"}, {"indent", "3"}}),
                                literalBlock("yaml", "indent: 3\nmax_width: 70"))));
    }

    private static DocNode apiReference() {
        DocNode signature =
                node(
                        NodeKind.DESC_SIGNATURE,
                        textual(NodeKind.DESC_NAME, "render"),
                        node(
                                NodeKind.DESC_PARAMETERLIST,
                                textual(NodeKind.DESC_PARAMETER, "document")));
        DocNode desc =
                DocNode.builder(NodeKind.DESC)
                        .attr("objtype", "function")
                        .child(signature)
                        .child(
                                node(
                                        NodeKind.DESC_CONTENT,
                                        paragraph("Renders a tree."),
                                        node(
                                                NodeKind.FIELD_LIST,
                                                field("Returns", paragraph("The text.")))))
                        .build();
        DocNode added =
                DocNode.builder(NodeKind.VERSIONMODIFIED)
                        .attr("type", "versionadded")
                        .attr("version", "0.1")
                        .build();
        DocNode footnote =
                node(NodeKind.FOOTNOTE, textual(NodeKind.LABEL, "1"), paragraph("Footnote body."));

        return document(
                section(
                        "API",
                        desc,
                        added,
                        node(
                                NodeKind.DEFINITION_LIST,
                                definitionItem("frame", null, paragraph("A unit of output."))),
                        footnote));
    }

    private static String unifiedDiff(String expected, String actual) {
        List<String> goldenLines = expected.lines().toList();
        List<String> actualLines = actual.lines().toList();
        Patch<String> patch = DiffUtils.diff(goldenLines, actualLines);
        List<String> diff =
                UnifiedDiffUtils.generateUnifiedDiff("golden", "actual", goldenLines, patch, 2);
        return String.join("\n", diff);
    }
}
