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
package net.boyechko.rst.writer.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class RenderConfigTest {

    @Test
    public void testLoadDefault() {
        RenderConfig config = RenderConfig.loadDefault();
        assertEquals(NewlineStyle.UNIX, config.getNewlines());
        assertEquals(3, config.getIndent());
        assertEquals(70, config.getMaxWidth());
        assertEquals(RenderConfig.DEFAULT_SECTION_CHARS, config.getSectionChars());
        assertFalse(config.isWrapParagraphs());
        assertFalse(config.isPreserveCodeBlockFlags());
    }

    @Test
    public void testDefaultsWithoutResource() {
        RenderConfig config = RenderConfig.defaults();
        assertEquals(NewlineStyle.UNIX, config.getNewlines());
        assertEquals(RenderConfig.DEFAULT_INDENT, config.getIndent());
        assertEquals(RenderConfig.DEFAULT_MAX_WIDTH, config.getMaxWidth());
    }

    @Test
    public void testFromYaml() {
        RenderConfig config =
                RenderConfig.fromYaml(
                        "newlines: windows\n"
                                + "indent: 4\n"
                                + "section_chars: \"#*\"\n"
                                + "max_width: 40\n"
                                + "wrap_paragraphs: true\n"
                                + "preserve_code_block_flags: true\n");
        assertEquals(NewlineStyle.WINDOWS, config.getNewlines());
        assertEquals(4, config.getIndent());
        assertEquals(40, config.getMaxWidth());
        assertTrue(config.isWrapParagraphs());
        assertTrue(config.isPreserveCodeBlockFlags());
        assertEquals('#', config.sectionChar(1));
        assertEquals('*', config.sectionChar(2));
        assertEquals('#', config.sectionChar(3));
    }

    @Test
    public void testUnsetIndentFallsBackToDefault() {
        RenderConfig config = RenderConfig.fromYaml("indent: null\n");
        assertEquals(RenderConfig.DEFAULT_INDENT, config.getIndent());
    }

    @Test
    public void testEmptyYamlGivesDefaults() {
        RenderConfig config = RenderConfig.fromYaml("");
        assertEquals(RenderConfig.DEFAULT_MAX_WIDTH, config.getMaxWidth());
    }

    @ParameterizedTest
    @CsvSource({"1, '='", "2, '-'", "4, '^'", "9, '='"})
    public void testSectionCharsCycle(int depth, char expected) {
        assertEquals(expected, RenderConfig.defaults().sectionChar(depth));
    }

    @Test
    public void testRejectsUnknownNewlineStyle() {
        assertThrows(
                IllegalArgumentException.class, () -> RenderConfig.fromYaml("newlines: mac\n"));
    }

    @Test
    public void testRejectsNegativeIndent() {
        assertThrows(IllegalArgumentException.class, () -> RenderConfig.fromYaml("indent: -2\n"));
    }

    @Test
    public void testRejectsZeroWidth() {
        assertThrows(IllegalArgumentException.class, () -> RenderConfig.fromYaml("max_width: 0\n"));
    }

    @Test
    public void testMissingResource() {
        assertThrows(
                IllegalArgumentException.class,
                () -> RenderConfig.fromResource("/no-such-config.yaml"));
    }

    @Test
    public void testNativeNewlineIsPlatformSeparator() {
        assertEquals(System.lineSeparator(), NewlineStyle.fromName("native").separator());
        assertEquals("\r\n", NewlineStyle.fromName("Windows").separator());
    }
}
