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

import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Rendering settings. Field names match the YAML keys; unset fields fall back to the defaults
 * exposed by the getters.
 */
public final class RenderConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/rst-writer-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(RenderConfig.class);

    public static final int DEFAULT_INDENT = 3;
    public static final int DEFAULT_MAX_WIDTH = 70;
    public static final String DEFAULT_SECTION_CHARS = "=-~^\"+*`";

    /** unix, windows or native. */
    public String newlines;

    /** Indent of nested blocks; null or 0 selects the default. */
    public Integer indent;

    /** Underline characters by section depth, reused cyclically. */
    public String section_chars;

    public Integer max_width;
    public Boolean wrap_paragraphs;

    /** Keep the {@code :linenos:} flag of code blocks. */
    public Boolean preserve_code_block_flags;

    /** A configuration with every setting at its default. */
    public static RenderConfig defaults() {
        return new RenderConfig();
    }

    public NewlineStyle getNewlines() {
        return NewlineStyle.fromName(newlines);
    }

    public int getIndent() {
        return indent != null && indent > 0 ? indent : DEFAULT_INDENT;
    }

    public String getSectionChars() {
        return section_chars != null && !section_chars.isEmpty()
                ? section_chars
                : DEFAULT_SECTION_CHARS;
    }

    public int getMaxWidth() {
        return max_width != null ? max_width : DEFAULT_MAX_WIDTH;
    }

    public boolean isWrapParagraphs() {
        return Boolean.TRUE.equals(wrap_paragraphs);
    }

    public boolean isPreserveCodeBlockFlags() {
        return Boolean.TRUE.equals(preserve_code_block_flags);
    }

    /** Underline character for a section at {@code depth} (1 = top level). */
    public char sectionChar(int depth) {
        String chars = getSectionChars();
        return chars.charAt((Math.max(depth, 1) - 1) % chars.length());
    }

    /**
     * Rejects settings that cannot produce output.
     *
     * @throws IllegalArgumentException on the first invalid setting
     */
    public RenderConfig validate() {
        getNewlines();
        if (indent != null && indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        if (max_width != null && max_width < 1) {
            throw new IllegalArgumentException("max_width must be positive: " + max_width);
        }
        return this;
    }

    /**
     * Load RenderConfig from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static RenderConfig fromResource(String resourcePath) {
        try (InputStream inputStream = RenderConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            RenderConfig config = newYaml().load(inputStream);
            logger.debug("Loaded render config from resource {}", resourcePath);
            return (config != null ? config : defaults()).validate();
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            logger.error(
                    "Failed to load render config from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load render config from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    public static RenderConfig fromYaml(String yamlText) {
        RenderConfig config = newYaml().load(yamlText);
        return (config != null ? config : defaults()).validate();
    }

    /** Load default config from standard location */
    public static RenderConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    private static Yaml newYaml() {
        return new Yaml(new Constructor(RenderConfig.class, new LoaderOptions()));
    }

    @Override
    public String toString() {
        return "RenderConfig{newlines="
                + getNewlines()
                + ", indent="
                + getIndent()
                + ", section_chars="
                + getSectionChars()
                + ", max_width="
                + getMaxWidth()
                + ", wrap_paragraphs="
                + isWrapParagraphs()
                + ", preserve_code_block_flags="
                + isPreserveCodeBlockFlags()
                + "}";
    }
}
