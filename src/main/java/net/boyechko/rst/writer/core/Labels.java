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
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/** Localized admonition and version-change labels, indexed by {@link LabelKey}. */
public final class Labels {
    private static final String DEFAULT_LABELS_RESOURCE = "/labels/en.yaml";
    private static final Logger logger = LoggerFactory.getLogger(Labels.class);

    private final Map<LabelKey, String> labels;

    public Labels(Map<LabelKey, String> labels) {
        EnumMap<LabelKey, String> all = new EnumMap<>(LabelKey.class);
        for (LabelKey key : LabelKey.values()) {
            String value = labels.get(key);
            if (value == null) {
                logger.warn("No label for '{}'; using '{}'", key.key(), key.english());
                value = key.english();
            }
            all.put(key, value);
        }
        this.labels = Collections.unmodifiableMap(all);
    }

    /** The built-in English labels. */
    public static Labels english() {
        EnumMap<LabelKey, String> map = new EnumMap<>(LabelKey.class);
        for (LabelKey key : LabelKey.values()) {
            map.put(key, key.english());
        }
        return new Labels(map);
    }

    public String get(LabelKey key) {
        return labels.get(key);
    }

    /** Label with the version substituted for {@code %s}. */
    public String format(LabelKey key, String version) {
        return String.format(labels.get(key), version);
    }

    /**
     * Load labels from a YAML mapping of label-file names to strings on the classpath.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static Labels fromResource(String resourcePath) {
        try (InputStream inputStream = Labels.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            Object loaded = new Yaml().load(inputStream);
            if (!(loaded instanceof Map<?, ?> raw)) {
                throw new IllegalArgumentException(
                        "Label resource " + resourcePath + " is not a mapping");
            }

            EnumMap<LabelKey, String> map = new EnumMap<>(LabelKey.class);
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                LabelKey key = LabelKey.fromKey(String.valueOf(entry.getKey()));
                if (key == null) {
                    logger.warn("Ignoring unknown label '{}' in {}", entry.getKey(), resourcePath);
                    continue;
                }
                map.put(key, String.valueOf(entry.getValue()));
            }
            logger.debug("Loaded {} labels from resource {}", map.size(), resourcePath);
            return new Labels(map);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            logger.error(
                    "Failed to load labels from resource {}: {}", resourcePath, e.getMessage());
            throw new RuntimeException(
                    "Failed to load labels from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load default labels from standard location */
    public static Labels loadDefault() {
        return fromResource(DEFAULT_LABELS_RESOURCE);
    }
}
