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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.rst.writer.core.RenderException;

/**
 * Immutable node of an already-parsed document tree. Attribute values are restricted to strings,
 * booleans and integers; a missing attribute is simply absent from the map.
 */
public final class DocNode {
    private final NodeKind kind;
    private final List<DocNode> children;
    private final Map<String, Object> attributes;
    private final String text;

    private DocNode(Builder b) {
        this.kind = b.kind;
        this.children = Collections.unmodifiableList(new ArrayList<>(b.children));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.text = b.text;
    }

    public NodeKind kind() {
        return kind;
    }

    public List<DocNode> children() {
        return children;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public boolean is(NodeKind k) {
        return kind == k;
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    /** Returns the attribute as a string, or null when absent. */
    public String getString(String name) {
        Object value = attributes.get(name);
        return value != null ? value.toString() : null;
    }

    public String getString(String name, String fallback) {
        String value = getString(name);
        return value != null ? value : fallback;
    }

    public int getInt(String name, int fallback) {
        Object value = attributes.get(name);
        if (value instanceof Integer i) {
            return i;
        }
        return fallback;
    }

    /** Boolean attributes count as set only when present and true. */
    public boolean getBoolean(String name) {
        return Boolean.TRUE.equals(attributes.get(name));
    }

    public DocNode firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    /**
     * Plain text of this subtree. Text elements concatenate their children; other elements
     * separate their children by a blank line, the way docutils derives it.
     */
    public String astext() {
        if (kind == NodeKind.TEXT) {
            return text;
        }
        String separator = kind.isTextElement() ? "" : "\n\n";
        return children.stream().map(DocNode::astext).collect(Collectors.joining(separator));
    }

    @Override
    public String toString() {
        if (kind == NodeKind.TEXT) {
            return "#text(" + text + ")";
        }
        return kind.nodeName() + attributes + children;
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    /** Looks the kind up by its docutils name; unknown names are rejected. */
    public static Builder builder(String nodeName) {
        return new Builder(NodeKind.forName(nodeName));
    }

    public static DocNode text(String text) {
        Builder b = new Builder(NodeKind.TEXT);
        b.text = text != null ? text : "";
        return b.build();
    }

    public static class Builder {
        private final NodeKind kind;
        private final List<DocNode> children = new ArrayList<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private String text;

        private Builder(NodeKind kind) {
            if (kind == null) {
                throw new IllegalArgumentException("Node kind is required");
            }
            this.kind = kind;
        }

        public Builder attr(String name, Object value) {
            if (value == null) {
                attributes.remove(name);
                return this;
            }
            if (!(value instanceof String
                    || value instanceof Boolean
                    || value instanceof Integer)) {
                throw new IllegalArgumentException(
                        "Attribute '"
                                + name
                                + "' of <"
                                + kind.nodeName()
                                + "> must be a string, boolean or integer, got "
                                + value.getClass().getSimpleName());
            }
            attributes.put(name, value);
            return this;
        }

        public Builder child(DocNode child) {
            if (kind == NodeKind.TEXT) {
                throw new IllegalStateException("Text nodes cannot have children");
            }
            children.add(child);
            return this;
        }

        public Builder children(List<DocNode> nodes) {
            nodes.forEach(this::child);
            return this;
        }

        public Builder text(String value) {
            return child(DocNode.text(value));
        }

        public DocNode build() {
            for (String required : kind.requiredAttributes()) {
                if (!attributes.containsKey(required)) {
                    throw RenderException.malformed(
                            null,
                            "<" + kind.nodeName() + "> requires attribute '" + required + "'");
                }
            }
            for (String spanAttr : List.of("morecols", "morerows")) {
                Object value = attributes.get(spanAttr);
                if (value != null && (!(value instanceof Integer i) || i < 0)) {
                    throw RenderException.malformed(
                            null,
                            "<"
                                    + kind.nodeName()
                                    + "> attribute '"
                                    + spanAttr
                                    + "' must be a non-negative integer");
                }
            }
            return new DocNode(this);
        }
    }
}
