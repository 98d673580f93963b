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

import java.util.Locale;

/** Line separator used when joining the rendered lines. */
public enum NewlineStyle {
    UNIX("\n"),
    WINDOWS("\r\n"),
    /** Whatever the host platform uses. */
    NATIVE(System.lineSeparator());

    private final String separator;

    NewlineStyle(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }

    public static NewlineStyle fromName(String name) {
        if (name == null) {
            return UNIX;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown newline style '" + name + "' (expected unix, windows or native)", e);
        }
    }
}
