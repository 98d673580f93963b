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

/** Keys of the localized strings the renderer emits. Version labels take {@code %s}. */
public enum LabelKey {
    ATTENTION("attention", "Attention"),
    CAUTION("caution", "Caution"),
    DANGER("danger", "Danger"),
    ERROR("error", "Error"),
    HINT("hint", "Hint"),
    IMPORTANT("important", "Important"),
    NOTE("note", "Note"),
    TIP("tip", "Tip"),
    WARNING("warning", "Warning"),
    VERSION_ADDED("versionadded", "New in version %s"),
    VERSION_CHANGED("versionchanged", "Changed in version %s"),
    DEPRECATED("deprecated", "Deprecated since version %s");

    private final String key;
    private final String english;

    LabelKey(String key, String english) {
        this.key = key;
        this.english = english;
    }

    /** Name used in label files. */
    public String key() {
        return key;
    }

    public String english() {
        return english;
    }

    /** Finds the key for a label-file name, or null. */
    public static LabelKey fromKey(String key) {
        for (LabelKey k : values()) {
            if (k.key.equals(key)) {
                return k;
            }
        }
        return null;
    }
}
