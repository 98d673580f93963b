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
package net.boyechko.rst.writer.lists;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of the lists currently open. Each nesting level keeps its own counter, so an inner list
 * never disturbs the numbering of the list around it.
 */
public class ListTracker {

    /** One open list. Enumerated lists count their items; the counter starts at 0. */
    public static final class Level {
        private final ListType type;
        private int counter;

        private Level(ListType type) {
            this.type = type;
        }

        public ListType type() {
            return type;
        }

        public int counter() {
            return counter;
        }
    }

    private final Deque<Level> levels = new ArrayDeque<>();

    public void enter(ListType type) {
        levels.push(new Level(type));
    }

    public void leave() {
        if (levels.isEmpty()) {
            throw new IllegalStateException("No open list to leave");
        }
        levels.pop();
    }

    public Level current() {
        Level level = levels.peek();
        if (level == null) {
            throw new IllegalStateException("List item outside of any list");
        }
        return level;
    }

    /** Advances the innermost enumerated list and returns the new item number. */
    public int nextNumber() {
        Level level = current();
        if (level.type != ListType.ENUMERATED) {
            throw new IllegalStateException("Innermost list is " + level.type + ", not enumerated");
        }
        return ++level.counter;
    }

    public int depth() {
        return levels.size();
    }
}
