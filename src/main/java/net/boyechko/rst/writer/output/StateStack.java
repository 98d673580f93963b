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
package net.boyechko.rst.writer.output;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stack of output frames. Text is appended to the top frame and formatted only when that frame is
 * popped, at which point the result is handed, with the popped frame's indent, to the frame below.
 * The bottom frame is never popped.
 */
public class StateStack {
    private static final Logger logger = LoggerFactory.getLogger(StateStack.class);

    /** Default end marker: one blank line after each formatted run of text. */
    public static final List<String> BLANK_LINE = List.of("");

    private final Deque<StateFrame> frames = new ArrayDeque<>();
    private final int maxWidth;

    public StateStack(int maxWidth) {
        if (maxWidth < 1) {
            throw new IllegalArgumentException("Output width must be positive: " + maxWidth);
        }
        this.maxWidth = maxWidth;
        frames.push(new StateFrame(0));
    }

    public void push(int indent) {
        frames.push(new StateFrame(indent));
        logger.trace("push indent={} depth={}", indent, frames.size());
    }

    public void appendRaw(String text) {
        frames.peek().add(new FrameEntry.RawSpan(text));
    }

    public void appendBlock(int relativeIndent, List<String> lines) {
        frames.peek().add(new FrameEntry.Block(relativeIndent, lines));
    }

    /** Pops without wrapping, ending each text run with a blank line. */
    public void pop() {
        pop(false, BLANK_LINE, null);
    }

    /**
     * Pops the top frame and merges it into the one below.
     *
     * @param wrap word-wrap runs of raw text to the width left after all frame indents; otherwise
     *     split them on their own line breaks
     * @param end lines appended after each formatted run, or null for none
     * @param first prefix spliced onto the first line of the result, which is then placed at the
     *     parent's margin instead of this frame's indent; null for none
     */
    public void pop(boolean wrap, List<String> end, String first) {
        int maxIndent = cumulativeIndent();
        StateFrame frame = popFrame();
        int indent = frame.indent();

        List<FrameEntry.Block> result = new ArrayList<>();
        List<String> toFormat = new ArrayList<>();
        for (FrameEntry entry : frame.entries()) {
            if (entry instanceof FrameEntry.RawSpan span) {
                toFormat.add(span.text());
            } else if (entry instanceof FrameEntry.Block block) {
                format(toFormat, wrap, maxIndent, end, indent, result);
                toFormat.clear();
                result.add(new FrameEntry.Block(indent + block.indent(), block.lines()));
            }
        }
        format(toFormat, wrap, maxIndent, end, indent, result);

        if (first != null && !result.isEmpty()) {
            FrameEntry.Block head = result.get(0);
            if (!head.lines().isEmpty()) {
                List<String> lines = head.lines();
                result.set(0, new FrameEntry.Block(head.indent(), lines.subList(1, lines.size())));
                result.add(
                        0,
                        new FrameEntry.Block(
                                head.indent() - indent, List.of(first + lines.get(0))));
            }
        }

        frames.peek().addAll(result);
    }

    /** Pops the top frame and returns the concatenation of its raw text, discarding blocks. */
    public String popRawText() {
        StateFrame frame = popFrame();
        StringBuilder sb = new StringBuilder();
        for (FrameEntry entry : frame.entries()) {
            if (entry instanceof FrameEntry.RawSpan span) {
                sb.append(span.text());
            }
        }
        return sb.toString();
    }

    /** Pops the top frame and returns everything in it as one line, line breaks removed. */
    public String popFlattened() {
        StateFrame frame = popFrame();
        StringBuilder sb = new StringBuilder();
        for (FrameEntry entry : frame.entries()) {
            if (entry instanceof FrameEntry.RawSpan span) {
                sb.append(span.text());
            } else if (entry instanceof FrameEntry.Block block) {
                block.lines().forEach(sb::append);
            }
        }
        return sb.toString().replace("\r", "").replace("\n", "");
    }

    /** Sum of the indents of all frames on the stack. */
    public int cumulativeIndent() {
        int sum = 0;
        for (StateFrame frame : frames) {
            sum += frame.indent();
        }
        return sum;
    }

    public boolean topIsEmpty() {
        return frames.peek().entries().isEmpty();
    }

    public int depth() {
        return frames.size();
    }

    public int maxWidth() {
        return maxWidth;
    }

    /** The bottom frame; after a balanced traversal it holds the whole document. */
    public StateFrame root() {
        Iterator<StateFrame> it = frames.descendingIterator();
        return it.next();
    }

    private StateFrame popFrame() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot pop the root output frame");
        }
        StateFrame frame = frames.pop();
        logger.trace("pop indent={} depth={}", frame.indent(), frames.size());
        return frame;
    }

    private void format(
            List<String> toFormat,
            boolean wrap,
            int maxIndent,
            List<String> end,
            int indent,
            List<FrameEntry.Block> result) {
        if (toFormat.isEmpty()) {
            return;
        }
        String text = String.join("", toFormat);
        List<String> lines =
                new ArrayList<>(
                        wrap
                                ? TextWrapper.wrap(text, Math.max(1, maxWidth - maxIndent))
                                : TextWrapper.splitLines(text));
        if (end != null) {
            lines.addAll(end);
        }
        result.add(new FrameEntry.Block(indent, lines));
    }
}
