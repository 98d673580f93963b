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
package net.boyechko.rst.writer.table;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.rst.writer.output.TextWrapper;

/**
 * Draws a {@link TableMatrix} as an ASCII grid.
 *
 * <pre>
 * +---+---+
 * | A | B |
 * +---+---+
 * | C     |
 * +---+---+
 * </pre>
 *
 * Each column is two characters wider than its longest cell. A cell spanning columns is drawn as
 * one cell as wide as the columns it covers plus the borders between them. Below a cell spanning
 * rows, the covered slots are drawn blank and the horizontal border over them is left open.
 */
public final class TableLayout {
    private TableLayout() {}

    public static List<String> draw(TableMatrix matrix) {
        List<List<String>> rows = matrix.rows();
        int[] widths = columnWidths(rows);

        List<String> lines = new ArrayList<>();
        for (int y = 0; y < rows.size(); y++) {
            lines.add(border(matrix, widths, y));
            lines.add(rowLine(matrix, widths, y));
        }
        lines.add(border(matrix, widths, -1));
        return lines;
    }

    /** Width of each column: 2 plus the longest text in that column. */
    public static int[] columnWidths(List<List<String>> rows) {
        int columns = 0;
        for (List<String> row : rows) {
            columns = Math.max(columns, row.size());
        }
        int[] widths = new int[columns];
        for (List<String> row : rows) {
            for (int c = 0; c < row.size(); c++) {
                widths[c] = Math.max(widths[c], TextWrapper.displayWidth(row.get(c)) + 2);
            }
        }
        return widths;
    }

    /** Border above row {@code y}; a negative row draws the closing border under the table. */
    static String border(TableMatrix matrix, int[] widths, int y) {
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < widths.length; c++) {
            boolean open = y >= 0 && matrix.isContinuation(y, c);
            boolean insideMerged =
                    c > 0
                            && open
                            && matrix.spanOriginCovering(y, c)
                                    .equals(matrix.spanOriginCovering(y, c - 1));
            sb.append(insideMerged ? ' ' : '+');
            sb.append(String.valueOf(open ? ' ' : '-').repeat(widths[c]));
        }
        sb.append('+');
        return sb.toString();
    }

    static String rowLine(TableMatrix matrix, int[] widths, int y) {
        List<String> row = matrix.rows().get(y);
        StringBuilder sb = new StringBuilder();
        int x = 0;
        while (x < row.size()) {
            if (matrix.isContinuation(y, x)) {
                sb.append('|').append(" ".repeat(widths[x]));
            } else {
                String text = row.get(x);
                sb.append("| ").append(text);
                sb.append(" ".repeat(Math.max(0, widths[x] - TextWrapper.displayWidth(text) - 2)));
                sb.append(' ');
            }
            int span = matrix.colspanAt(y, x);
            if (span > 1) {
                int covered = 0;
                for (int c = x + 1; c < x + span && c < widths.length; c++) {
                    covered += widths[c];
                }
                sb.append(" ".repeat(covered + span - 1));
                x += span - 1;
            }
            x++;
        }
        sb.append('|');
        return sb.toString();
    }
}
