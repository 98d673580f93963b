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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.rst.writer.core.RenderException;

/**
 * Cell texts of one table, collected row by row, plus the spans of merged cells. Slots covered by
 * a merged cell hold empty placeholders so that every column index lines up across rows.
 */
public class TableMatrix {
    private final List<List<String>> rows = new ArrayList<>();
    private final Map<CellPos, Integer> colspan = new HashMap<>();
    private final Map<CellPos, Integer> rowspan = new HashMap<>();
    private int currentRow = -1;

    public void startRow() {
        currentRow++;
        while (rows.size() <= currentRow) {
            rows.add(new ArrayList<>());
        }
    }

    /**
     * Adds the next cell of the current row.
     *
     * @param moreCols how many columns to the right the cell also covers
     * @param moreRows how many rows below the cell also covers
     */
    public void addCell(String text, int moreCols, int moreRows) {
        if (currentRow < 0) {
            throw new IllegalStateException("Cell added before any row was started");
        }
        List<String> row = rows.get(currentRow);
        fillReserved(row);

        int col = row.size();
        row.add(text);
        if (moreCols > 0) {
            colspan.put(new CellPos(currentRow, col), 1 + moreCols);
            for (int i = 0; i < moreCols; i++) {
                row.add("");
            }
        }
        if (moreRows > 0) {
            rowspan.put(new CellPos(currentRow, col), 1 + moreRows);
        }
    }

    public void endRow() {
        fillReserved(rows.get(currentRow));
    }

    /**
     * Checks that no cell spans past the last row.
     *
     * @throws RenderException for a span that does not fit
     */
    public void finish(String path) {
        for (Map.Entry<CellPos, Integer> span : rowspan.entrySet()) {
            int lastRow = span.getKey().row() + span.getValue() - 1;
            if (lastRow >= rows.size()) {
                throw RenderException.malformed(
                        path,
                        "Cell at row "
                                + span.getKey().row()
                                + ", column "
                                + span.getKey().col()
                                + " spans "
                                + span.getValue()
                                + " rows but the table has only "
                                + rows.size());
            }
        }
    }

    public List<List<String>> rows() {
        return Collections.unmodifiableList(rows);
    }

    /** Number of columns covered by the cell at {@code pos}, 1 when it is not merged. */
    public int colspanAt(int row, int col) {
        return colspan.getOrDefault(new CellPos(row, col), 1);
    }

    public Map<CellPos, Integer> colspans() {
        return Collections.unmodifiableMap(colspan);
    }

    public Map<CellPos, Integer> rowspans() {
        return Collections.unmodifiableMap(rowspan);
    }

    /**
     * Returns the origin of the row-spanning cell that covers slot ({@code row}, {@code col}) from
     * a row above, or null if the slot is not a continuation.
     */
    public CellPos spanOriginCovering(int row, int col) {
        for (Map.Entry<CellPos, Integer> span : rowspan.entrySet()) {
            CellPos origin = span.getKey();
            int width = colspan.getOrDefault(origin, 1);
            if (origin.row() < row
                    && row < origin.row() + span.getValue()
                    && origin.col() <= col
                    && col < origin.col() + width) {
                return origin;
            }
        }
        return null;
    }

    public boolean isContinuation(int row, int col) {
        return spanOriginCovering(row, col) != null;
    }

    // Slots reserved by a cell above are filled before the row's own next cell lands
    private void fillReserved(List<String> row) {
        CellPos origin;
        while ((origin = reservedOriginAt(currentRow, row.size())) != null) {
            int width = colspan.getOrDefault(origin, 1);
            if (width > 1) {
                colspan.put(new CellPos(currentRow, row.size()), width);
            }
            for (int i = 0; i < width; i++) {
                row.add("");
            }
        }
    }

    private CellPos reservedOriginAt(int row, int col) {
        CellPos origin = spanOriginCovering(row, col);
        return origin != null && origin.col() == col ? origin : null;
    }
}
