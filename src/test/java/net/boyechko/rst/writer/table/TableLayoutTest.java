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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TableLayoutTest {

    private static TableMatrix matrix(String[][] cells) {
        TableMatrix matrix = new TableMatrix();
        for (String[] row : cells) {
            matrix.startRow();
            for (String cell : row) {
                matrix.addCell(cell, 0, 0);
            }
            matrix.endRow();
        }
        return matrix;
    }

    @Test
    void plainGrid() {
        List<String> grid = TableLayout.draw(matrix(new String[][] {{"A", "B"}, {"C", "D"}}));

        assertEquals(
                List.of(
                        "+---+---+",
                        "| A | B |",
                        "+---+---+",
                        "| C | D |",
                        "+---+---+"),
                grid);
    }

    @Test
    void columnWidthIsLongestCellPlusTwo() {
        int[] widths =
                TableLayout.columnWidths(
                        List.of(List.of("Name", "x"), List.of("a", "Longer"), List.of("b")));
        assertArrayEquals(new int[] {6, 8}, widths);
    }

    @Test
    void borderCountIsRowsPlusOne() {
        String[][] cells = {{"1", "2", "3"}, {"4", "5", "6"}, {"7", "8", "9"}};
        List<String> grid = TableLayout.draw(matrix(cells));

        assertEquals(7, grid.size());
        assertEquals(4, grid.stream().filter(l -> l.startsWith("+")).count());
    }

    @Test
    void colspanCoversUnderlyingWidthsAndSeams() {
        TableMatrix matrix = new TableMatrix();
        matrix.startRow();
        matrix.addCell("Wide", 1, 0);
        matrix.endRow();
        matrix.startRow();
        matrix.addCell("a", 0, 0);
        matrix.addCell("b", 0, 0);
        matrix.endRow();

        assertEquals(
                List.of(
                        "+------+---+",
                        "| Wide     |",
                        "+------+---+",
                        "| a    | b |",
                        "+------+---+"),
                TableLayout.draw(matrix));
    }

    @Test
    void rowspanLeavesBorderOpen() {
        TableMatrix matrix = new TableMatrix();
        matrix.startRow();
        matrix.addCell("Tall", 0, 1);
        matrix.addCell("x", 0, 0);
        matrix.endRow();
        matrix.startRow();
        matrix.addCell("y", 0, 0);
        matrix.endRow();

        assertEquals(
                List.of(
                        "+------+---+",
                        "| Tall | x |",
                        "+      +---+",
                        "|      | y |",
                        "+------+---+"),
                TableLayout.draw(matrix));
    }

    @Test
    void cellSpanningBothWaysDrawsOneBlankRegion() {
        TableMatrix matrix = new TableMatrix();
        matrix.startRow();
        matrix.addCell("AB", 1, 1);
        matrix.addCell("x", 0, 0);
        matrix.endRow();
        matrix.startRow();
        matrix.addCell("y", 0, 0);
        matrix.endRow();

        assertEquals(
                List.of(
                        "+----+--+---+",
                        "| AB    | x |",
                        "+       +---+",
                        "|       | y |",
                        "+----+--+---+"),
                TableLayout.draw(matrix));
    }
}
