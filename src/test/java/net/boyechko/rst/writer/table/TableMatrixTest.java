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
import net.boyechko.rst.writer.core.RenderException;
import org.junit.jupiter.api.Test;

class TableMatrixTest {

    @Test
    void colspanAddsPlaceholders() {
        TableMatrix matrix = new TableMatrix();
        matrix.startRow();
        matrix.addCell("Wide", 2, 0);
        matrix.addCell("x", 0, 0);
        matrix.endRow();

        assertEquals(List.of(List.of("Wide", "", "", "x")), matrix.rows());
        assertEquals(3, matrix.colspanAt(0, 0));
        assertEquals(1, matrix.colspanAt(0, 3));
    }

    @Test
    void rowspanReservesSlotsInLaterRows() {
        TableMatrix matrix = new TableMatrix();
        matrix.startRow();
        matrix.addCell("a", 0, 0);
        matrix.addCell("Tall", 0, 2);
        matrix.endRow();
        matrix.startRow();
        matrix.addCell("b", 0, 0);
        matrix.endRow();
        matrix.startRow();
        matrix.addCell("c", 0, 0);
        matrix.addCell("d", 0, 0);
        matrix.endRow();
        matrix.finish("/table");

        assertEquals(
                List.of(List.of("a", "Tall"), List.of("b", ""), List.of("c", "", "d")),
                matrix.rows());
        assertTrue(matrix.isContinuation(1, 1));
        assertTrue(matrix.isContinuation(2, 1));
        assertFalse(matrix.isContinuation(0, 1));
        assertEquals(new CellPos(0, 1), matrix.spanOriginCovering(2, 1));
    }

    @Test
    void rowspanAtFirstColumnShiftsFollowingCells() {
        TableMatrix matrix = new TableMatrix();
        matrix.startRow();
        matrix.addCell("Tall", 0, 1);
        matrix.addCell("x", 0, 0);
        matrix.endRow();
        matrix.startRow();
        matrix.addCell("y", 0, 0);
        matrix.endRow();

        assertEquals(List.of(List.of("Tall", "x"), List.of("", "y")), matrix.rows());
    }

    @Test
    void cellSpanningBothWaysReservesItsWholeWidth() {
        TableMatrix matrix = new TableMatrix();
        matrix.startRow();
        matrix.addCell("Block", 1, 1);
        matrix.addCell("x", 0, 0);
        matrix.endRow();
        matrix.startRow();
        matrix.addCell("y", 0, 0);
        matrix.endRow();

        assertEquals(List.of(List.of("Block", "", "x"), List.of("", "", "y")), matrix.rows());
        assertEquals(2, matrix.colspanAt(1, 0));
        assertTrue(matrix.isContinuation(1, 1));
    }

    @Test
    void spanPastLastRowIsMalformed() {
        TableMatrix matrix = new TableMatrix();
        matrix.startRow();
        matrix.addCell("Tall", 0, 3);
        matrix.endRow();

        RenderException e = assertThrows(RenderException.class, () -> matrix.finish("/t"));
        assertEquals(RenderException.Kind.MALFORMED_INPUT, e.kind());
        assertEquals("/t", e.path());
    }

    @Test
    void cellBeforeRowFails() {
        TableMatrix matrix = new TableMatrix();
        assertThrows(IllegalStateException.class, () -> matrix.addCell("x", 0, 0));
    }
}
