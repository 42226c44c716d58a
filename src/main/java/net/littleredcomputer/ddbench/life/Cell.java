// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

import java.util.Objects;

/**
 * A position on the board, before or after the step. Two cells are equal when they are at the
 * same position, whatever their primedness. Cells are made by {@link Grid#cell}, which checks
 * the bounds.
 */
public final class Cell {
    private final byte row;
    private final byte col;
    private final Prime prime;

    Cell(int row, int col, Prime prime) {
        this.row = (byte) row;
        this.col = (byte) col;
        this.prime = prime;
    }

    public int row() { return row; }
    public int col() { return col; }
    public Prime prime() { return prime; }

    /** This position with another primedness. Whether that is on its board is not checked. */
    public Cell withPrime(Prime p) {
        return p == prime ? this : new Cell(row, col, p);
    }

    public int verticalDistanceTo(Cell o) { return Math.abs(row - o.row); }
    public int horizontalDistanceTo(Cell o) { return Math.abs(col - o.col); }

    /** Whether o is in the 3x3 square centered on this cell (this cell included). */
    public boolean inNeighbourhood(Cell o) {
        return verticalDistanceTo(o) <= 1 && horizontalDistanceTo(o) <= 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cell cell = (Cell) o;
        return row == cell.row && col == cell.col;
    }

    @Override
    public int hashCode() { return Objects.hash(row, col); }

    /** Like "2C" for row 2, column 3, and "2C'" for the same position after the step. */
    @Override
    public String toString() {
        return String.valueOf(row) + (char) ('A' + col - 1) + (prime == Prime.POST ? "'" : "");
    }
}
