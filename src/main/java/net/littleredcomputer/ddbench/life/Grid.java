// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The two boards of one step of the game. The post board has rows x cols cells, numbered from
 * 1. The pre board surrounds it with a border one cell wide, so its rows and columns run from 0
 * to rows+1 (resp. cols+1).
 */
public final class Grid {
    private final int rows;
    private final int cols;

    public Grid(int rows, int cols) {
        checkArgument(rows >= 1 && cols >= 1, "grid must be at least 1x1, got %sx%s", rows, cols);
        checkArgument(rows <= Byte.MAX_VALUE - 2 && cols <= Byte.MAX_VALUE - 2, "grid too large: %sx%s", rows, cols);
        this.rows = rows;
        this.cols = cols;
    }

    public int rows(Prime p) { return p == Prime.POST ? rows : rows + 2; }
    public int cols(Prime p) { return p == Prime.POST ? cols : cols + 2; }
    public int minRow(Prime p) { return p == Prime.POST ? 1 : 0; }
    public int maxRow(Prime p) { return p == Prime.POST ? rows : rows + 1; }
    public int minCol(Prime p) { return p == Prime.POST ? 1 : 0; }
    public int maxCol(Prime p) { return p == Prime.POST ? cols : cols + 1; }

    public boolean contains(int row, int col, Prime p) {
        return minRow(p) <= row && row <= maxRow(p) && minCol(p) <= col && col <= maxCol(p);
    }

    public boolean contains(Cell c) { return contains(c.row(), c.col(), c.prime()); }

    /** The cell at [row, col] on the given board. */
    public Cell cell(int row, int col, Prime p) {
        if (!contains(row, col, p)) {
            throw new IllegalArgumentException(String.format("Cell not within valid boundaries: [%d,%d] %s", row, col, p));
        }
        return new Cell(row, col, p);
    }

    /**
     * The nine pre cells whose state decides the state of c after one step, c's own position
     * included, in ascending row-major order. c must be a position of the post board.
     */
    public List<Cell> neighbourhood(Cell c) {
        checkArgument(contains(c.row(), c.col(), Prime.POST), "%s has no full neighbourhood", c);
        ImmutableList.Builder<Cell> b = ImmutableList.builder();
        for (int dr = -1; dr <= 1; ++dr) {
            for (int dc = -1; dc <= 1; ++dc) b.add(cell(c.row() + dr, c.col() + dc, Prime.PRE));
        }
        return b.build();
    }

    @Override
    public String toString() { return rows + " x " + cols; }
}
