// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;

/**
 * Assigns a diagram variable to every cell of both boards. Pre and post variables of the same
 * row are interleaved, so the cells a post cell depends on have nearby variables.
 *
 * With {@link Symmetry#MIRROR} a post cell and its horizontal mirror image share one variable,
 * which restricts the post states to mirror-symmetric ones. Pre variables are never shared.
 */
public class VarMap {
    private final Grid grid;
    private final Symmetry symmetry;
    private final Map<Prime, Map<Cell, Integer>> map = new EnumMap<>(Prime.class);
    private final Map<Prime, Integer> varcount = new EnumMap<>(Prime.class);
    private final Cell[] inverse;

    public VarMap(Grid grid, Symmetry symmetry) {
        this.grid = grid;
        this.symmetry = symmetry;
        for (Prime p : Prime.values()) {
            map.put(p, new HashMap<>());
            varcount.put(p, 0);
        }
        int x = 0;
        switch (symmetry) {
            case NONE:
                for (int row = grid.minRow(Prime.PRE); row <= grid.maxRow(Prime.PRE); ++row) {
                    for (int col = grid.minCol(Prime.PRE); col <= grid.maxCol(Prime.PRE); ++col) {
                        add(grid.cell(row, col, Prime.PRE), x++);
                        if (grid.contains(row, col, Prime.POST)) add(grid.cell(row, col, Prime.POST), x++);
                    }
                }
                break;
            case MIRROR: {
                final boolean oddCols = grid.cols(Prime.PRE) % 2 == 1;
                final int maxLeftCol = grid.minCol(Prime.PRE) + grid.cols(Prime.PRE) / 2 - (oddCols ? 0 : 1);
                for (int row = grid.minRow(Prime.PRE); row <= grid.maxRow(Prime.PRE); ++row) {
                    for (int leftCol = grid.minCol(Prime.PRE); leftCol <= maxLeftCol; ++leftCol) {
                        final int rightCol = grid.maxCol(Prime.PRE) - leftCol;
                        final boolean addMirror = maxLeftCol < rightCol;

                        add(grid.cell(row, leftCol, Prime.PRE), x++);
                        if (addMirror) add(grid.cell(row, rightCol, Prime.PRE), x++);

                        if (grid.contains(row, leftCol, Prime.POST)) {
                            final int postVar = x++;
                            add(grid.cell(row, leftCol, Prime.POST), postVar);
                            if (addMirror) map.get(Prime.POST).put(grid.cell(row, rightCol, Prime.POST), postVar);
                        }
                    }
                }
                break;
            }
            default:
                throw new IllegalArgumentException("unknown symmetry: " + symmetry);
        }
        // Pre variables must never have been merged.
        checkState(varcount(Prime.PRE) == grid.rows(Prime.PRE) * grid.cols(Prime.PRE),
                "%s pre variables for a %sx%s board", varcount(Prime.PRE), grid.rows(Prime.PRE), grid.cols(Prime.PRE));

        inverse = new Cell[x];
        map.forEach((p, m) -> m.forEach((c, v) -> {
            // Under symmetry, a shared post variable maps back to the cell it was made for.
            if (inverse[v] == null || inverse[v].col() > c.col()) inverse[v] = c;
        }));
    }

    private void add(Cell c, int x) {
        map.get(c.prime()).put(c, x);
        varcount.merge(c.prime(), 1, Integer::sum);
    }

    public Grid grid() { return grid; }
    public Symmetry symmetry() { return symmetry; }

    /** The variable of a cell. */
    public int var(Cell c) {
        if (!grid.contains(c)) throw new IllegalArgumentException("Cell not within valid boundaries: " + c);
        Integer x = map.get(c.prime()).get(c);
        if (x == null) throw new IllegalArgumentException("Cell not found in cell -> var map: " + c);
        return x;
    }

    /**
     * The cell a variable was made for. A post variable shared under symmetry yields the
     * left-hand cell of the pair.
     */
    public Cell cell(int x) {
        if (x < 0 || x >= inverse.length) throw new IllegalArgumentException("unmapped variable: " + x);
        return inverse[x];
    }

    /** Like {@link #cell(int)}, but prefer candidate c if it is one of the cells mapped to x. */
    public Cell cell(int x, Cell c) {
        return var(c) == x ? c : cell(x);
    }

    public int varcount(Prime p) { return varcount.get(p); }
    public int varcount() { return inverse.length; }

    /** Number of cells with a variable, which exceeds varcount() under symmetry. */
    public int size() { return map.get(Prime.PRE).size() + map.get(Prime.POST).size(); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int row = grid.minRow(Prime.PRE); row <= grid.maxRow(Prime.PRE); ++row) {
            for (int col = grid.minCol(Prime.PRE); col <= grid.maxCol(Prime.PRE); ++col) {
                Cell pre = grid.cell(row, col, Prime.PRE);
                sb.append(pre).append(" -> ").append(var(pre)).append('\n');
                if (grid.contains(row, col, Prime.POST)) {
                    Cell post = pre.withPrime(Prime.POST);
                    sb.append(post).append(" -> ").append(var(post)).append('\n');
                }
            }
        }
        return sb.toString();
    }
}
