// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class VarMapTest {
    private static void checkBijective(VarMap vm) {
        Grid g = vm.grid();
        Set<Integer> vars = new HashSet<>();
        for (int row = g.minRow(Prime.PRE); row <= g.maxRow(Prime.PRE); ++row) {
            for (int col = g.minCol(Prime.PRE); col <= g.maxCol(Prime.PRE); ++col) {
                Cell c = g.cell(row, col, Prime.PRE);
                int x = vm.var(c);
                assertThat(vm.cell(x), is(c));
                assertThat(vm.cell(x).prime(), is(Prime.PRE));
                assertThat(vars.add(x), is(true));
            }
        }
        assertThat(vm.varcount(Prime.PRE), is(g.rows(Prime.PRE) * g.cols(Prime.PRE)));
        assertThat(vars.size(), is(vm.varcount(Prime.PRE)));
        for (int row = g.minRow(Prime.POST); row <= g.maxRow(Prime.POST); ++row) {
            for (int col = g.minCol(Prime.POST); col <= g.maxCol(Prime.POST); ++col) {
                Cell c = g.cell(row, col, Prime.POST);
                int x = vm.var(c);
                assertThat(vm.cell(x, c), is(c));
                assertThat(vm.cell(x).prime(), is(Prime.POST));
                assertThat(vm.cell(x).row(), is(row));
                vars.add(x);
            }
        }
        assertThat(vars.size(), is(vm.varcount()));
        assertThat(vm.varcount(Prime.PRE) + vm.varcount(Prime.POST), is(vm.varcount()));
    }

    @Test public void noneIsBijective() {
        for (int r = 1; r <= 5; ++r) for (int c = 1; c <= 5; ++c) checkBijective(new VarMap(new Grid(r, c), Symmetry.NONE));
    }

    @Test public void mirrorIsBijectiveOnPreCells() {
        for (int r = 1; r <= 5; ++r) for (int c = 1; c <= 5; ++c) checkBijective(new VarMap(new Grid(r, c), Symmetry.MIRROR));
    }

    @Test public void noneInterleavesRowMajor() {
        VarMap vm = new VarMap(new Grid(1, 1), Symmetry.NONE);
        Grid g = vm.grid();
        assertThat(vm.varcount(), is(10));
        assertThat(vm.var(g.cell(0, 0, Prime.PRE)), is(0));
        assertThat(vm.var(g.cell(1, 0, Prime.PRE)), is(3));
        assertThat(vm.var(g.cell(1, 1, Prime.PRE)), is(4));
        assertThat(vm.var(g.cell(1, 1, Prime.POST)), is(5));
        assertThat(vm.var(g.cell(2, 2, Prime.PRE)), is(9));
        assertThat(vm.size(), is(10));
    }

    @Test public void mirrorSharesPostVariables() {
        for (int cols = 1; cols <= 6; ++cols) {
            VarMap vm = new VarMap(new Grid(3, cols), Symmetry.MIRROR);
            Grid g = vm.grid();
            for (int row = 1; row <= 3; ++row) {
                for (int col = 1; col <= cols; ++col) {
                    int mirror = cols + 1 - col;
                    int x = vm.var(g.cell(row, col, Prime.POST));
                    int y = vm.var(g.cell(row, mirror, Prime.POST));
                    assertThat(x, is(y));
                    // Every other pair of post cells has distinct variables.
                    for (int other = 1; other <= cols; ++other) {
                        if (other != col && other != mirror) {
                            assertThat(vm.var(g.cell(row, other, Prime.POST)), is(not(x)));
                        }
                    }
                }
            }
            assertThat(vm.varcount(Prime.POST), is(3 * ((cols + 1) / 2)));
            assertThat(vm.size(), is(vm.varcount(Prime.PRE) + 3 * cols));
        }
    }

    @Test public void mirrorNeverSharesPreVariables() {
        VarMap vm = new VarMap(new Grid(2, 4), Symmetry.MIRROR);
        Grid g = vm.grid();
        assertThat(vm.var(g.cell(1, 0, Prime.PRE)), is(not(vm.var(g.cell(1, 5, Prime.PRE)))));
    }

    @Test public void sharedVariableMapsBackToTheLeftCell() {
        VarMap vm = new VarMap(new Grid(2, 4), Symmetry.MIRROR);
        Grid g = vm.grid();
        Cell left = g.cell(2, 1, Prime.POST);
        Cell right = g.cell(2, 4, Prime.POST);
        int x = vm.var(right);
        assertThat(vm.cell(x).col(), is(1));
        assertThat(vm.cell(x, right).col(), is(4));
        assertThat(vm.cell(x, left).col(), is(1));
    }

    @Test public void preVariablesPrecedeTheirPostVariables() {
        for (Symmetry s : Symmetry.values()) {
            VarMap vm = new VarMap(new Grid(3, 4), s);
            Grid g = vm.grid();
            for (int row = 1; row <= 3; ++row) {
                for (int col = 1; col <= 4; ++col) {
                    assertThat(vm.var(g.cell(row, col, Prime.PRE)), is(lessThan(vm.var(g.cell(row, col, Prime.POST)))));
                }
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void unmappedVariable() {
        VarMap vm = new VarMap(new Grid(2, 2), Symmetry.NONE);
        vm.cell(vm.varcount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void cellOutsideTheBoard() {
        new Grid(2, 2).cell(0, 0, Prime.POST);
    }

    @Test(expected = IllegalArgumentException.class)
    public void postCellOnThePreBorder() {
        Grid g = new Grid(2, 2);
        new VarMap(g, Symmetry.NONE).var(g.cell(3, 3, Prime.PRE).withPrime(Prime.POST));
    }

    @Test public void symmetryNames() {
        assertThat(Symmetry.NONE.toString(), is("None"));
        assertThat(Symmetry.MIRROR.toString(), is("Mirror (Vertical)"));
    }
}
