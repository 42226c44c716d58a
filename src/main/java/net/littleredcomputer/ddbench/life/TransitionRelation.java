// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

import net.littleredcomputer.ddbench.DiagramManager;
import net.littleredcomputer.ddbench.DiagramStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Relations between pre and post states for single cells and whole rows of the post board.
 */
public final class TransitionRelation {
    private static final Logger log = LogManager.getFormatterLogger(TransitionRelation.class);

    private TransitionRelation() {}

    /**
     * The relation that the post state of cell c follows from the pre states around it. The rule
     * of Life is summed over the whole 3x3 square: a sum of three makes the centre alive, a sum of
     * four keeps its state and any other sum leaves it dead.
     */
    public static <D> D forCell(DiagramManager<D> mgr, VarMap vm, Cell c) {
        final D alive3 = LifePredicates.count(mgr, vm, c, 3);
        final D alive4 = LifePredicates.count(mgr, vm, c, 4);
        final int post = vm.var(c.withPrime(Prime.POST));

        // 3: born or survives.
        D out = mgr.imp(alive3, mgr.ithvar(post));
        // 4: unchanged.
        out = mgr.and(out, mgr.imp(alive4, LifePredicates.eq(mgr, vm, c)));
        // Otherwise dead.
        final D other = mgr.not(mgr.or(alive3, alive4));
        return mgr.and(out, mgr.imp(other, mgr.nithvar(post)));
    }

    /** The conjunction of {@link #forCell} over one row of the post board, built right to left. */
    public static <D> D forRow(DiagramManager<D> mgr, VarMap vm, int row, DiagramStatistics stats) {
        final Grid grid = vm.grid();
        D res = mgr.top();
        for (int col = grid.maxCol(Prime.POST); col >= grid.minCol(Prime.POST); --col) {
            final Cell c = grid.cell(row, col, Prime.POST);
            final D acc = res;
            res = stats.timeApply(() -> mgr.and(acc, forCell(mgr, vm, c)));
            if (stats.tracksSizes() || log.isDebugEnabled()) {
                long size = mgr.nodecount(res);
                stats.observe("Rel " + c, size);
                log.debug("   | | | %-4s : %d", c, size);
            }
        }
        return res;
    }
}
