// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

import net.littleredcomputer.ddbench.DiagramManager;
import net.littleredcomputer.ddbench.DiagramPredicates;
import net.littleredcomputer.ddbench.NodeBuilder;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Per-cell predicates built node by node, bottom-up over all variables of the {@link VarMap}.
 * Building them this way costs time linear in the number of variables, where combining literals
 * with and/or would produce (and throw away) many intermediate diagrams.
 */
public final class LifePredicates {
    private LifePredicates() {}

    /**
     * True iff exactly alive of the nine pre cells around c (c itself included) are alive.
     * If alive exceeds the size of the neighbourhood, the constant false is returned and no
     * construction is started.
     *
     * @param c a position of the post board (its primedness is ignored)
     * @see DiagramPredicates#exactly
     */
    public static <D> D count(DiagramManager<D> mgr, VarMap vm, Cell c, int alive) {
        checkVarcount(mgr, vm);
        final Cell centre = c.withPrime(Prime.POST);
        if (!vm.grid().contains(centre)) {
            throw new IllegalArgumentException("Cell not within valid boundaries: " + centre);
        }
        return DiagramPredicates.exactly(mgr, alive, x -> {
            final Cell cell = vm.cell(x);
            return cell.prime() == Prime.PRE && centre.inNeighbourhood(cell);
        });
    }

    /** True iff the cell c is in the same state before and after the step. */
    public static <D> D eq(DiagramManager<D> mgr, VarMap vm, Cell c) {
        checkVarcount(mgr, vm);
        final int xPre = vm.var(c.withPrime(Prime.PRE));
        final int xPost = vm.var(c.withPrime(Prime.POST));
        checkState(xPre < xPost, "pre variable %s of %s is not above its post variable %s", xPre, c, xPost);

        final NodeBuilder<D> b = mgr.builder();
        final D bot = b.leaf(false);
        // root0 continues the main chain, root1 the branch where the pre variable was true.
        D root0 = b.leaf(true);
        D root1;

        int x = vm.varcount() - 1;
        for (; xPost < x; --x) root0 = b.node(x, root0, root0);

        root1 = b.node(x, bot, root0);
        root0 = b.node(x, root0, bot);

        for (--x; xPre < x; --x) {
            root1 = b.node(x, root1, root1);
            root0 = b.node(x, root0, root0);
        }

        root0 = b.node(x, root0, root1);

        for (--x; x >= 0; --x) root0 = b.node(x, root0, root0);

        return b.build();
    }

    // Both predicates visit every variable of vm, so the manager must have exactly those.
    private static void checkVarcount(DiagramManager<?> mgr, VarMap vm) {
        checkArgument(mgr.varcount() == vm.varcount(),
                "manager has %s variables, the board needs %s", mgr.varcount(), vm.varcount());
    }
}
