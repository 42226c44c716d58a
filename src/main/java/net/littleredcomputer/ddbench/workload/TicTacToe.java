// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.workload;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.ddbench.DiagramManager;
import net.littleredcomputer.ddbench.DiagramPredicates;
import net.littleredcomputer.ddbench.DiagramStatistics;
import net.littleredcomputer.ddbench.NodeBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tic-Tac-Toe on a 4x4x4 cube: in how many ways can N crosses be placed so that the remaining
 * positions, filled with noughts, leave no line of four all crosses or all noughts? Position
 * (i, j, k) is variable 16i + 4j + k; true means a cross.
 */
public class TicTacToe {
    private static final Logger log = LogManager.getFormatterLogger(TicTacToe.class);
    public static final int SIZE = 4;
    public static final int VARIABLES = SIZE * SIZE * SIZE;
    private static final List<int[]> lines = lines();

    private final int crosses;

    public TicTacToe(int crosses) {
        checkArgument(crosses >= 0 && crosses <= VARIABLES, "crosses must be in [0, %s]", VARIABLES);
        this.crosses = crosses;
    }

    static int label(int i, int j, int k) { return SIZE * SIZE * i + SIZE * j + k; }

    /** The 76 winning lines of the cube, in the order they are conjoined. */
    public static List<int[]> winningLines() { return lines; }

    private static List<int[]> lines() {
        final ImmutableList.Builder<int[]> b = ImmutableList.builder();
        // Rows within each plane i, then its anti-diagonal.
        for (int i = 0; i < 4; ++i) for (int j = 0; j < 4; ++j) b.add(new int[]{label(i, j, 0), label(i, j, 1), label(i, j, 2), label(i, j, 3)});
        for (int i = 0; i < 4; ++i) b.add(new int[]{label(i, 0, 3), label(i, 1, 2), label(i, 2, 1), label(i, 3, 0)});
        // Columns within each plane, then its diagonal.
        for (int i = 0; i < 4; ++i) for (int k = 0; k < 4; ++k) b.add(new int[]{label(i, 0, k), label(i, 1, k), label(i, 2, k), label(i, 3, k)});
        for (int i = 0; i < 4; ++i) b.add(new int[]{label(i, 0, 0), label(i, 1, 1), label(i, 2, 2), label(i, 3, 3)});
        // Two space diagonals.
        b.add(new int[]{label(0, 3, 3), label(1, 2, 2), label(2, 1, 1), label(3, 0, 0)});
        b.add(new int[]{label(0, 3, 0), label(1, 2, 1), label(2, 1, 2), label(3, 0, 3)});
        // Planes of fixed j: anti-diagonals, verticals, diagonals.
        for (int j = 0; j < 4; ++j) b.add(new int[]{label(0, j, 3), label(1, j, 2), label(2, j, 1), label(3, j, 0)});
        for (int j = 0; j < 4; ++j) for (int k = 0; k < 4; ++k) b.add(new int[]{label(0, j, k), label(1, j, k), label(2, j, k), label(3, j, k)});
        for (int j = 0; j < 4; ++j) b.add(new int[]{label(0, j, 0), label(1, j, 1), label(2, j, 2), label(3, j, 3)});
        // Planes of fixed k.
        for (int k = 0; k < 4; ++k) b.add(new int[]{label(0, 3, k), label(1, 2, k), label(2, 1, k), label(3, 0, k)});
        for (int k = 0; k < 4; ++k) b.add(new int[]{label(0, 0, k), label(1, 1, k), label(2, 2, k), label(3, 3, k)});
        // The other two space diagonals.
        b.add(new int[]{label(0, 0, 3), label(1, 1, 2), label(2, 2, 1), label(3, 3, 0)});
        b.add(new int[]{label(0, 0, 0), label(1, 1, 1), label(2, 2, 2), label(3, 3, 3)});
        return b.build();
    }

    /** Exactly as many of the 64 positions as there are crosses are true. */
    public <D> D initial(DiagramManager<D> mgr) {
        return DiagramPredicates.exactly(mgr, crosses, x -> x < VARIABLES);
    }

    /** The positions of line are neither all crosses nor all noughts. */
    public static <D> D notWinning(DiagramManager<D> mgr, int[] line) {
        final int[] ls = line.clone();
        Arrays.sort(ls);
        final NodeBuilder<D> b = mgr.builder();
        final D ff = b.leaf(false);
        final D tt = b.leaf(true);
        // someNought: a nought below; someCross: a cross below.
        D someNought = ff;
        D someCross = ff;
        for (int i = ls.length - 1; i > 0; --i) {
            someNought = b.node(ls[i], tt, someNought);
            someCross = b.node(ls[i], someCross, tt);
        }
        b.node(ls[0], someCross, someNought);
        return b.build();
    }

    public <D> BigInteger solutions(DiagramManager<D> mgr) {
        return solutions(mgr, new DiagramStatistics());
    }

    /** The number of placements of the crosses with no winning line. */
    public <D> BigInteger solutions(DiagramManager<D> mgr, DiagramStatistics stats) {
        checkArgument(mgr.varcount() >= VARIABLES, "manager has %s variables, %s needed", mgr.varcount(), VARIABLES);
        log.info("Tic-Tac-Toe with %d crosses (%s)", crosses, mgr.name());
        final Stopwatch sw = Stopwatch.createStarted();
        D res = initial(mgr);
        observe(mgr, stats, "Init", res);
        for (int[] line : lines) {
            final D acc = res;
            final D c = notWinning(mgr, line);
            res = stats.timeApply(() -> mgr.and(acc, c));
            observe(mgr, stats, "Line " + Arrays.toString(line), res);
            if (res.equals(mgr.bot())) break;
        }
        final BigInteger n = mgr.satcount(res, VARIABLES);
        sw.stop();
        log.info("Tic-Tac-Toe with %d crosses: %s solutions in %s (%s)", crosses, n, sw, stats);
        return n;
    }

    private <D> void observe(DiagramManager<D> mgr, DiagramStatistics stats, String label, D f) {
        if (!stats.tracksSizes() && !log.isDebugEnabled()) return;
        long size = mgr.nodecount(f);
        stats.observe(label, size);
        log.debug("   | %-24s : %d", label, size);
    }
}
