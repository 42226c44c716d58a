// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.ddbench.DiagramManager;
import net.littleredcomputer.ddbench.DiagramStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.function.IntFunction;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Counts the Garden of Eden states of a Life board: post states that no pre state leads to.
 *
 * The one-step image of all pre states is computed symbolically. The transition relation is
 * accumulated row by row, the top half downwards and the bottom half upwards, and pre rows that
 * no remaining post row depends on are quantified away as soon as the {@link
 * QuantificationSchedule} allows. What is left after quantifying the remaining pre variables is
 * the set of reachable post states; its complement is counted.
 *
 * The variable order is designed for boards with cols <= rows.
 */
public class GardenOfEden {
    private static final Logger log = LogManager.getFormatterLogger(GardenOfEden.class);

    enum Phase {
        TOP_HALF("Top Half"),
        BOTTOM_HALF("Bottom Half"),
        MIDDLE_ROW("Middle Row"),
        QUANTIFY("Quantify"),
        DONE("Done");

        private final String title;

        Phase(String title) { this.title = title; }
    }

    private final VarMap vm;
    private QuantificationSchedule schedule = QuantificationSchedule.EAGER;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private Phase phase = Phase.DONE;

    /** The post board has rows x cols cells. */
    public GardenOfEden(int rows, int cols, Symmetry symmetry) {
        this(new VarMap(new Grid(rows, cols), symmetry));
    }

    public GardenOfEden(VarMap vm) {
        this.vm = vm;
    }

    public VarMap varMap() { return vm; }

    public GardenOfEden setSchedule(QuantificationSchedule schedule) {
        this.schedule = schedule;
        return this;
    }

    public GardenOfEden setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /**
     * Count the unreachable post states of a rows x cols board on a fresh manager from backend,
     * which is given the number of variables needed.
     */
    public static <D> BigInteger count(int rows, int cols, Symmetry symmetry, IntFunction<? extends DiagramManager<D>> backend) {
        GardenOfEden goe = new GardenOfEden(rows, cols, symmetry);
        return goe.unreachableStates(backend.apply(goe.vm.varcount()));
    }

    public <D> BigInteger unreachableStates(DiagramManager<D> mgr) {
        return unreachableStates(mgr, new DiagramStatistics());
    }

    /**
     * The number of post states without a predecessor. Under {@link Symmetry#MIRROR} only the
     * mirror-symmetric post states are counted.
     */
    public <D> BigInteger unreachableStates(DiagramManager<D> mgr, DiagramStatistics stats) {
        final Grid grid = vm.grid();
        log.info("Game of Life : [%s] (%s), symmetry %s, %d variables (%d pre, %d post)",
                grid, mgr.name(), vm.symmetry(), vm.varcount(), vm.varcount(Prime.PRE), vm.varcount(Prime.POST));
        final Stopwatch sw = Stopwatch.createStarted();
        final D reachable = image(mgr, stats);
        final D unreachable = stats.timeApply(() -> mgr.not(reachable));
        final BigInteger n = mgr.satcount(unreachable, vm.varcount(Prime.POST));
        sw.stop();
        log.info("Game of Life : [%s] %s unreachable states in %s (%s)", grid, n, sw, stats);
        return n;
    }

    public <D> D image(DiagramManager<D> mgr) {
        return image(mgr, new DiagramStatistics());
    }

    /** The post states reachable in one step from any pre state; depends on post variables only. */
    public <D> D image(DiagramManager<D> mgr, DiagramStatistics stats) {
        checkArgument(mgr.varcount() == vm.varcount(),
                "manager has %s variables, the board needs %s", mgr.varcount(), vm.varcount());
        final Grid grid = vm.grid();
        if (grid.rows(Prime.POST) < grid.cols(Prime.POST)) {
            log.warn("The variable ordering is designed for 'cols <= rows'. Maybe restart with the dimensions flipped?");
        }
        lastLogTime = Instant.now();

        enter(Phase.TOP_HALF);
        D res = half(mgr, false, stats);

        enter(Phase.BOTTOM_HALF);
        final D bottom = half(mgr, true, stats);
        final D top = res;
        res = stats.timeApply(() -> mgr.and(top, bottom));

        if (grid.rows(Prime.POST) % 2 == 1) {
            enter(Phase.MIDDLE_ROW);
            final D acc = res;
            final D middle = TransitionRelation.forRow(mgr, vm, grid.rows(Prime.POST) / 2 + 1, stats);
            res = stats.timeApply(() -> mgr.and(acc, middle));
        }
        observe(mgr, stats, String.format("Acc [%d-%d]", grid.minRow(Prime.PRE), grid.maxRow(Prime.PRE)), res);

        // This is where the diagram explodes before it collapses to the image.
        enter(Phase.QUANTIFY);
        final D all = res;
        res = stats.timeExists(() -> mgr.exists(all, x -> vm.cell(x).prime() == Prime.PRE));
        observe(mgr, stats, "Exi [_]", res);

        enter(Phase.DONE);
        return res;
    }

    private <D> D half(DiagramManager<D> mgr, boolean bottom, DiagramStatistics stats) {
        final Grid grid = vm.grid();
        final int halfRows = grid.rows(Prime.POST) / 2;
        final int step = bottom ? -1 : 1;
        final int begin = bottom ? grid.maxRow(Prime.POST) : grid.minRow(Prime.POST);
        final int end = begin + step * (halfRows - 1);

        D res = mgr.top();
        for (int row = begin; bottom ? end <= row : row <= end; row += step) {
            final D acc = res;
            final D rel = TransitionRelation.forRow(mgr, vm, row, stats);
            res = stats.timeApply(() -> mgr.and(acc, rel));
            observe(mgr, stats, String.format("Acc [%d-%d]", begin, row), res);

            // The pre row on the outer side of this row is used by no later post row of this half.
            final int quantRow = row - step;
            if (quantifyEarly(bottom, begin, quantRow)) {
                final D closed = res;
                res = stats.timeExists(() -> mgr.exists(closed, x -> {
                    Cell c = vm.cell(x);
                    return c.prime() == Prime.PRE && c.row() == quantRow;
                }));
                observe(mgr, stats, String.format("Exi [%d]", quantRow), res);
            }
            final int r = row;
            maybeReportProgress(() -> String.format("row %d of %s", r, grid));
        }
        return res;
    }

    private boolean quantifyEarly(boolean bottom, int begin, int quantRow) {
        switch (schedule) {
            case EAGER: return true;
            case BORDER: return bottom ? begin <= quantRow : quantRow < begin;
            case DEFERRED: return false;
            default: throw new IllegalStateException("unknown schedule " + schedule);
        }
    }

    private void enter(Phase next) {
        log.debug("   | %s -> %s", phase.title, next.title);
        phase = next;
    }

    private <D> void observe(DiagramManager<D> mgr, DiagramStatistics stats, String label, D f) {
        if (!stats.tracksSizes() && !log.isDebugEnabled()) return;
        long size = mgr.nodecount(f);
        stats.observe(label, size);
        log.debug("   | | %-12s : %d", label, size);
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();
        if (Duration.between(lastLogTime, now).compareTo(logInterval) < 0) return;
        log.info(() -> new FormattedMessage("%s: %s", phase.title, s.get()));
        lastLogTime = now;
    }

    /**
     * Whether the post state given by pattern is in image, which must come from {@link
     * #image}. The pattern has the size of the post board. Under symmetry, a pattern that is not
     * mirror-symmetric is never reachable.
     */
    public <D> boolean isReachable(DiagramManager<D> mgr, D image, Life pattern) {
        final Grid grid = vm.grid();
        checkArgument(pattern.rows() == grid.rows(Prime.POST) && pattern.cols() == grid.cols(Prime.POST),
                "pattern is %sx%s, the board %s", pattern.rows(), pattern.cols(), grid);
        D state = mgr.top();
        for (int row = grid.minRow(Prime.POST); row <= grid.maxRow(Prime.POST); ++row) {
            for (int col = grid.minCol(Prime.POST); col <= grid.maxCol(Prime.POST); ++col) {
                int x = vm.var(grid.cell(row, col, Prime.POST));
                boolean alive = pattern.alive(row - grid.minRow(Prime.POST), col - grid.minCol(Prime.POST));
                state = mgr.and(state, alive ? mgr.ithvar(x) : mgr.nithvar(x));
            }
        }
        return !mgr.and(image, state).equals(mgr.bot());
    }
}
