// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.workload;

import com.google.common.math.BigIntegerMath;
import net.littleredcomputer.ddbench.JbddManager;
import net.littleredcomputer.ddbench.DiagramStatistics;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class TicTacToeTest {
    @Test public void seventySixLines() {
        assertThat(TicTacToe.winningLines(), hasSize(76));
        Set<String> distinct = new HashSet<>();
        for (int[] line : TicTacToe.winningLines()) {
            int[] l = line.clone();
            Arrays.sort(l);
            assertThat(distinct.add(Arrays.toString(l)), is(true));
            for (int x : l) assertThat(x, is(both(greaterThanOrEqualTo(0)).and(lessThan(64))));
            // Positions on a line are evenly spaced.
            assertThat(l[1] - l[0], is(l[2] - l[1]));
            assertThat(l[2] - l[1], is(l[3] - l[2]));
        }
    }

    @Test public void labels() {
        assertThat(TicTacToe.label(0, 0, 0), is(0));
        assertThat(TicTacToe.label(1, 2, 3), is(27));
        assertThat(TicTacToe.label(3, 3, 3), is(63));
    }

    @Test public void initialCountsPlacements() {
        JbddManager mgr = new JbddManager(TicTacToe.VARIABLES);
        for (int n : new int[]{0, 1, 5, 20, 64}) {
            Integer f = new TicTacToe(n).initial(mgr);
            assertThat("crosses " + n, mgr.satcount(f), is(BigIntegerMath.binomial(64, n)));
        }
    }

    @Test public void notWinning() {
        JbddManager mgr = new JbddManager(8);
        Integer f = TicTacToe.notWinning(mgr, new int[]{6, 1, 3, 4});
        Integer all = mgr.and(mgr.and(mgr.ithvar(1), mgr.ithvar(3)), mgr.and(mgr.ithvar(4), mgr.ithvar(6)));
        Integer none = mgr.and(mgr.and(mgr.nithvar(1), mgr.nithvar(3)), mgr.and(mgr.nithvar(4), mgr.nithvar(6)));
        assertThat(f, is(mgr.not(mgr.or(all, none))));
        assertThat(mgr.satcount(f, 8).shiftRight(4), is(BigInteger.valueOf(14)));
    }

    @Test public void fewCrossesAlwaysLeaveANoughtLine() {
        // Every position lies on at most 7 lines, so 10 crosses cannot block all 76.
        for (int n : new int[]{0, 1, 2, 4}) {
            JbddManager mgr = new JbddManager(TicTacToe.VARIABLES);
            assertThat("crosses " + n, new TicTacToe(n).solutions(mgr), is(BigInteger.ZERO));
        }
    }

    @Test public void manyCrossesAlwaysMakeACrossLine() {
        for (int n : new int[]{64, 63, 60}) {
            JbddManager mgr = new JbddManager(TicTacToe.VARIABLES);
            assertThat("crosses " + n, new TicTacToe(n).solutions(mgr), is(BigInteger.ZERO));
        }
    }

    @Test public void twentyCrosses() {
        DiagramStatistics stats = new DiagramStatistics(true);
        BigInteger draws = new TicTacToe(20).solutions(new JbddManager(TicTacToe.VARIABLES), stats);
        assertThat(draws, is(BigInteger.valueOf(304)));
        // The initial diagram and one per winning line.
        assertThat(stats.labels(), hasSize(1 + TicTacToe.winningLines().size()));
    }

    @Test public void sizesAreObserved() {
        DiagramStatistics stats = new DiagramStatistics(true);
        new TicTacToe(2).solutions(new JbddManager(TicTacToe.VARIABLES), stats);
        assertThat(stats.labels().get(0), is("Init"));
        assertThat(stats.largestSize(), is(greaterThan(2L)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooManyCrosses() {
        new TicTacToe(65);
    }
}
