// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench;

import com.google.common.math.BigIntegerMath;
import org.junit.Test;

import java.math.BigInteger;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class DiagramPredicatesTest {
    @Test public void exactlyKOfAll() {
        for (int k = 0; k <= 6; ++k) {
            JbddManager mgr = new JbddManager(6);
            Integer f = DiagramPredicates.exactly(mgr, k, x -> true);
            assertThat("k=" + k, mgr.satcount(f), is(BigIntegerMath.binomial(6, k)));
        }
    }

    @Test public void exactlyKOfSome() {
        // Counted are the even variables 0, 2, ..., 8; the other five are "don't care".
        for (int k = 0; k <= 5; ++k) {
            JbddManager mgr = new JbddManager(10);
            Integer f = DiagramPredicates.exactly(mgr, k, x -> x % 2 == 0);
            assertThat("k=" + k, mgr.satcount(f), is(BigIntegerMath.binomial(5, k).shiftLeft(5)));
        }
    }

    @Test public void exactlyOneOfTwo() {
        JbddManager mgr = new JbddManager(2);
        Integer f = DiagramPredicates.exactly(mgr, 1, x -> true);
        assertThat(f, is(mgr.xor(mgr.ithvar(0), mgr.ithvar(1))));
    }

    @Test public void exactlyIsExact() {
        JbddManager mgr = new JbddManager(5);
        Integer f = DiagramPredicates.exactly(mgr, 2, x -> x != 2);
        for (int bits = 0; bits < 32; ++bits) {
            boolean[] p = new boolean[5];
            for (int i = 0; i < 5; ++i) p[i] = (bits >> i & 1) != 0;
            int n = Integer.bitCount(bits & ~0b100);
            assertThat(mgr.evaluate(f, p), is(n == 2));
        }
    }

    @Test public void exactlyTooManyIsFalse() {
        JbddManager mgr = new JbddManager(4);
        assertThat(DiagramPredicates.exactly(mgr, 5, x -> true), is(mgr.bot()));
        assertThat(DiagramPredicates.exactly(mgr, 2, x -> x == 3), is(mgr.bot()));
        // No construction was left open.
        assertThat(mgr.builder(), is(notNullValue()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void exactlyNegative() {
        DiagramPredicates.exactly(new JbddManager(4), -1, x -> true);
    }

    @Test public void clause() {
        JbddManager mgr = new JbddManager(4);
        Integer c = DiagramPredicates.clause(mgr, new int[]{1, -3, 4});
        assertThat(c, is(mgr.or(mgr.ithvar(0), mgr.or(mgr.nithvar(2), mgr.ithvar(3)))));
        assertThat(mgr.satcount(c), is(BigInteger.valueOf(14)));
    }

    @Test public void clauseWithRepeatedLiteral() {
        JbddManager mgr = new JbddManager(3);
        assertThat(DiagramPredicates.clause(mgr, new int[]{-2, 3, -2}),
                is(mgr.or(mgr.nithvar(1), mgr.ithvar(2))));
    }

    @Test public void tautology() {
        JbddManager mgr = new JbddManager(3);
        assertThat(DiagramPredicates.clause(mgr, new int[]{2, 1, -2}), is(mgr.top()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void literalOutOfRange() {
        DiagramPredicates.clause(new JbddManager(3), new int[]{1, 4});
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyClause() {
        DiagramPredicates.clause(new JbddManager(3), new int[0]);
    }
}
