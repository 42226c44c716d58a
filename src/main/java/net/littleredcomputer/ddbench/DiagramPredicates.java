// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.IntPredicate;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Predicates that are built directly with a {@link NodeBuilder}, leaves first, instead of by
 * combining literals.
 */
public final class DiagramPredicates {
    private DiagramPredicates() {}

    /**
     * True iff exactly k of the variables accepted by counted are true; all other variables
     * are "don't care". If fewer than k variables are counted, the constant false is returned
     * without starting a construction.
     *
     * One pass over the variables from the bottom up keeps a chain of partial diagrams per
     * possible number of true counted variables above the current one. Only the numbers that
     * can still add up to k are kept, so the work is O(k * varcount).
     */
    public static <D> D exactly(DiagramManager<D> mgr, int k, IntPredicate counted) {
        checkArgument(k >= 0, "negative count %s", k);
        int total = 0;
        for (int x = 0; x < mgr.varcount(); ++x) if (counted.test(x)) ++total;
        if (k > total) return mgr.bot();

        // parts.get(i): true iff k - i of the counted variables processed so far are true.
        final NodeBuilder<D> b = mgr.builder();
        final List<D> parts = new ArrayList<>(Collections.nCopies(k + 2, b.leaf(false)));
        parts.set(k, b.leaf(true));

        int processed = 0;
        int min = k;
        int max = k;
        for (int x = mgr.varcount() - 1; x >= 0; --x) {
            if (counted.test(x)) {
                ++processed;
                // i true variables above x leave k - i for x and below: both have to fit.
                min = Math.max(k - processed, 0);
                max = Math.min(k, total - processed);
                for (int i = min; i <= max; ++i) {
                    parts.set(i, b.node(x, parts.get(i), parts.get(i + 1)));
                }
            } else {
                for (int i = min; i <= max; ++i) {
                    final D child = parts.get(i);
                    parts.set(i, b.node(x, child, child));
                }
            }
        }
        // The range has narrowed to [0, 0], so the last node built is parts[0].
        return b.build();
    }

    /**
     * The disjunction of the given literals. A literal is v+1 for variable v and -(v+1) for its
     * negation, as in DIMACS files. A clause with both v and -v is the constant true.
     */
    public static <D> D clause(DiagramManager<D> mgr, int[] literals) {
        checkArgument(literals.length > 0, "empty clause");
        final int[] ls = literals.clone();
        for (int l : ls) {
            checkArgument(l != 0 && Math.abs(l) <= mgr.varcount(), "literal %s out of range", l);
        }
        // Deepest variable first; a literal and its negation end up next to each other.
        final Integer[] order = Arrays.stream(ls).boxed().toArray(Integer[]::new);
        Arrays.sort(order, (p, q) -> Math.abs(p) != Math.abs(q) ? Math.abs(q) - Math.abs(p) : p - q);
        for (int i = 1; i < order.length; ++i) {
            if (order[i] == -order[i - 1]) return mgr.top();
        }

        final NodeBuilder<D> b = mgr.builder();
        final D tt = b.leaf(true);
        D c = b.leaf(false);
        for (int i = 0; i < order.length; ++i) {
            if (i > 0 && order[i].equals(order[i - 1])) continue;
            final int l = order[i];
            final int x = Math.abs(l) - 1;
            c = l > 0 ? b.node(x, c, tt) : b.node(x, tt, c);
        }
        return b.build();
    }
}
