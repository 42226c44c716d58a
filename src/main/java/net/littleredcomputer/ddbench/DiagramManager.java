// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench;

import java.math.BigInteger;
import java.util.function.IntPredicate;

/**
 * The capabilities a decision diagram package must offer to run the benchmarks. Variables are
 * numbered 0 .. varcount()-1, and the number is also the level of the variable: smaller
 * variables sit closer to the root.
 *
 * Handles of type D are owned by the backend. Workloads never modify a handle; every operation
 * returns a new one. Handles of equal functions are equal (canonicity).
 *
 * @param <D> the backend's diagram handle
 */
public interface DiagramManager<D> {
    /** Short human readable name of the package, e.g. for log output. */
    String name();

    int varcount();

    D top();
    D bot();

    D ithvar(int i);
    D nithvar(int i);

    D ite(D f, D g, D h);

    D not(D f);
    D and(D f, D g);
    D or(D f, D g);
    D xor(D f, D g);
    D xnor(D f, D g);
    /** f and not g */
    D diff(D f, D g);
    /** not f or g */
    D imp(D f, D g);

    D exists(D f, int i);
    D exists(D f, IntPredicate vars);
    D exists(D f, Iterable<Integer> vars);

    D forall(D f, int i);
    D forall(D f, IntPredicate vars);
    D forall(D f, Iterable<Integer> vars);

    /** Number of nodes, each terminal that is reachable counted once. */
    long nodecount(D f);

    /** Number of satisfying assignments over all varcount() variables. */
    BigInteger satcount(D f);

    /**
     * Number of satisfying assignments, where only activeVarCount variables are considered.
     * The result of the full count is divided by 2^(varcount() - activeVarCount), so the
     * remaining variables count as "don't care". Meaningful when f does not depend on them.
     */
    BigInteger satcount(D f, int activeVarCount);

    /**
     * Start a bottom-up construction. Only one session may be open on a manager at a time; it
     * is closed by {@link NodeBuilder#build()}.
     *
     * @throws IllegalStateException if another session is still open
     */
    NodeBuilder<D> builder();
}
