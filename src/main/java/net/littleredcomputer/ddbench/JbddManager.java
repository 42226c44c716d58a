// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench;

import de.tum.in.jbdd.Bdd;
import de.tum.in.jbdd.BddConfiguration;
import de.tum.in.jbdd.BddFactory;
import de.tum.in.jbdd.ImmutableBddConfiguration;
import gnu.trove.set.hash.TIntHashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.BitSet;
import java.util.function.IntPredicate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Runs the workloads on JBDD. A diagram is the integer id of its root in the JBDD node table.
 *
 * The workloads hold their intermediate results as plain values and never reference or release
 * them, so the node table is created without garbage collection: nodes live as long as the
 * manager. A manager is meant to serve one workload and then be dropped. Running out of room
 * surfaces as whatever JBDD (or the JVM) throws; nothing here tries to recover.
 */
public class JbddManager implements DiagramManager<Integer> {
    private static final Logger log = LogManager.getFormatterLogger(JbddManager.class);

    /** Initial size of the node table. JBDD grows it on demand. */
    public static final int DEFAULT_NODE_TABLE_SIZE = 1 << 16;

    private final int varcount;
    private final Bdd bdd;
    private Session session;

    public JbddManager(int varcount) {
        this(varcount, DEFAULT_NODE_TABLE_SIZE);
    }

    public JbddManager(int varcount, int nodeTableSize) {
        this(varcount, nodeTableSize, ImmutableBddConfiguration.builder().useGarbageCollection(false).build());
    }

    public JbddManager(int varcount, int nodeTableSize, BddConfiguration configuration) {
        checkArgument(varcount >= 0, "negative variable count");
        checkArgument(nodeTableSize > 0, "node table size must be positive");
        checkArgument(!configuration.useGarbageCollection(),
                "diagrams are not reference counted, so the node table must not be garbage collected");
        this.varcount = varcount;
        this.bdd = BddFactory.buildBddRecursive(nodeTableSize, configuration);
        if (varcount > 0) bdd.createVariables(varcount);
        log.debug("%s: %d variables, initial node table %d", name(), varcount, nodeTableSize);
    }

    @Override public String name() { return "jbdd"; }
    @Override public int varcount() { return varcount; }

    @Override public Integer top() { return bdd.trueNode(); }
    @Override public Integer bot() { return bdd.falseNode(); }

    @Override
    public Integer ithvar(int i) {
        checkArgument(0 <= i && i < varcount, "no variable %s", i);
        return bdd.variableNode(i);
    }

    @Override
    public Integer nithvar(int i) {
        return bdd.not(ithvar(i));
    }

    @Override public Integer ite(Integer f, Integer g, Integer h) { return bdd.ifThenElse(f, g, h); }

    @Override public Integer not(Integer f) { return bdd.not(f); }
    @Override public Integer and(Integer f, Integer g) { return bdd.and(f, g); }
    @Override public Integer or(Integer f, Integer g) { return bdd.or(f, g); }
    @Override public Integer xor(Integer f, Integer g) { return bdd.xor(f, g); }
    @Override public Integer xnor(Integer f, Integer g) { return bdd.equivalence(f, g); }
    @Override public Integer diff(Integer f, Integer g) { return bdd.and(f, bdd.not(g)); }
    @Override public Integer imp(Integer f, Integer g) { return bdd.implication(f, g); }

    @Override public Integer exists(Integer f, int i) { return exists(f, x -> x == i); }
    @Override public Integer exists(Integer f, IntPredicate vars) { return bdd.exists(f, select(vars)); }

    @Override
    public Integer exists(Integer f, Iterable<Integer> vars) {
        return bdd.exists(f, select(vars));
    }

    @Override public Integer forall(Integer f, int i) { return forall(f, x -> x == i); }
    @Override public Integer forall(Integer f, IntPredicate vars) { return forall(f, select(vars)); }
    @Override public Integer forall(Integer f, Iterable<Integer> vars) { return forall(f, select(vars)); }

    private int forall(int f, BitSet vars) {
        return bdd.not(bdd.exists(bdd.not(f), vars));
    }

    private BitSet select(IntPredicate vars) {
        BitSet s = new BitSet(varcount);
        for (int x = 0; x < varcount; ++x) if (vars.test(x)) s.set(x);
        return s;
    }

    private BitSet select(Iterable<Integer> vars) {
        BitSet s = new BitSet(varcount);
        for (int x : vars) {
            checkArgument(0 <= x && x < varcount, "no variable %s", x);
            s.set(x);
        }
        return s;
    }

    private boolean isLeaf(int f) {
        return f == bdd.trueNode() || f == bdd.falseNode();
    }

    @Override
    public long nodecount(Integer f) {
        TIntHashSet seen = new TIntHashSet();
        mark(f, seen);
        return seen.size();
    }

    private void mark(int f, TIntHashSet seen) {
        if (!seen.add(f) || isLeaf(f)) return;
        mark(bdd.low(f), seen);
        mark(bdd.high(f), seen);
    }

    @Override
    public BigInteger satcount(Integer f) {
        return bdd.countSatisfyingAssignments(f);
    }

    @Override
    public BigInteger satcount(Integer f, int activeVarCount) {
        checkArgument(0 <= activeVarCount && activeVarCount <= varcount,
                "active variable count %s outside [0, %s]", activeVarCount, varcount);
        return satcount(f).shiftRight(varcount - activeVarCount);
    }

    /** The value of f under a full assignment of the variables. */
    public boolean evaluate(Integer f, boolean[] assignment) {
        checkArgument(assignment.length == varcount, "assignment has %s values for %s variables", assignment.length, varcount);
        return bdd.evaluate(f, assignment);
    }

    @Override
    public NodeBuilder<Integer> builder() {
        checkState(session == null, "another construction is still open on this manager");
        session = new Session();
        return session;
    }

    /** Each node is made as ite(x_var, high, low), so the result is reduced as it is built. */
    private class Session implements NodeBuilder<Integer> {
        private int level = varcount;
        private int latest = bdd.falseNode();
        private boolean built;
        private boolean open = true;

        @Override
        public Integer leaf(boolean value) {
            checkState(open, "construction already finished");
            int t = value ? bdd.trueNode() : bdd.falseNode();
            if (!built) latest = t;
            return t;
        }

        @Override
        public Integer node(int v, Integer low, Integer high) {
            checkState(open, "construction already finished");
            checkArgument(0 <= v && v < varcount, "no variable %s", v);
            checkArgument(v <= level, "variable %s is above the already visited level %s", v, level);
            checkArgument(below(low, v) && below(high, v), "children of a node for variable %s must lie below it", v);
            level = v;
            built = true;
            latest = bdd.ifThenElse(bdd.variableNode(v), high, low);
            return latest;
        }

        private boolean below(int f, int v) {
            return isLeaf(f) || bdd.variable(f) > v;
        }

        @Override
        public Integer build() {
            checkState(open, "construction already finished");
            open = false;
            session = null;
            int root = latest;
            latest = bdd.falseNode();
            return root;
        }
    }
}
