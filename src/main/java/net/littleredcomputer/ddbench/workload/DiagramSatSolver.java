// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.workload;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import net.littleredcomputer.ddbench.DiagramManager;
import net.littleredcomputer.ddbench.DiagramPredicates;
import net.littleredcomputer.ddbench.DiagramStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Decides a {@link Cnf} formula by conjoining its clauses as decision diagrams. Variable v of the
 * formula is diagram variable v-1.
 */
public class DiagramSatSolver<D> {
    private static final Logger log = LogManager.getFormatterLogger(DiagramSatSolver.class);
    private final DiagramManager<D> mgr;
    private final Cnf problem;
    private final DiagramStatistics stats;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch;

    public DiagramSatSolver(DiagramManager<D> mgr, Cnf problem) {
        this(mgr, problem, new DiagramStatistics());
    }

    public DiagramSatSolver(DiagramManager<D> mgr, Cnf problem, DiagramStatistics stats) {
        this(mgr, problem, stats, Ticker.systemTicker());
    }

    DiagramSatSolver(DiagramManager<D> mgr, Cnf problem, DiagramStatistics stats, Ticker ticker) {
        checkArgument(mgr.varcount() >= problem.nVariables(),
                "manager has %s variables, the formula needs %s", mgr.varcount(), problem.nVariables());
        this.mgr = mgr;
        this.problem = problem;
        this.stats = stats;
        this.stopwatch = Stopwatch.createUnstarted(ticker);
    }

    public DiagramSatSolver<D> setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /** Time taken by the most recent isSatisfiable, satcount or solve. */
    public Duration elapsed() {
        return stopwatch.elapsed();
    }

    /**
     * Whether some assignment satisfies every clause. Each variable is quantified away right after
     * the last clause mentioning it has been conjoined, and the search stops as soon as the
     * accumulated diagram is the constant false.
     */
    public boolean isSatisfiable() {
        final int[] lastUse = new int[problem.nVariables()];
        Arrays.fill(lastUse, -1);
        for (int i = 0; i < problem.nClauses(); ++i) {
            for (int l : problem.getClause(i)) lastUse[Math.abs(l) - 1] = i;
        }
        start();
        D acc = mgr.top();
        for (int i = 0; i < problem.nClauses(); ++i) {
            acc = conjoin(acc, i);
            final int clause = i;
            final D closed = acc;
            acc = stats.timeExists(() -> mgr.exists(closed,
                    x -> x < lastUse.length && lastUse[x] == clause));
            if (acc.equals(mgr.bot())) {
                stopwatch.stop();
                log.info("UNSAT after %d of %d clauses (%s)", i + 1, problem.nClauses(), stopwatch);
                return false;
            }
            final int n = i;
            maybeReportProgress(() -> String.format("clause %d of %d, %d nodes", n + 1, problem.nClauses(), mgr.nodecount(closed)));
        }
        stopwatch.stop();
        log.info("SAT in %s (%s)", stopwatch, stats);
        return true;
    }

    /** The number of assignments to the variables of the formula that satisfy every clause. */
    public BigInteger satcount() {
        start();
        D acc = mgr.top();
        for (int i = 0; i < problem.nClauses(); ++i) {
            acc = conjoin(acc, i);
            if (acc.equals(mgr.bot())) break;
            final int n = i;
            maybeReportProgress(() -> String.format("clause %d of %d", n + 1, problem.nClauses()));
        }
        final BigInteger count = mgr.satcount(acc, problem.nVariables());
        stopwatch.stop();
        log.info("%s solutions in %s (%s)", count, stopwatch, stats);
        return count;
    }

    /**
     * Some assignment satisfying every clause, with variable v at index v-1, or empty if there is
     * none. Variables are fixed in order, preferring false, by restricting the conjunction of all
     * clauses with one literal at a time.
     */
    public Optional<boolean[]> solve() {
        start();
        D acc = mgr.top();
        for (int i = 0; i < problem.nClauses() && !acc.equals(mgr.bot()); ++i) acc = conjoin(acc, i);
        if (acc.equals(mgr.bot())) {
            stopwatch.stop();
            log.info("UNSAT in %s (%s)", stopwatch, stats);
            return Optional.empty();
        }
        final boolean[] solution = new boolean[problem.nVariables()];
        for (int x = 0; x < solution.length; ++x) {
            final D f = acc;
            final D literal = mgr.nithvar(x);
            final D negative = stats.timeApply(() -> mgr.and(f, literal));
            if (negative.equals(mgr.bot())) {
                solution[x] = true;
                final D positive = mgr.ithvar(x);
                acc = stats.timeApply(() -> mgr.and(f, positive));
            } else {
                acc = negative;
            }
        }
        stopwatch.stop();
        log.info("SAT in %s (%s)", stopwatch, stats);
        return Optional.of(solution);
    }

    private D conjoin(D acc, int i) {
        final List<Integer> literals = problem.getClause(i);
        final D c = DiagramPredicates.clause(mgr, literals.stream().mapToInt(Integer::intValue).toArray());
        return stats.timeApply(() -> mgr.and(acc, c));
    }

    private void start() {
        stopwatch.reset().start();
        lastLogTime = Instant.now();
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();
        if (Duration.between(lastLogTime, now).compareTo(logInterval) < 0) return;
        log.info(() -> new FormattedMessage("%s %s %s", mgr.name(), stopwatch, s.get()));
        lastLogTime = now;
    }
}
