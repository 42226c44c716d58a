// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.workload;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.StreamSupport;

/**
 * A formula in conjunctive normal form over the variables 1..nVariables. Literals are written
 * as in DIMACS files: v for variable v, -v for its negation.
 */
public class Cnf {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();
    private final int nVariables;
    private final List<List<Integer>> clauses = new ArrayList<>();

    public Cnf(int nVariables) {
        if (nVariables < 1) throw new IllegalArgumentException("Must have at least one variable");
        this.nVariables = nVariables;
    }

    public int nVariables() { return nVariables; }
    public int nClauses() { return clauses.size(); }
    public List<Integer> getClause(int i) { return clauses.get(i); }
    public List<List<Integer>> clauses() { return Collections.unmodifiableList(clauses); }

    public Cnf addClause(Iterable<Integer> literals) {
        List<Integer> clause = ImmutableList.copyOf(literals);
        if (clause.isEmpty()) throw new IllegalArgumentException("Empty clause");
        for (int l : clause) {
            if (l == 0 || l > nVariables || l < -nVariables) throw new IllegalArgumentException("literal out of declared bounds: " + l);
        }
        clauses.add(clause);
        return this;
    }

    public Cnf addClause(int... literals) {
        return addClause(Ints.asList(literals));
    }

    /**
     * Evaluate the boolean function represented by the clauses at the specified point
     * @param p value of variable v at p[v-1]
     * @return the truth value of this formula at p
     */
    public boolean evaluate(boolean[] p) {
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (p[Math.abs(literal) - 1] == literal > 0) continue CLAUSE;
            }
            return false;
        }
        return true;
    }

    public static Cnf parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    public static Cnf parseFrom(Reader r) {
        List<Integer> literals = new ArrayList<>();
        Iterator<String> ls = new BufferedReader(r).lines().filter(s -> !s.startsWith("c")).iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing CNF data");
        Matcher m = pLineRe.matcher(ls.next());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nClause = Integer.parseInt(m.group(2));
        Cnf p = new Cnf(nVar);
        ls.forEachRemaining(line -> StreamSupport.stream(splitter.split(line).spliterator(), false)
                .mapToInt(Integer::parseInt)
                .forEach(l -> {
                    if (l == 0) {
                        p.addClause(literals);
                        literals.clear();
                    } else {
                        literals.add(l);
                    }
                }));
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (p.nClauses() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return p;
    }

    // At most one of the given variables is true: one clause per pair.
    private void atMostOne(List<Integer> vars) {
        for (int i = 0; i < vars.size(); ++i) {
            for (int j = i + 1; j < vars.size(); ++j) addClause(-vars.get(i), -vars.get(j));
        }
    }

    /**
     * n queens on an n x n board, none attacking another. Variable i*n+j+1 is the square in row
     * i, column j. The satisfying assignments are exactly the solutions of the puzzle.
     */
    public static Cnf queens(int n) {
        if (n < 1) throw new IllegalArgumentException("n must be positive");
        Cnf p = new Cnf(n * n);
        for (int i = 0; i < n; ++i) {
            List<Integer> row = new ArrayList<>();
            for (int j = 0; j < n; ++j) row.add(i * n + j + 1);
            p.addClause(row);
            p.atMostOne(row);
        }
        for (int j = 0; j < n; ++j) {
            List<Integer> col = new ArrayList<>();
            for (int i = 0; i < n; ++i) col.add(i * n + j + 1);
            p.atMostOne(col);
        }
        // Diagonals are indexed by i-j (down-right) and i+j (down-left).
        for (int d = -(n - 1); d <= n - 1; ++d) {
            List<Integer> down = new ArrayList<>(), up = new ArrayList<>();
            for (int i = 0; i < n; ++i) {
                int j = i - d;
                if (j >= 0 && j < n) down.add(i * n + j + 1);
                j = d + n - 1 - i;
                if (j >= 0 && j < n) up.add(i * n + j + 1);
            }
            p.atMostOne(down);
            p.atMostOne(up);
        }
        return p;
    }

    /**
     * n+1 pigeons in n holes, every pigeon in some hole, no two in the same one. Variable
     * p*n+h+1 puts pigeon p in hole h. Unsatisfiable for every n.
     */
    public static Cnf pigeonhole(int n) {
        if (n < 1) throw new IllegalArgumentException("n must be positive");
        Cnf p = new Cnf((n + 1) * n);
        for (int pigeon = 0; pigeon <= n; ++pigeon) {
            List<Integer> somewhere = new ArrayList<>();
            for (int h = 0; h < n; ++h) somewhere.add(pigeon * n + h + 1);
            p.addClause(somewhere);
        }
        for (int h = 0; h < n; ++h) {
            List<Integer> hole = new ArrayList<>();
            for (int pigeon = 0; pigeon <= n; ++pigeon) hole.add(pigeon * n + h + 1);
            p.atMostOne(hole);
        }
        return p;
    }
}
