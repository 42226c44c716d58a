// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An explicit Life board of r x c cells. Cells outside the board count as dead. This is the
 * state-by-state counterpart of the symbolic {@link GardenOfEden}, and the way to name a single
 * post state when asking whether it is reachable.
 */
public class Life {
    private final static Splitter splitter = Splitter.onPattern("\\s").omitEmptyStrings().trimResults();
    private final static CharMatcher dot = CharMatcher.anyOf(".·");
    final int r;
    final int c;
    final boolean[][] x;

    public Life(int r, int c) {
        checkArgument(r >= 1 && c >= 1, "empty board");
        this.r = r;
        this.c = c;
        x = new boolean[r][];
        for (int i = 0; i < r; ++i) x[i] = new boolean[c];
    }

    /** A board given row by row, rows separated by white space; '.' (or '·') is a dead cell. */
    public static Life fromDots(String s) {
        List<String> rows = splitter.splitToList(s);
        if (rows.isEmpty()) throw new IllegalArgumentException("bad board");
        int r = rows.size();
        int c = rows.get(0).length();
        for (int i = 1; i < r; ++i) {
            if (rows.get(i).length() != c) throw new IllegalArgumentException("ragged board");
        }
        Life l = new Life(r, c);
        for (int i = 0; i < r; ++i) {
            for (int j = 0; j < c; ++j) {
                l.x[i][j] = !dot.matches(rows.get(i).charAt(j));
            }
        }
        return l;
    }

    /** The board whose cell (i, j) is bit i*c+j of bits. */
    public static Life fromBits(int r, int c, long bits) {
        checkArgument(r * c <= Long.SIZE, "%sx%s board does not fit in a long", r, c);
        Life l = new Life(r, c);
        for (int i = 0; i < r; ++i) {
            for (int j = 0; j < c; ++j) l.x[i][j] = (bits >>> (i * c + j) & 1) != 0;
        }
        return l;
    }

    public int rows() { return r; }
    public int cols() { return c; }
    public boolean alive(int i, int j) { return x[i][j]; }

    private int nu(int i, int j) {
        int n = 0;
        for (int dx = -1; dx <= 1; ++dx) {
            for (int dy = -1; dy <= 1; ++dy) {
                if (dx != 0 || dy != 0) {
                    int R = i + dx, C = j + dy;
                    if (R >= 0 && R < r && C >= 0 && C < c && x[R][C]) ++n;
                }
            }
        }
        return n;
    }

    public Life step() {
        Life y = new Life(r, c);
        for (int i = 0; i < r; ++i) {
            for (int j = 0; j < c; ++j) {
                int n = nu(i, j);
                // live: 2 or 3, dead 3.
                y.x[i][j] = x[i][j] ? (n == 2 || n == 3) : n == 3;
            }
        }
        return y;
    }

    /** The board without its outermost rows and columns. */
    public Life interior() {
        checkArgument(r > 2 && c > 2, "%sx%s board has no interior", r, c);
        Life y = new Life(r - 2, c - 2);
        for (int i = 1; i < r - 1; ++i) System.arraycopy(x[i], 1, y.x[i - 1], 0, c - 2);
        return y;
    }

    /** Whether the board reads the same from the right as from the left. */
    public boolean isMirrorSymmetric() {
        for (int i = 0; i < r; ++i) {
            for (int j = 0; j < c / 2; ++j) if (x[i][j] != x[i][c - 1 - j]) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Life life = (Life) o;
        return r == life.r && c == life.c && Arrays.deepEquals(x, life.x);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(r, c);
        result = 31 * result + Arrays.deepHashCode(x);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < r; ++i) {
            for (int j = 0; j < c; ++j) sb.append(x[i][j] ? '*' : '·');
            sb.append('\n');
        }
        return sb.toString();
    }
}
