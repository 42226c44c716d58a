// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

/**
 * When the pre rows are quantified away while the transition relation is accumulated. The
 * image, and so the number of unreachable states, is the same for all of them; only the sizes of
 * the intermediate diagrams differ.
 */
public enum QuantificationSchedule {
    /** Quantify every pre row as soon as no further post row of its half depends on it. */
    EAGER,
    /** Quantify early only the outermost pre row at the top and the two outermost at the bottom. */
    BORDER,
    /** Quantify all pre rows at the very end. */
    DEFERRED,
}
