// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench;

import com.google.common.base.Stopwatch;
import gnu.trove.list.array.TLongArrayList;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Counters accumulated while a workload runs: time spent combining diagrams and time spent
 * quantifying, how often each happened, and the diagram sizes that were observed along the way.
 * The caller owns an instance and hands it to the workload; nothing here affects results.
 */
public class DiagramStatistics {
    private final Stopwatch apply = Stopwatch.createUnstarted();
    private final Stopwatch exists = Stopwatch.createUnstarted();
    private long applyCount;
    private long existsCount;
    private long largest;
    private final List<String> labels = new ArrayList<>();
    private final TLongArrayList sizes = new TLongArrayList();
    private final boolean trackSizes;

    public DiagramStatistics() { this(false); }

    /**
     * @param trackSizes whether workloads should measure intermediate diagrams even when debug
     *                   logging is off (measuring costs a traversal of the diagram)
     */
    public DiagramStatistics(boolean trackSizes) { this.trackSizes = trackSizes; }

    public boolean tracksSizes() { return trackSizes; }

    public <T> T timeApply(Supplier<T> op) {
        ++applyCount;
        return timed(apply, op);
    }

    public <T> T timeExists(Supplier<T> op) {
        ++existsCount;
        return timed(exists, op);
    }

    private static <T> T timed(Stopwatch sw, Supplier<T> op) {
        // Nested timing of the same kind is counted once.
        if (sw.isRunning()) return op.get();
        sw.start();
        try {
            return op.get();
        } finally {
            sw.stop();
        }
    }

    /** Record the size of an intermediate diagram under a short label, like "Acc [1-2]". */
    public void observe(String label, long nodecount) {
        labels.add(label);
        sizes.add(nodecount);
        if (nodecount > largest) largest = nodecount;
    }

    public Duration applyTime() { return apply.elapsed(); }
    public Duration existsTime() { return exists.elapsed(); }
    public long applyCount() { return applyCount; }
    public long existsCount() { return existsCount; }
    public long largestSize() { return largest; }

    public List<String> labels() { return Collections.unmodifiableList(labels); }
    public long[] sizes() { return sizes.toArray(); }

    @Override
    public String toString() {
        return String.format("apply %d calls %d ms, exists %d calls %d ms, largest %d nodes",
                applyCount, apply.elapsed().toMillis(), existsCount, exists.elapsed().toMillis(), largest);
    }
}
