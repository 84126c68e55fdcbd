package org.shardeval.metrics;

import java.util.Arrays;

/**
 * Per-class true-positive and false-positive counts, an {@code nclasses x 2} table.
 * <p>
 * A table produced on one partition is a partial statistic; summing the tables of all
 * partitions with {@link #add(TpFpTable)} yields the global table. Summation is commutative
 * and associative, so partials may be added in any order.
 * <p>
 * Not thread-safe. Partials are created on workers and only accumulated on the coordinator.
 */
public final class TpFpTable {

    private final long[] truePositives;
    private final long[] falsePositives;

    private TpFpTable(int nclasses) {
        if (nclasses < 1) {
            throw new IllegalArgumentException("nclasses must be >= 1, got " + nclasses);
        }
        this.truePositives = new long[nclasses];
        this.falsePositives = new long[nclasses];
    }

    /**
     * Creates an all-zero table.
     *
     * @param nclasses number of classes.
     * @return the empty table.
     */
    public static TpFpTable zeros(int nclasses) {
        return new TpFpTable(nclasses);
    }

    public int getClassCount() {
        return truePositives.length;
    }

    public long getTruePositives(int classIndex) {
        return truePositives[classIndex];
    }

    public long getFalsePositives(int classIndex) {
        return falsePositives[classIndex];
    }

    /**
     * Returns the number of rows predicted as the given class.
     *
     * @param classIndex class index.
     * @return TP + FP of that class.
     */
    public long getPredicted(int classIndex) {
        return truePositives[classIndex] + falsePositives[classIndex];
    }

    public long getTotalTruePositives() {
        return Arrays.stream(truePositives).sum();
    }

    public long getTotalFalsePositives() {
        return Arrays.stream(falsePositives).sum();
    }

    /**
     * Sets one class row.
     *
     * @param classIndex     class index.
     * @param truePositives  TP count.
     * @param falsePositives FP count.
     */
    void set(int classIndex, long truePositives, long falsePositives) {
        this.truePositives[classIndex] = truePositives;
        this.falsePositives[classIndex] = falsePositives;
    }

    /**
     * Adds another table element-wise into this one.
     *
     * @param other table of the same shape.
     * @return this table.
     * @throws IllegalArgumentException if the shapes differ.
     */
    public TpFpTable add(TpFpTable other) {
        if (other.getClassCount() != getClassCount()) {
            throw new IllegalArgumentException(String.format(
                "Cannot add a %d-class TP/FP table to a %d-class table", other.getClassCount(), getClassCount()));
        }
        for (int c = 0; c < truePositives.length; c++) {
            truePositives[c] += other.truePositives[c];
            falsePositives[c] += other.falsePositives[c];
        }
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TpFpTable[");
        for (int c = 0; c < truePositives.length; c++) {
            if (c > 0) sb.append(", ");
            sb.append(c).append(": tp=").append(truePositives[c]).append(" fp=").append(falsePositives[c]);
        }
        return sb.append(']').toString();
    }
}
