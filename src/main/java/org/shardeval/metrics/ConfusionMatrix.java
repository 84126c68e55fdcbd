package org.shardeval.metrics;

import java.util.Arrays;
import java.util.Objects;

/**
 * An {@code nclasses x nclasses} matrix of (weighted) counts over a {@link LabelSpace}.
 * <p>
 * Cell {@code (t, p)} holds the weight of rows whose true label has class index {@code t}
 * and whose predicted label has class index {@code p}. The same type serves as a partition's
 * partial statistic, as the summed global statistic and, after normalization, as the final
 * result.
 * <p>
 * Mutation ({@link #add}, {@link #accumulate}) is only meant for the thread that owns the
 * instance: a worker building its partial, or the coordinator summing partials.
 */
public final class ConfusionMatrix {

    private final LabelSpace labelSpace;
    private final double[][] cells;

    private ConfusionMatrix(LabelSpace labelSpace, double[][] cells) {
        this.labelSpace = labelSpace;
        this.cells = cells;
    }

    /**
     * Creates an all-zero matrix.
     *
     * @param labelSpace the labels indexing rows and columns.
     * @return the matrix.
     */
    public static ConfusionMatrix zeros(LabelSpace labelSpace) {
        Objects.requireNonNull(labelSpace, "labelSpace");
        int n = labelSpace.size();
        return new ConfusionMatrix(labelSpace, new double[n][n]);
    }

    public LabelSpace getLabelSpace() {
        return labelSpace;
    }

    public int size() {
        return cells.length;
    }

    /**
     * Returns one cell.
     *
     * @param trueIndex      class index of the true label.
     * @param predictedIndex class index of the predicted label.
     * @return the cell value.
     */
    public double get(int trueIndex, int predictedIndex) {
        return cells[trueIndex][predictedIndex];
    }

    /**
     * Adds {@code weight} to one cell.
     *
     * @param trueIndex      class index of the true label.
     * @param predictedIndex class index of the predicted label.
     * @param weight         weight to add.
     */
    void accumulate(int trueIndex, int predictedIndex, double weight) {
        cells[trueIndex][predictedIndex] += weight;
    }

    /**
     * Adds another matrix element-wise into this one.
     *
     * @param other matrix over the same label space.
     * @return this matrix.
     * @throws IllegalArgumentException if the label spaces differ.
     */
    public ConfusionMatrix add(ConfusionMatrix other) {
        if (!labelSpace.equals(other.labelSpace)) {
            throw new IllegalArgumentException(
                "Cannot add confusion matrices over different label spaces: " + labelSpace + " vs " + other.labelSpace);
        }
        for (int t = 0; t < cells.length; t++) {
            for (int p = 0; p < cells.length; p++) {
                cells[t][p] += other.cells[t][p];
            }
        }
        return this;
    }

    /**
     * Replaces every NaN cell with zero.
     *
     * @return this matrix.
     */
    ConfusionMatrix coerceNaNToZero() {
        for (double[] row : cells) {
            for (int p = 0; p < row.length; p++) {
                if (Double.isNaN(row[p])) {
                    row[p] = 0.0;
                }
            }
        }
        return this;
    }

    public double rowSum(int trueIndex) {
        double sum = 0.0;
        for (double v : cells[trueIndex]) {
            sum += v;
        }
        return sum;
    }

    public double columnSum(int predictedIndex) {
        double sum = 0.0;
        for (double[] row : cells) {
            sum += row[predictedIndex];
        }
        return sum;
    }

    /**
     * Returns the sum of all cells.
     *
     * @return the grand total.
     */
    public double total() {
        double sum = 0.0;
        for (int t = 0; t < cells.length; t++) {
            sum += rowSum(t);
        }
        return sum;
    }

    /**
     * Returns a normalized copy. A cell whose divisor is zero becomes zero.
     *
     * @param mode the normalization.
     * @return a new matrix; this one is unchanged.
     */
    public ConfusionMatrix normalized(NormalizeMode mode) {
        int n = cells.length;
        double[][] out = new double[n][n];
        double total = mode == NormalizeMode.ALL ? total() : 0.0;
        double[] columnSums = new double[n];
        if (mode == NormalizeMode.PRED) {
            for (int p = 0; p < n; p++) {
                columnSums[p] = columnSum(p);
            }
        }
        for (int t = 0; t < n; t++) {
            double rowSum = mode == NormalizeMode.TRUE ? rowSum(t) : 0.0;
            for (int p = 0; p < n; p++) {
                double divisor = switch (mode) {
                    case NONE -> 1.0;
                    case TRUE -> rowSum;
                    case PRED -> columnSums[p];
                    case ALL -> total;
                };
                out[t][p] = safeDivide(cells[t][p], divisor);
            }
        }
        return new ConfusionMatrix(labelSpace, out);
    }

    /**
     * Returns a copy of the cells, indexed {@code [true][predicted]}.
     *
     * @return the cells.
     */
    public double[][] toArray() {
        double[][] copy = new double[cells.length][];
        for (int t = 0; t < cells.length; t++) {
            copy[t] = cells[t].clone();
        }
        return copy;
    }

    private static double safeDivide(double numerator, double divisor) {
        if (divisor == 0.0) {
            return 0.0;
        }
        double value = numerator / divisor;
        return Double.isFinite(value) ? value : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfusionMatrix other)) return false;
        return labelSpace.equals(other.labelSpace) && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * labelSpace.hashCode() + Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return "ConfusionMatrix" + Arrays.deepToString(cells);
    }
}
