package org.shardeval.metrics;

import java.util.List;
import java.util.Objects;

/**
 * Coordinator-side reduction of partial statistics into global metrics.
 * <p>
 * All methods run single-threaded on the coordinator after a round has returned. Partials
 * are combined by element-wise summation, then the requested metric is derived from the
 * global statistic. A zero divisor yields 0, never NaN or infinity.
 */
public final class GlobalReducer {

    private GlobalReducer() {
    }

    /**
     * Computes accuracy from per-partition correct counts.
     *
     * @param correctCounts correct predictions per partition.
     * @param totalRows     total rows across all partitions.
     * @return correct / total.
     * @throws MetricsException {@link ErrorKind#EMPTY_INPUT} if {@code totalRows} is zero.
     */
    public static double accuracy(List<Long> correctCounts, long totalRows) {
        if (totalRows == 0) {
            throw new MetricsException(ErrorKind.EMPTY_INPUT, "Accuracy is undefined for zero rows");
        }
        long correct = 0;
        for (Long count : correctCounts) {
            correct += count;
        }
        return (double) correct / totalRows;
    }

    /**
     * Sums partial TP/FP tables.
     *
     * @param partials per-partition tables.
     * @param nclasses number of classes.
     * @return the global table.
     */
    public static TpFpTable sumTpFp(List<TpFpTable> partials, int nclasses) {
        TpFpTable global = TpFpTable.zeros(nclasses);
        for (TpFpTable partial : partials) {
            global.add(partial);
        }
        return global;
    }

    /**
     * Checks that precision with the given averaging is defined for {@code nclasses}.
     *
     * @param nclasses number of classes in the label space.
     * @param mode     averaging mode.
     * @throws MetricsException {@link ErrorKind#INVALID_AVERAGING_MODE} for binary averaging over
     *                          more than two classes, {@link ErrorKind#DEGENERATE_LABEL_SPACE} for
     *                          fewer than two classes.
     */
    public static void checkPrecisionDefined(int nclasses, AveragingMode mode) {
        Objects.requireNonNull(mode, "mode");
        if (mode == AveragingMode.BINARY && nclasses > 2) {
            throw new MetricsException(ErrorKind.INVALID_AVERAGING_MODE, String.format(
                "Binary precision is undefined for more than two classes (got %d); use macro or micro", nclasses));
        }
        if (nclasses < 2) {
            throw new MetricsException(ErrorKind.DEGENERATE_LABEL_SPACE,
                "Single-class precision is undefined (label space has " + nclasses + " class)");
        }
    }

    /**
     * Derives a precision score from the global TP/FP table.
     *
     * @param global summed table.
     * @param mode   averaging mode.
     * @return the precision.
     */
    public static double precision(TpFpTable global, AveragingMode mode) {
        checkPrecisionDefined(global.getClassCount(), mode);
        return switch (mode) {
            case BINARY -> classPrecision(global, global.getClassCount() - 1);
            case MACRO -> {
                double sum = 0.0;
                for (int c = 0; c < global.getClassCount(); c++) {
                    sum += classPrecision(global, c);
                }
                yield sum / global.getClassCount();
            }
            case MICRO -> ratio(global.getTotalTruePositives(),
                global.getTotalTruePositives() + global.getTotalFalsePositives());
        };
    }

    /**
     * Returns TP / (TP + FP) for every class, 0 for classes never predicted.
     *
     * @param global summed table.
     * @return per-class precision indexed by class index.
     */
    public static double[] perClassPrecision(TpFpTable global) {
        double[] precision = new double[global.getClassCount()];
        for (int c = 0; c < precision.length; c++) {
            precision[c] = classPrecision(global, c);
        }
        return precision;
    }

    /**
     * Sums partial confusion matrices and normalizes the result.
     *
     * @param partials   per-partition matrices.
     * @param labelSpace label space of every partial.
     * @param mode       normalization.
     * @return the global (normalized) matrix.
     */
    public static ConfusionMatrix confusionMatrix(List<ConfusionMatrix> partials, LabelSpace labelSpace,
                                                  NormalizeMode mode) {
        ConfusionMatrix global = ConfusionMatrix.zeros(labelSpace);
        for (ConfusionMatrix partial : partials) {
            global.add(partial);
        }
        global.coerceNaNToZero();
        return mode == NormalizeMode.NONE ? global : global.normalized(mode);
    }

    private static double classPrecision(TpFpTable table, int classIndex) {
        return ratio(table.getTruePositives(classIndex), table.getPredicted(classIndex));
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
