package org.shardeval.metrics;

import java.util.Objects;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Partition-local statistics.
 * <p>
 * Every method is a pure function of one partition's slices: no shared state, no I/O. The
 * results are partial statistics meant to be summed on the coordinator by
 * {@link GlobalReducer}.
 */
public final class LocalStatComputer {

    private LocalStatComputer() {
    }

    /**
     * Collects the distinct labels of one partition.
     *
     * @param labels the partition's labels.
     * @return the distinct labels, unordered.
     */
    public static IntOpenHashSet distinctLabels(int[] labels) {
        IntOpenHashSet distinct = new IntOpenHashSet();
        for (int label : labels) {
            distinct.add(label);
        }
        return distinct;
    }

    /**
     * Counts rows whose prediction equals the true label.
     *
     * @param yTrue true labels of the partition.
     * @param yPred predicted labels of the partition.
     * @return number of correct predictions.
     * @throws IllegalArgumentException if the slices differ in length.
     */
    public static long countCorrect(int[] yTrue, int[] yPred) {
        requireSameLength(yTrue, yPred);
        long correct = 0;
        for (int i = 0; i < yTrue.length; i++) {
            if (yTrue[i] == yPred[i]) {
                correct++;
            }
        }
        return correct;
    }

    /**
     * Computes the per-class true/false-positive table of one partition.
     * <p>
     * For each class, only rows predicted as that class matter: those whose true label matches
     * are true positives, the rest false positives. A class nobody predicted gets an all-zero
     * row. Predictions outside the label space belong to no class and are ignored.
     *
     * @param yTrue      true labels of the partition.
     * @param yPred      predicted labels of the partition.
     * @param labelSpace the resolved label space.
     * @return the partial table.
     * @throws IllegalArgumentException if the slices differ in length.
     */
    public static TpFpTable sumTpFp(int[] yTrue, int[] yPred, LabelSpace labelSpace) {
        requireSameLength(yTrue, yPred);
        int nclasses = labelSpace.size();
        long[] predicted = new long[nclasses];
        long[] hits = new long[nclasses];
        for (int i = 0; i < yPred.length; i++) {
            int c = labelSpace.indexOf(yPred[i]);
            if (c < 0) {
                continue;
            }
            predicted[c]++;
            if (yTrue[i] == yPred[i]) {
                hits[c]++;
            }
        }

        TpFpTable table = TpFpTable.zeros(nclasses);
        for (int c = 0; c < nclasses; c++) {
            if (predicted[c] == 0) {
                // empty prediction bucket: row stays zero
                continue;
            }
            table.set(c, hits[c], predicted[c] - hits[c]);
        }
        return table;
    }

    /**
     * Computes the confusion-matrix contribution of one partition.
     * <p>
     * Rows whose true or predicted label is outside the label space are dropped. Without
     * weights every row counts 1. NaN cells are coerced to zero.
     *
     * @param yTrue      true labels of the partition.
     * @param yPred      predicted labels of the partition.
     * @param weights    per-row weights, or {@code null} for uniform weight 1.
     * @param labelSpace the resolved label space.
     * @return the partial matrix.
     * @throws IllegalArgumentException if the slices differ in length.
     */
    public static ConfusionMatrix localConfusion(int[] yTrue, int[] yPred, double[] weights, LabelSpace labelSpace) {
        requireSameLength(yTrue, yPred);
        if (weights != null && weights.length != yTrue.length) {
            throw new IllegalArgumentException(String.format(
                "Weight slice has %d rows but label slice has %d", weights.length, yTrue.length));
        }
        ConfusionMatrix matrix = ConfusionMatrix.zeros(labelSpace);
        for (int i = 0; i < yTrue.length; i++) {
            int t = labelSpace.indexOf(yTrue[i]);
            int p = labelSpace.indexOf(yPred[i]);
            if (t < 0 || p < 0) {
                continue;
            }
            matrix.accumulate(t, p, weights == null ? 1.0 : weights[i]);
        }
        return matrix.coerceNaNToZero();
    }

    private static void requireSameLength(int[] yTrue, int[] yPred) {
        Objects.requireNonNull(yTrue, "yTrue");
        Objects.requireNonNull(yPred, "yPred");
        if (yTrue.length != yPred.length) {
            throw new IllegalArgumentException(String.format(
                "Aligned slices differ in length: y_true has %d rows, y_pred has %d", yTrue.length, yPred.length));
        }
    }
}
