package org.shardeval.metrics;

import java.util.List;
import java.util.Objects;

import org.shardeval.api.partition.IPartitionedSequence;
import org.shardeval.api.partition.PartitionHandle;

/**
 * True labels, predicted labels and optional weights that share one partition layout.
 * <p>
 * Construction checks the layout metadata only: same number of partitions, same row range
 * and same owning worker per partition, same total length. The rows themselves are never
 * inspected here; that row {@code k} of each sequence describes the same record is the
 * caller's responsibility.
 */
final class AlignedLabels {

    private final IPartitionedSequence<int[]> yTrue;
    private final IPartitionedSequence<int[]> yPred;
    private final IPartitionedSequence<double[]> weights;

    private AlignedLabels(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred,
                          IPartitionedSequence<double[]> weights) {
        this.yTrue = yTrue;
        this.yPred = yPred;
        this.weights = weights;
    }

    static AlignedLabels of(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred) {
        return of(yTrue, yPred, null);
    }

    /**
     * Pairs the sequences after checking their layouts.
     *
     * @param yTrue   true labels.
     * @param yPred   predicted labels.
     * @param weights per-row weights, or {@code null}.
     * @return the aligned triple.
     * @throws MetricsException {@link ErrorKind#PARTITION_MISMATCH} if the layouts disagree.
     */
    static AlignedLabels of(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred,
                            IPartitionedSequence<double[]> weights) {
        Objects.requireNonNull(yTrue, "yTrue");
        Objects.requireNonNull(yPred, "yPred");
        checkAligned("y_pred", yTrue, yPred);
        if (weights != null) {
            checkAligned("sample weights", yTrue, weights);
        }
        return new AlignedLabels(yTrue, yPred, weights);
    }

    IPartitionedSequence<int[]> yTrue() {
        return yTrue;
    }

    IPartitionedSequence<int[]> yPred() {
        return yPred;
    }

    boolean hasWeights() {
        return weights != null;
    }

    List<PartitionHandle> partitions() {
        return yTrue.getPartitions();
    }

    long totalLength() {
        return yTrue.getTotalLength();
    }

    int[] trueSlice(PartitionHandle partition) {
        return yTrue.fetch(partition);
    }

    int[] predSlice(PartitionHandle partition) {
        return yPred.fetch(yPred.getPartitions().get(partition.index()));
    }

    double[] weightSlice(PartitionHandle partition) {
        return weights == null ? null : weights.fetch(weights.getPartitions().get(partition.index()));
    }

    private static void checkAligned(String name, IPartitionedSequence<int[]> reference, IPartitionedSequence<?> other) {
        long expectedTotal = reference.getTotalLength();
        long actualTotal = other.getTotalLength();
        if (expectedTotal != actualTotal) {
            throw new MetricsException(ErrorKind.PARTITION_MISMATCH, String.format(
                "y_true has %d rows but %s has %d", expectedTotal, name, actualTotal));
        }
        List<PartitionHandle> expected = reference.getPartitions();
        List<PartitionHandle> actual = other.getPartitions();
        if (expected.size() != actual.size()) {
            throw new MetricsException(ErrorKind.PARTITION_MISMATCH, String.format(
                "y_true has %d partitions but %s has %d", expected.size(), name, actual.size()));
        }
        for (int i = 0; i < expected.size(); i++) {
            PartitionHandle e = expected.get(i);
            PartitionHandle a = actual.get(i);
            if (e.offset() != a.offset() || e.length() != a.length() || !e.worker().equals(a.worker())) {
                throw new MetricsException(ErrorKind.PARTITION_MISMATCH, String.format(
                    "Partition %d of %s (rows %d..%d on '%s') is not aligned with y_true (rows %d..%d on '%s')",
                    i, name, a.offset(), a.endOffset(), a.worker(), e.offset(), e.endOffset(), e.worker()));
            }
        }
    }
}
