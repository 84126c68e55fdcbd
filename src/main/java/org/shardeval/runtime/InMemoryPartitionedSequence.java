package org.shardeval.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

import org.shardeval.api.partition.IPartitionedSequence;
import org.shardeval.api.partition.PartitionHandle;

/**
 * A partitioned sequence whose partitions live in memory, each placed on a worker of a
 * {@link LocalWorkerPool}.
 * <p>
 * Partitions are assigned to workers round-robin in partition order. {@link #fetch} only
 * succeeds on the thread of the owning worker, which keeps every computation over a partition
 * on the worker that holds it.
 *
 * @param <S> slice type ({@code int[]} or {@code double[]}).
 */
public final class InMemoryPartitionedSequence<S> implements IPartitionedSequence<S> {

    private final List<PartitionHandle> partitions;
    private final List<S> slices;

    private InMemoryPartitionedSequence(List<PartitionHandle> partitions, List<S> slices) {
        this.partitions = List.copyOf(partitions);
        this.slices = List.copyOf(slices);
    }

    /**
     * Splits labels into partitions of the given lengths.
     *
     * @param values           all labels in row order; copied.
     * @param partitionLengths rows per partition, summing to {@code values.length}.
     * @param workers          worker names to place partitions on, round-robin.
     * @return the partitioned labels.
     */
    public static InMemoryPartitionedSequence<int[]> ofLabels(int[] values, int[] partitionLengths, List<String> workers) {
        return split(values.length, partitionLengths, workers, (from, to) -> Arrays.copyOfRange(values, from, to));
    }

    /**
     * Splits labels into {@code partitionCount} partitions of near-equal length.
     *
     * @param values         all labels in row order; copied.
     * @param partitionCount number of partitions, at least 1.
     * @param workers        worker names to place partitions on, round-robin.
     * @return the partitioned labels.
     */
    public static InMemoryPartitionedSequence<int[]> ofLabels(int[] values, int partitionCount, List<String> workers) {
        return ofLabels(values, evenLengths(values.length, partitionCount), workers);
    }

    /**
     * Splits sample weights into partitions of the given lengths.
     *
     * @param values           all weights in row order; copied.
     * @param partitionLengths rows per partition, summing to {@code values.length}.
     * @param workers          worker names to place partitions on, round-robin.
     * @return the partitioned weights.
     */
    public static InMemoryPartitionedSequence<double[]> ofWeights(double[] values, int[] partitionLengths, List<String> workers) {
        return split(values.length, partitionLengths, workers, (from, to) -> Arrays.copyOfRange(values, from, to));
    }

    public static InMemoryPartitionedSequence<double[]> ofWeights(double[] values, int partitionCount, List<String> workers) {
        return ofWeights(values, evenLengths(values.length, partitionCount), workers);
    }

    /**
     * Computes near-equal partition lengths; the first {@code total % partitionCount}
     * partitions get one extra row.
     *
     * @param total          total rows.
     * @param partitionCount number of partitions, at least 1.
     * @return the lengths.
     */
    public static int[] evenLengths(int total, int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("Partition count must be >= 1, got " + partitionCount);
        }
        int[] lengths = new int[partitionCount];
        int base = total / partitionCount;
        int remainder = total % partitionCount;
        for (int i = 0; i < partitionCount; i++) {
            lengths[i] = base + (i < remainder ? 1 : 0);
        }
        return lengths;
    }

    @Override
    public List<PartitionHandle> getPartitions() {
        return partitions;
    }

    @Override
    public S fetch(PartitionHandle partition) {
        Objects.requireNonNull(partition, "partition");
        int index = partition.index();
        if (index >= partitions.size() || !partitions.get(index).equals(partition)) {
            throw new IllegalArgumentException("Partition " + partition + " does not belong to this sequence");
        }
        String current = LocalWorkerPool.currentWorker();
        if (!partition.worker().equals(current)) {
            throw new IllegalStateException(String.format(
                "Partition %d lives on worker '%s' and cannot be read from %s",
                index, partition.worker(), current == null ? "thread '" + Thread.currentThread().getName() + "'" : "worker '" + current + "'"));
        }
        return slices.get(index);
    }

    private static <S> InMemoryPartitionedSequence<S> split(int total, int[] partitionLengths, List<String> workers,
                                                           BiFunction<Integer, Integer, S> slicer) {
        if (workers.isEmpty()) {
            throw new IllegalArgumentException("At least one worker is required");
        }
        if (partitionLengths.length == 0) {
            throw new IllegalArgumentException("At least one partition is required");
        }
        long sum = 0;
        for (int length : partitionLengths) {
            if (length < 0) {
                throw new IllegalArgumentException("Partition lengths must be >= 0: " + Arrays.toString(partitionLengths));
            }
            sum += length;
        }
        if (sum != total) {
            throw new IllegalArgumentException(String.format(
                "Partition lengths sum to %d but the sequence has %d rows", sum, total));
        }

        List<PartitionHandle> handles = new ArrayList<>(partitionLengths.length);
        List<S> slices = new ArrayList<>(partitionLengths.length);
        int offset = 0;
        for (int i = 0; i < partitionLengths.length; i++) {
            int length = partitionLengths[i];
            handles.add(new PartitionHandle(i, offset, length, workers.get(i % workers.size())));
            slices.add(slicer.apply(offset, offset + length));
            offset += length;
        }
        return new InMemoryPartitionedSequence<>(handles, slices);
    }
}
