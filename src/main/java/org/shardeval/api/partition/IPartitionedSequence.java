package org.shardeval.api.partition;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A sequence split into disjoint, contiguous partitions, each co-located with one worker.
 * <p>
 * Implementations hand out a partition's slice only where that partition lives. Callers
 * that need the rows of a partition must ship their computation to the owning worker
 * (see {@link org.shardeval.api.dispatch.ITaskDispatcher}) and call {@link #fetch(PartitionHandle)}
 * from there.
 *
 * @param <S> slice type, e.g. {@code int[]} for labels or {@code double[]} for weights.
 */
public interface IPartitionedSequence<S> {

    /**
     * Returns the partitions of this sequence in row order.
     *
     * @return an immutable list of partition handles.
     */
    List<PartitionHandle> getPartitions();

    /**
     * Fetches the in-place slice of one partition.
     * <p>
     * The returned slice must be treated as read-only.
     *
     * @param partition a handle obtained from {@link #getPartitions()}.
     * @return the partition's rows.
     * @throws IllegalArgumentException if the handle does not belong to this sequence.
     * @throws IllegalStateException    if called away from the partition's owning worker.
     */
    S fetch(PartitionHandle partition);

    /**
     * Returns the total number of rows across all partitions.
     *
     * @return the row count.
     */
    default long getTotalLength() {
        long total = 0;
        for (PartitionHandle partition : getPartitions()) {
            total += partition.length();
        }
        return total;
    }

    /**
     * Returns a view that applies {@code mapper} to each slice when it is fetched.
     * <p>
     * The mapping runs lazily, wherever {@link #fetch(PartitionHandle)} is called on the view,
     * so placement and partition boundaries are inherited unchanged. The mapper must preserve
     * the slice length.
     *
     * @param mapper slice transformation.
     * @param <T>    mapped slice type.
     * @return the mapped view.
     */
    default <T> IPartitionedSequence<T> map(Function<? super S, ? extends T> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        IPartitionedSequence<S> source = this;
        return new IPartitionedSequence<>() {
            @Override
            public List<PartitionHandle> getPartitions() {
                return source.getPartitions();
            }

            @Override
            public T fetch(PartitionHandle partition) {
                return mapper.apply(source.fetch(partition));
            }
        };
    }
}
