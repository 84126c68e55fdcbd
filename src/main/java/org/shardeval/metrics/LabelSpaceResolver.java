package org.shardeval.metrics;

import java.util.List;
import java.util.Objects;

import org.shardeval.api.partition.IPartitionedSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Discovers the label space of a partitioned label sequence in one scatter/gather round.
 * <p>
 * Each worker computes the distinct labels of its partition; the coordinator unions the
 * local sets and sorts the result. Because union is order-independent, the resolved space
 * does not depend on placement or completion order.
 */
public class LabelSpaceResolver {

    private static final Logger log = LoggerFactory.getLogger(LabelSpaceResolver.class);

    static final String ROUND_NAME = "label-space";

    private final ScatterGatherDriver driver;

    public LabelSpaceResolver(ScatterGatherDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver");
    }

    /**
     * Resolves the sorted set of distinct labels across all partitions.
     *
     * @param labels the partitioned labels, usually {@code y_true}.
     * @return the label space.
     * @throws MetricsException {@link ErrorKind#EMPTY_INPUT} if the sequence holds no rows,
     *                          {@link ErrorKind#WORKER_COMPUTATION_FAILED} if any partition fails.
     */
    public LabelSpace resolve(IPartitionedSequence<int[]> labels) {
        Objects.requireNonNull(labels, "labels");
        if (labels.getTotalLength() == 0) {
            throw new MetricsException(ErrorKind.EMPTY_INPUT, "Cannot resolve a label space from zero rows");
        }
        List<IntOpenHashSet> partials = driver.dispatch(ROUND_NAME, labels.getPartitions(),
            partition -> LocalStatComputer.distinctLabels(labels.fetch(partition)));
        LabelSpace space = union(partials);
        log.debug("Resolved {} classes: {}", space.size(), space);
        return space;
    }

    /**
     * Unions local distinct-label sets into a label space.
     *
     * @param partials local sets in any order.
     * @return the label space.
     * @throws MetricsException {@link ErrorKind#EMPTY_INPUT} if all sets are empty.
     */
    static LabelSpace union(List<IntOpenHashSet> partials) {
        IntOpenHashSet all = new IntOpenHashSet();
        for (IntOpenHashSet partial : partials) {
            all.addAll(partial);
        }
        if (all.isEmpty()) {
            throw new MetricsException(ErrorKind.EMPTY_INPUT, "No labels observed in any partition");
        }
        return LabelSpace.of(all);
    }
}
