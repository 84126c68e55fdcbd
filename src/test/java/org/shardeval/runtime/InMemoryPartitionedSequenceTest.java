package org.shardeval.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.shardeval.api.partition.IPartitionedSequence;
import org.shardeval.api.partition.PartitionHandle;

@Tag("unit")
class InMemoryPartitionedSequenceTest {

    private LocalWorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new LocalWorkerPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    void splitsIntoContiguousPartitionsPlacedRoundRobin() {
        InMemoryPartitionedSequence<int[]> labels =
            InMemoryPartitionedSequence.ofLabels(new int[] {0, 1, 2, 3, 4, 5, 6}, new int[] {3, 0, 4}, pool.getWorkerNames());

        assertThat(labels.getPartitions()).containsExactly(
            new PartitionHandle(0, 0, 3, "worker-0"),
            new PartitionHandle(1, 3, 0, "worker-1"),
            new PartitionHandle(2, 3, 4, "worker-0"));
        assertThat(labels.getTotalLength()).isEqualTo(7);
    }

    @Test
    void evenLengthsSpreadsRemainderOverFirstPartitions() {
        assertThat(InMemoryPartitionedSequence.evenLengths(10, 4)).containsExactly(3, 3, 2, 2);
        assertThat(InMemoryPartitionedSequence.evenLengths(2, 3)).containsExactly(1, 1, 0);
    }

    @Test
    void fetchReturnsSliceOnOwningWorker() throws Exception {
        InMemoryPartitionedSequence<int[]> labels =
            InMemoryPartitionedSequence.ofLabels(new int[] {5, 6, 7, 8}, 2, pool.getWorkerNames());
        PartitionHandle second = labels.getPartitions().get(1);

        int[] slice = pool.submit(second.worker(), () -> labels.fetch(second)).get(5, TimeUnit.SECONDS);

        assertThat(slice).containsExactly(7, 8);
    }

    @Test
    void fetchOnCoordinatorIsRejected() {
        InMemoryPartitionedSequence<int[]> labels =
            InMemoryPartitionedSequence.ofLabels(new int[] {1, 2}, 1, pool.getWorkerNames());

        assertThatThrownBy(() -> labels.fetch(labels.getPartitions().get(0)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("lives on worker 'worker-0'");
    }

    @Test
    void fetchOnOtherWorkerIsRejected() {
        InMemoryPartitionedSequence<int[]> labels =
            InMemoryPartitionedSequence.ofLabels(new int[] {1, 2}, 1, pool.getWorkerNames());
        PartitionHandle partition = labels.getPartitions().get(0);

        assertThatThrownBy(() -> pool.submit("worker-1", () -> labels.fetch(partition)).get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void fetchRejectsForeignHandle() {
        InMemoryPartitionedSequence<int[]> labels =
            InMemoryPartitionedSequence.ofLabels(new int[] {1, 2}, 1, pool.getWorkerNames());

        assertThatThrownBy(() -> labels.fetch(new PartitionHandle(0, 0, 5, "worker-0")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mappedViewKeepsPlacementAndAppliesMapperOnWorker() throws Exception {
        InMemoryPartitionedSequence<int[]> labels =
            InMemoryPartitionedSequence.ofLabels(new int[] {1, 2, 3}, 2, pool.getWorkerNames());
        IPartitionedSequence<String> mapped = labels.map(slice -> LocalWorkerPool.currentWorker() + ":" + slice.length);
        PartitionHandle second = mapped.getPartitions().get(1);

        String result = pool.submit(second.worker(), () -> mapped.fetch(second)).get(5, TimeUnit.SECONDS);

        assertThat(mapped.getPartitions()).isEqualTo(labels.getPartitions());
        assertThat(result).isEqualTo("worker-1:1");
    }

    @Test
    void weightsSplitLikeLabels() {
        InMemoryPartitionedSequence<double[]> weights =
            InMemoryPartitionedSequence.ofWeights(new double[] {0.5, 1.0, 2.0}, 2, pool.getWorkerNames());

        assertThat(weights.getPartitions()).extracting(PartitionHandle::length).containsExactly(2, 1);
    }

    @Test
    void rejectsLengthsNotCoveringSequence() {
        assertThatThrownBy(() -> InMemoryPartitionedSequence.ofLabels(new int[] {1, 2, 3}, new int[] {1, 1}, List.of("w")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sum to 2");
    }
}
