package org.shardeval.sentiment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.shardeval.api.partition.IPartitionedSequence;
import org.shardeval.config.MetricsConfig;
import org.shardeval.metrics.ClassificationReport;
import org.shardeval.metrics.MetricsCoordinator;
import org.shardeval.runtime.InMemoryPartitionedSequence;
import org.shardeval.runtime.LocalWorkerPool;

@Tag("unit")
class SentimentLabelsTest {

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
    void ratingsMapToThreeClasses() {
        assertThat(SentimentLabels.classify(new int[] {1, 2, 3, 4, 5, 0}))
            .containsExactly(SentimentLabels.NEG, SentimentLabels.NEG, SentimentLabels.NEUT,
                SentimentLabels.POS, SentimentLabels.POS, SentimentLabels.POS);
    }

    @Test
    void categoriesNameEachClass() {
        assertThat(SentimentLabels.categorize(new int[] {2, 0, 1})).containsExactly("POS", "NEG", "NEUT");
        assertThatThrownBy(() -> SentimentLabels.categoryOf(3))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("3");
    }

    @Test
    void relabelKeepsPlacementAndEvaluatesOnWorkers() {
        IPartitionedSequence<int[]> ratings =
            InMemoryPartitionedSequence.ofLabels(new int[] {5, 1, 3, 4, 2, 5}, 3, pool.getWorkerNames());
        IPartitionedSequence<int[]> predictedRatings =
            InMemoryPartitionedSequence.ofLabels(new int[] {4, 2, 5, 5, 3, 1}, 3, pool.getWorkerNames());

        IPartitionedSequence<int[]> yTrue = SentimentLabels.relabel(ratings);
        IPartitionedSequence<int[]> yPred = SentimentLabels.relabel(predictedRatings);
        ClassificationReport report = new MetricsCoordinator(pool, MetricsConfig.defaults()).evaluate(yTrue, yPred);

        assertThat(yTrue.getPartitions()).isEqualTo(ratings.getPartitions());
        assertThat(report.getLabelSpace()).isEqualTo(SentimentLabels.LABEL_SPACE);
        // true POS NEG NEUT POS NEG POS, pred POS NEG POS POS NEUT NEG
        assertThat(report.getAccuracy()).isEqualTo(0.5);
        assertThat(report.format(SentimentLabels::categoryOf)).contains("NEUT").contains("POS");
    }
}
