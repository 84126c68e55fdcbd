package org.shardeval.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ConfusionMatrixTest {

    private static final LabelSpace SPACE = LabelSpace.of(0, 1, 2);

    private ConfusionMatrix matrix;

    @BeforeEach
    void setUp() {
        // row 2 (true label 2) stays empty
        matrix = ConfusionMatrix.zeros(SPACE);
        matrix.accumulate(0, 0, 3.0);
        matrix.accumulate(0, 1, 1.0);
        matrix.accumulate(1, 1, 2.0);
        matrix.accumulate(1, 0, 2.0);
    }

    @Test
    void rowNormalization_NonEmptyRowsSumToOneAndEmptyRowsStayZero() {
        ConfusionMatrix normalized = matrix.normalized(NormalizeMode.TRUE);

        assertThat(normalized.rowSum(0)).isCloseTo(1.0, within(1e-12));
        assertThat(normalized.rowSum(1)).isCloseTo(1.0, within(1e-12));
        assertThat(normalized.rowSum(2)).isZero();
        assertThat(normalized.get(0, 0)).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void columnNormalization_EmptyColumnStaysZero() {
        ConfusionMatrix normalized = matrix.normalized(NormalizeMode.PRED);

        assertThat(normalized.columnSum(0)).isCloseTo(1.0, within(1e-12));
        assertThat(normalized.columnSum(1)).isCloseTo(1.0, within(1e-12));
        assertThat(normalized.columnSum(2)).isZero();
        assertThat(normalized.get(1, 0)).isCloseTo(0.4, within(1e-12));
    }

    @Test
    void totalNormalization_DividesByGrandTotal() {
        ConfusionMatrix normalized = matrix.normalized(NormalizeMode.ALL);

        assertThat(normalized.total()).isCloseTo(1.0, within(1e-12));
        assertThat(normalized.get(0, 0)).isCloseTo(3.0 / 8.0, within(1e-12));
    }

    @Test
    void normalizingAllZeroMatrixYieldsZerosNotNaN() {
        ConfusionMatrix empty = ConfusionMatrix.zeros(SPACE);

        for (NormalizeMode mode : NormalizeMode.values()) {
            double[][] cells = empty.normalized(mode).toArray();
            for (double[] row : cells) {
                assertThat(row).containsOnly(0.0);
            }
        }
    }

    @Test
    void normalizedLeavesOriginalUntouched() {
        matrix.normalized(NormalizeMode.ALL);

        assertThat(matrix.total()).isEqualTo(8.0);
    }

    @Test
    void addRejectsDifferentLabelSpaces() {
        assertThatThrownBy(() -> matrix.add(ConfusionMatrix.zeros(LabelSpace.of(0, 1))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("different label spaces");
    }
}
