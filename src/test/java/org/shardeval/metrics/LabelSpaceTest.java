package org.shardeval.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

@Tag("unit")
class LabelSpaceTest {

    @Test
    void sortsAndDeduplicates() {
        LabelSpace space = LabelSpace.of(3, 1, 3, 2, 1);

        assertThat(space.toArray()).containsExactly(1, 2, 3);
        assertThat(space.size()).isEqualTo(3);
    }

    @Test
    void buildsFromIntCollection() {
        IntOpenHashSet labels = new IntOpenHashSet(new int[] {7, -2, 7, 0});

        assertThat(LabelSpace.of(labels).toArray()).containsExactly(-2, 0, 7);
    }

    @Test
    void contiguousLabelsIndexThemselves() {
        LabelSpace space = LabelSpace.of(0, 1, 2);

        assertThat(space.isContiguousFromZero()).isTrue();
        assertThat(space.indexOf(0)).isEqualTo(0);
        assertThat(space.indexOf(2)).isEqualTo(2);
        assertThat(space.indexOf(3)).isEqualTo(-1);
        assertThat(space.indexOf(-1)).isEqualTo(-1);
    }

    @Test
    void sparseLabelsMapThroughIndex() {
        LabelSpace space = LabelSpace.of(10, 20, 40);

        assertThat(space.isContiguousFromZero()).isFalse();
        assertThat(space.indexOf(10)).isEqualTo(0);
        assertThat(space.indexOf(40)).isEqualTo(2);
        assertThat(space.indexOf(30)).isEqualTo(-1);
        assertThat(space.labelAt(1)).isEqualTo(20);
        assertThat(space.contains(20)).isTrue();
        assertThat(space.contains(0)).isFalse();
    }

    @Test
    void rejectsEmptySpace() {
        assertThatThrownBy(() -> LabelSpace.of())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least one label");
    }

    @Test
    void equalityIsByLabels() {
        assertThat(LabelSpace.of(2, 1)).isEqualTo(LabelSpace.of(1, 2));
        assertThat(LabelSpace.of(2, 1)).hasSameHashCodeAs(LabelSpace.of(1, 2));
        assertThat(LabelSpace.of(1, 2)).isNotEqualTo(LabelSpace.of(1, 2, 3));
    }

    @Test
    void toArrayReturnsCopy() {
        LabelSpace space = LabelSpace.of(0, 1);
        space.toArray()[0] = 99;

        assertThat(space.labelAt(0)).isEqualTo(0);
    }
}
