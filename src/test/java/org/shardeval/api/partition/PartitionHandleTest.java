package org.shardeval.api.partition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PartitionHandleTest {

    @Test
    void endOffsetIsExclusive() {
        assertThat(new PartitionHandle(2, 10, 5, "w").endOffset()).isEqualTo(15);
    }

    @Test
    void rejectsNegativeFields() {
        assertThatThrownBy(() -> new PartitionHandle(-1, 0, 0, "w")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartitionHandle(0, -1, 0, "w")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartitionHandle(0, 0, -1, "w")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartitionHandle(0, 0, 0, null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void mappedViewSharesHandlesAndTotalLength() {
        List<PartitionHandle> handles = List.of(new PartitionHandle(0, 0, 2, "w"), new PartitionHandle(1, 2, 3, "w"));
        IPartitionedSequence<int[]> source = new IPartitionedSequence<>() {
            @Override
            public List<PartitionHandle> getPartitions() {
                return handles;
            }

            @Override
            public int[] fetch(PartitionHandle partition) {
                return new int[partition.length()];
            }
        };

        IPartitionedSequence<Integer> lengths = source.map(slice -> slice.length);

        assertThat(lengths.getPartitions()).isSameAs(handles);
        assertThat(lengths.getTotalLength()).isEqualTo(5);
        assertThat(lengths.fetch(handles.get(1))).isEqualTo(3);
    }
}
