package org.shardeval.metrics;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntCollection;

/**
 * The ordered set of distinct class labels that are valid for one run.
 * <p>
 * Labels are kept in strictly increasing order. A label's position in that order is its
 * class index: row and column {@code i} of every per-class statistic refer to
 * {@link #labelAt(int) labelAt(i)}. Labels need not be contiguous or start at zero;
 * {@link #indexOf(int)} maps any label to its class index, or {@code -1} if the label lies
 * outside the space.
 * <p>
 * Instances are immutable and safe to share with workers.
 */
public final class LabelSpace {

    private final int[] labels;
    private final boolean contiguousFromZero;

    private LabelSpace(int[] sortedDistinct) {
        if (sortedDistinct.length == 0) {
            throw new IllegalArgumentException("A label space needs at least one label");
        }
        this.labels = sortedDistinct;
        this.contiguousFromZero = sortedDistinct[0] == 0
            && sortedDistinct[sortedDistinct.length - 1] == sortedDistinct.length - 1;
    }

    /**
     * Creates a label space from arbitrary labels. Duplicates are removed and the rest sorted.
     *
     * @param labels at least one label.
     * @return the label space.
     * @throws IllegalArgumentException if no label is given.
     */
    public static LabelSpace of(int... labels) {
        int[] copy = labels.clone();
        IntArrays.quickSort(copy);
        int distinct = 0;
        for (int i = 0; i < copy.length; i++) {
            if (i == 0 || copy[i] != copy[distinct - 1]) {
                copy[distinct++] = copy[i];
            }
        }
        return new LabelSpace(Arrays.copyOf(copy, distinct));
    }

    /**
     * Creates a label space from a collection of labels.
     *
     * @param labels at least one label.
     * @return the label space.
     */
    public static LabelSpace of(IntCollection labels) {
        return of(labels.toIntArray());
    }

    /**
     * Returns the number of classes.
     *
     * @return {@code nclasses}, at least 1.
     */
    public int size() {
        return labels.length;
    }

    /**
     * Returns the label of a class index.
     *
     * @param index class index in {@code [0, size())}.
     * @return the label.
     */
    public int labelAt(int index) {
        return labels[index];
    }

    /**
     * Returns the class index of a label.
     *
     * @param label any label.
     * @return the class index, or {@code -1} if the label is outside this space.
     */
    public int indexOf(int label) {
        if (contiguousFromZero) {
            return label >= 0 && label < labels.length ? label : -1;
        }
        int index = Arrays.binarySearch(labels, label);
        return index >= 0 ? index : -1;
    }

    public boolean contains(int label) {
        return indexOf(label) >= 0;
    }

    /**
     * Returns whether the labels are exactly {@code 0, 1, ..., size() - 1}.
     *
     * @return true if every label equals its class index.
     */
    public boolean isContiguousFromZero() {
        return contiguousFromZero;
    }

    /**
     * Returns a copy of the labels in ascending order.
     *
     * @return the labels.
     */
    public int[] toArray() {
        return labels.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelSpace other)) return false;
        return Arrays.equals(labels, other.labels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        return "LabelSpace" + Arrays.toString(labels);
    }
}
