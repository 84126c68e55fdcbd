package org.shardeval.sentiment;

import org.shardeval.api.partition.IPartitionedSequence;
import org.shardeval.metrics.LabelSpace;

/**
 * Three-way sentiment classes derived from product review ratings.
 * <p>
 * <strong>Mapping:</strong>
 * <ul>
 *   <li>ratings 1 and 2 - {@link #NEG}</li>
 *   <li>rating 3 - {@link #NEUT}</li>
 *   <li>any other rating - {@link #POS}</li>
 * </ul>
 */
public final class SentimentLabels {

    public static final int NEG = 0;
    public static final int NEUT = 1;
    public static final int POS = 2;

    /** The label space of all three classes. */
    public static final LabelSpace LABEL_SPACE = LabelSpace.of(NEG, NEUT, POS);

    private static final String[] CATEGORIES = {"NEG", "NEUT", "POS"};

    private SentimentLabels() {
    }

    /**
     * Maps one review rating to its sentiment class.
     *
     * @param rating the review rating.
     * @return {@link #NEG}, {@link #NEUT} or {@link #POS}.
     */
    public static int classOf(int rating) {
        if (rating == 1 || rating == 2) {
            return NEG;
        }
        return rating == 3 ? NEUT : POS;
    }

    /**
     * Maps a slice of ratings to sentiment classes.
     *
     * @param ratings review ratings.
     * @return a new array of classes, same length.
     */
    public static int[] classify(int[] ratings) {
        int[] classes = new int[ratings.length];
        for (int i = 0; i < ratings.length; i++) {
            classes[i] = classOf(ratings[i]);
        }
        return classes;
    }

    /**
     * Returns a view of partitioned ratings as sentiment classes. The mapping runs on the worker
     * owning each partition when that partition is fetched; placement is unchanged.
     *
     * @param ratings partitioned review ratings.
     * @return partitioned sentiment classes.
     */
    public static IPartitionedSequence<int[]> relabel(IPartitionedSequence<int[]> ratings) {
        return ratings.map(SentimentLabels::classify);
    }

    /**
     * Returns the category name of a sentiment class.
     *
     * @param label a sentiment class.
     * @return "NEG", "NEUT" or "POS".
     * @throws IllegalArgumentException if {@code label} is not a sentiment class.
     */
    public static String categoryOf(int label) {
        if (label < NEG || label > POS) {
            throw new IllegalArgumentException("Not a sentiment class: " + label);
        }
        return CATEGORIES[label];
    }

    /**
     * Maps a slice of sentiment classes to category names.
     *
     * @param labels sentiment classes.
     * @return category names, same length.
     */
    public static String[] categorize(int[] labels) {
        String[] categories = new String[labels.length];
        for (int i = 0; i < labels.length; i++) {
            categories[i] = categoryOf(labels[i]);
        }
        return categories;
    }
}
