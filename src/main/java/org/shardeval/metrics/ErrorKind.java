package org.shardeval.metrics;

/**
 * Categories of fatal metric computation failures.
 */
public enum ErrorKind {

    /** Binary averaging requested for a label space with more than two classes. */
    INVALID_AVERAGING_MODE,

    /** Fewer classes than the metric requires. */
    DEGENERATE_LABEL_SPACE,

    /** Aligned sequences disagree in partition layout or total length. */
    PARTITION_MISMATCH,

    /** A unit dispatched to a worker failed, timed out or could not be submitted. */
    WORKER_COMPUTATION_FAILED,

    /** The input holds no rows at all. */
    EMPTY_INPUT
}
