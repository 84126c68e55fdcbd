package org.shardeval.metrics;

import java.util.Locale;

/**
 * Policy for collapsing per-class precision into one scalar.
 */
public enum AveragingMode {

    /**
     * Precision of the positive (second) class. Only defined for exactly two classes.
     */
    BINARY("binary"),

    /**
     * Unweighted mean of the per-class precisions.
     */
    MACRO("macro"),

    /**
     * Precision over the pooled true and false positives of all classes.
     */
    MICRO("micro");

    private final String key;

    AveragingMode(String key) {
        this.key = key;
    }

    /**
     * Returns the configuration key of this mode.
     *
     * @return lower-case key, e.g. "macro".
     */
    public String getKey() {
        return key;
    }

    /**
     * Parses a configuration key, ignoring case.
     *
     * @param value the key, e.g. "micro".
     * @return the matching mode.
     * @throws IllegalArgumentException if the key names no mode.
     */
    public static AveragingMode fromKey(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AveragingMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown averaging mode '" + value + "', expected binary, macro or micro");
    }
}
