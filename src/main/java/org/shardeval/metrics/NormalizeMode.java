package org.shardeval.metrics;

import java.util.Locale;

/**
 * Normalization applied to a reduced confusion matrix.
 */
public enum NormalizeMode {

    /** Raw (weighted) counts. */
    NONE("none"),

    /** Each cell divided by its row sum, i.e. over the true label. */
    TRUE("true"),

    /** Each cell divided by its column sum, i.e. over the predicted label. */
    PRED("pred"),

    /** Each cell divided by the grand total. */
    ALL("all");

    private final String key;

    NormalizeMode(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Parses a configuration key, ignoring case.
     *
     * @param value the key, e.g. "true".
     * @return the matching mode.
     * @throws IllegalArgumentException if the key names no mode.
     */
    public static NormalizeMode fromKey(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (NormalizeMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown normalize mode '" + value + "', expected none, true, pred or all");
    }
}
