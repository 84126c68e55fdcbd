package org.shardeval.config;

import java.time.Duration;
import java.util.Objects;

import org.shardeval.metrics.AveragingMode;
import org.shardeval.metrics.NormalizeMode;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Typed view of the {@code shardeval} configuration block.
 * <p>
 * Values are validated eagerly so that a bad configuration fails at startup instead of in the
 * middle of a metric round.
 */
public final class MetricsConfig {

    /** Root path of all settings. */
    public static final String ROOT_PATH = "shardeval";

    private final int workers;
    private final Duration roundTimeout;
    private final AveragingMode defaultAveraging;
    private final NormalizeMode defaultNormalize;

    private MetricsConfig(int workers, Duration roundTimeout, AveragingMode defaultAveraging,
                          NormalizeMode defaultNormalize) {
        this.workers = workers;
        this.roundTimeout = roundTimeout;
        this.defaultAveraging = defaultAveraging;
        this.defaultNormalize = defaultNormalize;
    }

    /**
     * Reads the settings below {@link #ROOT_PATH}, falling back to {@code reference.conf} for
     * anything missing.
     *
     * @param root a resolved application config.
     * @return the typed settings.
     * @throws ConfigException.BadValue if a value is out of range or names an unknown mode.
     */
    public static MetricsConfig from(Config root) {
        Objects.requireNonNull(root, "root");
        Config config = root.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT_PATH);

        int workers = config.getInt("workers");
        if (workers < 1) {
            throw new ConfigException.BadValue(config.origin(), ROOT_PATH + ".workers",
                "must be >= 1, got " + workers);
        }
        Duration roundTimeout = config.getDuration("round-timeout");
        if (roundTimeout.isZero() || roundTimeout.isNegative()) {
            throw new ConfigException.BadValue(config.origin(), ROOT_PATH + ".round-timeout",
                "must be positive, got " + roundTimeout);
        }

        AveragingMode averaging;
        try {
            averaging = AveragingMode.fromKey(config.getString("precision.average"));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), ROOT_PATH + ".precision.average", e.getMessage(), e);
        }
        NormalizeMode normalize;
        try {
            normalize = NormalizeMode.fromKey(config.getString("confusion.normalize"));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), ROOT_PATH + ".confusion.normalize", e.getMessage(), e);
        }
        return new MetricsConfig(workers, roundTimeout, averaging, normalize);
    }

    /**
     * Returns the settings from {@code reference.conf} only.
     *
     * @return the defaults.
     */
    public static MetricsConfig defaults() {
        return from(ConfigFactory.empty());
    }

    public int getWorkers() {
        return workers;
    }

    public Duration getRoundTimeout() {
        return roundTimeout;
    }

    public AveragingMode getDefaultAveraging() {
        return defaultAveraging;
    }

    public NormalizeMode getDefaultNormalize() {
        return defaultNormalize;
    }

    @Override
    public String toString() {
        return "MetricsConfig{workers=" + workers
            + ", roundTimeout=" + roundTimeout
            + ", defaultAveraging=" + defaultAveraging
            + ", defaultNormalize=" + defaultNormalize + '}';
    }
}
