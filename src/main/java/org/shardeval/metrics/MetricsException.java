package org.shardeval.metrics;

import java.util.Objects;

/**
 * Thrown when a metric cannot be computed.
 * <p>
 * Every condition reported through this exception is fatal for the whole operation: no
 * partial metric is returned and nothing is retried. Numeric edge cases such as 0/0 are
 * not failures and never surface here.
 * <p>
 * This is a RuntimeException because callers can only fix the input or the cluster and
 * run again.
 */
public class MetricsException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Creates a MetricsException with the specified kind and message.
     *
     * @param kind    Category of the failure
     * @param message Description of the failure
     */
    public MetricsException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Creates a MetricsException with the specified kind, message and cause.
     *
     * @param kind    Category of the failure
     * @param message Description of the failure
     * @param cause   The underlying exception that caused the failure
     */
    public MetricsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Returns the failure category.
     *
     * @return the error kind.
     */
    public ErrorKind getKind() {
        return kind;
    }
}
