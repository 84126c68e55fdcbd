package org.shardeval.metrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.shardeval.api.dispatch.ITaskDispatcher;
import org.shardeval.api.partition.PartitionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-out/fan-in over the partitions of a distributed sequence.
 * <p>
 * One call to {@link #dispatch(String, List, PartitionTask)} is one scatter/gather round:
 * <ol>
 *   <li>One unit per partition is submitted to the worker owning that partition</li>
 *   <li>The calling thread blocks (no spinning) until every unit has completed, one unit has
 *       failed, or the round timeout has elapsed</li>
 *   <li>On success the partial results are returned; on failure all units still in flight are
 *       cancelled and a single {@link MetricsException} is thrown</li>
 * </ol>
 * <p>
 * Results come back in partition order, but callers must not depend on the order in which
 * units ran: reductions over them are commutative.
 * <p>
 * <b>Thread safety:</b> rounds are independent; the driver holds no per-round state.
 */
public class ScatterGatherDriver {

    private static final Logger log = LoggerFactory.getLogger(ScatterGatherDriver.class);

    private final ITaskDispatcher dispatcher;
    private final Duration roundTimeout;

    /**
     * Creates a driver.
     *
     * @param dispatcher   submits units to workers.
     * @param roundTimeout upper bound for one round; must be positive.
     */
    public ScatterGatherDriver(ITaskDispatcher dispatcher, Duration roundTimeout) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.roundTimeout = Objects.requireNonNull(roundTimeout, "roundTimeout");
        if (roundTimeout.isZero() || roundTimeout.isNegative()) {
            throw new IllegalArgumentException("Round timeout must be positive, got " + roundTimeout);
        }
    }

    /**
     * Runs one round.
     *
     * @param roundName  name used in logs and error messages.
     * @param partitions partitions to process, one unit each.
     * @param task       the partition-local computation.
     * @param <R>        partial result type.
     * @return the partial results, in partition order.
     * @throws MetricsException with {@link ErrorKind#WORKER_COMPUTATION_FAILED} if any unit fails,
     *                          cannot be submitted, or the round times out or is interrupted.
     */
    public <R> List<R> dispatch(String roundName, List<PartitionHandle> partitions, PartitionTask<R> task) {
        Objects.requireNonNull(task, "task");
        if (partitions.isEmpty()) {
            return List.of();
        }
        long startNanos = System.nanoTime();
        log.debug("Round '{}': dispatching {} units", roundName, partitions.size());

        List<CompletableFuture<R>> futures = new ArrayList<>(partitions.size());
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        AtomicReference<PartitionHandle> failedPartition = new AtomicReference<>();

        for (PartitionHandle partition : partitions) {
            CompletableFuture<R> future;
            try {
                future = dispatcher.submit(partition.worker(), () -> task.run(partition));
            } catch (RuntimeException e) {
                cancelAll(futures);
                throw new MetricsException(ErrorKind.WORKER_COMPUTATION_FAILED, String.format(
                    "Round '%s': could not submit partition %d to worker '%s'",
                    roundName, partition.index(), partition.worker()), e);
            }
            future.whenComplete((result, error) -> {
                if (error != null && failedPartition.compareAndSet(null, partition)) {
                    firstFailure.completeExceptionally(error);
                }
            });
            futures.add(future);
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
        try {
            CompletableFuture.anyOf(all, firstFailure).get(roundTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            cancelAll(futures);
            PartitionHandle partition = failedPartition.get();
            Throwable cause = unwrap(e);
            log.warn("Round '{}' failed on partition {}: {}",
                roundName, partition == null ? "?" : partition.index(), cause.toString());
            throw new MetricsException(ErrorKind.WORKER_COMPUTATION_FAILED, describeFailure(roundName, partition, cause), cause);
        } catch (TimeoutException e) {
            cancelAll(futures);
            log.warn("Round '{}' timed out after {}", roundName, roundTimeout);
            throw new MetricsException(ErrorKind.WORKER_COMPUTATION_FAILED,
                String.format("Round '%s' did not complete within %s", roundName, roundTimeout), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new MetricsException(ErrorKind.WORKER_COMPUTATION_FAILED,
                String.format("Round '%s' interrupted while awaiting workers", roundName), e);
        }

        List<R> results = new ArrayList<>(futures.size());
        for (CompletableFuture<R> future : futures) {
            results.add(future.join());
        }
        log.debug("Round '{}': {} units completed in {} ms",
            roundName, results.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return results;
    }

    private static void cancelAll(List<? extends CompletableFuture<?>> futures) {
        for (CompletableFuture<?> future : futures) {
            future.cancel(true);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describeFailure(String roundName, PartitionHandle partition, Throwable cause) {
        if (partition == null) {
            return String.format("Round '%s' failed: %s", roundName, cause);
        }
        return String.format("Round '%s' failed on partition %d (worker '%s'): %s",
            roundName, partition.index(), partition.worker(), cause);
    }
}
