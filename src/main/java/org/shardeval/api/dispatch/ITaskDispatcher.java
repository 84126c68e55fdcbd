package org.shardeval.api.dispatch;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Submits units of work to named workers.
 * <p>
 * A unit submitted for a worker runs where that worker's partitions live. The returned future
 * completes with the unit's result, or exceptionally with whatever the unit threw. Cancelling
 * the future must cancel (or at least discard) the unit.
 */
public interface ITaskDispatcher {

    /**
     * Submits a unit bound to a specific worker.
     *
     * @param worker name of the worker that must execute the unit.
     * @param unit   the computation.
     * @param <R>    result type.
     * @return a future for the unit's result.
     * @throws IllegalArgumentException if the worker is unknown to this dispatcher.
     * @throws IllegalStateException    if the dispatcher no longer accepts work.
     */
    <R> CompletableFuture<R> submit(String worker, Callable<R> unit);
}
