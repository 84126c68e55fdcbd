package org.shardeval.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.shardeval.api.dispatch.ITaskDispatcher;
import org.shardeval.config.MetricsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An in-process stand-in for a cluster of workers.
 * <p>
 * Every worker is one named daemon thread with its own queue. A unit submitted for worker
 * {@code w} always runs on {@code w}'s thread, so partitions placed on {@code w} (see
 * {@link InMemoryPartitionedSequence}) are only ever read there. Workers share no state and
 * never talk to each other.
 * <p>
 * Cancelling a future returned by {@link #submit(String, Callable)} removes the unit from the
 * worker's queue, or interrupts it if it is already running.
 * <p>
 * <b>Thread safety:</b> {@link #submit(String, Callable)} may be called from any thread.
 * {@link #shutdown()} is idempotent and safe to call from any thread.
 */
public class LocalWorkerPool implements ITaskDispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerPool.class);

    private static final ThreadLocal<String> CURRENT_WORKER = new ThreadLocal<>();

    private final Map<String, ExecutorService> executors;
    private final AtomicBoolean stopped = new AtomicBoolean();

    /**
     * Creates a pool with workers named {@code worker-0} to {@code worker-(n-1)}.
     *
     * @param workerCount number of workers; must be &gt;= 1.
     * @throws IllegalArgumentException if workerCount &lt; 1
     */
    public LocalWorkerPool(int workerCount) {
        this(defaultWorkerNames(workerCount));
    }

    /**
     * Creates a pool with one worker per name.
     *
     * @param workerNames distinct, non-empty list of worker names.
     * @throws IllegalArgumentException if the list is empty or contains duplicates
     */
    public LocalWorkerPool(List<String> workerNames) {
        if (workerNames.isEmpty()) {
            throw new IllegalArgumentException("A worker pool needs at least one worker");
        }
        Map<String, ExecutorService> created = new LinkedHashMap<>();
        for (String name : workerNames) {
            Objects.requireNonNull(name, "worker name");
            if (created.containsKey(name)) {
                created.values().forEach(ExecutorService::shutdownNow);
                throw new IllegalArgumentException("Duplicate worker name: " + name);
            }
            created.put(name, Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(() -> {
                    CURRENT_WORKER.set(name);
                    runnable.run();
                }, "metric-worker-" + name);
                thread.setDaemon(true);
                return thread;
            }));
        }
        this.executors = Collections.unmodifiableMap(created);
        log.debug("Started {} workers: {}", executors.size(), executors.keySet());
    }

    /**
     * Creates a pool sized by {@link MetricsConfig#getWorkers()}.
     *
     * @param config the settings.
     * @return the pool.
     */
    public static LocalWorkerPool fromConfig(MetricsConfig config) {
        return new LocalWorkerPool(config.getWorkers());
    }

    /**
     * Returns the name of the worker whose thread is calling, or {@code null} when called from
     * any other thread (e.g. the coordinator).
     *
     * @return the current worker name, or {@code null}.
     */
    public static String currentWorker() {
        return CURRENT_WORKER.get();
    }

    /**
     * Returns the worker names in creation order.
     *
     * @return immutable list of names.
     */
    public List<String> getWorkerNames() {
        return List.copyOf(executors.keySet());
    }

    @Override
    public <R> CompletableFuture<R> submit(String worker, Callable<R> unit) {
        Objects.requireNonNull(unit, "unit");
        ExecutorService executor = executors.get(worker);
        if (executor == null) {
            throw new IllegalArgumentException("Unknown worker '" + worker + "', known: " + executors.keySet());
        }
        if (stopped.get()) {
            throw new IllegalStateException("Worker pool is shut down");
        }

        CompletableFuture<R> result = new CompletableFuture<>();
        Future<?> running;
        try {
            running = executor.submit(() -> {
                if (result.isDone()) {
                    return;
                }
                try {
                    result.complete(unit.call());
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Worker '" + worker + "' no longer accepts work", e);
        }
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                running.cancel(true);
            }
        });
        return result;
    }

    /**
     * Shuts down all workers, interrupting running units, and waits up to 5 seconds per worker.
     * <p>
     * Idempotent.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        for (ExecutorService executor : executors.values()) {
            executor.shutdownNow();
        }
        List<String> stuck = new ArrayList<>();
        for (Map.Entry<String, ExecutorService> entry : executors.entrySet()) {
            try {
                if (!entry.getValue().awaitTermination(5, TimeUnit.SECONDS)) {
                    stuck.add(entry.getKey());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (!stuck.isEmpty()) {
            log.warn("Workers did not terminate within 5s: {}", stuck);
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private static List<String> defaultWorkerNames(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be >= 1, got " + workerCount);
        }
        List<String> names = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            names.add("worker-" + i);
        }
        return names;
    }
}
