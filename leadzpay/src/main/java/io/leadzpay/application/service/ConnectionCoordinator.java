package io.leadzpay.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * ConnectionCoordinator - Actor-based routing for connection mutations.
 *
 * SINGLE-WRITER PER CONNECTION:
 * All mutations for a connection key (connection id, or provider|buyer pair for creation)
 * are routed to the same executor partition and run one at a time. A lead submission and
 * a lifecycle transition on the same connection never interleave in this process.
 *
 * PARTITIONING STRATEGY:
 * - Partition count = clamp(availableProcessors(), 8, 32)
 * - Route by: floorMod(hash(key), partitions)
 *
 * Cross-process safety comes from the repositories' optimistic version check.
 */
public final class ConnectionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ConnectionCoordinator.class);

    private static final int MIN_PARTITIONS = 8;
    private static final int MAX_PARTITIONS = 32;

    private final ExecutorService[] partitions;
    private final int partitionCount;

    public ConnectionCoordinator() {
        this(calculateOptimalPartitions());
    }

    public ConnectionCoordinator(int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be positive: " + partitionCount);
        }
        this.partitionCount = partitionCount;
        this.partitions = new ExecutorService[partitionCount];

        for (int i = 0; i < partitionCount; i++) {
            final int partitionIndex = i;
            this.partitions[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread t = new Thread(runnable, "connection-coordinator-" + partitionIndex);
                t.setDaemon(true);
                return t;
            });
        }

        log.info("ConnectionCoordinator initialized with {} partitions (CPUs: {})",
            partitionCount, Runtime.getRuntime().availableProcessors());
    }

    private static int calculateOptimalPartitions() {
        int processors = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_PARTITIONS, Math.min(MAX_PARTITIONS, processors));
    }

    /**
     * Run a task on the key's partition and return its result asynchronously.
     */
    public <T> CompletableFuture<T> submit(String key, Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, partitions[getPartition(key)]);
    }

    /**
     * Run a task on the key's partition and wait for it.
     *
     * Exceptions thrown by the task are rethrown as-is so callers see domain exceptions,
     * not CompletionException.
     */
    public <T> T call(String key, Supplier<T> task) {
        try {
            return submit(key, task).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Connection operation failed: " + key, cause);
        }
    }

    /**
     * Partition index for a key, 0 to partitionCount-1.
     */
    int getPartition(String key) {
        return Math.floorMod(key.hashCode(), partitionCount);
    }

    /**
     * Shutdown all partitions gracefully.
     *
     * Waits up to 30 seconds for pending tasks to complete.
     */
    public void shutdown() {
        log.info("Shutting down ConnectionCoordinator with {} partitions", partitionCount);

        for (ExecutorService partition : partitions) {
            partition.shutdown();
        }

        try {
            for (int i = 0; i < partitionCount; i++) {
                if (!partitions[i].awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Partition {} did not terminate in time, forcing shutdown", i);
                    partitions[i].shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            log.error("Shutdown interrupted", e);
            for (ExecutorService partition : partitions) {
                partition.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }

        log.info("ConnectionCoordinator shutdown complete");
    }

    public int getPartitionCount() {
        return partitionCount;
    }
}
