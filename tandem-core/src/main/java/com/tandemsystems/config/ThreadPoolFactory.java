package com.tandemsystems.config;

import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Factory for the executors that run spawned processes.
 * Centralizes thread pool creation so pool type, size and thread naming can be tuned in one place.
 */
public class ThreadPoolFactory {
    private static final Logger logger = LoggerFactory.getLogger(ThreadPoolFactory.class);

    // Default values
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;
    private static final ThreadPoolType DEFAULT_EXECUTOR_TYPE = ThreadPoolType.CACHED;

    private ThreadPoolType executorType = DEFAULT_EXECUTOR_TYPE;
    private int fixedPoolSize = Runtime.getRuntime().availableProcessors();
    private int workStealingParallelism = Runtime.getRuntime().availableProcessors();
    private boolean useNamedThreads = true;
    private boolean daemonThreads = true;
    private int shutdownTimeoutSeconds = DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;

    /**
     * Enum defining the types of thread pools that can be used.
     */
    public enum ThreadPoolType {
        /**
         * One thread per live process, reused once a process finishes.
         * Suits processes that spend most of their time waiting on a channel.
         */
        CACHED,

        /**
         * A fixed number of threads. Processes beyond the pool size queue up
         * until a thread frees, so blocking processes can starve each other.
         */
        FIXED,

        /**
         * A work-stealing pool for short, CPU-bound processes.
         */
        WORK_STEALING
    }

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates an executor service based on the current configuration.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new executor service
     */
    public ExecutorService createExecutorService(String poolName) {
        logger.debug("Creating {} executor for pool {} (fixedPoolSize={}, parallelism={}, namedThreads={})",
                executorType, poolName, fixedPoolSize, workStealingParallelism, useNamedThreads);
        switch (executorType) {
            case CACHED:
                return useNamedThreads
                        ? Executors.newCachedThreadPool(createNamedThreadFactory(poolName))
                        : Executors.newCachedThreadPool();
            case FIXED:
                return useNamedThreads
                        ? Executors.newFixedThreadPool(fixedPoolSize, createNamedThreadFactory(poolName))
                        : Executors.newFixedThreadPool(fixedPoolSize);
            case WORK_STEALING:
                return Executors.newWorkStealingPool(workStealingParallelism);
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    /**
     * Creates a named thread factory for better thread identification in logs and profilers.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory that creates named threads
     */
    private ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemonThreads)
                .build();
    }

    // Getters and setters

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        this.executorType = executorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        checkArgument(fixedPoolSize > 0, "fixedPoolSize must be positive: %s", fixedPoolSize);
        this.fixedPoolSize = fixedPoolSize;
        return this;
    }

    public int getWorkStealingParallelism() {
        return workStealingParallelism;
    }

    public ThreadPoolFactory setWorkStealingParallelism(int workStealingParallelism) {
        checkArgument(workStealingParallelism > 0,
                "workStealingParallelism must be positive: %s", workStealingParallelism);
        this.workStealingParallelism = workStealingParallelism;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        checkArgument(shutdownTimeoutSeconds >= 0,
                "shutdownTimeoutSeconds cannot be negative: %s", shutdownTimeoutSeconds);
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        return this;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("executorType", executorType)
                .add("fixedPoolSize", fixedPoolSize)
                .add("workStealingParallelism", workStealingParallelism)
                .add("useNamedThreads", useNamedThreads)
                .add("shutdownTimeoutSeconds", shutdownTimeoutSeconds)
                .toString();
    }
}
