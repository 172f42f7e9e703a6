package com.tandemsystems;

import com.tandemsystems.config.ChannelConfig;
import com.tandemsystems.config.ThreadPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs tasks as processes on a thread pool and tracks their identifiers.
 *
 * Each spawned task sees its own {@link ProcessId} through {@link #myPid()}. Failures
 * inside a process are logged and end that process only.
 */
public class ProcessSystem {
    private static final Logger logger = LoggerFactory.getLogger(ProcessSystem.class);

    private final String name;
    private final ThreadPoolFactory threadPoolFactory;
    private final ExecutorService executor;
    private final Map<ProcessId, Future<?>> processes = new ConcurrentHashMap<>();
    private final ThreadLocal<ProcessId> currentPid = new ThreadLocal<>();
    private final AtomicLong pidCounter = new AtomicLong();

    /**
     * Creates a process system with default thread pool settings.
     */
    public ProcessSystem() {
        this(new ThreadPoolFactory());
    }

    /**
     * Creates a process system with the given thread pool settings.
     *
     * @param threadPoolFactory the thread pool configuration
     */
    public ProcessSystem(ThreadPoolFactory threadPoolFactory) {
        this("proc", threadPoolFactory);
    }

    /**
     * Creates a named process system. The name prefixes process ids and thread names.
     *
     * @param name the system name
     * @param threadPoolFactory the thread pool configuration
     */
    public ProcessSystem(String name, ThreadPoolFactory threadPoolFactory) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory cannot be null");
        this.executor = threadPoolFactory.createExecutorService(name);
        logger.debug("ProcessSystem {} created with thread pool {}", name, threadPoolFactory);
    }

    /**
     * Starts a task in a new process.
     *
     * @param task the task to run
     * @return the id of the new process
     */
    public ProcessId spawn(Runnable task) {
        Objects.requireNonNull(task, "task cannot be null");
        ProcessId pid = nextPid();
        FutureTask<Void> future = new FutureTask<>(() -> runProcess(pid, task), null);
        processes.put(pid, future);
        try {
            executor.execute(future);
        } catch (RejectedExecutionException e) {
            processes.remove(pid);
            throw e;
        }
        return pid;
    }

    /**
     * Creates a channel with default configuration, starts a process holding its receiver
     * view and returns the sender view to the caller.
     *
     * @param body the process body
     * @return the process id and the caller's end of the channel
     */
    public LinkedProcess spawnLinked(ChannelTask body) {
        return spawnLinked(new ChannelConfig(), body);
    }

    /**
     * Creates a channel, starts a process holding its receiver view and returns the
     * sender view to the caller.
     *
     * @param config the channel configuration
     * @param body the process body
     * @return the process id and the caller's end of the channel
     */
    public LinkedProcess spawnLinked(ChannelConfig config, ChannelTask body) {
        Objects.requireNonNull(body, "body cannot be null");
        Channel channel = Channels.newChannel(config);
        ChannelView receiver = Channels.makeReceiver(channel);
        ProcessId pid = spawn(() -> {
            try {
                body.run(receiver);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Process {} interrupted while waiting on {}", myPid(), channel.id());
            }
        });
        return new LinkedProcess(pid, Channels.makeSender(channel));
    }

    /**
     * Returns the id of the calling process. A thread not started by this system is
     * assigned an id on its first call and keeps it afterwards.
     *
     * @return the caller's process id
     */
    public ProcessId myPid() {
        ProcessId pid = currentPid.get();
        if (pid == null) {
            pid = nextPid();
            currentPid.set(pid);
            logger.debug("Assigned {} to thread {}", pid, Thread.currentThread().getName());
        }
        return pid;
    }

    /**
     * Checks whether a spawned process is still running or waiting to run.
     *
     * @param pid the process id
     * @return true if the process has not finished
     */
    public boolean isAlive(ProcessId pid) {
        Future<?> future = processes.get(pid);
        return future != null && !future.isDone();
    }

    /**
     * Waits for a process to finish.
     *
     * @param pid the process id
     * @param timeout the maximum time to wait
     * @return true if no process with this id is running when the call returns
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean join(ProcessId pid, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Future<?> future = processes.get(pid);
        if (future == null) {
            return true;
        }
        try {
            future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException | CancellationException e) {
            // Logged by runProcess before the future completed
            return true;
        }
    }

    /**
     * Returns the number of processes that have not finished.
     *
     * @return the live process count
     */
    public int liveProcessCount() {
        return processes.size();
    }

    /**
     * Stops the system. Processes still waiting on a channel are interrupted.
     */
    public void shutdown() {
        logger.info("Shutting down process system {} with {} live processes", name, processes.size());
        for (Runnable neverStarted : executor.shutdownNow()) {
            if (neverStarted instanceof Future) {
                ((Future<?>) neverStarted).cancel(false);
            }
        }
        processes.values().removeIf(Future::isDone);
        try {
            int timeoutSeconds = threadPoolFactory.getShutdownTimeoutSeconds();
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                logger.warn("Process system {} did not terminate within {} seconds", name, timeoutSeconds);
            } else {
                logger.info("Process system {} shut down successfully", name);
            }
        } catch (InterruptedException e) {
            logger.error("Process system {} shutdown was interrupted", name, e);
            Thread.currentThread().interrupt();
        }
    }

    public String getName() {
        return name;
    }

    private void runProcess(ProcessId pid, Runnable task) {
        currentPid.set(pid);
        logger.debug("Process {} started", pid);
        try {
            task.run();
        } catch (RuntimeException | Error e) {
            logger.error("Process {} failed", pid, e);
            throw e;
        } finally {
            currentPid.remove();
            processes.remove(pid);
            logger.debug("Process {} finished", pid);
        }
    }

    private ProcessId nextPid() {
        return new ProcessId(name + "-" + pidCounter.incrementAndGet());
    }
}
