package com.whereq.indexnode.service;

import com.whereq.indexnode.config.IndexNodeProperties;
import com.whereq.indexnode.model.IndexState;
import com.whereq.indexnode.registry.TaskRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Waits, for a bounded time, until no task in the {@link TaskRegistry} is in progress.
 *
 * <p>Used on the shutdown path. The drainer only observes: it never cancels tasks,
 * and running past the timeout is logged, not treated as a failure. A drain that
 * completes in time logs nothing.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class TaskDrainer {

    private final TaskRegistry taskRegistry;
    private final Duration timeout;
    private final Duration pollInterval;

    // released when the node lifecycle ends before the drain does
    private final CountDownLatch aborted = new CountDownLatch(1);

    @Autowired
    public TaskDrainer(TaskRegistry taskRegistry, IndexNodeProperties properties) {
        this(taskRegistry, properties.getGracefulStopTimeout(), properties.getDrainPollInterval());
    }

    public TaskDrainer(TaskRegistry taskRegistry, Duration timeout, Duration pollInterval) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Graceful stop timeout must not be negative: " + timeout);
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Drain poll interval must be positive: " + pollInterval);
        }
        this.taskRegistry = taskRegistry;
        this.timeout = timeout;
        this.pollInterval = pollInterval;
    }

    /**
     * Block until no task is in progress or the timeout elapses.
     *
     * @return true if all tasks left the in-progress state, false on timeout or abort
     */
    public boolean awaitTaskCompletion() {
        if (!taskRegistry.hasInProgressTask()) {
            return true;
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                if (aborted.await(Math.min(pollInterval.toNanos(), remaining), TimeUnit.NANOSECONDS)) {
                    log.info("Node lifecycle ended, no longer waiting for tasks");
                    break;
                }
                if (!taskRegistry.hasInProgressTask()) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-progress tasks");
        }

        reportInProgressTasks();
        return false;
    }

    /**
     * End a running or future {@link #awaitTaskCompletion()} early, through the timeout path.
     *
     * <p>Not tied to the Spring context: the drain itself runs while the context closes.
     * Whoever owns the node process calls this when it must stop without waiting any
     * longer, for example from a second termination signal or a supervisor deadline.
     */
    public void abort() {
        aborted.countDown();
    }

    private void reportInProgressTasks() {
        log.warn("Timeout, the index node still has {} in-progress tasks", taskRegistry.inProgressTaskCount());
        taskRegistry.forEachIndexTask((key, info) -> {
            if (info.getState() == IndexState.IN_PROGRESS) {
                log.warn("In-progress index task {}: {}", key, info);
            }
        });
        taskRegistry.forEachAnalysisTask((key, info) -> {
            if (info.getState() == IndexState.IN_PROGRESS) {
                log.warn("In-progress analysis task {}: {}", key, info);
            }
        });
    }
}
