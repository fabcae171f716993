package com.whereq.indexnode.service;

import com.whereq.indexnode.registry.ReleasedTask;
import com.whereq.indexnode.registry.TaskRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.util.List;

/**
 * Shuts the node's task bookkeeping down: drains in-progress tasks, then removes
 * every task from the registry and cancels whatever is still running.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class IndexNodeShutdown {

    private final TaskRegistry taskRegistry;
    private final TaskDrainer taskDrainer;

    @Autowired
    public IndexNodeShutdown(TaskRegistry taskRegistry, TaskDrainer taskDrainer) {
        this.taskRegistry = taskRegistry;
        this.taskDrainer = taskDrainer;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down index node tasks");

        boolean drained = taskDrainer.awaitTaskCompletion();
        if (!drained) {
            log.warn("Proceeding with shutdown while tasks are still in progress");
        }

        cancelAll(taskRegistry.deleteAllIndexTasks());
        cancelAll(taskRegistry.deleteAllAnalysisTasks());

        log.info("Index node tasks shut down");
    }

    private void cancelAll(List<? extends ReleasedTask<?>> tasks) {
        for (ReleasedTask<?> task : tasks) {
            try {
                task.cancel();
            } catch (RuntimeException e) {
                log.error("Error cancelling task {}", task.getKey(), e);
            }
        }
    }
}
