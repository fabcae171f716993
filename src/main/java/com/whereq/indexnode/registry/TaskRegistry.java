package com.whereq.indexnode.registry;

import com.whereq.indexnode.model.IndexBuildResult;
import com.whereq.indexnode.model.IndexState;
import com.whereq.indexnode.model.TaskKey;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * Node-wide registry of index-build and analysis tasks.
 *
 * <p>Task runners register a task when they start it and report state changes and
 * results through the registry; request handlers read state from it and remove tasks
 * once the coordinator has collected them. Both maps are guarded by a single lock so
 * that {@link #hasInProgressTask()} sees a consistent picture across task kinds.
 *
 * <p>Unknown keys are never an error. A task may be removed while its runner is still
 * reporting, so updates to missing tasks are dropped and lookups return
 * {@link IndexState#NONE} or an empty {@link Optional}.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class TaskRegistry {

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock; replaced wholesale by deleteAll*
    private Map<TaskKey, IndexTaskInfo> indexTasks = new HashMap<>();
    private Map<TaskKey, AnalysisTaskInfo> analysisTasks = new HashMap<>();

    // ---------------------------------------------------------------- index tasks

    /**
     * Register an index task unless one is already known under the same key.
     *
     * @return the task already registered under {@code key}, in which case
     *     {@code info} was not stored; empty if {@code info} is now registered
     */
    public Optional<IndexTaskInfo> registerIndexTask(@NonNull TaskKey key, @NonNull IndexTaskInfo info) {
        lock.lock();
        try {
            return Optional.ofNullable(indexTasks.putIfAbsent(key, info));
        } finally {
            lock.unlock();
        }
    }

    public IndexState getIndexTaskState(TaskKey key) {
        lock.lock();
        try {
            IndexTaskInfo info = indexTasks.get(key);
            return info == null ? IndexState.NONE : info.getState();
        } finally {
            lock.unlock();
        }
    }

    public Optional<IndexTaskInfo> getIndexTask(TaskKey key) {
        lock.lock();
        try {
            return Optional.ofNullable(indexTasks.get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overwrite state and fail reason of an index task. Ignored if the task is unknown.
     */
    public void setIndexTaskState(TaskKey key, @NonNull IndexState state, String failReason) {
        lock.lock();
        try {
            IndexTaskInfo info = indexTasks.get(key);
            if (info != null) {
                log.debug("Store index task state: task={}, state={}, failReason={}", key, state, failReason);
                info.setState(state);
                info.setFailReason(failReason);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attach the output of a finished build. File keys and statistics are copied,
     * so the caller may reuse its buffers afterwards. Ignored if the task is unknown.
     */
    public void attachIndexResult(TaskKey key, @NonNull IndexBuildResult result) {
        List<String> fileKeys = result.getFileKeys() == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(result.getFileKeys()));
        lock.lock();
        try {
            IndexTaskInfo info = indexTasks.get(key);
            if (info == null) {
                return;
            }
            info.setFileKeys(fileKeys);
            info.setSerializedSize(result.getSerializedSize());
            info.setStatistic(result.getStatistic() == null ? null : result.getStatistic().copy());
            info.setCurrentIndexVersion(result.getCurrentIndexVersion());
            if (result.getIndexStoreVersion() != null) {
                info.setIndexStoreVersion(result.getIndexStoreVersion());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Call {@code action} for every index task while holding the registry lock.
     * The action must not call back into the registry.
     */
    public void forEachIndexTask(BiConsumer<TaskKey, IndexTaskInfo> action) {
        lock.lock();
        try {
            indexTasks.forEach(action);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the given index tasks. Keys without a task are skipped.
     *
     * @return the removed tasks, in the order their keys were given
     */
    public List<ReleasedTask<IndexTaskInfo>> deleteIndexTasks(Collection<TaskKey> keys) {
        lock.lock();
        try {
            return removeAll(indexTasks, keys, "index");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every index task.
     */
    public List<ReleasedTask<IndexTaskInfo>> deleteAllIndexTasks() {
        Map<TaskKey, IndexTaskInfo> deleted;
        lock.lock();
        try {
            deleted = indexTasks;
            indexTasks = new HashMap<>();
        } finally {
            lock.unlock();
        }
        log.info("Deleted all {} index tasks", deleted.size());
        return release(deleted);
    }

    public int indexTaskCount() {
        lock.lock();
        try {
            return indexTasks.size();
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------- analysis tasks

    /**
     * Register an analysis task unless one is already known under the same key.
     *
     * @return the task already registered under {@code key}, in which case
     *     {@code info} was not stored; empty if {@code info} is now registered
     */
    public Optional<AnalysisTaskInfo> registerAnalysisTask(@NonNull TaskKey key, @NonNull AnalysisTaskInfo info) {
        lock.lock();
        try {
            return Optional.ofNullable(analysisTasks.putIfAbsent(key, info));
        } finally {
            lock.unlock();
        }
    }

    public IndexState getAnalysisTaskState(TaskKey key) {
        lock.lock();
        try {
            AnalysisTaskInfo info = analysisTasks.get(key);
            return info == null ? IndexState.NONE : info.getState();
        } finally {
            lock.unlock();
        }
    }

    public Optional<AnalysisTaskInfo> getAnalysisTask(TaskKey key) {
        lock.lock();
        try {
            return Optional.ofNullable(analysisTasks.get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overwrite state and fail reason of an analysis task. Ignored if the task is unknown.
     */
    public void setAnalysisTaskState(TaskKey key, @NonNull IndexState state, String failReason) {
        lock.lock();
        try {
            AnalysisTaskInfo info = analysisTasks.get(key);
            if (info != null) {
                log.info("Store analysis task state: task={}, state={}, failReason={}", key, state, failReason);
                info.setState(state);
                info.setFailReason(failReason);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attach the output of a finished analysis. The mapping is stored as given, not
     * copied; the caller hands it over and must not modify it afterwards.
     * Ignored if the task is unknown.
     */
    public void attachAnalysisResult(TaskKey key, String centroidsFile, Map<Long, String> segmentsOffsetMapping) {
        lock.lock();
        try {
            AnalysisTaskInfo info = analysisTasks.get(key);
            if (info != null) {
                info.setCentroidsFile(centroidsFile);
                info.setSegmentsOffsetMapping(segmentsOffsetMapping);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Call {@code action} for every analysis task while holding the registry lock.
     * The action must not call back into the registry.
     */
    public void forEachAnalysisTask(BiConsumer<TaskKey, AnalysisTaskInfo> action) {
        lock.lock();
        try {
            analysisTasks.forEach(action);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the given analysis tasks. Keys without a task are skipped.
     *
     * @return the removed tasks, in the order their keys were given
     */
    public List<ReleasedTask<AnalysisTaskInfo>> deleteAnalysisTasks(Collection<TaskKey> keys) {
        lock.lock();
        try {
            return removeAll(analysisTasks, keys, "analysis");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every analysis task.
     */
    public List<ReleasedTask<AnalysisTaskInfo>> deleteAllAnalysisTasks() {
        Map<TaskKey, AnalysisTaskInfo> deleted;
        lock.lock();
        try {
            deleted = analysisTasks;
            analysisTasks = new HashMap<>();
        } finally {
            lock.unlock();
        }
        log.info("Deleted all {} analysis tasks", deleted.size());
        return release(deleted);
    }

    public int analysisTaskCount() {
        lock.lock();
        try {
            return analysisTasks.size();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- aggregates

    /**
     * Whether any task of either kind is currently {@link IndexState#IN_PROGRESS}.
     */
    public boolean hasInProgressTask() {
        lock.lock();
        try {
            return countInProgress(indexTasks) > 0 || countInProgress(analysisTasks) > 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of tasks of either kind currently {@link IndexState#IN_PROGRESS}.
     */
    public int inProgressTaskCount() {
        lock.lock();
        try {
            return countInProgress(indexTasks) + countInProgress(analysisTasks);
        } finally {
            lock.unlock();
        }
    }

    private static int countInProgress(Map<TaskKey, ? extends TaskInfo> tasks) {
        int count = 0;
        for (TaskInfo info : tasks.values()) {
            if (info.getState() == IndexState.IN_PROGRESS) {
                count++;
            }
        }
        return count;
    }

    private static <T extends TaskInfo> List<ReleasedTask<T>> removeAll(
            Map<TaskKey, T> tasks, Collection<TaskKey> keys, String kind) {
        List<ReleasedTask<T>> deleted = new ArrayList<>(keys.size());
        for (TaskKey key : keys) {
            T info = tasks.remove(key);
            if (info != null) {
                deleted.add(new ReleasedTask<>(key, info));
                log.info("Deleted {} task {}", kind, key);
            }
        }
        return deleted;
    }

    private static <T extends TaskInfo> List<ReleasedTask<T>> release(Map<TaskKey, T> tasks) {
        List<ReleasedTask<T>> released = new ArrayList<>(tasks.size());
        tasks.forEach((key, info) -> released.add(new ReleasedTask<>(key, info)));
        return released;
    }
}
