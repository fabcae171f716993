package com.whereq.indexnode.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Identifies a task on this node: the cluster that issued it plus the task id
 * (build id for index tasks) inside that cluster.
 */
@Value
public class TaskKey {
    @NonNull
    String clusterId;

    long taskId;

    public static TaskKey of(String clusterId, long taskId) {
        return new TaskKey(clusterId, taskId);
    }
}
