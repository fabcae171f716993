package com.whereq.indexnode.registry;

import com.whereq.indexnode.model.TaskKey;
import lombok.Getter;
import lombok.ToString;

/**
 * A task removed from the {@link TaskRegistry}. The registry no longer holds it;
 * the receiver decides whether the work behind it must be cancelled.
 *
 * @param <T> kind of task
 */
@Getter
@ToString
public final class ReleasedTask<T extends TaskInfo> {

    private final TaskKey key;

    private final T info;

    ReleasedTask(TaskKey key, T info) {
        this.key = key;
        this.info = info;
    }

    /**
     * Invoke the cancel handle the task was registered with.
     */
    public void cancel() {
        info.getCancelHandle().cancel();
    }
}
