package com.whereq.indexnode.registry;

import com.whereq.indexnode.model.CancelHandle;
import com.whereq.indexnode.model.IndexState;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;

/**
 * State shared by every kind of task tracked in the {@link TaskRegistry}.
 * Readable by anyone holding a reference; mutated only by the registry, under its lock.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString
public abstract class TaskInfo {

    @Setter(AccessLevel.NONE)
    @ToString.Exclude
    private final CancelHandle cancelHandle;

    private IndexState state;

    private String failReason = "";

    protected TaskInfo(@NonNull CancelHandle cancelHandle, @NonNull IndexState state) {
        this.cancelHandle = cancelHandle;
        this.state = state;
    }
}
