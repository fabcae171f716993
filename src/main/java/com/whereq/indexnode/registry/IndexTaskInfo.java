package com.whereq.indexnode.registry;

import com.whereq.indexnode.model.CancelHandle;
import com.whereq.indexnode.model.IndexState;
import com.whereq.indexnode.model.JobInfo;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * Bookkeeping for one index-build task.
 * File keys and statistics are only filled in once the build has finished.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString(callSuper = true)
public class IndexTaskInfo extends TaskInfo {

    private List<String> fileKeys = List.of();

    // unsigned, see IndexBuildResult#getSerializedSize
    private long serializedSize;

    private int currentIndexVersion;

    private long indexStoreVersion;

    @Getter(AccessLevel.NONE)
    private JobInfo statistic;

    public IndexTaskInfo(CancelHandle cancelHandle, IndexState state) {
        super(cancelHandle, state);
    }

    /**
     * Copy of the build statistics, or {@code null} before the result is attached.
     */
    public JobInfo getStatistic() {
        return statistic == null ? null : statistic.copy();
    }
}
