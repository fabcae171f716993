package com.whereq.indexnode.registry;

import com.whereq.indexnode.model.CancelHandle;
import com.whereq.indexnode.model.IndexState;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Map;

/**
 * Bookkeeping for one analysis task: the centroids it computed and, per segment,
 * the file holding that segment's offsets.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString(callSuper = true)
public class AnalysisTaskInfo extends TaskInfo {

    private String centroidsFile = "";

    @ToString.Exclude
    private Map<Long, String> segmentsOffsetMapping = Map.of();

    @Setter(AccessLevel.NONE)
    private final long indexStoreVersion;

    public AnalysisTaskInfo(CancelHandle cancelHandle, IndexState state) {
        this(cancelHandle, state, 0L);
    }

    public AnalysisTaskInfo(CancelHandle cancelHandle, IndexState state, long indexStoreVersion) {
        super(cancelHandle, state);
        this.indexStoreVersion = indexStoreVersion;
    }
}
