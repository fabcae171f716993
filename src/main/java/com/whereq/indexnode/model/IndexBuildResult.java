package com.whereq.indexnode.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of a finished index build, as handed to the registry by the build task.
 */
@Value
@Builder
public class IndexBuildResult {
    /**
     * Identifiers of the index files written to the object store
     */
    List<String> fileKeys;

    /**
     * Total size of the serialized index, in bytes, as an unsigned 64-bit value.
     * Sizes above {@link Long#MAX_VALUE} read as negative; use
     * {@link Long#toUnsignedString(long)} or {@link Long#compareUnsigned(long, long)}.
     */
    long serializedSize;

    JobInfo statistic;

    int currentIndexVersion;

    /**
     * Storage format version of the written files. Coordinators predating
     * versioned storage do not send it; {@code null} keeps the recorded value.
     */
    Long indexStoreVersion;
}
