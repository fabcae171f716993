package com.whereq.indexnode.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Statistics of a finished index build, reported back to the coordinator
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobInfo {
    /**
     * Number of rows indexed
     */
    private long numRows;

    /**
     * Vector dimension
     */
    private long dim;

    /**
     * Build start, epoch millis
     */
    private long startTime;

    /**
     * Build end, epoch millis
     */
    private long endTime;

    private String indexType;

    /**
     * Index parameters the build ran with
     */
    @Builder.Default
    private List<Param> indexParams = new ArrayList<>();

    /**
     * Node that ran the build
     */
    private long podId;

    /**
     * Deep copy, sharing nothing mutable with this instance.
     */
    public JobInfo copy() {
        List<Param> params = new ArrayList<>(indexParams == null ? 0 : indexParams.size());
        if (indexParams != null) {
            for (Param param : indexParams) {
                params.add(new Param(param.getKey(), param.getValue()));
            }
        }
        return new JobInfo(numRows, dim, startTime, endTime, indexType, params, podId);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Param {
        private String key;
        private String value;
    }
}
