package com.algobrain.knowledge.model;

import lombok.Builder;
import lombok.Value;

/**
 * 批量入库汇总，任何输入都会落入其中一个计数
 */
@Value
@Builder
public class IngestionSummary {
    String jobId;
    String status;
    int total;
    int autoCommitted;
    int queuedForReview;
    int duplicates;
    int eventsRecorded;
    int malformed;
    int deadLettered;
    int parkFailed;
    int abandoned;

    /** 已写入证据库（含待审核）的数量 */
    public int getCommitted() {
        return autoCommitted + queuedForReview + eventsRecorded;
    }
}
