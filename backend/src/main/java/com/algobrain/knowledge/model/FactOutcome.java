package com.algobrain.knowledge.model;

/**
 * 单条输入在入库流水线中的最终去向
 */
public enum FactOutcome {
    AUTO_COMMITTED,
    QUEUED_FOR_REVIEW,
    DUPLICATE,
    EVENT_RECORDED,
    MALFORMED,
    DEAD_LETTERED,
    /** 重试耗尽且死信也没能保存，原始输入只留在错误日志里 */
    PARK_FAILED,
    ABANDONED
}
