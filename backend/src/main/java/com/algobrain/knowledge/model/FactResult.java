package com.algobrain.knowledge.model;

import lombok.Value;

/**
 * 单条事实/事件的处理结果
 */
@Value
public class FactResult {
    FactOutcome outcome;
    /** 写入或命中的断言/事件ID */
    String recordId;
    /** 失败原因（格式错误、重试耗尽） */
    String error;
    /** 重试耗尽时的异常类别 */
    String failureClass;
    int attempts;

    public static FactResult of(FactOutcome outcome, String recordId) {
        return new FactResult(outcome, recordId, null, null, 1);
    }

    public static FactResult malformed(String error) {
        return new FactResult(FactOutcome.MALFORMED, null, error, "MalformedRecordException", 1);
    }

    public static FactResult deadLettered(String error, String failureClass, int attempts) {
        return new FactResult(FactOutcome.DEAD_LETTERED, null, error, failureClass, attempts);
    }
}
