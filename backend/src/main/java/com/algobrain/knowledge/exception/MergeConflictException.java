package com.algobrain.knowledge.exception;

/**
 * 实体合并冲突（目标重叠、已被合并或形成环）
 */
public class MergeConflictException extends RuntimeException {

    public MergeConflictException(String message) {
        super(message);
    }
}
