package com.algobrain.knowledge.model;

import lombok.Value;

/**
 * 追加写入结果；duplicate 为 true 时 record 是按幂等键找到的既有记录
 */
@Value
public class CommitResult<T> {
    T record;
    boolean duplicate;

    public static <T> CommitResult<T> created(T record) {
        return new CommitResult<>(record, false);
    }

    public static <T> CommitResult<T> duplicate(T record) {
        return new CommitResult<>(record, true);
    }
}
