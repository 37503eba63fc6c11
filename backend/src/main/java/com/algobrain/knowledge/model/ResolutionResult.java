package com.algobrain.knowledge.model;

import lombok.Value;

import java.util.List;

/**
 * 实体消解结果
 */
@Value
public class ResolutionResult {

    public enum Outcome {
        /** 匹配到已有实体 */
        MATCHED,
        /** 新建实体 */
        CREATED,
        /** 加锁后发现并发线程已创建，直接采用 */
        ADOPTED,
        /** 人工指定 */
        PINNED
    }

    String entityId;
    Outcome outcome;
    double score;
    List<ScoredCandidate> candidates;
}
