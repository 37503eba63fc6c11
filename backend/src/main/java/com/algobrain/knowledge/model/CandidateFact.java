package com.algobrain.knowledge.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 归一化后的候选事实（固定结构）
 *
 * 宾语要么是实体描述（object 非空），要么是字面量（objectLiteral 非空）
 */
@Value
@Builder(toBuilder = true)
public class CandidateFact {

    EntityDescriptor subject;

    String predicate;

    EntityDescriptor object;

    String objectLiteral;

    /** 谓词表示实体间关系 */
    boolean relationship;

    String sourceId;

    double confidence;

    Instant observedAt;

    String sourceTextRef;

    FactOrigin origin;

    public boolean hasEntityObject() {
        return object != null;
    }
}
