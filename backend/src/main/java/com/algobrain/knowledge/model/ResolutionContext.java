package com.algobrain.knowledge.model;

import lombok.Builder;
import lombok.Value;

/**
 * 消歧上下文：所在事实、来源可信度、对端实体
 */
@Value
@Builder(toBuilder = true)
public class ResolutionContext {
    String sourceId;
    double sourceReliability;
    String predicate;
    /** 事实另一端已消解的实体ID，可为空 */
    String counterpartEntityId;
}
