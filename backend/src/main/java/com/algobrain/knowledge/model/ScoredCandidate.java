package com.algobrain.knowledge.model;

import lombok.Value;

/**
 * 消歧打分后的候选实体
 */
@Value
public class ScoredCandidate {
    String entityId;
    double score;
    long confirmationCount;
}
