package com.algobrain.knowledge.model;

import lombok.Value;

/**
 * 候选生成阶段召回的实体
 */
@Value
public class ResolutionCandidate {
    GraphEntity entity;
    /** 相似度服务得分，非相似度召回时为 0 */
    double similarity;
    /** 由名称索引（含别名）召回 */
    boolean nameIndexHit;

    public String getEntityId() {
        return entity.getEntityId();
    }
}
