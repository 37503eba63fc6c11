package com.algobrain.knowledge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 相似度服务返回的近邻
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityHit {
    private String entityId;
    private double score;
}
