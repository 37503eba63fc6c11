package com.algobrain.knowledge.service.similarity;

import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.SimilarityHit;

import java.util.List;

/**
 * 相似度检索服务
 *
 * 返回的实体ID可能已被合并，调用方负责沿合并指针解析
 */
public interface SimilarityService {

    /**
     * 按文本检索最相近的 k 个实体，按得分降序
     *
     * @throws com.algobrain.knowledge.exception.RetryableResolutionFailure 服务超时或不可用
     */
    List<SimilarityHit> nearest(String text, int k);

    /**
     * 新实体入库后登记到相似度索引
     */
    void index(GraphEntity entity);
}
