package com.algobrain.knowledge.model;

import lombok.Builder;
import lombok.Value;

/**
 * 边投影：已接受的关系型断言的读优化视图，断言日志才是权威数据
 */
@Value
@Builder(toBuilder = true)
public class MaterializedEdge {
    String fromEntityId;
    String edgeType;
    String toEntityId;
    String assertionId;
    String sourceId;
    double confidence;
}
