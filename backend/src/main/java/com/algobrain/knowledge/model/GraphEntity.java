package com.algobrain.knowledge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 规范实体节点
 *
 * 一个现实对象只对应一个活跃实体；实体从不删除，只会被合并（mergedInto 指向存活实体）
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GraphEntity {

    /**
     * 实体ID，首次消解时分配，永不复用
     */
    private String entityId;

    /**
     * 领域类型
     */
    private EntityType typeTag;

    /**
     * 规范名称
     */
    private String canonicalName;

    /**
     * 归一化名称（用于精确匹配）
     */
    private String normalizedName;

    /**
     * 外部标识（CVE编号、ATT&CK技术编号等），可为空
     */
    private String externalId;

    /**
     * 描述文本（相似度索引使用）
     */
    private String description;

    /**
     * 自由属性
     */
    @Builder.Default
    private Map<String, Object> properties = new HashMap<>();

    /**
     * 合并指针，非空表示该实体已并入其他实体
     */
    private String mergedInto;

    /**
     * 原子创建所用的唯一键
     */
    private String creationKey;

    private Instant createdAt;

    public boolean isMerged() {
        return mergedInto != null;
    }

    /**
     * 浅拷贝，属性表单独复制，避免调用方改动存储内对象
     */
    public GraphEntity copy() {
        return toBuilder()
            .properties(properties == null ? new HashMap<>() : new HashMap<>(properties))
            .build();
    }
}
