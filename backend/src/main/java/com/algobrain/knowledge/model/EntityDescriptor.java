package com.algobrain.knowledge.model;

import lombok.Builder;
import lombok.Value;

/**
 * 候选事实中对实体的描述（主语或宾语）
 */
@Value
@Builder(toBuilder = true)
public class EntityDescriptor {

    String name;

    String normalizedName;

    EntityType typeTag;

    /** 外部标识，统一大写 */
    String externalId;

    /** 上下文文本（描述、所在句子），参与相似度检索 */
    String contextText;

    /** 人工指定的实体ID，指定后跳过候选生成 */
    String pinnedEntityId;

    /**
     * 原子创建唯一键：有外部标识时与类型无关，否则按 类型|归一化名称
     */
    public String creationKey() {
        if (externalId != null) {
            return "ext:" + externalId;
        }
        return (typeTag == null ? EntityType.UNKNOWN : typeTag).name() + "|" + normalizedName;
    }

    /**
     * 幂等键中使用的身份部分，与图谱状态无关
     */
    public String identityKey() {
        if (pinnedEntityId != null) {
            return "id:" + pinnedEntityId;
        }
        return externalId != null ? "ext:" + externalId : "name:" + normalizedName;
    }

    public String searchText() {
        if (contextText == null || contextText.isBlank()) {
            return name;
        }
        return name + " " + contextText;
    }
}
