package com.algobrain.knowledge.exception;

import java.util.List;

/**
 * 实体消解歧义：多个候选得分在容差内且历史确认数无法区分
 *
 * 不是错误，而是路由决策：事实以待审核状态挂在排名第一的候选上，交由人工裁定
 */
public class AmbiguousResolutionException extends RuntimeException {

    private final String descriptorName;
    private final String provisionalEntityId;
    private final List<String> candidateEntityIds;

    public AmbiguousResolutionException(String descriptorName, String provisionalEntityId,
                                        List<String> candidateEntityIds) {
        super("实体消解存在歧义: " + descriptorName + " -> " + candidateEntityIds);
        this.descriptorName = descriptorName;
        this.provisionalEntityId = provisionalEntityId;
        this.candidateEntityIds = List.copyOf(candidateEntityIds);
    }

    public String getDescriptorName() {
        return descriptorName;
    }

    public String getProvisionalEntityId() {
        return provisionalEntityId;
    }

    public List<String> getCandidateEntityIds() {
        return candidateEntityIds;
    }
}
