package com.algobrain.knowledge.model;

/**
 * 断言校验状态
 *
 * PENDING 只能单向迁移到 HUMAN_VALIDATED 或 HUMAN_REJECTED，其余均为终态
 */
public enum ValidationStatus {
    PENDING,
    HUMAN_VALIDATED,
    HUMAN_REJECTED,
    AUTO_COMMITTED;

    /** 参与状态重建与边投影 */
    public boolean isAccepted() {
        return this == AUTO_COMMITTED || this == HUMAN_VALIDATED;
    }

    /** 已由人工裁定 */
    public boolean isHumanResolved() {
        return this == HUMAN_VALIDATED || this == HUMAN_REJECTED;
    }
}
