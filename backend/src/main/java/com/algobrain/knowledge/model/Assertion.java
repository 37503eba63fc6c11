package com.algobrain.knowledge.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 断言：某个来源对某个实体（或实体间关系）的一次主张
 *
 * 内容字段写入后不可变，纠错只能追加新断言；唯一允许的变化是待审核断言的人工裁定结果
 */
@Value
@Builder(toBuilder = true)
public class Assertion {

    String assertionId;

    String subjectEntityId;

    String predicate;

    /** 宾语为实体时的实体ID */
    String objectEntityId;

    /** 宾语为字面量时的取值 */
    String objectLiteral;

    /** 谓词属于关系谓词；只有这类断言被接受后才投影成边 */
    boolean relationship;

    /** 抽取置信度 [0,1] */
    double confidence;

    String sourceId;

    /** 来源声称事实成立的时间，可为空 */
    Instant observedAt;

    /** 入库时间 */
    Instant recordedAt;

    ValidationStatus validationStatus;

    /** 人工裁定时间 */
    Instant resolvedAt;

    String idempotencyKey;

    /** 人工修正时被替代的原断言 */
    String supersedes;

    /** 原始文本引用（报告段落、代码文件等） */
    String sourceTextRef;

    public boolean hasEntityObject() {
        return objectEntityId != null;
    }

    public String objectValue() {
        return objectEntityId != null ? objectEntityId : objectLiteral;
    }

    public boolean isEdgeCandidate() {
        return relationship && objectEntityId != null;
    }

    public boolean isAccepted() {
        return validationStatus != null && validationStatus.isAccepted();
    }
}
