package com.algobrain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 抽取器/结构化订阅源输出的原始候选事实
 *
 * 字段可能缺失或脏，由 RecordNormalizer 校验后转为 CandidateFact
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RawCandidateFact {

    private String subject;
    private String subjectType;
    private String subjectExternalId;
    /** 人工指定主语实体 */
    private String subjectEntityId;

    private String predicate;

    private String object;
    private String objectType;
    private String objectExternalId;
    private String objectEntityId;
    /** 强制宾语按字面量处理 */
    private Boolean objectIsLiteral;

    /** 上下文句子，参与消歧 */
    private String context;

    private String sourceId;
    private Double confidence;
    private Instant observedAt;
    private String sourceTextRef;

    /** STRUCTURED_FEED / LLM_EXTRACTION / CODE_ANALYSIS / MANUAL */
    private String origin;
}
