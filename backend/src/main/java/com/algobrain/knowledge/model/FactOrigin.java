package com.algobrain.knowledge.model;

/**
 * 候选事实来源类别
 */
public enum FactOrigin {
    /** 结构化情报源（STIX/ATT&CK 等）三元组 */
    STRUCTURED_FEED,
    /** 大模型从文本抽取 */
    LLM_EXTRACTION,
    /** 漏洞利用代码分析 */
    CODE_ANALYSIS,
    /** 人工录入或审核修正 */
    MANUAL
}
