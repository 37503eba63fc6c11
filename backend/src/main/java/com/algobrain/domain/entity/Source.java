package com.algobrain.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 情报来源实体（报告、订阅源、工具运行）
 *
 * 首次入库时登记；可信度只由可信度追踪任务更新；从不删除
 */
@Data
@TableName("kb_sources")
public class Source {

    /** 来源ID，由调用方指定（如 mitre-attack） */
    @TableId(type = IdType.INPUT)
    private String sourceId;

    /** 展示名称 */
    private String displayName;

    /** 来源类别 */
    private SourceKind sourceKind;

    /** 可信度 [0,1] */
    private Double reliabilityScore;

    /** 最近一次计算使用的已裁定断言数 */
    private Integer resolvedCount;

    /** 最近一次重算时间 */
    private LocalDateTime lastRecomputedAt;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    /**
     * 来源类别
     */
    public enum SourceKind {
        STRUCTURED_FEED,
        LLM_EXTRACTION,
        CODE_ANALYSIS,
        MANUAL
    }
}
