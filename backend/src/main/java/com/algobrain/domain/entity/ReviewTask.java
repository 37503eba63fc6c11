package com.algobrain.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 人工审核任务，包装一条待审核断言
 *
 * 队列按 priority（即置信度）升序、入队时间升序出队，置信度最低的最先审核
 */
@Data
@TableName("kb_review_tasks")
public class ReviewTask {

    @TableId(type = IdType.AUTO)
    private Long id;

    /** 被审核的断言 */
    private String assertionId;

    private String sourceId;

    /** 入队原因 */
    private ReviewReason reason;

    /** 优先级，取断言置信度 */
    private Double priority;

    /** 歧义消解时的候选实体，逗号分隔 */
    private String candidateEntityIds;

    private TaskStatus status;

    private LocalDateTime enqueuedAt;

    private LocalDateTime resolvedAt;

    private ReviewDecision resolution;

    private String reviewer;

    private String note;

    /** 人工修正后新写入的断言 */
    private String correctedAssertionId;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public boolean isOpen() {
        return status == TaskStatus.OPEN;
    }

    public enum ReviewReason {
        /** 置信度低于阈值 */
        LOW_CONFIDENCE,
        /** 实体消解存在歧义 */
        AMBIGUOUS_RESOLUTION
    }

    public enum TaskStatus {
        OPEN,
        RESOLVED
    }

    public enum ReviewDecision {
        ACCEPT,
        REJECT,
        EDIT
    }
}
