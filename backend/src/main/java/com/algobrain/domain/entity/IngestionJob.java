package com.algobrain.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 批量入库任务（一次上传的数据集对应一个任务）
 */
@Data
@TableName("kb_ingestion_jobs")
public class IngestionJob {

    @TableId(type = IdType.INPUT)
    private String jobId;

    /** 主来源 */
    private String sourceId;

    private JobStatus status;

    private Integer totalCount;

    private Integer autoCommittedCount;

    private Integer queuedCount;

    private Integer duplicateCount;

    private Integer eventCount;

    private Integer malformedCount;

    private Integer deadLetteredCount;

    private Integer parkFailedCount;

    private Integer abandonedCount;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public enum JobStatus {
        RUNNING,
        COMPLETED,
        CANCELLED,
        FAILED
    }
}
