package com.algobrain.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 死信记录：重试耗尽的输入原样保存，供人工排查与重放
 */
@Data
@TableName("kb_dead_letters")
public class DeadLetterRecord {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String jobId;

    private String sourceId;

    /** FACT / EVENT */
    private String payloadType;

    /** 原始输入 JSON */
    private String payload;

    private String failureClass;

    private String lastError;

    private Integer attempts;

    private DeadLetterStatus status;

    private LocalDateTime replayedAt;

    @TableField(value = "created_at", fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(value = "updated_at", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public enum DeadLetterStatus {
        PARKED,
        REPLAYED
    }
}
