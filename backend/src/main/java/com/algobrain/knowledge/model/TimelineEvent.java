package com.algobrain.knowledge.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 时间线事件（披露、利用、修补等），写入后不可变
 */
@Value
@Builder(toBuilder = true)
public class TimelineEvent {

    String eventId;

    /** 事件类型，统一大写 */
    String eventType;

    Instant startTime;

    Instant endTime;

    List<EventParticipant> participants;

    String sourceId;

    String description;

    Instant recordedAt;

    /** 存储分配的单调递增写入序号 */
    long sequence;

    String idempotencyKey;

    /**
     * 有效时间：结束时间优先，否则开始时间
     */
    public Instant effectiveTime() {
        return endTime != null ? endTime : startTime;
    }

    public boolean involves(String entityId) {
        return participants != null && participants.stream().anyMatch(p -> p.getEntityId().equals(entityId));
    }
}
