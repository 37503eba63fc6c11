package com.algobrain.knowledge.model;

import lombok.Value;

import java.time.Instant;

/**
 * 实体在某时刻的派生状态
 */
@Value
public class StateSnapshot {
    String entityId;
    Instant asOf;
    String state;
    /** 决定状态的事件，无则为空 */
    String eventId;
    String eventType;
    Instant effectiveTime;
}
