package com.algobrain.knowledge.model;

import lombok.Value;

/**
 * 事件参与实体及其角色
 */
@Value
public class EventParticipant {
    String entityId;
    String role;
}
