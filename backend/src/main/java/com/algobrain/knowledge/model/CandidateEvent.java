package com.algobrain.knowledge.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 归一化后的候选事件，参与者尚未消解
 */
@Value
@Builder
public class CandidateEvent {

    /** 统一大写 */
    String eventType;

    Instant startTime;

    Instant endTime;

    List<Participant> participants;

    String sourceId;

    String description;

    @Value
    public static class Participant {
        EntityDescriptor descriptor;
        String role;
    }
}
