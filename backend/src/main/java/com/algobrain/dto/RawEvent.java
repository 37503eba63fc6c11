package com.algobrain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 原始时间线事件
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RawEvent {

    private String eventType;
    private Instant startTime;
    private Instant endTime;
    private List<Participant> participants;
    private String sourceId;
    private String description;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Participant {
        private String name;
        private String type;
        private String externalId;
        private String entityId;
        /** 角色，如 target / actor */
        private String role;
    }
}
