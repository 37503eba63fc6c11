package com.algobrain.knowledge.model;

import java.util.Locale;

/**
 * 实体领域类型（封闭集合）
 */
public enum EntityType {
    TOOL,
    MALWARE,
    VULNERABILITY,
    TECHNIQUE,
    TACTIC,
    ACTOR,
    CAMPAIGN,
    MITIGATION,
    PAYLOAD,
    DATA_SOURCE,
    DATA_COMPONENT,
    INDICATOR,
    UNKNOWN;

    /**
     * 宽松解析，无法识别时返回 UNKNOWN
     */
    public static EntityType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (EntityType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * UNKNOWN 与任何类型兼容
     */
    public boolean isCompatibleWith(EntityType other) {
        return this == UNKNOWN || other == null || other == UNKNOWN || this == other;
    }
}
