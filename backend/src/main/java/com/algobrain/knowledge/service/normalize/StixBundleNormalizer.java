package com.algobrain.knowledge.service.normalize;

import com.algobrain.dto.RawCandidateFact;
import com.algobrain.knowledge.exception.MalformedRecordException;
import com.algobrain.knowledge.model.EntityType;
import com.algobrain.knowledge.model.FactOrigin;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * STIX 2.x bundle 转候选事实
 *
 * 每个领域对象产生 has-stix-id（以及 has-description）字面量事实，
 * relationship 对象产生实体间关系事实，攻击技术的 kill_chain_phases 产生 belongs-to 事实。
 * 攻击技术的 x_mitre_data_sources（"数据源: 数据组件"）产生 组件 detects 技术、数据源 has-component 组件 两条事实
 */
@Slf4j
@Component
public class StixBundleNormalizer {

    public static final String PREDICATE_STIX_ID = "has-stix-id";
    public static final String PREDICATE_DESCRIPTION = "has-description";
    public static final String PREDICATE_TACTIC = "belongs-to";
    public static final String PREDICATE_DETECTS = "detects";
    public static final String PREDICATE_HAS_COMPONENT = "has-component";

    private static final Map<String, EntityType> SDO_TYPES = new LinkedHashMap<>();

    private static final Set<String> EXTERNAL_ID_SOURCES = Set.of("mitre-attack", "cve", "mitre-mobile-attack",
        "mitre-ics-attack");

    static {
        SDO_TYPES.put("attack-pattern", EntityType.TECHNIQUE);
        SDO_TYPES.put("malware", EntityType.MALWARE);
        SDO_TYPES.put("tool", EntityType.TOOL);
        SDO_TYPES.put("intrusion-set", EntityType.ACTOR);
        SDO_TYPES.put("threat-actor", EntityType.ACTOR);
        SDO_TYPES.put("campaign", EntityType.CAMPAIGN);
        SDO_TYPES.put("course-of-action", EntityType.MITIGATION);
        SDO_TYPES.put("vulnerability", EntityType.VULNERABILITY);
        SDO_TYPES.put("x-mitre-tactic", EntityType.TACTIC);
        SDO_TYPES.put("x-mitre-data-source", EntityType.DATA_SOURCE);
        SDO_TYPES.put("x-mitre-data-component", EntityType.DATA_COMPONENT);
        SDO_TYPES.put("indicator", EntityType.INDICATOR);
    }

    public List<RawCandidateFact> toCandidateFacts(JsonNode bundle, String sourceId) {
        if (bundle == null || !"bundle".equals(bundle.path("type").asText())
            || !bundle.path("objects").isArray()) {
            throw new MalformedRecordException("不是合法的STIX bundle", sourceId);
        }

        Map<String, StixObject> objects = new LinkedHashMap<>();
        List<JsonNode> relationships = new ArrayList<>();
        int skipped = 0;

        for (JsonNode node : bundle.path("objects")) {
            String type = node.path("type").asText();
            if (isRevokedOrDeprecated(node)) {
                skipped++;
                continue;
            }
            if ("relationship".equals(type)) {
                relationships.add(node);
                continue;
            }
            EntityType entityType = SDO_TYPES.get(type);
            if (entityType == null || StringUtils.isBlank(node.path("name").asText(null))) {
                continue;
            }
            objects.put(node.path("id").asText(), new StixObject(node, entityType, externalId(node)));
        }

        Map<String, StixObject> dataSourcesByName = byName(objects, EntityType.DATA_SOURCE);
        Map<String, StixObject> componentsByName = byName(objects, EntityType.DATA_COMPONENT);
        Set<String> componentLinks = new HashSet<>();

        List<RawCandidateFact> facts = new ArrayList<>();
        for (StixObject obj : objects.values()) {
            facts.add(literalFact(obj, PREDICATE_STIX_ID, obj.stixId(), sourceId));
            String description = obj.node.path("description").asText(null);
            if (StringUtils.isNotBlank(description)) {
                facts.add(literalFact(obj, PREDICATE_DESCRIPTION, description, sourceId));
            }
            if (obj.type == EntityType.TECHNIQUE) {
                facts.addAll(tacticFacts(obj, sourceId));
                facts.addAll(detectionFacts(obj, dataSourcesByName, componentsByName, componentLinks, sourceId));
            }
            if (obj.type == EntityType.DATA_COMPONENT) {
                StixObject dataSource = objects.get(obj.node.path("x_mitre_data_source_ref").asText());
                if (dataSource != null && componentLinks.add(dataSource.stixId() + "|" + obj.stixId())) {
                    facts.add(linkFact(dataSource, PREDICATE_HAS_COMPONENT, obj, obj.node, sourceId));
                }
            }
        }

        int dangling = 0;
        for (JsonNode rel : relationships) {
            StixObject from = objects.get(rel.path("source_ref").asText());
            StixObject to = objects.get(rel.path("target_ref").asText());
            String relType = rel.path("relationship_type").asText(null);
            if (from == null || to == null || StringUtils.isBlank(relType)) {
                dangling++;
                continue;
            }
            facts.add(RawCandidateFact.builder()
                .subject(from.name())
                .subjectType(from.type.name())
                .subjectExternalId(from.externalId)
                .predicate(relType)
                .object(to.name())
                .objectType(to.type.name())
                .objectExternalId(to.externalId)
                .context(rel.path("description").asText(null))
                .sourceId(sourceId)
                .confidence(confidence(rel))
                .observedAt(timestamp(rel))
                .sourceTextRef("stix:" + rel.path("id").asText())
                .origin(FactOrigin.STRUCTURED_FEED.name())
                .build());
        }

        log.info("📦 STIX bundle 转换完成: source={}, 实体={}, 关系={}, 候选事实={}, 跳过(撤销/废弃)={}, 悬空关系={}",
            sourceId, objects.size(), relationships.size() - dangling, facts.size(), skipped, dangling);
        return facts;
    }

    private RawCandidateFact literalFact(StixObject obj, String predicate, String value, String sourceId) {
        return RawCandidateFact.builder()
            .subject(obj.name())
            .subjectType(obj.type.name())
            .subjectExternalId(obj.externalId)
            .predicate(predicate)
            .object(value)
            .objectIsLiteral(true)
            .sourceId(sourceId)
            .confidence(confidence(obj.node))
            .observedAt(timestamp(obj.node))
            .sourceTextRef("stix:" + obj.stixId())
            .origin(FactOrigin.STRUCTURED_FEED.name())
            .build();
    }

    private List<RawCandidateFact> tacticFacts(StixObject technique, String sourceId) {
        List<RawCandidateFact> facts = new ArrayList<>();
        for (JsonNode phase : technique.node.path("kill_chain_phases")) {
            String chain = phase.path("kill_chain_name").asText();
            String phaseName = phase.path("phase_name").asText(null);
            if (!chain.startsWith("mitre-") || StringUtils.isBlank(phaseName)) {
                continue;
            }
            facts.add(RawCandidateFact.builder()
                .subject(technique.name())
                .subjectType(technique.type.name())
                .subjectExternalId(technique.externalId)
                .predicate(PREDICATE_TACTIC)
                .object(phaseName.replace('-', ' '))
                .objectType(EntityType.TACTIC.name())
                .sourceId(sourceId)
                .confidence(confidence(technique.node))
                .observedAt(timestamp(technique.node))
                .sourceTextRef("stix:" + technique.stixId())
                .origin(FactOrigin.STRUCTURED_FEED.name())
                .build());
        }
        return facts;
    }

    /**
     * x_mitre_data_sources 形如 "Process: Process Creation"；数据组件在 bundle 中不存在时跳过
     */
    private List<RawCandidateFact> detectionFacts(StixObject technique, Map<String, StixObject> dataSourcesByName,
                                                  Map<String, StixObject> componentsByName,
                                                  Set<String> componentLinks, String sourceId) {
        List<RawCandidateFact> facts = new ArrayList<>();
        for (JsonNode entry : technique.node.path("x_mitre_data_sources")) {
            String value = entry.asText("");
            int colon = value.indexOf(':');
            if (colon < 0) {
                log.debug("跳过格式错误的数据源 '{}': technique={}", value, technique.externalId);
                continue;
            }
            StixObject dataSource = dataSourcesByName.get(value.substring(0, colon).trim());
            StixObject component = componentsByName.get(value.substring(colon + 1).trim());
            if (component == null) {
                continue;
            }
            facts.add(linkFact(component, PREDICATE_DETECTS, technique, technique.node, sourceId));
            if (dataSource != null && componentLinks.add(dataSource.stixId() + "|" + component.stixId())) {
                facts.add(linkFact(dataSource, PREDICATE_HAS_COMPONENT, component, component.node, sourceId));
            }
        }
        return facts;
    }

    private RawCandidateFact linkFact(StixObject from, String predicate, StixObject to, JsonNode origin,
                                      String sourceId) {
        return RawCandidateFact.builder()
            .subject(from.name())
            .subjectType(from.type.name())
            .subjectExternalId(from.externalId)
            .predicate(predicate)
            .object(to.name())
            .objectType(to.type.name())
            .objectExternalId(to.externalId)
            .sourceId(sourceId)
            .confidence(confidence(origin))
            .observedAt(timestamp(origin))
            .sourceTextRef("stix:" + origin.path("id").asText())
            .origin(FactOrigin.STRUCTURED_FEED.name())
            .build();
    }

    private static Map<String, StixObject> byName(Map<String, StixObject> objects, EntityType type) {
        Map<String, StixObject> byName = new HashMap<>();
        for (StixObject obj : objects.values()) {
            if (obj.type == type) {
                byName.putIfAbsent(obj.name(), obj);
            }
        }
        return byName;
    }

    private static boolean isRevokedOrDeprecated(JsonNode node) {
        return node.path("revoked").asBoolean(false) || node.path("x_mitre_deprecated").asBoolean(false);
    }

    private static String externalId(JsonNode node) {
        for (JsonNode ref : node.path("external_references")) {
            String source = ref.path("source_name").asText();
            String id = ref.path("external_id").asText(null);
            if (EXTERNAL_ID_SOURCES.contains(source) && StringUtils.isNotBlank(id)) {
                return id.trim();
            }
        }
        return null;
    }

    /**
     * STIX confidence 为 0-100，缺省视为结构化数据完全可信
     */
    static double confidence(JsonNode node) {
        JsonNode c = node.get("confidence");
        if (c == null || !c.isNumber()) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, c.asDouble() / 100.0));
    }

    private static Instant timestamp(JsonNode node) {
        String raw = StringUtils.firstNonBlank(node.path("modified").asText(null), node.path("created").asText(null));
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            log.debug("无法解析STIX时间戳: {}", raw);
            return null;
        }
    }

    private static final class StixObject {
        final JsonNode node;
        final EntityType type;
        final String externalId;

        StixObject(JsonNode node, EntityType type, String externalId) {
            this.node = node;
            this.type = type;
            this.externalId = externalId;
        }

        String name() {
            return node.path("name").asText().trim();
        }

        String stixId() {
            return node.path("id").asText();
        }
    }
}
