package com.algobrain.knowledge.service.normalize;

import com.algobrain.dto.RawCandidateFact;
import com.algobrain.dto.RawEvent;
import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.exception.MalformedRecordException;
import com.algobrain.knowledge.model.CandidateEvent;
import com.algobrain.knowledge.model.CandidateFact;
import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.EntityType;
import com.algobrain.knowledge.model.FactOrigin;
import com.algobrain.knowledge.service.reliability.SourceRegistry;
import com.algobrain.knowledge.util.NameNormalizer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 候选事实归一化
 *
 * 在入口处把不可信的原始记录转换为固定结构，后续组件不再处理缺字段、脏格式；无副作用
 */
@Component
public class RecordNormalizer {

    private final SourceRegistry sourceRegistry;
    private final EngineConfig engineConfig;

    @Autowired
    public RecordNormalizer(SourceRegistry sourceRegistry, EngineConfig engineConfig) {
        this.sourceRegistry = sourceRegistry;
        this.engineConfig = engineConfig;
    }

    public CandidateFact normalize(RawCandidateFact raw) {
        if (raw == null) {
            throw new MalformedRecordException("候选事实为空", null);
        }
        String sourceId = requireRegisteredSource(raw.getSourceId());

        if (StringUtils.isAllBlank(raw.getSubject(), raw.getSubjectEntityId())) {
            throw new MalformedRecordException("主语为空", sourceId);
        }
        String predicate = NameNormalizer.normalizePredicate(raw.getPredicate());
        if (predicate.isEmpty()) {
            throw new MalformedRecordException("谓词为空", sourceId);
        }
        if (StringUtils.isAllBlank(raw.getObject(), raw.getObjectEntityId())) {
            throw new MalformedRecordException("宾语为空", sourceId);
        }

        boolean relationship = engineConfig.isRelationshipPredicate(predicate);
        boolean literalRequested = Boolean.TRUE.equals(raw.getObjectIsLiteral());
        if (relationship && literalRequested) {
            throw new MalformedRecordException("关系谓词 " + predicate + " 的宾语必须是实体", sourceId);
        }
        boolean entityObject = !literalRequested && (relationship
            || StringUtils.isNotBlank(raw.getObjectType())
            || StringUtils.isNotBlank(raw.getObjectExternalId())
            || StringUtils.isNotBlank(raw.getObjectEntityId()));

        EntityDescriptor subject = descriptor(raw.getSubject(), raw.getSubjectType(),
            raw.getSubjectExternalId(), raw.getSubjectEntityId(), raw.getContext(), sourceId);

        CandidateFact.CandidateFactBuilder builder = CandidateFact.builder()
            .subject(subject)
            .predicate(predicate)
            .relationship(relationship)
            .sourceId(sourceId)
            .confidence(clampConfidence(raw.getConfidence()))
            .observedAt(raw.getObservedAt())
            .sourceTextRef(StringUtils.trimToNull(raw.getSourceTextRef()))
            .origin(parseOrigin(raw.getOrigin()));

        if (entityObject) {
            builder.object(descriptor(raw.getObject(), raw.getObjectType(), raw.getObjectExternalId(),
                raw.getObjectEntityId(), raw.getContext(), sourceId));
        } else if (StringUtils.isBlank(raw.getObject())) {
            throw new MalformedRecordException("字面量宾语为空", sourceId);
        } else {
            builder.objectLiteral(raw.getObject().trim());
        }
        return builder.build();
    }

    public CandidateEvent normalizeEvent(RawEvent raw) {
        if (raw == null) {
            throw new MalformedRecordException("事件为空", null);
        }
        String sourceId = requireRegisteredSource(raw.getSourceId());
        if (StringUtils.isBlank(raw.getEventType())) {
            throw new MalformedRecordException("事件类型为空", sourceId);
        }
        if (raw.getStartTime() == null && raw.getEndTime() == null) {
            throw new MalformedRecordException("事件缺少时间", sourceId);
        }
        if (raw.getStartTime() != null && raw.getEndTime() != null
            && raw.getEndTime().isBefore(raw.getStartTime())) {
            throw new MalformedRecordException("事件结束时间早于开始时间", sourceId);
        }
        if (raw.getParticipants() == null || raw.getParticipants().isEmpty()) {
            throw new MalformedRecordException("事件没有参与实体", sourceId);
        }

        List<CandidateEvent.Participant> participants = new ArrayList<>();
        for (RawEvent.Participant p : raw.getParticipants()) {
            if (p == null || StringUtils.isAllBlank(p.getName(), p.getEntityId(), p.getExternalId())) {
                throw new MalformedRecordException("事件参与实体缺少名称", sourceId);
            }
            String name = StringUtils.firstNonBlank(p.getName(), p.getExternalId(), p.getEntityId());
            EntityDescriptor descriptor = descriptor(name, p.getType(), p.getExternalId(), p.getEntityId(),
                raw.getDescription(), sourceId);
            participants.add(new CandidateEvent.Participant(descriptor,
                StringUtils.defaultIfBlank(p.getRole(), "target").trim().toLowerCase(Locale.ROOT)));
        }

        return CandidateEvent.builder()
            .eventType(raw.getEventType().trim().toUpperCase(Locale.ROOT))
            .startTime(raw.getStartTime())
            .endTime(raw.getEndTime())
            .participants(participants)
            .sourceId(sourceId)
            .description(StringUtils.trimToNull(raw.getDescription()))
            .build();
    }

    /**
     * 单独构造实体描述，供消解排名查询使用
     */
    public EntityDescriptor describeEntity(String name, String type, String externalId) {
        return descriptor(name, type, externalId, null, null, null);
    }

    private String requireRegisteredSource(String rawSourceId) {
        String sourceId = StringUtils.trimToNull(rawSourceId);
        if (sourceId == null) {
            throw new MalformedRecordException("sourceId为空", null);
        }
        if (!sourceRegistry.isRegistered(sourceId)) {
            throw new MalformedRecordException("来源未登记: " + sourceId, sourceId);
        }
        return sourceId;
    }

    private EntityDescriptor descriptor(String rawName, String rawType, String rawExternalId,
                                        String pinnedEntityId, String context, String sourceId) {
        String pinned = StringUtils.trimToNull(pinnedEntityId);
        String name = StringUtils.trimToNull(rawName);
        if (name == null) {
            name = pinned;
        }
        String externalId = StringUtils.isNotBlank(rawExternalId)
            ? rawExternalId.trim().toUpperCase(Locale.ROOT)
            : NameNormalizer.detectExternalId(name);
        String normalizedName = NameNormalizer.normalize(name);
        if (normalizedName.isEmpty() && externalId == null && pinned == null) {
            throw new MalformedRecordException("实体名称归一化后为空: " + rawName, sourceId);
        }

        EntityType type = EntityType.parse(rawType);
        if (type == EntityType.UNKNOWN && externalId != null) {
            type = inferType(externalId);
        }

        return EntityDescriptor.builder()
            .name(name)
            .normalizedName(normalizedName)
            .typeTag(type)
            .externalId(externalId)
            .contextText(StringUtils.trimToNull(context))
            .pinnedEntityId(pinned)
            .build();
    }

    static EntityType inferType(String externalId) {
        if (externalId.startsWith("CVE-")) {
            return EntityType.VULNERABILITY;
        }
        if (externalId.startsWith("TA")) {
            return EntityType.TACTIC;
        }
        if (externalId.matches("^T\\d{4}(\\.\\d{3})?$")) {
            return EntityType.TECHNIQUE;
        }
        if (externalId.matches("^G\\d{4}$")) {
            return EntityType.ACTOR;
        }
        if (externalId.matches("^M\\d{4}$")) {
            return EntityType.MITIGATION;
        }
        return EntityType.UNKNOWN;
    }

    static double clampConfidence(Double raw) {
        if (raw == null || raw.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, raw));
    }

    private FactOrigin parseOrigin(String raw) {
        if (StringUtils.isBlank(raw)) {
            return FactOrigin.LLM_EXTRACTION;
        }
        try {
            return FactOrigin.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return FactOrigin.LLM_EXTRACTION;
        }
    }
}
