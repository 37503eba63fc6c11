package com.algobrain.knowledge.service.query;

import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.MaterializedEdge;
import com.algobrain.knowledge.model.ResolutionContext;
import com.algobrain.knowledge.model.ScoredCandidate;
import com.algobrain.knowledge.model.StateSnapshot;
import com.algobrain.knowledge.model.TimelineEvent;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.service.normalize.RecordNormalizer;
import com.algobrain.knowledge.service.reliability.SourceRegistry;
import com.algobrain.knowledge.service.resolve.EntityResolver;
import com.algobrain.knowledge.service.temporal.TemporalStateReconstructor;
import com.algobrain.knowledge.util.NameNormalizer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 图谱只读查询
 *
 * 已合并的实体ID按合并指针透明转到存活实体
 */
@Service
public class KnowledgeQueryService {

    @Autowired
    private IEvidenceStore evidenceStore;
    @Autowired
    private TemporalStateReconstructor temporalStateReconstructor;
    @Autowired
    private EntityResolver entityResolver;
    @Autowired
    private RecordNormalizer normalizer;
    @Autowired
    private SourceRegistry sourceRegistry;

    public GraphEntity getEntity(String entityId) {
        String canonicalId = canonical(entityId);
        return evidenceStore.getEntity(canonicalId)
            .orElseThrow(() -> new NoSuchElementException("实体不存在: " + entityId));
    }

    /**
     * 实体的全部断言，冲突断言与被拒绝断言一并返回
     */
    public List<Assertion> getAssertions(String entityId, String predicate) {
        String normalizedPredicate = StringUtils.isBlank(predicate) ? null : NameNormalizer.normalizePredicate(predicate);
        return evidenceStore.getAssertions(canonical(entityId), normalizedPredicate);
    }

    public StateSnapshot getStateAt(String entityId, Instant asOf) {
        return temporalStateReconstructor.getStateAt(canonical(entityId), asOf == null ? Instant.now() : asOf);
    }

    public List<MaterializedEdge> getEdges(String entityId, String edgeType) {
        String normalizedType = StringUtils.isBlank(edgeType) ? null : NameNormalizer.normalizePredicate(edgeType);
        return evidenceStore.getEdges(canonical(entityId), normalizedType);
    }

    public List<TimelineEvent> getEvents(String entityId) {
        return evidenceStore.getEvents(canonical(entityId));
    }

    /**
     * 解释一个名称会被消解到哪些实体（只排名，不创建）
     */
    public List<ScoredCandidate> explainResolution(String name, String type, String externalId, String sourceId) {
        EntityDescriptor descriptor = normalizer.describeEntity(name, type, externalId);
        ResolutionContext context = ResolutionContext.builder()
            .sourceId(sourceId)
            .sourceReliability(sourceRegistry.getReliability(sourceId))
            .build();
        return entityResolver.rank(descriptor, context);
    }

    private String canonical(String entityId) {
        String canonicalId = evidenceStore.resolveCanonicalId(entityId);
        if (canonicalId == null) {
            throw new NoSuchElementException("实体不存在: " + entityId);
        }
        return canonicalId;
    }
}
