package com.algobrain.knowledge.service.graph;

import com.algobrain.knowledge.exception.MergeConflictException;
import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.CommitResult;
import com.algobrain.knowledge.model.EventParticipant;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.MaterializedEdge;
import com.algobrain.knowledge.model.TimelineEvent;
import com.algobrain.knowledge.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 内存证据库（降级方案）
 *
 * 未启用Neo4j时使用此实现，数据只保存在内存中；单元测试也使用此实现
 */
@Service
@ConditionalOnProperty(name = "graph.neo4j.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryEvidenceStore implements IEvidenceStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEvidenceStore.class);

    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();

    private final Map<String, GraphEntity> entities = new LinkedHashMap<>();
    private final Map<String, String> byCreationKey = new HashMap<>();
    private final Map<String, String> byExternalId = new HashMap<>();
    private final Map<String, Set<String>> byName = new HashMap<>();

    // 断言日志，插入顺序即入库顺序
    private final Map<String, Assertion> assertions = new LinkedHashMap<>();
    private final Map<String, Long> assertionSeq = new HashMap<>();
    private final Map<String, String> assertionByKey = new HashMap<>();
    private final Map<String, Set<String>> assertionsByEntity = new HashMap<>();

    private final Map<String, TimelineEvent> events = new LinkedHashMap<>();
    private final Map<String, String> eventByKey = new HashMap<>();
    private final Map<String, Set<String>> eventsByEntity = new HashMap<>();

    // assertionId -> 边
    private final Map<String, MaterializedEdge> edges = new LinkedHashMap<>();
    private final Map<String, Set<String>> edgesByEntity = new HashMap<>();

    private long sequence = 0;

    public InMemoryEvidenceStore() {
        logger.warn("⚠️⚠️⚠️ 警告：正在使用内存证据库（降级模式）⚠️⚠️⚠️");
        logger.warn("   断言与事件日志仅保存在内存中，重启后将全部丢失！");
        logger.warn("   修改配置: application.yml -> graph.neo4j.enabled: true");
    }

    @Override
    public CommitResult<GraphEntity> createEntityIfAbsent(GraphEntity entity) {
        rwLock.writeLock().lock();
        try {
            String existingId = byCreationKey.get(entity.getCreationKey());
            if (existingId != null) {
                return CommitResult.duplicate(entities.get(canonical(existingId)).copy());
            }
            GraphEntity stored = entity.toBuilder()
                .entityId(entity.getEntityId() != null ? entity.getEntityId() : "ent-" + UUID.randomUUID())
                .createdAt(entity.getCreatedAt() != null ? entity.getCreatedAt() : Instant.now())
                .mergedInto(null)
                .build();
            entities.put(stored.getEntityId(), stored);
            byCreationKey.put(stored.getCreationKey(), stored.getEntityId());
            if (stored.getExternalId() != null) {
                byExternalId.putIfAbsent(stored.getExternalId(), stored.getEntityId());
            }
            indexName(stored.getNormalizedName(), stored.getEntityId());
            logger.debug("➕ 新建实体: {} [{}] {}", stored.getEntityId(), stored.getTypeTag(), stored.getCanonicalName());
            return CommitResult.created(stored.copy());
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public Optional<GraphEntity> findByCreationKey(String creationKey) {
        rwLock.readLock().lock();
        try {
            String id = byCreationKey.get(creationKey);
            return id == null ? Optional.empty() : Optional.of(entities.get(canonical(id)).copy());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public Optional<GraphEntity> findByExternalId(String externalId) {
        rwLock.readLock().lock();
        try {
            String id = externalId == null ? null : byExternalId.get(externalId);
            return id == null ? Optional.empty() : Optional.of(entities.get(canonical(id)).copy());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public List<GraphEntity> findByNormalizedName(String normalizedName) {
        rwLock.readLock().lock();
        try {
            Set<String> ids = byName.getOrDefault(normalizedName, Set.of());
            return ids.stream()
                .map(this::canonical)
                .distinct()
                .map(id -> entities.get(id).copy())
                .collect(Collectors.toList());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public Optional<GraphEntity> getEntity(String entityId) {
        rwLock.readLock().lock();
        try {
            GraphEntity entity = entities.get(entityId);
            return entity == null ? Optional.empty() : Optional.of(entity.copy());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public String resolveCanonicalId(String entityId) {
        rwLock.readLock().lock();
        try {
            return entities.containsKey(entityId) ? canonical(entityId) : null;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public List<GraphEntity> listEntities() {
        rwLock.readLock().lock();
        try {
            return entities.values().stream()
                .filter(e -> !e.isMerged())
                .map(GraphEntity::copy)
                .collect(Collectors.toList());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void addAlias(String entityId, String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return;
        }
        rwLock.writeLock().lock();
        try {
            if (entities.containsKey(entityId)) {
                indexName(normalizedName, canonical(entityId));
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public CommitResult<Assertion> commitAssertion(Assertion assertion) {
        rwLock.writeLock().lock();
        try {
            String existingId = assertionByKey.get(assertion.getIdempotencyKey());
            if (existingId != null) {
                return CommitResult.duplicate(assertions.get(existingId));
            }
            Assertion stored = assertion.toBuilder()
                .assertionId(assertion.getAssertionId() != null ? assertion.getAssertionId() : "asr-" + UUID.randomUUID())
                .recordedAt(assertion.getRecordedAt() != null ? assertion.getRecordedAt() : Instant.now())
                .build();
            assertions.put(stored.getAssertionId(), stored);
            assertionSeq.put(stored.getAssertionId(), ++sequence);
            assertionByKey.put(stored.getIdempotencyKey(), stored.getAssertionId());
            indexAssertion(canonical(stored.getSubjectEntityId()), stored.getAssertionId());
            if (stored.hasEntityObject()) {
                indexAssertion(canonical(stored.getObjectEntityId()), stored.getAssertionId());
            }
            if (stored.isAccepted()) {
                projectEdge(stored);
            }
            return CommitResult.created(stored);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public Assertion updateValidationStatus(String assertionId, ValidationStatus status, Instant resolvedAt) {
        if (status == null || !status.isHumanResolved()) {
            throw new IllegalStateException("只能裁定为 HUMAN_VALIDATED 或 HUMAN_REJECTED: " + status);
        }
        rwLock.writeLock().lock();
        try {
            Assertion current = assertions.get(assertionId);
            if (current == null) {
                throw new IllegalStateException("断言不存在: " + assertionId);
            }
            if (current.getValidationStatus() != ValidationStatus.PENDING) {
                throw new IllegalStateException("断言 " + assertionId + " 已处于 " + current.getValidationStatus()
                    + "，不能再次裁定");
            }
            Assertion updated = current.toBuilder()
                .validationStatus(status)
                .resolvedAt(resolvedAt)
                .build();
            assertions.put(assertionId, updated);
            if (updated.isAccepted()) {
                projectEdge(updated);
            }
            return updated;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Assertion> getAssertion(String assertionId) {
        rwLock.readLock().lock();
        try {
            return Optional.ofNullable(assertions.get(assertionId));
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public List<Assertion> getAssertions(String entityId, String predicate) {
        rwLock.readLock().lock();
        try {
            if (!entities.containsKey(entityId)) {
                return List.of();
            }
            return assertionsByEntity.getOrDefault(canonical(entityId), Set.of()).stream()
                .sorted(Comparator.comparing(assertionSeq::get))
                .map(assertions::get)
                .filter(a -> predicate == null || predicate.equals(a.getPredicate()))
                .collect(Collectors.toList());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public List<Assertion> getResolvedAssertions() {
        rwLock.readLock().lock();
        try {
            return assertions.values().stream()
                .filter(a -> a.getValidationStatus().isHumanResolved())
                .collect(Collectors.toList());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public List<Assertion> getValidatedSince(Instant since) {
        rwLock.readLock().lock();
        try {
            return assertions.values().stream()
                .filter(a -> a.getValidationStatus() == ValidationStatus.HUMAN_VALIDATED)
                .filter(a -> a.getResolvedAt() != null && (since == null || !a.getResolvedAt().isBefore(since)))
                .sorted(Comparator.comparing(Assertion::getResolvedAt)
                    .thenComparing(a -> assertionSeq.get(a.getAssertionId())))
                .collect(Collectors.toList());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public CommitResult<TimelineEvent> appendEvent(TimelineEvent event) {
        rwLock.writeLock().lock();
        try {
            String existingId = eventByKey.get(event.getIdempotencyKey());
            if (existingId != null) {
                return CommitResult.duplicate(events.get(existingId));
            }
            TimelineEvent stored = event.toBuilder()
                .eventId(event.getEventId() != null ? event.getEventId() : "evt-" + UUID.randomUUID())
                .recordedAt(event.getRecordedAt() != null ? event.getRecordedAt() : Instant.now())
                .sequence(++sequence)
                .build();
            events.put(stored.getEventId(), stored);
            eventByKey.put(stored.getIdempotencyKey(), stored.getEventId());
            for (EventParticipant p : stored.getParticipants()) {
                eventsByEntity.computeIfAbsent(canonical(p.getEntityId()), k -> new LinkedHashSet<>())
                    .add(stored.getEventId());
            }
            return CommitResult.created(stored);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public List<TimelineEvent> getEvents(String entityId) {
        rwLock.readLock().lock();
        try {
            if (!entities.containsKey(entityId)) {
                return List.of();
            }
            return eventsByEntity.getOrDefault(canonical(entityId), Set.of()).stream()
                .map(events::get)
                .sorted(Comparator.comparing(TimelineEvent::effectiveTime)
                    .thenComparingLong(TimelineEvent::getSequence))
                .collect(Collectors.toList());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public List<MaterializedEdge> getEdges(String entityId, String edgeType) {
        rwLock.readLock().lock();
        try {
            if (!entities.containsKey(entityId)) {
                return List.of();
            }
            return edgesByEntity.getOrDefault(canonical(entityId), Set.of()).stream()
                .map(edges::get)
                .filter(e -> edgeType == null || edgeType.equals(e.getEdgeType()))
                .collect(Collectors.toList());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public long confirmationCount(String entityId) {
        rwLock.readLock().lock();
        try {
            if (!entities.containsKey(entityId)) {
                return 0;
            }
            return assertionsByEntity.getOrDefault(canonical(entityId), Set.of()).stream()
                .map(assertions::get)
                .filter(Assertion::isAccepted)
                .count();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public long coOccurrenceCount(String entityA, String entityB) {
        rwLock.readLock().lock();
        try {
            if (!entities.containsKey(entityA) || !entities.containsKey(entityB)) {
                return 0;
            }
            String a = canonical(entityA);
            String b = canonical(entityB);
            return assertionsByEntity.getOrDefault(a, Set.of()).stream()
                .map(assertions::get)
                .filter(Assertion::isAccepted)
                .filter(Assertion::hasEntityObject)
                .filter(x -> {
                    String s = canonical(x.getSubjectEntityId());
                    String o = canonical(x.getObjectEntityId());
                    return (s.equals(a) && o.equals(b)) || (s.equals(b) && o.equals(a));
                })
                .count();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void mergeEntities(String losingId, String survivingId, String reason) {
        rwLock.writeLock().lock();
        try {
            GraphEntity loser = entities.get(losingId);
            GraphEntity survivor = entities.get(survivingId);
            if (loser == null || survivor == null) {
                throw new MergeConflictException("合并的实体不存在: " + losingId + " -> " + survivingId);
            }
            if (losingId.equals(survivingId)) {
                throw new MergeConflictException("不能把实体合并到自身: " + losingId);
            }
            if (loser.isMerged()) {
                throw new MergeConflictException("实体 " + losingId + " 已合并到 " + loser.getMergedInto());
            }
            String target = canonical(survivingId);
            if (target.equals(losingId)) {
                throw new MergeConflictException("合并会形成环: " + survivingId + " 已并入 " + losingId);
            }

            loser.setMergedInto(target);
            GraphEntity surviving = entities.get(target);
            if (surviving.getExternalId() == null && loser.getExternalId() != null) {
                surviving.setExternalId(loser.getExternalId());
            }
            for (Set<String> ids : byName.values()) {
                if (ids.remove(losingId)) {
                    ids.add(target);
                }
            }
            indexName(loser.getNormalizedName(), target);

            moveIndex(assertionsByEntity, losingId, target);
            moveIndex(eventsByEntity, losingId, target);

            Set<String> loserEdges = edgesByEntity.remove(losingId);
            if (loserEdges != null) {
                for (String assertionId : loserEdges) {
                    MaterializedEdge edge = edges.get(assertionId);
                    MaterializedEdge moved = edge.toBuilder()
                        .fromEntityId(edge.getFromEntityId().equals(losingId) ? target : edge.getFromEntityId())
                        .toEntityId(edge.getToEntityId().equals(losingId) ? target : edge.getToEntityId())
                        .build();
                    edges.put(assertionId, moved);
                    edgesByEntity.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(assertionId);
                }
            }
            logger.info("🔗 实体合并: {} -> {}，原因: {}", losingId, target, reason);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, Object> getStatistics() {
        rwLock.readLock().lock();
        try {
            Map<String, Object> stats = new LinkedHashMap<>();
            long active = entities.values().stream().filter(e -> !e.isMerged()).count();
            stats.put("entities", active);
            stats.put("mergedEntities", entities.size() - active);
            stats.put("assertions", assertions.size());
            Map<String, Long> byStatus = assertions.values().stream()
                .collect(Collectors.groupingBy(a -> a.getValidationStatus().name(), LinkedHashMap::new,
                    Collectors.counting()));
            stats.put("assertionsByStatus", byStatus);
            stats.put("events", events.size());
            stats.put("edges", edges.size());
            return stats;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getServiceType() {
        return "IN_MEMORY";
    }

    private String canonical(String entityId) {
        String current = entityId;
        GraphEntity entity = entities.get(current);
        while (entity != null && entity.getMergedInto() != null) {
            current = entity.getMergedInto();
            entity = entities.get(current);
        }
        return current;
    }

    private void indexName(String normalizedName, String entityId) {
        if (normalizedName != null && !normalizedName.isEmpty()) {
            byName.computeIfAbsent(normalizedName, k -> new LinkedHashSet<>()).add(entityId);
        }
    }

    private void indexAssertion(String entityId, String assertionId) {
        assertionsByEntity.computeIfAbsent(entityId, k -> new LinkedHashSet<>()).add(assertionId);
    }

    private static void moveIndex(Map<String, Set<String>> index, String from, String to) {
        Set<String> moved = index.remove(from);
        if (moved != null) {
            index.computeIfAbsent(to, k -> new LinkedHashSet<>()).addAll(moved);
        }
    }

    private void projectEdge(Assertion assertion) {
        if (!assertion.isEdgeCandidate()) {
            return;
        }
        String from = canonical(assertion.getSubjectEntityId());
        String to = canonical(assertion.getObjectEntityId());
        MaterializedEdge edge = MaterializedEdge.builder()
            .fromEntityId(from)
            .edgeType(assertion.getPredicate())
            .toEntityId(to)
            .assertionId(assertion.getAssertionId())
            .sourceId(assertion.getSourceId())
            .confidence(assertion.getConfidence())
            .build();
        edges.put(assertion.getAssertionId(), edge);
        edgesByEntity.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(assertion.getAssertionId());
        if (!Objects.equals(from, to)) {
            edgesByEntity.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(assertion.getAssertionId());
        }
    }
}
