package com.algobrain.knowledge.service.graph;

import com.algobrain.knowledge.exception.MergeConflictException;
import com.algobrain.knowledge.exception.RetryableResolutionFailure;
import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.CommitResult;
import com.algobrain.knowledge.model.EntityType;
import com.algobrain.knowledge.model.EventParticipant;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.MaterializedEdge;
import com.algobrain.knowledge.model.TimelineEvent;
import com.algobrain.knowledge.model.ValidationStatus;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.TransactionWork;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Neo4j 证据库（持久化实现）
 *
 * 节点模型：
 * (:KbEntity) 规范实体；(:Assertion)-[:SUBJECT|OBJECT]->(:KbEntity) 断言节点；
 * (:TimelineEvent)-[:INVOLVES {role}]->(:KbEntity) 事件；
 * (:KbEntity)-[:USES|EXPLOITS|... {assertionId}]->(:KbEntity) 边投影
 *
 * 合并时对指向失败方的合并指针做路径压缩，因此合并链最多一跳
 */
@Service
@ConditionalOnProperty(name = "graph.neo4j.enabled", havingValue = "true")
public class Neo4jEvidenceStore implements IEvidenceStore {

    private static final Logger logger = LoggerFactory.getLogger(Neo4jEvidenceStore.class);

    private static final String CONSTRAINT_FAILED = "Neo.ClientError.Schema.ConstraintValidationFailed";

    private static final Pattern EDGE_TYPE = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    private static final String CANONICAL =
        "MATCH (e0:KbEntity {entityId: $id}) " +
        "OPTIONAL MATCH (s0:KbEntity {entityId: e0.mergedInto}) " +
        "RETURN coalesce(s0, e0) AS e";

    private final Driver driver;

    @Autowired
    public Neo4jEvidenceStore(Driver driver) {
        this.driver = driver;
        logger.info("✅ 证据库使用Neo4j持久化实现");
    }

    @Override
    public CommitResult<GraphEntity> createEntityIfAbsent(GraphEntity entity) {
        String entityId = entity.getEntityId() != null ? entity.getEntityId() : "ent-" + UUID.randomUUID();
        Map<String, Object> props = new HashMap<>();
        props.put("entityId", entityId);
        props.put("typeTag", entity.getTypeTag() == null ? EntityType.UNKNOWN.name() : entity.getTypeTag().name());
        props.put("canonicalName", entity.getCanonicalName());
        props.put("normalizedName", entity.getNormalizedName());
        props.put("externalId", entity.getExternalId());
        props.put("description", entity.getDescription());
        props.put("createdAt", epoch(entity.getCreatedAt() != null ? entity.getCreatedAt() : Instant.now()));
        props.put("aliases", new ArrayList<String>());

        String cypher =
            "MERGE (e:KbEntity {creationKey: $key}) " +
            "ON CREATE SET e += $props, e.isNew = true " +
            "WITH e, coalesce(e.isNew, false) AS created " +
            "REMOVE e.isNew " +
            "RETURN e.entityId AS id, created";

        try {
            return write("createEntity", tx -> {
                Record record = tx.run(cypher, params("key", entity.getCreationKey(), "props", props)).single();
                GraphEntity stored = canonicalEntity(tx, record.get("id").asString());
                return record.get("created").asBoolean()
                    ? CommitResult.created(stored)
                    : CommitResult.duplicate(stored);
            });
        } catch (ClientException e) {
            if (!CONSTRAINT_FAILED.equals(e.code())) {
                throw new RetryableResolutionFailure("Neo4j创建实体失败: " + e.getMessage(), e);
            }
            // 并发创建同一创建键，读取对方的结果
            return findByCreationKey(entity.getCreationKey())
                .map(CommitResult::duplicate)
                .orElseThrow(() -> new RetryableResolutionFailure("创建键冲突但未找到实体: " + entity.getCreationKey()));
        }
    }

    @Override
    public Optional<GraphEntity> findByCreationKey(String creationKey) {
        return read("findByCreationKey", tx -> {
            List<Record> records = tx.run("MATCH (e:KbEntity {creationKey: $key}) RETURN e.entityId AS id",
                params("key", creationKey)).list();
            return records.isEmpty()
                ? Optional.empty()
                : Optional.ofNullable(canonicalEntity(tx, records.get(0).get("id").asString()));
        });
    }

    @Override
    public Optional<GraphEntity> findByExternalId(String externalId) {
        if (externalId == null) {
            return Optional.empty();
        }
        return read("findByExternalId", tx -> {
            List<Record> records = tx.run(
                "MATCH (e:KbEntity {externalId: $ext}) RETURN e.entityId AS id ORDER BY e.createdAt ASC LIMIT 1",
                params("ext", externalId)).list();
            return records.isEmpty()
                ? Optional.empty()
                : Optional.ofNullable(canonicalEntity(tx, records.get(0).get("id").asString()));
        });
    }

    @Override
    public List<GraphEntity> findByNormalizedName(String normalizedName) {
        String cypher =
            "MATCH (e:KbEntity) WHERE e.normalizedName = $name OR $name IN coalesce(e.aliases, []) " +
            "OPTIONAL MATCH (s:KbEntity {entityId: e.mergedInto}) " +
            "WITH DISTINCT coalesce(s, e) AS c " +
            "RETURN c ORDER BY c.entityId";
        return read("findByNormalizedName", tx -> tx.run(cypher, params("name", normalizedName))
            .list(r -> toEntity(r.get("c"))));
    }

    @Override
    public Optional<GraphEntity> getEntity(String entityId) {
        return read("getEntity", tx -> {
            List<Record> records = tx.run("MATCH (e:KbEntity {entityId: $id}) RETURN e", params("id", entityId)).list();
            return records.isEmpty() ? Optional.empty() : Optional.of(toEntity(records.get(0).get("e")));
        });
    }

    @Override
    public String resolveCanonicalId(String entityId) {
        return read("resolveCanonicalId", tx -> {
            GraphEntity e = canonicalEntity(tx, entityId);
            return e == null ? null : e.getEntityId();
        });
    }

    @Override
    public List<GraphEntity> listEntities() {
        return read("listEntities", tx -> tx.run(
            "MATCH (e:KbEntity) WHERE e.mergedInto IS NULL RETURN e ORDER BY e.createdAt, e.entityId")
            .list(r -> toEntity(r.get("e"))));
    }

    @Override
    public void addAlias(String entityId, String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return;
        }
        write("addAlias", tx -> {
            GraphEntity target = canonicalEntity(tx, entityId);
            if (target != null) {
                tx.run("MATCH (e:KbEntity {entityId: $id}) " +
                        "WHERE NOT $alias IN coalesce(e.aliases, []) AND e.normalizedName <> $alias " +
                        "SET e.aliases = coalesce(e.aliases, []) + $alias",
                    params("id", target.getEntityId(), "alias", normalizedName)).consume();
            }
            return null;
        });
    }

    @Override
    public CommitResult<Assertion> commitAssertion(Assertion assertion) {
        try {
            return write("commitAssertion", tx -> {
                List<Record> existing = tx.run("MATCH (a:Assertion {idempotencyKey: $key}) RETURN a",
                    params("key", assertion.getIdempotencyKey())).list();
                if (!existing.isEmpty()) {
                    return CommitResult.duplicate(toAssertion(existing.get(0).get("a")));
                }
                Assertion stored = assertion.toBuilder()
                    .assertionId(assertion.getAssertionId() != null
                        ? assertion.getAssertionId() : "asr-" + UUID.randomUUID())
                    .recordedAt(assertion.getRecordedAt() != null ? assertion.getRecordedAt() : Instant.now())
                    .build();
                Map<String, Object> props = assertionProps(stored);
                props.put("seq", nextSequence(tx));

                tx.run("CREATE (a:Assertion) SET a = $props", params("props", props)).consume();
                linkAssertion(tx, stored.getAssertionId(), "SUBJECT", stored.getSubjectEntityId());
                if (stored.hasEntityObject()) {
                    linkAssertion(tx, stored.getAssertionId(), "OBJECT", stored.getObjectEntityId());
                }
                if (stored.isAccepted()) {
                    projectEdge(tx, stored);
                }
                return CommitResult.created(stored);
            });
        } catch (ClientException e) {
            if (!CONSTRAINT_FAILED.equals(e.code())) {
                throw new RetryableResolutionFailure("Neo4j写入断言失败: " + e.getMessage(), e);
            }
            return read("commitAssertion.dup", tx -> {
                List<Record> records = tx.run("MATCH (a:Assertion {idempotencyKey: $key}) RETURN a",
                    params("key", assertion.getIdempotencyKey())).list();
                if (records.isEmpty()) {
                    throw new RetryableResolutionFailure("幂等键冲突但未找到断言: " + assertion.getIdempotencyKey());
                }
                return CommitResult.duplicate(toAssertion(records.get(0).get("a")));
            });
        }
    }

    @Override
    public Assertion updateValidationStatus(String assertionId, ValidationStatus status, Instant resolvedAt) {
        if (status == null || !status.isHumanResolved()) {
            throw new IllegalStateException("只能裁定为 HUMAN_VALIDATED 或 HUMAN_REJECTED: " + status);
        }
        return write("updateValidationStatus", tx -> {
            List<Record> records = tx.run("MATCH (a:Assertion {assertionId: $id}) RETURN a",
                params("id", assertionId)).list();
            if (records.isEmpty()) {
                throw new IllegalStateException("断言不存在: " + assertionId);
            }
            Assertion current = toAssertion(records.get(0).get("a"));
            if (current.getValidationStatus() != ValidationStatus.PENDING) {
                throw new IllegalStateException("断言 " + assertionId + " 已处于 " + current.getValidationStatus()
                    + "，不能再次裁定");
            }
            tx.run("MATCH (a:Assertion {assertionId: $id}) " +
                    "WHERE a.validationStatus = 'PENDING' " +
                    "SET a.validationStatus = $status, a.resolvedAt = $resolvedAt",
                params("id", assertionId, "status", status.name(), "resolvedAt", epoch(resolvedAt))).consume();
            Assertion updated = current.toBuilder().validationStatus(status).resolvedAt(resolvedAt).build();
            if (updated.isAccepted()) {
                projectEdge(tx, updated);
            }
            return updated;
        });
    }

    @Override
    public Optional<Assertion> getAssertion(String assertionId) {
        return read("getAssertion", tx -> {
            List<Record> records = tx.run("MATCH (a:Assertion {assertionId: $id}) RETURN a",
                params("id", assertionId)).list();
            return records.isEmpty() ? Optional.empty() : Optional.of(toAssertion(records.get(0).get("a")));
        });
    }

    @Override
    public List<Assertion> getAssertions(String entityId, String predicate) {
        return read("getAssertions", tx -> {
            GraphEntity c = canonicalEntity(tx, entityId);
            if (c == null) {
                return List.of();
            }
            return tx.run("MATCH (a:Assertion)-[:SUBJECT|OBJECT]->(:KbEntity {entityId: $id}) " +
                    "WHERE $predicate IS NULL OR a.predicate = $predicate " +
                    "RETURN DISTINCT a ORDER BY a.seq ASC",
                params("id", c.getEntityId(), "predicate", predicate)).list(r -> toAssertion(r.get("a")));
        });
    }

    @Override
    public List<Assertion> getResolvedAssertions() {
        return read("getResolvedAssertions", tx -> tx.run(
            "MATCH (a:Assertion) WHERE a.validationStatus IN ['HUMAN_VALIDATED', 'HUMAN_REJECTED'] " +
                "RETURN a ORDER BY a.seq ASC").list(r -> toAssertion(r.get("a"))));
    }

    @Override
    public List<Assertion> getValidatedSince(Instant since) {
        return read("getValidatedSince", tx -> tx.run(
            "MATCH (a:Assertion {validationStatus: 'HUMAN_VALIDATED'}) " +
                "WHERE a.resolvedAt IS NOT NULL AND ($since IS NULL OR a.resolvedAt >= $since) " +
                "RETURN a ORDER BY a.resolvedAt ASC, a.seq ASC",
            params("since", epoch(since))).list(r -> toAssertion(r.get("a"))));
    }

    @Override
    public CommitResult<TimelineEvent> appendEvent(TimelineEvent event) {
        try {
            return write("appendEvent", tx -> {
                List<Record> existing = tx.run("MATCH (ev:TimelineEvent {idempotencyKey: $key}) RETURN ev",
                    params("key", event.getIdempotencyKey())).list();
                if (!existing.isEmpty()) {
                    return CommitResult.duplicate(toEvent(tx, existing.get(0).get("ev")));
                }
                TimelineEvent stored = event.toBuilder()
                    .eventId(event.getEventId() != null ? event.getEventId() : "evt-" + UUID.randomUUID())
                    .recordedAt(event.getRecordedAt() != null ? event.getRecordedAt() : Instant.now())
                    .sequence(nextSequence(tx))
                    .build();

                Map<String, Object> props = new HashMap<>();
                props.put("eventId", stored.getEventId());
                props.put("eventType", stored.getEventType());
                props.put("startTime", epoch(stored.getStartTime()));
                props.put("endTime", epoch(stored.getEndTime()));
                props.put("effectiveTime", epoch(stored.effectiveTime()));
                props.put("sourceId", stored.getSourceId());
                props.put("description", stored.getDescription());
                props.put("recordedAt", epoch(stored.getRecordedAt()));
                props.put("sequence", stored.getSequence());
                props.put("idempotencyKey", stored.getIdempotencyKey());
                tx.run("CREATE (ev:TimelineEvent) SET ev = $props", params("props", props)).consume();

                for (EventParticipant p : stored.getParticipants()) {
                    GraphEntity target = canonicalEntity(tx, p.getEntityId());
                    if (target == null) {
                        throw new IllegalStateException("事件参与实体不存在: " + p.getEntityId());
                    }
                    tx.run("MATCH (ev:TimelineEvent {eventId: $eventId}), (e:KbEntity {entityId: $entityId}) " +
                            "CREATE (ev)-[:INVOLVES {role: $role, originalEntityId: $original}]->(e)",
                        params("eventId", stored.getEventId(), "entityId", target.getEntityId(),
                            "role", p.getRole(), "original", p.getEntityId())).consume();
                }
                return CommitResult.created(stored);
            });
        } catch (ClientException e) {
            if (!CONSTRAINT_FAILED.equals(e.code())) {
                throw new RetryableResolutionFailure("Neo4j写入事件失败: " + e.getMessage(), e);
            }
            return read("appendEvent.dup", tx -> {
                List<Record> records = tx.run("MATCH (ev:TimelineEvent {idempotencyKey: $key}) RETURN ev",
                    params("key", event.getIdempotencyKey())).list();
                if (records.isEmpty()) {
                    throw new RetryableResolutionFailure("幂等键冲突但未找到事件: " + event.getIdempotencyKey());
                }
                return CommitResult.duplicate(toEvent(tx, records.get(0).get("ev")));
            });
        }
    }

    @Override
    public List<TimelineEvent> getEvents(String entityId) {
        return read("getEvents", tx -> {
            GraphEntity c = canonicalEntity(tx, entityId);
            if (c == null) {
                return List.of();
            }
            List<Value> nodes = tx.run(
                "MATCH (ev:TimelineEvent)-[:INVOLVES]->(:KbEntity {entityId: $id}) " +
                    "RETURN DISTINCT ev ORDER BY ev.effectiveTime ASC, ev.sequence ASC",
                params("id", c.getEntityId())).list(r -> r.get("ev"));
            List<TimelineEvent> result = new ArrayList<>();
            for (Value node : nodes) {
                result.add(toEvent(tx, node));
            }
            return result;
        });
    }

    @Override
    public List<MaterializedEdge> getEdges(String entityId, String edgeType) {
        return read("getEdges", tx -> {
            GraphEntity c = canonicalEntity(tx, entityId);
            if (c == null) {
                return List.of();
            }
            return tx.run("MATCH (f:KbEntity)-[r]->(t:KbEntity) " +
                    "WHERE (f.entityId = $id OR t.entityId = $id) AND r.assertionId IS NOT NULL " +
                    "AND ($edgeType IS NULL OR r.edgeType = $edgeType) " +
                    "RETURN f.entityId AS fromId, t.entityId AS toId, r ORDER BY r.seq ASC",
                params("id", c.getEntityId(), "edgeType", edgeType)).list(r -> {
                    Value rel = r.get("r");
                    return MaterializedEdge.builder()
                        .fromEntityId(r.get("fromId").asString())
                        .toEntityId(r.get("toId").asString())
                        .edgeType(rel.get("edgeType").asString())
                        .assertionId(rel.get("assertionId").asString())
                        .sourceId(rel.get("sourceId").asString(null))
                        .confidence(rel.get("confidence").asDouble(0.0))
                        .build();
                });
        });
    }

    @Override
    public long confirmationCount(String entityId) {
        return read("confirmationCount", tx -> {
            GraphEntity c = canonicalEntity(tx, entityId);
            if (c == null) {
                return 0L;
            }
            return tx.run("MATCH (a:Assertion)-[:SUBJECT|OBJECT]->(:KbEntity {entityId: $id}) " +
                    "WHERE a.validationStatus IN ['AUTO_COMMITTED', 'HUMAN_VALIDATED'] " +
                    "RETURN count(DISTINCT a) AS cnt",
                params("id", c.getEntityId())).single().get("cnt").asLong();
        });
    }

    @Override
    public long coOccurrenceCount(String entityA, String entityB) {
        return read("coOccurrenceCount", tx -> {
            GraphEntity a = canonicalEntity(tx, entityA);
            GraphEntity b = canonicalEntity(tx, entityB);
            if (a == null || b == null) {
                return 0L;
            }
            return tx.run("MATCH (x:KbEntity {entityId: $a})<-[:SUBJECT|OBJECT]-(asr:Assertion)" +
                    "-[:SUBJECT|OBJECT]->(y:KbEntity {entityId: $b}) " +
                    "WHERE asr.validationStatus IN ['AUTO_COMMITTED', 'HUMAN_VALIDATED'] " +
                    "RETURN count(DISTINCT asr) AS cnt",
                params("a", a.getEntityId(), "b", b.getEntityId())).single().get("cnt").asLong();
        });
    }

    @Override
    public void mergeEntities(String losingId, String survivingId, String reason) {
        write("mergeEntities", tx -> {
            GraphEntity loser = rawEntity(tx, losingId);
            GraphEntity survivorRaw = rawEntity(tx, survivingId);
            if (loser == null || survivorRaw == null) {
                throw new MergeConflictException("合并的实体不存在: " + losingId + " -> " + survivingId);
            }
            if (losingId.equals(survivingId)) {
                throw new MergeConflictException("不能把实体合并到自身: " + losingId);
            }
            if (loser.isMerged()) {
                throw new MergeConflictException("实体 " + losingId + " 已合并到 " + loser.getMergedInto());
            }
            String target = canonicalEntity(tx, survivingId).getEntityId();
            if (target.equals(losingId)) {
                throw new MergeConflictException("合并会形成环: " + survivingId + " 已并入 " + losingId);
            }

            Map<String, Object> p = params("loser", losingId, "target", target);
            tx.run("MATCH (l:KbEntity {entityId: $loser}), (s:KbEntity {entityId: $target}) " +
                "SET l.mergedInto = $target, " +
                "    s.externalId = coalesce(s.externalId, l.externalId), " +
                "    s.aliases = [x IN coalesce(s.aliases, []) + [l.normalizedName] + coalesce(l.aliases, []) " +
                "                 WHERE x IS NOT NULL AND x <> s.normalizedName]", p).consume();
            // 路径压缩
            tx.run("MATCH (m:KbEntity {mergedInto: $loser}) SET m.mergedInto = $target", p).consume();

            for (String role : new String[]{"SUBJECT", "OBJECT"}) {
                tx.run("MATCH (a:Assertion)-[r:" + role + "]->(l:KbEntity {entityId: $loser}) " +
                    "MATCH (s:KbEntity {entityId: $target}) " +
                    "CREATE (a)-[:" + role + "]->(s) DELETE r", p).consume();
            }
            tx.run("MATCH (ev:TimelineEvent)-[r:INVOLVES]->(l:KbEntity {entityId: $loser}) " +
                "MATCH (s:KbEntity {entityId: $target}) " +
                "CREATE (ev)-[:INVOLVES {role: r.role, originalEntityId: r.originalEntityId}]->(s) DELETE r", p).consume();

            List<Record> loserEdges = tx.run("MATCH (f:KbEntity)-[r]->(t:KbEntity) " +
                "WHERE (f.entityId = $loser OR t.entityId = $loser) AND r.assertionId IS NOT NULL " +
                "RETURN f.entityId AS fromId, t.entityId AS toId, type(r) AS relType, properties(r) AS props, id(r) AS rid",
                p).list();
            for (Record edge : loserEdges) {
                String from = edge.get("fromId").asString().equals(losingId) ? target : edge.get("fromId").asString();
                String to = edge.get("toId").asString().equals(losingId) ? target : edge.get("toId").asString();
                tx.run("MATCH (f:KbEntity {entityId: $from}), (t:KbEntity {entityId: $to}) " +
                        "CREATE (f)-[r:" + edge.get("relType").asString() + "]->(t) SET r = $props",
                    params("from", from, "to", to, "props", edge.get("props").asMap())).consume();
                tx.run("MATCH ()-[r]->() WHERE id(r) = $rid DELETE r",
                    params("rid", edge.get("rid").asLong())).consume();
            }
            logger.info("🔗 Neo4j实体合并: {} -> {}，原因: {}，迁移边 {} 条", losingId, target, reason, loserEdges.size());
            return null;
        });
    }

    @Override
    public Map<String, Object> getStatistics() {
        return read("getStatistics", tx -> {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("entities", count(tx, "MATCH (e:KbEntity) WHERE e.mergedInto IS NULL RETURN count(e) AS cnt"));
            stats.put("mergedEntities", count(tx, "MATCH (e:KbEntity) WHERE e.mergedInto IS NOT NULL RETURN count(e) AS cnt"));
            stats.put("assertions", count(tx, "MATCH (a:Assertion) RETURN count(a) AS cnt"));
            Map<String, Long> byStatus = new LinkedHashMap<>();
            tx.run("MATCH (a:Assertion) RETURN a.validationStatus AS status, count(a) AS cnt ORDER BY status")
                .list().forEach(r -> byStatus.put(r.get("status").asString(), r.get("cnt").asLong()));
            stats.put("assertionsByStatus", byStatus);
            stats.put("events", count(tx, "MATCH (ev:TimelineEvent) RETURN count(ev) AS cnt"));
            stats.put("edges", count(tx, "MATCH (:KbEntity)-[r]->(:KbEntity) WHERE r.assertionId IS NOT NULL RETURN count(r) AS cnt"));
            return stats;
        });
    }

    @Override
    public boolean isAvailable() {
        try (Session session = driver.session()) {
            session.run("RETURN 1").consume();
            return true;
        } catch (Exception e) {
            logger.warn("Neo4j不可用: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getServiceType() {
        return "NEO4J";
    }

    /**
     * 关系类型：谓词转大写下划线，如 attributed-to -> ATTRIBUTED_TO
     */
    static String relationshipType(String predicate) {
        String type = predicate.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_");
        if (!EDGE_TYPE.matcher(type).matches()) {
            return "RELATED_TO";
        }
        return type;
    }

    private void projectEdge(Transaction tx, Assertion assertion) {
        if (!assertion.isEdgeCandidate()) {
            return;
        }
        GraphEntity from = canonicalEntity(tx, assertion.getSubjectEntityId());
        GraphEntity to = canonicalEntity(tx, assertion.getObjectEntityId());
        Map<String, Object> props = new HashMap<>();
        props.put("assertionId", assertion.getAssertionId());
        props.put("edgeType", assertion.getPredicate());
        props.put("sourceId", assertion.getSourceId());
        props.put("confidence", assertion.getConfidence());
        props.put("seq", nextSequence(tx));
        tx.run("MATCH (f:KbEntity {entityId: $from}), (t:KbEntity {entityId: $to}) " +
                "MERGE (f)-[r:" + relationshipType(assertion.getPredicate()) + " {assertionId: $assertionId}]->(t) " +
                "SET r += $props",
            params("from", from.getEntityId(), "to", to.getEntityId(),
                "assertionId", assertion.getAssertionId(), "props", props)).consume();
    }

    private void linkAssertion(Transaction tx, String assertionId, String role, String entityId) {
        GraphEntity target = canonicalEntity(tx, entityId);
        if (target == null) {
            throw new IllegalStateException("断言引用的实体不存在: " + entityId);
        }
        tx.run("MATCH (a:Assertion {assertionId: $aid}), (e:KbEntity {entityId: $eid}) " +
            "CREATE (a)-[:" + role + "]->(e)", params("aid", assertionId, "eid", target.getEntityId())).consume();
    }

    private long nextSequence(Transaction tx) {
        return tx.run("MERGE (s:KbSequence {name: 'global'}) " +
            "SET s.value = coalesce(s.value, 0) + 1 RETURN s.value AS value").single().get("value").asLong();
    }

    private GraphEntity canonicalEntity(Transaction tx, String entityId) {
        List<Record> records = tx.run(CANONICAL, params("id", entityId)).list();
        return records.isEmpty() ? null : toEntity(records.get(0).get("e"));
    }

    private GraphEntity rawEntity(Transaction tx, String entityId) {
        List<Record> records = tx.run("MATCH (e:KbEntity {entityId: $id}) RETURN e", params("id", entityId)).list();
        return records.isEmpty() ? null : toEntity(records.get(0).get("e"));
    }

    private long count(Transaction tx, String cypher) {
        return tx.run(cypher).single().get("cnt").asLong();
    }

    private <T> T write(String operation, TransactionWork<T> work) {
        try (Session session = driver.session()) {
            return session.writeTransaction(work);
        } catch (ClientException e) {
            if (CONSTRAINT_FAILED.equals(e.code())) {
                // 唯一约束冲突交给调用方按幂等语义处理
                throw e;
            }
            logger.error("❌ Neo4j写入失败: op={}, {}", operation, e.getMessage());
            throw new RetryableResolutionFailure("Neo4j写入失败: " + operation, e);
        } catch (Neo4jException e) {
            logger.error("❌ Neo4j写入失败: op={}, {}", operation, e.getMessage());
            throw new RetryableResolutionFailure("Neo4j写入失败: " + operation, e);
        }
    }

    private <T> T read(String operation, TransactionWork<T> work) {
        try (Session session = driver.session()) {
            return session.readTransaction(work);
        } catch (Neo4jException e) {
            logger.error("❌ Neo4j查询失败: op={}, {}", operation, e.getMessage());
            throw new RetryableResolutionFailure("Neo4j查询失败: " + operation, e);
        }
    }

    private static Map<String, Object> params(Object... kv) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            params.put((String) kv[i], kv[i + 1]);
        }
        return params;
    }

    private static Long epoch(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant instant(Value value) {
        return value == null || value.isNull() ? null : Instant.ofEpochMilli(value.asLong());
    }

    private static GraphEntity toEntity(Value node) {
        return GraphEntity.builder()
            .entityId(node.get("entityId").asString())
            .typeTag(EntityType.parse(node.get("typeTag").asString(null)))
            .canonicalName(node.get("canonicalName").asString(null))
            .normalizedName(node.get("normalizedName").asString(null))
            .externalId(node.get("externalId").asString(null))
            .description(node.get("description").asString(null))
            .creationKey(node.get("creationKey").asString(null))
            .mergedInto(node.get("mergedInto").asString(null))
            .createdAt(instant(node.get("createdAt")))
            .properties(new HashMap<>())
            .build();
    }

    private static Map<String, Object> assertionProps(Assertion a) {
        Map<String, Object> props = new HashMap<>();
        props.put("assertionId", a.getAssertionId());
        props.put("subjectEntityId", a.getSubjectEntityId());
        props.put("predicate", a.getPredicate());
        props.put("objectEntityId", a.getObjectEntityId());
        props.put("objectLiteral", a.getObjectLiteral());
        props.put("relationship", a.isRelationship());
        props.put("confidence", a.getConfidence());
        props.put("sourceId", a.getSourceId());
        props.put("observedAt", epoch(a.getObservedAt()));
        props.put("recordedAt", epoch(a.getRecordedAt()));
        props.put("validationStatus", a.getValidationStatus().name());
        props.put("resolvedAt", epoch(a.getResolvedAt()));
        props.put("idempotencyKey", a.getIdempotencyKey());
        props.put("supersedes", a.getSupersedes());
        props.put("sourceTextRef", a.getSourceTextRef());
        return props;
    }

    private static Assertion toAssertion(Value node) {
        return Assertion.builder()
            .assertionId(node.get("assertionId").asString())
            .subjectEntityId(node.get("subjectEntityId").asString())
            .predicate(node.get("predicate").asString())
            .objectEntityId(node.get("objectEntityId").asString(null))
            .objectLiteral(node.get("objectLiteral").asString(null))
            .relationship(node.get("relationship").asBoolean(false))
            .confidence(node.get("confidence").asDouble(0.0))
            .sourceId(node.get("sourceId").asString(null))
            .observedAt(instant(node.get("observedAt")))
            .recordedAt(instant(node.get("recordedAt")))
            .validationStatus(ValidationStatus.valueOf(node.get("validationStatus").asString()))
            .resolvedAt(instant(node.get("resolvedAt")))
            .idempotencyKey(node.get("idempotencyKey").asString(null))
            .supersedes(node.get("supersedes").asString(null))
            .sourceTextRef(node.get("sourceTextRef").asString(null))
            .build();
    }

    private TimelineEvent toEvent(Transaction tx, Value node) {
        String eventId = node.get("eventId").asString();
        List<EventParticipant> participants = tx.run(
            "MATCH (:TimelineEvent {eventId: $id})-[r:INVOLVES]->(e:KbEntity) " +
                "RETURN coalesce(r.originalEntityId, e.entityId) AS entityId, r.role AS role ORDER BY entityId",
            params("id", eventId)).list(r -> new EventParticipant(r.get("entityId").asString(), r.get("role").asString(null)));
        return TimelineEvent.builder()
            .eventId(eventId)
            .eventType(node.get("eventType").asString())
            .startTime(instant(node.get("startTime")))
            .endTime(instant(node.get("endTime")))
            .sourceId(node.get("sourceId").asString(null))
            .description(node.get("description").asString(null))
            .recordedAt(instant(node.get("recordedAt")))
            .sequence(node.get("sequence").asLong())
            .idempotencyKey(node.get("idempotencyKey").asString(null))
            .participants(participants)
            .build();
    }
}
