package com.algobrain.knowledge.service.graph;

import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.CommitResult;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.MaterializedEdge;
import com.algobrain.knowledge.model.TimelineEvent;
import com.algobrain.knowledge.model.ValidationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 证据库统一接口
 *
 * 断言与事件只追加不修改（人工裁定状态除外）；边投影只是已接受关系断言的派生视图。
 * 提供 Neo4j 和内存两种实现，运行时根据 graph.neo4j.enabled 选择。
 * 存储故障统一抛出 RetryableResolutionFailure
 */
public interface IEvidenceStore {

    /**
     * 按创建键原子创建实体；键已存在时返回既有实体，duplicate=true
     */
    CommitResult<GraphEntity> createEntityIfAbsent(GraphEntity entity);

    /**
     * 按创建键查找（跟随合并指针）
     */
    Optional<GraphEntity> findByCreationKey(String creationKey);

    /**
     * 按外部标识查找活跃实体（跟随合并指针）
     */
    Optional<GraphEntity> findByExternalId(String externalId);

    /**
     * 按归一化名称查找，包括以别名登记的实体，结果均为活跃实体
     */
    List<GraphEntity> findByNormalizedName(String normalizedName);

    /**
     * 原样读取实体（可能是已合并实体）
     */
    Optional<GraphEntity> getEntity(String entityId);

    /**
     * 沿合并指针找到存活实体ID；未知实体返回 null
     */
    String resolveCanonicalId(String entityId);

    /**
     * 所有活跃实体
     */
    List<GraphEntity> listEntities();

    /**
     * 记录实体别名，合并及消解命中不同写法时使用
     */
    void addAlias(String entityId, String normalizedName);

    /**
     * 幂等追加断言；同一幂等键重复提交返回原断言，duplicate=true
     */
    CommitResult<Assertion> commitAssertion(Assertion assertion);

    /**
     * 唯一允许的状态迁移：PENDING -> HUMAN_VALIDATED / HUMAN_REJECTED
     *
     * @throws IllegalStateException 断言不存在或不在 PENDING 状态
     */
    Assertion updateValidationStatus(String assertionId, ValidationStatus status, Instant resolvedAt);

    Optional<Assertion> getAssertion(String assertionId);

    /**
     * 实体（作为主语或宾语）的全部断言，包括冲突与被拒绝的，按入库顺序
     */
    List<Assertion> getAssertions(String entityId, String predicate);

    /**
     * 已人工裁定断言的快照
     */
    List<Assertion> getResolvedAssertions();

    /**
     * resolvedAt >= since 的人工确认断言，按 resolvedAt 升序
     */
    List<Assertion> getValidatedSince(Instant since);

    /**
     * 幂等追加事件，存储分配写入序号
     */
    CommitResult<TimelineEvent> appendEvent(TimelineEvent event);

    /**
     * 实体参与的事件，按 (有效时间, 序号) 升序
     */
    List<TimelineEvent> getEvents(String entityId);

    /**
     * 实体出边与入边
     */
    List<MaterializedEdge> getEdges(String entityId, String edgeType);

    /**
     * 已接受断言中实体作为主语或宾语出现的次数
     */
    long confirmationCount(String entityId);

    /**
     * 两实体之间已接受断言的数量（任一方向）
     */
    long coOccurrenceCount(String entityA, String entityB);

    /**
     * 合并实体：索引、断言引用、事件与边迁移到存活实体，失败方留下合并指针
     *
     * @throws com.algobrain.knowledge.exception.MergeConflictException 合并目标非法
     */
    void mergeEntities(String losingId, String survivingId, String reason);

    Map<String, Object> getStatistics();

    boolean isAvailable();

    String getServiceType();
}
