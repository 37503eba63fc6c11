package com.algobrain.knowledge.service.resolve;

import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.exception.MergeConflictException;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.service.temporal.StateQueryCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 实体合并（审核人确认两个实体是同一对象时执行）
 *
 * 失败方保留合并指针，ID 永不复用；所有读取沿指针解析到存活实体
 */
@Slf4j
@Service
public class EntityMergeService {

    private final IEvidenceStore evidenceStore;
    private final EntityLockRegistry lockRegistry;
    private final StateQueryCache stateCache;
    private final EngineConfig engineConfig;

    @Autowired
    public EntityMergeService(IEvidenceStore evidenceStore, EntityLockRegistry lockRegistry,
                              StateQueryCache stateCache, EngineConfig engineConfig) {
        this.evidenceStore = evidenceStore;
        this.lockRegistry = lockRegistry;
        this.stateCache = stateCache;
        this.engineConfig = engineConfig;
    }

    /**
     * @return 存活实体
     */
    public GraphEntity merge(String losingId, String survivingId, String reason) {
        GraphEntity loser = evidenceStore.getEntity(losingId)
            .orElseThrow(() -> new MergeConflictException("实体不存在: " + losingId));
        GraphEntity survivor = evidenceStore.getEntity(survivingId)
            .orElseThrow(() -> new MergeConflictException("实体不存在: " + survivingId));

        // 同时锁住实体ID与创建键，阻止合并期间按创建键新建或采用失败方
        List<String> keys = new ArrayList<>();
        keys.add(losingId);
        keys.add(survivingId);
        keys.add(loser.getCreationKey());
        keys.add(survivor.getCreationKey());

        String canonicalId = lockRegistry.withLocks(keys, engineConfig.getLockTimeoutMs(), () -> {
            evidenceStore.mergeEntities(losingId, survivingId, reason);
            String canonical = evidenceStore.resolveCanonicalId(survivingId);
            // 锁内失效；锁外并发计算的旧状态由缓存代数拦截
            stateCache.invalidateEntity(losingId);
            stateCache.invalidateEntity(survivingId);
            stateCache.invalidateEntity(canonical);
            return canonical;
        });
        log.info("🔗 实体已合并: {} -> {}，原因: {}", losingId, canonicalId, reason);
        return evidenceStore.getEntity(canonicalId)
            .orElseThrow(() -> new IllegalStateException("合并后未找到存活实体: " + canonicalId));
    }
}
