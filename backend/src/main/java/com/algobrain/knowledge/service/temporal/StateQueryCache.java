package com.algobrain.knowledge.service.temporal;

import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.model.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 时序状态查询缓存
 *
 * 策略：
 * 1. 按 (实体, 查询时刻) 缓存派生状态
 * 2. 该实体有新事件写入或发生合并时精确失效
 * 3. 定时清理过期条目
 *
 * 每个实体有一个失效代数：读取前记下代数，写回时代数已变化说明期间发生过失效，结果作废
 */
@Component
public class StateQueryCache {

    private static final Logger logger = LoggerFactory.getLogger(StateQueryCache.class);

    private final long ttlMs;

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();

    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();

    @Autowired
    public StateQueryCache(EngineConfig engineConfig) {
        this.ttlMs = engineConfig.getStateCacheTtlMs();
    }

    public Optional<StateSnapshot> get(String entityId, Instant asOf) {
        String key = buildKey(entityId, asOf);
        CacheEntry entry = cache.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (System.currentTimeMillis() - entry.timestamp > ttlMs) {
            cache.remove(key);
            logger.debug("缓存过期: {}", key);
            return Optional.empty();
        }
        logger.debug("缓存命中: {}", key);
        return Optional.of(entry.snapshot);
    }

    /**
     * 当前失效代数，在读取事件之前调用
     */
    public long generation(String entityId) {
        AtomicLong generation = generations.get(entityId);
        return generation == null ? 0L : generation.get();
    }

    /**
     * @param generation 计算前由 {@link #generation(String)} 取得的代数
     * @return 是否写入缓存
     */
    public boolean put(String entityId, Instant asOf, StateSnapshot snapshot, long generation) {
        if (generation(entityId) != generation) {
            logger.debug("状态计算期间实体已失效，不写缓存: entityId={}", entityId);
            return false;
        }
        CacheEntry entry = new CacheEntry();
        entry.timestamp = System.currentTimeMillis();
        entry.snapshot = snapshot;
        String key = buildKey(entityId, asOf);
        cache.put(key, entry);
        // 检查与写入之间发生的失效
        if (generation(entityId) != generation) {
            cache.remove(key, entry);
            return false;
        }
        return true;
    }

    /**
     * 失效实体的所有缓存；先推进代数再删除条目
     */
    public void invalidateEntity(String entityId) {
        generations.computeIfAbsent(entityId, k -> new AtomicLong()).incrementAndGet();
        String prefix = entityId + "|";
        cache.keySet().removeIf(key -> key.startsWith(prefix));
        logger.debug("失效实体状态缓存: entityId={}", entityId);
    }

    static String buildKey(String entityId, Instant asOf) {
        return entityId + "|" + asOf.toEpochMilli();
    }

    /**
     * 定时清理过期缓存
     */
    @Scheduled(fixedRate = 10 * 60 * 1000)
    public void cleanExpiredCache() {
        long now = System.currentTimeMillis();
        int removedCount = 0;

        Iterator<Map.Entry<String, CacheEntry>> iterator = cache.entrySet().iterator();
        while (iterator.hasNext()) {
            if (now - iterator.next().getValue().timestamp > ttlMs) {
                iterator.remove();
                removedCount++;
            }
        }
        if (removedCount > 0) {
            logger.info("清理过期状态缓存: 移除{}个条目", removedCount);
        }
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        long now = System.currentTimeMillis();
        long validCount = cache.values().stream().filter(e -> now - e.timestamp <= ttlMs).count();
        stats.put("totalEntries", cache.size());
        stats.put("validEntries", validCount);
        stats.put("expiredEntries", cache.size() - validCount);
        return stats;
    }

    private static class CacheEntry {
        long timestamp;
        StateSnapshot snapshot;
    }
}
