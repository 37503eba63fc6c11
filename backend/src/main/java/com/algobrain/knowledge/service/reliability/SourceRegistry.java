package com.algobrain.knowledge.service.reliability;

import com.algobrain.domain.entity.Source;
import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.repository.SourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 来源登记表
 *
 * 热路径（归一化、路由）频繁读取可信度，这里保留一份进程内副本，
 * 可信度重算后同步刷新
 */
@Slf4j
@Service
public class SourceRegistry {

    @Autowired
    private SourceRepository sourceRepository;
    @Autowired
    private EngineConfig engineConfig;

    private final Map<String, Source> sources = new ConcurrentHashMap<>();

    /**
     * 登记来源，已存在时直接返回（不会覆盖可信度）
     */
    public Source register(String sourceId, String displayName, String sourceKind) {
        if (StringUtils.isBlank(sourceId)) {
            throw new IllegalArgumentException("sourceId不能为空");
        }
        Source existing = find(sourceId);
        if (existing != null) {
            return existing;
        }

        Source source = new Source();
        source.setSourceId(sourceId);
        source.setDisplayName(StringUtils.defaultIfBlank(displayName, sourceId));
        source.setSourceKind(parseKind(sourceKind));
        source.setReliabilityScore(engineConfig.getNeutralScore());
        source.setResolvedCount(0);
        try {
            sourceRepository.insert(source);
            log.info("📌 登记新来源: sourceId={}, kind={}", sourceId, source.getSourceKind());
        } catch (DuplicateKeyException e) {
            // 并发登记，读取对方写入的记录
            log.debug("来源已被并发登记: {}", sourceId);
            Source stored = sourceRepository.selectById(sourceId);
            if (stored != null) {
                source = stored;
            }
        }
        sources.put(sourceId, source);
        return source;
    }

    public Source find(String sourceId) {
        if (StringUtils.isBlank(sourceId)) {
            return null;
        }
        Source cached = sources.get(sourceId);
        if (cached != null) {
            return cached;
        }
        Source stored = sourceRepository.selectById(sourceId);
        if (stored != null) {
            sources.put(sourceId, stored);
        }
        return stored;
    }

    public boolean isRegistered(String sourceId) {
        return find(sourceId) != null;
    }

    /**
     * 来源可信度，未登记或未计算时返回中性值
     */
    public double getReliability(String sourceId) {
        Source source = find(sourceId);
        if (source == null || source.getReliabilityScore() == null) {
            return engineConfig.getNeutralScore();
        }
        return source.getReliabilityScore();
    }

    public List<Source> listAll() {
        List<Source> all = sourceRepository.findAllOrdered();
        all.forEach(s -> sources.put(s.getSourceId(), s));
        return all;
    }

    /**
     * 写入可信度（只由可信度追踪任务调用）
     */
    public void updateReliability(String sourceId, double score, int resolvedCount) {
        LocalDateTime now = LocalDateTime.now();
        int updated = sourceRepository.updateReliability(sourceId, score, resolvedCount, now);
        if (updated == 0) {
            log.warn("更新可信度时未找到来源: {}", sourceId);
            return;
        }
        sources.computeIfPresent(sourceId, (id, cached) -> {
            cached.setReliabilityScore(score);
            cached.setResolvedCount(resolvedCount);
            cached.setLastRecomputedAt(now);
            return cached;
        });
    }

    private Source.SourceKind parseKind(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Source.SourceKind.LLM_EXTRACTION;
        }
        try {
            return Source.SourceKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("未知来源类别 {}，按 LLM_EXTRACTION 处理", raw);
            return Source.SourceKind.LLM_EXTRACTION;
        }
    }
}
