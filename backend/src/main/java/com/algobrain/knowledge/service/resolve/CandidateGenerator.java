package com.algobrain.knowledge.service.resolve;

import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.ResolutionCandidate;
import com.algobrain.knowledge.model.SimilarityHit;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.service.similarity.SimilarityService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 候选生成：外部标识精确匹配 → 归一化名称匹配 → 相似度近邻
 *
 * 结果均为活跃实体（已沿合并指针解析），去重后截断到短名单上限
 */
@Slf4j
@Component
public class CandidateGenerator {

    private final IEvidenceStore evidenceStore;
    private final SimilarityService similarityService;
    private final EngineConfig engineConfig;

    @Autowired
    public CandidateGenerator(IEvidenceStore evidenceStore, SimilarityService similarityService,
                              EngineConfig engineConfig) {
        this.evidenceStore = evidenceStore;
        this.similarityService = similarityService;
        this.engineConfig = engineConfig;
    }

    public List<ResolutionCandidate> generate(EntityDescriptor descriptor) {
        int limit = engineConfig.getShortlistSize();
        Map<String, ResolutionCandidate> shortlist = new LinkedHashMap<>();

        boolean externalHit = false;
        if (descriptor.getExternalId() != null) {
            Optional<GraphEntity> byExternal = evidenceStore.findByExternalId(descriptor.getExternalId());
            if (byExternal.isPresent()) {
                shortlist.put(byExternal.get().getEntityId(), new ResolutionCandidate(byExternal.get(), 0.0, false));
                externalHit = true;
            }
        }

        if (descriptor.getNormalizedName() != null && !descriptor.getNormalizedName().isEmpty()) {
            for (GraphEntity entity : evidenceStore.findByNormalizedName(descriptor.getNormalizedName())) {
                if (shortlist.size() >= limit) {
                    break;
                }
                shortlist.putIfAbsent(entity.getEntityId(), new ResolutionCandidate(entity, 0.0, true));
            }
        }

        // 外部标识已精确命中时不再调用相似度服务
        if (!externalHit && shortlist.size() < limit) {
            for (SimilarityHit hit : similarityService.nearest(descriptor.searchText(), limit)) {
                if (shortlist.size() >= limit) {
                    break;
                }
                String canonicalId = evidenceStore.resolveCanonicalId(hit.getEntityId());
                if (canonicalId == null) {
                    log.debug("相似度服务返回未知实体: {}", hit.getEntityId());
                    continue;
                }
                ResolutionCandidate existing = shortlist.get(canonicalId);
                if (existing != null) {
                    if (hit.getScore() > existing.getSimilarity()) {
                        shortlist.put(canonicalId, new ResolutionCandidate(existing.getEntity(), hit.getScore(),
                            existing.isNameIndexHit()));
                    }
                    continue;
                }
                evidenceStore.getEntity(canonicalId).ifPresent(entity ->
                    shortlist.put(canonicalId, new ResolutionCandidate(entity, hit.getScore(), false)));
            }
        }

        return new ArrayList<>(shortlist.values());
    }
}
