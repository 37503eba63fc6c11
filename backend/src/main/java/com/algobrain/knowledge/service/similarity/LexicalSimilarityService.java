package com.algobrain.knowledge.service.similarity;

import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.SimilarityHit;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.util.NameNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 词项相似度（默认实现，不依赖外部向量服务）
 *
 * 得分 = 0.5 * Jaccard + 0.5 * 实体名称词项覆盖率
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "similarity.enabled", havingValue = "false", matchIfMissing = true)
public class LexicalSimilarityService implements SimilarityService {

    private final IEvidenceStore evidenceStore;

    private final Map<String, Set<String>> tokenIndex = new ConcurrentHashMap<>();

    private volatile boolean warmedUp = false;

    @Autowired
    public LexicalSimilarityService(IEvidenceStore evidenceStore) {
        this.evidenceStore = evidenceStore;
    }

    @Override
    public List<SimilarityHit> nearest(String text, int k) {
        warmUp();
        Set<String> query = NameNormalizer.tokens(text);
        if (query.isEmpty() || k <= 0) {
            return List.of();
        }
        return tokenIndex.entrySet().stream()
            .map(e -> new SimilarityHit(e.getKey(), score(query, e.getValue())))
            .filter(hit -> hit.getScore() > 0)
            .sorted(Comparator.comparingDouble(SimilarityHit::getScore).reversed()
                .thenComparing(SimilarityHit::getEntityId))
            .limit(k)
            .collect(Collectors.toList());
    }

    @Override
    public void index(GraphEntity entity) {
        Set<String> tokens = NameNormalizer.tokens(entity.getCanonicalName());
        if (!tokens.isEmpty()) {
            tokenIndex.put(entity.getEntityId(), tokens);
        }
    }

    static double score(Set<String> query, Set<String> name) {
        if (name.isEmpty()) {
            return 0.0;
        }
        long overlap = name.stream().filter(query::contains).count();
        double coverage = (double) overlap / name.size();
        return 0.5 * NameNormalizer.jaccard(query, name) + 0.5 * coverage;
    }

    /**
     * 首次检索时从证据库加载已有实体（重启后恢复索引）
     */
    private void warmUp() {
        if (warmedUp) {
            return;
        }
        synchronized (this) {
            if (warmedUp) {
                return;
            }
            List<GraphEntity> entities = evidenceStore.listEntities();
            entities.forEach(this::index);
            warmedUp = true;
            log.info("📚 词项相似度索引加载完成: {} 个实体", entities.size());
        }
    }
}
