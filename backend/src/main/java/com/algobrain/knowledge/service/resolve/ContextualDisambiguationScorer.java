package com.algobrain.knowledge.service.resolve;

import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.EntityType;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.ResolutionCandidate;
import com.algobrain.knowledge.model.ResolutionContext;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.util.NameNormalizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 默认消歧打分
 *
 * 1. 外部标识一致直接得 1.0，不一致得 0
 * 2. 名称：完全一致 1.0，别名 0.95，否则词项 Jaccard × 0.8
 * 3. 相似度得分按来源可信度加权：sim × (0.7 + 0.3 × reliability)
 * 4. 类型不兼容减半
 * 5. 与事实另一端实体的历史共现加分，每次 0.02，上限 0.1
 */
@Component
public class ContextualDisambiguationScorer implements DisambiguationScorer {

    static final double ALIAS_SCORE = 0.95;
    static final double TOKEN_WEIGHT = 0.8;
    static final double CO_OCCURRENCE_STEP = 0.02;
    static final double CO_OCCURRENCE_CAP = 0.1;

    private final IEvidenceStore evidenceStore;

    @Autowired
    public ContextualDisambiguationScorer(IEvidenceStore evidenceStore) {
        this.evidenceStore = evidenceStore;
    }

    @Override
    public double score(EntityDescriptor descriptor, ResolutionCandidate candidate, ResolutionContext context) {
        GraphEntity entity = candidate.getEntity();

        if (descriptor.getExternalId() != null && entity.getExternalId() != null) {
            return descriptor.getExternalId().equals(entity.getExternalId()) ? 1.0 : 0.0;
        }

        double nameScore;
        if (descriptor.getNormalizedName() != null && descriptor.getNormalizedName().equals(entity.getNormalizedName())) {
            nameScore = 1.0;
        } else if (candidate.isNameIndexHit()) {
            nameScore = ALIAS_SCORE;
        } else {
            nameScore = NameNormalizer.jaccard(NameNormalizer.tokens(descriptor.getNormalizedName()),
                NameNormalizer.tokens(entity.getNormalizedName())) * TOKEN_WEIGHT;
        }

        double reliability = context == null ? 0.5 : context.getSourceReliability();
        double similarityScore = candidate.getSimilarity() * (0.7 + 0.3 * reliability);
        double score = Math.max(nameScore, similarityScore);

        EntityType type = descriptor.getTypeTag() == null ? EntityType.UNKNOWN : descriptor.getTypeTag();
        if (!type.isCompatibleWith(entity.getTypeTag())) {
            score *= 0.5;
        }

        if (context != null && context.getCounterpartEntityId() != null
            && !context.getCounterpartEntityId().equals(entity.getEntityId())) {
            long together = evidenceStore.coOccurrenceCount(entity.getEntityId(), context.getCounterpartEntityId());
            score += Math.min(CO_OCCURRENCE_CAP, CO_OCCURRENCE_STEP * together);
        }
        return Math.min(1.0, score);
    }
}
