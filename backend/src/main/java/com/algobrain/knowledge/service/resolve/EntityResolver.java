package com.algobrain.knowledge.service.resolve;

import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.exception.AmbiguousResolutionException;
import com.algobrain.knowledge.exception.MalformedRecordException;
import com.algobrain.knowledge.model.CommitResult;
import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.EntityType;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.ResolutionCandidate;
import com.algobrain.knowledge.model.ResolutionContext;
import com.algobrain.knowledge.model.ResolutionResult;
import com.algobrain.knowledge.model.ScoredCandidate;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.service.similarity.SimilarityService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 实体消解：把实体描述映射到唯一的规范实体
 *
 * 候选生成 → 消歧打分 → 接受 / 新建。相同输入与相同图谱状态下结果确定
 */
@Slf4j
@Service
public class EntityResolver {

    /** 排序：得分降序 → 历史确认数降序 → 实体ID升序 */
    static final Comparator<ScoredCandidate> RANKING = Comparator
        .comparingDouble(ScoredCandidate::getScore).reversed()
        .thenComparing(Comparator.comparingLong(ScoredCandidate::getConfirmationCount).reversed())
        .thenComparing(ScoredCandidate::getEntityId);

    private final IEvidenceStore evidenceStore;
    private final CandidateGenerator candidateGenerator;
    private final DisambiguationScorer scorer;
    private final SimilarityService similarityService;
    private final EntityLockRegistry lockRegistry;
    private final EngineConfig engineConfig;

    @Autowired
    public EntityResolver(IEvidenceStore evidenceStore, CandidateGenerator candidateGenerator,
                          DisambiguationScorer scorer, SimilarityService similarityService,
                          EntityLockRegistry lockRegistry, EngineConfig engineConfig) {
        this.evidenceStore = evidenceStore;
        this.candidateGenerator = candidateGenerator;
        this.scorer = scorer;
        this.similarityService = similarityService;
        this.lockRegistry = lockRegistry;
        this.engineConfig = engineConfig;
    }

    /**
     * @throws AmbiguousResolutionException 多个候选无法区分，需要人工裁定
     * @throws com.algobrain.knowledge.exception.RetryableResolutionFailure 相似度服务或存储暂不可用
     */
    public ResolutionResult resolve(EntityDescriptor descriptor, ResolutionContext context) {
        if (descriptor.getPinnedEntityId() != null) {
            String canonicalId = evidenceStore.resolveCanonicalId(descriptor.getPinnedEntityId());
            if (canonicalId == null) {
                throw new MalformedRecordException("指定的实体不存在: " + descriptor.getPinnedEntityId(),
                    context == null ? null : context.getSourceId());
            }
            return new ResolutionResult(canonicalId, ResolutionResult.Outcome.PINNED, 1.0, List.of());
        }

        List<ScoredCandidate> ranked = rank(descriptor, context);
        ScoredCandidate top = ranked.isEmpty() ? null : ranked.get(0);

        if (top == null || top.getScore() < engineConfig.getAcceptanceThreshold()) {
            return createOrAdopt(descriptor, ranked);
        }

        List<ScoredCandidate> rivals = ranked.stream()
            .skip(1)
            .filter(c -> isAmbiguousRival(top, c))
            .collect(Collectors.toList());
        if (!rivals.isEmpty()) {
            List<String> ids = new ArrayList<>();
            ids.add(top.getEntityId());
            rivals.forEach(r -> ids.add(r.getEntityId()));
            log.info("⚖️ 实体消解存在歧义: name={}, 候选={}", descriptor.getName(), ids);
            throw new AmbiguousResolutionException(descriptor.getName(), top.getEntityId(), ids);
        }

        if (descriptor.getExternalId() != null && descriptor.getNormalizedName() != null) {
            // 外部标识命中时记录新的名称写法
            evidenceStore.getEntity(top.getEntityId())
                .filter(e -> e.getExternalId() != null && e.getExternalId().equals(descriptor.getExternalId()))
                .filter(e -> !descriptor.getNormalizedName().equals(e.getNormalizedName()))
                .ifPresent(e -> evidenceStore.addAlias(e.getEntityId(), descriptor.getNormalizedName()));
        }
        return new ResolutionResult(top.getEntityId(), ResolutionResult.Outcome.MATCHED, top.getScore(), ranked);
    }

    /**
     * 只做候选生成与打分，不创建实体，供查询接口解释消解过程
     */
    public List<ScoredCandidate> rank(EntityDescriptor descriptor, ResolutionContext context) {
        List<ResolutionCandidate> candidates = candidateGenerator.generate(descriptor);
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (ResolutionCandidate candidate : candidates) {
            double score = scorer.score(descriptor, candidate, context);
            scored.add(new ScoredCandidate(candidate.getEntityId(), score,
                evidenceStore.confirmationCount(candidate.getEntityId())));
        }
        scored.sort(RANKING);
        return scored;
    }

    /**
     * 得分在容差内但不完全相同，且历史确认数不能区分两者
     */
    private boolean isAmbiguousRival(ScoredCandidate top, ScoredCandidate rival) {
        double gap = top.getScore() - rival.getScore();
        return gap > 0
            && gap <= engineConfig.getAmbiguityEpsilon()
            && top.getConfirmationCount() <= rival.getConfirmationCount();
    }

    private ResolutionResult createOrAdopt(EntityDescriptor descriptor, List<ScoredCandidate> ranked) {
        String creationKey = descriptor.creationKey();
        ResolutionResult result = lockRegistry.withLock(creationKey, engineConfig.getLockTimeoutMs(), () -> {
            Optional<GraphEntity> existing = evidenceStore.findByCreationKey(creationKey);
            if (existing.isPresent()) {
                return new ResolutionResult(existing.get().getEntityId(), ResolutionResult.Outcome.ADOPTED, 1.0, ranked);
            }
            CommitResult<GraphEntity> created = evidenceStore.createEntityIfAbsent(newEntity(descriptor, creationKey));
            ResolutionResult.Outcome outcome = created.isDuplicate()
                ? ResolutionResult.Outcome.ADOPTED
                : ResolutionResult.Outcome.CREATED;
            return new ResolutionResult(created.getRecord().getEntityId(), outcome, 1.0, ranked);
        });

        // 相似度索引登记可能是网络调用，放在锁外
        if (result.getOutcome() == ResolutionResult.Outcome.CREATED) {
            evidenceStore.getEntity(result.getEntityId()).ifPresent(similarityService::index);
            log.info("➕ 新建实体: {} [{}] {}", result.getEntityId(), descriptor.getTypeTag(), descriptor.getName());
        }
        return result;
    }

    private GraphEntity newEntity(EntityDescriptor descriptor, String creationKey) {
        return GraphEntity.builder()
            .entityId("ent-" + UUID.randomUUID())
            .typeTag(descriptor.getTypeTag() == null ? EntityType.UNKNOWN : descriptor.getTypeTag())
            .canonicalName(descriptor.getName())
            .normalizedName(descriptor.getNormalizedName())
            .externalId(descriptor.getExternalId())
            .creationKey(creationKey)
            .createdAt(Instant.now())
            .build();
    }
}
