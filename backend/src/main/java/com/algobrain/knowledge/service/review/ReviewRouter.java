package com.algobrain.knowledge.service.review;

import com.algobrain.domain.entity.ReviewTask;
import com.algobrain.dto.RawCandidateFact;
import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.exception.AmbiguousResolutionException;
import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.CandidateFact;
import com.algobrain.knowledge.model.CommitResult;
import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.FactOutcome;
import com.algobrain.knowledge.model.FactResult;
import com.algobrain.knowledge.model.ResolutionContext;
import com.algobrain.knowledge.model.ReviewOutcome;
import com.algobrain.knowledge.model.ValidationStatus;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.service.normalize.RecordNormalizer;
import com.algobrain.knowledge.service.reliability.SourceRegistry;
import com.algobrain.knowledge.service.resolve.EntityResolver;
import com.algobrain.knowledge.util.IdempotencyKeys;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 审核路由
 *
 * 置信度达到阈值的断言自动入库（AUTO_COMMITTED），其余以 PENDING 入库并进入审核队列；
 * PENDING 断言只能由人工裁定为 HUMAN_VALIDATED 或 HUMAN_REJECTED
 */
@Slf4j
@Service
public class ReviewRouter {

    private final IEvidenceStore evidenceStore;
    private final ReviewQueueService reviewQueue;
    private final SourceRegistry sourceRegistry;
    private final RecordNormalizer normalizer;
    private final EntityResolver entityResolver;
    private final EngineConfig engineConfig;

    @Autowired
    public ReviewRouter(IEvidenceStore evidenceStore, ReviewQueueService reviewQueue, SourceRegistry sourceRegistry,
                        RecordNormalizer normalizer, EntityResolver entityResolver, EngineConfig engineConfig) {
        this.evidenceStore = evidenceStore;
        this.reviewQueue = reviewQueue;
        this.sourceRegistry = sourceRegistry;
        this.normalizer = normalizer;
        this.entityResolver = entityResolver;
        this.engineConfig = engineConfig;
    }

    /**
     * 来源的有效阈值：base + (neutral - reliability) × swing，截断到 [0,1]
     */
    public double effectiveThreshold(String sourceId) {
        double swing = engineConfig.getReliabilityThresholdSwing();
        double threshold = engineConfig.getReviewThreshold();
        if (swing != 0.0) {
            threshold += (engineConfig.getNeutralScore() - sourceRegistry.getReliability(sourceId)) * swing;
        }
        return Math.max(0.0, Math.min(1.0, threshold));
    }

    /**
     * 把已消解的事实写入证据库并决定去向
     *
     * @param ambiguousCandidates 非空表示实体消解存在歧义，无论置信度都进入审核
     */
    public FactResult route(CandidateFact fact, String subjectEntityId, String objectEntityId,
                            List<String> ambiguousCandidates) {
        boolean ambiguous = ambiguousCandidates != null && !ambiguousCandidates.isEmpty();
        boolean autoCommit = !ambiguous && fact.getConfidence() >= effectiveThreshold(fact.getSourceId());

        Assertion assertion = Assertion.builder()
            .subjectEntityId(subjectEntityId)
            .predicate(fact.getPredicate())
            .objectEntityId(fact.hasEntityObject() ? objectEntityId : null)
            .objectLiteral(fact.hasEntityObject() ? null : fact.getObjectLiteral())
            .relationship(fact.isRelationship())
            .confidence(fact.getConfidence())
            .sourceId(fact.getSourceId())
            .observedAt(fact.getObservedAt())
            .validationStatus(autoCommit ? ValidationStatus.AUTO_COMMITTED : ValidationStatus.PENDING)
            .idempotencyKey(IdempotencyKeys.forFact(fact))
            .sourceTextRef(fact.getSourceTextRef())
            .build();

        CommitResult<Assertion> committed = evidenceStore.commitAssertion(assertion);
        Assertion stored = committed.getRecord();
        ReviewTask.ReviewReason reason = ambiguous
            ? ReviewTask.ReviewReason.AMBIGUOUS_RESOLUTION
            : ReviewTask.ReviewReason.LOW_CONFIDENCE;

        if (committed.isDuplicate()) {
            // 上次写入断言后未来得及建审核任务，补建
            if (stored.getValidationStatus() == ValidationStatus.PENDING
                && reviewQueue.findByAssertionId(stored.getAssertionId()) == null) {
                reviewQueue.enqueue(stored, reason, ambiguousCandidates);
            }
            return FactResult.of(FactOutcome.DUPLICATE, stored.getAssertionId());
        }

        if (stored.getValidationStatus() == ValidationStatus.PENDING) {
            reviewQueue.enqueue(stored, reason, ambiguousCandidates);
            return FactResult.of(FactOutcome.QUEUED_FOR_REVIEW, stored.getAssertionId());
        }
        return FactResult.of(FactOutcome.AUTO_COMMITTED, stored.getAssertionId());
    }

    /**
     * 人工裁定
     *
     * @param correctedFact EDIT 时必填；sourceId、sourceTextRef 缺省沿用原断言
     */
    public ReviewOutcome resolve(Long taskId, ReviewTask.ReviewDecision decision, RawCandidateFact correctedFact,
                                 String reviewer, String note) {
        ReviewTask task = reviewQueue.getTask(taskId);
        if (task == null) {
            throw new NoSuchElementException("审核任务不存在: " + taskId);
        }
        if (!task.isOpen()) {
            throw new IllegalStateException("审核任务 " + taskId + " 已处理，结果为 " + task.getResolution());
        }
        Assertion original = evidenceStore.getAssertion(task.getAssertionId())
            .orElseThrow(() -> new IllegalStateException("审核任务引用的断言不存在: " + task.getAssertionId()));

        CandidateFact corrected = null;
        if (decision == ReviewTask.ReviewDecision.EDIT) {
            if (correctedFact == null) {
                throw new IllegalArgumentException("EDIT 裁定必须提供修正后的事实");
            }
            RawCandidateFact raw = correctedFact.toBuilder()
                .sourceId(StringUtils.defaultIfBlank(correctedFact.getSourceId(), original.getSourceId()))
                .sourceTextRef(StringUtils.defaultIfBlank(correctedFact.getSourceTextRef(), original.getSourceTextRef()))
                .confidence(correctedFact.getConfidence() == null ? 1.0 : correctedFact.getConfidence())
                .build();
            corrected = normalizer.normalize(raw);
        }

        if (!reviewQueue.claim(task, decision, reviewer, note)) {
            throw new IllegalStateException("审核任务 " + taskId + " 已被其他审核人处理");
        }

        try {
            Instant now = Instant.now();
            Assertion correctedAssertion = null;
            Assertion updated;
            switch (decision) {
                case ACCEPT:
                    updated = evidenceStore.updateValidationStatus(original.getAssertionId(),
                        ValidationStatus.HUMAN_VALIDATED, now);
                    break;
                case REJECT:
                    updated = evidenceStore.updateValidationStatus(original.getAssertionId(),
                        ValidationStatus.HUMAN_REJECTED, now);
                    break;
                case EDIT:
                    // 先写修正断言（幂等），再拒绝原断言，失败重试不会丢修正
                    correctedAssertion = commitCorrection(original, corrected, now);
                    updated = evidenceStore.updateValidationStatus(original.getAssertionId(),
                        ValidationStatus.HUMAN_REJECTED, now);
                    reviewQueue.attachCorrection(taskId, correctedAssertion.getAssertionId());
                    break;
                default:
                    throw new IllegalArgumentException("未知裁定: " + decision);
            }
            log.info("✅ 审核完成: taskId={}, decision={}, assertionId={}, reviewer={}",
                taskId, decision, original.getAssertionId(), reviewer);
            return new ReviewOutcome(taskId, decision, updated, correctedAssertion);
        } catch (RuntimeException e) {
            reviewQueue.reopen(taskId);
            throw e;
        }
    }

    private Assertion commitCorrection(Assertion original, CandidateFact corrected, Instant resolvedAt) {
        ResolutionContext context = ResolutionContext.builder()
            .sourceId(corrected.getSourceId())
            .sourceReliability(sourceRegistry.getReliability(corrected.getSourceId()))
            .predicate(corrected.getPredicate())
            .build();
        String subjectId = resolveForCorrection(corrected.getSubject(), context);
        String objectId = corrected.hasEntityObject()
            ? resolveForCorrection(corrected.getObject(), context.toBuilder().counterpartEntityId(subjectId).build())
            : null;

        Assertion assertion = Assertion.builder()
            .subjectEntityId(subjectId)
            .predicate(corrected.getPredicate())
            .objectEntityId(objectId)
            .objectLiteral(corrected.hasEntityObject() ? null : corrected.getObjectLiteral())
            .relationship(corrected.isRelationship())
            .confidence(corrected.getConfidence())
            .sourceId(corrected.getSourceId())
            .observedAt(corrected.getObservedAt() != null ? corrected.getObservedAt() : original.getObservedAt())
            .validationStatus(ValidationStatus.HUMAN_VALIDATED)
            .resolvedAt(resolvedAt)
            .idempotencyKey(IdempotencyKeys.forCorrection(original.getAssertionId(), corrected))
            .supersedes(original.getAssertionId())
            .sourceTextRef(corrected.getSourceTextRef())
            .build();
        return evidenceStore.commitAssertion(assertion).getRecord();
    }

    /**
     * 人工修正时歧义不再升级，采用排名第一的候选；需要精确指定时由审核人填写实体ID
     */
    private String resolveForCorrection(EntityDescriptor descriptor, ResolutionContext context) {
        try {
            return entityResolver.resolve(descriptor, context).getEntityId();
        } catch (AmbiguousResolutionException e) {
            log.info("修正事实中的实体存在歧义，采用排名第一的候选: {} -> {}", descriptor.getName(),
                e.getProvisionalEntityId());
            return e.getProvisionalEntityId();
        }
    }
}
