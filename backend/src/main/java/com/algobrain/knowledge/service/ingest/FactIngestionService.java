package com.algobrain.knowledge.service.ingest;

import com.algobrain.dto.RawCandidateFact;
import com.algobrain.dto.RawEvent;
import com.algobrain.knowledge.exception.AmbiguousResolutionException;
import com.algobrain.knowledge.exception.MalformedRecordException;
import com.algobrain.knowledge.model.CandidateEvent;
import com.algobrain.knowledge.model.CandidateFact;
import com.algobrain.knowledge.model.CommitResult;
import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.EventParticipant;
import com.algobrain.knowledge.model.FactOutcome;
import com.algobrain.knowledge.model.FactResult;
import com.algobrain.knowledge.model.ResolutionContext;
import com.algobrain.knowledge.model.TimelineEvent;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.service.normalize.RecordNormalizer;
import com.algobrain.knowledge.service.reliability.SourceRegistry;
import com.algobrain.knowledge.service.resolve.EntityResolver;
import com.algobrain.knowledge.service.review.ReviewRouter;
import com.algobrain.knowledge.service.temporal.TemporalStateReconstructor;
import com.algobrain.knowledge.util.IdempotencyKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 单条事实/事件的端到端处理：归一化 → 实体消解 → 写入与路由
 *
 * 格式错误直接丢弃并计数；可重试故障按退避策略重试，耗尽后由调用方转入死信
 */
@Slf4j
@Service
public class FactIngestionService {

    private final RecordNormalizer normalizer;
    private final EntityResolver entityResolver;
    private final ReviewRouter reviewRouter;
    private final IEvidenceStore evidenceStore;
    private final SourceRegistry sourceRegistry;
    private final TemporalStateReconstructor temporalStateReconstructor;
    private final RetryTemplate retryTemplate;

    @Autowired
    public FactIngestionService(RecordNormalizer normalizer, EntityResolver entityResolver,
                                ReviewRouter reviewRouter, IEvidenceStore evidenceStore,
                                SourceRegistry sourceRegistry,
                                TemporalStateReconstructor temporalStateReconstructor,
                                RetryTemplate ingestionRetryTemplate) {
        this.normalizer = normalizer;
        this.entityResolver = entityResolver;
        this.reviewRouter = reviewRouter;
        this.evidenceStore = evidenceStore;
        this.sourceRegistry = sourceRegistry;
        this.temporalStateReconstructor = temporalStateReconstructor;
        this.retryTemplate = ingestionRetryTemplate;
    }

    public FactResult ingestFact(RawCandidateFact raw) {
        CandidateFact fact;
        try {
            fact = normalizer.normalize(raw);
        } catch (MalformedRecordException e) {
            log.warn("🗑️ 丢弃格式错误的事实: source={}, {}", e.getSourceId(), e.getMessage());
            return FactResult.malformed(e.getMessage());
        }
        return retryTemplate.execute(ctx -> processFact(fact), this::recover);
    }

    public FactResult ingestEvent(RawEvent raw) {
        CandidateEvent event;
        try {
            event = normalizer.normalizeEvent(raw);
        } catch (MalformedRecordException e) {
            log.warn("🗑️ 丢弃格式错误的事件: source={}, {}", e.getSourceId(), e.getMessage());
            return FactResult.malformed(e.getMessage());
        }
        return retryTemplate.execute(ctx -> processEvent(event), this::recover);
    }

    FactResult processFact(CandidateFact fact) {
        ResolutionContext context = ResolutionContext.builder()
            .sourceId(fact.getSourceId())
            .sourceReliability(sourceRegistry.getReliability(fact.getSourceId()))
            .predicate(fact.getPredicate())
            .build();

        List<String> ambiguous = new ArrayList<>();
        String subjectId = resolveEndpoint(fact.getSubject(), context, ambiguous);
        String objectId = null;
        if (fact.hasEntityObject()) {
            objectId = resolveEndpoint(fact.getObject(),
                context.toBuilder().counterpartEntityId(subjectId).build(), ambiguous);
        }
        return reviewRouter.route(fact, subjectId, objectId, ambiguous);
    }

    FactResult processEvent(CandidateEvent event) {
        ResolutionContext context = ResolutionContext.builder()
            .sourceId(event.getSourceId())
            .sourceReliability(sourceRegistry.getReliability(event.getSourceId()))
            .predicate(event.getEventType())
            .build();

        List<EventParticipant> participants = new ArrayList<>();
        List<String> identityKeys = new ArrayList<>();
        for (CandidateEvent.Participant p : event.getParticipants()) {
            List<String> ambiguous = new ArrayList<>();
            String entityId = resolveEndpoint(p.getDescriptor(), context, ambiguous);
            if (!ambiguous.isEmpty()) {
                // 事件没有审核流程，按排名第一的候选记录
                log.warn("事件参与实体存在歧义，按排名第一的候选记录: {} -> {}", p.getDescriptor().getName(), entityId);
            }
            participants.add(new EventParticipant(entityId, p.getRole()));
            identityKeys.add(p.getDescriptor().identityKey() + "@" + p.getRole());
        }
        identityKeys.sort(String::compareTo);

        TimelineEvent timelineEvent = TimelineEvent.builder()
            .eventType(event.getEventType())
            .startTime(event.getStartTime())
            .endTime(event.getEndTime())
            .participants(participants)
            .sourceId(event.getSourceId())
            .description(event.getDescription())
            .idempotencyKey(IdempotencyKeys.forEvent(event.getSourceId(), event.getEventType(),
                event.getStartTime(), event.getEndTime(), identityKeys))
            .build();

        CommitResult<TimelineEvent> committed = evidenceStore.appendEvent(timelineEvent);
        if (committed.isDuplicate()) {
            return FactResult.of(FactOutcome.DUPLICATE, committed.getRecord().getEventId());
        }
        temporalStateReconstructor.onEventRecorded(committed.getRecord());
        return FactResult.of(FactOutcome.EVENT_RECORDED, committed.getRecord().getEventId());
    }

    private String resolveEndpoint(EntityDescriptor descriptor, ResolutionContext context, List<String> ambiguous) {
        try {
            return entityResolver.resolve(descriptor, context).getEntityId();
        } catch (AmbiguousResolutionException e) {
            for (String id : e.getCandidateEntityIds()) {
                if (!ambiguous.contains(id)) {
                    ambiguous.add(id);
                }
            }
            return e.getProvisionalEntityId();
        }
    }

    private FactResult recover(RetryContext ctx) {
        Throwable last = ctx.getLastThrowable();
        if (last instanceof MalformedRecordException) {
            MalformedRecordException malformed = (MalformedRecordException) last;
            log.warn("🗑️ 丢弃格式错误的事实: source={}, {}", malformed.getSourceId(), malformed.getMessage());
            return FactResult.malformed(malformed.getMessage());
        }
        int attempts = Math.max(1, ctx.getRetryCount());
        log.error("❌ 重试耗尽，转入死信: attempts={}, error={}", attempts, last == null ? null : last.getMessage(), last);
        return FactResult.deadLettered(last == null ? "unknown" : last.getMessage(),
            last == null ? "Unknown" : last.getClass().getSimpleName(), attempts);
    }
}
