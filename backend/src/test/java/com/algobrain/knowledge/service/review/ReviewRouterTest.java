package com.algobrain.knowledge.service.review;

import com.algobrain.domain.entity.ReviewTask;
import com.algobrain.dto.RawCandidateFact;
import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.CandidateFact;
import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.EntityType;
import com.algobrain.knowledge.model.FactOutcome;
import com.algobrain.knowledge.model.FactResult;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.ReviewOutcome;
import com.algobrain.knowledge.model.ValidationStatus;
import com.algobrain.knowledge.service.graph.InMemoryEvidenceStore;
import com.algobrain.knowledge.service.normalize.RecordNormalizer;
import com.algobrain.knowledge.service.reliability.SourceRegistry;
import com.algobrain.knowledge.service.resolve.CandidateGenerator;
import com.algobrain.knowledge.service.resolve.ContextualDisambiguationScorer;
import com.algobrain.knowledge.service.resolve.EntityLockRegistry;
import com.algobrain.knowledge.service.resolve.EntityResolver;
import com.algobrain.knowledge.service.similarity.LexicalSimilarityService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReviewRouterTest {

    private static final String TOOL_ID = "ent-scriptx";
    private static final String CVE_ID = "ent-cve-1";

    @Mock
    private ReviewQueueService reviewQueue;

    @Mock
    private SourceRegistry sourceRegistry;

    private InMemoryEvidenceStore store;
    private EngineConfig config;
    private ReviewRouter router;

    @BeforeEach
    void setUp() {
        store = new InMemoryEvidenceStore();
        config = new EngineConfig();
        LexicalSimilarityService similarity = new LexicalSimilarityService(store);
        EntityResolver resolver = new EntityResolver(store, new CandidateGenerator(store, similarity, config),
            new ContextualDisambiguationScorer(store), similarity, new EntityLockRegistry(), config);
        router = new ReviewRouter(store, reviewQueue, sourceRegistry,
            new RecordNormalizer(sourceRegistry, config), resolver, config);

        when(sourceRegistry.isRegistered(anyString())).thenReturn(true);
        when(sourceRegistry.getReliability(anyString())).thenReturn(0.5);

        store.createEntityIfAbsent(GraphEntity.builder()
            .entityId(TOOL_ID).typeTag(EntityType.TOOL).canonicalName("ScriptX")
            .normalizedName("scriptx").creationKey("TOOL|scriptx").build());
        store.createEntityIfAbsent(GraphEntity.builder()
            .entityId(CVE_ID).typeTag(EntityType.VULNERABILITY).canonicalName("CVE-2025-1")
            .normalizedName("cve 2025 1").externalId("CVE-2025-1").creationKey("ext:CVE-2025-1").build());
    }

    @Test
    void shouldAutoCommitConfidentFactAndProjectEdge() {
        FactResult result = router.route(fact("report-a", 0.92), TOOL_ID, CVE_ID, null);

        assertThat(result.getOutcome()).isEqualTo(FactOutcome.AUTO_COMMITTED);
        assertThat(store.getAssertion(result.getRecordId()))
            .hasValueSatisfying(a -> assertThat(a.getValidationStatus()).isEqualTo(ValidationStatus.AUTO_COMMITTED));
        assertThat(store.getEdges(TOOL_ID, "exploits")).hasSize(1);
        verify(reviewQueue, never()).enqueue(any(), any(), any());
    }

    @Test
    void shouldKeepNonRelationshipPredicateOutOfEdges() {
        CandidateFact mention = new RecordNormalizer(sourceRegistry, config).normalize(RawCandidateFact.builder()
            .subject("ScriptX").subjectType("tool")
            .predicate("mentioned-alongside")
            .object("CVE-2025-1").objectType("vulnerability")
            .sourceId("report-a").confidence(0.95)
            .build());
        assertThat(mention.isRelationship()).isFalse();
        assertThat(mention.hasEntityObject()).isTrue();

        FactResult result = router.route(mention, TOOL_ID, CVE_ID, null);

        assertThat(result.getOutcome()).isEqualTo(FactOutcome.AUTO_COMMITTED);
        assertThat(store.getAssertion(result.getRecordId()))
            .hasValueSatisfying(a -> assertThat(a.getObjectEntityId()).isEqualTo(CVE_ID));
        assertThat(store.getEdges(TOOL_ID, null)).isEmpty();
    }

    @Test
    void shouldQueueLowConfidenceFactWithoutEdge() {
        FactResult result = router.route(fact("report-b", 0.60), TOOL_ID, CVE_ID, null);

        assertThat(result.getOutcome()).isEqualTo(FactOutcome.QUEUED_FOR_REVIEW);
        Assertion stored = store.getAssertion(result.getRecordId()).orElseThrow();
        assertThat(stored.getValidationStatus()).isEqualTo(ValidationStatus.PENDING);
        assertThat(store.getEdges(TOOL_ID, null)).isEmpty();
        verify(reviewQueue).enqueue(eq(stored), eq(ReviewTask.ReviewReason.LOW_CONFIDENCE), isNull());
    }

    @Test
    void shouldQueueAmbiguousResolutionEvenWhenConfident() {
        List<String> candidates = List.of("ent-a", "ent-b");

        FactResult result = router.route(fact("report-a", 0.99), TOOL_ID, CVE_ID, candidates);

        assertThat(result.getOutcome()).isEqualTo(FactOutcome.QUEUED_FOR_REVIEW);
        verify(reviewQueue).enqueue(any(Assertion.class), eq(ReviewTask.ReviewReason.AMBIGUOUS_RESOLUTION),
            eq(candidates));
    }

    @Test
    void shouldReportDuplicateAndRestoreMissingReviewTask() {
        FactResult first = router.route(fact("report-b", 0.60), TOOL_ID, CVE_ID, null);
        when(reviewQueue.findByAssertionId(first.getRecordId())).thenReturn(null);

        FactResult second = router.route(fact("report-b", 0.60), TOOL_ID, CVE_ID, null);

        assertThat(second.getOutcome()).isEqualTo(FactOutcome.DUPLICATE);
        assertThat(second.getRecordId()).isEqualTo(first.getRecordId());
        verify(reviewQueue, times(2))
            .enqueue(any(Assertion.class), eq(ReviewTask.ReviewReason.LOW_CONFIDENCE), isNull());
    }

    @Test
    void shouldShiftThresholdByReliability() {
        config.setReliabilityThresholdSwing(0.2);
        when(sourceRegistry.getReliability("trusted")).thenReturn(1.0);
        when(sourceRegistry.getReliability("noisy")).thenReturn(0.0);

        assertThat(router.effectiveThreshold("trusted")).isCloseTo(0.75, within(1e-9));
        assertThat(router.effectiveThreshold("noisy")).isCloseTo(0.95, within(1e-9));

        FactResult result = router.route(fact("trusted", 0.80), TOOL_ID, CVE_ID, null);
        assertThat(result.getOutcome()).isEqualTo(FactOutcome.AUTO_COMMITTED);
    }

    @Test
    void shouldAcceptPendingAssertionAndMaterializeEdge() {
        ReviewTask task = pendingTask(7L);
        when(reviewQueue.getTask(7L)).thenReturn(task);
        when(reviewQueue.claim(task, ReviewTask.ReviewDecision.ACCEPT, "analyst", null)).thenReturn(true);

        ReviewOutcome outcome = router.resolve(7L, ReviewTask.ReviewDecision.ACCEPT, null, "analyst", null);

        assertThat(outcome.getAssertion().getValidationStatus()).isEqualTo(ValidationStatus.HUMAN_VALIDATED);
        assertThat(outcome.getAssertion().getResolvedAt()).isNotNull();
        assertThat(store.getEdges(TOOL_ID, "exploits")).hasSize(1);
    }

    @Test
    void shouldRefuseTaskClaimedByAnotherReviewer() {
        ReviewTask task = pendingTask(8L);
        when(reviewQueue.getTask(8L)).thenReturn(task);
        when(reviewQueue.claim(task, ReviewTask.ReviewDecision.REJECT, "analyst", null)).thenReturn(false);

        assertThatThrownBy(() -> router.resolve(8L, ReviewTask.ReviewDecision.REJECT, null, "analyst", null))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.getAssertion(task.getAssertionId()))
            .hasValueSatisfying(a -> assertThat(a.getValidationStatus()).isEqualTo(ValidationStatus.PENDING));
    }

    @Test
    void shouldRecordCorrectionAndRejectOriginalOnEdit() {
        ReviewTask task = pendingTask(9L);
        when(reviewQueue.getTask(9L)).thenReturn(task);
        when(reviewQueue.claim(task, ReviewTask.ReviewDecision.EDIT, "analyst", "wrong CVE")).thenReturn(true);

        RawCandidateFact corrected = RawCandidateFact.builder()
            .subject("ScriptX")
            .subjectType("tool")
            .predicate("exploits")
            .object("CVE-2025-2")
            .build();

        ReviewOutcome outcome = router.resolve(9L, ReviewTask.ReviewDecision.EDIT, corrected, "analyst", "wrong CVE");

        Assertion correction = outcome.getCorrectedAssertion();
        assertThat(outcome.getAssertion().getValidationStatus()).isEqualTo(ValidationStatus.HUMAN_REJECTED);
        assertThat(correction.getValidationStatus()).isEqualTo(ValidationStatus.HUMAN_VALIDATED);
        assertThat(correction.getSupersedes()).isEqualTo(task.getAssertionId());
        assertThat(correction.getSourceId()).isEqualTo("report-b");
        assertThat(correction.getConfidence()).isEqualTo(1.0);
        assertThat(correction.getSubjectEntityId()).isEqualTo(TOOL_ID);
        assertThat(correction.getObjectEntityId()).isNotEqualTo(CVE_ID);
        verify(reviewQueue).attachCorrection(9L, correction.getAssertionId());
    }

    @Test
    void shouldReopenTaskWhenResolutionFails() {
        FactResult committed = router.route(fact("report-a", 0.95), TOOL_ID, CVE_ID, null);
        ReviewTask task = task(10L, committed.getRecordId());
        when(reviewQueue.getTask(10L)).thenReturn(task);
        when(reviewQueue.claim(task, ReviewTask.ReviewDecision.ACCEPT, "analyst", null)).thenReturn(true);

        assertThatThrownBy(() -> router.resolve(10L, ReviewTask.ReviewDecision.ACCEPT, null, "analyst", null))
            .isInstanceOf(IllegalStateException.class);
        verify(reviewQueue).reopen(10L);
    }

    @Test
    void shouldFailForUnknownTask() {
        when(reviewQueue.getTask(404L)).thenReturn(null);

        assertThatThrownBy(() -> router.resolve(404L, ReviewTask.ReviewDecision.ACCEPT, null, "analyst", null))
            .isInstanceOf(NoSuchElementException.class);
    }

    private ReviewTask pendingTask(Long id) {
        FactResult queued = router.route(fact("report-b", 0.40), TOOL_ID, CVE_ID, null);
        return task(id, queued.getRecordId());
    }

    private static ReviewTask task(Long id, String assertionId) {
        ReviewTask task = new ReviewTask();
        task.setId(id);
        task.setAssertionId(assertionId);
        task.setStatus(ReviewTask.TaskStatus.OPEN);
        task.setReason(ReviewTask.ReviewReason.LOW_CONFIDENCE);
        return task;
    }

    private static CandidateFact fact(String sourceId, double confidence) {
        return CandidateFact.builder()
            .subject(EntityDescriptor.builder().name("ScriptX").normalizedName("scriptx").typeTag(EntityType.TOOL).build())
            .predicate("exploits")
            .object(EntityDescriptor.builder().name("CVE-2025-1").normalizedName("cve 2025 1")
                .typeTag(EntityType.VULNERABILITY).externalId("CVE-2025-1").build())
            .relationship(true)
            .sourceId(sourceId)
            .confidence(confidence)
            .build();
    }
}
