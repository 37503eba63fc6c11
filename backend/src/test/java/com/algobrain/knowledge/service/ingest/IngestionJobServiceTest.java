package com.algobrain.knowledge.service.ingest;

import com.algobrain.domain.entity.IngestionJob;
import com.algobrain.dto.IngestionRequest;
import com.algobrain.dto.RawCandidateFact;
import com.algobrain.dto.RawEvent;
import com.algobrain.dto.SourceRegistrationRequest;
import com.algobrain.knowledge.model.FactOutcome;
import com.algobrain.knowledge.model.FactResult;
import com.algobrain.knowledge.model.IngestionSummary;
import com.algobrain.knowledge.service.normalize.StixBundleNormalizer;
import com.algobrain.knowledge.service.reliability.SourceRegistry;
import com.algobrain.repository.IngestionJobRepository;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.QueryTimeoutException;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IngestionJobServiceTest {

    @Mock
    private FactIngestionService factIngestionService;

    @Mock
    private DeadLetterService deadLetterService;

    @Mock
    private SourceRegistry sourceRegistry;

    @Mock
    private StixBundleNormalizer stixBundleNormalizer;

    @Mock
    private IngestionJobRepository jobRepository;

    private IngestionJobService jobService;

    private final AtomicReference<String> jobId = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        // 直接在调用线程执行，任务在 submit 返回前结束
        jobService = new IngestionJobService(factIngestionService, deadLetterService, sourceRegistry,
            stixBundleNormalizer, jobRepository, Runnable::run);
        doAnswer(invocation -> {
            jobId.set(invocation.<IngestionJob>getArgument(0).getJobId());
            return 1;
        }).when(jobRepository).insert(any(IngestionJob.class));
    }

    @Test
    void shouldCountEveryOutcomeAndParkDeadLetters() {
        RawCandidateFact confident = fact("report-a", "CVE-2025-1");
        RawCandidateFact doubtful = fact("report-a", "CVE-2025-2");
        RawCandidateFact broken = fact("report-a", "CVE-2025-3");
        RawCandidateFact flaky = fact("report-b", "CVE-2025-4");
        RawEvent disclosure = event("nvd");
        FactResult deadLettered = FactResult.deadLettered("timeout", "RetryableResolutionFailure", 3);

        when(factIngestionService.ingestFact(confident)).thenReturn(FactResult.of(FactOutcome.AUTO_COMMITTED, "a1"));
        when(factIngestionService.ingestFact(doubtful)).thenReturn(FactResult.of(FactOutcome.QUEUED_FOR_REVIEW, "a2"));
        when(factIngestionService.ingestFact(broken)).thenReturn(FactResult.malformed("谓词为空"));
        when(factIngestionService.ingestFact(flaky)).thenReturn(deadLettered);
        when(factIngestionService.ingestEvent(disclosure)).thenReturn(FactResult.of(FactOutcome.EVENT_RECORDED, "e1"));

        IngestionRequest request = new IngestionRequest();
        request.setFacts(List.of(confident, doubtful, broken, flaky));
        request.setEvents(List.of(disclosure));

        IngestionSummary summary = jobService.submitAndWait(request);

        assertThat(summary.getStatus()).isEqualTo("COMPLETED");
        assertThat(summary.getTotal()).isEqualTo(5);
        assertThat(summary.getAutoCommitted()).isEqualTo(1);
        assertThat(summary.getQueuedForReview()).isEqualTo(1);
        assertThat(summary.getMalformed()).isEqualTo(1);
        assertThat(summary.getDeadLettered()).isEqualTo(1);
        assertThat(summary.getEventsRecorded()).isEqualTo(1);
        assertThat(summary.getAbandoned()).isZero();
        verify(deadLetterService).parkFact(jobId.get(), flaky, deadLettered);

        ArgumentCaptor<IngestionJob> saved = ArgumentCaptor.forClass(IngestionJob.class);
        verify(jobRepository).updateById(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(IngestionJob.JobStatus.COMPLETED);
        assertThat(saved.getValue().getDeadLetteredCount()).isEqualTo(1);
        assertThat(saved.getValue().getFinishedAt()).isNotNull();
    }

    @Test
    void shouldRetryParkingBeforeCountingDeadLetter() {
        RawCandidateFact flaky = fact("report-a", "CVE-2025-1");
        FactResult deadLettered = FactResult.deadLettered("timeout", "RetryableResolutionFailure", 3);
        when(factIngestionService.ingestFact(flaky)).thenReturn(deadLettered);
        when(deadLetterService.parkFact(anyString(), eq(flaky), eq(deadLettered)))
            .thenThrow(new QueryTimeoutException("db busy"))
            .thenReturn(null);

        IngestionRequest request = new IngestionRequest();
        request.setFacts(List.of(flaky));

        IngestionSummary summary = jobService.submitAndWait(request);

        assertThat(summary.getStatus()).isEqualTo("COMPLETED");
        assertThat(summary.getDeadLettered()).isEqualTo(1);
        assertThat(summary.getParkFailed()).isZero();
        verify(deadLetterService, times(2)).parkFact(jobId.get(), flaky, deadLettered);
    }

    @Test
    void shouldFailJobWhenDeadLetterCannotBeSaved() {
        RawCandidateFact flaky = fact("report-a", "CVE-2025-1");
        RawCandidateFact next = fact("report-a", "CVE-2025-2");
        FactResult deadLettered = FactResult.deadLettered("timeout", "RetryableResolutionFailure", 3);
        when(factIngestionService.ingestFact(flaky)).thenReturn(deadLettered);
        when(factIngestionService.ingestFact(next)).thenReturn(FactResult.of(FactOutcome.AUTO_COMMITTED, "a1"));
        when(deadLetterService.parkFact(anyString(), eq(flaky), eq(deadLettered)))
            .thenThrow(new QueryTimeoutException("db down"));

        IngestionRequest request = new IngestionRequest();
        request.setFacts(List.of(flaky, next));

        IngestionSummary summary = jobService.submitAndWait(request);

        assertThat(summary.getStatus()).isEqualTo("FAILED");
        assertThat(summary.getDeadLettered()).isZero();
        assertThat(summary.getParkFailed()).isEqualTo(1);
        assertThat(summary.getAutoCommitted()).isEqualTo(1);
        verify(deadLetterService, times(3)).parkFact(jobId.get(), flaky, deadLettered);

        ArgumentCaptor<IngestionJob> saved = ArgumentCaptor.forClass(IngestionJob.class);
        verify(jobRepository).updateById(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(IngestionJob.JobStatus.FAILED);
        assertThat(saved.getValue().getParkFailedCount()).isEqualTo(1);
        assertThat(saved.getValue().getDeadLetteredCount()).isZero();
    }

    @Test
    void shouldTreatUnexpectedFailureAsDeadLetterWithoutStoppingBatch() {
        RawCandidateFact exploding = fact("report-a", "CVE-2025-1");
        RawCandidateFact next = fact("report-a", "CVE-2025-2");
        when(factIngestionService.ingestFact(exploding)).thenThrow(new IllegalStateException("boom"));
        when(factIngestionService.ingestFact(next)).thenReturn(FactResult.of(FactOutcome.DUPLICATE, "a1"));

        IngestionRequest request = new IngestionRequest();
        request.setFacts(List.of(exploding, next));

        IngestionSummary summary = jobService.submitAndWait(request);

        assertThat(summary.getDeadLettered()).isEqualTo(1);
        assertThat(summary.getDuplicates()).isEqualTo(1);
        verify(deadLetterService).parkFact(eq(jobId.get()), eq(exploding),
            argThat(r -> "IllegalStateException".equals(r.getFailureClass())));
    }

    @Test
    void shouldAbandonRemainingInputsAfterCancellation() {
        RawCandidateFact first = fact("report-a", "CVE-2025-1");
        RawCandidateFact second = fact("report-a", "CVE-2025-2");
        RawCandidateFact third = fact("report-a", "CVE-2025-3");
        when(factIngestionService.ingestFact(first)).thenAnswer(invocation -> {
            assertThat(jobService.cancel(jobId.get())).isTrue();
            return FactResult.of(FactOutcome.AUTO_COMMITTED, "a1");
        });

        IngestionRequest request = new IngestionRequest();
        request.setFacts(List.of(first, second, third));

        IngestionSummary summary = jobService.submitAndWait(request);

        assertThat(summary.getStatus()).isEqualTo("CANCELLED");
        assertThat(summary.getAutoCommitted()).isEqualTo(1);
        assertThat(summary.getAbandoned()).isEqualTo(2);
        verify(factIngestionService, never()).ingestFact(second);
        verify(factIngestionService, never()).ingestFact(third);
    }

    @Test
    void shouldKeepSubmissionOrderWithinSource() {
        RawCandidateFact first = fact("report-a", "CVE-2025-1");
        RawCandidateFact second = fact("report-a", "CVE-2025-2");
        RawCandidateFact third = fact("report-a", "CVE-2025-3");
        when(factIngestionService.ingestFact(any())).thenReturn(FactResult.of(FactOutcome.AUTO_COMMITTED, "a"));

        IngestionRequest request = new IngestionRequest();
        request.setFacts(List.of(first, second, third));
        jobService.submitAndWait(request);

        InOrder order = inOrder(factIngestionService);
        order.verify(factIngestionService).ingestFact(first);
        order.verify(factIngestionService).ingestFact(second);
        order.verify(factIngestionService).ingestFact(third);
    }

    @Test
    void shouldRegisterSourceAndFillMissingSourceIds() {
        when(factIngestionService.ingestFact(any())).thenReturn(FactResult.of(FactOutcome.AUTO_COMMITTED, "a"));

        IngestionRequest request = new IngestionRequest();
        request.setSource(new SourceRegistrationRequest("vendor-feed", "Vendor Feed", "STRUCTURED_FEED"));
        request.setFacts(List.of(fact(null, "CVE-2025-1")));

        jobService.submitAndWait(request);

        verify(sourceRegistry).register("vendor-feed", "Vendor Feed", "STRUCTURED_FEED");
        verify(factIngestionService).ingestFact(argThat(f -> "vendor-feed".equals(f.getSourceId())));
    }

    @Test
    void shouldRejectNonObjectStixBundle() {
        assertThatThrownBy(() -> jobService.submitStixBundle(JsonNodeFactory.instance.arrayNode(),
            "mitre-attack", "MITRE ATT&CK", true))
            .isInstanceOf(IllegalArgumentException.class);
        verify(stixBundleNormalizer, never()).toCandidateFacts(any(), anyString());
    }

    @Test
    void shouldReportFinishedAndUnknownJobs() {
        IngestionJob finished = new IngestionJob();
        finished.setJobId("job-done");
        finished.setStatus(IngestionJob.JobStatus.COMPLETED);
        finished.setTotalCount(4);
        finished.setAutoCommittedCount(4);
        when(jobRepository.selectById("job-done")).thenReturn(finished);

        assertThat(jobService.cancel("job-done")).isFalse();
        IngestionSummary summary = jobService.getJob("job-done");
        assertThat(summary.getStatus()).isEqualTo("COMPLETED");
        assertThat(summary.getAutoCommitted()).isEqualTo(4);
        assertThat(summary.getDuplicates()).isZero();

        assertThatThrownBy(() -> jobService.getJob("job-missing")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> jobService.cancel("job-missing")).isInstanceOf(NoSuchElementException.class);
    }

    private static RawCandidateFact fact(String sourceId, String cve) {
        return RawCandidateFact.builder()
            .subject("ScriptX")
            .predicate("exploits")
            .object(cve)
            .sourceId(sourceId)
            .confidence(0.9)
            .build();
    }

    private static RawEvent event(String sourceId) {
        return RawEvent.builder()
            .eventType("DISCLOSURE")
            .startTime(Instant.parse("2025-01-10T00:00:00Z"))
            .participants(List.of(new RawEvent.Participant("CVE-2025-1", null, "CVE-2025-1", null, "target")))
            .sourceId(sourceId)
            .build();
    }
}
