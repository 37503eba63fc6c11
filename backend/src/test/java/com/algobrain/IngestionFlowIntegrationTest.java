package com.algobrain;

import com.algobrain.domain.entity.ReviewTask;
import com.algobrain.dto.IngestionRequest;
import com.algobrain.dto.RawCandidateFact;
import com.algobrain.dto.SourceRegistrationRequest;
import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.IngestionSummary;
import com.algobrain.knowledge.model.ReviewItem;
import com.algobrain.knowledge.model.ReviewOutcome;
import com.algobrain.knowledge.model.ValidationStatus;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.service.ingest.IngestionJobService;
import com.algobrain.knowledge.service.reliability.SourceRegistry;
import com.algobrain.knowledge.service.reliability.SourceReliabilityTracker;
import com.algobrain.knowledge.service.review.ReviewQueueService;
import com.algobrain.knowledge.service.review.ReviewRouter;
import com.algobrain.knowledge.util.NameNormalizer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 入库 → 审核 → 可信度重算的完整链路（H2 + 内存证据库）
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class IngestionFlowIntegrationTest {

    @Autowired
    private IngestionJobService jobService;

    @Autowired
    private ReviewQueueService reviewQueue;

    @Autowired
    private ReviewRouter reviewRouter;

    @Autowired
    private SourceReliabilityTracker reliabilityTracker;

    @Autowired
    private SourceRegistry sourceRegistry;

    @Autowired
    private IEvidenceStore evidenceStore;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldKeepConflictingClaimsAndLearnFromReview() throws Exception {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        String trusted = "it-vendor-" + suffix;
        String noisy = "it-forum-" + suffix;
        String tool = "ScriptX" + suffix;

        IngestionSummary first = jobService.submitAndWait(request(trusted, tool, "CVE-2025-1001", 0.92));
        IngestionSummary second = jobService.submitAndWait(request(noisy, tool, "CVE-2025-1002", 0.40));

        assertThat(first.getAutoCommitted()).isEqualTo(1);
        assertThat(second.getQueuedForReview()).isEqualTo(1);

        GraphEntity toolEntity = evidenceStore.findByNormalizedName(NameNormalizer.normalize(tool)).get(0);
        String toolId = toolEntity.getEntityId();
        List<Assertion> claims = evidenceStore.getAssertions(toolId, "exploits");
        assertThat(claims).hasSize(2);
        assertThat(evidenceStore.getEdges(toolId, "exploits")).hasSize(1);

        List<ReviewItem> pending = reviewQueue.listPending(null, 500).getItems().stream()
            .filter(item -> noisy.equals(item.getTask().getSourceId()))
            .collect(Collectors.toList());
        assertThat(pending).hasSize(1);
        ReviewTask task = pending.get(0).getTask();
        assertThat(task.getReason()).isEqualTo(ReviewTask.ReviewReason.LOW_CONFIDENCE);
        assertThat(pending.get(0).getAssertion().getConfidence()).isEqualTo(0.40);

        ReviewOutcome outcome = reviewRouter.resolve(task.getId(), ReviewTask.ReviewDecision.REJECT, null,
            "analyst", "no exploitation evidence");
        assertThat(outcome.getAssertion().getValidationStatus()).isEqualTo(ValidationStatus.HUMAN_REJECTED);
        assertThat(evidenceStore.getEdges(toolId, "exploits")).hasSize(1);
        assertThat(reviewQueue.getTask(task.getId()).isOpen()).isFalse();
        assertThatThrownBy(() -> reviewRouter.resolve(task.getId(), ReviewTask.ReviewDecision.ACCEPT, null,
            "analyst", null)).isInstanceOf(IllegalStateException.class);

        Map<String, Double> scores = reliabilityTracker.recomputeAll(Instant.now());
        // 一条刚被拒绝的断言，先验权重 1 时约为 0.5 / 2
        assertThat(scores.get(noisy)).isCloseTo(0.25, within(1e-3));
        assertThat(scores.get(trusted)).isEqualTo(0.5);
        assertThat(sourceRegistry.getReliability(noisy)).isCloseTo(0.25, within(1e-3));

        IngestionSummary replay = jobService.submitAndWait(request(trusted, tool, "CVE-2025-1001", 0.92));
        assertThat(replay.getDuplicates()).isEqualTo(1);
        assertThat(evidenceStore.getAssertions(toolId, "exploits")).hasSize(2);
        assertThat(jobService.getJob(first.getJobId()).getStatus()).isEqualTo("COMPLETED");

        mockMvc.perform(get("/knowledge/entities/{entityId}", toolId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.canonicalName").value(tool));
        mockMvc.perform(get("/knowledge/entities/{entityId}", "ent-missing-" + suffix))
            .andExpect(status().isNotFound());
    }

    @Test
    void shouldAnswerAcceptedForBackgroundJobsAndOkWhenWaiting() throws Exception {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        String body = "{\"source\":{\"sourceId\":\"http-" + suffix + "\",\"sourceKind\":\"LLM_EXTRACTION\"},"
            + "\"facts\":[{\"subject\":\"Loader-" + suffix + "\",\"subjectType\":\"malware\","
            + "\"predicate\":\"drops\",\"object\":\"Payload-" + suffix + "\",\"objectType\":\"payload\","
            + "\"confidence\":0.95}]}";

        mockMvc.perform(post("/ingestion/jobs").param("wait", "true")
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(200))
            .andExpect(jsonPath("$.data.status").value("COMPLETED"))
            .andExpect(jsonPath("$.data.autoCommitted").value(1));

        mockMvc.perform(post("/ingestion/jobs")
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(202))
            .andExpect(jsonPath("$.data.jobId").isNotEmpty())
            .andExpect(jsonPath("$.data.total").value(1));
    }

    private static IngestionRequest request(String sourceId, String tool, String cve, double confidence) {
        IngestionRequest request = new IngestionRequest();
        request.setSource(new SourceRegistrationRequest(sourceId, sourceId, "LLM_EXTRACTION"));
        request.setFacts(List.of(RawCandidateFact.builder()
            .subject(tool)
            .subjectType("tool")
            .predicate("exploits")
            .object(cve)
            .confidence(confidence)
            .build()));
        return request;
    }
}
