package com.algobrain.knowledge.controller;

import com.algobrain.common.Result;
import com.algobrain.domain.entity.DeadLetterRecord;
import com.algobrain.dto.MergeRequest;
import com.algobrain.knowledge.model.FactResult;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.knowledge.service.ingest.DeadLetterService;
import com.algobrain.knowledge.service.reliability.SourceReliabilityTracker;
import com.algobrain.knowledge.service.resolve.EntityMergeService;
import com.algobrain.knowledge.service.review.ReviewQueueService;
import com.algobrain.knowledge.service.temporal.StateQueryCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 图谱管理：统计、实体合并、死信、可信度重算
 */
@RestController
@RequestMapping("/graph")
@CrossOrigin(origins = "*")
public class GraphManagementController {

    private static final Logger logger = LoggerFactory.getLogger(GraphManagementController.class);

    @Autowired
    private IEvidenceStore evidenceStore;

    @Autowired
    private EntityMergeService entityMergeService;

    @Autowired
    private DeadLetterService deadLetterService;

    @Autowired
    private ReviewQueueService reviewQueueService;

    @Autowired
    private SourceReliabilityTracker reliabilityTracker;

    @Autowired
    private StateQueryCache stateQueryCache;

    /**
     * 获取图谱统计信息
     */
    @GetMapping("/stats")
    public Result<Map<String, Object>> getStats() {
        Map<String, Object> stats = new HashMap<>(evidenceStore.getStatistics());
        stats.put("mode", evidenceStore.getServiceType());
        stats.put("available", evidenceStore.isAvailable());
        stats.put("openReviewTasks", reviewQueueService.countOpen());
        stats.put("parkedDeadLetters", deadLetterService.countParked());
        stats.put("stateCache", stateQueryCache.getStats());
        return Result.success(stats);
    }

    /**
     * 合并重复实体
     * POST /graph/merge  body: { losingEntityId, survivingEntityId, reason }
     */
    @PostMapping("/merge")
    public Result<GraphEntity> merge(@Valid @RequestBody MergeRequest request) {
        GraphEntity survivor = entityMergeService.merge(
            request.getLosingEntityId(), request.getSurvivingEntityId(), request.getReason());
        return Result.success("实体合并完成", survivor);
    }

    @GetMapping("/dead-letters")
    public Result<List<DeadLetterRecord>> listDeadLetters(@RequestParam(required = false) String jobId) {
        return Result.success(jobId == null ? deadLetterService.listParked() : deadLetterService.listByJob(jobId));
    }

    @PostMapping("/dead-letters/{id}/replay")
    public Result<FactResult> replayDeadLetter(@PathVariable Long id) {
        return Result.success(deadLetterService.replay(id));
    }

    /**
     * 手动触发来源可信度重算
     */
    @PostMapping("/reliability/recompute")
    public Result<Map<String, Double>> recomputeReliability() {
        if (reliabilityTracker.isRunning()) {
            return Result.conflict("可信度重算正在进行中");
        }
        Map<String, Double> scores = reliabilityTracker.recomputeAll(Instant.now());
        logger.info("手动重算来源可信度完成: {} 个来源", scores.size());
        return Result.success(scores);
    }
}
