package com.algobrain.knowledge.controller;

import com.algobrain.common.Result;
import com.algobrain.domain.entity.ReviewTask;
import com.algobrain.dto.ReviewDecisionRequest;
import com.algobrain.knowledge.model.ReviewOutcome;
import com.algobrain.knowledge.model.ReviewPage;
import com.algobrain.knowledge.service.review.ReviewQueueService;
import com.algobrain.knowledge.service.review.ReviewRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.Locale;

/**
 * 人工审核接口
 */
@RestController
@RequestMapping("/review")
@CrossOrigin(origins = "*")
public class ReviewController {

    private static final Logger logger = LoggerFactory.getLogger(ReviewController.class);

    @Autowired
    private ReviewQueueService reviewQueueService;

    @Autowired
    private ReviewRouter reviewRouter;

    /**
     * 待审核列表，置信度最低的在前，同置信度先入先出
     * GET /review/pending?cursor=&limit=50
     */
    @GetMapping("/pending")
    public Result<ReviewPage> listPending(@RequestParam(required = false) String cursor,
                                          @RequestParam(defaultValue = "50") int limit) {
        return Result.success(reviewQueueService.listPending(cursor, limit));
    }

    /**
     * 提交裁定
     * POST /review/{taskId}/resolve
     * body: { decision: ACCEPT|REJECT|EDIT, correctedFact?: {...}, reviewer?, note? }
     */
    @PostMapping("/{taskId}/resolve")
    public Result<ReviewOutcome> resolve(@PathVariable Long taskId,
                                         @Valid @RequestBody ReviewDecisionRequest request) {
        ReviewTask.ReviewDecision decision = parseDecision(request.getDecision());
        ReviewOutcome outcome = reviewRouter.resolve(taskId, decision, request.getCorrectedFact(),
            request.getReviewer(), request.getNote());
        logger.info("审核任务 {} 已裁定: {}", taskId, decision);
        return Result.success(outcome);
    }

    private ReviewTask.ReviewDecision parseDecision(String raw) {
        try {
            return ReviewTask.ReviewDecision.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("不支持的裁定类型: " + raw + "，可选 ACCEPT / REJECT / EDIT", e);
        }
    }
}
