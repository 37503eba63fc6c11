package com.algobrain.knowledge.controller;

import com.algobrain.common.Result;
import com.algobrain.domain.entity.Source;
import com.algobrain.dto.IngestionRequest;
import com.algobrain.dto.SourceRegistrationRequest;
import com.algobrain.knowledge.model.IngestionSummary;
import com.algobrain.knowledge.service.ingest.IngestionJobService;
import com.algobrain.knowledge.service.reliability.SourceRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

/**
 * 入库控制器：来源登记、批量提交、STIX 导入、任务查询与取消
 */
@RestController
@RequestMapping("/ingestion")
@CrossOrigin(origins = "*")
public class IngestionController {

    private static final Logger logger = LoggerFactory.getLogger(IngestionController.class);

    @Autowired
    private IngestionJobService ingestionJobService;

    @Autowired
    private SourceRegistry sourceRegistry;

    /**
     * 登记来源（幂等）
     * POST /ingestion/sources
     */
    @PostMapping("/sources")
    public Result<Source> registerSource(@Valid @RequestBody SourceRegistrationRequest request) {
        Source source = sourceRegistry.register(request.getSourceId(), request.getDisplayName(), request.getSourceKind());
        return Result.success(source);
    }

    @GetMapping("/sources")
    public Result<List<Source>> listSources() {
        return Result.success(sourceRegistry.listAll());
    }

    /**
     * 提交批量入库任务
     * POST /ingestion/jobs?wait=false
     * body: { source: {...}, facts: [...], events: [...] }
     */
    @PostMapping("/jobs")
    public Result<IngestionSummary> submitJob(@RequestBody IngestionRequest request,
                                              @RequestParam(defaultValue = "false") boolean wait) {
        IngestionSummary summary = wait
            ? ingestionJobService.submitAndWait(request)
            : ingestionJobService.submit(request);
        logger.info("收到入库请求: job={}, 输入={}", summary.getJobId(), summary.getTotal());
        return wait ? Result.success(summary) : Result.accepted(summary);
    }

    /**
     * 导入 STIX 2.x bundle
     * POST /ingestion/stix?sourceId=mitre-attack&displayName=MITRE%20ATT%26CK
     */
    @PostMapping("/stix")
    public Result<IngestionSummary> importStix(@RequestBody JsonNode bundle,
                                               @RequestParam String sourceId,
                                               @RequestParam(required = false) String displayName,
                                               @RequestParam(defaultValue = "false") boolean wait) {
        IngestionSummary summary = ingestionJobService.submitStixBundle(bundle, sourceId, displayName, wait);
        return wait ? Result.success(summary) : Result.accepted(summary);
    }

    @GetMapping("/jobs")
    public Result<List<IngestionSummary>> recentJobs(@RequestParam(defaultValue = "20") int limit) {
        return Result.success(ingestionJobService.listRecent(limit));
    }

    @GetMapping("/jobs/{jobId}")
    public Result<IngestionSummary> getJob(@PathVariable String jobId) {
        return Result.success(ingestionJobService.getJob(jobId));
    }

    /**
     * 取消任务：已处理的输入保持写入，剩余输入计为放弃
     */
    @PostMapping("/jobs/{jobId}/cancel")
    public Result<IngestionSummary> cancelJob(@PathVariable String jobId) {
        boolean cancelled = ingestionJobService.cancel(jobId);
        IngestionSummary summary = ingestionJobService.getJob(jobId);
        return Result.success(cancelled ? "已请求取消" : "任务已结束", summary);
    }
}
