package com.algobrain.knowledge.controller;

import com.algobrain.common.Result;
import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.MaterializedEdge;
import com.algobrain.knowledge.model.ScoredCandidate;
import com.algobrain.knowledge.model.StateSnapshot;
import com.algobrain.knowledge.model.TimelineEvent;
import com.algobrain.knowledge.service.query.KnowledgeQueryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * 图谱查询接口
 */
@RestController
@RequestMapping("/knowledge")
@CrossOrigin(origins = "*")
public class KnowledgeQueryController {

    @Autowired
    private KnowledgeQueryService queryService;

    @GetMapping("/entities/{entityId}")
    public Result<GraphEntity> getEntity(@PathVariable String entityId) {
        return Result.success(queryService.getEntity(entityId));
    }

    /**
     * 实体断言（含冲突与被拒绝的），可按谓词过滤
     */
    @GetMapping("/entities/{entityId}/assertions")
    public Result<List<Assertion>> getAssertions(@PathVariable String entityId,
                                                 @RequestParam(required = false) String predicate) {
        return Result.success(queryService.getAssertions(entityId, predicate));
    }

    /**
     * 实体在某一时刻的状态，at 缺省为当前时间
     * GET /knowledge/entities/{id}/state?at=2024-03-01T00:00:00Z
     */
    @GetMapping("/entities/{entityId}/state")
    public Result<StateSnapshot> getStateAt(@PathVariable String entityId,
                                            @RequestParam(required = false)
                                            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant at) {
        return Result.success(queryService.getStateAt(entityId, at));
    }

    @GetMapping("/entities/{entityId}/events")
    public Result<List<TimelineEvent>> getEvents(@PathVariable String entityId) {
        return Result.success(queryService.getEvents(entityId));
    }

    @GetMapping("/entities/{entityId}/edges")
    public Result<List<MaterializedEdge>> getEdges(@PathVariable String entityId,
                                                   @RequestParam(required = false) String type) {
        return Result.success(queryService.getEdges(entityId, type));
    }

    /**
     * 查看名称的消解候选排名（不写入）
     */
    @GetMapping("/resolve")
    public Result<List<ScoredCandidate>> explainResolution(@RequestParam String name,
                                                           @RequestParam(required = false) String type,
                                                           @RequestParam(required = false) String externalId,
                                                           @RequestParam(required = false) String sourceId) {
        return Result.success(queryService.explainResolution(name, type, externalId, sourceId));
    }
}
