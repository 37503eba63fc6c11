package com.algobrain.knowledge.controller;

import com.algobrain.knowledge.service.export.CorrectedDatasetExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.time.Instant;

/**
 * 人工校正数据集导出（JSON Lines）
 */
@RestController
@RequestMapping("/export")
@CrossOrigin(origins = "*")
public class ExportController {

    private static final Logger logger = LoggerFactory.getLogger(ExportController.class);

    private static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    @Autowired
    private CorrectedDatasetExporter exporter;

    /**
     * GET /export/validated?since=2024-01-01T00:00:00Z
     */
    @GetMapping("/validated")
    public ResponseEntity<StreamingResponseBody> exportValidated(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        Instant from = since == null ? Instant.EPOCH : since;
        StreamingResponseBody body = out -> {
            long lines = exporter.writeJsonLines(from, out);
            logger.info("📤 校正数据集导出完成: since={}, 行数={}", from, lines);
        };
        return ResponseEntity.ok().contentType(NDJSON).body(body);
    }
}
