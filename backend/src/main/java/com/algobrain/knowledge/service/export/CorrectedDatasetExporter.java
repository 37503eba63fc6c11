package com.algobrain.knowledge.service.export;

import com.algobrain.knowledge.model.ExportRecord;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * 修正数据集导出：人工确认的断言连同原文引用，供抽取模型微调
 */
@Slf4j
@Service
public class CorrectedDatasetExporter {

    private static final DateTimeFormatter FILE_TS =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final IEvidenceStore evidenceStore;
    private final ObjectMapper objectMapper;

    @Value("${export.enabled:false}")
    private boolean scheduledExportEnabled;

    @Value("${export.directory:./exports}")
    private String exportDirectory;

    // 定时导出的水位线，只导出上次之后新确认的断言
    private final AtomicReference<Instant> watermark = new AtomicReference<>(Instant.EPOCH);

    @Autowired
    public CorrectedDatasetExporter(IEvidenceStore evidenceStore, ObjectMapper objectMapper) {
        this.evidenceStore = evidenceStore;
        this.objectMapper = objectMapper;
    }

    /**
     * resolvedAt >= since 的人工确认断言，按 resolvedAt 升序
     */
    public Stream<ExportRecord> exportValidated(Instant since) {
        return evidenceStore.getValidatedSince(since).stream()
            .map(a -> new ExportRecord(a.getSourceTextRef(), a));
    }

    /**
     * 以 JSON Lines 写出，返回行数
     */
    public long writeJsonLines(Instant since, OutputStream out) throws IOException {
        long lines = 0;
        try (Stream<ExportRecord> records = exportValidated(since)) {
            Iterator<ExportRecord> it = records.iterator();
            while (it.hasNext()) {
                out.write(objectMapper.writeValueAsBytes(it.next()));
                out.write('\n');
                lines++;
            }
        }
        out.flush();
        return lines;
    }

    @Scheduled(cron = "${export.cron:0 30 3 * * *}")
    public void scheduledExport() {
        if (!scheduledExportEnabled) {
            return;
        }
        Instant now = Instant.now();
        try {
            Path file = exportToFile(watermark.get(), now);
            if (file != null) {
                watermark.set(now);
            }
        } catch (UncheckedIOException e) {
            log.error("❌ 定时导出修正数据集失败: {}", e.getMessage(), e);
        }
    }

    /**
     * 导出到 export-<时间>.jsonl；没有新数据时不生成文件并返回 null
     */
    public Path exportToFile(Instant since, Instant now) {
        Path dir = Paths.get(exportDirectory);
        Path file = dir.resolve("export-" + FILE_TS.format(now) + ".jsonl");
        try {
            Files.createDirectories(dir);
            long lines;
            try (OutputStream out = Files.newOutputStream(file)) {
                lines = writeJsonLines(since, out);
            }
            if (lines == 0) {
                Files.deleteIfExists(file);
                log.info("修正数据集无新增记录，跳过导出 (since={})", since);
                return null;
            }
            log.info("📤 修正数据集已导出: {} ({} 条)", file, lines);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("写入导出文件失败: " + file, e);
        }
    }

    void setExportDirectory(String exportDirectory) {
        this.exportDirectory = exportDirectory;
    }
}
