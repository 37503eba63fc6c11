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
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 批量入库任务调度
 *
 * 同一来源的输入按提交顺序在一个工作线程上串行处理，不同来源并行。
 * 每条输入必然落入一个计数：自动写入、待审核、重复、事件、格式错误、死信或因取消而放弃。
 * 死信只有在保存成功后才计入死信；保存失败的输入单独计数，任务以 FAILED 结束。
 */
@Slf4j
@Service
public class IngestionJobService {

    private final FactIngestionService factIngestionService;
    private final DeadLetterService deadLetterService;
    private final SourceRegistry sourceRegistry;
    private final StixBundleNormalizer stixBundleNormalizer;
    private final IngestionJobRepository jobRepository;
    private final Executor ingestionExecutor;

    /** 运行中的任务 */
    private final Map<String, JobHandle> activeJobs = new ConcurrentHashMap<>();

    private RetryTemplate parkRetryTemplate = RetryTemplate.builder()
        .maxAttempts(3)
        .fixedBackoff(100)
        .build();

    @Autowired
    public IngestionJobService(FactIngestionService factIngestionService,
                               DeadLetterService deadLetterService,
                               SourceRegistry sourceRegistry,
                               StixBundleNormalizer stixBundleNormalizer,
                               IngestionJobRepository jobRepository,
                               @Qualifier("ingestionExecutor") Executor ingestionExecutor) {
        this.factIngestionService = factIngestionService;
        this.deadLetterService = deadLetterService;
        this.sourceRegistry = sourceRegistry;
        this.stixBundleNormalizer = stixBundleNormalizer;
        this.jobRepository = jobRepository;
        this.ingestionExecutor = ingestionExecutor;
    }

    /**
     * 异步提交，立即返回任务ID与初始计数
     */
    public IngestionSummary submit(IngestionRequest request) {
        return start(request).snapshot();
    }

    /**
     * 提交并等待全部来源处理结束
     */
    public IngestionSummary submitAndWait(IngestionRequest request) {
        return start(request).completion.join();
    }

    /**
     * 导入 STIX 2.x bundle（如 MITRE ATT&CK），结构化来源的事实走同一条流水线
     */
    public IngestionSummary submitStixBundle(JsonNode bundle, String sourceId, String displayName, boolean wait) {
        if (bundle == null || !bundle.isObject()) {
            throw new IllegalArgumentException("STIX bundle 必须是 JSON 对象");
        }
        IngestionRequest request = new IngestionRequest();
        request.setSource(new SourceRegistrationRequest(sourceId, displayName, "STRUCTURED_FEED"));
        request.setFacts(stixBundleNormalizer.toCandidateFacts(bundle, sourceId));
        return wait ? submitAndWait(request) : submit(request);
    }

    /**
     * 请求取消：已处理的输入保持写入，剩余输入计为放弃
     *
     * @return 任务仍在运行并已标记取消返回 true，任务已结束返回 false
     */
    public boolean cancel(String jobId) {
        JobHandle handle = activeJobs.get(jobId);
        if (handle != null) {
            handle.cancelled.set(true);
            log.info("⏹️ 入库任务已请求取消: {}", jobId);
            return true;
        }
        if (jobRepository.selectById(jobId) == null) {
            throw new NoSuchElementException("入库任务不存在: " + jobId);
        }
        return false;
    }

    public IngestionSummary getJob(String jobId) {
        JobHandle handle = activeJobs.get(jobId);
        if (handle != null) {
            return handle.snapshot();
        }
        IngestionJob job = jobRepository.selectById(jobId);
        if (job == null) {
            throw new NoSuchElementException("入库任务不存在: " + jobId);
        }
        return toSummary(job);
    }

    public List<IngestionSummary> listRecent(int limit) {
        return jobRepository.findRecent(Math.max(1, Math.min(limit, 100))).stream()
            .map(IngestionJobService::toSummary)
            .collect(Collectors.toList());
    }

    private JobHandle start(IngestionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("入库请求不能为空");
        }
        String defaultSourceId = null;
        if (request.getSource() != null && StringUtils.isNotBlank(request.getSource().getSourceId())) {
            SourceRegistrationRequest source = request.getSource();
            sourceRegistry.register(source.getSourceId(), source.getDisplayName(), source.getSourceKind());
            defaultSourceId = source.getSourceId();
        }

        Map<String, List<WorkItem>> partitions = partition(request, defaultSourceId);
        int total = partitions.values().stream().mapToInt(List::size).sum();

        String jobId = "job-" + UUID.randomUUID();
        JobHandle handle = new JobHandle(jobId, total);

        IngestionJob job = new IngestionJob();
        job.setJobId(jobId);
        job.setSourceId(defaultSourceId);
        job.setStatus(IngestionJob.JobStatus.RUNNING);
        job.setTotalCount(total);
        job.setStartedAt(LocalDateTime.now());
        jobRepository.insert(job);
        activeJobs.put(jobId, handle);

        log.info("📥 入库任务开始: job={}, 输入={}, 来源数={}", jobId, total, partitions.size());

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (Map.Entry<String, List<WorkItem>> entry : partitions.entrySet()) {
            futures.add(CompletableFuture.runAsync(
                () -> processPartition(handle, entry.getKey(), entry.getValue()), ingestionExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .whenComplete((ignored, error) -> finish(handle, job, error));
        return handle;
    }

    private Map<String, List<WorkItem>> partition(IngestionRequest request, String defaultSourceId) {
        Map<String, List<WorkItem>> partitions = new LinkedHashMap<>();
        if (request.getFacts() != null) {
            for (RawCandidateFact fact : request.getFacts()) {
                if (fact != null && StringUtils.isBlank(fact.getSourceId()) && defaultSourceId != null) {
                    fact = fact.toBuilder().sourceId(defaultSourceId).build();
                }
                String key = fact == null ? "" : StringUtils.defaultString(fact.getSourceId());
                partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(WorkItem.fact(fact));
            }
        }
        if (request.getEvents() != null) {
            for (RawEvent event : request.getEvents()) {
                if (event != null && StringUtils.isBlank(event.getSourceId()) && defaultSourceId != null) {
                    event = event.toBuilder().sourceId(defaultSourceId).build();
                }
                String key = event == null ? "" : StringUtils.defaultString(event.getSourceId());
                partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(WorkItem.event(event));
            }
        }
        return partitions;
    }

    private void processPartition(JobHandle handle, String sourceId, List<WorkItem> items) {
        for (int i = 0; i < items.size(); i++) {
            if (handle.cancelled.get()) {
                int remaining = items.size() - i;
                handle.count(FactOutcome.ABANDONED, remaining);
                log.info("来源 {} 的 {} 条输入因任务取消而放弃: job={}", sourceId, remaining, handle.jobId);
                return;
            }
            WorkItem item = items.get(i);
            FactResult result = processItem(item);
            FactOutcome outcome = result.getOutcome();
            if (outcome == FactOutcome.DEAD_LETTERED && !park(handle.jobId, item, result)) {
                outcome = FactOutcome.PARK_FAILED;
            }
            handle.count(outcome, 1);
        }
        log.debug("来源 {} 处理完成: job={}, 输入={}", sourceId, handle.jobId, items.size());
    }

    private FactResult processItem(WorkItem item) {
        try {
            return item.event != null
                ? factIngestionService.ingestEvent(item.event)
                : factIngestionService.ingestFact(item.fact);
        } catch (RuntimeException e) {
            // 单条输入的意外故障不中断整批
            log.error("❌ 输入处理异常: {}", e.getMessage(), e);
            return FactResult.deadLettered(e.getMessage(), e.getClass().getSimpleName(), 1);
        }
    }

    /**
     * @return 死信是否已保存
     */
    private boolean park(String jobId, WorkItem item, FactResult result) {
        try {
            parkRetryTemplate.execute(context -> {
                if (item.event != null) {
                    deadLetterService.parkEvent(jobId, item.event, result);
                } else {
                    deadLetterService.parkFact(jobId, item.fact, result);
                }
                return null;
            });
            return true;
        } catch (RuntimeException e) {
            log.error("❌ 死信保存失败，输入仅保留在日志中: job={}, input={}, cause={}", jobId,
                item.event != null ? item.event : item.fact, result.getError(), e);
            return false;
        }
    }

    private void finish(JobHandle handle, IngestionJob job, Throwable error) {
        IngestionJob.JobStatus status;
        if (error != null) {
            status = IngestionJob.JobStatus.FAILED;
            log.error("❌ 入库任务失败: job={}", handle.jobId, error);
        } else if (handle.get(FactOutcome.PARK_FAILED) > 0) {
            status = IngestionJob.JobStatus.FAILED;
            log.error("❌ 入库任务失败: job={}, {} 条死信未能保存", handle.jobId, handle.get(FactOutcome.PARK_FAILED));
        } else if (handle.cancelled.get()) {
            status = IngestionJob.JobStatus.CANCELLED;
        } else {
            status = IngestionJob.JobStatus.COMPLETED;
        }
        handle.status = status;

        IngestionSummary summary = handle.snapshot();
        job.setStatus(status);
        job.setAutoCommittedCount(summary.getAutoCommitted());
        job.setQueuedCount(summary.getQueuedForReview());
        job.setDuplicateCount(summary.getDuplicates());
        job.setEventCount(summary.getEventsRecorded());
        job.setMalformedCount(summary.getMalformed());
        job.setDeadLetteredCount(summary.getDeadLettered());
        job.setParkFailedCount(summary.getParkFailed());
        job.setAbandonedCount(summary.getAbandoned());
        job.setFinishedAt(LocalDateTime.now());
        try {
            jobRepository.updateById(job);
        } catch (RuntimeException e) {
            log.error("❌ 入库任务状态保存失败: job={}", handle.jobId, e);
        } finally {
            activeJobs.remove(handle.jobId);
            handle.completion.complete(summary);
        }

        log.info("✅ 入库任务结束: job={}, status={}, 自动写入={}, 待审核={}, 重复={}, 事件={}, 格式错误={}, 死信={}, 死信保存失败={}, 放弃={}",
            handle.jobId, status, summary.getAutoCommitted(), summary.getQueuedForReview(), summary.getDuplicates(),
            summary.getEventsRecorded(), summary.getMalformed(), summary.getDeadLettered(), summary.getParkFailed(),
            summary.getAbandoned());
    }

    private static IngestionSummary toSummary(IngestionJob job) {
        return IngestionSummary.builder()
            .jobId(job.getJobId())
            .status(job.getStatus() == null ? null : job.getStatus().name())
            .total(zeroIfNull(job.getTotalCount()))
            .autoCommitted(zeroIfNull(job.getAutoCommittedCount()))
            .queuedForReview(zeroIfNull(job.getQueuedCount()))
            .duplicates(zeroIfNull(job.getDuplicateCount()))
            .eventsRecorded(zeroIfNull(job.getEventCount()))
            .malformed(zeroIfNull(job.getMalformedCount()))
            .deadLettered(zeroIfNull(job.getDeadLetteredCount()))
            .parkFailed(zeroIfNull(job.getParkFailedCount()))
            .abandoned(zeroIfNull(job.getAbandonedCount()))
            .build();
    }

    private static int zeroIfNull(Integer value) {
        return value == null ? 0 : value;
    }

    private static final class WorkItem {
        final RawCandidateFact fact;
        final RawEvent event;

        private WorkItem(RawCandidateFact fact, RawEvent event) {
            this.fact = fact;
            this.event = event;
        }

        static WorkItem fact(RawCandidateFact fact) {
            return new WorkItem(fact, null);
        }

        static WorkItem event(RawEvent event) {
            return new WorkItem(null, event);
        }
    }

    private static final class JobHandle {
        final String jobId;
        final int total;
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        final Map<FactOutcome, AtomicInteger> counters = new EnumMap<>(FactOutcome.class);
        final CompletableFuture<IngestionSummary> completion = new CompletableFuture<>();
        volatile IngestionJob.JobStatus status = IngestionJob.JobStatus.RUNNING;

        JobHandle(String jobId, int total) {
            this.jobId = jobId;
            this.total = total;
            for (FactOutcome outcome : FactOutcome.values()) {
                counters.put(outcome, new AtomicInteger());
            }
        }

        void count(FactOutcome outcome, int delta) {
            counters.get(outcome).addAndGet(delta);
        }

        int get(FactOutcome outcome) {
            return counters.get(outcome).get();
        }

        IngestionSummary snapshot() {
            return IngestionSummary.builder()
                .jobId(jobId)
                .status(status.name())
                .total(total)
                .autoCommitted(get(FactOutcome.AUTO_COMMITTED))
                .queuedForReview(get(FactOutcome.QUEUED_FOR_REVIEW))
                .duplicates(get(FactOutcome.DUPLICATE))
                .eventsRecorded(get(FactOutcome.EVENT_RECORDED))
                .malformed(get(FactOutcome.MALFORMED))
                .deadLettered(get(FactOutcome.DEAD_LETTERED))
                .parkFailed(get(FactOutcome.PARK_FAILED))
                .abandoned(get(FactOutcome.ABANDONED))
                .build();
        }
    }
}
