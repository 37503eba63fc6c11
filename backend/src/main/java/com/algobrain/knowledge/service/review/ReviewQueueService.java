package com.algobrain.knowledge.service.review;

import com.algobrain.domain.entity.ReviewTask;
import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.ReviewItem;
import com.algobrain.knowledge.model.ReviewPage;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import com.algobrain.repository.ReviewTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 待审核队列（持久化在 kb_review_tasks）
 *
 * 出队顺序：置信度升序 → 入队时间升序 → 任务ID升序；游标是最后一个已读任务的ID
 */
@Slf4j
@Service
public class ReviewQueueService {

    private static final long WARN_INTERVAL_MS = 60_000;

    @Autowired
    private ReviewTaskRepository reviewTaskRepository;
    @Autowired
    private IEvidenceStore evidenceStore;
    @Autowired
    private EngineConfig engineConfig;

    private final AtomicLong lastWarnAt = new AtomicLong();

    /**
     * 为待审核断言建任务；同一断言只会有一个任务
     */
    public ReviewTask enqueue(Assertion assertion, ReviewTask.ReviewReason reason, List<String> candidateEntityIds) {
        ReviewTask existing = reviewTaskRepository.findByAssertionId(assertion.getAssertionId());
        if (existing != null) {
            return existing;
        }

        ReviewTask task = new ReviewTask();
        task.setAssertionId(assertion.getAssertionId());
        task.setSourceId(assertion.getSourceId());
        task.setReason(reason);
        task.setPriority(assertion.getConfidence());
        task.setCandidateEntityIds(candidateEntityIds == null || candidateEntityIds.isEmpty()
            ? null : String.join(",", candidateEntityIds));
        task.setStatus(ReviewTask.TaskStatus.OPEN);
        task.setEnqueuedAt(LocalDateTime.now());
        try {
            reviewTaskRepository.insert(task);
        } catch (DuplicateKeyException e) {
            log.debug("审核任务已由并发请求创建: assertionId={}", assertion.getAssertionId());
            return reviewTaskRepository.findByAssertionId(assertion.getAssertionId());
        }
        log.info("📝 进入审核队列: taskId={}, assertionId={}, reason={}, confidence={}",
            task.getId(), assertion.getAssertionId(), reason, assertion.getConfidence());
        warnIfBacklogged();
        return task;
    }

    public ReviewTask findByAssertionId(String assertionId) {
        return reviewTaskRepository.findByAssertionId(assertionId);
    }

    public ReviewTask getTask(Long taskId) {
        return reviewTaskRepository.selectById(taskId);
    }

    /**
     * @param cursor 上一页最后一个任务的ID，为空时从队首开始
     */
    public ReviewPage listPending(String cursor, int limit) {
        int pageSize = Math.max(1, Math.min(limit, 500));
        List<ReviewTask> tasks;
        if (StringUtils.isBlank(cursor)) {
            tasks = reviewTaskRepository.findPendingHead(pageSize + 1);
        } else {
            ReviewTask last = reviewTaskRepository.selectById(parseCursor(cursor));
            if (last == null) {
                throw new IllegalArgumentException("无效的游标: " + cursor);
            }
            tasks = reviewTaskRepository.findPendingAfter(last.getPriority(), last.getEnqueuedAt(), last.getId(),
                pageSize + 1);
        }

        boolean hasMore = tasks.size() > pageSize;
        List<ReviewTask> page = hasMore ? tasks.subList(0, pageSize) : tasks;
        List<ReviewItem> items = new ArrayList<>(page.size());
        for (ReviewTask task : page) {
            items.add(new ReviewItem(task, evidenceStore.getAssertion(task.getAssertionId()).orElse(null)));
        }
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getId()) : null;
        return new ReviewPage(items, nextCursor, reviewTaskRepository.countOpen());
    }

    /**
     * 条件更新认领任务
     *
     * @return false 表示任务已被处理
     */
    public boolean claim(ReviewTask task, ReviewTask.ReviewDecision decision, String reviewer, String note) {
        return reviewTaskRepository.claimResolution(task.getId(), decision, reviewer, note, LocalDateTime.now()) == 1;
    }

    public void attachCorrection(Long taskId, String correctedAssertionId) {
        reviewTaskRepository.attachCorrection(taskId, correctedAssertionId);
    }

    /**
     * 裁定落库失败时撤销认领，任务回到队列
     */
    public void reopen(Long taskId) {
        reviewTaskRepository.reopen(taskId);
        log.warn("↩️ 审核任务已回到队列: taskId={}", taskId);
    }

    public long countOpen() {
        return reviewTaskRepository.countOpen();
    }

    private void warnIfBacklogged() {
        long open = reviewTaskRepository.countOpen();
        if (open <= engineConfig.getReviewQueueWarnSize()) {
            return;
        }
        long now = System.currentTimeMillis();
        long last = lastWarnAt.get();
        if (now - last > WARN_INTERVAL_MS && lastWarnAt.compareAndSet(last, now)) {
            log.warn("⚠️ 待审核队列积压: {} 条（告警水位 {}）", open, engineConfig.getReviewQueueWarnSize());
        }
    }

    private long parseCursor(String cursor) {
        try {
            return Long.parseLong(cursor.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("无效的游标: " + cursor);
        }
    }
}
