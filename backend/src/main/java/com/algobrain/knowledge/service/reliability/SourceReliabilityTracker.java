package com.algobrain.knowledge.service.reliability;

import com.algobrain.domain.entity.Source;
import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.ValidationStatus;
import com.algobrain.knowledge.service.graph.IEvidenceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 来源可信度追踪
 *
 * score = (Σ(v·d) + neutral·k) / (Σ(d) + k)，d = e^(-λ·天数)，v 取 1（人工确认）或 0（人工拒绝），
 * k 为中性先验的权重：证据越旧衰减越多，得分越向中性值收缩。
 * 待审核与自动入库的断言不计入。只写来源表，不改动断言
 */
@Slf4j
@Service
public class SourceReliabilityTracker {

    private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;

    private final IEvidenceStore evidenceStore;
    private final SourceRegistry sourceRegistry;
    private final EngineConfig engineConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Autowired
    public SourceReliabilityTracker(IEvidenceStore evidenceStore, SourceRegistry sourceRegistry,
                                    EngineConfig engineConfig) {
        this.evidenceStore = evidenceStore;
        this.sourceRegistry = sourceRegistry;
        this.engineConfig = engineConfig;
    }

    @Scheduled(cron = "${reliability.recompute-cron:0 0 3 * * *}")
    public void scheduledRecompute() {
        recomputeAll(Instant.now());
    }

    /**
     * 重算所有来源的可信度；上一次重算仍在进行时直接跳过
     *
     * @return sourceId -> 新得分；跳过时返回空表
     */
    public Map<String, Double> recomputeAll(Instant now) {
        if (!running.compareAndSet(false, true)) {
            log.warn("⏳ 可信度重算仍在进行，本次跳过");
            return Map.of();
        }
        try {
            long start = System.currentTimeMillis();
            // 一次读取快照，本轮计算期间新裁定的断言留到下一轮
            Map<String, List<Assertion>> bySource = evidenceStore.getResolvedAssertions().stream()
                .filter(a -> a.getSourceId() != null && a.getResolvedAt() != null)
                // 人工修正写入的断言不代表来源本身的准确性
                .filter(a -> a.getSupersedes() == null)
                .collect(Collectors.groupingBy(Assertion::getSourceId));

            Map<String, Double> scores = new LinkedHashMap<>();
            for (Source source : sourceRegistry.listAll()) {
                List<Assertion> resolved = bySource.getOrDefault(source.getSourceId(), new ArrayList<>());
                double score = resolved.size() < engineConfig.getMinEvidence()
                    ? engineConfig.getNeutralScore()
                    : computeScore(resolved, now, engineConfig.getDecayLambda(),
                        engineConfig.getNeutralScore(), engineConfig.getPriorWeight());
                sourceRegistry.updateReliability(source.getSourceId(), score, resolved.size());
                scores.put(source.getSourceId(), score);
            }
            log.info("📊 来源可信度重算完成: {} 个来源，耗时 {}ms", scores.size(), System.currentTimeMillis() - start);
            return scores;
        } finally {
            running.set(false);
        }
    }

    /**
     * 时间衰减加权、向中性值收缩的确认率
     *
     * @param neutral     无证据时的得分
     * @param priorWeight 中性先验相当于多少条“刚刚裁定”的断言
     */
    public static double computeScore(List<Assertion> resolved, Instant now, double lambda,
                                      double neutral, double priorWeight) {
        double weighted = 0.0;
        double total = 0.0;
        for (Assertion a : resolved) {
            if (a.getValidationStatus() == null || !a.getValidationStatus().isHumanResolved()
                || a.getResolvedAt() == null) {
                continue;
            }
            double days = Math.max(0.0, Duration.between(a.getResolvedAt(), now).toMillis() / MILLIS_PER_DAY);
            double decay = Math.exp(-lambda * days);
            double v = a.getValidationStatus() == ValidationStatus.HUMAN_VALIDATED ? 1.0 : 0.0;
            weighted += v * decay;
            total += decay;
        }
        double denominator = total + priorWeight;
        return denominator <= 0.0 ? neutral : (weighted + neutral * priorWeight) / denominator;
    }

    public boolean isRunning() {
        return running.get();
    }
}
