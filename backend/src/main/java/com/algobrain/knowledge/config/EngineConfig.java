package com.algobrain.knowledge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 入库引擎可调参数
 *
 * 阈值、衰减系数等没有公认默认值，全部走配置；字段初始值与 application.yml 默认值保持一致，
 * 便于脱离 Spring 容器直接构造
 */
@Configuration
public class EngineConfig {

    /** 自动入库置信度阈值 */
    @Value("${review.confidence-threshold:0.85}")
    private double reviewThreshold = 0.85;

    /** 按来源可信度调整阈值的幅度，0 表示不调整 */
    @Value("${review.reliability-threshold-swing:0.0}")
    private double reliabilityThresholdSwing = 0.0;

    /** 待审核队列告警水位 */
    @Value("${review.queue-warn-size:1000}")
    private int reviewQueueWarnSize = 1000;

    /** 消歧接受阈值 */
    @Value("${resolver.acceptance-threshold:0.75}")
    private double acceptanceThreshold = 0.75;

    /** 歧义判定容差 */
    @Value("${resolver.ambiguity-epsilon:0.02}")
    private double ambiguityEpsilon = 0.02;

    /** 候选短名单上限 */
    @Value("${resolver.shortlist-size:10}")
    private int shortlistSize = 10;

    /** 创建锁等待上限（毫秒） */
    @Value("${resolver.lock-timeout-ms:5000}")
    private long lockTimeoutMs = 5000;

    /** 相似度服务调用超时（毫秒） */
    @Value("${similarity.timeout-ms:2000}")
    private int similarityTimeoutMs = 2000;

    /** 可信度时间衰减系数 λ（每天） */
    @Value("${reliability.decay-lambda:0.01}")
    private double decayLambda = 0.01;

    /** 无证据来源的中性可信度 */
    @Value("${reliability.neutral-score:0.5}")
    private double neutralScore = 0.5;

    /** 中性先验的权重，越大则少量或陈旧的裁定越难把得分拉离中性值 */
    @Value("${reliability.prior-weight:1.0}")
    private double priorWeight = 1.0;

    /** 计算可信度所需的最少已裁定断言数 */
    @Value("${reliability.min-evidence:1}")
    private int minEvidence = 1;

    @Value("${ingestion.retry.max-attempts:3}")
    private int retryMaxAttempts = 3;

    @Value("${ingestion.retry.initial-backoff-ms:200}")
    private long retryInitialBackoffMs = 200;

    @Value("${ingestion.retry.max-backoff-ms:2000}")
    private long retryMaxBackoffMs = 2000;

    /** 状态定义事件 -> 状态，格式 TYPE:state,TYPE:state */
    @Value("${temporal.state-map:DISCLOSURE:disclosed,EXPLOIT:exploited,PATCH:patched}")
    private String stateMap = "DISCLOSURE:disclosed,EXPLOIT:exploited,PATCH:patched";

    @Value("${temporal.default-state:undiscovered}")
    private String defaultState = "undiscovered";

    @Value("${temporal.cache-ttl-ms:600000}")
    private long stateCacheTtlMs = 600000;

    /** 表示实体间关系的谓词，这类断言被接受后进入边投影 */
    @Value("${graph.relationship-predicates:uses,exploits,mitigates,detects,targets,attributed-to,subtechnique-of,revoked-by,belongs-to,has-component,delivers,drops,related-to}")
    private String relationshipPredicates =
        "uses,exploits,mitigates,detects,targets,attributed-to,subtechnique-of,revoked-by,belongs-to,has-component,delivers,drops,related-to";

    public double getReviewThreshold() { return reviewThreshold; }
    public void setReviewThreshold(double reviewThreshold) { this.reviewThreshold = reviewThreshold; }

    public double getReliabilityThresholdSwing() { return reliabilityThresholdSwing; }
    public void setReliabilityThresholdSwing(double swing) { this.reliabilityThresholdSwing = swing; }

    public int getReviewQueueWarnSize() { return reviewQueueWarnSize; }
    public void setReviewQueueWarnSize(int reviewQueueWarnSize) { this.reviewQueueWarnSize = reviewQueueWarnSize; }

    public double getAcceptanceThreshold() { return acceptanceThreshold; }
    public void setAcceptanceThreshold(double acceptanceThreshold) { this.acceptanceThreshold = acceptanceThreshold; }

    public double getAmbiguityEpsilon() { return ambiguityEpsilon; }
    public void setAmbiguityEpsilon(double ambiguityEpsilon) { this.ambiguityEpsilon = ambiguityEpsilon; }

    public int getShortlistSize() { return shortlistSize; }
    public void setShortlistSize(int shortlistSize) { this.shortlistSize = shortlistSize; }

    public long getLockTimeoutMs() { return lockTimeoutMs; }
    public void setLockTimeoutMs(long lockTimeoutMs) { this.lockTimeoutMs = lockTimeoutMs; }

    public int getSimilarityTimeoutMs() { return similarityTimeoutMs; }
    public void setSimilarityTimeoutMs(int similarityTimeoutMs) { this.similarityTimeoutMs = similarityTimeoutMs; }

    public double getDecayLambda() { return decayLambda; }
    public void setDecayLambda(double decayLambda) { this.decayLambda = decayLambda; }

    public double getNeutralScore() { return neutralScore; }
    public void setNeutralScore(double neutralScore) { this.neutralScore = neutralScore; }

    public double getPriorWeight() { return priorWeight; }
    public void setPriorWeight(double priorWeight) { this.priorWeight = priorWeight; }

    public int getMinEvidence() { return minEvidence; }
    public void setMinEvidence(int minEvidence) { this.minEvidence = minEvidence; }

    public int getRetryMaxAttempts() { return retryMaxAttempts; }
    public void setRetryMaxAttempts(int retryMaxAttempts) { this.retryMaxAttempts = retryMaxAttempts; }

    public long getRetryInitialBackoffMs() { return retryInitialBackoffMs; }
    public void setRetryInitialBackoffMs(long ms) { this.retryInitialBackoffMs = ms; }

    public long getRetryMaxBackoffMs() { return retryMaxBackoffMs; }
    public void setRetryMaxBackoffMs(long ms) { this.retryMaxBackoffMs = ms; }

    public String getDefaultState() { return defaultState; }
    public void setDefaultState(String defaultState) { this.defaultState = defaultState; }

    public long getStateCacheTtlMs() { return stateCacheTtlMs; }
    public void setStateCacheTtlMs(long stateCacheTtlMs) { this.stateCacheTtlMs = stateCacheTtlMs; }

    public void setStateMap(String stateMap) { this.stateMap = stateMap; }

    public void setRelationshipPredicates(String relationshipPredicates) {
        this.relationshipPredicates = relationshipPredicates;
    }

    /**
     * 状态定义事件类型（大写）到状态名的映射
     */
    public Map<String, String> getStateDefiningEvents() {
        if (stateMap == null || stateMap.isBlank()) {
            return Collections.emptyMap();
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (String pair : stateMap.split(",")) {
            String[] kv = pair.split(":");
            if (kv.length == 2 && !kv[0].isBlank() && !kv[1].isBlank()) {
                map.put(kv[0].trim().toUpperCase(Locale.ROOT), kv[1].trim());
            }
        }
        return map;
    }

    public Set<String> getRelationshipPredicateSet() {
        if (relationshipPredicates == null || relationshipPredicates.isBlank()) {
            return Collections.emptySet();
        }
        return Arrays.stream(relationshipPredicates.split(","))
            .map(p -> p.trim().toLowerCase(Locale.ROOT))
            .filter(p -> !p.isEmpty())
            .collect(Collectors.toSet());
    }

    public boolean isRelationshipPredicate(String predicate) {
        return predicate != null && getRelationshipPredicateSet().contains(predicate);
    }
}
