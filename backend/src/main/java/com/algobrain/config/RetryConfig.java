package com.algobrain.config;

import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.exception.RetryableResolutionFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Collections;

/**
 * 重试机制配置
 * 只重试 RetryableResolutionFailure（存储写入失败、相似度超时、锁等待超时），
 * 格式错误等其他异常直接抛出
 */
@Configuration
@Slf4j
public class RetryConfig {

    @Bean
    public RetryTemplate ingestionRetryTemplate(EngineConfig engineConfig) {
        log.info("入库重试策略: maxAttempts={}, initialBackoff={}ms, maxBackoff={}ms",
            engineConfig.getRetryMaxAttempts(), engineConfig.getRetryInitialBackoffMs(),
            engineConfig.getRetryMaxBackoffMs());
        return buildRetryTemplate(engineConfig.getRetryMaxAttempts(),
            engineConfig.getRetryInitialBackoffMs(), engineConfig.getRetryMaxBackoffMs());
    }

    /**
     * 指数退避，倍数 2
     */
    public static RetryTemplate buildRetryTemplate(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(maxAttempts,
            Collections.singletonMap(RetryableResolutionFailure.class, true), true);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(initialBackoffMs);
        backOffPolicy.setMaxInterval(maxBackoffMs);
        backOffPolicy.setMultiplier(2.0);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }
}
