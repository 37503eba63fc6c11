package com.algobrain.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 异步任务配置
 * 批量入库时每个来源的事实流由一个工作线程顺序处理
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${ingestion.workers.core-size:4}")
    private int corePoolSize;

    @Value("${ingestion.workers.max-size:8}")
    private int maxPoolSize;

    @Value("${ingestion.workers.queue-capacity:200}")
    private int queueCapacity;

    /**
     * 入库专用线程池
     * - 拒绝策略: CallerRunsPolicy (队列满时由提交线程执行，防止事实丢失)
     */
    @Bean(name = "ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("kb-ingest-");
        executor.setKeepAliveSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        // 关闭时等待在途事实处理完
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("入库线程池初始化完成: corePoolSize={}, maxPoolSize={}, queueCapacity={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), queueCapacity);
        return executor;
    }
}
