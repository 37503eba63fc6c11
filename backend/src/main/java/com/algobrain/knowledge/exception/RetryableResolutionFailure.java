package com.algobrain.knowledge.exception;

/**
 * 可重试的依赖故障（相似度服务超时、存储写入失败、锁等待超时）
 *
 * 按退避策略重试，超过次数后进入死信
 */
public class RetryableResolutionFailure extends RuntimeException {

    public RetryableResolutionFailure(String message) {
        super(message);
    }

    public RetryableResolutionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
