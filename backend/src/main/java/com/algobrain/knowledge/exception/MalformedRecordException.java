package com.algobrain.knowledge.exception;

/**
 * 候选事实格式错误
 *
 * 事实被丢弃并记录来源上下文，不参与重试
 */
public class MalformedRecordException extends RuntimeException {

    private final String sourceId;

    public MalformedRecordException(String message, String sourceId) {
        super(message);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
