package com.algobrain.common;

/**
 * 统一响应结果类
 *
 * code 沿用 HTTP 语义：200 完成，202 已受理（入库任务仍在后台运行，按 jobId 轮询），
 * 409 与当前状态冲突
 * @param <T> 响应数据类型
 */
public class Result<T> {
    private int code;
    private String message;
    private T data;

    private Result(int code, String message, T data) {
        this.code = code;
        this.message = message;
        this.data = data;
    }

    /**
     * 成功响应
     */
    public static <T> Result<T> success(T data) {
        return new Result<>(200, "success", data);
    }

    /**
     * 成功响应（自定义消息）
     */
    public static <T> Result<T> success(String message, T data) {
        return new Result<>(200, message, data);
    }

    /**
     * 已受理：异步任务已开始，data 是任务当前快照
     */
    public static <T> Result<T> accepted(T data) {
        return new Result<>(202, "accepted", data);
    }

    /**
     * 与当前状态冲突，如重算已在进行
     */
    public static <T> Result<T> conflict(String message) {
        return new Result<>(409, message, null);
    }

    public boolean isSuccess() {
        return code >= 200 && code < 300;
    }

    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public T getData() {
        return data;
    }

    public void setData(T data) {
        this.data = data;
    }
}
