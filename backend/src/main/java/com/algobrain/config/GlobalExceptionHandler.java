package com.algobrain.config;

import com.algobrain.knowledge.exception.MalformedRecordException;
import com.algobrain.knowledge.exception.MergeConflictException;
import com.algobrain.knowledge.exception.RetryableResolutionFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 全局异常处理器
 * 统一处理系统异常并返回标准格式的错误响应
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 处理格式错误的候选事实
     */
    @ExceptionHandler(MalformedRecordException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedRecord(MalformedRecordException e) {
        logger.warn("候选事实格式错误: source={}, {}", e.getSourceId(), e.getMessage());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "记录格式错误");
        errorResponse.put("message", e.getMessage());
        errorResponse.put("code", "MALFORMED_RECORD");
        errorResponse.put("sourceId", e.getSourceId());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 处理合并冲突与非法状态迁移
     */
    @ExceptionHandler({MergeConflictException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(RuntimeException e) {
        logger.warn("状态冲突: {}", e.getMessage());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "状态冲突");
        errorResponse.put("message", e.getMessage());
        errorResponse.put("code", "CONFLICT");

        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    /**
     * 处理依赖服务暂不可用
     */
    @ExceptionHandler(RetryableResolutionFailure.class)
    public ResponseEntity<Map<String, Object>> handleRetryable(RetryableResolutionFailure e) {
        logger.error("依赖服务暂不可用: {}", e.getMessage(), e);

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "依赖服务错误");
        errorResponse.put("message", "图谱或相似度服务暂时不可用，请稍后重试");
        errorResponse.put("details", e.getMessage());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorResponse);
    }

    /**
     * 处理资源不存在（实体、审核任务、入库任务、死信）
     */
    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoSuchElementException e) {
        logger.warn("资源不存在: {}", e.getMessage());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "资源不存在");
        errorResponse.put("message", e.getMessage());
        errorResponse.put("code", "NOT_FOUND");

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * 处理非法参数（游标、裁定类型等）
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("非法参数: {}", e.getMessage());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "参数错误");
        errorResponse.put("message", e.getMessage());
        errorResponse.put("code", "INVALID_ARGUMENT");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 处理请求体校验失败
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new HashMap<>();
        e.getBindingResult().getFieldErrors()
            .forEach(error -> fieldErrors.put(error.getField(), error.getDefaultMessage()));
        logger.warn("请求校验失败: {}", fieldErrors);

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "参数校验失败");
        errorResponse.put("message", "请求参数不合法");
        errorResponse.put("fields", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 处理参数缺失异常
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException e) {
        logger.warn("参数缺失: {}", e.getMessage());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "参数错误");
        errorResponse.put("message", "缺少必要参数: " + e.getParameterName());
        errorResponse.put("parameter", e.getParameterName());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 处理参数类型错误异常
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        logger.warn("参数类型错误: {}", e.getMessage());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "参数类型错误");
        errorResponse.put("message", "参数 " + e.getName() + " 类型不正确");
        errorResponse.put("parameter", e.getName());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 处理数据库操作异常
     */
    @ExceptionHandler(org.springframework.dao.DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccessException(Exception e) {
        logger.error("数据库操作异常: {}", e.getMessage(), e);

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "数据操作失败");
        errorResponse.put("message", "数据操作失败，请稍后重试");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    /**
     * 处理其他未捕获的异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception e) {
        logger.error("系统异常: {}", e.getMessage(), e);

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", "系统错误");
        errorResponse.put("message", "系统内部错误，请联系管理员");
        errorResponse.put("timestamp", System.currentTimeMillis());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}
