package com.example.hybridrec.exception;

import lombok.Getter;

/**
 * 推荐核心异常基类
 *
 * 携带出错字段名，供接口层返回给调用方
 */
@Getter
public abstract class RecommendationException extends RuntimeException {

    private final String field;

    protected RecommendationException(String field, String message) {
        super(message);
        this.field = field;
    }

    protected RecommendationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * 错误码（接口响应中的 error 字段）
     */
    public abstract String getErrorCode();
}
