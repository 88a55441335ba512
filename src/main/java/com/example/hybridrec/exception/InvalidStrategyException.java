package com.example.hybridrec.exception;

/**
 * 未知的推荐策略
 */
public class InvalidStrategyException extends RecommendationException {

    public InvalidStrategyException(String field, String message) {
        super(field, message);
    }

    @Override
    public String getErrorCode() {
        return "invalid_strategy";
    }
}
