package com.example.hybridrec.exception;

/**
 * 交互类型不在允许集合内
 */
public class InvalidInteractionTypeException extends RecommendationException {

    public InvalidInteractionTypeException(String field, String message) {
        super(field, message);
    }

    @Override
    public String getErrorCode() {
        return "invalid_interaction_type";
    }
}
