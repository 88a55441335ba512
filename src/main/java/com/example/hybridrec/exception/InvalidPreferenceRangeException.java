package com.example.hybridrec.exception;

/**
 * 偏好标量超出 [0, 1]
 */
public class InvalidPreferenceRangeException extends RecommendationException {

    public InvalidPreferenceRangeException(String field, String message) {
        super(field, message);
    }

    @Override
    public String getErrorCode() {
        return "invalid_preference_range";
    }
}
