package com.example.hybridrec.exception;

/**
 * 排序权重覆盖不完整或总和不为 1
 */
public class InvalidRankingWeightsException extends RecommendationException {

    public InvalidRankingWeightsException(String field, String message) {
        super(field, message);
    }

    @Override
    public String getErrorCode() {
        return "invalid_ranking_weights";
    }
}
