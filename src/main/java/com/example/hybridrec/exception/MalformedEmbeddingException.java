package com.example.hybridrec.exception;

/**
 * embedding 缺失、维度不符或包含非有限值（逐条跳过，不致命）
 */
public class MalformedEmbeddingException extends RecommendationException {

    public MalformedEmbeddingException(String message) {
        super("embedding", message);
    }

    @Override
    public String getErrorCode() {
        return "malformed_embedding";
    }
}
