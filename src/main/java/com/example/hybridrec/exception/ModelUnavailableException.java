package com.example.hybridrec.exception;

/**
 * 协同过滤模型未加载或无法加载
 *
 * 只在模型加载阶段抛出，由评分器吸收并转为 unavailable
 */
public class ModelUnavailableException extends RecommendationException {

    public ModelUnavailableException(String message) {
        super("model", message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super("model", message, cause);
    }

    @Override
    public String getErrorCode() {
        return "model_unavailable";
    }
}
