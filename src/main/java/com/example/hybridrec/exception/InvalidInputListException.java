package com.example.hybridrec.exception;

/**
 * 列表输入中包含无法清洗的条目
 */
public class InvalidInputListException extends RecommendationException {

    public InvalidInputListException(String field, String message) {
        super(field, message);
    }

    @Override
    public String getErrorCode() {
        return "invalid_input_list";
    }
}
