package com.example.hybridrec.entity;

import com.example.hybridrec.exception.InvalidInteractionTypeException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 交互类型枚举
 */
public enum InteractionType {
    VIEW("view", 0.0, 0.5),                    // 强度由停留时长与滚动深度计算
    ANNOTATION("annotation", 0.7, 0.8),
    COLLECTION_ADD("collection_add", 0.8, 0.8),
    EXPORT("export", 0.9, 0.8),
    RATING("rating", 0.0, 1.0);                // 强度由评分计算

    private final String value;
    private final double baseStrength;
    private final double confidence;

    InteractionType(String value, double baseStrength, double confidence) {
        this.value = value;
        this.baseStrength = baseStrength;
        this.confidence = confidence;
    }

    public String getValue() {
        return value;
    }

    public double getBaseStrength() {
        return baseStrength;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * 解析交互类型
     *
     * @throws InvalidInteractionTypeException 不在允许集合内
     */
    public static InteractionType fromValue(String value) {
        if (value != null) {
            for (InteractionType type : values()) {
                if (type.value.equals(value.trim().toLowerCase())) {
                    return type;
                }
            }
        }
        String allowed = Arrays.stream(values()).map(InteractionType::getValue).collect(Collectors.joining(", "));
        throw new InvalidInteractionTypeException("interactionType",
            "interactionType 必须是 [" + allowed + "] 之一，实际为: " + value);
    }
}
