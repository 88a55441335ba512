package com.example.hybridrec.dto;

import lombok.Builder;
import lombok.Data;

/**
 * 交互上下文：停留时长、滚动深度、评分、会话
 */
@Data
@Builder
public class InteractionContext {

    private Integer dwellTime;

    private Double scrollDepth;

    private Integer rating;

    private String sessionId;

    public static InteractionContext empty() {
        return InteractionContext.builder().build();
    }
}
