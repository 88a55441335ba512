package com.example.hybridrec.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class InteractionRequest {

    @NotBlank
    private String userId;

    @NotBlank
    private String resourceId;

    /**
     * view / annotation / collection_add / export / rating
     */
    @NotBlank
    private String interactionType;

    /**
     * 停留时长（秒）
     */
    @PositiveOrZero
    private Integer dwellTime;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double scrollDepth;

    private String sessionId;

    /**
     * 评分（1-5 星），仅 rating 类型使用
     */
    @Min(1)
    @Max(5)
    private Integer rating;

    public InteractionContext toContext() {
        return InteractionContext.builder()
            .dwellTime(dwellTime)
            .scrollDepth(scrollDepth)
            .sessionId(sessionId)
            .rating(rating)
            .build();
    }
}
