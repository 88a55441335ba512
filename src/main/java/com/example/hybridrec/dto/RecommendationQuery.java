package com.example.hybridrec.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 推荐请求参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationQuery {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    /**
     * collaborative / content / graph / hybrid
     */
    @Builder.Default
    private String strategy = "hybrid";

    /**
     * 覆盖画像中的多样性偏好（仅本次请求有效）
     */
    private Double diversity;

    /**
     * 最低质量阈值
     */
    private Double minQuality;
}
