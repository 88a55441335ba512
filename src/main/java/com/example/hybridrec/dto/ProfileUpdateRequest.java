package com.example.hybridrec.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 画像设置更新请求（字段为 null 表示不修改）
 *
 * 取值范围在服务层统一校验，校验失败时画像保持不变
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileUpdateRequest {

    @NotBlank
    private String userId;

    private Double diversityPreference;

    private Double noveltyPreference;

    private Double recencyBias;

    private List<String> excludedSources;

    private List<String> researchDomains;

    private String activeDomain;

    /**
     * collaborative / content / graph / quality / recency -> 权重
     */
    private Map<String, Double> rankingWeights;
}
