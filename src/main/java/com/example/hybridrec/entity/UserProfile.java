package com.example.hybridrec.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 用户画像实体 - 偏好标量、过滤条件与聚合计数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("user_profile")
public class UserProfile {

    public static final double DEFAULT_DIVERSITY = 0.5;
    public static final double DEFAULT_NOVELTY = 0.3;
    public static final double DEFAULT_RECENCY = 0.5;

    @TableId(type = IdType.AUTO)
    private Long id;

    private String userId;

    /**
     * 多样性偏好 [0, 1]，即 MMR 的 λ
     */
    private Double diversityPreference;

    /**
     * 新颖度偏好 [0, 1]，新颖分超过该值才加权
     */
    private Double noveltyPreference;

    /**
     * 时效偏好 [0, 1]
     */
    private Double recencyBias;

    /**
     * 研究领域（JSON 数组）
     */
    private String researchDomains;

    private String activeDomain;

    /**
     * 排除的来源域名（JSON 数组）
     */
    private String excludedSources;

    /**
     * 偏好作者 Top 10（JSON 数组，由偏好学习重算）
     */
    private String preferredAuthors;

    /**
     * 排序权重覆盖（JSON 对象，五个分量，总和为 1）
     */
    private String rankingWeights;

    private Integer totalInteractions;

    private LocalDateTime lastActiveAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
