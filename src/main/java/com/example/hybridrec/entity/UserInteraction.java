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
 * 用户-资源交互实体
 *
 * 同一 (user, resource) 只保留一行：重复交互只累加 returnVisits，
 * 并把 interactionStrength 提升到历史最大值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("user_interaction")
public class UserInteraction {

    /**
     * 强度超过该值视为正向交互
     */
    public static final double POSITIVE_THRESHOLD = 0.4;

    @TableId(type = IdType.AUTO)
    private Long id;

    private String userId;

    private String resourceId;

    /**
     * view / annotation / collection_add / export / rating
     */
    private String interactionType;

    /**
     * 交互强度 [0, 1]
     */
    private Double interactionStrength;

    private Boolean isPositive;

    private Integer returnVisits;

    /**
     * 停留时长（秒）
     */
    private Integer dwellTime;

    /**
     * 滚动深度 [0, 1]
     */
    private Double scrollDepth;

    /**
     * 评分（1-5 星）
     */
    private Integer rating;

    private String sessionId;

    private Double confidence;

    private LocalDateTime interactionTimestamp;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
