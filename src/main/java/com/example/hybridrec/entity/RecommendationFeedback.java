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
 * 推荐反馈实体 - 下发时写入曝光，点击/显式反馈时更新
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("recommendation_feedback")
public class RecommendationFeedback {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String userId;

    private String resourceId;

    /**
     * 产出该推荐的策略标签（collaborative / content / graph / hybrid）
     */
    private String recommendationStrategy;

    private Double recommendationScore;

    private Integer rankPosition;

    private Boolean wasClicked;

    private Boolean wasUseful;

    private String feedbackNotes;

    private LocalDateTime recommendedAt;

    private LocalDateTime feedbackAt;
}
